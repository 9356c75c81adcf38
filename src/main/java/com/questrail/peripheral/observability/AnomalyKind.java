package com.questrail.peripheral.observability;

/**
 * Kinds of unexpected radio-session behaviour the stack tolerates and counts.
 */
public enum AnomalyKind {
    /** Connect succeeded for a peripheral with no pending connect. */
    UNSOLICITED_CONNECT,
    /** Connect succeeded again while paths were still being resolved. */
    DUPLICATE_CONNECT,
    /** Connect failed for a peripheral with no pending connect. */
    UNSOLICITED_CONNECT_FAILURE,
    /** A discovery result arrived with no path discovery expecting it. */
    UNSOLICITED_DISCOVERY_RESULT,
    /** An event arrived from a session that has since been replaced. */
    STALE_SESSION_EVENT
}
