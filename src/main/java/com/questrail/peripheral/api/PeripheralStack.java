package com.questrail.peripheral.api;

import com.questrail.peripheral.config.ConnectionConfiguration;
import com.questrail.peripheral.config.ReconnectConfiguration;
import com.questrail.peripheral.config.ScanConfiguration;
import com.questrail.peripheral.config.SessionConfiguration;
import com.questrail.peripheral.observability.AnomalyKind;

import java.util.List;
import java.util.Set;

/**
 * PeripheralStack
 * -----------------------------------------------------------------------------
 * {@code PeripheralStack} is the primary facade for finding, connecting to and
 * addressing wireless peripherals through a platform radio.
 *
 * This interface is the boundary between application code and the raw radio
 * session, which reports everything as uncorrelated asynchronous callbacks.
 *
 * <h2>Core Responsibilities</h2>
 * A {@code PeripheralStack} is responsible for:
 * <ul>
 *   <li>Tracking radio readiness and refusing work while the radio is not ready</li>
 *   <li>Allowing at most one pending scan, and at most one pending connect and
 *       one pending disconnect per peripheral</li>
 *   <li>Routing the radio's asynchronous failures back to the caller whose
 *       command caused them</li>
 *   <li>Resolving the services and characteristics requested for a connection
 *       into {@link KnownPath}s before reporting the peripheral connected</li>
 *   <li>Publishing its state as push-updated {@link StateView}s</li>
 * </ul>
 *
 * It is explicitly <b>not</b> responsible for:
 * <ul>
 *   <li>Reading, writing or subscribing to characteristic values</li>
 *   <li>Timeouts or retries of connect attempts</li>
 *   <li>Persisting peripheral state across process restarts</li>
 * </ul>
 *
 * <h2>Commands and Errors</h2>
 * Commands never throw for domain failures and never block on the radio. Each
 * takes an {@link ErrorHandler}:
 * <ul>
 *   <li>precondition failures are reported synchronously, before any state
 *       changes</li>
 *   <li>failures the radio reports later are routed to the handler of the
 *       command that started the operation</li>
 * </ul>
 * A command whose handler is never called has been accepted; its success is
 * visible on the state views, not through a callback.
 *
 * <h2>Threading and Concurrency</h2>
 * Implementations are thread-safe. Commands and radio events are applied one at
 * a time. Error handlers and view subscribers run while that serialization is
 * held and may issue further commands, but must not block.
 *
 * <h2>Lifecycle</h2>
 * Nothing works until {@link #initializeSession} has been called and the radio
 * has reported {@link RadioState#POWERED_ON}. Calling it again replaces the
 * session and resets all state. {@link #close()} releases the radio.
 */
public interface PeripheralStack extends AutoCloseable
{
    // -------------------------------------------------------------------------
    // Commands
    // -------------------------------------------------------------------------

    /**
     * Opens a radio session and starts receiving its events.
     * <p>
     * If a session is already open it is closed and replaced. Pending connect
     * and disconnect operations are failed with a {@link StackError.RadioError}
     * whose cause is a {@link SessionReplacedException}, and all state views
     * return to their initial values.
     */
    void initializeSession(SessionConfiguration configuration);

    /**
     * Starts scanning and clears the available-peripherals view.
     * <p>
     * Fails with {@link StackError.SystemNotReady} when the radio is not ready
     * and with {@link StackError.InvalidInstruction} when a scan is already
     * running.
     */
    void startScanning(ScanConfiguration configuration, ErrorHandler onError);

    /**
     * Stops the running scan. Fails with {@link StackError.InvalidInstruction}
     * when no scan is running.
     */
    void stopScanning(ErrorHandler onError);

    /**
     * Connects to a peripheral and resolves the requested route.
     * <p>
     * The peripheral is listed in {@link #connectingPeripherals()} until every
     * requested path is resolved, then in {@link #connectedPeripherals()}.
     * Fails synchronously with {@link StackError.SystemNotReady} or
     * {@link StackError.InvalidInstruction} (connect already pending, or already
     * connected). The radio's connect failure, or a path-resolution failure, is
     * reported later as a {@link StackError.RadioError}; after a
     * path-resolution failure the link is torn down.
     */
    void connectPeripheral(ConnectionConfiguration configuration, ErrorHandler onError);

    /**
     * Cancels a pending connect or disconnects a connected peripheral.
     * <p>
     * Fails with {@link StackError.SystemNotReady},
     * {@link StackError.InvalidInstruction} (disconnect already pending) or
     * {@link StackError.UnknownDevice} (neither connecting nor connected).
     */
    void cancelConnection(PeripheralId peripheral, ErrorHandler onError);

    /**
     * Connects to a peripheral known from an earlier session.
     * <p>
     * The identifier is resolved through the radio's retained identifiers or,
     * failing that, among the peripherals already connected to the system that
     * expose the configured services. Fails with
     * {@link StackError.UnknownDevice} if neither resolves it; otherwise behaves
     * as {@link #connectPeripheral}.
     */
    void reconnectToPeripheral(ReconnectConfiguration configuration, ErrorHandler onError);

    // -------------------------------------------------------------------------
    // Queries
    // -------------------------------------------------------------------------

    /**
     * Finds a resolved path, or {@link StackError.UnknownPath}.
     */
    Outcome<KnownPath> lookupPath(PeripheralId peripheral, ServiceId service, CharacteristicId characteristic);

    /**
     * Raw radio state and platform authorization, for explaining why
     * {@link #systemReady()} is false. Not reactive.
     */
    ReadinessDiagnostics troubleshootReadiness();

    /**
     * Number of unexpected radio events dropped since construction.
     */
    long anomalyCount();

    long anomalyCount(AnomalyKind kind);

    // -------------------------------------------------------------------------
    // Views
    // -------------------------------------------------------------------------

    /** True while the radio is powered on. */
    StateView<Boolean> systemReady();

    /** True while a scan is running. */
    StateView<Boolean> scanning();

    /** Peripherals found by the current scan, strongest signal first. */
    StateView<List<DiscoveredPeripheral>> availablePeripherals();

    /** Peripherals with a connect in progress, including path resolution. */
    StateView<Set<PeripheralId>> connectingPeripherals();

    /** Peripherals connected with their paths resolved. */
    StateView<Set<PeripheralId>> connectedPeripherals();

    /** Every resolved path of every connected peripheral. */
    StateView<Set<KnownPath>> knownPaths();

    /**
     * Stops event delivery and closes the radio session.
     */
    @Override
    void close();
}
