/**
 * Radio Ports
 * =============================================================================
 *
 * These interfaces define the boundary between the peripheral stack and the
 * platform radio layer (a vendor SDK, an operating-system service, a simulator,
 * or a test double).
 *
 * <h2>Why these ports exist</h2>
 * The stack drives scanning, connecting and structural discovery, but it never
 * touches the radio itself. Everything above this package sees only:
 * <ul>
 *   <li>opaque peripheral identifiers and attribute UUIDs</li>
 *   <li>fire-and-forget commands on {@link com.questrail.peripheral.radio.RadioSession}</li>
 *   <li>asynchronous outcomes on {@link com.questrail.peripheral.radio.RadioSessionListener}</li>
 * </ul>
 *
 * <h2>Constraints on implementations</h2>
 * <ul>
 *   <li>Commands must not block and must not call the listener re-entrantly
 *       from the command method</li>
 *   <li>Listener callbacks may arrive on any thread; the stack serializes them</li>
 *   <li>The radio layer offers no timeouts; a connect attempt stays pending until
 *       it succeeds, fails, or is cancelled</li>
 * </ul>
 */
package com.questrail.peripheral.radio;
