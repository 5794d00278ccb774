/**
 * Bus Transport Ports
 * =============================================================================
 *
 * The boundary between the dispatch engine and whatever actually moves bytes
 * to and from the bus daemon.
 *
 * <h2>What lives on this side</h2>
 * <ul>
 *   <li>{@link com.questrail.dbus.transport.Connection}: send, dispatch-one,
 *       dispatch status, flush, filters, event-loop installation</li>
 *   <li>{@link com.questrail.dbus.transport.Watch} and
 *       {@link com.questrail.dbus.transport.Timeout}: readiness and interval
 *       registrations whose state the connection controls</li>
 *   <li>{@link com.questrail.dbus.transport.PendingCall}: reply correlation</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform no handler routing (that is the job of
 *       {@code com.questrail.dbus.handler})</li>
 *   <li>Never block or spawn threads; all progress is driven by the event loop</li>
 *   <li>Resolve each pending call at most once</li>
 * </ul>
 *
 * <p>{@code transport.local} provides an in-process implementation used by the
 * tests and by applications that want a bus inside a single JVM.</p>
 */
package com.questrail.dbus.transport;
