/**
 * External Sync Ports
 * =============================================================================
 *
 * Boundary between the signal controller and the scoring service that mirrors
 * station signal values.
 *
 * <p>Everything above this package sees only {@link com.questrail.lantern.sync.SignalReport}
 * and {@link com.questrail.lantern.sync.SyncReceipt}. HTTP and Netty types stay
 * inside {@code sync.http.netty}.</p>
 *
 * <h2>Constraints (binding)</h2>
 * Implementations MUST:
 * <ul>
 *   <li>Push exactly one report per call, without retrying</li>
 *   <li>Return the response status unchanged, 2xx or not</li>
 *   <li>Signal every failure as {@link com.questrail.lantern.api.ExternalSyncException}</li>
 * </ul>
 */
package com.questrail.lantern.sync;
