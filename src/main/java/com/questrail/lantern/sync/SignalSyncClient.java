package com.questrail.lantern.sync;

import com.questrail.lantern.api.ExternalSyncException;

/**
 * SignalSyncClient
 * -----------------------------------------------------------------------------
 * Port for the best-effort push of a station's signal value to the external
 * scoring service.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>One request per call; no retries</li>
 *   <li>Blocking: returns once the service answered or the request failed</li>
 *   <li>Missing host or API key fails every call with
 *       {@link ExternalSyncException.Reason#UNCONFIGURED}</li>
 * </ul>
 *
 * <p>Implementations may be backed by Netty, a JDK client, or a test double.</p>
 */
public interface SignalSyncClient
{
    SyncReceipt push(SignalReport report) throws ExternalSyncException;
}
