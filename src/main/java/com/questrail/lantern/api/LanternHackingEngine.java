package com.questrail.lantern.api;

/**
 * LanternHackingEngine
 * -----------------------------------------------------------------------------
 * Semantic façade of the station signal-control and hacking-session engine.
 *
 * <p>This interface is the boundary between the request handlers that front
 * the engine (socket or REST, out of scope here) and the engine core. Callers
 * are expected to have authenticated the player already; {@code owner} is the
 * authorized user name.</p>
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Create, reuse, or supersede the single live hack session of an owner</li>
 *   <li>Evaluate guesses and enforce the tries budget</li>
 *   <li>Adjust the target station's signal value on a successful guess</li>
 *   <li>Report the current round and station overview</li>
 * </ul>
 *
 * <p>It is explicitly <b>not</b> responsible for authorization, input framing,
 * or rendering errors to the player.</p>
 */
public interface LanternHackingEngine
{
    /**
     * Returns the hack payload for {@code owner} on {@code stationId}, creating
     * a new session when the owner has none or has one on a different station.
     *
     * @throws NotFoundException if the station has no game users
     * @throws StorageException  if a store read or write fails
     */
    HackView getOrCreateSession(String owner, int stationId);

    /**
     * Evaluates one guess against the owner's live session.
     *
     * @param boosting {@code true} to push the station value up on success
     * @throws NotFoundException      if the owner has no live session
     * @throws ExternalSyncException  if the signal was adjusted but could not be pushed;
     *                                the session is left untouched
     * @throws StorageException       if a store read or write fails
     */
    AttemptResult attempt(String owner, String guess, boolean boosting);

    /**
     * Returns the current round and, while it is active, the stations.
     */
    LanternInfo lanternInfo();
}
