package com.questrail.lantern.store;

import com.questrail.lantern.model.GameUser;

import java.util.List;

/**
 * Read-only source of game users per station and of the global filler
 * ("fake") password pool.
 */
public interface CandidatePool
{
    List<GameUser> getCandidates(int stationId);

    List<String> getFillerPasswords();
}
