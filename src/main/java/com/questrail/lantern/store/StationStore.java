package com.questrail.lantern.store;

import com.questrail.lantern.model.Station;

import java.util.List;
import java.util.Optional;

/**
 * StationStore
 * -----------------------------------------------------------------------------
 * Durable per-station records. Stations are seeded externally and never
 * deleted by the engine; only the signal value is written.
 *
 * <p>Implementations report persistence failures as
 * {@link com.questrail.lantern.api.StorageException}.</p>
 */
public interface StationStore
{
    Optional<Station> getStation(int stationId);

    /**
     * Persists a new signal value.
     *
     * @return {@code false} if the station does not exist
     */
    boolean setSignalValue(int stationId, int signalValue);

    List<Station> getAllStations();
}
