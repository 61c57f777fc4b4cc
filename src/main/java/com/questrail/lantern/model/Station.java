package com.questrail.lantern.model;

/**
 * Durable per-station record.
 *
 * <p>{@code signalValue} is only ever written by the signal controller, which
 * keeps it inside {@code [default - threshold, default + threshold]}.</p>
 */
public record Station(int stationId, int signalValue, boolean isActive)
{
    public Station withSignalValue(int newValue) {
        return new Station(stationId, newValue, isActive);
    }
}
