package com.questrail.lantern.sync;

/**
 * New signal value of a station, as pushed to the scoring service.
 */
public record SignalReport(int stationId, int boost) {
}
