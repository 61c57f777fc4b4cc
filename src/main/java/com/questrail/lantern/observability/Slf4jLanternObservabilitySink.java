package com.questrail.lantern.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of LanternObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jLanternObservabilitySink implements LanternObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jLanternObservabilitySink.class);

    @Override
    public void onSignalChanged(SignalChangeEvent event) {
        if (event.cause() == SignalChangeEvent.Cause.DECAY) {
            log.debug("Station {}: signal {} -> {} (decay)",
                event.stationId(), event.previousValue(), event.newValue());
        } else {
            log.info("Station {}: signal {} -> {}",
                event.stationId(), event.previousValue(), event.newValue());
        }
    }

    @Override
    public void onSessionTransition(SessionTransitionEvent event) {
        if (event.reason() == SessionTransitionEvent.Reason.REUSED) {
            log.debug("Hack session of {} reused on {}", event.owner(), event.to());
            return;
        }
        log.info("Hack session of {}: {} -> {} ({})",
            event.owner(), event.from(), event.to(), event.reason());
    }

    @Override
    public void onSyncResult(SyncResultEvent event) {
        if (event.statusCode() >= 200 && event.statusCode() < 300) {
            log.debug("Scoring service accepted station {} boost {} (HTTP {})",
                event.report().stationId(), event.report().boost(), event.statusCode());
        } else {
            log.warn("Scoring service answered HTTP {} for station {} boost {}",
                event.statusCode(), event.report().stationId(), event.report().boost());
        }
    }

    @Override
    public void onError(LanternErrorEvent event) {
        log.error("Lantern engine error: {}", event.message(), event.cause());
    }
}
