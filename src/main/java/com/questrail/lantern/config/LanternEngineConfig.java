package com.questrail.lantern.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for the hacking engine runtime.
 *
 * <p>{@code decayInterval} of {@link Duration#ZERO} disables the decay loop.</p>
 */
public record LanternEngineConfig(
        SignalPolicy signalPolicy,
        HackPolicy hackPolicy,
        SignalSyncConfig sync,
        Duration decayInterval
) {
    public LanternEngineConfig {
        Objects.requireNonNull(signalPolicy, "signalPolicy");
        Objects.requireNonNull(hackPolicy, "hackPolicy");
        Objects.requireNonNull(sync, "sync");
        Objects.requireNonNull(decayInterval, "decayInterval");
        if (decayInterval.isNegative()) {
            throw new IllegalArgumentException("decayInterval must be non-negative");
        }
    }

    public boolean decayEnabled() {
        return !decayInterval.isZero();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SignalPolicy signalPolicy = SignalPolicy.defaults();
        private HackPolicy hackPolicy = HackPolicy.defaults();
        private SignalSyncConfig sync = SignalSyncConfig.unconfigured();
        private Duration decayInterval = Duration.ofSeconds(30);

        public Builder withSignalPolicy(SignalPolicy signalPolicy) {
            this.signalPolicy = signalPolicy;
            return this;
        }

        public Builder withHackPolicy(HackPolicy hackPolicy) {
            this.hackPolicy = hackPolicy;
            return this;
        }

        public Builder withSync(SignalSyncConfig sync) {
            this.sync = sync;
            return this;
        }

        public Builder withDecayInterval(Duration decayInterval) {
            this.decayInterval = decayInterval;
            return this;
        }

        public LanternEngineConfig build() {
            return new LanternEngineConfig(signalPolicy, hackPolicy, sync, decayInterval);
        }
    }
}
