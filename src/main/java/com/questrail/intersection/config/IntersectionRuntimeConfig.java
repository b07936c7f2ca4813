package com.questrail.intersection.config;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Aggregated configuration for the intersection production runtime.
 *
 * @param timingPolicy decision-loop tuning
 * @param bindAddress  local UDP address the runtime listens on
 * @param arrivalSeed  seed for the synthetic arrival model; empty for an unseeded source
 */
public record IntersectionRuntimeConfig(
    SignalTimingPolicy timingPolicy,
    InetSocketAddress bindAddress,
    OptionalLong arrivalSeed
) {
    public IntersectionRuntimeConfig {
        Objects.requireNonNull(timingPolicy, "timingPolicy");
        Objects.requireNonNull(bindAddress, "bindAddress");
        Objects.requireNonNull(arrivalSeed, "arrivalSeed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SignalTimingPolicy timingPolicy = SignalTimingPolicy.hostDefaults();
        private InetSocketAddress bindAddress = new InetSocketAddress(0);
        private OptionalLong arrivalSeed = OptionalLong.empty();

        public Builder withTimingPolicy(SignalTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public Builder withBindAddress(InetSocketAddress bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder withArrivalSeed(long seed) {
            this.arrivalSeed = OptionalLong.of(seed);
            return this;
        }

        public IntersectionRuntimeConfig build() {
            return new IntersectionRuntimeConfig(timingPolicy, bindAddress, arrivalSeed);
        }
    }
}
