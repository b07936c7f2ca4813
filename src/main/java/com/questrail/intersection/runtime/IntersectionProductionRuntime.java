package com.questrail.intersection.runtime;

import com.questrail.intersection.config.IntersectionRuntimeConfig;
import com.questrail.intersection.core.UniformArrivalGenerator;
import com.questrail.intersection.detection.DetectionAggregator;
import com.questrail.intersection.detection.ImageEmbedder;
import com.questrail.intersection.detection.VehicleClassifier;
import com.questrail.intersection.observability.NullObservabilitySink;
import com.questrail.intersection.observability.SignalObservabilitySink;
import com.questrail.intersection.service.IntersectionService;
import com.questrail.intersection.time.SystemMonotonicClock;
import com.questrail.intersection.time.SystemWallClock;
import com.questrail.intersection.transport.udp.netty.NettyUdpDatagramEndpoint;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * IntersectionProductionRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the production intersection stack:
 * one {@link IntersectionService} served over a Netty UDP endpoint.
 */
public final class IntersectionProductionRuntime {
    private final IntersectionUdpRuntime udpRuntime;
    private final NettyUdpDatagramEndpoint nettyEndpoint;

    private IntersectionProductionRuntime(IntersectionUdpRuntime udpRuntime,
                                          NettyUdpDatagramEndpoint nettyEndpoint) {
        this.udpRuntime = udpRuntime;
        this.nettyEndpoint = nettyEndpoint;
    }

    public void start() {
        udpRuntime.start();
    }

    public void stop() {
        udpRuntime.stop();
    }

    public boolean isTransportUp() {
        return udpRuntime.isTransportUp();
    }

    /**
     * Bound local address once the transport is up.
     */
    public Optional<InetSocketAddress> localAddress() {
        return nettyEndpoint.localAddress();
    }

    public IntersectionService service() {
        return udpRuntime.service();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private IntersectionRuntimeConfig config = IntersectionRuntimeConfig.builder().build();
        private SignalObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private VehicleClassifier classifier;
        private ImageEmbedder embedder;
        private final List<String> loadErrors = new ArrayList<>();

        public Builder withConfig(IntersectionRuntimeConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(SignalObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withClassifier(VehicleClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder withEmbedder(ImageEmbedder embedder) {
            this.embedder = embedder;
            return this;
        }

        /**
         * Records a problem met while loading a classification seam. The
         * runtime still starts; the problem is reported with pipeline status.
         */
        public Builder withLoadError(String error) {
            this.loadErrors.add(Objects.requireNonNull(error, "error"));
            return this;
        }

        public IntersectionProductionRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");

            // 1. Arrival model
            UniformArrivalGenerator arrivals = config.arrivalSeed().isPresent()
                    ? UniformArrivalGenerator.seeded(config.arrivalSeed().getAsLong())
                    : UniformArrivalGenerator.unseeded();

            // 2. Detection pipeline
            DetectionAggregator aggregator = new DetectionAggregator(
                    classifier, embedder, observabilitySink, SystemWallClock.INSTANCE);

            // 3. Service
            IntersectionService service = IntersectionService.builder()
                    .withPolicy(config.timingPolicy())
                    .withArrivalGenerator(arrivals)
                    .withAggregator(aggregator)
                    .withObservabilitySink(observabilitySink)
                    .withClock(SystemMonotonicClock.INSTANCE)
                    .withWallClock(SystemWallClock.INSTANCE)
                    .withLoadErrors(loadErrors)
                    .build();

            // 4. Transport
            NettyUdpDatagramEndpoint endpoint = new NettyUdpDatagramEndpoint(config.bindAddress());
            IntersectionUdpRuntime udpRuntime = new IntersectionUdpRuntime(
                    service, endpoint, observabilitySink, SystemWallClock.INSTANCE);

            return new IntersectionProductionRuntime(udpRuntime, endpoint);
        }
    }
}
