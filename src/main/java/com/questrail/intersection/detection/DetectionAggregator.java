package com.questrail.intersection.detection;

import com.questrail.intersection.api.LaneReading;
import com.questrail.intersection.observability.ClassificationFallbackEvent;
import com.questrail.intersection.observability.NullObservabilitySink;
import com.questrail.intersection.observability.SignalObservabilitySink;
import com.questrail.intersection.time.SystemWallClock;
import com.questrail.intersection.time.WallClock;

import java.util.*;

/**
 * DetectionAggregator
 * -----------------------------------------------------------------------------
 * Folds a batch of {@link Detection}s into per-lane {@link LaneReading}s.
 *
 * <h2>Lenient degrade</h2>
 * A vehicle is never dropped from its lane's count because it could not be
 * classified. Any of the following counts it as {@code normal}:
 * <ul>
 *   <li>no label, embedding or image on the detection</li>
 *   <li>the classifier or embedder is not installed</li>
 *   <li>the classifier or embedder throws</li>
 *   <li>the resulting label is blank</li>
 * </ul>
 *
 * Only detections without a (non-blank) lane are skipped.
 *
 * <p>Stateless apart from its collaborators; safe to share if they are.</p>
 */
public final class DetectionAggregator
{
    private final VehicleClassifier classifier;
    private final ImageEmbedder embedder;
    private final SignalObservabilitySink sink;
    private final WallClock wallClock;

    /**
     * @param classifier may be null when no classifier is available
     * @param embedder   may be null when no embedder is available
     */
    public DetectionAggregator(VehicleClassifier classifier,
                               ImageEmbedder embedder,
                               SignalObservabilitySink sink,
                               WallClock wallClock) {
        this.classifier = classifier;
        this.embedder = embedder;
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    public DetectionAggregator(VehicleClassifier classifier, ImageEmbedder embedder) {
        this(classifier, embedder, NullObservabilitySink.INSTANCE, SystemWallClock.INSTANCE);
    }

    /**
     * Aggregator with no classification seams: only pre-labeled detections can
     * count as emergencies.
     */
    public static DetectionAggregator labelsOnly() {
        return new DetectionAggregator(null, null);
    }

    public boolean hasClassifier() {
        return classifier != null;
    }

    public boolean hasEmbedder() {
        return embedder != null;
    }

    public AggregationResult aggregate(List<Detection> detections) {
        Objects.requireNonNull(detections, "detections");

        Map<String, int[]> counts = new LinkedHashMap<>();
        int fallbacks = 0;
        int skipped = 0;

        for (Detection d : detections) {
            Optional<String> lane = d.laneId().filter(l -> !l.isBlank());
            if (lane.isEmpty()) {
                skipped++;
                continue;
            }

            // [normal, emergency]
            int[] c = counts.computeIfAbsent(lane.get(), k -> new int[2]);

            Optional<String> label = resolveLabel(d, lane.get());
            if (label.isEmpty()) {
                fallbacks++;
                c[0]++;
            }
            else if (VehicleLabels.isEmergency(label.get())) {
                c[1]++;
            }
            else {
                c[0]++;
            }
        }

        List<LaneReading> readings = new ArrayList<>(counts.size());
        for (Map.Entry<String, int[]> e : counts.entrySet()) {
            readings.add(new LaneReading(e.getKey(), e.getValue()[0], e.getValue()[1]));
        }
        return new AggregationResult(readings, fallbacks, skipped);
    }

    private Optional<String> resolveLabel(Detection d, String laneId) {
        Optional<String> label = d.label();
        if (label.isPresent()) {
            return label;
        }

        try {
            Optional<float[]> embedding = d.embedding();
            if (embedding.isPresent()) {
                return nonBlank(classify(embedding.get()), laneId);
            }

            Optional<byte[]> image = d.image();
            if (image.isPresent()) {
                if (embedder == null) {
                    throw new ClassificationException("no image embedder installed");
                }
                return nonBlank(classify(embedder.embed(image.get())), laneId);
            }

            fallback(laneId, "no classification source");
            return Optional.empty();
        }
        catch (ClassificationException | RuntimeException e) {
            fallback(laneId, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            return Optional.empty();
        }
    }

    private String classify(float[] embedding) throws ClassificationException {
        if (classifier == null) {
            throw new ClassificationException("no classifier installed");
        }
        return classifier.classify(embedding);
    }

    private Optional<String> nonBlank(String label, String laneId) {
        if (label == null || label.isBlank()) {
            fallback(laneId, "blank label");
            return Optional.empty();
        }
        return Optional.of(label);
    }

    private void fallback(String laneId, String reason) {
        sink.onClassificationFallback(new ClassificationFallbackEvent(wallClock.now(), laneId, reason));
    }
}
