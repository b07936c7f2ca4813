package com.questrail.intersection.detection;

import java.util.Optional;

/**
 * Detection
 * -----------------------------------------------------------------------------
 * One observed vehicle attributed to a lane.
 *
 * <p>A detection carries at most one usable classification source. When more
 * than one is set, they are consulted in this order:</p>
 * <ol>
 *   <li>a label already assigned upstream</li>
 *   <li>an embedding vector to classify</li>
 *   <li>an encoded image crop to embed, then classify</li>
 * </ol>
 *
 * Immutability is enforced via defensive copying.
 */
public final class Detection
{
    private final String laneId;
    private final String label;
    private final float[] embedding;
    private final byte[] image;

    public Detection(String laneId, String label, float[] embedding, byte[] image) {
        this.laneId = laneId;
        this.label = label;
        this.embedding = (embedding == null) ? null : embedding.clone();
        this.image = (image == null) ? null : image.clone();
    }

    public static Detection labeled(String laneId, String label) {
        return new Detection(laneId, label, null, null);
    }

    public static Detection embedded(String laneId, float[] embedding) {
        return new Detection(laneId, null, embedding, null);
    }

    public static Detection cropped(String laneId, byte[] image) {
        return new Detection(laneId, null, null, image);
    }

    public static Detection unclassified(String laneId) {
        return new Detection(laneId, null, null, null);
    }

    /**
     * Lane the vehicle was seen in; empty if the upstream detector could not
     * attribute it.
     */
    public Optional<String> laneId() {
        return Optional.ofNullable(laneId);
    }

    public Optional<String> label() {
        return Optional.ofNullable(label).filter(l -> !l.isEmpty());
    }

    public Optional<float[]> embedding() {
        return Optional.ofNullable(embedding).map(float[]::clone);
    }

    public Optional<byte[]> image() {
        return Optional.ofNullable(image).map(byte[]::clone);
    }

    @Override
    public String toString() {
        return "Detection[lane=" + laneId +
                ", label=" + label +
                ", embeddingDim=" + (embedding == null ? "-" : embedding.length) +
                ", imageBytes=" + (image == null ? "-" : image.length) +
                ']';
    }
}
