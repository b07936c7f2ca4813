package com.questrail.intersection.protocol.codec;

/**
 * Type bytes of the intersection datagram protocol.
 *
 * <p>Requests occupy {@code 0x01..0x7F}; responses have the high bit set.</p>
 */
final class LaneMessageType
{
    static final int DECIDE = 0x01;
    static final int STATUS = 0x02;
    static final int DETECTIONS = 0x03;
    static final int PIPELINE_STATUS = 0x04;

    static final int DECISION_RESPONSE = 0x81;
    static final int STATUS_RESPONSE = 0x82;
    static final int DETECTION_RESULT_RESPONSE = 0x83;
    static final int PIPELINE_STATUS_RESPONSE = 0x84;
    static final int FAILURE_RESPONSE = 0xE0;

    // Detection classification source kinds.
    static final int SOURCE_NONE = 0;
    static final int SOURCE_LABEL = 1;
    static final int SOURCE_EMBEDDING = 2;
    static final int SOURCE_IMAGE = 3;

    private LaneMessageType() {}
}
