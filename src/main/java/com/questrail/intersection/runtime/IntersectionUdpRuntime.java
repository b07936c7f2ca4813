package com.questrail.intersection.runtime;

import com.questrail.intersection.observability.SignalErrorEvent;
import com.questrail.intersection.observability.SignalObservabilitySink;
import com.questrail.intersection.protocol.LaneMessage;
import com.questrail.intersection.protocol.LaneRequest;
import com.questrail.intersection.protocol.LaneResponse;
import com.questrail.intersection.protocol.codec.LaneDecodeException;
import com.questrail.intersection.protocol.codec.LaneFrame;
import com.questrail.intersection.protocol.codec.LaneFrameCodec;
import com.questrail.intersection.protocol.codec.LaneMessageDecoder;
import com.questrail.intersection.protocol.codec.LaneMessageEncoder;
import com.questrail.intersection.service.IntersectionService;
import com.questrail.intersection.time.WallClock;
import com.questrail.intersection.transport.DatagramEndpoint;
import com.questrail.intersection.transport.DatagramEndpointListener;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;

/**
 * IntersectionUdpRuntime
 * =============================================================================
 * Serves {@link IntersectionService} over a datagram transport.
 *
 * <h2>Inbound path</h2>
 * <pre>
 *   DatagramEndpoint
 *        → LaneFrameCodec        (CRC / framing; defects dropped)
 *            → LaneMessageDecoder  (semantic decode; defects answered)
 *                → IntersectionService.handle
 *                    → LaneMessageEncoder → LaneFrameCodec
 *                        → DatagramEndpoint.send(sender)
 * </pre>
 *
 * <h2>Failure policy</h2>
 * <ul>
 *   <li>Truncated or corrupt datagrams are dropped silently: the sender
 *       cannot be trusted to be a client.</li>
 *   <li>A CRC-valid datagram that does not decode into a request is answered
 *       with an {@code INVALID_REQUEST} failure.</li>
 *   <li>Response messages arriving at the server are ignored.</li>
 * </ul>
 *
 * Nothing raised while serving one datagram stops the runtime.
 */
public final class IntersectionUdpRuntime implements DatagramEndpointListener
{
    private final IntersectionService service;
    private final DatagramEndpoint endpoint;
    private final SignalObservabilitySink sink;
    private final WallClock wallClock;

    private final LaneFrameCodec frameCodec = new LaneFrameCodec();
    private final LaneMessageDecoder messageDecoder = new LaneMessageDecoder();
    private final LaneMessageEncoder messageEncoder = new LaneMessageEncoder();

    private volatile boolean transportUp;

    public IntersectionUdpRuntime(IntersectionService service,
                                  DatagramEndpoint endpoint,
                                  SignalObservabilitySink sink,
                                  WallClock wallClock) {
        this.service = Objects.requireNonNull(service, "service");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");

        this.endpoint.setListener(this);
    }

    public void start() {
        endpoint.start();
    }

    public void stop() {
        endpoint.stop();
    }

    public boolean isTransportUp() {
        return transportUp;
    }

    public IntersectionService service() {
        return service;
    }

    // -------------------------------------------------------------------------
    // DatagramEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        transportUp = true;
    }

    @Override
    public void onTransportDown(Throwable cause) {
        transportUp = false;
        if (cause != null) {
            sink.onError(new SignalErrorEvent(wallClock.now(), "Transport down", cause));
        }
    }

    @Override
    public void onDatagram(SocketAddress remote, byte[] payload) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(payload, "payload");

        // 1) Datagram bytes -> frame (drop invalid framing)
        Optional<LaneFrame> frame = frameCodec.decode(payload);
        if (frame.isEmpty()) {
            return;
        }

        // 2) Frame -> request
        final LaneMessage message;
        try {
            message = messageDecoder.decode(frame.get());
        }
        catch (LaneDecodeException e) {
            reply(remote, new LaneResponse.Failure(LaneResponse.ErrorCode.INVALID_REQUEST, e.getMessage()));
            return;
        }
        if (!(message instanceof LaneRequest request)) {
            return;
        }

        // 3) Serve and answer the sender
        reply(remote, service.handle(request));
    }

    private void reply(SocketAddress remote, LaneResponse response) {
        byte[] datagram;
        try {
            datagram = frameCodec.encode(messageEncoder.encode(response));
        }
        catch (IllegalArgumentException e) {
            sink.onError(new SignalErrorEvent(wallClock.now(), "Response could not be encoded: " + response, e));
            datagram = frameCodec.encode(messageEncoder.encode(new LaneResponse.Failure(
                    LaneResponse.ErrorCode.INTERNAL, "response does not fit the wire format")));
        }
        endpoint.send(remote, datagram);
    }
}
