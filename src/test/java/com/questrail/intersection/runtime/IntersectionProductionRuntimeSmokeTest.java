package com.questrail.intersection.runtime;

import com.questrail.intersection.config.IntersectionRuntimeConfig;
import com.questrail.intersection.protocol.LaneRequest;
import com.questrail.intersection.protocol.LaneResponse;
import com.questrail.intersection.protocol.codec.LaneFrameCodec;
import com.questrail.intersection.protocol.codec.LaneMessageDecoder;
import com.questrail.intersection.protocol.codec.LaneMessageEncoder;
import org.junit.jupiter.api.Test;

import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetSocketAddress;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class IntersectionProductionRuntimeSmokeTest {

    @Test
    void fullStackAnswersOverLoopback() throws Exception {
        IntersectionRuntimeConfig config = IntersectionRuntimeConfig.builder()
                .withBindAddress(new InetSocketAddress("127.0.0.1", 0)) // ephemeral
                .withArrivalSeed(5L)
                .build();

        IntersectionProductionRuntime runtime = IntersectionProductionRuntime.builder()
                .withConfig(config)
                .withLoadError("classifier load: not configured")
                .build();

        runtime.start();
        try {
            long deadline = System.currentTimeMillis() + 5_000;
            while (!runtime.isTransportUp() && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            assertTrue(runtime.isTransportUp());
            InetSocketAddress server = runtime.localAddress().orElseThrow();

            LaneFrameCodec frames = new LaneFrameCodec();
            byte[] request = frames.encode(new LaneMessageEncoder().encode(new LaneRequest.PipelineStatusQuery()));

            try (DatagramSocket socket = new DatagramSocket(new InetSocketAddress("127.0.0.1", 0))) {
                socket.setSoTimeout(5_000);
                socket.send(new DatagramPacket(request, request.length, server));

                byte[] buf = new byte[2048];
                DatagramPacket reply = new DatagramPacket(buf, buf.length);
                socket.receive(reply);

                byte[] payload = Arrays.copyOf(reply.getData(), reply.getLength());
                LaneResponse response = (LaneResponse) new LaneMessageDecoder()
                        .decode(frames.decode(payload).orElseThrow());

                LaneResponse.Pipeline pipeline = assertInstanceOf(LaneResponse.Pipeline.class, response);
                assertFalse(pipeline.status().classifierLoaded());
                assertEquals(1, pipeline.status().loadErrors().size());
            }
        }
        finally {
            runtime.stop();
        }
    }
}
