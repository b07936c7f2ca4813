package com.questrail.intersection.transport;

import java.net.SocketAddress;

/**
 * Callback sink for {@link DatagramEndpoint}.
 *
 * <p>Callbacks are delivered serially. The Netty endpoint delivers them on its
 * channel's event loop.</p>
 */
public interface DatagramEndpointListener
{
    void onTransportUp();

    /**
     * @param cause diagnostic cause; {@code null} for orderly shutdown
     */
    void onTransportDown(Throwable cause);

    /**
     * Called once per received datagram with the payload exactly as received.
     * The payload is always a complete datagram.
     */
    void onDatagram(SocketAddress remote, byte[] payload);
}
