package com.questrail.wrpbridge.transport;

import java.time.Duration;

/**
 * Transport
 * =============================================================================
 * Port for a point-to-point frame transport addressed by URL
 * ({@code tcp://host:port}).
 *
 * <p>Implementations own every socket, thread and buffer they create. Nothing
 * from the underlying network library crosses this interface: frames go in and
 * come out as {@code byte[]}.</p>
 *
 * <h2>Deadlines</h2>
 * A deadline of {@link Duration#ZERO} means "no deadline": the call blocks
 * until it completes or the socket is closed.
 */
public interface Transport
{
    /**
     * @return the URL scheme this transport serves, e.g. {@code tcp}
     */
    String scheme();

    /**
     * Bind an inbound socket.
     *
     * @throws TransportException if the address cannot be bound
     */
    InboundSocket listen(TransportUrl url, Duration receiveDeadline);

    /**
     * Connect an outbound socket.
     *
     * @throws TransportException if the peer cannot be reached
     */
    OutboundSocket dial(TransportUrl url, Duration sendDeadline);
}
