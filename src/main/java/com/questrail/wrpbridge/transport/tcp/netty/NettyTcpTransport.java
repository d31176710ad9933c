package com.questrail.wrpbridge.transport.tcp.netty;

import com.questrail.wrpbridge.transport.InboundSocket;
import com.questrail.wrpbridge.transport.OutboundSocket;
import com.questrail.wrpbridge.transport.Transport;
import com.questrail.wrpbridge.transport.TransportException;
import com.questrail.wrpbridge.transport.TransportUrl;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;

/**
 * NettyTcpTransport
 * =============================================================================
 * Netty-backed {@link Transport} speaking nanomsg PUSH/PULL over TCP.
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package. Frames are copied into {@code byte[]} on the
 * way in and wrapped on the way out.
 *
 * <h2>Threads</h2>
 * Every socket gets its own single-threaded {@code NioEventLoopGroup}, shut
 * down when the socket is closed. The transport itself holds no resources.
 */
public final class NettyTcpTransport implements Transport
{
    public static final String SCHEME = "tcp";

    private final TcpTransportConfig config;

    public NettyTcpTransport() {
        this(TcpTransportConfig.defaults());
    }

    public NettyTcpTransport(TcpTransportConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public String scheme() {
        return SCHEME;
    }

    @Override
    public InboundSocket listen(TransportUrl url, Duration receiveDeadline) {
        Objects.requireNonNull(url, "url");
        InetSocketAddress bindAddress = url.isWildcardHost()
                ? new InetSocketAddress(url.port())
                : new InetSocketAddress(url.host(), url.port());
        return NettyPullSocket.bind(bindAddress, nonNegative(receiveDeadline), config);
    }

    @Override
    public OutboundSocket dial(TransportUrl url, Duration sendDeadline) {
        Objects.requireNonNull(url, "url");
        if (url.isWildcardHost()) {
            throw new TransportException("cannot dial a wildcard host: " + url);
        }
        return NettyPushSocket.connect(new InetSocketAddress(url.host(), url.port()),
                nonNegative(sendDeadline), config);
    }

    private static Duration nonNegative(Duration deadline) {
        Objects.requireNonNull(deadline, "deadline");
        return deadline.isNegative() ? Duration.ZERO : deadline;
    }
}
