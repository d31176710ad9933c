package com.questrail.wrpbridge.transport.tcp.netty;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning for {@link NettyTcpTransport}.
 *
 * @param maxFrameBytes  largest inbound frame accepted; a larger one disconnects that peer
 * @param connectTimeout bound on TCP connect plus SP handshake when dialing
 * @param highWaterMark  queued inbound frames above which reading from peers pauses
 * @param lowWaterMark   queued inbound frames at or below which reading resumes
 */
public record TcpTransportConfig(
        int maxFrameBytes,
        Duration connectTimeout,
        int highWaterMark,
        int lowWaterMark
) {
    public static final int DEFAULT_MAX_FRAME_BYTES = 1024 * 1024;
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);

    public TcpTransportConfig {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be > 0");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be > 0");
        }
        if (lowWaterMark < 0 || highWaterMark <= lowWaterMark) {
            throw new IllegalArgumentException("require 0 <= lowWaterMark < highWaterMark");
        }
    }

    public static TcpTransportConfig defaults() {
        return new TcpTransportConfig(DEFAULT_MAX_FRAME_BYTES, DEFAULT_CONNECT_TIMEOUT, 256, 64);
    }
}
