package com.questrail.wrpbridge.transport;

import com.questrail.wrpbridge.transport.tcp.netty.NettyTcpTransport;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps URL schemes to {@link Transport} implementations.
 */
public final class TransportRegistry
{
    private final Map<String, Transport> transports = new ConcurrentHashMap<>();

    /**
     * An empty registry. Most callers want {@link #defaults()}.
     */
    public TransportRegistry() {
    }

    /**
     * A registry with {@code tcp} served by {@link NettyTcpTransport}.
     */
    public static TransportRegistry defaults() {
        return new TransportRegistry().register(new NettyTcpTransport());
    }

    /**
     * Register (or replace) the transport for its scheme.
     */
    public TransportRegistry register(Transport transport) {
        Objects.requireNonNull(transport, "transport");
        transports.put(transport.scheme().toLowerCase(Locale.ROOT), transport);
        return this;
    }

    /**
     * @throws TransportException if no transport serves the scheme
     */
    public Transport forScheme(String scheme) {
        Transport transport = transports.get(scheme.toLowerCase(Locale.ROOT));
        if (transport == null) {
            throw new TransportException("no transport registered for scheme '" + scheme + "'");
        }
        return transport;
    }

    public InboundSocket listen(String url, Duration receiveDeadline) {
        TransportUrl parsed = TransportUrl.parse(url);
        return forScheme(parsed.scheme()).listen(parsed, receiveDeadline);
    }

    public OutboundSocket dial(String url, Duration sendDeadline) {
        TransportUrl parsed = TransportUrl.parse(url);
        return forScheme(parsed.scheme()).dial(parsed, sendDeadline);
    }
}
