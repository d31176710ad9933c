package com.questrail.wrpbridge.transport;

import java.util.Locale;
import java.util.Objects;

/**
 * Parsed transport address of the form {@code scheme://host:port}.
 *
 * <p>A host of {@code *} (or an empty host) means "all interfaces" and is only
 * meaningful for listening.</p>
 */
public record TransportUrl(String scheme, String host, int port)
{
    public static final String WILDCARD_HOST = "*";

    public TransportUrl {
        Objects.requireNonNull(scheme, "scheme");
        Objects.requireNonNull(host, "host");
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    /**
     * @throws TransportException if the string is not a {@code scheme://host:port} URL
     */
    public static TransportUrl parse(String url) {
        if (url == null || url.isEmpty()) {
            throw new TransportException("empty url");
        }

        int sep = url.indexOf("://");
        if (sep <= 0) {
            throw new TransportException("url has no scheme: " + url);
        }
        String scheme = url.substring(0, sep).toLowerCase(Locale.ROOT);
        String authority = url.substring(sep + 3);
        int slash = authority.indexOf('/');
        if (slash >= 0) {
            authority = authority.substring(0, slash);
        }

        int colon = authority.lastIndexOf(':');
        if (colon < 0) {
            throw new TransportException("url has no port: " + url);
        }
        String host = authority.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        if (host.isEmpty()) {
            host = WILDCARD_HOST;
        }

        int port;
        try {
            port = Integer.parseInt(authority.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new TransportException("invalid port in url: " + url, e);
        }
        if (port < 0 || port > 65535) {
            throw new TransportException("port out of range in url: " + url);
        }
        return new TransportUrl(scheme, host, port);
    }

    public boolean isWildcardHost() {
        return WILDCARD_HOST.equals(host);
    }

    @Override
    public String toString() {
        String h = host.indexOf(':') >= 0 ? "[" + host + "]" : host;
        return scheme + "://" + h + ":" + port;
    }
}
