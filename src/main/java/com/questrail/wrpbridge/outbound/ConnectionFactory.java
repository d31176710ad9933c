package com.questrail.wrpbridge.outbound;

import com.questrail.wrpbridge.config.ConnectionConfig;

/**
 * Creates un-dialed connections. The router supplies the close listener so it
 * can prune its table.
 */
@FunctionalInterface
public interface ConnectionFactory
{
    Connection create(ConnectionConfig config, ConnectionCloseListener closeListener);
}
