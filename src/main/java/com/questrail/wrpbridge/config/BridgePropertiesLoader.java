package com.questrail.wrpbridge.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Reads {@link BridgeConfig} settings from a {@link Properties} stream.
 */
public final class BridgePropertiesLoader
{
    private BridgePropertiesLoader() {
    }

    /**
     * Read the raw key/value pairs; {@link BridgeConfig#fromMap(Map)} builds
     * the config once every layer has been merged.
     *
     * @param in properties stream; not closed by this method
     */
    public static Map<String, String> read(InputStream in) throws IOException {
        Properties props = new Properties();
        props.load(in);

        Map<String, String> values = new HashMap<>();
        for (String name : props.stringPropertyNames()) {
            values.put(name, props.getProperty(name));
        }
        return values;
    }
}
