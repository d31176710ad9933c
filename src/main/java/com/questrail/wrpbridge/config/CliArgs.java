package com.questrail.wrpbridge.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} command-line arguments into a map.
 */
public final class CliArgs
{
    private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

    private CliArgs() {
    }

    /**
     * Split each argument on its first {@code '='}. Later duplicates win.
     *
     * @throws ConfigurationException for an argument that is not {@code key=value}
     */
    public static Map<String, String> toMap(String[] args) {
        Map<String, String> map = new LinkedHashMap<>();
        if (args == null) {
            return map;
        }
        for (String raw : args) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String arg = raw.trim();
            int idx = arg.indexOf('=');
            if (idx <= 0) {
                throw new ConfigurationException("argument must be key=value (was '" + raw + "')");
            }
            String key = arg.substring(0, idx).trim();
            if (!KEY_PATTERN.matcher(key).matches()) {
                throw new ConfigurationException("invalid argument name: " + key);
            }
            map.put(key, arg.substring(idx + 1).trim());
        }
        return map;
    }
}
