package com.questrail.wrpbridge.runtime;

import com.questrail.wrpbridge.Bridge;
import com.questrail.wrpbridge.config.BridgeConfig;
import com.questrail.wrpbridge.config.BridgePropertiesLoader;
import com.questrail.wrpbridge.config.CliArgs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

/**
 * Command-line entry point: runs a bridge that logs every message leaving it
 * towards the application.
 *
 * <pre>
 *   java ... BridgeMain [config=bridge.properties] [listen.url=tcp://127.0.0.1:6666] [key=value ...]
 * </pre>
 *
 * <p>Arguments override values from the {@code config} file. The bridge runs
 * until the JVM is asked to shut down.</p>
 */
public final class BridgeMain
{
    private static final Logger log = LoggerFactory.getLogger(BridgeMain.class);

    public static final String KEY_CONFIG = "config";
    public static final String DEFAULT_LISTEN_URL = "tcp://127.0.0.1:6666";

    private BridgeMain() {
    }

    public static void main(String[] args) throws IOException, InterruptedException {
        BridgeConfig config = loadConfig(args);

        Bridge bridge = Bridge.builder().withConfig(config).build();
        bridge.addEgressModifier((ctx, message) -> {
            log.info("Received {}", message);
            return message;
        });

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                bridge.close();
            } finally {
                stopped.countDown();
            }
        }, "wrp-shutdown"));

        bridge.start();
        stopped.await();
    }

    static BridgeConfig loadConfig(String[] args) throws IOException {
        Map<String, String> cli = new HashMap<>(CliArgs.toMap(args));
        String file = cli.remove(KEY_CONFIG);

        Map<String, String> values = new HashMap<>();
        values.put(BridgeConfig.KEY_LISTEN_URL, DEFAULT_LISTEN_URL);
        if (file != null) {
            try (InputStream in = Files.newInputStream(Path.of(file))) {
                values.putAll(BridgePropertiesLoader.read(in));
            }
            log.info("Loaded configuration from {}", file);
        }
        values.putAll(cli);
        return BridgeConfig.fromMap(values);
    }
}
