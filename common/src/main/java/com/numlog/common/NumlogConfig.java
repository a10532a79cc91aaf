package com.numlog.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Central configuration loaded from numlog.yml (or classpath default).
 * All fields have sensible defaults for localhost development.
 */
public final class NumlogConfig {

    private static final Logger log = LoggerFactory.getLogger(NumlogConfig.class);

    // Listener
    public String host = "localhost";
    public int port = 3280;

    // Admission gate: max connections under handling at once
    public int connectionLimit = 6;

    // Line protocol
    public int recordLength = 10;          // including the '\n' terminator
    public long minValue = 1_000_000L;
    public int maxLineLength = 1024;       // longer lines are measured, not buffered

    // Reporting
    public int outputIntervalSecs = 5;
    public int logIntervalSecs = 10;

    // Unique values are appended here, one per line. Truncated on startup.
    public String uniqueLogPath = "numbers.log";

    // Threads running connection handlers (off the I/O event loop)
    public int handlerThreads = 6;

    // How long shutdown waits for in-flight connections
    public int shutdownGraceSecs = 5;

    public static NumlogConfig load(String path) {
        NumlogConfig cfg = new NumlogConfig();
        try (InputStream is = path != null && Files.exists(Paths.get(path))
                ? Files.newInputStream(Paths.get(path))
                : NumlogConfig.class.getResourceAsStream("/numlog.yml")) {
            if (is == null) return cfg;
            Map<String, Object> map = new Yaml().load(is);
            if (map == null) return cfg;
            applyMap(cfg, map);
        } catch (Exception e) {
            // log and proceed with defaults
            log.warn("Failed to load config, using defaults: {}", e.getMessage());
        }
        return cfg;
    }

    static void applyMap(NumlogConfig cfg, Map<String, Object> map) {
        if (map.containsKey("host")) cfg.host = (String) map.get("host");
        if (map.containsKey("port")) cfg.port = (int) map.get("port");
        if (map.containsKey("connectionLimit")) cfg.connectionLimit = (int) map.get("connectionLimit");
        if (map.containsKey("recordLength")) cfg.recordLength = (int) map.get("recordLength");
        if (map.containsKey("minValue")) cfg.minValue = ((Number) map.get("minValue")).longValue();
        if (map.containsKey("maxLineLength")) cfg.maxLineLength = (int) map.get("maxLineLength");
        if (map.containsKey("outputIntervalSecs")) cfg.outputIntervalSecs = (int) map.get("outputIntervalSecs");
        if (map.containsKey("logIntervalSecs")) cfg.logIntervalSecs = (int) map.get("logIntervalSecs");
        if (map.containsKey("uniqueLogPath")) cfg.uniqueLogPath = (String) map.get("uniqueLogPath");
        if (map.containsKey("handlerThreads")) cfg.handlerThreads = (int) map.get("handlerThreads");
        if (map.containsKey("shutdownGraceSecs")) cfg.shutdownGraceSecs = (int) map.get("shutdownGraceSecs");
    }

    /**
     * Rejects values the server cannot run with.
     *
     * @throws IllegalArgumentException naming the first offending key
     */
    public NumlogConfig validate() {
        require(port >= 0 && port <= 65535, "port", port);
        require(connectionLimit > 0, "connectionLimit", connectionLimit);
        require(recordLength > 1, "recordLength", recordLength);
        require(maxLineLength >= recordLength, "maxLineLength", maxLineLength);
        require(outputIntervalSecs > 0, "outputIntervalSecs", outputIntervalSecs);
        require(logIntervalSecs > 0, "logIntervalSecs", logIntervalSecs);
        require(handlerThreads > 0, "handlerThreads", handlerThreads);
        require(shutdownGraceSecs >= 0, "shutdownGraceSecs", shutdownGraceSecs);
        require(uniqueLogPath != null && !uniqueLogPath.isEmpty(), "uniqueLogPath", uniqueLogPath);
        return this;
    }

    private static void require(boolean ok, String key, Object value) {
        if (!ok) throw new IllegalArgumentException("Invalid config value " + key + "=" + value);
    }
}
