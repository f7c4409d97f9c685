package org.muma.kv.config;

import lombok.Getter;
import lombok.Setter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Server configuration.
 * Precedence: command line > environment > properties file (kv-server.properties) > defaults.
 */
@Getter
@Setter
public class KvServerConfig {

    private static final Logger log = LoggerFactory.getLogger(KvServerConfig.class);
    private static final KvServerConfig INSTANCE = new KvServerConfig();

    public static final String DEFAULT_CONFIG_FILE = "kv-server.properties";
    public static final int DEFAULT_PORT = 6379;

    // --- Core Settings ---
    private int port = DEFAULT_PORT;
    private int workerThreads = 0; // 0 = Netty default
    private long slowLogThresholdMillis = 10;

    // --- Engine ---
    private Long skiplistSeed = null; // null = unseeded

    private String configFilePath = DEFAULT_CONFIG_FILE;

    // visible for tests; production code goes through getInstance()
    KvServerConfig() {
    }

    public static KvServerConfig getInstance() {
        return INSTANCE;
    }

    /**
     * Loads file, then environment, then command line, so later sources win.
     */
    public void load(String[] args) {
        String path = findConfigPath(args);
        if (path != null) {
            this.configFilePath = path;
        }
        loadConfig(this.configFilePath);
        applyEnvOverrides(System.getenv("KV_PORT"));
        parseArgs(args);
        log.info("KvServerConfig initialized: {}", this);
    }

    public void parseArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) && i + 1 < args.length) {
                this.configFilePath = args[++i];
            } else if ("--port".equals(arg) && i + 1 < args.length) {
                this.port = parsePort(args[++i], this.port);
            }
        }
    }

    public void loadConfig(String path) {
        Properties props = loadProperties(path);

        this.port = parsePort(props.getProperty("server.port"), this.port);
        this.workerThreads = getInt(props, "server.worker_threads", this.workerThreads);
        this.slowLogThresholdMillis = getInt(props, "server.slowlog_threshold_ms", (int) this.slowLogThresholdMillis);

        String seed = props.getProperty("engine.skiplist_seed");
        if (seed != null && !seed.isBlank()) {
            try {
                this.skiplistSeed = Long.parseLong(seed.trim());
            } catch (NumberFormatException e) {
                log.warn("Invalid engine.skiplist_seed value '{}', using an unseeded source.", seed);
            }
        }
    }

    void applyEnvOverrides(String envPort) {
        if (envPort != null) {
            this.port = parsePort(envPort, this.port);
            log.info("Port overridden by ENV: {}", this.port);
        }
    }

    private static String findConfigPath(String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                return args[i + 1];
            }
        }
        return null;
    }

    private Properties loadProperties(String path) {
        Properties props = new Properties();
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(path)) {
            if (is != null) {
                props.load(is);
                log.info("Loaded config from classpath: {}", path);
            } else {
                try (InputStream fis = new FileInputStream(path)) {
                    props.load(fis);
                    log.info("Loaded config from file: {}", path);
                } catch (IOException e) {
                    log.warn("Config file not found: {}, using defaults.", path);
                }
            }
        } catch (IOException e) {
            log.error("Error loading config", e);
        }
        return props;
    }

    private int parsePort(String value, int defaultValue) {
        if (value == null) return defaultValue;
        try {
            int p = Integer.parseInt(value.trim());
            if (p < 0 || p > 65535) {
                log.warn("Port {} out of range, keeping {}.", p, defaultValue);
                return defaultValue;
            }
            return p;
        } catch (NumberFormatException e) {
            log.warn("Invalid port '{}', keeping {}.", value, defaultValue);
            return defaultValue;
        }
    }

    private int getInt(Properties props, String key, int defaultValue) {
        String val = props.getProperty(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid {} value '{}', using default {}.", key, val, defaultValue);
            return defaultValue;
        }
    }

    @Override
    public String toString() {
        return "Config{port=" + port + ", workerThreads=" + workerThreads
                + ", slowLogThresholdMillis=" + slowLogThresholdMillis + ", skiplistSeed=" + skiplistSeed + "}";
    }
}
