package com.accesslog.analyzer;

import java.util.Map;
import java.util.Properties;

/**
 * Runtime settings. Values are layered: built-in defaults, then a properties
 * file, then environment variables. Command line options are applied last by the caller.
 */
public class AnalyzerSettings {

    public static final String DEFAULT_LOGS_DIR = "logs";
    public static final int DEFAULT_MAX_LOG_ENTRIES = 85000;
    public static final int DEFAULT_IP_LIMIT = 20;

    static final String PROP_LOGS_DIR = "logs.dir";
    static final String PROP_MAX_ENTRIES = "logs.maxEntries";
    static final String PROP_IP_LIMIT = "report.ipLimit";
    static final String PROP_DEBUG = "debug";

    static final String ENV_LOGS_DIR = "LOGS_DIR";
    static final String ENV_MAX_ENTRIES = "MAX_LOG_ENTRIES";
    static final String ENV_IP_LIMIT = "DEFAULT_IP_LIMIT";
    static final String ENV_DEBUG = "DEBUG";

    private String logsDir = DEFAULT_LOGS_DIR;
    private int maxLogEntries = DEFAULT_MAX_LOG_ENTRIES;
    private int defaultIpLimit = DEFAULT_IP_LIMIT;
    private boolean debug = false;

    /**
     * @param props may be null
     * @param env usually {@link System#getenv()}
     * @throws IllegalArgumentException if a numeric or boolean value is invalid
     */
    public static AnalyzerSettings load(Properties props, Map<String, String> env) {
        AnalyzerSettings settings = new AnalyzerSettings();
        if (props != null) {
            settings.apply(PROP_LOGS_DIR, props.getProperty(PROP_LOGS_DIR),
                    PROP_MAX_ENTRIES, props.getProperty(PROP_MAX_ENTRIES),
                    PROP_IP_LIMIT, props.getProperty(PROP_IP_LIMIT),
                    PROP_DEBUG, props.getProperty(PROP_DEBUG));
        }
        if (env != null) {
            settings.apply(ENV_LOGS_DIR, env.get(ENV_LOGS_DIR),
                    ENV_MAX_ENTRIES, env.get(ENV_MAX_ENTRIES),
                    ENV_IP_LIMIT, env.get(ENV_IP_LIMIT),
                    ENV_DEBUG, env.get(ENV_DEBUG));
        }
        return settings;
    }

    private void apply(String dirKey, String dir, String maxKey, String max, String limitKey, String limit,
            String debugKey, String debugValue) {
        if (dir != null && !dir.trim().isEmpty()) {
            logsDir = dir.trim();
        }
        if (max != null) {
            maxLogEntries = parsePositiveInt(maxKey, max);
        }
        if (limit != null) {
            defaultIpLimit = parsePositiveInt(limitKey, limit);
        }
        if (debugValue != null) {
            debug = parseBoolean(debugKey, debugValue);
        }
    }

    static int parsePositiveInt(String key, String value) {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed <= 0) {
                throw new IllegalArgumentException(key + " must be a positive integer: " + value);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " is not a valid integer: " + value, e);
        }
    }

    static boolean parseBoolean(String key, String value) {
        String v = value.trim();
        if ("true".equalsIgnoreCase(v)) {
            return true;
        } else if ("false".equalsIgnoreCase(v)) {
            return false;
        }
        throw new IllegalArgumentException(key + " must be true or false: " + value);
    }

    public String getLogsDir() {
        return logsDir;
    }

    public void setLogsDir(String logsDir) {
        this.logsDir = logsDir;
    }

    public int getMaxLogEntries() {
        return maxLogEntries;
    }

    public void setMaxLogEntries(int maxLogEntries) {
        this.maxLogEntries = maxLogEntries;
    }

    public int getDefaultIpLimit() {
        return defaultIpLimit;
    }

    public void setDefaultIpLimit(int defaultIpLimit) {
        this.defaultIpLimit = defaultIpLimit;
    }

    public boolean isDebug() {
        return debug;
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    @Override
    public String toString() {
        return String.format("logsDir=%s, maxLogEntries=%d, defaultIpLimit=%d, debug=%s",
                logsDir, maxLogEntries, defaultIpLimit, debug);
    }
}
