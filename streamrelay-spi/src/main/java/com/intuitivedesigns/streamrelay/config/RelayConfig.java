/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Layered configuration.
 *
 * <p>Every key is resolved in this order:</p>
 * <ol>
 *   <li>JVM system property with the same dotted name ({@code -Dkafka.brokers=...})</li>
 *   <li>Environment variable, upper-cased with dots and dashes turned into underscores
 *       ({@code kafka.brokers -> KAFKA_BROKERS})</li>
 *   <li>The loaded properties file</li>
 * </ol>
 *
 * The shared instance ({@link #get()}) loads its file from {@code -Dsr.config.path}, the
 * {@code SR_CONFIG_PATH} environment variable or the classpath resource
 * {@code streamrelay.properties}, in that order.
 */
public final class RelayConfig {

    private static final Logger log = LoggerFactory.getLogger(RelayConfig.class);

    public static final String P_CONFIG_PATH = "sr.config.path";
    public static final String ENV_CONFIG_PATH = "SR_CONFIG_PATH";
    public static final String DEFAULT_RESOURCE = "streamrelay.properties";

    private static final Pattern DURATION = Pattern.compile("^(\\d+)(ms|s|m|h)?$");

    private static volatile RelayConfig shared;

    private final Properties props;
    private final Function<String, String> env;
    private final boolean systemProperties;

    private RelayConfig(Properties props, Function<String, String> env, boolean systemProperties) {
        this.props = props;
        this.env = env;
        this.systemProperties = systemProperties;
    }

    public static RelayConfig get() {
        RelayConfig local = shared;
        if (local == null) {
            synchronized (RelayConfig.class) {
                local = shared;
                if (local == null) {
                    local = new RelayConfig(loadDefault(), System::getenv, true);
                    shared = local;
                }
            }
        }
        return local;
    }

    /** File-only view, no system property or environment overrides. Mostly for tests. */
    public static RelayConfig fromProperties(Properties props) {
        final Properties copy = new Properties();
        copy.putAll(Objects.requireNonNull(props, "props"));
        return new RelayConfig(copy, key -> null, false);
    }

    public static RelayConfig fromMap(Map<String, String> values) {
        final Properties p = new Properties();
        p.putAll(Objects.requireNonNull(values, "values"));
        return fromProperties(p);
    }

    /** Same as {@link #fromProperties(Properties)} but with an explicit environment lookup. */
    public static RelayConfig withEnvironment(Properties props, Function<String, String> env) {
        final Properties copy = new Properties();
        copy.putAll(Objects.requireNonNull(props, "props"));
        return new RelayConfig(copy, Objects.requireNonNull(env, "env"), false);
    }

    private static Properties loadDefault() {
        String path = System.getProperty(P_CONFIG_PATH);
        if (path == null || path.isBlank()) {
            path = System.getenv(ENV_CONFIG_PATH);
        }

        final Properties p = new Properties();
        if (path != null && !path.isBlank()) {
            log.info("Loading configuration from: {}", path);
            try (InputStream is = new FileInputStream(path)) {
                p.load(is);
                log.info("Loaded {} properties.", p.size());
            } catch (IOException e) {
                throw new IllegalStateException("Failed to load config file: " + path, e);
            }
            return p;
        }

        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = RelayConfig.class.getClassLoader();

        try (InputStream is = cl.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                log.warn("No configuration file found (-D{} / {} / classpath {}). Using environment and defaults.",
                        P_CONFIG_PATH, ENV_CONFIG_PATH, DEFAULT_RESOURCE);
                return p;
            }
            p.load(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load classpath config: " + DEFAULT_RESOURCE, e);
        }
        return p;
    }

    // --- Lookup ---

    public String getString(String key, String defaultValue) {
        final String v = lookup(key);
        return v == null ? defaultValue : v;
    }

    public int getInt(String key, int defaultValue) {
        final String val = lookup(key);
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val);
        } catch (NumberFormatException e) {
            log.warn("Invalid int for '{}': '{}'. Using default {}", key, val, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        final String val = lookup(key);
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val);
        } catch (NumberFormatException e) {
            log.warn("Invalid long for '{}': '{}'. Using default {}", key, val, defaultValue);
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        final String val = lookup(key);
        if (val == null) return defaultValue;
        try {
            return Double.parseDouble(val);
        } catch (NumberFormatException e) {
            log.warn("Invalid double for '{}': '{}'. Using default {}", key, val, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        final String val = lookup(key);
        return val == null ? defaultValue : Boolean.parseBoolean(val);
    }

    /**
     * Durations accept a bare number of milliseconds or a number with one of the
     * suffixes {@code ms}, {@code s}, {@code m}, {@code h} ({@code 30s}, {@code 10m}).
     */
    public Duration getDuration(String key, Duration defaultValue) {
        final String val = lookup(key);
        if (val == null) return defaultValue;
        final Duration parsed = parseDuration(val);
        if (parsed == null) {
            log.warn("Invalid duration for '{}': '{}'. Using default {}", key, val, defaultValue);
            return defaultValue;
        }
        return parsed;
    }

    /** Comma separated list, blanks removed. */
    public List<String> getList(String key, List<String> defaultValue) {
        final String val = lookup(key);
        if (val == null) return defaultValue;

        final List<String> out = new ArrayList<>();
        for (String part : val.split(",")) {
            final String t = part.trim();
            if (!t.isEmpty()) out.add(t);
        }
        return out.isEmpty() ? defaultValue : Collections.unmodifiableList(out);
    }

    public boolean hasPath(String key) {
        return lookup(key) != null;
    }

    public Set<String> keys() {
        return props.stringPropertyNames();
    }

    public Map<String, Object> asMap() {
        final Map<String, Object> map = new HashMap<>();
        for (String name : props.stringPropertyNames()) {
            map.put(name, getString(name, props.getProperty(name)));
        }
        return map;
    }

    private String lookup(String key) {
        if (key == null) return null;

        if (systemProperties) {
            final String sys = normalize(System.getProperty(key));
            if (sys != null) return sys;
        }

        final String fromEnv = normalize(env.apply(envName(key)));
        if (fromEnv != null) return fromEnv;

        return normalize(props.getProperty(key));
    }

    static String envName(String key) {
        return key.trim().replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
    }

    static Duration parseDuration(String raw) {
        if (raw == null) return null;
        final Matcher m = DURATION.matcher(raw.trim().toLowerCase(Locale.ROOT));
        if (!m.matches()) return null;

        final long amount = Long.parseLong(m.group(1));
        final String unit = m.group(2);
        if (unit == null || unit.equals("ms")) return Duration.ofMillis(amount);
        switch (unit) {
            case "s":
                return Duration.ofSeconds(amount);
            case "m":
                return Duration.ofMinutes(amount);
            default:
                return Duration.ofHours(amount);
        }
    }

    private static String normalize(String s) {
        if (s == null) return null;
        final String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
