/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.metrics;

import com.intuitivedesigns.streamrelay.config.RelayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

public final class MetricsFactory {

    private static final Logger log = LoggerFactory.getLogger(MetricsFactory.class);

    static final String KEY_ENABLED = "metrics.enabled";
    static final String KEY_TAG_PREFIX = "metrics.tag.";

    private MetricsFactory() {}

    /**
     * Micrometer runtime when {@code metrics.enabled=true}, otherwise the no-op runtime.
     * Keys under {@code metrics.tag.*} become common tags.
     */
    public static MetricsRuntime init(RelayConfig config) {
        Objects.requireNonNull(config, "config");

        if (!config.getBoolean(KEY_ENABLED, false)) {
            log.info("Metrics disabled (NOOP active).");
            return MetricsRuntime.noop();
        }

        final Map<String, String> tags = new HashMap<>();
        for (String k : config.keys()) {
            if (!k.startsWith(KEY_TAG_PREFIX)) continue;
            final String tagKey = k.substring(KEY_TAG_PREFIX.length()).trim();
            final String value = config.getString(k, null);
            if (tagKey.isEmpty() || value == null) continue;
            tags.put(tagKey, value);
        }

        log.info("Metrics runtime initialized (type=MICROMETER tags={})", tags);
        return new MicrometerMetricsRuntime(tags);
    }
}
