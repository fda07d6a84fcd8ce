/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.kafka;

import com.intuitivedesigns.streamrelay.config.RelayConfig;

import java.util.Objects;

/**
 * Retry and dead-letter routing.
 *
 * @param enabled           when false the retry manager never writes
 * @param maxRetries        retry attempts before a record goes to the DLQ
 * @param topicPrefix       retry topic is {@code topicPrefix + originalTopic}
 * @param dlqTopic          dead letter topic, blank disables DLQ writes
 * @param backoffMultiplier base of the advisory exponential delay, values {@code <= 0} mean 2.0
 */
public record RetrySettings(
        boolean enabled,
        int maxRetries,
        String topicPrefix,
        String dlqTopic,
        double backoffMultiplier
) {

    static final String CFG_ENABLED = "kafka.retry.enabled";
    static final String CFG_MAX_RETRIES = "kafka.retry.max.retries";
    static final String CFG_TOPIC_PREFIX = "kafka.retry.topic.prefix";
    static final String CFG_DLQ_TOPIC = "kafka.dlq.topic";
    static final String CFG_BACKOFF_MULTIPLIER = "kafka.retry.backoff.multiplier";

    static final int DEFAULT_MAX_RETRIES = 3;
    static final String DEFAULT_TOPIC_PREFIX = "retry-";
    static final String DEFAULT_DLQ_TOPIC = "dlq";
    static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;

    public RetrySettings {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        topicPrefix = topicPrefix == null ? DEFAULT_TOPIC_PREFIX : topicPrefix;
        dlqTopic = dlqTopic == null ? "" : dlqTopic.trim();
        if (backoffMultiplier <= 0 || Double.isNaN(backoffMultiplier)) {
            backoffMultiplier = DEFAULT_BACKOFF_MULTIPLIER;
        }
    }

    public static RetrySettings defaults() {
        return new RetrySettings(true, DEFAULT_MAX_RETRIES, DEFAULT_TOPIC_PREFIX, DEFAULT_DLQ_TOPIC, DEFAULT_BACKOFF_MULTIPLIER);
    }

    public static RetrySettings disabled() {
        return new RetrySettings(false, DEFAULT_MAX_RETRIES, DEFAULT_TOPIC_PREFIX, DEFAULT_DLQ_TOPIC, DEFAULT_BACKOFF_MULTIPLIER);
    }

    public RetrySettings withMaxRetries(int max) {
        return new RetrySettings(enabled, max, topicPrefix, dlqTopic, backoffMultiplier);
    }

    public static RetrySettings fromConfig(RelayConfig config) {
        Objects.requireNonNull(config, "config");
        return new RetrySettings(
                config.getBoolean(CFG_ENABLED, true),
                config.getInt(CFG_MAX_RETRIES, DEFAULT_MAX_RETRIES),
                config.getString(CFG_TOPIC_PREFIX, DEFAULT_TOPIC_PREFIX),
                config.getString(CFG_DLQ_TOPIC, DEFAULT_DLQ_TOPIC),
                config.getDouble(CFG_BACKOFF_MULTIPLIER, DEFAULT_BACKOFF_MULTIPLIER));
    }
}
