/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.kafka;

import com.intuitivedesigns.streamrelay.config.RelayConfig;
import com.intuitivedesigns.streamrelay.core.PartitionKeyExtractor;

import java.time.Duration;
import java.util.Objects;

/**
 * Producer-side settings.
 *
 * @param producerId     client id of the producer connection
 * @param topic          default target topic for {@link RelayProducer#produce}
 * @param keyExtractor   optional partition key function; {@code null} leaves partitioning to the broker
 * @param maxMessageSize largest serialized value accepted, {@code 0} disables the check
 * @param retryUntil     how long a record stays retriable after it was first published
 * @param idempotent     enable the idempotent producer
 */
public record ProducerSettings(
        String producerId,
        String topic,
        PartitionKeyExtractor keyExtractor,
        int maxMessageSize,
        Duration retryUntil,
        boolean idempotent
) {

    static final String CFG_PRODUCER_ID = "kafka.producer.id";
    static final String CFG_TOPIC = "kafka.producer.topic";
    static final String CFG_MAX_MESSAGE_SIZE = "kafka.max.message.size";
    static final String CFG_RETRY_UNTIL = "kafka.retry.until";
    static final String CFG_IDEMPOTENT = "kafka.idempotent.producer";

    static final String DEFAULT_PRODUCER_ID = "streamrelay-producer";
    static final int DEFAULT_MAX_MESSAGE_SIZE = 1_048_576;
    static final Duration DEFAULT_RETRY_UNTIL = Duration.ofMinutes(10);

    public ProducerSettings {
        producerId = (producerId == null || producerId.isBlank()) ? DEFAULT_PRODUCER_ID : producerId.trim();
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("producer topic is required");
        }
        topic = topic.trim();
        if (maxMessageSize < 0) {
            throw new IllegalArgumentException("maxMessageSize must be >= 0");
        }
        if (retryUntil == null || retryUntil.isZero() || retryUntil.isNegative()) {
            retryUntil = DEFAULT_RETRY_UNTIL;
        }
    }

    public static ProducerSettings forTopic(String topic) {
        return new ProducerSettings(null, topic, null, DEFAULT_MAX_MESSAGE_SIZE, DEFAULT_RETRY_UNTIL, true);
    }

    public ProducerSettings withKeyExtractor(PartitionKeyExtractor extractor) {
        return new ProducerSettings(producerId, topic, extractor, maxMessageSize, retryUntil, idempotent);
    }

    public static ProducerSettings fromConfig(RelayConfig config) {
        return fromConfig(config, null);
    }

    /** Same as {@link #fromConfig(RelayConfig)}, with {@code defaultTopic} used when no topic is configured. */
    public static ProducerSettings fromConfig(RelayConfig config, String defaultTopic) {
        Objects.requireNonNull(config, "config");
        return new ProducerSettings(
                config.getString(CFG_PRODUCER_ID, DEFAULT_PRODUCER_ID),
                config.getString(CFG_TOPIC, defaultTopic),
                null,
                config.getInt(CFG_MAX_MESSAGE_SIZE, DEFAULT_MAX_MESSAGE_SIZE),
                config.getDuration(CFG_RETRY_UNTIL, DEFAULT_RETRY_UNTIL),
                config.getBoolean(CFG_IDEMPOTENT, true));
    }
}
