/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.kafka;

import com.intuitivedesigns.streamrelay.config.RelayConfig;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Consumer-side settings.
 *
 * @param topics            subscribed topics
 * @param consumerGroup     consumer group id
 * @param requeueMaxRetries records whose retry count is above this are not requeued
 * @param withoutScope      skip the scope header check
 * @param autoCommit        let the client commit offsets on its own
 * @param startOffset       where a new group starts reading
 * @param pollTimeout       upper bound of a single poll
 * @param maxBatchSize      {@code max.poll.records}
 */
public record ConsumerSettings(
        List<String> topics,
        String consumerGroup,
        int requeueMaxRetries,
        boolean withoutScope,
        boolean autoCommit,
        StartOffset startOffset,
        Duration pollTimeout,
        int maxBatchSize
) {

    static final String CFG_TOPICS = "kafka.consumer.topics";
    static final String CFG_GROUP = "kafka.consumer.group";
    static final String CFG_REQUEUE_MAX_RETRIES = "kafka.requeue.max.retries";
    static final String CFG_WITHOUT_SCOPE = "kafka.without.scope";
    static final String CFG_AUTO_COMMIT = "kafka.auto.commit";
    static final String CFG_START_OFFSET = "kafka.start.offset";
    static final String CFG_POLL_TIMEOUT = "kafka.poll.timeout";
    static final String CFG_MAX_BATCH_SIZE = "kafka.max.batch.size";

    static final int DEFAULT_REQUEUE_MAX_RETRIES = 3;
    static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofSeconds(5);
    static final int DEFAULT_MAX_BATCH_SIZE = 100;

    public ConsumerSettings {
        if (topics == null || topics.isEmpty()) {
            throw new IllegalArgumentException("At least one consumer topic is required");
        }
        topics = List.copyOf(topics);
        if (consumerGroup == null || consumerGroup.isBlank()) {
            throw new IllegalArgumentException("consumer group is required");
        }
        consumerGroup = consumerGroup.trim();
        if (requeueMaxRetries < 0) {
            throw new IllegalArgumentException("requeueMaxRetries must be >= 0");
        }
        if (startOffset == null) startOffset = StartOffset.LATEST;
        if (pollTimeout == null || pollTimeout.isNegative() || pollTimeout.isZero()) {
            pollTimeout = DEFAULT_POLL_TIMEOUT;
        }
        if (maxBatchSize <= 0) maxBatchSize = DEFAULT_MAX_BATCH_SIZE;
    }

    public static ConsumerSettings of(String group, String... topics) {
        return new ConsumerSettings(List.of(topics), group, DEFAULT_REQUEUE_MAX_RETRIES,
                false, true, StartOffset.LATEST, DEFAULT_POLL_TIMEOUT, DEFAULT_MAX_BATCH_SIZE);
    }

    public ConsumerSettings withAutoCommit(boolean enabled) {
        return new ConsumerSettings(topics, consumerGroup, requeueMaxRetries, withoutScope,
                enabled, startOffset, pollTimeout, maxBatchSize);
    }

    public ConsumerSettings withRequeueMaxRetries(int max) {
        return new ConsumerSettings(topics, consumerGroup, max, withoutScope,
                autoCommit, startOffset, pollTimeout, maxBatchSize);
    }

    public ConsumerSettings withoutScopeCheck() {
        return new ConsumerSettings(topics, consumerGroup, requeueMaxRetries, true,
                autoCommit, startOffset, pollTimeout, maxBatchSize);
    }

    public ConsumerSettings withPollTimeout(Duration timeout) {
        return new ConsumerSettings(topics, consumerGroup, requeueMaxRetries, withoutScope,
                autoCommit, startOffset, timeout, maxBatchSize);
    }

    public static ConsumerSettings fromConfig(RelayConfig config) {
        Objects.requireNonNull(config, "config");
        return new ConsumerSettings(
                config.getList(CFG_TOPICS, List.of()),
                config.getString(CFG_GROUP, null),
                config.getInt(CFG_REQUEUE_MAX_RETRIES, DEFAULT_REQUEUE_MAX_RETRIES),
                config.getBoolean(CFG_WITHOUT_SCOPE, false),
                config.getBoolean(CFG_AUTO_COMMIT, true),
                StartOffset.parse(config.getString(CFG_START_OFFSET, null), StartOffset.LATEST),
                config.getDuration(CFG_POLL_TIMEOUT, DEFAULT_POLL_TIMEOUT),
                config.getInt(CFG_MAX_BATCH_SIZE, DEFAULT_MAX_BATCH_SIZE));
    }
}
