/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.kafka;

import com.intuitivedesigns.streamrelay.metrics.MetricsRuntime;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;

/**
 * Routes failed records to {@code <prefix><originalTopic>} retry topics or to the dead letter topic.
 *
 * <p>Key and value are republished untouched; only headers change. Retry copies get an
 * incremented {@code x-retry-count}, plus {@code x-original-topic} and {@code x-retry-reason} when
 * missing. DLQ copies keep every header and get {@code x-original-topic}, {@code x-dlq-reason} and
 * {@code x-dlq-timestamp} appended.</p>
 *
 * <p>With retries disabled, or without a publisher, every send is a no-op that returns
 * {@link RetryOutcome#SKIPPED}.</p>
 */
public final class RetryManager {

    private static final Logger log = LoggerFactory.getLogger(RetryManager.class);

    public static final String REASON_MAX_RETRIES_EXCEEDED = "max_retries_exceeded";
    public static final String DEFAULT_RETRY_REASON = "processing_failed";

    static final Duration BASE_DELAY = Duration.ofSeconds(30);

    static final String METRIC_RETRY_SENT = "streamrelay.retry.sent";
    static final String METRIC_DLQ_SENT = "streamrelay.retry.dlq";

    private final RetrySettings settings;
    private final RecordPublisher publisher;
    private final MetricsRuntime metrics;
    private final Clock clock;

    /**
     * @param publisher where retry and DLQ copies are written; {@code null} puts the manager in the
     *                  disabled state
     */
    public RetryManager(RetrySettings settings, RecordPublisher publisher, MetricsRuntime metrics) {
        this(settings, publisher, metrics, Clock.systemUTC());
    }

    RetryManager(RetrySettings settings, RecordPublisher publisher, MetricsRuntime metrics, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.publisher = publisher;
        this.metrics = (metrics == null) ? MetricsRuntime.noop() : metrics;
        this.clock = Objects.requireNonNull(clock, "clock");

        if (settings.enabled() && publisher == null) {
            log.warn("Retry is enabled but no publisher was supplied. Retry and DLQ writes are disabled.");
        }
    }

    public static RetryManager disabled() {
        return new RetryManager(RetrySettings.disabled(), null, MetricsRuntime.noop());
    }

    /** True when sends actually reach the broker. */
    public boolean active() {
        return settings.enabled() && publisher != null;
    }

    public RetryOutcome sendToRetry(ConsumerRecord<byte[], byte[]> record, int currentRetryCount, String originalTopic) {
        return sendToRetry(record, currentRetryCount, originalTopic, null);
    }

    /**
     * Republishes {@code record} to the retry topic of {@code originalTopic}, or to the DLQ once
     * {@code currentRetryCount} reached the configured maximum.
     *
     * @param reason written as {@code x-retry-reason} unless the record already has one;
     *               {@code null} means {@value #DEFAULT_RETRY_REASON}
     * @throws ProduceException when the broker write fails
     */
    public RetryOutcome sendToRetry(ConsumerRecord<byte[], byte[]> record,
                                    int currentRetryCount,
                                    String originalTopic,
                                    String reason) {
        Objects.requireNonNull(record, "record");
        if (!active()) return RetryOutcome.SKIPPED;

        final String origin = resolveOrigin(record, originalTopic);

        if (currentRetryCount >= settings.maxRetries()) {
            log.debug("Max retries exceeded ({} >= {}), sending to DLQ", currentRetryCount, settings.maxRetries());
            return sendToDlq(record, origin, REASON_MAX_RETRIES_EXCEEDED);
        }

        final String retryTopic = retryTopicFor(origin);
        final int nextCount = Math.max(0, currentRetryCount) + 1;

        final List<Header> headers = withRetryCount(RelayHeaders.copy(record.headers()), nextCount);
        if (!containsKey(headers, RelayHeaders.X_ORIGINAL_TOPIC)) {
            headers.add(RelayHeaders.header(RelayHeaders.X_ORIGINAL_TOPIC, origin));
        }
        if (!containsKey(headers, RelayHeaders.X_RETRY_REASON)) {
            headers.add(RelayHeaders.header(RelayHeaders.X_RETRY_REASON,
                    (reason == null || reason.isBlank()) ? DEFAULT_RETRY_REASON : reason));
        }

        try {
            publisher.publish(new ProducerRecord<>(retryTopic, null, record.key(), record.value(), headers));
        } catch (ProduceException e) {
            log.error("Failed to send message to retry topic {}: {}", retryTopic, e.getMessage());
            throw new ProduceException(retryTopic, "failed to send to retry topic " + retryTopic, e);
        }

        metrics.counter(METRIC_RETRY_SENT);
        if (log.isDebugEnabled()) {
            log.debug("Message sent to retry topic. retryTopic={} retryCount={} advisoryDelay={}",
                    retryTopic, nextCount, calculateRetryDelay(nextCount));
        }
        return RetryOutcome.RETRIED;
    }

    /**
     * Republishes {@code record} to the DLQ with routing metadata.
     *
     * @throws ProduceException when the broker write fails
     */
    public RetryOutcome sendToDlq(ConsumerRecord<byte[], byte[]> record, String originalTopic, String reason) {
        Objects.requireNonNull(record, "record");
        if (!active() || settings.dlqTopic().isEmpty()) return RetryOutcome.SKIPPED;

        final String origin = resolveOrigin(record, originalTopic);
        final String dlqTopic = settings.dlqTopic();

        final List<Header> headers = RelayHeaders.copy(record.headers());
        headers.add(RelayHeaders.header(RelayHeaders.X_ORIGINAL_TOPIC, origin));
        headers.add(RelayHeaders.header(RelayHeaders.X_DLQ_REASON, reason == null ? "" : reason));
        headers.add(RelayHeaders.header(RelayHeaders.X_DLQ_TIMESTAMP, dlqTimestamp()));

        try {
            publisher.publish(new ProducerRecord<>(dlqTopic, null, record.key(), record.value(), headers));
        } catch (ProduceException e) {
            log.error("Failed to send message to DLQ {}: {}", dlqTopic, e.getMessage());
            throw new ProduceException(dlqTopic, "failed to send to DLQ " + dlqTopic, e);
        }

        metrics.counter(METRIC_DLQ_SENT);
        log.warn("Message sent to DLQ. dlqTopic={} originalTopic={} reason={} offset={}",
                dlqTopic, origin, reason, record.offset());
        return RetryOutcome.DEAD_LETTERED;
    }

    /**
     * {@code 30s * multiplier^retryCount}. Advisory only: nothing in the pipeline waits for it.
     */
    public Duration calculateRetryDelay(int retryCount) {
        final double multiplier = settings.backoffMultiplier();
        double nanos = BASE_DELAY.toNanos();
        for (int i = 0; i < retryCount; i++) {
            nanos *= multiplier;
            if (nanos >= Long.MAX_VALUE) {
                return Duration.ofNanos(Long.MAX_VALUE);
            }
        }
        return Duration.ofNanos((long) nanos);
    }

    public boolean isRetryTopic(String topic) {
        final String prefix = settings.topicPrefix();
        return topic != null && !prefix.isEmpty() && topic.length() > prefix.length() && topic.startsWith(prefix);
    }

    public boolean isDlqTopic(String topic) {
        return topic != null && !settings.dlqTopic().isEmpty() && topic.equals(settings.dlqTopic());
    }

    public String retryTopicFor(String originalTopic) {
        return settings.topicPrefix() + originalTopic;
    }

    private String dlqTimestamp() {
        return DateTimeFormatter.ISO_INSTANT.format(Instant.now(clock).truncatedTo(ChronoUnit.SECONDS));
    }

    private static String resolveOrigin(ConsumerRecord<byte[], byte[]> record, String originalTopic) {
        return (originalTopic == null || originalTopic.isBlank()) ? record.topic() : originalTopic;
    }

    /** Replaces {@code x-retry-count} in place, or appends it when the record had none. */
    private static List<Header> withRetryCount(List<Header> headers, int count) {
        final Header replacement = RelayHeaders.header(RelayHeaders.X_RETRY_COUNT, Integer.toString(count));
        boolean replaced = false;
        for (int i = 0; i < headers.size(); i++) {
            if (RelayHeaders.X_RETRY_COUNT.equals(headers.get(i).key())) {
                headers.set(i, replacement);
                replaced = true;
            }
        }
        if (!replaced) headers.add(replacement);
        return headers;
    }

    private static boolean containsKey(List<Header> headers, String key) {
        for (Header h : headers) {
            if (key.equals(h.key())) return true;
        }
        return false;
    }
}
