/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.core;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Application-level message carried inside a Kafka record value.
 *
 * <p>Immutable. The payload itself is opaque to the pipeline and only the codec gives it a
 * shape. Headers are envelope headers (serialized with the payload), not Kafka record
 * headers; the consumer adds the {@code kafka.*} entries when it hands an envelope to a
 * handler.</p>
 *
 * @param id          unique event id
 * @param payloadType payload type tag, e.g. {@code order.created}
 * @param payload     decoded payload, may be {@code null}
 * @param timestamp   creation time
 * @param headers     envelope headers, never {@code null}
 */
public record Envelope(
        String id,
        String payloadType,
        Object payload,
        Instant timestamp,
        Map<String, String> headers
) {

    public static final String H_KAFKA_OFFSET = "kafka.offset";
    public static final String H_KAFKA_PARTITION = "kafka.partition";
    public static final String H_KAFKA_TOPIC = "kafka.topic";
    public static final String H_KAFKA_RETRY_COUNT = "kafka.retry_count";

    public Envelope {
        Objects.requireNonNull(id, "Envelope id cannot be null");
        Objects.requireNonNull(payloadType, "Envelope payloadType cannot be null");
        if (timestamp == null) timestamp = Instant.now();
        headers = (headers == null) ? Map.of() : Map.copyOf(headers);
    }

    public Envelope(String id, String payloadType, Object payload) {
        this(id, payloadType, payload, Instant.now(), Map.of());
    }

    public static Envelope of(String payloadType, Object payload) {
        return new Envelope(UUID.randomUUID().toString(), payloadType, payload);
    }

    public String header(String key) {
        return headers.get(key);
    }

    /** Payload cast to {@code type}; {@link ClassCastException} when the codec produced something else. */
    public <T> T payloadAs(Class<T> type) {
        return type.cast(payload);
    }

    public Envelope withHeader(String key, String value) {
        final Map<String, String> next = new HashMap<>(headers);
        next.put(key, value);
        return new Envelope(id, payloadType, payload, timestamp, next);
    }

    public Envelope withHeaders(Map<String, String> extra) {
        final Map<String, String> next = new HashMap<>(headers);
        next.putAll(extra);
        return new Envelope(id, payloadType, payload, timestamp, next);
    }

    public Envelope withPayload(Object newPayload) {
        return new Envelope(id, payloadType, newPayload, timestamp, headers);
    }
}
