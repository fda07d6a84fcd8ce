/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.kafka;

import com.intuitivedesigns.streamrelay.core.Envelope;
import com.intuitivedesigns.streamrelay.core.EnvelopeCodec;
import com.intuitivedesigns.streamrelay.core.PartitionKeyExtractor;
import com.intuitivedesigns.streamrelay.core.ScopeProvider;
import com.intuitivedesigns.streamrelay.core.TraceIds;
import com.intuitivedesigns.streamrelay.error.CodecException;
import com.intuitivedesigns.streamrelay.metrics.MetricsRuntime;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.header.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Publishes envelopes with the relay header protocol and waits for broker acknowledgement.
 *
 * <p>Every record carries {@code scope}, {@code trace_id} and {@code x-retry-until}, followed by
 * {@code x-payload-type} and {@code x-event-id}. Publishing is synchronous; the first failed
 * record aborts the call with a {@link ProduceException}.</p>
 *
 * <p>Thread-safe as long as the underlying {@link Producer} is (a {@link KafkaProducer} is).</p>
 */
public final class RelayProducer implements RecordPublisher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RelayProducer.class);

    static final String METRIC_SENT = "streamrelay.producer.sent";
    static final String METRIC_FAILED = "streamrelay.producer.failed";

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

    private final Producer<byte[], byte[]> client;
    private final ProducerSettings settings;
    private final EnvelopeCodec codec;
    private final ScopeProvider scope;
    private final MetricsRuntime metrics;
    private final Clock clock;

    private final AtomicBoolean closed = new AtomicBoolean(false);

    public RelayProducer(Producer<byte[], byte[]> client,
                         ProducerSettings settings,
                         EnvelopeCodec codec,
                         ScopeProvider scope,
                         MetricsRuntime metrics) {
        this(client, settings, codec, scope, metrics, Clock.systemUTC());
    }

    RelayProducer(Producer<byte[], byte[]> client,
                  ProducerSettings settings,
                  EnvelopeCodec codec,
                  ScopeProvider scope,
                  MetricsRuntime metrics,
                  Clock clock) {
        this.client = Objects.requireNonNull(client, "client");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.scope = Objects.requireNonNull(scope, "scope");
        this.metrics = (metrics == null) ? MetricsRuntime.noop() : metrics;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Opens a dedicated {@link KafkaProducer} for this relay producer. */
    public static RelayProducer create(KafkaClientSettings connection,
                                       ProducerSettings settings,
                                       EnvelopeCodec codec,
                                       ScopeProvider scope,
                                       MetricsRuntime metrics) {
        Objects.requireNonNull(connection, "connection");
        final KafkaProducer<byte[], byte[]> client = new KafkaProducer<>(connection.producerProperties(settings));
        log.info("RelayProducer '{}' connected. topic='{}' {}", settings.producerId(), settings.topic(), connection);
        return new RelayProducer(client, settings, codec, scope, metrics);
    }

    public String id() {
        return settings.producerId();
    }

    public String topic() {
        return settings.topic();
    }

    /** Publishes one envelope to the configured topic. */
    public void produce(Envelope envelope) {
        Objects.requireNonNull(envelope, "envelope");
        final byte[] value = encode(envelope);
        final List<Header> headers = withPayloadHeaders(baseHeaders(), envelope);
        publish(List.of(new ProducerRecord<>(settings.topic(), null, partitionKey(envelope), value, headers)));
        log.debug("Envelope produced. topic={} id={}", settings.topic(), envelope.id());
    }

    public void produceBatch(Envelope... envelopes) {
        produceBatch(Arrays.asList(envelopes));
    }

    /**
     * Publishes every envelope to the configured topic.
     *
     * <p>Envelopes that cannot be encoded, or that exceed the size limit, are logged and skipped;
     * the rest is still sent. Broker failures are not skipped: the first one fails the call.</p>
     */
    public void produceBatch(List<Envelope> envelopes) {
        Objects.requireNonNull(envelopes, "envelopes");
        if (envelopes.isEmpty()) return;

        // One header block per batch: every record shares the same trace id and deadline.
        final List<Header> base = baseHeaders();
        final List<ProducerRecord<byte[], byte[]>> records = new ArrayList<>(envelopes.size());

        for (Envelope envelope : envelopes) {
            if (envelope == null) continue;
            final byte[] value;
            try {
                value = encode(envelope);
            } catch (CodecException | ProduceException e) {
                log.warn("Skipping envelope in batch. id={} payloadType={} reason={}",
                        envelope.id(), envelope.payloadType(), e.getMessage());
                continue;
            }
            records.add(new ProducerRecord<>(settings.topic(), null, partitionKey(envelope), value,
                    withPayloadHeaders(base, envelope)));
        }

        if (log.isDebugEnabled()) {
            log.debug("Generated {} of {} records for topic {}", records.size(), envelopes.size(), settings.topic());
        }
        if (records.isEmpty()) return;

        publish(records);
        log.debug("Batch produced. records={}", records.size());
    }

    /** Publishes one envelope to an explicit topic with an explicit (nullable) partition key. */
    public void produceWithTopic(Envelope envelope, String topic, byte[] partitionKey) {
        Objects.requireNonNull(envelope, "envelope");
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic is required");
        }
        final byte[] value = encode(envelope);
        final List<Header> headers = withPayloadHeaders(baseHeaders(), envelope);
        publish(List.of(new ProducerRecord<>(topic, null, partitionKey, value, headers)));
        log.debug("Envelope produced. topic={} id={}", topic, envelope.id());
    }

    @Override
    public void publish(List<ProducerRecord<byte[], byte[]>> records) {
        Objects.requireNonNull(records, "records");
        if (closed.get()) {
            throw new IllegalStateException("RelayProducer '" + id() + "' is closed");
        }

        final List<Future<RecordMetadata>> acks = new ArrayList<>(records.size());
        for (ProducerRecord<byte[], byte[]> record : records) {
            try {
                acks.add(client.send(record));
            } catch (RuntimeException e) {
                // send() throws directly for serialization, buffer and metadata problems
                throw failed(record.topic(), e);
            }
        }

        for (int i = 0; i < acks.size(); i++) {
            final String topic = records.get(i).topic();
            try {
                final RecordMetadata md = acks.get(i).get();
                metrics.counter(METRIC_SENT);
                if (log.isTraceEnabled()) {
                    log.trace("Acked: topic={} part={} off={}", md.topic(), md.partition(), md.offset());
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                metrics.counter(METRIC_FAILED);
                throw new ProduceException(topic, "Interrupted while waiting for producer ack", ie);
            } catch (ExecutionException ee) {
                throw failed(topic, ee.getCause() == null ? ee : ee.getCause());
            }
        }
    }

    private ProduceException failed(String topic, Throwable cause) {
        metrics.counter(METRIC_FAILED);
        log.error("Failed to produce message to topic {}: {}", topic, safeMessage(cause));
        return new ProduceException(topic, "kafka produce error: " + safeMessage(cause), cause);
    }

    private byte[] encode(Envelope envelope) {
        final byte[] value = codec.encode(envelope);
        final int max = settings.maxMessageSize();
        if (max > 0 && value.length > max) {
            throw new ProduceException(settings.topic(),
                    "message size " + value.length + " exceeds max message size " + max, null);
        }
        return value;
    }

    private byte[] partitionKey(Envelope envelope) {
        final PartitionKeyExtractor extractor = settings.keyExtractor();
        return extractor == null ? null : extractor.extract(envelope);
    }

    private List<Header> baseHeaders() {
        final long retryUntil = clock.millis() + settings.retryUntil().toMillis();
        final List<Header> headers = new ArrayList<>(5);
        headers.add(RelayHeaders.header(RelayHeaders.SCOPE, scope.scope()));
        headers.add(RelayHeaders.header(RelayHeaders.TRACE_ID, TraceIds.currentOrNew()));
        headers.add(RelayHeaders.header(RelayHeaders.X_RETRY_UNTIL, Long.toString(retryUntil)));
        return headers;
    }

    private static List<Header> withPayloadHeaders(List<Header> base, Envelope envelope) {
        final List<Header> headers = new ArrayList<>(base.size() + 2);
        headers.addAll(base);
        headers.add(RelayHeaders.header(RelayHeaders.X_PAYLOAD_TYPE, envelope.payloadType()));
        headers.add(RelayHeaders.header(RelayHeaders.X_EVENT_ID, envelope.id()));
        return headers;
    }

    private static String safeMessage(Throwable t) {
        if (t == null) return "unknown";
        final String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : m;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        log.info("Closing RelayProducer '{}'...", id());
        try {
            client.flush();
        } catch (Exception e) {
            log.warn("Producer flush failed", e);
        }
        try {
            client.close(CLOSE_TIMEOUT);
        } catch (Exception e) {
            log.warn("Producer close failed", e);
        }
    }
}
