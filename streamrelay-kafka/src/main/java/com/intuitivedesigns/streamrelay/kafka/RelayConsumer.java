/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.kafka;

import com.intuitivedesigns.streamrelay.core.Envelope;
import com.intuitivedesigns.streamrelay.core.EnvelopeCodec;
import com.intuitivedesigns.streamrelay.core.EnvelopeHandler;
import com.intuitivedesigns.streamrelay.core.MessageContext;
import com.intuitivedesigns.streamrelay.core.ScopeProvider;
import com.intuitivedesigns.streamrelay.core.TraceIds;
import com.intuitivedesigns.streamrelay.error.CodecException;
import com.intuitivedesigns.streamrelay.error.ErrorCode;
import com.intuitivedesigns.streamrelay.error.RelayException;
import com.intuitivedesigns.streamrelay.metrics.MetricsRuntime;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Poll loop that decodes records, filters them by scope, hands them to an {@link EnvelopeHandler}
 * and decides per record whether to commit, requeue or drop.
 *
 * <p>One thread drives one consumer: {@link #consume} and {@link #consumeBatch} block until
 * {@link #shutdown()} is called. Both run under a {@link Supervisor}, so a throwable escaping the
 * loop restarts it after a delay instead of killing the caller.</p>
 *
 * <p>Commit rules:</p>
 * <ul>
 *   <li>single mode commits each handled record right away unless auto-commit is on;</li>
 *   <li>batch mode makes one commit per polled batch, covering the highest handled or dropped
 *       offset per partition, and only when no handler in the batch failed;</li>
 *   <li>a dropped record is committed whatever the auto-commit setting; in single mode
 *       {@link #requeueOrDelete} commits it right away.</li>
 * </ul>
 *
 * <p>The underlying {@link Consumer} is owned by this instance and is not thread-safe; only
 * {@link #shutdown()} and {@link #close()} may be called from other threads.</p>
 */
public final class RelayConsumer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RelayConsumer.class);

    static final String METRIC_HANDLED = "streamrelay.consumer.handled";
    static final String METRIC_FAILED = "streamrelay.consumer.failed";
    static final String METRIC_COMMITTED = "streamrelay.consumer.committed";
    static final String METRIC_REQUEUED = "streamrelay.consumer.requeued";
    static final String METRIC_DROPPED = "streamrelay.consumer.dropped";
    static final String METRIC_POLL_ERRORS = "streamrelay.consumer.poll.errors";
    static final String METRIC_BATCH_SIZE = "streamrelay.consumer.batch.size";
    static final String METRIC_HANDLER_LATENCY = "streamrelay.consumer.handler.latency";

    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);
    private static final long ERROR_LOG_INTERVAL_MS = 1_000L;

    private final Consumer<byte[], byte[]> client;
    private final ConsumerSettings settings;
    private final EnvelopeCodec codec;
    private final ScopeProvider scope;
    private final RetryManager retryManager;
    private final MetricsRuntime metrics;
    private final Clock clock;
    private final Supervisor supervisor;

    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicBoolean looping = new AtomicBoolean(false);
    private final AtomicBoolean closeRequested = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final AtomicLong lastErrorLogMs = new AtomicLong(0L);
    private final LongAdder suppressedErrors = new LongAdder();

    public RelayConsumer(Consumer<byte[], byte[]> client,
                         ConsumerSettings settings,
                         EnvelopeCodec codec,
                         ScopeProvider scope,
                         RetryManager retryManager,
                         MetricsRuntime metrics) {
        this(client, settings, codec, scope, retryManager, metrics, Clock.systemUTC(),
                new Supervisor("relay-consumer", metrics, 0));
    }

    RelayConsumer(Consumer<byte[], byte[]> client,
                  ConsumerSettings settings,
                  EnvelopeCodec codec,
                  ScopeProvider scope,
                  RetryManager retryManager,
                  MetricsRuntime metrics,
                  Clock clock,
                  Supervisor supervisor) {
        this.client = Objects.requireNonNull(client, "client");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.scope = Objects.requireNonNull(scope, "scope");
        this.retryManager = (retryManager == null) ? RetryManager.disabled() : retryManager;
        this.metrics = (metrics == null) ? MetricsRuntime.noop() : metrics;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.supervisor = Objects.requireNonNull(supervisor, "supervisor");

        this.client.subscribe(settings.topics());
    }

    /** Opens a dedicated {@link KafkaConsumer}; it is never shared with a producer. */
    public static RelayConsumer create(KafkaClientSettings connection,
                                       ConsumerSettings settings,
                                       EnvelopeCodec codec,
                                       ScopeProvider scope,
                                       RetryManager retryManager,
                                       MetricsRuntime metrics) {
        Objects.requireNonNull(connection, "connection");
        final KafkaConsumer<byte[], byte[]> client = new KafkaConsumer<>(connection.consumerProperties(settings));
        log.info("RelayConsumer connected. group='{}' topics={} {}", settings.consumerGroup(), settings.topics(), connection);
        return new RelayConsumer(client, settings, codec, scope, retryManager, metrics);
    }

    /** Handles records one at a time. Blocks until {@link #shutdown()}. */
    public void consume(EnvelopeHandler handler) {
        Objects.requireNonNull(handler, "handler");
        supervise("consume", () -> pollLoop(records -> handleEach(records, handler)));
    }

    /** Handles each polled batch as a unit for commit purposes. Blocks until {@link #shutdown()}. */
    public void consumeBatch(EnvelopeHandler handler) {
        Objects.requireNonNull(handler, "handler");
        supervise("consumeBatch", () -> pollLoop(records -> handleBatch(records, handler)));
    }

    public boolean isRunning() {
        return running.get();
    }

    /** Stops the loop: the current batch finishes, a blocked poll is woken up. */
    public void shutdown() {
        if (!running.compareAndSet(true, false)) return;
        log.info("Shutdown requested for RelayConsumer (group='{}')", settings.consumerGroup());
        client.wakeup();
    }

    @Override
    public void close() {
        shutdown();
        closeRequested.set(true);
        // A running loop closes the client itself on its way out.
        if (!looping.get()) {
            closeClient();
        }
    }

    // ---------------------------------------------------------
    // LOOP
    // ---------------------------------------------------------

    @FunctionalInterface
    private interface BatchStep {
        void accept(ConsumerRecords<byte[], byte[]> records);
    }

    /** Receives a record whose offset may be committed. */
    @FunctionalInterface
    private interface Ack {
        void accept(ConsumerRecord<byte[], byte[]> record);
    }

    private void supervise(String mode, Supervisor.Task loop) {
        if (!looping.compareAndSet(false, true)) {
            throw new IllegalStateException("RelayConsumer is already consuming");
        }
        log.info("RelayConsumer {} started. group='{}' topics={} autoCommit={} pollTimeout={}",
                mode, settings.consumerGroup(), settings.topics(), settings.autoCommit(), settings.pollTimeout());
        try {
            supervisor.run(loop, running::get);
        } finally {
            looping.set(false);
            if (closeRequested.get()) {
                closeClient();
            }
            log.info("RelayConsumer {} stopped.", mode);
        }
    }

    private void pollLoop(BatchStep step) {
        while (running.get()) {
            final ConsumerRecords<byte[], byte[]> records;
            try {
                records = client.poll(settings.pollTimeout());
            } catch (WakeupException we) {
                continue; // loop condition decides
            } catch (InterruptException ie) {
                log.info("RelayConsumer interrupted while polling, stopping");
                running.set(false);
                return;
            } catch (KafkaException ke) {
                metrics.counter(METRIC_POLL_ERRORS);
                rateLimitedLog("Error fetching from kafka", ke);
                continue;
            }

            if (records.isEmpty()) continue;
            step.accept(records);
        }
    }

    private void handleEach(ConsumerRecords<byte[], byte[]> records, EnvelopeHandler handler) {
        for (ConsumerRecord<byte[], byte[]> record : records) {
            final Optional<Envelope> envelope = processRecord(record);
            if (envelope.isEmpty()) continue;

            if (dispatch(record, envelope.get(), handler, this::commit) && !settings.autoCommit()) {
                commit(record);
            }
        }
    }

    /**
     * Decodes the whole batch first, then dispatches in poll order. Nothing is committed before
     * the batch is over: dropped records join the batch commit, and a single handler failure
     * withholds it for every partition. Records rejected before dispatch do not fail the batch.
     */
    private void handleBatch(ConsumerRecords<byte[], byte[]> records, EnvelopeHandler handler) {
        final Map<TopicPartition, Long> dropped = new HashMap<>();
        final Ack deferDrop = r -> dropped.merge(partitionOf(r), r.offset(), Math::max);

        final List<ConsumerRecord<byte[], byte[]>> accepted = new ArrayList<>(records.count());
        final List<Envelope> envelopes = new ArrayList<>(records.count());
        for (ConsumerRecord<byte[], byte[]> record : records) {
            final Optional<Envelope> envelope = processRecord(record, deferDrop);
            if (envelope.isPresent()) {
                accepted.add(record);
                envelopes.add(envelope.get());
            }
        }
        metrics.gauge(METRIC_BATCH_SIZE, accepted.size());

        boolean batchFailed = false;
        final Map<TopicPartition, Long> handled = new HashMap<>();

        for (int i = 0; i < accepted.size(); i++) {
            final ConsumerRecord<byte[], byte[]> record = accepted.get(i);
            if (!dispatch(record, envelopes.get(i), handler, deferDrop)) {
                batchFailed = true;
                continue;
            }
            handled.merge(partitionOf(record), record.offset(), Math::max);
        }

        if (batchFailed) {
            log.warn("Batch had failures, withholding commits. records={} partitions={}",
                    records.count(), records.partitions().size());
            return;
        }

        // Drops are committed even with auto-commit on, handled records only without it.
        final Map<TopicPartition, Long> highest = new HashMap<>(dropped);
        if (!settings.autoCommit()) {
            handled.forEach((tp, offset) -> highest.merge(tp, offset, Math::max));
        }
        if (!highest.isEmpty()) {
            final Map<TopicPartition, OffsetAndMetadata> offsets = new HashMap<>();
            highest.forEach((tp, offset) -> offsets.put(tp, new OffsetAndMetadata(offset + 1)));
            commitOffsets(offsets);
        }
    }

    // ---------------------------------------------------------
    // PER RECORD
    // ---------------------------------------------------------

    /**
     * Decodes {@code record} and checks its scope. A rejected record has already been routed
     * through {@link #requeueOrDelete} when this returns empty.
     */
    Optional<Envelope> processRecord(ConsumerRecord<byte[], byte[]> record) {
        return processRecord(record, this::commit);
    }

    private Optional<Envelope> processRecord(ConsumerRecord<byte[], byte[]> record, Ack ack) {
        final Envelope decoded;
        try {
            decoded = codec.decode(record.value());
        } catch (RuntimeException e) {
            final String field = (e instanceof CodecException ce) ? ce.field() : null;
            log.error("Error deserializing message. topic={} partition={} offset={} payloadType={} field={} error={}",
                    record.topic(), record.partition(), record.offset(),
                    RelayHeaders.first(record.headers(), RelayHeaders.X_PAYLOAD_TYPE), field, e.getMessage());
            route(record, RelayException.noRetry("error deserializing message", e), ack);
            return Optional.empty();
        }

        if (!settings.withoutScope()) {
            final String recordScope = RelayHeaders.first(record.headers(), RelayHeaders.SCOPE);
            final String localScope = scope.scope();
            if (!localScope.equals(recordScope)) {
                log.warn("Scope is invalid. topic={} partition={} offset={} scope={} expected={}",
                        record.topic(), record.partition(), record.offset(), recordScope, localScope);
                route(record, RelayException.invalidScope("invalid scope: " + recordScope), ack);
                return Optional.empty();
            }
        }

        final Map<String, String> kafkaHeaders = Map.of(
                Envelope.H_KAFKA_OFFSET, Long.toString(record.offset()),
                Envelope.H_KAFKA_PARTITION, Integer.toString(record.partition()),
                Envelope.H_KAFKA_TOPIC, record.topic(),
                Envelope.H_KAFKA_RETRY_COUNT, Integer.toString(RelayHeaders.retryCount(record.headers())));
        return Optional.of(decoded.withHeaders(kafkaHeaders));
    }

    private boolean dispatch(ConsumerRecord<byte[], byte[]> record, Envelope envelope, EnvelopeHandler handler, Ack ack) {
        final String traceId = TraceIds.newTraceId();
        final MessageContext ctx = new MessageContext(traceId, record.topic(), record.partition(), record.offset(),
                RelayHeaders.retryCount(record.headers()));

        try (MDC.MDCCloseable ignored = TraceIds.bind(traceId)) {
            final long startNs = System.nanoTime();
            try {
                handler.handle(ctx, envelope);
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                metrics.counter(METRIC_FAILED);
                log.error("Error processing message. topic={} partition={} offset={} payloadType={} id={}",
                        record.topic(), record.partition(), record.offset(), envelope.payloadType(), envelope.id(), e);
                route(record, e, ack);
                return false;
            }
            metrics.counter(METRIC_HANDLED);
            metrics.timer(METRIC_HANDLER_LATENCY, TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs));
            return true;
        }
    }

    /**
     * Decides the fate of a record whose processing failed and commits it when it is dropped.
     *
     * <ol>
     *   <li>past its {@code x-retry-until} deadline: commit (drop), nothing else is checked;</li>
     *   <li>requeue-eligible and retry count within {@code requeueMaxRetries}: hand to the retry
     *       manager and leave the record uncommitted, unless it went to the DLQ;</li>
     *   <li>anything else, including a failed requeue: commit (drop).</li>
     * </ol>
     */
    void requeueOrDelete(ConsumerRecord<byte[], byte[]> record, Throwable error) {
        route(record, error, this::commit);
    }

    private void route(ConsumerRecord<byte[], byte[]> record, Throwable error, Ack ack) {
        final long deadline = RelayHeaders.retryDeadline(record.headers());
        final long now = clock.millis();

        if (deadline > 0 && now > deadline) {
            log.error("Message retry deadline exceeded, dropping message. topic={} partition={} offset={} payloadType={} messageBase64={}",
                    record.topic(), record.partition(), record.offset(),
                    RelayHeaders.first(record.headers(), RelayHeaders.X_PAYLOAD_TYPE),
                    record.value() == null ? "" : Base64.getEncoder().encodeToString(record.value()));
            metrics.counter(METRIC_DROPPED);
            ack.accept(record);
            return;
        }

        final ErrorCode code = ErrorCode.classify(error);
        final int retryCount = RelayHeaders.retryCount(record.headers());

        if (log.isDebugEnabled()) {
            log.debug("Evaluating record for deletion. code={} requeueEligible={} retryCount={} maxRetries={}",
                    code, code.requeueEligible(), retryCount, settings.requeueMaxRetries());
        }

        if (code.requeueEligible() && retryCount <= settings.requeueMaxRetries()) {
            try {
                final RetryOutcome outcome = retryManager.sendToRetry(
                        record, retryCount, originalTopic(record), retryReason(code));
                if (outcome != RetryOutcome.DEAD_LETTERED) {
                    metrics.counter(METRIC_REQUEUED);
                    log.debug("Left uncommitted, requeue outcome {}", outcome);
                    return;
                }
                // The DLQ copy is durable; the original is done.
                ack.accept(record);
                return;
            } catch (RuntimeException e) {
                log.error("Error requeueing message. topic={} partition={} offset={}",
                        record.topic(), record.partition(), record.offset(), e);
            }
        }

        log.debug("Dropping record (commit). topic={} partition={} offset={} code={}",
                record.topic(), record.partition(), record.offset(), code);
        metrics.counter(METRIC_DROPPED);
        ack.accept(record);
    }

    private static TopicPartition partitionOf(ConsumerRecord<byte[], byte[]> record) {
        return new TopicPartition(record.topic(), record.partition());
    }

    /** A record read from a retry topic keeps pointing at the topic it was first published to. */
    private static String originalTopic(ConsumerRecord<byte[], byte[]> record) {
        final String origin = RelayHeaders.originalTopic(record.headers());
        return (origin == null || origin.isBlank()) ? record.topic() : origin;
    }

    private static String retryReason(ErrorCode code) {
        return code == ErrorCode.INVALID_SCOPE_REQUEUE ? "invalid_scope" : null;
    }

    // ---------------------------------------------------------
    // COMMIT / CLOSE
    // ---------------------------------------------------------

    private void commit(ConsumerRecord<byte[], byte[]> record) {
        commitOffsets(Map.of(partitionOf(record), new OffsetAndMetadata(record.offset() + 1)));
    }

    private void commitOffsets(Map<TopicPartition, OffsetAndMetadata> offsets) {
        if (log.isDebugEnabled()) {
            log.debug("Committing offsets {}", offsets);
        }
        for (int attempt = 1; attempt <= 2; attempt++) {
            try {
                client.commitSync(offsets);
                metrics.counter(METRIC_COMMITTED, offsets.size());
                return;
            } catch (WakeupException we) {
                // shutdown() raced the commit; the wakeup is consumed, so one more attempt goes through
                log.debug("Commit interrupted by wakeup (attempt {})", attempt);
            } catch (KafkaException e) {
                log.error("Error committing message offsets {}: {}", offsets, e.getMessage());
                return;
            }
        }
        log.error("Error committing message offsets {}: interrupted by wakeup twice", offsets);
    }

    private void rateLimitedLog(String context, Throwable ex) {
        final long now = System.currentTimeMillis();
        final long last = lastErrorLogMs.get();

        if (now - last >= ERROR_LOG_INTERVAL_MS && lastErrorLogMs.compareAndSet(last, now)) {
            final long suppressed = suppressedErrors.sumThenReset();
            log.error("{} (suppressed {} similar errors): {}", context, suppressed, ex.toString());
        } else {
            suppressedErrors.increment();
        }
    }

    private void closeClient() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            client.close(CLOSE_TIMEOUT);
            log.info("RelayConsumer closed (group='{}')", settings.consumerGroup());
        } catch (Exception e) {
            log.warn("RelayConsumer close failed", e);
        }
    }
}
