/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.kafka;

import com.intuitivedesigns.streamrelay.core.Envelope;
import com.intuitivedesigns.streamrelay.core.EnvelopeHandler;
import com.intuitivedesigns.streamrelay.core.MessageContext;
import com.intuitivedesigns.streamrelay.core.ScopeProvider;
import com.intuitivedesigns.streamrelay.error.RelayException;
import com.intuitivedesigns.streamrelay.metrics.MicrometerMetricsRuntime;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class RelayConsumerTest {

    private static final long NOW = 1_700_000_000_000L;
    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);

    private static final TopicPartition ORDERS_0 = new TopicPartition("orders", 0);
    private static final TopicPartition ORDERS_1 = new TopicPartition("orders", 1);
    private static final TopicPartition RETRY_0 = new TopicPartition("retry-orders", 0);

    private final List<ProducerRecord<byte[], byte[]>> published = new ArrayList<>();
    private final List<Envelope> handled = new ArrayList<>();
    private final List<MessageContext> contexts = new ArrayList<>();

    private RecordingConsumer mock;
    private MicrometerMetricsRuntime metrics;
    private RelayConsumer relay;

    @BeforeEach
    void setUp() {
        relay = newRelay(manualCommit(), published::addAll);
    }

    private static ConsumerSettings manualCommit() {
        return ConsumerSettings.of("g", "orders", "retry-orders").withAutoCommit(false);
    }

    private RelayConsumer newRelay(ConsumerSettings settings, RecordPublisher publisher) {
        mock = new RecordingConsumer();
        metrics = new MicrometerMetricsRuntime();
        RetryManager retry = new RetryManager(RetrySettings.defaults(), publisher, metrics, CLOCK);
        Supervisor supervisor = new Supervisor("test", metrics, Duration.ZERO, Duration.ZERO,
                Duration.ofSeconds(60), 3, CLOCK, d -> {});
        RelayConsumer consumer = new RelayConsumer(mock, settings, new TextCodec(), ScopeProvider.fixed("test"),
                retry, metrics, CLOCK, supervisor);
        mock.assignAtStart(ORDERS_0, ORDERS_1, RETRY_0);
        return consumer;
    }

    private RelayConsumer newRelayWithoutRetries(ConsumerSettings settings) {
        mock = new RecordingConsumer();
        metrics = new MicrometerMetricsRuntime();
        RelayConsumer consumer = new RelayConsumer(mock, settings, new TextCodec(), ScopeProvider.fixed("test"),
                null, metrics, CLOCK, new Supervisor("test", metrics, 0));
        mock.assignAtStart(ORDERS_0, ORDERS_1, RETRY_0);
        return consumer;
    }

    /** A record produced in this scope that is still within its retry window. */
    private static Records live(TopicPartition tp, long offset, String payload) {
        return Records.at(tp.topic(), tp.partition(), offset)
                .value(TextCodec.bytes("order.created", "evt-" + offset, payload))
                .header(RelayHeaders.SCOPE, "test")
                .header(RelayHeaders.X_RETRY_UNTIL, Long.toString(NOW + 600_000));
    }

    private EnvelopeHandler recording(Consumer<Envelope> body) {
        return (ctx, envelope) -> {
            contexts.add(ctx);
            handled.add(envelope);
            body.accept(envelope);
        };
    }

    private EnvelopeHandler succeeding() {
        return recording(e -> {});
    }

    private EnvelopeHandler failingWith(RuntimeException error) {
        return recording(e -> {
            throw error;
        });
    }

    /** Delivers {@code records} on the first poll, shuts the relay down on the next one. */
    @SafeVarargs
    private void consume(EnvelopeHandler handler, ConsumerRecord<byte[], byte[]>... records) {
        mock.schedulePollTask(() -> {
            for (ConsumerRecord<byte[], byte[]> r : records) mock.addRecord(r);
        });
        mock.schedulePollTask(relay::shutdown);
        relay.consume(handler);
    }

    @SafeVarargs
    private void consumeBatch(EnvelopeHandler handler, ConsumerRecord<byte[], byte[]>... records) {
        mock.schedulePollTask(() -> {
            for (ConsumerRecord<byte[], byte[]> r : records) mock.addRecord(r);
        });
        mock.schedulePollTask(relay::shutdown);
        relay.consumeBatch(handler);
    }

    private static Map<TopicPartition, OffsetAndMetadata> offset(TopicPartition tp, long next) {
        return Map.of(tp, new OffsetAndMetadata(next));
    }

    private static String header(ProducerRecord<byte[], byte[]> record, String key) {
        return RelayHeaders.first(record.headers(), key);
    }

    // ---------------------------------------------------------
    // SINGLE MODE
    // ---------------------------------------------------------

    @Test
    void consume_shouldHandleAndCommitEachRecord() {
        consume(succeeding(), live(ORDERS_0, 0, "a").build(), live(ORDERS_0, 1, "b").build());

        assertEquals(2, handled.size());
        Envelope first = handled.get(0);
        assertEquals("evt-0", first.id());
        assertEquals("a", first.payload());
        assertEquals("0", first.header(Envelope.H_KAFKA_OFFSET));
        assertEquals("0", first.header(Envelope.H_KAFKA_PARTITION));
        assertEquals("orders", first.header(Envelope.H_KAFKA_TOPIC));
        assertEquals("0", first.header(Envelope.H_KAFKA_RETRY_COUNT));

        assertEquals("orders", contexts.get(1).topic());
        assertEquals(1L, contexts.get(1).offset());
        assertNotEquals(contexts.get(0).traceId(), contexts.get(1).traceId());

        assertEquals(List.of(offset(ORDERS_0, 1), offset(ORDERS_0, 2)), mock.commits);
        assertTrue(published.isEmpty());
        assertEquals(2.0, metrics.count(RelayConsumer.METRIC_HANDLED));
        assertFalse(relay.isRunning());
    }

    @Test
    void consume_shouldSubscribeToConfiguredTopics() {
        assertEquals(Set.of("orders", "retry-orders"), mock.subscription());
    }

    @Test
    void consume_shouldNotCommitSuccessesWithAutoCommit() {
        relay = newRelay(ConsumerSettings.of("g", "orders", "retry-orders"), published::addAll);

        consume(succeeding(), live(ORDERS_0, 0, "a").build());

        assertEquals(1, handled.size());
        assertTrue(mock.commits.isEmpty());
    }

    @Test
    void handlerFailure_shouldRequeueAndLeaveUncommitted() {
        consume(failingWith(new IllegalStateException("db down")), live(ORDERS_0, 0, "a").build());

        assertEquals(1, published.size());
        ProducerRecord<byte[], byte[]> retry = published.get(0);
        assertEquals("retry-orders", retry.topic());
        assertEquals("1", header(retry, RelayHeaders.X_RETRY_COUNT));
        assertEquals("orders", header(retry, RelayHeaders.X_ORIGINAL_TOPIC));
        assertEquals(RetryManager.DEFAULT_RETRY_REASON, header(retry, RelayHeaders.X_RETRY_REASON));
        assertArrayEquals(TextCodec.bytes("order.created", "evt-0", "a"), retry.value());

        assertTrue(mock.commits.isEmpty());
        assertEquals(1.0, metrics.count(RelayConsumer.METRIC_FAILED));
        assertEquals(1.0, metrics.count(RelayConsumer.METRIC_REQUEUED));
    }

    @Test
    void doNotRequeue_shouldCommitWithoutPublishing() {
        consume(failingWith(RelayException.doNotRequeue("invalid order")), live(ORDERS_0, 3, "a").build());

        assertTrue(published.isEmpty());
        assertEquals(List.of(offset(ORDERS_0, 4)), mock.commits);
        assertEquals(1.0, metrics.count(RelayConsumer.METRIC_DROPPED));
    }

    @Test
    void noRetry_shouldCommitEvenWithAutoCommit() {
        relay = newRelay(ConsumerSettings.of("g", "orders", "retry-orders"), published::addAll);

        consume(failingWith(RelayException.noRetry("bad data", null)), live(ORDERS_0, 0, "a").build());

        assertTrue(published.isEmpty());
        assertEquals(List.of(offset(ORDERS_0, 1)), mock.commits);
    }

    @Test
    void expiredDeadline_shouldDropRegardlessOfError() {
        ConsumerRecord<byte[], byte[]> expired = Records.at("orders", 0, 0)
                .value(TextCodec.bytes("order.created", "evt-0", "a"))
                .header(RelayHeaders.SCOPE, "test")
                .header(RelayHeaders.X_RETRY_UNTIL, Long.toString(NOW - 1))
                .build();

        consume(failingWith(new IllegalStateException("db down")), expired);

        assertEquals(1, handled.size());
        assertTrue(published.isEmpty());
        assertEquals(List.of(offset(ORDERS_0, 1)), mock.commits);
        assertEquals(1.0, metrics.count(RelayConsumer.METRIC_DROPPED));
    }

    @Test
    void requeueOrDelete_shouldDropExpiredRecordWhateverTheError() {
        ConsumerRecord<byte[], byte[]> expired = Records.at("orders", 0, 5)
                .value(TextCodec.bytes("order.created", "evt-5", "a"))
                .header(RelayHeaders.SCOPE, "test")
                .header(RelayHeaders.X_RETRY_UNTIL, Long.toString(NOW - 1))
                .build();

        relay.requeueOrDelete(expired, RelayException.doNotRequeue("invalid order"));
        relay.requeueOrDelete(expired, RelayException.invalidScope("invalid scope: prod"));
        relay.requeueOrDelete(expired, new IllegalStateException("db down"));

        assertTrue(published.isEmpty());
        assertEquals(List.of(offset(ORDERS_0, 6), offset(ORDERS_0, 6), offset(ORDERS_0, 6)), mock.commits);
        assertEquals(3.0, metrics.count(RelayConsumer.METRIC_DROPPED));
    }

    @Test
    void requeueOrDelete_shouldDropExpiredRecordWithoutRetryManager() {
        relay = newRelayWithoutRetries(manualCommit());
        ConsumerRecord<byte[], byte[]> expired = Records.at("retry-orders", 0, 2)
                .value(TextCodec.bytes("order.created", "evt-2", "a"))
                .header(RelayHeaders.X_RETRY_UNTIL, Long.toString(NOW - 1))
                .header(RelayHeaders.X_RETRY_COUNT, "1")
                .build();

        relay.requeueOrDelete(expired, new IllegalStateException("db down"));

        assertEquals(List.of(offset(RETRY_0, 3)), mock.commits);
    }

    @Test
    void retryTopicRecord_shouldKeepOriginalTopic() {
        ConsumerRecord<byte[], byte[]> fromRetry = live(RETRY_0, 0, "a")
                .header(RelayHeaders.X_RETRY_COUNT, "1")
                .header(RelayHeaders.X_ORIGINAL_TOPIC, "orders")
                .build();

        consume(failingWith(new IllegalStateException("still down")), fromRetry);

        assertEquals(1, contexts.get(0).retryCount());
        assertEquals("1", handled.get(0).header(Envelope.H_KAFKA_RETRY_COUNT));

        ProducerRecord<byte[], byte[]> retry = published.get(0);
        assertEquals("retry-orders", retry.topic());
        assertEquals("2", header(retry, RelayHeaders.X_RETRY_COUNT));
        assertTrue(mock.commits.isEmpty());
    }

    @Test
    void exhaustedRetries_shouldDeadLetterAndCommit() {
        ConsumerRecord<byte[], byte[]> lastAttempt = live(RETRY_0, 7, "a")
                .header(RelayHeaders.X_RETRY_COUNT, "3")
                .header(RelayHeaders.X_ORIGINAL_TOPIC, "orders")
                .build();

        consume(failingWith(new IllegalStateException("still down")), lastAttempt);

        assertEquals(1, published.size());
        ProducerRecord<byte[], byte[]> dead = published.get(0);
        assertEquals("dlq", dead.topic());
        assertEquals(RetryManager.REASON_MAX_RETRIES_EXCEEDED, header(dead, RelayHeaders.X_DLQ_REASON));
        assertEquals(List.of(offset(RETRY_0, 8)), mock.commits);
    }

    @Test
    void retryCountAboveRequeueLimit_shouldDropWithoutPublishing() {
        ConsumerRecord<byte[], byte[]> overLimit = live(RETRY_0, 0, "a")
                .header(RelayHeaders.X_RETRY_COUNT, "4")
                .build();

        consume(failingWith(new IllegalStateException("still down")), overLimit);

        assertTrue(published.isEmpty());
        assertEquals(List.of(offset(RETRY_0, 1)), mock.commits);
    }

    @Test
    void failedRequeue_shouldCommit() {
        relay = newRelay(manualCommit(), records -> {
            throw new ProduceException("retry-orders", "kafka produce error: broker down", null);
        });

        consume(failingWith(new IllegalStateException("db down")), live(ORDERS_0, 0, "a").build());

        assertEquals(List.of(offset(ORDERS_0, 1)), mock.commits);
        assertEquals(1.0, metrics.count(RelayConsumer.METRIC_DROPPED));
        assertEquals(0.0, metrics.count(RelayConsumer.METRIC_REQUEUED));
    }

    @Test
    void disabledRetry_shouldLeaveRecordUncommitted() {
        relay = newRelayWithoutRetries(manualCommit());

        consume(failingWith(new IllegalStateException("db down")), live(ORDERS_0, 0, "a").build());

        assertTrue(mock.commits.isEmpty());
    }

    // ---------------------------------------------------------
    // PRE-DISPATCH REJECTS
    // ---------------------------------------------------------

    @Test
    void scopeMismatch_shouldRequeueWithoutCallingHandler() {
        ConsumerRecord<byte[], byte[]> foreign = Records.at("orders", 0, 0)
                .value(TextCodec.bytes("order.created", "evt-0", "a"))
                .header(RelayHeaders.SCOPE, "prod")
                .header(RelayHeaders.X_RETRY_UNTIL, Long.toString(NOW + 600_000))
                .build();
        ConsumerRecord<byte[], byte[]> unscoped = Records.at("orders", 0, 1)
                .value(TextCodec.bytes("order.created", "evt-1", "b"))
                .build();

        consume(succeeding(), foreign, unscoped);

        assertTrue(handled.isEmpty());
        assertEquals(2, published.size());
        assertEquals("invalid_scope", header(published.get(0), RelayHeaders.X_RETRY_REASON));
        assertEquals("retry-orders", published.get(1).topic());
        assertTrue(mock.commits.isEmpty());
    }

    @Test
    void withoutScope_shouldAcceptAnyScope() {
        relay = newRelay(manualCommit().withoutScopeCheck(), published::addAll);
        ConsumerRecord<byte[], byte[]> foreign = Records.at("orders", 0, 0)
                .value(TextCodec.bytes("order.created", "evt-0", "a"))
                .header(RelayHeaders.SCOPE, "prod")
                .build();

        consume(succeeding(), foreign);

        assertEquals(1, handled.size());
        assertEquals(List.of(offset(ORDERS_0, 1)), mock.commits);
    }

    @Test
    void undecodableRecord_shouldBeDropped() {
        ConsumerRecord<byte[], byte[]> garbage = live(ORDERS_0, 0, "a")
                .value("garbage".getBytes(StandardCharsets.UTF_8))
                .build();

        consume(succeeding(), garbage, live(ORDERS_0, 1, "b").build());

        assertEquals(1, handled.size());
        assertEquals("evt-1", handled.get(0).id());
        assertTrue(published.isEmpty());
        assertEquals(List.of(offset(ORDERS_0, 1), offset(ORDERS_0, 2)), mock.commits);
    }

    // ---------------------------------------------------------
    // BATCH MODE
    // ---------------------------------------------------------

    @Test
    void consumeBatch_shouldCommitHighestOffsetPerPartitionOnce() {
        consumeBatch(succeeding(),
                live(ORDERS_0, 0, "a").build(),
                live(ORDERS_0, 1, "b").build(),
                live(ORDERS_1, 0, "c").build());

        assertEquals(3, handled.size());
        assertEquals(1, mock.commits.size());
        assertEquals(Map.of(ORDERS_0, new OffsetAndMetadata(2), ORDERS_1, new OffsetAndMetadata(1)), mock.commits.get(0));

        MeterRegistry registry = (MeterRegistry) metrics.registry();
        assertEquals(3.0, registry.find(RelayConsumer.METRIC_BATCH_SIZE).gauge().value());
        assertEquals(3L, registry.find(RelayConsumer.METRIC_HANDLER_LATENCY).timer().count());
    }

    @Test
    void consumeBatch_shouldWithholdCommitsWhenAnyHandlerFails() {
        consumeBatch(recording(e -> {
                    if ("b".equals(e.payload())) throw new IllegalStateException("db down");
                }),
                live(ORDERS_0, 0, "a").build(),
                live(ORDERS_0, 1, "b").build(),
                live(ORDERS_0, 2, "c").build());

        assertEquals(3, handled.size());
        assertEquals(1, published.size());
        assertArrayEquals(TextCodec.bytes("order.created", "evt-1", "b"), published.get(0).value());
        assertTrue(mock.commits.isEmpty());
    }

    @Test
    void consumeBatch_shouldNotFailBatchOnPreDispatchReject() {
        ConsumerRecord<byte[], byte[]> garbage = live(ORDERS_0, 1, "x")
                .value("garbage".getBytes(StandardCharsets.UTF_8))
                .build();

        consumeBatch(succeeding(), live(ORDERS_0, 0, "a").build(), garbage, live(ORDERS_0, 2, "c").build());

        assertEquals(2, handled.size());
        // the dropped record rides along with the single batch commit
        assertEquals(List.of(offset(ORDERS_0, 3)), mock.commits);
    }

    @Test
    void consumeBatch_shouldNotCommitDropPastFailedRecord() {
        relay = newRelayWithoutRetries(manualCommit());
        ConsumerRecord<byte[], byte[]> garbage = live(ORDERS_0, 1, "x")
                .value("garbage".getBytes(StandardCharsets.UTF_8))
                .build();

        consumeBatch(failingWith(new IllegalStateException("db down")), live(ORDERS_0, 0, "a").build(), garbage);

        assertEquals(1, handled.size());
        assertTrue(mock.commits.isEmpty());
        assertEquals(1.0, metrics.count(RelayConsumer.METRIC_DROPPED));
    }

    @Test
    void consumeBatch_shouldHoldBackDroppedFailuresUntilBatchSucceeds() {
        consumeBatch(recording(e -> {
                    if ("a".equals(e.payload())) throw new IllegalStateException("db down");
                    if ("b".equals(e.payload())) throw RelayException.doNotRequeue("invalid order");
                }),
                live(ORDERS_0, 0, "a").build(),
                live(ORDERS_0, 1, "b").build(),
                live(ORDERS_1, 0, "c").build());

        assertEquals(3, handled.size());
        assertEquals(1, published.size());
        assertTrue(mock.commits.isEmpty());
    }

    @Test
    void consumeBatch_shouldCommitDropsWithAutoCommit() {
        relay = newRelay(ConsumerSettings.of("g", "orders", "retry-orders"), published::addAll);
        ConsumerRecord<byte[], byte[]> garbage = live(ORDERS_0, 1, "x")
                .value("garbage".getBytes(StandardCharsets.UTF_8))
                .build();

        consumeBatch(succeeding(), live(ORDERS_0, 0, "a").build(), garbage, live(ORDERS_1, 0, "c").build());

        assertEquals(2, handled.size());
        assertEquals(List.of(offset(ORDERS_0, 2)), mock.commits);
    }

    @Test
    void consumeBatch_shouldSkipCommitWithAutoCommit() {
        relay = newRelay(ConsumerSettings.of("g", "orders", "retry-orders"), published::addAll);

        consumeBatch(succeeding(), live(ORDERS_0, 0, "a").build());

        assertEquals(1, handled.size());
        assertTrue(mock.commits.isEmpty());
    }

    // ---------------------------------------------------------
    // PRODUCER TO CONSUMER
    // ---------------------------------------------------------

    @Test
    void producedEnvelope_shouldBeConsumedAndCommittedOnce() {
        MockProducer<byte[], byte[]> broker = new MockProducer<>(true, new ByteArraySerializer(), new ByteArraySerializer());
        try (RelayProducer producer = new RelayProducer(broker, ProducerSettings.forTopic("orders"), new TextCodec(),
                ScopeProvider.fixed("test"), metrics, CLOCK)) {
            producer.produce(new Envelope("evt-1", "order.created", "42"));
        }
        ConsumerRecord<byte[], byte[]> delivered = Records.delivered(broker.history().get(0), 0, 0);

        consume(succeeding(), delivered);

        assertEquals(1, handled.size());
        assertEquals("evt-1", handled.get(0).id());
        assertEquals("order.created", handled.get(0).payloadType());
        assertEquals("42", handled.get(0).payload());
        assertEquals(List.of(offset(ORDERS_0, 1)), mock.commits);
        assertTrue(published.isEmpty());
    }

    @Test
    void producedEnvelope_fromOtherScopeShouldBeRequeued() {
        MockProducer<byte[], byte[]> broker = new MockProducer<>(true, new ByteArraySerializer(), new ByteArraySerializer());
        try (RelayProducer producer = new RelayProducer(broker, ProducerSettings.forTopic("orders"), new TextCodec(),
                ScopeProvider.fixed("prod"), metrics, CLOCK)) {
            producer.produce(new Envelope("evt-1", "order.created", "42"));
        }

        consume(succeeding(), Records.delivered(broker.history().get(0), 0, 0));

        assertTrue(handled.isEmpty());
        assertEquals(1, published.size());
        assertEquals("invalid_scope", header(published.get(0), RelayHeaders.X_RETRY_REASON));
        assertTrue(mock.commits.isEmpty());
    }

    // ---------------------------------------------------------
    // LIFECYCLE
    // ---------------------------------------------------------

    @Test
    void escapingError_shouldRestartLoop() {
        AtomicInteger calls = new AtomicInteger();
        EnvelopeHandler handler = recording(e -> {
            if (calls.getAndIncrement() == 0) throw new AssertionError("handler bug");
        });

        mock.schedulePollTask(() -> mock.addRecord(live(ORDERS_0, 0, "a").build()));
        mock.schedulePollTask(() -> mock.addRecord(live(ORDERS_0, 1, "b").build()));
        mock.schedulePollTask(relay::shutdown);
        relay.consume(handler);

        assertEquals(2, handled.size());
        // the crashed record is neither retried nor committed
        assertTrue(published.isEmpty());
        assertEquals(List.of(offset(ORDERS_0, 2)), mock.commits);
        assertEquals(1.0, metrics.count(Supervisor.METRIC_RESTARTS));
    }

    @Test
    void pollError_shouldBeCountedAndSurvived() {
        mock.schedulePollTask(() -> mock.setPollException(new KafkaException("broker gone")));
        mock.schedulePollTask(() -> mock.addRecord(live(ORDERS_0, 0, "a").build()));
        mock.schedulePollTask(relay::shutdown);

        relay.consume(succeeding());

        assertEquals(1, handled.size());
        assertEquals(1.0, metrics.count(RelayConsumer.METRIC_POLL_ERRORS));
        assertEquals(0.0, metrics.count(Supervisor.METRIC_RESTARTS));
    }

    @Test
    void closeDuringLoop_shouldCloseClientOnExit() {
        mock.schedulePollTask(relay::close);

        relay.consume(succeeding());

        assertTrue(mock.closed());
        assertFalse(relay.isRunning());
    }

    @Test
    void close_shouldCloseIdleClient() {
        relay.close();
        relay.close();

        assertTrue(mock.closed());
        assertFalse(relay.isRunning());
    }
}
