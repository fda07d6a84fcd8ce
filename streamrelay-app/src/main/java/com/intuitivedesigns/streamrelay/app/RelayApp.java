/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.streamrelay.config.RelayConfig;
import com.intuitivedesigns.streamrelay.core.Envelope;
import com.intuitivedesigns.streamrelay.core.EnvelopeCodec;
import com.intuitivedesigns.streamrelay.core.EnvelopeHandler;
import com.intuitivedesigns.streamrelay.core.ScopeProvider;
import com.intuitivedesigns.streamrelay.kafka.ConsumerSettings;
import com.intuitivedesigns.streamrelay.kafka.KafkaClientSettings;
import com.intuitivedesigns.streamrelay.kafka.ProducerSettings;
import com.intuitivedesigns.streamrelay.kafka.RelayConsumer;
import com.intuitivedesigns.streamrelay.kafka.RelayProducer;
import com.intuitivedesigns.streamrelay.kafka.RetryManager;
import com.intuitivedesigns.streamrelay.kafka.RetrySettings;
import com.intuitivedesigns.streamrelay.metrics.MetricsFactory;
import com.intuitivedesigns.streamrelay.metrics.MetricsRuntime;
import com.intuitivedesigns.streamrelay.spi.CodecPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public final class RelayApp {

    private static final Logger log = LoggerFactory.getLogger(RelayApp.class);

    private static final long SHUTDOWN_WAIT_SECONDS = 10L;

    private RelayApp() {}

    public static void main(String[] args) {
        final RelayCommand command;
        try {
            command = RelayCommand.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println(RelayCommand.USAGE);
            System.exit(2);
            return;
        }

        log.info("=== Booting StreamRelay ({}) ===", command.mode());

        final RelayConfig config = RelayConfig.get();
        final MetricsRuntime metrics = MetricsFactory.init(config);

        try {
            final EnvelopeCodec codec = CodecPlugin.load(config, metrics);
            final KafkaClientSettings connection = KafkaClientSettings.fromConfig(config);
            final ScopeProvider scope = ScopeProvider.fromEnvironment();

            log.info("CONFIG: codec={} scope={} {}", codec.id(), scope.scope(), connection);

            if (command.mode() == RelayCommand.Mode.PRODUCE) {
                produceOne(config, connection, codec, scope, metrics, command);
            } else {
                consume(config, connection, codec, scope, metrics, command.batch());
            }
        } catch (Exception e) {
            log.error("StreamRelay failed", e);
            System.exit(1);
        } finally {
            metrics.close();
        }
    }

    private static void produceOne(RelayConfig config,
                                   KafkaClientSettings connection,
                                   EnvelopeCodec codec,
                                   ScopeProvider scope,
                                   MetricsRuntime metrics,
                                   RelayCommand command) throws JsonProcessingException {
        final JsonNode payload = new ObjectMapper().readTree(command.payloadJson());
        final Envelope envelope = Envelope.of(command.payloadType(), payload);

        try (RelayProducer producer = RelayProducer.create(connection, ProducerSettings.fromConfig(config), codec, scope, metrics)) {
            producer.produce(envelope);
            log.info("Produced envelope id={} payloadType={} topic={}", envelope.id(), envelope.payloadType(), producer.topic());
        }
    }

    /**
     * Producer first, then the retry manager that publishes through it, then the consumer.
     * Closed in reverse order.
     */
    private static void consume(RelayConfig config,
                                KafkaClientSettings connection,
                                EnvelopeCodec codec,
                                ScopeProvider scope,
                                MetricsRuntime metrics,
                                boolean batch) {
        final ConsumerSettings consumerSettings = ConsumerSettings.fromConfig(config);
        final ProducerSettings producerSettings = ProducerSettings.fromConfig(config, consumerSettings.topics().get(0));

        try (RelayProducer producer = RelayProducer.create(connection, producerSettings, codec, scope, metrics)) {
            final RetryManager retryManager = new RetryManager(RetrySettings.fromConfig(config), producer, metrics);

            final CountDownLatch stopped = new CountDownLatch(1);
            final RelayConsumer consumer = RelayConsumer.create(connection, consumerSettings, codec, scope, retryManager, metrics);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                log.info("Shutdown signal received. Stopping consumer...");
                consumer.shutdown();
                try {
                    if (!stopped.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                        log.warn("Consumer did not stop within {}s", SHUTDOWN_WAIT_SECONDS);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }, "streamrelay-shutdown"));

            try {
                final EnvelopeHandler handler = loggingHandler();
                if (batch) {
                    consumer.consumeBatch(handler);
                } else {
                    consumer.consume(handler);
                }
            } finally {
                consumer.close();
                stopped.countDown();
            }
        }
    }

    private static EnvelopeHandler loggingHandler() {
        return (ctx, envelope) -> log.info("Envelope id={} payloadType={} topic={} partition={} offset={} retry={} payload={}",
                envelope.id(), envelope.payloadType(), ctx.topic(), ctx.partition(), ctx.offset(),
                ctx.retryCount(), envelope.payload());
    }
}
