/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.kafka;

import com.intuitivedesigns.streamrelay.config.RelayConfig;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.config.SaslConfigs;
import org.apache.kafka.common.config.SslConfigs;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Connection bootstrap shared by producer and consumer clients: brokers, client id,
 * timeouts, compression, SASL and TLS.
 *
 * <p>Only translates settings into kafka-clients {@link Properties}. Each client built from
 * these properties is a separate connection owned by whoever created it.</p>
 */
public record KafkaClientSettings(
        List<String> brokers,
        String clientId,
        Duration retryBackoff,
        Duration requestTimeout,
        String compression,
        Sasl sasl,
        Tls tls
) {

    // Config keys
    static final String CFG_BROKERS = "kafka.brokers";
    static final String CFG_CLIENT_ID = "kafka.client.id";
    static final String CFG_RETRY_BACKOFF = "kafka.retry.backoff";
    static final String CFG_REQUEST_TIMEOUT = "kafka.request.timeout";
    static final String CFG_COMPRESSION = "kafka.compression";

    static final String CFG_SASL_MECHANISM = "kafka.sasl.mechanism";
    static final String CFG_SASL_USERNAME = "kafka.sasl.username";
    static final String CFG_SASL_PASSWORD = "kafka.sasl.password";

    static final String CFG_TLS_ENABLED = "kafka.tls.enabled";
    static final String CFG_TLS_INSECURE = "kafka.tls.insecure";
    static final String CFG_TLS_CERT_FILE = "kafka.tls.cert.file";
    static final String CFG_TLS_KEY_FILE = "kafka.tls.key.file";
    static final String CFG_TLS_CA_FILE = "kafka.tls.ca.file";
    static final String CFG_TLS_CERT_BASE64 = "kafka.tls.cert.base64";
    static final String CFG_TLS_KEY_BASE64 = "kafka.tls.key.base64";
    static final String CFG_TLS_CA_BASE64 = "kafka.tls.ca.base64";

    // Defaults
    static final String DEFAULT_BROKERS = "localhost:9092";
    static final String DEFAULT_CLIENT_ID = "streamrelay-client";
    static final Duration DEFAULT_RETRY_BACKOFF = Duration.ofSeconds(1);
    static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    static final String DEFAULT_COMPRESSION = "none";

    private static final List<String> COMPRESSIONS = List.of("none", "gzip", "snappy", "lz4", "zstd");

    public KafkaClientSettings {
        if (brokers == null || brokers.isEmpty()) {
            throw new IllegalArgumentException("At least one broker is required");
        }
        brokers = List.copyOf(brokers);
        clientId = (clientId == null || clientId.isBlank()) ? DEFAULT_CLIENT_ID : clientId.trim();
        if (retryBackoff == null) retryBackoff = DEFAULT_RETRY_BACKOFF;
        if (requestTimeout == null) requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        compression = (compression == null || compression.isBlank())
                ? DEFAULT_COMPRESSION
                : compression.trim().toLowerCase(Locale.ROOT);
        if (!COMPRESSIONS.contains(compression)) {
            throw new IllegalArgumentException("Unsupported compression '" + compression + "'. Expected one of " + COMPRESSIONS);
        }
    }

    public static KafkaClientSettings of(String... brokers) {
        return new KafkaClientSettings(List.of(brokers), null, null, null, null, null, null);
    }

    public static KafkaClientSettings fromConfig(RelayConfig config) {
        Objects.requireNonNull(config, "config");

        Sasl sasl = null;
        final String mechanism = config.getString(CFG_SASL_MECHANISM, null);
        if (mechanism != null) {
            sasl = new Sasl(mechanism,
                    config.getString(CFG_SASL_USERNAME, ""),
                    config.getString(CFG_SASL_PASSWORD, ""));
        }

        Tls tls = null;
        if (config.getBoolean(CFG_TLS_ENABLED, false)) {
            tls = new Tls(true,
                    config.getBoolean(CFG_TLS_INSECURE, false),
                    config.getString(CFG_TLS_CERT_FILE, null),
                    config.getString(CFG_TLS_KEY_FILE, null),
                    config.getString(CFG_TLS_CA_FILE, null),
                    config.getString(CFG_TLS_CERT_BASE64, null),
                    config.getString(CFG_TLS_KEY_BASE64, null),
                    config.getString(CFG_TLS_CA_BASE64, null));
        }

        return new KafkaClientSettings(
                config.getList(CFG_BROKERS, List.of(DEFAULT_BROKERS)),
                config.getString(CFG_CLIENT_ID, DEFAULT_CLIENT_ID),
                config.getDuration(CFG_RETRY_BACKOFF, DEFAULT_RETRY_BACKOFF),
                config.getDuration(CFG_REQUEST_TIMEOUT, DEFAULT_REQUEST_TIMEOUT),
                config.getString(CFG_COMPRESSION, DEFAULT_COMPRESSION),
                sasl,
                tls);
    }

    /** Connection-level properties common to producers and consumers. */
    public Properties baseProperties() {
        final Properties props = new Properties();

        props.put(CommonClientConfigs.BOOTSTRAP_SERVERS_CONFIG, String.join(",", brokers));
        props.put(CommonClientConfigs.CLIENT_ID_CONFIG, clientId);
        props.put(CommonClientConfigs.RETRY_BACKOFF_MS_CONFIG, Long.toString(retryBackoff.toMillis()));
        props.put(CommonClientConfigs.REQUEST_TIMEOUT_MS_CONFIG, Integer.toString(saturatedMillis(requestTimeout)));

        final boolean tlsOn = tls != null && tls.enabled();
        if (sasl != null) {
            props.put(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, tlsOn ? "SASL_SSL" : "SASL_PLAINTEXT");
            props.put(SaslConfigs.SASL_MECHANISM, sasl.mechanism());
            props.put(SaslConfigs.SASL_JAAS_CONFIG, sasl.jaasConfig());
        } else if (tlsOn) {
            props.put(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, "SSL");
        }

        if (tlsOn) {
            tls.applyTo(props);
        }

        return props;
    }

    public Properties producerProperties(ProducerSettings producer) {
        Objects.requireNonNull(producer, "producer");
        final Properties props = baseProperties();

        props.put(ProducerConfig.CLIENT_ID_CONFIG, producer.producerId());
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, Boolean.toString(producer.idempotent()));
        props.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, compression);

        // Broker-side limit still applies; this only lifts the client default when asked to.
        if (producer.maxMessageSize() > 0) {
            props.put(ProducerConfig.MAX_REQUEST_SIZE_CONFIG, Integer.toString(Math.max(producer.maxMessageSize(), 1_048_576)));
        }
        return props;
    }

    public Properties consumerProperties(ConsumerSettings consumer) {
        Objects.requireNonNull(consumer, "consumer");
        final Properties props = baseProperties();

        props.put(ConsumerConfig.GROUP_ID_CONFIG, consumer.consumerGroup());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, consumer.startOffset().resetPolicy());
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, Boolean.toString(consumer.autoCommit()));
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, Integer.toString(consumer.maxBatchSize()));
        return props;
    }

    private static int saturatedMillis(Duration d) {
        return (int) Math.min(Integer.MAX_VALUE, Math.max(0L, d.toMillis()));
    }

    @Override
    public String toString() {
        return "KafkaClientSettings{brokers=" + brokers +
                ", clientId='" + clientId + '\'' +
                ", retryBackoff=" + retryBackoff +
                ", requestTimeout=" + requestTimeout +
                ", compression='" + compression + '\'' +
                ", sasl=" + (sasl == null ? "off" : sasl.mechanism()) +
                ", tls=" + (tls != null && tls.enabled() ? "on" : "off") +
                '}';
    }

    /** SASL credentials. Mechanisms: PLAIN, SCRAM-SHA-256, SCRAM-SHA-512. */
    public record Sasl(String mechanism, String username, String password) {

        public Sasl {
            Objects.requireNonNull(mechanism, "mechanism");
            mechanism = mechanism.trim().toUpperCase(Locale.ROOT);
            if (!mechanism.equals("PLAIN") && !mechanism.equals("SCRAM-SHA-256") && !mechanism.equals("SCRAM-SHA-512")) {
                throw new IllegalArgumentException("Unsupported SASL mechanism '" + mechanism + "'");
            }
            username = username == null ? "" : username;
            password = password == null ? "" : password;
        }

        String jaasConfig() {
            final String module = mechanism.equals("PLAIN")
                    ? "org.apache.kafka.common.security.plain.PlainLoginModule"
                    : "org.apache.kafka.common.security.scram.ScramLoginModule";
            return module + " required username=\"" + escape(username) + "\" password=\"" + escape(password) + "\";";
        }

        private static String escape(String s) {
            return s.replace("\\", "\\\\").replace("\"", "\\\"");
        }

        @Override
        public String toString() {
            return "Sasl{mechanism='" + mechanism + "', username='" + username + "', password=****}";
        }
    }

    /**
     * TLS material. Certificates and keys are PEM, either as file paths or as base64 encoded
     * PEM text; base64 values win over files. Private keys must be PKCS#8.
     */
    public record Tls(
            boolean enabled,
            boolean insecureSkipVerify,
            String certFile,
            String keyFile,
            String caFile,
            String certBase64,
            String keyBase64,
            String caBase64
    ) {

        void applyTo(Properties props) {
            if (insecureSkipVerify) {
                // kafka-clients can only switch off hostname verification, not chain validation
                props.put(SslConfigs.SSL_ENDPOINT_IDENTIFICATION_ALGORITHM_CONFIG, "");
            }

            final String ca = firstPem(caBase64, caFile, "CA");
            if (ca != null) {
                props.put(SslConfigs.SSL_TRUSTSTORE_TYPE_CONFIG, "PEM");
                props.put(SslConfigs.SSL_TRUSTSTORE_CERTIFICATES_CONFIG, ca);
            }

            final String cert = firstPem(certBase64, certFile, "certificate");
            final String key = firstPem(keyBase64, keyFile, "key");
            if (cert != null && key != null) {
                props.put(SslConfigs.SSL_KEYSTORE_TYPE_CONFIG, "PEM");
                props.put(SslConfigs.SSL_KEYSTORE_CERTIFICATE_CHAIN_CONFIG, cert);
                props.put(SslConfigs.SSL_KEYSTORE_KEY_CONFIG, key);
            }
        }

        private static String firstPem(String base64, String file, String what) {
            if (base64 != null && !base64.isBlank()) {
                return new String(decodeBase64(base64, what), StandardCharsets.UTF_8);
            }
            if (file != null && !file.isBlank()) {
                try {
                    return Files.readString(Path.of(file.trim()), StandardCharsets.UTF_8);
                } catch (IOException e) {
                    throw new IllegalArgumentException("Unable to read TLS " + what + " file: " + file, e);
                }
            }
            return null;
        }

        @Override
        public String toString() {
            return "Tls{enabled=" + enabled + ", insecureSkipVerify=" + insecureSkipVerify + '}';
        }
    }

    static byte[] decodeBase64(String value, String what) {
        try {
            return Base64.getDecoder().decode(value.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("TLS " + what + " is not valid base64", e);
        }
    }
}
