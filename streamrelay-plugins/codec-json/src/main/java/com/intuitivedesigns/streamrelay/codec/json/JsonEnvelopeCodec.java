/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.codec.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.intuitivedesigns.streamrelay.core.Envelope;
import com.intuitivedesigns.streamrelay.core.EnvelopeCodec;
import com.intuitivedesigns.streamrelay.error.CodecException;
import com.intuitivedesigns.streamrelay.error.ErrorCode;

import java.io.IOException;
import java.time.Instant;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JSON wire format for envelopes:
 *
 * <pre>
 * {"id":"evt-1","timestamp":"2025-01-01T00:00:00Z","headers":{},"payload_type":"order.created","payload":{...}}
 * </pre>
 *
 * <p>Payloads of registered types are bound to their class; other payloads stay a {@link JsonNode}.
 * In strict mode an unregistered payload type is rejected with
 * {@link ErrorCode#INVALID_PAYLOAD_TYPE}.</p>
 */
public final class JsonEnvelopeCodec implements EnvelopeCodec {

    static final String F_ID = "id";
    static final String F_TIMESTAMP = "timestamp";
    static final String F_HEADERS = "headers";
    static final String F_PAYLOAD_TYPE = "payload_type";
    static final String F_PAYLOAD = "payload";

    private final ObjectMapper json;
    private final PayloadTypeRegistry registry;
    private final boolean strictTypes;

    public JsonEnvelopeCodec() {
        this(new PayloadTypeRegistry(), false);
    }

    public JsonEnvelopeCodec(PayloadTypeRegistry registry, boolean strictTypes) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.strictTypes = strictTypes;
        this.json = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public String id() {
        return "JSON";
    }

    public boolean strictTypes() {
        return strictTypes;
    }

    @Override
    public byte[] encode(Envelope envelope) {
        Objects.requireNonNull(envelope, "envelope");
        try {
            final ObjectNode root = json.createObjectNode();
            root.put(F_ID, envelope.id());
            root.set(F_TIMESTAMP, json.valueToTree(envelope.timestamp()));
            final ObjectNode headers = root.putObject(F_HEADERS);
            envelope.headers().forEach(headers::put);
            root.put(F_PAYLOAD_TYPE, envelope.payloadType());
            root.set(F_PAYLOAD, json.valueToTree(envelope.payload()));
            return json.writeValueAsBytes(root);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CodecException(ErrorCode.SERIALIZATION,
                    "error serializing envelope " + envelope.id() + ": " + e.getMessage(), F_PAYLOAD, e);
        }
    }

    @Override
    public Envelope decode(byte[] value) {
        if (value == null || value.length == 0) {
            throw new CodecException("empty message", null);
        }

        final JsonNode root;
        try {
            root = json.readTree(value);
        } catch (IOException e) {
            throw new CodecException("malformed JSON envelope: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new CodecException("envelope must be a JSON object", null);
        }

        final String payloadType = requiredText(root, F_PAYLOAD_TYPE);
        final String id = requiredText(root, F_ID);
        final Instant timestamp = timestamp(root.get(F_TIMESTAMP));
        final Map<String, String> headers = headers(root.get(F_HEADERS));
        final Object payload = payload(payloadType, root.get(F_PAYLOAD));

        return new Envelope(id, payloadType, payload, timestamp, headers);
    }

    private Object payload(String payloadType, JsonNode node) {
        final Optional<Class<?>> bound = registry.lookup(payloadType);
        if (bound.isEmpty()) {
            if (strictTypes) throw CodecException.invalidPayloadType(payloadType);
            return (node == null || node.isNull()) ? null : node;
        }
        if (node == null || node.isNull()) return null;
        try {
            return json.treeToValue(node, bound.get());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CodecException(ErrorCode.DESERIALIZATION,
                    "payload does not match " + bound.get().getSimpleName() + " for type " + payloadType, F_PAYLOAD, e);
        }
    }

    private Instant timestamp(JsonNode node) {
        if (node == null || node.isNull()) return null;
        try {
            return json.treeToValue(node, Instant.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CodecException(ErrorCode.DESERIALIZATION, "invalid timestamp: " + node, F_TIMESTAMP, e);
        }
    }

    private static Map<String, String> headers(JsonNode node) {
        if (node == null || node.isNull()) return Map.of();
        if (!node.isObject()) {
            throw new CodecException(ErrorCode.DESERIALIZATION, "headers must be an object", F_HEADERS, null);
        }
        final Map<String, String> out = new HashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            final Map.Entry<String, JsonNode> e = it.next();
            final JsonNode v = e.getValue();
            if (v == null || v.isNull()) continue;
            out.put(e.getKey(), v.isValueNode() ? v.asText() : v.toString());
        }
        return out;
    }

    private static String requiredText(JsonNode root, String field) {
        final JsonNode node = root.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new CodecException(ErrorCode.DESERIALIZATION, "missing or empty '" + field + "'", field, null);
        }
        return node.asText();
    }
}
