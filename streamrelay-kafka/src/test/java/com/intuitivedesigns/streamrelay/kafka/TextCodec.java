/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.kafka;

import com.intuitivedesigns.streamrelay.core.Envelope;
import com.intuitivedesigns.streamrelay.core.EnvelopeCodec;
import com.intuitivedesigns.streamrelay.error.CodecException;

import java.nio.charset.StandardCharsets;

/** {@code payloadType|id|payload}. A payload of {@code poison} cannot be encoded. */
final class TextCodec implements EnvelopeCodec {

    static final String POISON = "poison";

    @Override
    public byte[] encode(Envelope envelope) {
        if (POISON.equals(envelope.payload())) {
            throw new CodecException("cannot encode poison payload", null);
        }
        return (envelope.payloadType() + "|" + envelope.id() + "|" + envelope.payload()).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public Envelope decode(byte[] value) {
        final String[] parts = new String(value, StandardCharsets.UTF_8).split("\\|", 3);
        if (parts.length < 3) {
            throw new CodecException("not a text envelope", null);
        }
        return new Envelope(parts[1], parts[0], parts[2]);
    }

    static byte[] bytes(String payloadType, String id, String payload) {
        return (payloadType + "|" + id + "|" + payload).getBytes(StandardCharsets.UTF_8);
    }
}
