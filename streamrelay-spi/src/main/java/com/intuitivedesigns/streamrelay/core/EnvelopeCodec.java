/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.core;

import com.intuitivedesigns.streamrelay.error.CodecException;

/**
 * Turns envelopes into record values and back.
 *
 * <p>Implementations must be thread-safe. {@link #decode(byte[])} is also where payload
 * types are validated, so an unknown type surfaces as a {@link CodecException} with code
 * {@code INVALID_PAYLOAD_TYPE}.</p>
 */
public interface EnvelopeCodec {

    byte[] encode(Envelope envelope) throws CodecException;

    Envelope decode(byte[] value) throws CodecException;

    default String id() {
        return getClass().getSimpleName();
    }
}
