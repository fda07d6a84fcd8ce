/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.error;

/**
 * Envelope encode/decode failure.
 *
 * {@code field} names the part of the payload that failed (for example {@code payload_type})
 * when the codec can tell.
 */
public class CodecException extends RelayException {

    private final String field;

    public CodecException(String message, Throwable cause) {
        this(ErrorCode.DESERIALIZATION, message, null, cause);
    }

    public CodecException(ErrorCode code, String message, String field, Throwable cause) {
        super(code, message, cause);
        this.field = field;
    }

    public static CodecException invalidPayloadType(String payloadType) {
        return new CodecException(ErrorCode.INVALID_PAYLOAD_TYPE,
                "event type " + payloadType + " not registered", "payload_type", null);
    }

    public String field() {
        return field;
    }
}
