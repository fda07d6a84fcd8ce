/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.core;

import java.util.Objects;

/**
 * Request-scoped data handed to a handler together with the envelope.
 * A new trace id is generated for every dispatch.
 */
public record MessageContext(
        String traceId,
        String topic,
        int partition,
        long offset,
        int retryCount
) {

    public MessageContext {
        Objects.requireNonNull(traceId, "traceId");
        Objects.requireNonNull(topic, "topic");
    }
}
