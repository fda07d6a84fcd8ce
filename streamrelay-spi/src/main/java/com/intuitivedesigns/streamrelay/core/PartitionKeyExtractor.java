/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.core;

import java.nio.charset.StandardCharsets;

/**
 * Computes the record key for an envelope. A {@code null} key leaves partitioning to the broker.
 */
@FunctionalInterface
public interface PartitionKeyExtractor {

    byte[] extract(Envelope envelope);

    static PartitionKeyExtractor byId() {
        return e -> e.id().getBytes(StandardCharsets.UTF_8);
    }

    static PartitionKeyExtractor byHeader(String header) {
        return e -> {
            final String v = e.header(header);
            return v == null ? null : v.getBytes(StandardCharsets.UTF_8);
        };
    }
}
