/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.kafka;

import java.util.Locale;

/** Where a consumer group without committed offsets starts reading. */
public enum StartOffset {
    EARLIEST,
    LATEST;

    /** Value for {@code auto.offset.reset}. */
    public String resetPolicy() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static StartOffset parse(String raw, StartOffset def) {
        if (raw == null || raw.isBlank()) return def;
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "earliest":
                return EARLIEST;
            case "latest":
                return LATEST;
            default:
                throw new IllegalArgumentException("Unknown start offset '" + raw + "'. Expected earliest|latest");
        }
    }
}
