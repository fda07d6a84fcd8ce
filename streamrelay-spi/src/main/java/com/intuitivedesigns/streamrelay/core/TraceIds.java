/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.core;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Trace id helpers. The active trace id lives in the SLF4J MDC under {@link #MDC_KEY}.
 */
public final class TraceIds {

    public static final String MDC_KEY = "trace_id";

    private TraceIds() {}

    public static String newTraceId() {
        return UUID.randomUUID().toString();
    }

    /** Trace id bound to the current thread, or {@code null}. */
    public static String current() {
        return MDC.get(MDC_KEY);
    }

    public static String currentOrNew() {
        final String t = current();
        return (t == null || t.isBlank()) ? newTraceId() : t;
    }

    /** Binds {@code traceId} for the lifetime of the returned handle. */
    public static MDC.MDCCloseable bind(String traceId) {
        return MDC.putCloseable(MDC_KEY, traceId);
    }
}
