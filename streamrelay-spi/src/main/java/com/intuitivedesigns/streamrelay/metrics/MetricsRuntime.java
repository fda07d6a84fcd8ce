/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.metrics;

/**
 * Vendor-agnostic metrics contract used by the producer, consumer and retry manager.
 *
 * All instrumentation methods default to no-ops, so {@link #noop()} costs nothing.
 */
public interface MetricsRuntime extends AutoCloseable {

    /**
     * Underlying registry (a Micrometer {@code MeterRegistry} for the Micrometer runtime).
     */
    Object registry();

    default boolean enabled() { return false; }

    default String type() { return "NOOP"; }

    default void counter(String name) {}

    default void counter(String name, double increment) {}

    default void timer(String name, long durationMillis) {}

    default void gauge(String name, double value) {}

    @Override
    default void close() {
        // no-op by default
    }

    static MetricsRuntime noop() {
        return NoopHolder.NOOP;
    }

    final class NoopHolder {
        private static final Object SENTINEL = new Object();
        private static final MetricsRuntime NOOP = () -> SENTINEL;

        private NoopHolder() {}
    }
}
