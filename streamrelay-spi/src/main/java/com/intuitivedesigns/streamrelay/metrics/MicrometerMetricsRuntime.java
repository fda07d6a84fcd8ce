/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer bridge.
 *
 * <p>Meters live in a composite registry that always holds a {@link SimpleMeterRegistry}, so
 * counts can be read back with {@link #count(String)} without any exporter. Exporters are
 * attached with {@link #addRegistry(MeterRegistry)}. Every meter carries the common tags.</p>
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final CompositeMeterRegistry registry = new CompositeMeterRegistry();
    private final Tags commonTags;
    private final Map<String, GaugeCell> gauges = new ConcurrentHashMap<>();

    public MicrometerMetricsRuntime() {
        this(Map.of());
    }

    public MicrometerMetricsRuntime(Map<String, String> commonTags) {
        Objects.requireNonNull(commonTags, "commonTags");
        Tags tags = Tags.empty();
        for (Map.Entry<String, String> e : commonTags.entrySet()) {
            tags = tags.and(e.getKey(), e.getValue());
        }
        this.commonTags = tags;
        registry.add(new SimpleMeterRegistry());
    }

    public void addRegistry(MeterRegistry exporter) {
        registry.add(Objects.requireNonNull(exporter, "exporter"));
        log.info("Attached meter registry {}", exporter.getClass().getSimpleName());
    }

    @Override
    public Object registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return "MICROMETER";
    }

    @Override
    public void counter(String name) {
        counter(name, 1.0);
    }

    @Override
    public void counter(String name, double increment) {
        if (increment <= 0) return;
        Counter.builder(name).tags(commonTags).register(registry).increment(increment);
    }

    @Override
    public void timer(String name, long durationMillis) {
        registry.timer(name, commonTags).record(Duration.ofMillis(Math.max(0L, durationMillis)));
    }

    /** Last-value gauge: the first call registers it, later calls overwrite the value. */
    @Override
    public void gauge(String name, double value) {
        gauges.computeIfAbsent(name, key -> {
            final GaugeCell cell = new GaugeCell();
            Gauge.builder(key, cell, GaugeCell::get).tags(commonTags).register(registry);
            return cell;
        }).set(value);
    }

    /** Current count of a counter, 0 when it was never incremented. */
    public double count(String name) {
        final Counter c = registry.find(name).counter();
        return c == null ? 0.0 : c.count();
    }

    @Override
    public void close() {
        registry.close();
        log.info("Metrics runtime closed.");
    }

    private static final class GaugeCell {
        private volatile double value;

        double get() {
            return value;
        }

        void set(double v) {
            value = v;
        }
    }
}
