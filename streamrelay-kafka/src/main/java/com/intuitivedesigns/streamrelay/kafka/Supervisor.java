/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.kafka;

import com.intuitivedesigns.streamrelay.metrics.MetricsRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Relaunches a long-running task when it dies with an unexpected throwable.
 *
 * <p>Restarts are delayed exponentially (initial delay, doubling, capped). A task that stayed up
 * for at least the healthy window resets the delay and the consecutive restart count. With a
 * positive {@code maxConsecutiveRestarts} the supervisor gives up and rethrows once the bound is
 * exceeded; {@code 0} means unbounded.</p>
 */
public final class Supervisor {

    private static final Logger log = LoggerFactory.getLogger(Supervisor.class);

    static final String METRIC_RESTARTS = "streamrelay.consumer.restarts";

    static final Duration DEFAULT_INITIAL_DELAY = Duration.ofMillis(100);
    static final Duration DEFAULT_MAX_DELAY = Duration.ofSeconds(30);
    static final Duration DEFAULT_HEALTHY_WINDOW = Duration.ofSeconds(60);

    /** The supervised unit of work. Returning normally means it stopped on purpose. */
    @FunctionalInterface
    public interface Task {
        void run() throws Exception;
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration d) throws InterruptedException;
    }

    private final String name;
    private final MetricsRuntime metrics;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final Duration healthyWindow;
    private final int maxConsecutiveRestarts;
    private final Clock clock;
    private final Sleeper sleeper;

    public Supervisor(String name, MetricsRuntime metrics, int maxConsecutiveRestarts) {
        this(name, metrics, DEFAULT_INITIAL_DELAY, DEFAULT_MAX_DELAY, DEFAULT_HEALTHY_WINDOW,
                maxConsecutiveRestarts, Clock.systemUTC(), d -> Thread.sleep(d.toMillis()));
    }

    Supervisor(String name,
               MetricsRuntime metrics,
               Duration initialDelay,
               Duration maxDelay,
               Duration healthyWindow,
               int maxConsecutiveRestarts,
               Clock clock,
               Sleeper sleeper) {
        this.name = Objects.requireNonNull(name, "name");
        this.metrics = (metrics == null) ? MetricsRuntime.noop() : metrics;
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
        this.healthyWindow = Objects.requireNonNull(healthyWindow, "healthyWindow");
        if (maxConsecutiveRestarts < 0) {
            throw new IllegalArgumentException("maxConsecutiveRestarts must be >= 0");
        }
        this.maxConsecutiveRestarts = maxConsecutiveRestarts;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /**
     * Runs {@code task} until it returns normally or {@code keepRunning} turns false.
     *
     * @throws IllegalStateException when the restart bound is exceeded
     */
    public void run(Task task, BooleanSupplier keepRunning) {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(keepRunning, "keepRunning");

        Duration delay = initialDelay;
        int consecutive = 0;

        while (true) {
            final long startedMs = clock.millis();
            try {
                task.run();
                return;
            } catch (VirtualMachineError fatal) {
                throw fatal;
            } catch (Throwable t) {
                if (!keepRunning.getAsBoolean()) {
                    log.info("{} failed while stopping, not restarting: {}", name, t.toString());
                    return;
                }

                if (clock.millis() - startedMs >= healthyWindow.toMillis()) {
                    delay = initialDelay;
                    consecutive = 0;
                }
                consecutive++;

                if (maxConsecutiveRestarts > 0 && consecutive > maxConsecutiveRestarts) {
                    log.error("{} crashed {} times in a row, giving up", name, consecutive, t);
                    throw new IllegalStateException(name + " exceeded " + maxConsecutiveRestarts + " consecutive restarts", t);
                }

                metrics.counter(METRIC_RESTARTS);
                log.error("{} recovered from crash, restarting in {} ms (attempt {})", name, delay.toMillis(), consecutive, t);
            }

            try {
                sleeper.sleep(delay);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.info("{} interrupted during restart delay, stopping", name);
                return;
            }
            if (!keepRunning.getAsBoolean()) return;

            final Duration doubled = delay.multipliedBy(2);
            delay = doubled.compareTo(maxDelay) > 0 ? maxDelay : doubled;
        }
    }
}
