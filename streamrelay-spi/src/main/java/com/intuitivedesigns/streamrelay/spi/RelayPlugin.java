/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.spi;

import com.intuitivedesigns.streamrelay.config.RelayConfig;
import com.intuitivedesigns.streamrelay.metrics.MetricsRuntime;

/**
 * Base contract for every ServiceLoader-discovered component.
 *
 * @param <T> the component type the plugin builds
 */
public interface RelayPlugin<T> {

    String id(); // e.g. "JSON"

    T create(RelayConfig config, MetricsRuntime metrics) throws Exception;
}
