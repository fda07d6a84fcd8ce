/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.spi;

import com.intuitivedesigns.streamrelay.config.RelayConfig;
import com.intuitivedesigns.streamrelay.core.EnvelopeCodec;
import com.intuitivedesigns.streamrelay.metrics.MetricsRuntime;

/**
 * SPI for envelope codecs. Register implementations in
 * {@code META-INF/services/com.intuitivedesigns.streamrelay.spi.CodecPlugin}.
 */
public interface CodecPlugin extends RelayPlugin<EnvelopeCodec> {

    String KEY_CODEC = "streamrelay.codec";
    String DEFAULT_CODEC = "JSON";

    @Override
    EnvelopeCodec create(RelayConfig config, MetricsRuntime metrics) throws Exception;

    /** Resolves {@code streamrelay.codec} against the plugins visible to the context class loader. */
    static EnvelopeCodec load(RelayConfig config, MetricsRuntime metrics) throws Exception {
        final ServicePluginRegistry<CodecPlugin> registry = new ServicePluginRegistry<>(CodecPlugin.class);
        final String id = config.getString(KEY_CODEC, DEFAULT_CODEC);
        return registry.require(id, KEY_CODEC).create(config, metrics);
    }
}
