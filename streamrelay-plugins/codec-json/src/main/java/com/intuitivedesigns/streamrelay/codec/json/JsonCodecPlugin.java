/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.codec.json;

import com.intuitivedesigns.streamrelay.config.RelayConfig;
import com.intuitivedesigns.streamrelay.core.EnvelopeCodec;
import com.intuitivedesigns.streamrelay.metrics.MetricsRuntime;
import com.intuitivedesigns.streamrelay.spi.CodecPlugin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class JsonCodecPlugin implements CodecPlugin {

    private static final Logger log = LoggerFactory.getLogger(JsonCodecPlugin.class);

    static final String CFG_STRICT_TYPES = "codec.json.strict.types";
    static final String CFG_TYPES = "codec.json.types";

    @Override
    public String id() {
        return "JSON";
    }

    @Override
    public EnvelopeCodec create(RelayConfig config, MetricsRuntime metrics) {
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = JsonCodecPlugin.class.getClassLoader();

        final PayloadTypeRegistry registry = PayloadTypeRegistry.parse(config.getString(CFG_TYPES, null), cl);
        final boolean strict = config.getBoolean(CFG_STRICT_TYPES, false);

        log.info("Initialized JSON envelope codec. strictTypes={} registeredTypes={}", strict, registry.payloadTypes());
        return new JsonEnvelopeCodec(registry, strict);
    }
}
