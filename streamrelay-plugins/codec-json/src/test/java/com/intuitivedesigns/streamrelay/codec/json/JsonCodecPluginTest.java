/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.codec.json;

import com.intuitivedesigns.streamrelay.config.RelayConfig;
import com.intuitivedesigns.streamrelay.core.EnvelopeCodec;
import com.intuitivedesigns.streamrelay.metrics.MetricsRuntime;
import com.intuitivedesigns.streamrelay.spi.CodecPlugin;
import com.intuitivedesigns.streamrelay.spi.ServicePluginRegistry;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonCodecPluginTest {

    @Test
    void serviceLoader_shouldDiscoverJsonCodec() {
        ServicePluginRegistry<CodecPlugin> registry = new ServicePluginRegistry<>(CodecPlugin.class);

        assertTrue(registry.availableIds().contains("JSON"));
        assertInstanceOf(JsonCodecPlugin.class, registry.require("json", CodecPlugin.KEY_CODEC));
    }

    @Test
    void load_shouldBuildConfiguredCodec() throws Exception {
        RelayConfig config = RelayConfig.fromMap(Map.of(
                "streamrelay.codec", "json",
                "codec.json.strict.types", "true",
                "codec.json.types", "order.created=" + OrderCreated.class.getName()));

        EnvelopeCodec codec = CodecPlugin.load(config, MetricsRuntime.noop());

        JsonEnvelopeCodec json = assertInstanceOf(JsonEnvelopeCodec.class, codec);
        assertEquals("JSON", json.id());
        assertTrue(json.strictTypes());
    }

    @Test
    void load_shouldFailForUnknownCodec() {
        RelayConfig config = RelayConfig.fromMap(Map.of("streamrelay.codec", "avro"));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CodecPlugin.load(config, MetricsRuntime.noop()));
        assertTrue(e.getMessage().contains("streamrelay.codec=avro"));
    }
}
