/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.codec.json;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps payload type tags to the Java class their payload is bound to.
 * Types without a mapping decode to a Jackson tree, unless the codec runs in strict mode.
 */
public final class PayloadTypeRegistry {

    private final Map<String, Class<?>> types = new ConcurrentHashMap<>();

    public PayloadTypeRegistry register(String payloadType, Class<?> payloadClass) {
        if (payloadType == null || payloadType.isBlank()) {
            throw new IllegalArgumentException("payloadType is required");
        }
        Objects.requireNonNull(payloadClass, "payloadClass");
        final Class<?> previous = types.putIfAbsent(payloadType.trim(), payloadClass);
        if (previous != null && previous != payloadClass) {
            throw new IllegalStateException("Payload type '" + payloadType + "' already bound to " + previous.getName());
        }
        return this;
    }

    public Optional<Class<?>> lookup(String payloadType) {
        return payloadType == null ? Optional.empty() : Optional.ofNullable(types.get(payloadType));
    }

    public boolean contains(String payloadType) {
        return payloadType != null && types.containsKey(payloadType);
    }

    public Set<String> payloadTypes() {
        return Collections.unmodifiableSet(types.keySet());
    }

    /**
     * Parses {@code order.created=com.acme.OrderCreated,order.cancelled=com.acme.OrderCancelled}.
     *
     * @throws IllegalArgumentException on a malformed entry or a class that cannot be loaded
     */
    public static PayloadTypeRegistry parse(String mappings, ClassLoader cl) {
        final PayloadTypeRegistry registry = new PayloadTypeRegistry();
        if (mappings == null || mappings.isBlank()) return registry;

        for (String entry : mappings.split(",")) {
            final String e = entry.trim();
            if (e.isEmpty()) continue;

            final int eq = e.indexOf('=');
            if (eq <= 0 || eq == e.length() - 1) {
                throw new IllegalArgumentException("Invalid payload type mapping '" + e + "'. Expected type=fully.qualified.Class");
            }
            final String type = e.substring(0, eq).trim();
            final String className = e.substring(eq + 1).trim();
            try {
                registry.register(type, Class.forName(className, false, cl));
            } catch (ClassNotFoundException ex) {
                throw new IllegalArgumentException("Payload class not found for '" + type + "': " + className, ex);
            }
        }
        return registry;
    }
}
