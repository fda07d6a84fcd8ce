/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.spi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Plugins of one SPI type discovered with {@link ServiceLoader}, keyed by upper-cased id.
 * The classpath is scanned once, in the constructor.
 *
 * @param <T> plugin interface, e.g. {@link CodecPlugin}
 */
public final class ServicePluginRegistry<T extends RelayPlugin<?>> {

    private static final Logger log = LoggerFactory.getLogger(ServicePluginRegistry.class);

    private final String spiName;
    private final Map<String, T> plugins;

    public ServicePluginRegistry(Class<T> spiType) {
        this(spiType, defaultClassLoader());
    }

    /**
     * @throws IllegalStateException when a plugin has a blank id or two plugins share one
     */
    public ServicePluginRegistry(Class<T> spiType, ClassLoader cl) {
        this.spiName = spiType.getSimpleName();
        final Map<String, T> found = new TreeMap<>();
        for (T plugin : ServiceLoader.load(spiType, cl)) {
            final String id = normalizeId(plugin.id());
            if (id.isEmpty()) {
                throw new IllegalStateException(spiName + " " + plugin.getClass().getName() + " has a blank id");
            }
            final T clash = found.putIfAbsent(id, plugin);
            if (clash != null) {
                throw new IllegalStateException("Duplicate " + spiName + " id '" + id + "': "
                        + clash.getClass().getName() + " and " + plugin.getClass().getName());
            }
        }
        this.plugins = Map.copyOf(found);
        log.debug("Discovered {} plugins: {}", spiName, found.keySet());
    }

    /**
     * @param configKey config key the id was read from, used in the error message
     * @throws IllegalArgumentException when no plugin has this id
     */
    public T require(String id, String configKey) {
        return find(id).orElseThrow(() -> new IllegalArgumentException(
                "No " + spiName + " for '" + configKey + "=" + id + "'. Available: " + availableIds()));
    }

    public Optional<T> find(String id) {
        return Optional.ofNullable(plugins.get(normalizeId(id)));
    }

    public Set<String> availableIds() {
        return new TreeSet<>(plugins.keySet());
    }

    static String normalizeId(String id) {
        return id == null ? "" : id.trim().toUpperCase(Locale.ROOT);
    }

    private static ClassLoader defaultClassLoader() {
        final ClassLoader tccl = Thread.currentThread().getContextClassLoader();
        return tccl != null ? tccl : ServicePluginRegistry.class.getClassLoader();
    }
}
