/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.core;

import java.util.Objects;

/**
 * Supplies the deployment scope (environment tag) stamped on produced records and
 * compared against consumed ones.
 */
@FunctionalInterface
public interface ScopeProvider {

    String ENV_SCOPE = "SCOPE";
    String P_SCOPE = "streamrelay.scope";
    String DEFAULT_SCOPE = "local";

    String scope();

    static ScopeProvider fixed(String scope) {
        Objects.requireNonNull(scope, "scope");
        return () -> scope;
    }

    /** {@code -Dstreamrelay.scope}, then env {@code SCOPE}, then {@value #DEFAULT_SCOPE}. */
    static ScopeProvider fromEnvironment() {
        String s = System.getProperty(P_SCOPE);
        if (s == null || s.isBlank()) s = System.getenv(ENV_SCOPE);
        return fixed((s == null || s.isBlank()) ? DEFAULT_SCOPE : s.trim());
    }
}
