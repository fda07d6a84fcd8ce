/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.core;

/**
 * User callback invoked once per decoded envelope.
 *
 * <p>Returning normally acknowledges the message. Throwing routes it to the retry path;
 * throw a {@link com.intuitivedesigns.streamrelay.error.RelayException} with
 * {@code NO_RETRY} or {@code PROCESS_FAILED_DO_NOT_REQUEUE} to drop it instead.</p>
 */
@FunctionalInterface
public interface EnvelopeHandler {

    void handle(MessageContext context, Envelope envelope) throws Exception;
}
