/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.error;

import java.util.Objects;

/**
 * Base unchecked exception. Handlers throw it (or a subclass) to tell the consumer how a
 * failure should be treated; any other exception counts as a generic processing failure.
 */
public class RelayException extends RuntimeException {

    private final ErrorCode code;

    public RelayException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public RelayException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode code() {
        return code;
    }

    public static RelayException noRetry(String message, Throwable cause) {
        return new RelayException(ErrorCode.NO_RETRY, message, cause);
    }

    public static RelayException doNotRequeue(String message) {
        return new RelayException(ErrorCode.PROCESS_FAILED_DO_NOT_REQUEUE, message);
    }

    public static RelayException processing(String message, Throwable cause) {
        return new RelayException(ErrorCode.PROCESSING_EVENT, message, cause);
    }

    public static RelayException invalidScope(String message) {
        return new RelayException(ErrorCode.INVALID_SCOPE_REQUEUE, message);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + code + "]: " + getMessage();
    }
}
