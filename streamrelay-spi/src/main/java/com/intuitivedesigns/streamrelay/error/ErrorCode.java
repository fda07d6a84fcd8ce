/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.error;

/**
 * Failure classification understood by the consumer pipeline.
 *
 * <p>The consumer never looks at exception messages, only at the code resolved by
 * {@link #classify(Throwable)}.</p>
 */
public enum ErrorCode {

    /** Record belongs to another deployment scope. Requeued, eventually dropped by deadline. */
    INVALID_SCOPE_REQUEUE(true),

    /** Handler says processing failed and a retry cannot help. */
    PROCESS_FAILED_DO_NOT_REQUEUE(false),

    /** Non-retriable failure (malformed input, permanently invalid data). */
    NO_RETRY(false),

    /** Generic processing failure. */
    PROCESSING_EVENT(true),

    /** Payload bytes could not be decoded into an envelope. */
    DESERIALIZATION(false),

    /** Envelope could not be encoded for publishing. */
    SERIALIZATION(false),

    /** Payload type is not known to the codec. */
    INVALID_PAYLOAD_TYPE(false),

    /** Broker publish failed. */
    PRODUCER(true),

    /** Exception carried no code. Treated like a generic processing failure. */
    UNKNOWN(true);

    private final boolean requeueEligible;

    ErrorCode(boolean requeueEligible) {
        this.requeueEligible = requeueEligible;
    }

    public boolean requeueEligible() {
        return requeueEligible;
    }

    /**
     * Walks the cause chain and returns the first code found.
     * A {@code null} throwable or a chain without any {@link RelayException} yields {@link #UNKNOWN}.
     */
    public static ErrorCode classify(Throwable error) {
        Throwable t = error;
        int depth = 0;
        while (t != null && depth++ < 32) {
            if (t instanceof RelayException re) {
                return re.code();
            }
            if (t.getCause() == t) break;
            t = t.getCause();
        }
        return UNKNOWN;
    }

    /** True if any exception in the cause chain carries {@code code}. */
    public static boolean has(Throwable error, ErrorCode code) {
        Throwable t = error;
        int depth = 0;
        while (t != null && depth++ < 32) {
            if (t instanceof RelayException re && re.code() == code) {
                return true;
            }
            if (t.getCause() == t) break;
            t = t.getCause();
        }
        return false;
    }
}
