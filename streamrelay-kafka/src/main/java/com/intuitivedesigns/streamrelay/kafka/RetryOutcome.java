/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.kafka;

/** What the retry manager did with a failed record. */
public enum RetryOutcome {
    /** A copy was published to the retry topic. */
    RETRIED,
    /** A copy was published to the dead letter topic. */
    DEAD_LETTERED,
    /** Retry is disabled or has no publisher; nothing was written. */
    SKIPPED
}
