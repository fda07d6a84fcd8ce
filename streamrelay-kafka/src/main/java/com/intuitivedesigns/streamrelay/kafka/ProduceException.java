/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.kafka;

import com.intuitivedesigns.streamrelay.error.ErrorCode;
import com.intuitivedesigns.streamrelay.error.RelayException;

/** A record could not be written to the broker. */
public class ProduceException extends RelayException {

    private final String topic;

    public ProduceException(String topic, String message, Throwable cause) {
        super(ErrorCode.PRODUCER, message, cause);
        this.topic = topic;
    }

    public String topic() {
        return topic;
    }
}
