/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.kafka;

import org.apache.kafka.clients.producer.ProducerRecord;

import java.util.List;

/**
 * Synchronous raw-record publishing, the only thing the retry manager needs from a producer.
 */
public interface RecordPublisher {

    /**
     * Sends every record and waits for the broker acknowledgements.
     *
     * @throws ProduceException for the first record that failed
     */
    void publish(List<ProducerRecord<byte[], byte[]>> records) throws ProduceException;

    default void publish(ProducerRecord<byte[], byte[]> record) throws ProduceException {
        publish(List.of(record));
    }
}
