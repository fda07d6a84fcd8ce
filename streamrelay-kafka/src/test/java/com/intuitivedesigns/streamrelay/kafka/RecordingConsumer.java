/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.kafka;

import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.TopicPartition;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** MockConsumer that remembers every explicit commit call. */
final class RecordingConsumer extends MockConsumer<byte[], byte[]> {

    final List<Map<TopicPartition, OffsetAndMetadata>> commits = new ArrayList<>();

    RecordingConsumer() {
        super(OffsetResetStrategy.EARLIEST);
    }

    @Override
    public synchronized void commitSync(Map<TopicPartition, OffsetAndMetadata> offsets) {
        commits.add(Map.copyOf(offsets));
        super.commitSync(offsets);
    }

    /** Assigns {@code partitions} starting at offset 0. */
    void assignAtStart(TopicPartition... partitions) {
        rebalance(List.of(partitions));
        final Map<TopicPartition, Long> begin = new HashMap<>();
        for (TopicPartition tp : partitions) begin.put(tp, 0L);
        updateBeginningOffsets(begin);
    }
}
