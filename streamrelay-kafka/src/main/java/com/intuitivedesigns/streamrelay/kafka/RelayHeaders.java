/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.kafka;

import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;
import org.apache.kafka.common.header.internals.RecordHeader;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Record header protocol shared by producer, consumer and retry manager.
 *
 * <p>All values are UTF-8 strings. A key may appear more than once; readers here always
 * take the first occurrence.</p>
 */
public final class RelayHeaders {

    /** Unix millis after which the record is dropped instead of retried. Set once, never rewritten. */
    public static final String X_RETRY_UNTIL = "x-retry-until";
    /** Retry attempts so far. Absent means 0. */
    public static final String X_RETRY_COUNT = "x-retry-count";
    public static final String X_PAYLOAD_TYPE = "x-payload-type";
    public static final String X_EVENT_ID = "x-event-id";
    public static final String X_ORIGINAL_TOPIC = "x-original-topic";
    public static final String X_RETRY_REASON = "x-retry-reason";
    public static final String X_DLQ_REASON = "x-dlq-reason";
    /** RFC 3339, UTC, second precision. */
    public static final String X_DLQ_TIMESTAMP = "x-dlq-timestamp";

    public static final String SCOPE = "scope";
    public static final String TRACE_ID = "trace_id";

    private RelayHeaders() {}

    public static Header header(String key, String value) {
        return new RecordHeader(key, value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8));
    }

    /** First value for {@code key}, or {@code null}. */
    public static String first(Headers headers, String key) {
        if (headers == null) return null;
        final Iterator<Header> it = headers.headers(key).iterator();
        if (!it.hasNext()) return null;
        final byte[] value = it.next().value();
        return value == null ? null : new String(value, StandardCharsets.UTF_8);
    }

    public static boolean has(Headers headers, String key) {
        return headers != null && headers.headers(key).iterator().hasNext();
    }

    /** {@code x-retry-count}, 0 when absent or not a number. */
    public static int retryCount(Headers headers) {
        final String v = first(headers, X_RETRY_COUNT);
        if (v == null) return 0;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    /** {@code x-retry-until} in Unix millis, 0 when absent or not a number. */
    public static long retryDeadline(Headers headers) {
        final String v = first(headers, X_RETRY_UNTIL);
        if (v == null) return 0L;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    public static String originalTopic(Headers headers) {
        return first(headers, X_ORIGINAL_TOPIC);
    }

    /** Snapshot of {@code headers} in order, safe to mutate. */
    public static List<Header> copy(Headers headers) {
        final List<Header> out = new ArrayList<>();
        if (headers == null) return out;
        for (Header h : headers) {
            out.add(new RecordHeader(h.key(), h.value()));
        }
        return out;
    }
}
