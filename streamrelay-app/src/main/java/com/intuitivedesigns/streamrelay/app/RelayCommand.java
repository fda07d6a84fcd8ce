/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.streamrelay.app;

import java.util.Locale;

/**
 * Parsed command line.
 *
 * <pre>
 *   consume            tail the configured topics (default)
 *   consume --batch    same, committing per polled batch
 *   produce TYPE JSON  publish one envelope to kafka.producer.topic
 * </pre>
 */
record RelayCommand(Mode mode, boolean batch, String payloadType, String payloadJson) {

    enum Mode { CONSUME, PRODUCE }

    static final String USAGE = "usage: streamrelay [consume [--batch] | produce <payloadType> <json>]";

    static RelayCommand parse(String[] args) {
        if (args == null || args.length == 0) {
            return new RelayCommand(Mode.CONSUME, false, null, null);
        }

        switch (args[0].trim().toLowerCase(Locale.ROOT)) {
            case "consume":
                if (args.length == 1) return new RelayCommand(Mode.CONSUME, false, null, null);
                if (args.length == 2 && "--batch".equals(args[1].trim())) {
                    return new RelayCommand(Mode.CONSUME, true, null, null);
                }
                throw new IllegalArgumentException("unexpected arguments for consume");
            case "produce":
                if (args.length != 3 || args[1].isBlank() || args[2].isBlank()) {
                    throw new IllegalArgumentException("produce needs <payloadType> <json>");
                }
                return new RelayCommand(Mode.PRODUCE, false, args[1].trim(), args[2]);
            default:
                throw new IllegalArgumentException("unknown command '" + args[0] + "'");
        }
    }
}
