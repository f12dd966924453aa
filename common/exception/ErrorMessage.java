/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.common.exception;

import java.util.HashMap;
import java.util.Map;

public abstract class ErrorMessage {

    private static final Map<String, Map<Integer, ErrorMessage>> errors = new HashMap<>();
    private static int maxCodeNumber = 0;
    private static int maxCodeDigits = 0;

    private final String codePrefix;
    private final int codeNumber;
    private final String messagePrefix;
    private final String messageBody;
    private String code = null;

    private ErrorMessage(String codePrefix, int codeNumber, String messagePrefix, String messageBody) {
        this.codePrefix = codePrefix;
        this.codeNumber = codeNumber;
        this.messagePrefix = messagePrefix;
        this.messageBody = messageBody;

        assert errors.get(codePrefix) == null || errors.get(codePrefix).get(codeNumber) == null;
        errors.computeIfAbsent(codePrefix, s -> new HashMap<>()).put(codeNumber, this);
        maxCodeNumber = Math.max(codeNumber, maxCodeNumber);
        maxCodeDigits = String.valueOf(maxCodeNumber).length();
    }

    public String code() {
        if (code != null) return code;

        StringBuilder zeros = new StringBuilder();
        for (int digits = String.valueOf(codeNumber).length(); digits < maxCodeDigits; digits++) {
            zeros.append("0");
        }

        code = codePrefix + zeros + codeNumber;
        return code;
    }

    public String message(Object... parameters) {
        return String.format(toString(), parameters);
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", code(), messagePrefix, messageBody);
    }

    public static class Internal extends ErrorMessage {
        public static final Internal ILLEGAL_STATE =
                new Internal(1, "Illegal internal state!");
        public static final Internal ILLEGAL_CAST =
                new Internal(2, "Illegal casting operation from '%s' to '%s'.");
        public static final Internal ILLEGAL_ARGUMENT =
                new Internal(3, "Illegal argument provided.");
        public static final Internal ILLEGAL_OPERATION_ON_ENTITY_MAP =
                new Internal(4, "This map is not a real map: '%s' is not allowed on the properties of '%s'. This should not happen.");
        public static final Internal ILLEGAL_OPERATION =
                new Internal(5, "Illegal internal operation! This method should not have been called.");

        private static final String codePrefix = "INT";
        private static final String messagePrefix = "Invalid Internal State";

        Internal(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Expression extends ErrorMessage {
        public static final Expression NOT_A_MAP =
                new Expression(1, "Expected '%s' to be a map, node or relationship, but it was '%s'.");
        public static final Expression MISSING_PARAMETER =
                new Expression(2, "The query parameter '%s' has not been provided.");

        private static final String codePrefix = "EXP";
        private static final String messagePrefix = "Invalid Expression Evaluation";

        Expression(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }

    public static class Settings extends ErrorMessage {
        public static final Settings INVALID_VALUE =
                new Settings(1, "Setting '%s' received the value '%s' which is not a valid %s.");
        public static final Settings MANDATORY_MISSING =
                new Settings(2, "Setting '%s' is mandatory but has no value.");
        public static final Settings BELOW_MINIMUM =
                new Settings(3, "Setting '%s' has the value '%s', which is below the minimum '%s'.");
        public static final Settings ABOVE_MAXIMUM =
                new Settings(4, "Setting '%s' has the value '%s', which is above the maximum '%s'.");
        public static final Settings PATTERN_MISMATCH =
                new Settings(5, "Setting '%s' has the value '%s', which does not match the pattern '%s'.");
        public static final Settings NOT_A_FILE =
                new Settings(6, "Setting '%s' has the value '%s', which is a directory rather than a file.");
        public static final Settings CONFIG_FILE_NOT_READABLE =
                new Settings(7, "Could not read the configuration file '%s'.");

        private static final String codePrefix = "SET";
        private static final String messagePrefix = "Invalid Configuration";

        Settings(int number, String message) {
            super(codePrefix, number, messagePrefix, message);
        }
    }
}
