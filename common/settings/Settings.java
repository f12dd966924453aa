/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.common.settings;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.regex.Pattern;

import static com.graphmatch.core.common.exception.ErrorMessage.Settings.ABOVE_MAXIMUM;
import static com.graphmatch.core.common.exception.ErrorMessage.Settings.BELOW_MINIMUM;
import static com.graphmatch.core.common.exception.ErrorMessage.Settings.INVALID_VALUE;
import static com.graphmatch.core.common.exception.ErrorMessage.Settings.MANDATORY_MISSING;
import static com.graphmatch.core.common.exception.ErrorMessage.Settings.NOT_A_FILE;
import static com.graphmatch.core.common.exception.ErrorMessage.Settings.PATTERN_MISMATCH;

/**
 * Factory for {@link Setting}s: value parsers, constraints, defaults and inheritance.
 *
 * A setting without a value of its own takes the value explicitly set on the setting it inherits from (if
 * any, recursively), then its own default, then the default of the setting it inherits from.
 */
public class Settings {

    public static final String NO_DEFAULT = null;
    public static final String MANDATORY = "<mandatory>";
    public static final String TRUE = "true";
    public static final String FALSE = "false";

    public interface Parser<T> extends Function<String, T> {

        String typeName();
    }

    public interface Constraint<T> {

        T apply(String settingName, T value, Function<String, String> settings);
    }

    public static <T> Parser<T> parser(String typeName, Function<String, T> parseFn) {
        return new Parser<T>() {
            @Override
            public String typeName() {
                return typeName;
            }

            @Override
            public T apply(String value) {
                return parseFn.apply(value);
            }

            @Override
            public String toString() {
                return typeName;
            }
        };
    }

    public static final Parser<String> STRING = parser("string", value -> value);
    public static final Parser<Integer> INTEGER = parser("integer", value -> Integer.parseInt(value.trim()));
    public static final Parser<Long> LONG = parser("long", value -> Long.parseLong(value.trim()));
    public static final Parser<Path> PATH = parser("path", value -> Paths.get(value.trim()));

    public static final Parser<Boolean> BOOLEAN = parser("boolean", value -> {
        String trimmed = value.trim();
        if (trimmed.equalsIgnoreCase(TRUE)) return true;
        else if (trimmed.equalsIgnoreCase(FALSE)) return false;
        else throw new IllegalArgumentException(trimmed);
    });

    /**
     * A duration in milliseconds, written as a number with an optional {@code ms}, {@code s}, {@code m} or
     * {@code h} suffix. A bare number is read as milliseconds.
     */
    public static final Parser<Long> DURATION = parser("duration", value -> {
        String trimmed = value.trim().toLowerCase();
        if (trimmed.endsWith("ms")) {
            return Long.parseLong(trimmed.substring(0, trimmed.length() - 2).trim());
        } else if (trimmed.endsWith("s")) {
            return TimeUnit.SECONDS.toMillis(Long.parseLong(trimmed.substring(0, trimmed.length() - 1).trim()));
        } else if (trimmed.endsWith("m")) {
            return TimeUnit.MINUTES.toMillis(Long.parseLong(trimmed.substring(0, trimmed.length() - 1).trim()));
        } else if (trimmed.endsWith("h")) {
            return TimeUnit.HOURS.toMillis(Long.parseLong(trimmed.substring(0, trimmed.length() - 1).trim()));
        } else {
            return Long.parseLong(trimmed);
        }
    });

    public static <T> Parser<List<T>> list(String separator, Parser<T> itemParser) {
        return parser("list of " + itemParser.typeName(), value -> {
            ImmutableList.Builder<T> items = ImmutableList.builder();
            for (String item : Splitter.on(separator).trimResults().omitEmptyStrings().split(value)) {
                items.add(itemParser.apply(item));
            }
            return items.build();
        });
    }

    @SafeVarargs
    public static <T> Setting<T> setting(String name, Parser<T> parser, String defaultValue,
                                         Constraint<T>... constraints) {
        return new TypedSetting<>(name, parser, defaultValue, null, ImmutableList.copyOf(constraints));
    }

    @SafeVarargs
    public static <T> Setting<T> setting(String name, Parser<T> parser, String defaultValue,
                                         Setting<T> inheritedSetting, Constraint<T>... constraints) {
        return new TypedSetting<>(name, parser, defaultValue, inheritedSetting, ImmutableList.copyOf(constraints));
    }

    @SafeVarargs
    public static <T> Setting<T> setting(String name, Parser<T> parser, Setting<T> inheritedSetting,
                                         Constraint<T>... constraints) {
        return new TypedSetting<>(name, parser, NO_DEFAULT, inheritedSetting, ImmutableList.copyOf(constraints));
    }

    public static <T extends Comparable<T>> Constraint<T> min(T min) {
        return (name, value, settings) -> {
            if (value != null && value.compareTo(min) < 0) {
                throw new IllegalArgumentException(BELOW_MINIMUM.message(name, value, min));
            }
            return value;
        };
    }

    public static <T extends Comparable<T>> Constraint<T> max(T max) {
        return (name, value, settings) -> {
            if (value != null && value.compareTo(max) > 0) {
                throw new IllegalArgumentException(ABOVE_MAXIMUM.message(name, value, max));
            }
            return value;
        };
    }

    public static <T extends Comparable<T>> Constraint<T> range(T min, T max) {
        Constraint<T> lower = min(min);
        Constraint<T> upper = max(max);
        return (name, value, settings) -> upper.apply(name, lower.apply(name, value, settings), settings);
    }

    public static Constraint<String> matches(String regex) {
        Pattern pattern = Pattern.compile(regex);
        return (name, value, settings) -> {
            if (value != null && !pattern.matcher(value).matches()) {
                throw new IllegalArgumentException(PATTERN_MISMATCH.message(name, value, regex));
            }
            return value;
        };
    }

    /**
     * Resolves a relative path against the value of {@code baseSetting}.
     */
    public static Constraint<Path> basePath(Setting<Path> baseSetting) {
        return (name, value, settings) -> {
            if (value == null || value.isAbsolute()) return value;
            Path base = baseSetting.apply(settings);
            return base == null ? value : base.resolve(value);
        };
    }

    public static final Constraint<Path> isFile = (name, value, settings) -> {
        if (value != null && Files.isDirectory(value)) {
            throw new IllegalArgumentException(NOT_A_FILE.message(name, value));
        }
        return value;
    };

    private static class TypedSetting<T> implements Setting<T> {

        private final String name;
        private final Parser<T> parser;
        private final String defaultValue;
        private final Setting<T> inheritedSetting;
        private final List<Constraint<T>> constraints;

        private TypedSetting(String name, Parser<T> parser, String defaultValue, Setting<T> inheritedSetting,
                             List<Constraint<T>> constraints) {
            this.name = name;
            this.parser = parser;
            this.defaultValue = defaultValue;
            this.inheritedSetting = inheritedSetting;
            this.constraints = constraints;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public String defaultValue() {
            return defaultValue;
        }

        @Override
        public T apply(Function<String, String> settings) {
            String raw = resolve(this, settings);
            if (raw == null) return null;

            T value;
            try {
                value = parser.apply(raw);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(INVALID_VALUE.message(name, raw, parser.typeName()), e);
            }
            for (Constraint<T> constraint : constraints) {
                value = constraint.apply(name, value, settings);
            }
            return value;
        }

        private static String explicitValue(Setting<?> setting, Function<String, String> settings) {
            String value = settings.apply(setting.name());
            if (value != null) return value;
            else if (setting instanceof TypedSetting<?> && ((TypedSetting<?>) setting).inheritedSetting != null) {
                return explicitValue(((TypedSetting<?>) setting).inheritedSetting, settings);
            } else return null;
        }

        private static String resolve(Setting<?> setting, Function<String, String> settings) {
            String value = explicitValue(setting, settings);
            if (value != null) return value;

            String defaultValue = setting.defaultValue();
            if (MANDATORY.equals(defaultValue)) {
                throw new IllegalArgumentException(MANDATORY_MISSING.message(setting.name()));
            } else if (defaultValue != null) {
                return defaultValue;
            } else if (setting instanceof TypedSetting<?> && ((TypedSetting<?>) setting).inheritedSetting != null) {
                return resolve(((TypedSetting<?>) setting).inheritedSetting, settings);
            } else {
                return null;
            }
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            TypedSetting<?> that = (TypedSetting<?>) o;
            return name.equals(that.name) && Objects.equals(defaultValue, that.defaultValue);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, defaultValue);
        }

        @Override
        public String toString() {
            return name + " (" + parser.typeName() + (defaultValue == null ? "" : ", default '" + defaultValue + "'") + ")";
        }
    }
}
