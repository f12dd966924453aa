/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.common.settings;

import java.util.function.Function;

/**
 * A typed configuration value, resolved from a lookup of raw string values by setting name.
 *
 * @param <T> the type of the resolved value
 */
public interface Setting<T> extends Function<Function<String, String>, T> {

    String name();

    /**
     * @return the raw default value, or null when the setting has none of its own
     */
    String defaultValue();

    /**
     * Resolves this setting against {@code settings}, which returns the raw value for a setting name or null
     * when it is not set.
     *
     * @throws IllegalArgumentException if the value cannot be parsed, violates a constraint, or is mandatory
     * and missing
     */
    @Override
    T apply(Function<String, String> settings);
}
