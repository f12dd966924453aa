/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.common.settings;

import javax.annotation.Nullable;

/**
 * System properties read by the matching engine.
 */
public enum SystemProperty {

    CONFIGURATION_FILE("graphmatch.conf");

    private final String key;

    SystemProperty(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * @return the value of the system property, or null if it is not set
     */
    @Nullable
    public String value() {
        return System.getProperty(key);
    }

    public void set(String value) {
        System.setProperty(key, value);
    }

    public void clear() {
        System.clearProperty(key);
    }
}
