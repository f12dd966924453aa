/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.common.settings;

import static com.graphmatch.core.common.settings.Settings.BOOLEAN;
import static com.graphmatch.core.common.settings.Settings.INTEGER;
import static com.graphmatch.core.common.settings.Settings.TRUE;
import static com.graphmatch.core.common.settings.Settings.min;
import static com.graphmatch.core.common.settings.Settings.setting;

public class MatchingSettings {

    /**
     * When on, a relationship is traversed at most once within a single matched path.
     */
    public static final Setting<Boolean> RELATIONSHIP_UNIQUENESS =
            setting("matching.relationship_uniqueness", BOOLEAN, TRUE);

    /**
     * Paths are not extended beyond this many relationships, whatever the hops of the pattern allow.
     */
    public static final Setting<Integer> MAX_PATH_LENGTH =
            setting("matching.max_path_length", INTEGER, "64", min(1));
}
