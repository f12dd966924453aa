/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.common.settings;

import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static com.graphmatch.core.common.settings.Settings.BOOLEAN;
import static com.graphmatch.core.common.settings.Settings.DURATION;
import static com.graphmatch.core.common.settings.Settings.INTEGER;
import static com.graphmatch.core.common.settings.Settings.MANDATORY;
import static com.graphmatch.core.common.settings.Settings.NO_DEFAULT;
import static com.graphmatch.core.common.settings.Settings.PATH;
import static com.graphmatch.core.common.settings.Settings.STRING;
import static com.graphmatch.core.common.settings.Settings.basePath;
import static com.graphmatch.core.common.settings.Settings.isFile;
import static com.graphmatch.core.common.settings.Settings.list;
import static com.graphmatch.core.common.settings.Settings.matches;
import static com.graphmatch.core.common.settings.Settings.max;
import static com.graphmatch.core.common.settings.Settings.min;
import static com.graphmatch.core.common.settings.Settings.range;
import static com.graphmatch.core.common.settings.Settings.setting;
import static junit.framework.TestCase.assertEquals;
import static junit.framework.TestCase.assertNull;
import static junit.framework.TestCase.assertTrue;
import static junit.framework.TestCase.fail;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;

public class SettingsTest {

    private static Function<String, String> values(String... keyValues) {
        ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
        for (int i = 0; i < keyValues.length; i += 2) builder.put(keyValues[i], keyValues[i + 1]);
        Map<String, String> map = builder.build();
        return map::get;
    }

    private static void assertRejected(Setting<?> setting, Function<String, String> values, String messagePart) {
        try {
            setting.apply(values);
            fail();
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), containsString(messagePart));
        }
    }

    @Test
    public void integers_are_parsed_and_malformed_values_rejected() {
        Setting<Integer> setting = setting("foo", INTEGER, "3");

        assertThat(setting.apply(values("foo", "4")), equalTo(4));
        assertThat(setting.apply(values("foo", " 5 ")), equalTo(5));
        assertRejected(setting, values("foo", "bar"), "not a valid integer");
    }

    @Test
    public void booleans_accept_only_true_and_false() {
        Setting<Boolean> setting = setting("flag", BOOLEAN, Settings.FALSE);

        assertThat(setting.apply(values()), equalTo(false));
        assertThat(setting.apply(values("flag", "TRUE")), equalTo(true));
        assertRejected(setting, values("flag", "yes"), "not a valid boolean");
    }

    @Test
    public void lists_split_on_the_separator() {
        Setting<List<Integer>> setting = setting("foo", list(",", INTEGER), "1,2,3,4");

        assertThat(setting.apply(values()).toString(), equalTo("[1, 2, 3, 4]"));
        assertThat(setting.apply(values("foo", " 7 , ,8")).toString(), equalTo("[7, 8]"));
        assertRejected(setting, values("foo", "1,x"), "not a valid list of integer");
    }

    @Test
    public void values_below_the_minimum_are_rejected() {
        Setting<Integer> setting = setting("foo", INTEGER, "3", min(2));

        assertThat(setting.apply(values("foo", "4")), equalTo(4));
        assertRejected(setting, values("foo", "1"), "below the minimum '2'");
    }

    @Test
    public void values_above_the_maximum_are_rejected() {
        Setting<Integer> setting = setting("foo", INTEGER, "3", max(5));

        assertThat(setting.apply(values("foo", "4")), equalTo(4));
        assertRejected(setting, values("foo", "7"), "above the maximum '5'");
    }

    @Test
    public void values_must_lie_within_a_range() {
        Setting<Integer> setting = setting("foo", INTEGER, "3", range(2, 5));

        assertThat(setting.apply(values("foo", "4")), equalTo(4));
        assertRejected(setting, values("foo", "1"), "below the minimum");
        assertRejected(setting, values("foo", "6"), "above the maximum");
    }

    @Test
    public void strings_must_match_the_pattern() {
        Setting<String> setting = setting("foo", STRING, "abc", matches("a*b*c*"));

        assertThat(setting.apply(values("foo", "aaabbbccc")), equalTo("aaabbbccc"));
        assertRejected(setting, values("foo", "cba"), "does not match the pattern");
    }

    @Test
    public void durations_are_read_in_milliseconds() {
        Setting<Long> setting = setting("foo.bar", DURATION, "3s", min(DURATION.apply("3s")));

        assertThat(setting.apply(values("foo.bar", "4s")), equalTo(4000L));
        assertThat(setting.apply(values("foo.bar", "2m")), equalTo(120000L));
        assertThat(setting.apply(values("foo.bar", "1h")), equalTo(3600000L));
        assertThat(setting.apply(values("foo.bar", "3500ms")), equalTo(3500L));
        assertThat(setting.apply(values("foo.bar", "5000")), equalTo(5000L));
        assertRejected(setting, values("foo.bar", "2s"), "below the minimum");
    }

    @Test(expected = IllegalArgumentException.class)
    public void defaults_are_subject_to_the_constraints() {
        Setting<Long> setting = setting("foo.bar", DURATION, "1s", min(DURATION.apply("3s")));
        setting.apply(values());
    }

    @Test
    public void unset_values_take_the_default() {
        assertThat(setting("foo", INTEGER, "3").apply(values()), equalTo(3));
        assertNull(setting("foo", INTEGER, NO_DEFAULT).apply(values()));
    }

    @Test
    public void mandatory_settings_must_be_set() {
        Setting<Integer> setting = setting("foo", INTEGER, MANDATORY);

        assertThat(setting.apply(values("foo", "1")), equalTo(1));
        assertRejected(setting, values(), "'foo' is mandatory");
    }

    @Test
    public void relative_paths_resolve_against_their_base() {
        Setting<Path> home = setting("home", PATH, ".");
        Setting<Path> config = setting("config", PATH, "config.properties", basePath(home), isFile);

        assertEquals(Paths.get("config.properties").toAbsolutePath().normalize(),
                config.apply(values()).toAbsolutePath().normalize());
        assertEquals(Paths.get("/etc/conf").resolve("config.properties"), config.apply(values("home", "/etc/conf")));
        Path absolute = Paths.get("/opt/graphmatch.properties").toAbsolutePath();
        assertEquals(absolute, config.apply(values("config", absolute.toString())));
    }

    @Test
    public void directories_are_not_files() {
        Setting<Path> config = setting("config", PATH, ".", isFile);

        assertRejected(config, values(), "is a directory");
    }

    @Test
    public void a_setting_inherits_the_value_of_its_parent() {
        Setting<Integer> root = setting("root", INTEGER, "4");
        Setting<Integer> setting = setting("foo", INTEGER, root);

        assertThat(setting.apply(values("foo", "1")), equalTo(1));
        assertThat(setting.apply(values("root", "2")), equalTo(2));
        assertThat(setting.apply(values()), equalTo(4));
    }

    @Test
    public void inheritance_follows_the_whole_hierarchy() {
        Setting<String> a = setting("A", STRING, "A");
        Setting<String> b = setting("B", STRING, "B", a);
        Setting<String> c = setting("C", STRING, "C", b);
        Setting<String> d = setting("D", STRING, b);
        Setting<String> e = setting("E", STRING, d);

        assertThat(c.apply(values("C", "X")), equalTo("X"));
        assertThat(c.apply(values("B", "X")), equalTo("X"));
        assertThat(c.apply(values("A", "X")), equalTo("X"));
        assertThat(c.apply(values("A", "Y", "B", "X")), equalTo("X"));
        assertThat(c.apply(values()), equalTo("C"));

        assertThat(d.apply(values()), equalTo("B"));
        assertThat(e.apply(values()), equalTo("B"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void mandatory_settings_fail_even_when_inheriting() {
        Setting<String> x = setting("X", STRING, NO_DEFAULT);
        Setting<String> y = setting("Y", STRING, MANDATORY, x);

        y.apply(key -> null);
    }

    @Test
    public void the_matching_settings_have_usable_defaults() {
        assertTrue(MatchingSettings.RELATIONSHIP_UNIQUENESS.apply(values()));
        assertThat(MatchingSettings.MAX_PATH_LENGTH.apply(values()), equalTo(64));
        assertRejected(MatchingSettings.MAX_PATH_LENGTH, values("matching.max_path_length", "0"), "below the minimum");
    }
}
