/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.common.settings;

import com.graphmatch.core.common.exception.ErrorMessage;
import com.graphmatch.core.common.exception.GraphMatchException;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Properties;

import static com.graphmatch.core.common.settings.MatchingSettings.MAX_PATH_LENGTH;
import static com.graphmatch.core.common.settings.MatchingSettings.RELATIONSHIP_UNIQUENESS;
import static junit.framework.TestCase.assertEquals;
import static junit.framework.TestCase.assertFalse;
import static junit.framework.TestCase.assertTrue;
import static junit.framework.TestCase.fail;

public class ConfigTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void settings_resolve_against_the_properties_read() throws IOException {
        String content = "matching.relationship_uniqueness = false\nmatching.max_path_length = 12\n";

        Config config = Config.read(new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8)));

        assertFalse(config.get(RELATIONSHIP_UNIQUENESS));
        assertEquals(12, (int) config.get(MAX_PATH_LENGTH));
    }

    @Test
    public void unset_properties_take_the_defaults() {
        Config config = Config.of(new Properties());

        assertTrue(config.get(RELATIONSHIP_UNIQUENESS));
        assertEquals(64, (int) config.get(MAX_PATH_LENGTH));
    }

    @Test
    public void the_classpath_configuration_is_read_by_default() {
        Config config = Config.defaults();

        assertEquals(32, (int) config.get(MAX_PATH_LENGTH));
    }

    @Test
    public void the_configuration_file_can_be_chosen_with_a_system_property() throws IOException {
        File file = folder.newFile("override.properties");
        Files.write(file.toPath(), "matching.max_path_length=5\n".getBytes(StandardCharsets.UTF_8));

        SystemProperty.CONFIGURATION_FILE.set(file.getAbsolutePath());
        try {
            assertEquals(5, (int) Config.defaults().get(MAX_PATH_LENGTH));
        } finally {
            SystemProperty.CONFIGURATION_FILE.clear();
        }
    }

    @Test
    public void a_missing_file_is_reported() {
        File missing = new File(folder.getRoot(), "missing.properties");

        try {
            Config.read(missing.toPath());
            fail();
        } catch (GraphMatchException e) {
            assertEquals(ErrorMessage.Settings.CONFIG_FILE_NOT_READABLE, e.errorMessage());
            assertFalse(e.isInternal());
            assertTrue(e.getCause() instanceof IOException);
            assertTrue(e.getMessage().contains(missing.toPath().toString()));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalid_values_are_rejected_when_resolved() {
        Properties properties = new Properties();
        properties.setProperty("matching.max_path_length", "-3");

        Config.of(properties).get(MAX_PATH_LENGTH);
    }
}
