/*
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at https://mozilla.org/MPL/2.0/.
 */

package com.graphmatch.core.common.settings;

import com.graphmatch.core.common.exception.GraphMatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Properties;

import static com.graphmatch.core.common.exception.ErrorMessage.Settings.CONFIG_FILE_NOT_READABLE;

/**
 * Raw configuration values read from a properties file, resolved into typed values through {@link Setting}s.
 */
public class Config {

    private static final Logger LOG = LoggerFactory.getLogger(Config.class);
    public static final String DEFAULT_CONFIG_RESOURCE = "graphmatch.properties";

    private final Properties prop;

    private Config(Properties prop) {
        this.prop = prop;
    }

    /**
     * Reads the file named by the {@code graphmatch.conf} system property if it is set, otherwise the
     * {@code graphmatch.properties} resource on the classpath. Without either, every setting takes its default.
     */
    public static Config defaults() {
        String path = SystemProperty.CONFIGURATION_FILE.value();
        if (path != null) return read(Paths.get(path));

        try (InputStream inputStream = Config.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (inputStream == null) {
                LOG.debug("No {} found on the classpath, using default settings", DEFAULT_CONFIG_RESOURCE);
                return of(new Properties());
            }
            return read(inputStream);
        } catch (IOException e) {
            LOG.error("Could not load properties from classpath resource {}", DEFAULT_CONFIG_RESOURCE, e);
            throw GraphMatchException.of(CONFIG_FILE_NOT_READABLE, e, DEFAULT_CONFIG_RESOURCE);
        }
    }

    public static Config read(Path path) {
        try (InputStream inputStream = Files.newInputStream(path)) {
            return read(inputStream);
        } catch (IOException e) {
            LOG.error("Could not load properties from {}", path, e);
            throw GraphMatchException.of(CONFIG_FILE_NOT_READABLE, e, path);
        }
    }

    public static Config read(InputStream inputStream) throws IOException {
        Properties prop = new Properties();
        prop.load(inputStream);
        return of(prop);
    }

    public static Config of(Properties properties) {
        Properties localProps = new Properties();
        properties.forEach((key, value) -> localProps.setProperty((String) key, (String) value));
        return new Config(localProps);
    }

    public static Config of(Map<String, String> values) {
        Properties properties = new Properties();
        values.forEach(properties::setProperty);
        return new Config(properties);
    }

    public <T> T get(Setting<T> setting) {
        return setting.apply(prop::getProperty);
    }

    @Override
    public String toString() {
        return "Config" + prop;
    }
}
