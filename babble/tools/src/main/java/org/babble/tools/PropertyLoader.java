package org.babble.tools;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

public class PropertyLoader {

    private static final Logger log = Logger.getLogger(PropertyLoader.class);
    private static final String PROPERTIES_FILE = "config.properties";

    private static Properties properties = null;

    public static String getProperty(String key) {
        String value = load().getProperty(key);
        log.debug("[property loader] Getting property: " + key + " = " + value);
        return value;
    }

    public static String getProperty(String key, String defaultValue) {
        String value = getProperty(key);
        return value == null ? defaultValue : value;
    }

    public static int getIntProperty(String key, int defaultValue) {
        String value = getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("[property loader] Property " + key + " is not an integer: " + value + ", using " + defaultValue);
            return defaultValue;
        }
    }

    private static synchronized Properties load() {
        if (properties == null) {
            properties = load(Paths.get(PROPERTIES_FILE));
        }
        return properties;
    }

    // local file first, classpath when it is missing or unreadable
    static Properties load(Path local) {
        Properties loaded = new Properties();
        if (Files.isRegularFile(local)) {
            try (FileInputStream fis = new FileInputStream(local.toFile())) {
                loaded.load(fis);
                log.info("[property loader] Loaded " + local.toAbsolutePath());
                return loaded;
            } catch (IOException | IllegalArgumentException e) {
                log.warn("[property loader] Cannot read " + local.toAbsolutePath() + ", trying classpath", e);
                loaded = new Properties();
            }
        }

        try (InputStream is = PropertyLoader.class.getClassLoader().getResourceAsStream(PROPERTIES_FILE)) {
            if (is == null) {
                log.warn("[property loader] " + PROPERTIES_FILE + " not found, using defaults");
            } else {
                loaded.load(is);
            }
        } catch (IOException e) {
            log.warn("[property loader] Cannot read " + PROPERTIES_FILE + " from classpath", e);
        }
        return loaded;
    }

    static synchronized void reset() {
        properties = null;
    }
}
