package com.traffic.counts.common;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Jackson helpers and properties loading shared by the import job and tests.
 */
public final class JsonUtils {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private JsonUtils() {
    }

    public static String toJson(Object o) throws IOException {
        return MAPPER.writeValueAsString(o);
    }

    public static <T> List<T> readListFromClasspath(String path, Class<T> clazz) throws IOException {
        try (InputStream is = JsonUtils.class.getResourceAsStream(path)) {
            if (is == null) {
                throw new IllegalArgumentException("Resource not found on classpath: " + path);
            }
            return MAPPER.readValue(is,
                    MAPPER.getTypeFactory().constructCollectionType(List.class, clazz));
        }
    }

    /**
     * Load a properties file from the classpath, falling back to the given
     * filesystem path.
     */
    public static Properties loadProperties(String classpathName, String fallbackPath) throws IOException {
        Properties props = new Properties();
        try (InputStream in = JsonUtils.class.getClassLoader().getResourceAsStream(classpathName)) {
            if (in != null) {
                props.load(in);
                return props;
            }
        }
        Path fallback = Paths.get(fallbackPath);
        if (!Files.isRegularFile(fallback)) {
            throw new IllegalStateException("Cannot load properties from classpath or " + fallbackPath);
        }
        try (InputStream fs = Files.newInputStream(fallback)) {
            props.load(fs);
        }
        return props;
    }

    public static String requireProperty(Properties props, String key) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Missing required property: " + key);
        }
        return value.trim();
    }

    public static String optionalProperty(Properties props, String key, String defaultValue) {
        return Objects.requireNonNullElse(props.getProperty(key), defaultValue).trim();
    }

    public static int intProperty(Properties props, String key, int defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Property " + key + " is not an integer: " + value, e);
        }
    }

    public static double doubleProperty(Properties props, String key, double defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Property " + key + " is not a number: " + value, e);
        }
    }

    public static boolean booleanProperty(Properties props, String key, boolean defaultValue) {
        String value = props.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }
}
