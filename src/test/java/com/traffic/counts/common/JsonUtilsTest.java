package com.traffic.counts.common;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Properties;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.traffic.counts.aadv.InOutTotal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class JsonUtilsTest {

    @Test void testReadFixture() throws IOException {
        List<InOutTotal> totals = JsonUtils.readListFromClasspath("/fixtures/bike_156238_inout.json", InOutTotal.class);
        assertEquals(9, totals.size());
        assertEquals(LocalDate.of(2020, 11, 22), totals.get(1).date);
        assertEquals(84, totals.get(1).total);
        assertEquals(50, totals.get(1).in);
        assertEquals(34, totals.get(1).out);
    }

    @Test void testMissingFixture() {
        assertThrows(IllegalArgumentException.class,
                () -> JsonUtils.readListFromClasspath("/fixtures/none.json", InOutTotal.class));
    }

    @Test void testDatesWrittenAsText() throws IOException {
        assertEquals("{\"d\":\"2020-11-22\"}", JsonUtils.toJson(Map.of("d", LocalDate.of(2020, 11, 22))));
    }

    @Test void testPropertiesFallbackFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("counts.properties");
        Files.writeString(file, "mysql.url= jdbc:mysql://db/traffic \nmysql.batch.size=250\nimport.cleanup.files=true\n");
        Properties props = JsonUtils.loadProperties("no-such-file.properties", file.toString());

        assertEquals("jdbc:mysql://db/traffic", JsonUtils.requireProperty(props, "mysql.url"));
        assertEquals(250, JsonUtils.intProperty(props, "mysql.batch.size", 500));
        assertEquals(0.4, JsonUtils.doubleProperty(props, "check.direction.lower.bound", 0.4));
        assertTrue(JsonUtils.booleanProperty(props, "import.cleanup.files", false));
        assertEquals("x", JsonUtils.optionalProperty(props, "mysql.user", "x"));
    }

    @Test void testMissingRequiredProperty() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> JsonUtils.requireProperty(new Properties(), "mysql.url"));
        assertEquals("Missing required property: mysql.url", e.getMessage());
    }

    @Test void testBadNumber() {
        Properties props = new Properties();
        props.setProperty("mysql.batch.size", "lots");
        assertThrows(IllegalStateException.class, () -> JsonUtils.intProperty(props, "mysql.batch.size", 500));
        assertFalse(JsonUtils.booleanProperty(props, "import.cleanup.files", false));
    }

    @Test void testClasspathProperties() throws IOException {
        Properties props = JsonUtils.loadProperties("application.properties", "missing.properties");
        assertEquals("20", props.getProperty("check.bike.max.per.period"));
    }
}
