package com.netmig.pan2tf.config;

import com.netmig.pan2tf.model.Category;
import com.netmig.pan2tf.naming.NamespaceMode;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    private final ConfigLoader loader = new ConfigLoader();

    @Test
    @DisplayName("Default config is read from the classpath")
    void testLoadDefault() {
        ConversionConfig config = loader.loadDefault();

        assertEquals(NamespaceMode.PER_CATEGORY, config.getNamespaceMode());
        assertEquals(1000, config.getMaxSuffixAttempts());
        assertFalse(config.isAbortOnUnresolved());
        assertEquals(List.of("DG-", "dg-"), config.getTemplatePrefixes());
        assertEquals("***CHANGE_ME***", config.getSecretPlaceholder());
        assertEquals("10.0.0", config.getPartitionVersion());
    }

    @Test
    @DisplayName("Explicit config file overrides defaults")
    void testLoadFromFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("custom.yaml");
        Files.writeString(file, "namespaceMode: GLOBAL\n"
                + "abortOnUnresolved: true\n"
                + "excludedCategories: [SCHEDULE, REGION]\n");

        ConversionConfig config = loader.load(file.toString());

        assertEquals(NamespaceMode.GLOBAL, config.getNamespaceMode());
        assertTrue(config.isAbortOnUnresolved());
        assertEquals(List.of(Category.SCHEDULE, Category.REGION), config.getExcludedCategories());
        assertEquals(1000, config.getMaxSuffixAttempts(), "Keys not in the file keep their default");
    }

    @Test
    @DisplayName("Missing explicit config file is an error")
    void testMissingFile(@TempDir Path tempDir) {
        assertThrows(IOException.class, () -> loader.load(tempDir.resolve("absent.yaml").toString()));
    }

    @Test
    @DisplayName("Empty config file gives defaults")
    void testEmptyFile(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("empty.yaml");
        Files.writeString(file, "");

        assertEquals(new ConversionConfig(), loader.loadFromFile(file));
    }
}
