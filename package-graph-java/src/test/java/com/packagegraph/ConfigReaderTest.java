package com.packagegraph;

import com.packagegraph.config.ConfigReader;
import com.packagegraph.config.GraphConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigReaderTest {

    private final ConfigReader reader = new ConfigReader();

    @Test
    void readsSnakeCaseKeys(@TempDir Path tmp) throws IOException {
        Files.writeString(tmp.resolve("package_graph.json"), """
            {
              "toolchain_path": "/opt/sdk",
              "output_dir": "build/graph"
            }
            """);

        GraphConfig config = reader.read(tmp);
        assertEquals("/opt/sdk", config.getToolchainPath());
        assertNull(config.getToolchainExecutable());
        assertEquals("build/graph", config.getOutputDir());
    }

    @Test
    void missingFileGivesEmptyConfig(@TempDir Path tmp) {
        GraphConfig config = reader.read(tmp);
        assertNull(config.getToolchainPath());
        assertNull(config.getOutputDir());
    }

    @Test
    void emptyFileIsInvalid(@TempDir Path tmp) throws IOException {
        Files.writeString(tmp.resolve("package_graph.json"), "");
        PackageGraphException ex = assertThrows(PackageGraphException.class, () -> reader.read(tmp));
        assertEquals(PackageGraphException.Reason.INVALID_CONFIG, ex.reason());
    }

    @Test
    void brokenJsonIsInvalid(@TempDir Path tmp) throws IOException {
        Files.writeString(tmp.resolve("package_graph.json"), "{\"output_dir\": [1, 2");
        PackageGraphException ex = assertThrows(PackageGraphException.class, () -> reader.read(tmp));
        assertEquals(PackageGraphException.Reason.INVALID_CONFIG, ex.reason());
    }

    @Test
    void overridesReplaceOnlySetValues() {
        GraphConfig file = new GraphConfig("/opt/sdk", null, "out");
        GraphConfig merged = file.overriddenBy(new GraphConfig(null, "/usr/lib/sdk/bin/dart", null));

        assertEquals("/opt/sdk", merged.getToolchainPath());
        assertEquals("/usr/lib/sdk/bin/dart", merged.getToolchainExecutable());
        assertEquals("out", merged.getOutputDir());
    }
}
