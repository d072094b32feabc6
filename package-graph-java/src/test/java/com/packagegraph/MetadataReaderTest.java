package com.packagegraph;

import com.packagegraph.metadata.MetadataReader;
import com.packagegraph.metadata.RootManifest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MetadataReaderTest {

    private final MetadataReader reader = new MetadataReader();

    @Test
    void rootManifestUnionsAllThreeLists(@TempDir Path tmp) {
        PackageTreeFixture tree = new PackageTreeFixture(tmp, "app", List.of("a"), List.of("b"), List.of("c"));

        RootManifest root = reader.readRootManifest(tree.root());
        assertEquals("app", root.name());
        assertEquals(Set.of("a", "b", "c"), root.dependencyNames());
    }

    @Test
    void packageManifestUsesTheSameUnion(@TempDir Path tmp) {
        PackageTreeFixture.write(tmp.resolve("pubspec.yaml"),
                PackageTreeFixture.manifest("dep", List.of("x"), List.of("y"), List.of("x", "z")));

        assertEquals(Set.of("x", "y", "z"), reader.readManifestDependencies(tmp));
    }

    @Test
    void rootManifestMustDeclareName(@TempDir Path tmp) {
        PackageTreeFixture.write(tmp.resolve("pubspec.yaml"), "dependencies:\n  a: any\n");

        PackageGraphException ex = assertThrows(PackageGraphException.class, () -> reader.readRootManifest(tmp));
        assertEquals(PackageGraphException.Reason.MALFORMED_METADATA, ex.reason());
    }

    @Test
    void tablesComeFromTheInstalledTree(@TempDir Path tmp) {
        PackageTreeFixture tree = new PackageTreeFixture(tmp, "app", List.of("a"))
                .addPackage("a", "git", List.of())
                .install();

        assertEquals(tree.packageDir("a"), reader.readPackageLocations(tree.root()).get("a"));
        assertEquals(Set.of("a"), reader.readDependencyTypes(tree.root()).keySet());
    }
}
