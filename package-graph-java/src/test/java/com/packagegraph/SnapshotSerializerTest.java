package com.packagegraph;

import com.google.gson.Gson;
import com.packagegraph.graph.DependencyType;
import com.packagegraph.graph.PackageGraph;
import com.packagegraph.graph.PackageGraphBuilder;
import com.packagegraph.graph.PackageNode;
import com.packagegraph.snapshot.GraphSnapshot;
import com.packagegraph.snapshot.SnapshotSerializer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotSerializerTest {

    private PackageGraph makeGraph() {
        PackageNode app = new PackageNode("app", Paths.get("/work/app"), DependencyType.FILESYSTEM_PATH, true);
        PackageNode zed = new PackageNode("zed", Paths.get("/cache/zed"), DependencyType.REGISTRY_HOSTED, false);
        PackageNode alpha = new PackageNode("alpha", Paths.get("/cache/alpha"), DependencyType.VERSION_CONTROL, false);
        app.addDependency(zed).addDependency(alpha);  // zed before alpha intentionally
        return new PackageGraphBuilder(null).buildFromRoot(app);
    }

    private GraphSnapshot readBack(Path file) throws Exception {
        try (Reader r = Files.newBufferedReader(file)) {
            return new Gson().fromJson(r, GraphSnapshot.class);
        }
    }

    @Test
    void packagesSortedByNameEdgesInDeclarationOrder(@TempDir Path tmp) throws Exception {
        Path written = new SnapshotSerializer().write(makeGraph(), tmp);

        assertEquals(tmp.resolve("package_graph.snapshot.json"), written);
        GraphSnapshot parsed = readBack(written);
        assertEquals("app", parsed.root);
        assertEquals(List.of(PackageGraph.TOOLCHAIN_PACKAGE, "alpha", "app", "zed"),
                parsed.packages.stream().map(p -> p.name).collect(Collectors.toList()));

        GraphSnapshot.PackageEntry app = parsed.packages.get(2);
        assertTrue(app.isRoot);
        assertEquals("FILESYSTEM_PATH", app.type);
        assertEquals(List.of("zed", "alpha"), app.dependencies);
    }

    @Test
    void toolchainWithoutPathIsWrittenAsNull(@TempDir Path tmp) throws Exception {
        Path written = new SnapshotSerializer().write(makeGraph(), tmp);

        assertTrue(Files.readString(written).contains("\"toolchain_path\": null"));
        GraphSnapshot parsed = readBack(written);
        assertNull(parsed.toolchainPath);
        assertNull(parsed.packages.get(0).path);
        assertEquals("TOOLCHAIN_BUNDLED", parsed.packages.get(0).type);
    }

    @Test
    void entriesCarrySourceTagAndWatchability(@TempDir Path tmp) throws Exception {
        GraphSnapshot parsed = readBack(new SnapshotSerializer().write(makeGraph(), tmp));

        GraphSnapshot.PackageEntry toolchain = parsed.packages.get(0);
        GraphSnapshot.PackageEntry alpha = parsed.packages.get(1);
        GraphSnapshot.PackageEntry app = parsed.packages.get(2);
        GraphSnapshot.PackageEntry zed = parsed.packages.get(3);

        assertEquals("sdk", toolchain.source);
        assertFalse(toolchain.mayChangeLocally);
        assertEquals("git", alpha.source);
        assertTrue(alpha.mayChangeLocally);
        assertEquals("path", app.source);
        assertTrue(app.mayChangeLocally);
        assertEquals("hosted", zed.source);
        assertFalse(zed.mayChangeLocally);
    }

    @Test
    void createsMissingOutputDirectory(@TempDir Path tmp) {
        Path nested = tmp.resolve("out").resolve("graphs");
        new SnapshotSerializer().write(makeGraph(), nested);
        assertTrue(Files.exists(nested.resolve("package_graph.snapshot.json")));
    }

    @Test
    void sameGraphGivesSameBytes(@TempDir Path tmp) throws Exception {
        Path first = new SnapshotSerializer().write(makeGraph(), tmp.resolve("one"));
        Path second = new SnapshotSerializer().write(makeGraph(), tmp.resolve("two"));
        assertEquals(Files.readString(first), Files.readString(second));
    }
}
