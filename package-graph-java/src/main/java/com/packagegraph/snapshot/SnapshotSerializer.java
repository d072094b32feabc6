package com.packagegraph.snapshot;

import com.google.gson.GsonBuilder;
import com.packagegraph.graph.PackageGraph;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;

/**
 * Writes a built graph to package_graph.snapshot.json for downstream tools.
 */
public class SnapshotSerializer {

    public static final String SNAPSHOT_FILE = "package_graph.snapshot.json";

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * Writes {@code graph} to {@code outputDir/package_graph.snapshot.json}.
     *
     * @param outputDir directory to write into (created if absent)
     * @return path of the written file
     */
    public Path write(PackageGraph graph, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory: " + outputDir, e);
        }

        var gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

        Path snapshotPath = outputDir.resolve(SNAPSHOT_FILE);
        try (Writer w = Files.newBufferedWriter(snapshotPath, StandardCharsets.UTF_8)) {
            gson.toJson(GraphSnapshot.of(graph), w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + SNAPSHOT_FILE + ": " + e.getMessage(), e);
        }
        System.err.println("[package-graph] " + SNAPSHOT_FILE + " written: " + snapshotPath);
        return snapshotPath;
    }
}
