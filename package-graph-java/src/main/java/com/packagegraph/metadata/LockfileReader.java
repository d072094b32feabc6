package com.packagegraph.metadata;

import com.fasterxml.jackson.databind.JsonNode;
import com.packagegraph.PackageGraphException;
import com.packagegraph.PackageGraphException.Reason;
import com.packagegraph.graph.DependencyType;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the source classification of every locked package from pubspec.lock.
 */
public class LockfileReader {

    public static final String LOCKFILE = "pubspec.lock";

    /**
     * @throws PackageGraphException MISSING_LOCKFILE if there is no lock file,
     *         UNKNOWN_SOURCE_TAG for a {@code source} outside git, hosted, path and sdk
     */
    public Map<String, DependencyType> read(Path rootDir) {
        Path lockPath = rootDir.resolve(LOCKFILE);
        if (!Files.isRegularFile(lockPath)) {
            throw new PackageGraphException(Reason.MISSING_LOCKFILE, lockPath.toString(),
                    "Unable to generate package graph, no " + LOCKFILE + " found in " + rootDir
                            + ". Run the package install step in the root directory first.");
        }
        JsonNode tree = ManifestReader.readTree(lockPath);
        if (tree == null || !tree.isObject()) {
            throw new PackageGraphException(Reason.MALFORMED_METADATA, lockPath.toString(),
                    "Lock file is empty or not a YAML mapping: " + lockPath);
        }

        Map<String, DependencyType> types = new LinkedHashMap<>();
        JsonNode packages = tree.get("packages");
        if (packages == null || !packages.isObject()) return types;

        for (Iterator<Map.Entry<String, JsonNode>> it = packages.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode source = entry.getValue().get("source");
            String tag = source != null && source.isTextual() ? source.asText() : null;
            DependencyType type = DependencyType.fromSourceTag(tag);
            if (type == null) {
                throw new PackageGraphException(Reason.UNKNOWN_SOURCE_TAG, entry.getKey(),
                        "Unable to determine dependency type of '" + entry.getKey() + "' from source: " + tag);
            }
            types.put(entry.getKey(), type);
        }
        return types;
    }
}
