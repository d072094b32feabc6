package com.packagegraph.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.packagegraph.PackageGraphException;
import com.packagegraph.PackageGraphException.Reason;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Reads the pubspec.yaml at the top of a package directory.
 */
public class ManifestReader {

    public static final String MANIFEST_FILE = "pubspec.yaml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    /**
     * Reads and parses the manifest of the package whose top level directory is {@code packageDir}.
     *
     * @throws PackageGraphException MISSING_MANIFEST if there is no manifest,
     *         MALFORMED_METADATA if it is not a YAML mapping
     */
    public PackageManifest read(Path packageDir) {
        Path manifestPath = packageDir.resolve(MANIFEST_FILE);
        if (!Files.isRegularFile(manifestPath)) {
            throw new PackageGraphException(Reason.MISSING_MANIFEST, manifestPath.toString(),
                    "Unable to generate package graph, no " + manifestPath + " found");
        }
        JsonNode tree = readTree(manifestPath);
        if (tree == null || !tree.isObject()) {
            throw new PackageGraphException(Reason.MALFORMED_METADATA, manifestPath.toString(),
                    "Manifest is empty or not a YAML mapping: " + manifestPath);
        }
        JsonNode name = tree.get("name");
        return new PackageManifest(
                name != null && name.isTextual() ? name.asText() : null,
                keysOf(tree.get("dependencies")),
                keysOf(tree.get("dev_dependencies")),
                keysOf(tree.get("dependency_overrides")));
    }

    static JsonNode readTree(Path yamlPath) {
        try {
            return YAML.readTree(Files.readString(yamlPath, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            throw new PackageGraphException(Reason.MALFORMED_METADATA, yamlPath.toString(),
                    "Invalid YAML in " + yamlPath + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new PackageGraphException(Reason.MALFORMED_METADATA, yamlPath.toString(),
                    "Failed to read " + yamlPath + ": " + e.getMessage(), e);
        }
    }

    // Values are version constraints or source descriptions, only the keys matter here.
    private static List<String> keysOf(JsonNode section) {
        List<String> keys = new ArrayList<>();
        if (section == null || !section.isObject()) return keys;
        for (Iterator<String> it = section.fieldNames(); it.hasNext(); ) {
            keys.add(it.next());
        }
        return keys;
    }
}
