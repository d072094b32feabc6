package com.packagegraph.metadata;

import com.packagegraph.PackageGraphException;
import com.packagegraph.PackageGraphException.Reason;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses the .packages location index: one {@code name:location} line per resolved package,
 * where the location is a file URI or a path ending in {@code lib/}.
 */
public class LocationIndexReader {

    public static final String LOCATION_INDEX_FILE = ".packages";

    private static final String LIB_SUFFIX = "lib/";

    /**
     * Maps every package listed in the index to the absolute path of its top level directory.
     * Relative locations are resolved against {@code rootDir}. The first line is a header and
     * is always skipped; later blank and {@code #} lines are ignored.
     *
     * @throws PackageGraphException MISSING_LOCATION_INDEX if the index does not exist,
     *         MALFORMED_METADATA for a line that is not {@code name:...lib/}
     */
    public Map<String, Path> read(Path rootDir) {
        Path indexPath = rootDir.resolve(LOCATION_INDEX_FILE);
        if (!Files.isRegularFile(indexPath)) {
            throw new PackageGraphException(Reason.MISSING_LOCATION_INDEX, indexPath.toString(),
                    "Unable to generate package graph, no " + LOCATION_INDEX_FILE + " found in " + rootDir
                            + ". Run the package install step in the root directory first.");
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(indexPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new PackageGraphException(Reason.MALFORMED_METADATA, indexPath.toString(),
                    "Failed to read " + indexPath + ": " + e.getMessage(), e);
        }

        Map<String, Path> locations = new LinkedHashMap<>();
        for (String raw : lines.subList(Math.min(1, lines.size()), lines.size())) {
            String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) continue;

            int colon = line.indexOf(':');
            if (colon <= 0 || !line.endsWith(LIB_SUFFIX)) {
                throw new PackageGraphException(Reason.MALFORMED_METADATA, indexPath.toString(),
                        "Malformed entry in " + indexPath + ": '" + line + "'");
            }
            String name = line.substring(0, colon);
            String location = line.substring(colon + 1, line.length() - LIB_SUFFIX.length());
            if (location.endsWith("/")) {
                location = location.substring(0, location.length() - 1);
            }
            locations.put(name, toPath(rootDir, location, indexPath));
        }
        return locations;
    }

    static Path toPath(Path rootDir, String location, Path indexPath) {
        Path path;
        try {
            path = fromUri(new URI(location), location, indexPath);
        } catch (URISyntaxException e) {
            // characters a URI does not allow, e.g. spaces, mean a plain path
            path = Paths.get(location);
        }
        return path.isAbsolute() ? path : rootDir.resolve(path);
    }

    private static Path fromUri(URI uri, String location, Path indexPath) {
        String scheme = uri.getScheme();
        if (scheme == null) {
            return Paths.get(uri.getPath());
        }
        // one letter is a drive, not a scheme
        if (scheme.length() == 1) {
            return Paths.get(location);
        }
        if (!"file".equalsIgnoreCase(scheme)) {
            throw new PackageGraphException(Reason.MALFORMED_METADATA, indexPath.toString(),
                    "Unsupported location '" + location + "' in " + indexPath + ", only file URIs are allowed");
        }
        try {
            return Paths.get(uri);
        } catch (IllegalArgumentException e) {
            throw new PackageGraphException(Reason.MALFORMED_METADATA, indexPath.toString(),
                    "Invalid file URI '" + location + "' in " + indexPath, e);
        }
    }
}
