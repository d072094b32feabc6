package com.packagegraph.metadata;

import com.packagegraph.PackageGraphException;
import com.packagegraph.PackageGraphException.Reason;
import com.packagegraph.graph.DependencyType;

import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * Loads the on-disk metadata of an installed package tree as plain lookup tables.
 * Every call reads from disk; nothing is cached.
 */
public class MetadataReader {

    private final ManifestReader manifests;
    private final LocationIndexReader locations;
    private final LockfileReader lockfile;

    public MetadataReader() {
        this(new ManifestReader(), new LocationIndexReader(), new LockfileReader());
    }

    public MetadataReader(ManifestReader manifests, LocationIndexReader locations, LockfileReader lockfile) {
        this.manifests = manifests;
        this.locations = locations;
        this.lockfile = lockfile;
    }

    /** Name of the root package and the union of its dependency, dev and override names. */
    public RootManifest readRootManifest(Path rootDir) {
        PackageManifest manifest = manifests.read(rootDir);
        if (manifest.name() == null || manifest.name().isBlank()) {
            throw new PackageGraphException(Reason.MALFORMED_METADATA,
                    rootDir.resolve(ManifestReader.MANIFEST_FILE).toString(),
                    "Root manifest in " + rootDir + " does not declare a name");
        }
        return new RootManifest(manifest.name(), manifest.allDependencyNames());
    }

    public Map<String, Path> readPackageLocations(Path rootDir) {
        return locations.read(rootDir);
    }

    public Map<String, DependencyType> readDependencyTypes(Path rootDir) {
        return lockfile.read(rootDir);
    }

    /** Same union rule as the root, applied to the manifest of any located package. */
    public Set<String> readManifestDependencies(Path packageDir) {
        return manifests.read(packageDir).allDependencyNames();
    }
}
