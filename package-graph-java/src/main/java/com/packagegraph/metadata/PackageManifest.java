package com.packagegraph.metadata;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The parts of a package manifest (pubspec.yaml) the graph needs.
 * Dependency lists keep the order in which the manifest declares them.
 */
public record PackageManifest(
    String name,                     // nullable, only the root manifest must declare it
    List<String> dependencies,
    List<String> devDependencies,
    List<String> dependencyOverrides
) {

    /**
     * Union of regular, dev and override dependencies, first declaration wins the position.
     * Dev dependencies and overrides are folded in for every package, not only the root,
     * so test-only sources of dependencies are part of the graph too.
     */
    public Set<String> allDependencyNames() {
        Set<String> names = new LinkedHashSet<>(dependencies);
        names.addAll(devDependencies);
        names.addAll(dependencyOverrides);
        return names;
    }
}
