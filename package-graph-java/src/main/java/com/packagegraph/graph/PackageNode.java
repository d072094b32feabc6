package com.packagegraph.graph;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A node in a {@link PackageGraph}.
 *
 * Dependency edges may be added until the node becomes part of a graph; after that the node
 * is read-only.
 */
public final class PackageNode {

    private final String name;
    private final Path path;
    private final DependencyType dependencyType;
    private final boolean root;
    private final List<PackageNode> dependencies = new ArrayList<>();
    private boolean sealed;

    /**
     * @param path top level directory of the package, stored canonical and absolute;
     *             null only for a toolchain node without a known installation
     */
    public PackageNode(String name, Path path, DependencyType dependencyType, boolean root) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Package name must not be empty");
        }
        this.name = name;
        this.path = canonicalize(path);
        this.dependencyType = dependencyType;
        this.root = root;
    }

    public String name()                   { return name; }
    public Path path()                     { return path; }
    public DependencyType dependencyType() { return dependencyType; }
    public boolean isRoot()                { return root; }

    /** Direct dependencies in declaration order. */
    public List<PackageNode> dependencies() {
        return Collections.unmodifiableList(dependencies);
    }

    public List<String> dependencyNames() {
        return dependencies.stream().map(PackageNode::name).collect(Collectors.toList());
    }

    /**
     * Adds a direct dependency edge. Returns this node for chaining.
     *
     * @throws IllegalStateException if the node already belongs to a built graph
     */
    public PackageNode addDependency(PackageNode dependency) {
        if (sealed) {
            throw new IllegalStateException("Package '" + name + "' belongs to a built graph and cannot change");
        }
        dependencies.add(dependency);
        return this;
    }

    void seal() {
        sealed = true;
    }

    /** Absolute, with no {@code .} or {@code ..} segments. Symlinks are not resolved. */
    static Path canonicalize(Path path) {
        return path == null ? null : path.toAbsolutePath().normalize();
    }

    @Override
    public String toString() {
        return "  " + name + ":\n"
                + "    type: " + dependencyType + "\n"
                + "    path: " + path + "\n"
                + "    dependencies: [" + String.join(", ", dependencyNames()) + "]";
    }
}
