package com.packagegraph.graph;

import com.packagegraph.PackageGraphException;
import com.packagegraph.PackageGraphException.Reason;
import com.packagegraph.metadata.MetadataReader;
import com.packagegraph.metadata.RootManifest;

import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds a {@link PackageGraph} either from an installed package tree on disk or from a root
 * node whose edges the caller already attached.
 *
 * The builder holds no state between calls; every build re-reads its inputs.
 */
public class PackageGraphBuilder {

    private final MetadataReader reader;
    private final Path toolchainPath;

    /**
     * @param toolchainPath installation directory of the toolchain, used as the path of the
     *                      synthetic {@link PackageGraph#TOOLCHAIN_PACKAGE} node; may be null
     */
    public PackageGraphBuilder(Path toolchainPath) {
        this(new MetadataReader(), toolchainPath);
    }

    public PackageGraphBuilder(MetadataReader reader, Path toolchainPath) {
        this.reader = reader;
        this.toolchainPath = toolchainPath;
    }

    /**
     * Creates the graph for the package whose top level directory is {@code rootDir}.
     * The tree must already be installed: manifest, lock file and location index all present.
     */
    public PackageGraph buildFromPath(Path rootDir) {
        Path rootPath = PackageNode.canonicalize(rootDir);
        RootManifest rootManifest = reader.readRootManifest(rootPath);
        String rootName = rootManifest.name();

        Map<String, Path> locations = new LinkedHashMap<>(reader.readPackageLocations(rootPath));
        locations.remove(rootName);
        Map<String, DependencyType> dependencyTypes = reader.readDependencyTypes(rootPath);

        Map<String, PackageNode> nodes = new LinkedHashMap<>();
        PackageNode rootNode = new PackageNode(rootName, rootPath, DependencyType.FILESYSTEM_PATH, true);
        nodes.put(rootName, rootNode);
        for (Map.Entry<String, Path> location : locations.entrySet()) {
            String name = location.getKey();
            DependencyType type = dependencyTypes.get(name);
            if (type == null) {
                throw new PackageGraphException(Reason.MISSING_DEPENDENCY_TYPE, name,
                        "Package '" + name + "' has a location but no entry in the lock file");
            }
            nodes.put(name, new PackageNode(name, location.getValue(), type, false));
        }
        PackageNode toolchain = toolchainNode();
        nodes.putIfAbsent(PackageGraph.TOOLCHAIN_PACKAGE, toolchain);

        wire(rootNode, rootManifest.dependencyNames(), nodes);
        for (PackageNode node : nodes.values()) {
            if (node == rootNode || node == toolchain) continue;
            wire(node, reader.readManifestDependencies(node.path()), nodes);
        }

        Map<String, PackageNode> reachable = reachableFrom(rootNode);
        for (PackageNode node : nodes.values()) {
            if (node != toolchain && !reachable.containsKey(node.name())) {
                System.err.println("[package-graph] WARNING: package not reachable from '" + rootName
                        + "' (dropped): " + node.name());
            }
        }
        return new PackageGraph(rootNode, reachable, toolchain);
    }

    /**
     * Creates the graph from a root node whose dependency edges are already attached.
     * Every node reachable from {@code root} becomes part of the graph; a package reached
     * through several paths is recorded once, under the first node found with its name.
     */
    public PackageGraph buildFromRoot(PackageNode root) {
        if (root == null) {
            throw new PackageGraphException(Reason.INVALID_ROOT, null, "Root node must not be null");
        }
        return new PackageGraph(root, reachableFrom(root), toolchainNode());
    }

    private PackageNode toolchainNode() {
        return new PackageNode(PackageGraph.TOOLCHAIN_PACKAGE, toolchainPath, DependencyType.TOOLCHAIN_BUNDLED, false);
    }

    private static void wire(PackageNode node, Collection<String> dependencyNames, Map<String, PackageNode> nodes) {
        for (String dependencyName : dependencyNames) {
            PackageNode dependency = nodes.get(dependencyName);
            if (dependency == null) {
                throw new PackageGraphException(Reason.DANGLING_DEPENDENCY, dependencyName,
                        "Package '" + node.name() + "' depends on '" + dependencyName
                                + "', which has no location in the package tree");
            }
            node.addDependency(dependency);
        }
    }

    private static Map<String, PackageNode> reachableFrom(PackageNode root) {
        Map<String, PackageNode> reachable = new LinkedHashMap<>();
        reachable.put(root.name(), root);
        addDependencies(root, reachable);
        return reachable;
    }

    // Visited check before descending keeps shared dependencies and cycles to one visit.
    private static void addDependencies(PackageNode node, Map<String, PackageNode> reachable) {
        for (PackageNode dependency : node.dependencies()) {
            if (reachable.containsKey(dependency.name())) continue;
            reachable.put(dependency.name(), dependency);
            addDependencies(dependency, reachable);
        }
    }
}
