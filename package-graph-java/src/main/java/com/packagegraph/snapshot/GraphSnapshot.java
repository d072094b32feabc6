package com.packagegraph.snapshot;

import com.google.gson.annotations.SerializedName;
import com.packagegraph.graph.DependencyType;
import com.packagegraph.graph.PackageGraph;
import com.packagegraph.graph.PackageNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * JSON shape of package_graph.snapshot.json. Field names use @SerializedName for snake_case keys.
 */
public final class GraphSnapshot {

    @SerializedName("root")           public String root;
    @SerializedName("toolchain_path") public String toolchainPath;
    @SerializedName("packages")       public List<PackageEntry> packages;

    public static class PackageEntry {
        @SerializedName("name")         public String name;
        @SerializedName("type")         public String type;
        @SerializedName("source")       public String source;    // lock file tag: git, hosted, path, sdk
        @SerializedName("may_change_locally") public boolean mayChangeLocally;
        @SerializedName("path")         public String path;      // nullable for the toolchain
        @SerializedName("is_root")      public boolean isRoot;
        @SerializedName("dependencies") public List<String> dependencies;
    }

    /** Packages sorted by name; dependency lists keep declaration order. */
    public static GraphSnapshot of(PackageGraph graph) {
        GraphSnapshot snapshot = new GraphSnapshot();
        snapshot.root = graph.root().name();
        PackageNode toolchain = graph.get(PackageGraph.TOOLCHAIN_PACKAGE);
        snapshot.toolchainPath = toolchain.path() == null ? null : toolchain.path().toString();

        snapshot.packages = new ArrayList<>();
        for (PackageNode node : graph.allPackages().values()) {
            PackageEntry entry = new PackageEntry();
            entry.name = node.name();
            DependencyType type = node.dependencyType();
            entry.type = type == null ? null : type.name();
            entry.source = type == null ? null : type.sourceTag();
            entry.mayChangeLocally = type != null && type.mayChangeLocally();
            entry.path = node.path() == null ? null : node.path().toString();
            entry.isRoot = node.isRoot();
            entry.dependencies = node.dependencyNames();
            snapshot.packages.add(entry);
        }
        snapshot.packages.sort(Comparator.comparing(e -> e.name));
        return snapshot;
    }
}
