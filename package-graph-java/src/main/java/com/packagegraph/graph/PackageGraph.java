package com.packagegraph.graph;

import com.packagegraph.PackageGraphException;
import com.packagegraph.PackageGraphException.Reason;

import java.util.*;

/**
 * A graph of the package dependencies for an application.
 *
 * Built once by {@link PackageGraphBuilder} and read-only afterwards.
 */
public final class PackageGraph {

    /** Key of the synthetic node standing for the toolchain's bundled libraries. */
    public static final String TOOLCHAIN_PACKAGE = "$sdk";

    private final PackageNode root;
    private final Map<String, PackageNode> allPackages;

    PackageGraph(PackageNode root, Map<String, PackageNode> packages, PackageNode toolchain) {
        Map<String, PackageNode> all = new LinkedHashMap<>(packages);
        all.putIfAbsent(TOOLCHAIN_PACKAGE, toolchain);

        if (root == null || !root.isRoot()) {
            throw new PackageGraphException(Reason.INVALID_ROOT, root == null ? null : root.name(),
                    "Root node must indicate isRoot");
        }
        if (all.get(root.name()) != root) {
            throw new PackageGraphException(Reason.INVALID_ROOT, root.name(),
                    "Root node '" + root.name() + "' is not the node registered under its name");
        }
        for (PackageNode node : all.values()) {
            if (node != root && node.isRoot()) {
                throw new PackageGraphException(Reason.DUPLICATE_ROOT, node.name(),
                        "No nodes other than the root may indicate isRoot, found '" + node.name() + "'");
            }
        }
        all.values().forEach(PackageNode::seal);

        this.root = root;
        this.allPackages = Collections.unmodifiableMap(all);
    }

    public PackageNode root() {
        return root;
    }

    /** All nodes indexed by package name, including the toolchain node. */
    public Map<String, PackageNode> allPackages() {
        return allPackages;
    }

    public Optional<PackageNode> find(String packageName) {
        return Optional.ofNullable(allPackages.get(packageName));
    }

    /** Shorthand to get a package by name, null if there is none. */
    public PackageNode get(String packageName) {
        return allPackages.get(packageName);
    }

    /**
     * Looks for a dependency cycle reachable from any node.
     *
     * @return names along one cycle, the first name repeated at the end, or empty if acyclic
     */
    public Optional<List<String>> findCycle() {
        Set<String> done = new HashSet<>();
        for (PackageNode start : allPackages.values()) {
            if (done.contains(start.name())) continue;

            // iterative DFS; the stack holds the current path, the iterators its unvisited edges
            Deque<PackageNode> path = new ArrayDeque<>();
            Deque<Iterator<PackageNode>> pending = new ArrayDeque<>();
            Set<String> onPath = new HashSet<>();
            path.push(start);
            pending.push(start.dependencies().iterator());
            onPath.add(start.name());

            while (!path.isEmpty()) {
                Iterator<PackageNode> edges = pending.peek();
                if (!edges.hasNext()) {
                    PackageNode finished = path.pop();
                    pending.pop();
                    onPath.remove(finished.name());
                    done.add(finished.name());
                    continue;
                }
                PackageNode next = edges.next();
                if (onPath.contains(next.name())) {
                    List<String> cycle = new ArrayList<>();
                    Iterator<PackageNode> it = path.descendingIterator();
                    boolean inCycle = false;
                    while (it.hasNext()) {
                        String name = it.next().name();
                        if (name.equals(next.name())) inCycle = true;
                        if (inCycle) cycle.add(name);
                    }
                    cycle.add(next.name());
                    return Optional.of(cycle);
                }
                if (done.contains(next.name())) continue;
                path.push(next);
                pending.push(next.dependencies().iterator());
                onPath.add(next.name());
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        StringBuilder buffer = new StringBuilder();
        for (PackageNode node : allPackages.values()) {
            buffer.append(node).append('\n');
        }
        return buffer.toString();
    }
}
