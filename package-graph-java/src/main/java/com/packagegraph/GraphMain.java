package com.packagegraph;

import com.packagegraph.config.ConfigReader;
import com.packagegraph.config.GraphConfig;
import com.packagegraph.config.ToolchainLocator;
import com.packagegraph.graph.PackageGraph;
import com.packagegraph.graph.PackageGraphBuilder;
import com.packagegraph.snapshot.SnapshotSerializer;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command-line entry point.
 *
 * Usage:
 *   java -jar package-graph-java.jar graph \
 *     [--root <package-dir>] \
 *     [--toolchain <install-dir> | --toolchain-executable <path-to-exe>] \
 *     [--output <dir>]
 */
public class GraphMain {

    public static void main(String[] args) {
        try {
            run(args, System.out);
            System.exit(0);
        } catch (UsageException e) {
            System.err.println("[package-graph] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar package-graph-java.jar graph [--root <dir>] "
                    + "[--toolchain <dir> | --toolchain-executable <exe>] [--output <dir>]");
            System.exit(2);
        } catch (PackageGraphException e) {
            System.err.println("[package-graph] FATAL: " + e.reason() + ": " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            System.err.println("[package-graph] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static PackageGraph run(String[] args, PrintStream out) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("graph")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        String rootDir = ".";
        String toolchain = null;
        String toolchainExecutable = null;
        String outputDir = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--root"                 -> rootDir             = requireNext(args, i++, "--root");
                case "--toolchain"            -> toolchain           = requireNext(args, i++, "--toolchain");
                case "--toolchain-executable" -> toolchainExecutable = requireNext(args, i++, "--toolchain-executable");
                case "--output"               -> outputDir           = requireNext(args, i++, "--output");
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }
        if (toolchain != null && toolchainExecutable != null) {
            throw new UsageException("--toolchain and --toolchain-executable are mutually exclusive");
        }

        Path root = Paths.get(rootDir).toAbsolutePath().normalize();

        // Flags win over package_graph.json
        GraphConfig config = new ConfigReader().read(root)
                .overriddenBy(new GraphConfig(toolchain, toolchainExecutable, outputDir));
        Path toolchainPath = new ToolchainLocator()
                .locate(config.getToolchainPath(), config.getToolchainExecutable());
        if (toolchainPath == null) {
            System.err.println("[package-graph] WARNING: no toolchain location configured, "
                    + PackageGraph.TOOLCHAIN_PACKAGE + " will have no path");
        }

        System.err.println("[package-graph] Building package graph for: " + root);
        PackageGraph graph = new PackageGraphBuilder(toolchainPath).buildFromPath(root);
        System.err.println("[package-graph] Graph complete: root '" + graph.root().name() + "', "
                + graph.allPackages().size() + " packages");

        graph.findCycle().ifPresent(cycle -> System.err.println(
                "[package-graph] WARNING: dependency cycle: " + String.join(" -> ", cycle)));

        out.print(graph);

        if (config.getOutputDir() != null) {
            new SnapshotSerializer().write(graph, root.resolve(config.getOutputDir()));
        }
        return graph;
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
