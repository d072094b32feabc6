package com.packagegraph.config;

import com.google.gson.annotations.SerializedName;

/**
 * Deserialized form of the optional package_graph.json in the root package directory.
 */
public class GraphConfig {

    /** Toolchain installation directory; wins over {@link #toolchainExecutable}. */
    @SerializedName("toolchain_path")
    private String toolchainPath;

    /** Path of the toolchain executable, the installation is two directories up. */
    @SerializedName("toolchain_executable")
    private String toolchainExecutable;

    /** Where package_graph.snapshot.json is written; no snapshot when absent. */
    @SerializedName("output_dir")
    private String outputDir;

    public GraphConfig() {}

    public GraphConfig(String toolchainPath, String toolchainExecutable, String outputDir) {
        this.toolchainPath = toolchainPath;
        this.toolchainExecutable = toolchainExecutable;
        this.outputDir = outputDir;
    }

    public String getToolchainPath()       { return toolchainPath; }
    public String getToolchainExecutable() { return toolchainExecutable; }
    public String getOutputDir()           { return outputDir; }

    /** Values set in {@code overrides} replace the ones in this config. */
    public GraphConfig overriddenBy(GraphConfig overrides) {
        return new GraphConfig(
                overrides.toolchainPath != null ? overrides.toolchainPath : toolchainPath,
                overrides.toolchainExecutable != null ? overrides.toolchainExecutable : toolchainExecutable,
                overrides.outputDir != null ? overrides.outputDir : outputDir);
    }
}
