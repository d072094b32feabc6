package com.packagegraph.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Works out the toolchain installation directory used for the synthetic toolchain package.
 */
public class ToolchainLocator {

    public static final String TOOLCHAIN_ENV = "PACKAGE_GRAPH_TOOLCHAIN";

    private final Map<String, String> env;

    public ToolchainLocator() {
        this(System.getenv());
    }

    public ToolchainLocator(Map<String, String> env) {
        this.env = env;
    }

    /**
     * Installation directory of a toolchain whose executable lives at {@code <install>/bin/<exe>}.
     */
    public static Path fromExecutable(Path executable) {
        Path bin = executable.toAbsolutePath().normalize().getParent();
        return bin == null ? null : bin.getParent();
    }

    /**
     * First match of: explicit directory, directory derived from an executable,
     * {@value #TOOLCHAIN_ENV}. Null if none is set.
     */
    public Path locate(String toolchainPath, String toolchainExecutable) {
        if (toolchainPath != null && !toolchainPath.isBlank()) {
            return Paths.get(toolchainPath);
        }
        if (toolchainExecutable != null && !toolchainExecutable.isBlank()) {
            return fromExecutable(Paths.get(toolchainExecutable));
        }
        String fromEnv = env.get(TOOLCHAIN_ENV);
        return fromEnv == null || fromEnv.isBlank() ? null : Paths.get(fromEnv);
    }
}
