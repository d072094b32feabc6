package com.packagegraph.graph;

/**
 * How a package's source is obtained. This dictates how the package should be watched
 * for changes.
 */
public enum DependencyType {
    VERSION_CONTROL("git"),
    REGISTRY_HOSTED("hosted"),
    FILESYSTEM_PATH("path"),
    TOOLCHAIN_BUNDLED("sdk");

    private final String sourceTag;

    DependencyType(String sourceTag) {
        this.sourceTag = sourceTag;
    }

    /** The {@code source} value used for this type in the lock file. */
    public String sourceTag() {
        return sourceTag;
    }

    /** Registry and toolchain sources are immutable once installed. */
    public boolean mayChangeLocally() {
        return this == VERSION_CONTROL || this == FILESYSTEM_PATH;
    }

    /** Returns the type for a lock file source tag, or null if the tag is not known. */
    public static DependencyType fromSourceTag(String tag) {
        for (DependencyType type : values()) {
            if (type.sourceTag.equals(tag)) return type;
        }
        return null;
    }
}
