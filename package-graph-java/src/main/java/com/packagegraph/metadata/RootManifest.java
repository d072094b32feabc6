package com.packagegraph.metadata;

import java.util.Set;

/**
 * Name of the root package and the union of its declared dependency names.
 */
public record RootManifest(String name, Set<String> dependencyNames) {}
