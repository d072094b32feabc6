package com.packagegraph;

/**
 * Raised when a package tree cannot be turned into a graph.
 *
 * Every reason is fatal to the build in progress. {@link #subject()} names the offending
 * path or package so the caller can report it.
 */
public class PackageGraphException extends RuntimeException {

    public enum Reason {
        MISSING_MANIFEST,
        MISSING_LOCATION_INDEX,
        MISSING_LOCKFILE,
        UNKNOWN_SOURCE_TAG,
        MISSING_DEPENDENCY_TYPE,
        DANGLING_DEPENDENCY,
        INVALID_ROOT,
        DUPLICATE_ROOT,
        MALFORMED_METADATA,
        INVALID_CONFIG
    }

    private final Reason reason;
    private final String subject;

    public PackageGraphException(Reason reason, String subject, String message) {
        super(message);
        this.reason = reason;
        this.subject = subject;
    }

    public PackageGraphException(Reason reason, String subject, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.subject = subject;
    }

    public Reason reason()  { return reason; }
    public String subject() { return subject; }
}
