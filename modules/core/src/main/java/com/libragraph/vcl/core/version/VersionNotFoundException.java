package com.libragraph.vcl.core.version;

/**
 * Thrown when a version id does not resolve.
 */
public class VersionNotFoundException extends RuntimeException {

    private final long versionId;

    public VersionNotFoundException(long versionId) {
        super("Version not found: id=" + versionId);
        this.versionId = versionId;
    }

    public long versionId() {
        return versionId;
    }
}
