package com.libragraph.vcl.core.version;

import com.libragraph.vcl.types.SkipReason;

/**
 * Whether a write should produce a version. A skip is a value for the caller to relay, not an error.
 */
public record VersionDecision(boolean create, SkipReason reason, String message) {

    private static final VersionDecision CREATE = new VersionDecision(true, null, null);

    public static VersionDecision createVersion() {
        return CREATE;
    }

    public static VersionDecision skip(SkipReason reason, String message) {
        return new VersionDecision(false, reason, message);
    }
}
