package com.libragraph.vcl.core.version;

import com.libragraph.vcl.core.quota.ScopeKey;
import com.libragraph.vcl.types.ChangeKind;
import com.libragraph.vcl.util.ContentHash;

import java.util.Objects;

/**
 * Everything needed to record one version. {@code digest} may be null and is then computed.
 */
public record VersionRequest(
        long fileId,
        ScopeKey scope,
        byte[] content,
        ChangeKind changeKind,
        ContentHash digest,
        boolean priority,
        String comment,
        boolean wasCached,
        Integer cacheDurationSeconds
) {
    public VersionRequest {
        Objects.requireNonNull(scope, "scope cannot be null");
        Objects.requireNonNull(content, "content cannot be null");
        Objects.requireNonNull(changeKind, "changeKind cannot be null");
        if (scope.isGlobal()) {
            throw new IllegalArgumentException("Versions belong to an owner scope, not the global default");
        }
    }

    public static VersionRequest of(long fileId, ScopeKey scope, byte[] content, ChangeKind changeKind) {
        return new VersionRequest(fileId, scope, content, changeKind, null, false, null, false, null);
    }

    public VersionRequest withDigest(ContentHash digest) {
        return new VersionRequest(fileId, scope, content, changeKind, digest, priority, comment,
                wasCached, cacheDurationSeconds);
    }

    public VersionRequest withPriority(boolean priority) {
        return new VersionRequest(fileId, scope, content, changeKind, digest, priority, comment,
                wasCached, cacheDurationSeconds);
    }

    public VersionRequest withComment(String comment) {
        return new VersionRequest(fileId, scope, content, changeKind, digest, priority, comment,
                wasCached, cacheDurationSeconds);
    }

    public VersionRequest cached(int cacheDurationSeconds) {
        return new VersionRequest(fileId, scope, content, changeKind, digest, priority, comment,
                true, cacheDurationSeconds);
    }
}
