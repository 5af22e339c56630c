package com.libragraph.vcl.core.quota;

/**
 * Identifies a quota scope. A {@code null} owner is the platform-wide default.
 */
public record ScopeKey(Integer ownerId) {

    public static final ScopeKey GLOBAL = new ScopeKey(null);

    public static ScopeKey owner(int ownerId) {
        return new ScopeKey(ownerId);
    }

    public boolean isGlobal() {
        return ownerId == null;
    }

    @Override
    public String toString() {
        return isGlobal() ? "global" : "owner:" + ownerId;
    }
}
