package com.libragraph.vcl.types;

/**
 * Why a write did not produce a new version. Returned as a value, never thrown.
 */
public enum SkipReason {
    TOO_LARGE(0, "too_large"),
    UNCHANGED(1, "unchanged"),
    DISABLED(2, "disabled"),
    QUOTA_EXCEEDED(3, "quota_exceeded");

    private final int id;
    private final String label;

    SkipReason(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static SkipReason fromId(int id) {
        for (SkipReason r : values()) {
            if (r.id == id) return r;
        }
        throw new IllegalArgumentException("Unknown SkipReason id: " + id);
    }
}
