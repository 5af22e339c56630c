package com.libragraph.vcl.types;

/**
 * Operational status of a quota scope, ordered by severity.
 */
public enum QuotaStatus {
    OK(0, "ok"),
    APPROACHING_LIMIT(1, "approaching_limit"),
    WARNING(2, "warning"),
    CRITICAL(3, "critical");

    private final int id;
    private final String label;

    QuotaStatus(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public boolean isAtLeast(QuotaStatus other) {
        return id >= other.id;
    }

    public static QuotaStatus fromId(int id) {
        for (QuotaStatus s : values()) {
            if (s.id == id) return s;
        }
        throw new IllegalArgumentException("Unknown QuotaStatus id: " + id);
    }
}
