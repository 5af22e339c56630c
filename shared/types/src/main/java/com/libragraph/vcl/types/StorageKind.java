package com.libragraph.vcl.types;

/**
 * How a version holds its content: {@code PRIMARY} versions created the blob,
 * {@code SHARED} versions reference a blob that already existed.
 */
public enum StorageKind {
    PRIMARY(0, "primary"),
    SHARED(1, "shared");

    private final int id;
    private final String label;

    StorageKind(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static StorageKind fromId(int id) {
        for (StorageKind k : values()) {
            if (k.id == id) return k;
        }
        throw new IllegalArgumentException("Unknown StorageKind id: " + id);
    }
}
