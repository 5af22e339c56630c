package com.libragraph.vcl.types;

public enum ChangeKind {
    CREATE(0, "create"),
    UPDATE(1, "update"),
    DELETE_MARKER(2, "delete"),
    OVERWRITE(3, "overwrite"),
    BATCHED(4, "batched");

    private final int id;
    private final String label;

    ChangeKind(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static ChangeKind fromId(int id) {
        for (ChangeKind k : values()) {
            if (k.id == id) return k;
        }
        throw new IllegalArgumentException("Unknown ChangeKind id: " + id);
    }

    public static ChangeKind fromLabel(String label) {
        for (ChangeKind k : values()) {
            if (k.label.equalsIgnoreCase(label)) return k;
        }
        throw new IllegalArgumentException("Unknown ChangeKind label: " + label);
    }
}
