package com.modelpack.types;

/**
 * File kinds recorded in the file metadata annotation, keyed by their tar typeflag.
 */
public enum EntryType {
    FILE(0, "file"),
    SYMLINK(2, "symlink"),
    DIRECTORY(5, "directory");

    private final int typeflag;
    private final String label;

    EntryType(int typeflag, String label) {
        this.typeflag = typeflag;
        this.label = label;
    }

    public int typeflag() {
        return typeflag;
    }

    public String label() {
        return label;
    }

    public static EntryType fromTypeflag(int typeflag) {
        for (EntryType t : values()) {
            if (t.typeflag == typeflag) return t;
        }
        throw new IllegalArgumentException("Unknown typeflag: " + typeflag);
    }
}
