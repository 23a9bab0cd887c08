package com.libragraph.vfs.types;

/**
 * Document type discriminator stored in the {@code type} field of every VFS document.
 */
public enum NodeType {
    FILE("file"),
    DIRECTORY("directory");

    private final String label;

    NodeType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static NodeType fromLabel(String label) {
        for (NodeType t : values()) {
            if (t.label.equals(label)) return t;
        }
        throw new IllegalArgumentException("Unknown NodeType label: " + label);
    }
}
