package com.libragraph.repobuilder.types;

public enum FileRole {
    RUN("run"),
    DOC("doc"),
    SOURCE("source");

    private final String label;

    FileRole(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
