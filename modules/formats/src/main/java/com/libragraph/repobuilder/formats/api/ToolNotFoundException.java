package com.libragraph.repobuilder.formats.api;

public class ToolNotFoundException extends ArchiveException {

    public ToolNotFoundException(String message) {
        super(message);
    }
}
