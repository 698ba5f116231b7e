package com.libragraph.repobuilder.core.config;

import java.util.Optional;

public enum RunMode {
    BUILD_HIERARCHY("build-hierarchy"),
    UPDATE_REPOSITORY("update-repository"),
    CREATE_PACKAGE("create-package"),
    DISASSEMBLE("disassemble"),
    VERSION("version");

    private final String configName;

    RunMode(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public static Optional<RunMode> fromConfigName(String name) {
        for (RunMode m : values()) {
            if (m.configName.equalsIgnoreCase(name.trim())) {
                return Optional.of(m);
            }
        }
        return Optional.empty();
    }
}
