package com.libragraph.repobuilder;

import io.quarkus.test.junit.QuarkusTestProfile;
import io.quarkus.test.junit.TestProfile;
import io.quarkus.test.junit.main.Launch;
import io.quarkus.test.junit.main.LaunchResult;
import io.quarkus.test.junit.main.QuarkusMainTest;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

@QuarkusMainTest
@TestProfile(WarningOutputTest.DuplicateEntryProfile.class)
class WarningOutputTest {

    public static class DuplicateEntryProfile implements QuarkusTestProfile {
        @Override
        public Map<String, String> getConfigOverrides() {
            return Map.of(
                    "repobuilder.mode", "create-package",
                    "repobuilder.package-list", "src/test/resources/duplicate-entries.lst");
        }
    }

    @Test
    @Launch(value = {}, exitCode = 1)
    void shouldPrefixWarningsWithProgramName(LaunchResult result) {
        assertThat(Stream.concat(result.getOutputStream().stream(), result.getErrorStream().stream()))
                .contains("repobuilder: warning: ignoring 'T a': already marked as 'S'")
                .contains("repobuilder: No repository location was specified.");
    }
}
