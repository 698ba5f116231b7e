package com.libragraph.repobuilder.formats.external;

import com.libragraph.repobuilder.formats.api.ToolNotFoundException;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Finds external tools by searching the {@code PATH} environment variable.
 */
public final class ToolLocator {

    private ToolLocator() {
    }

    public static Path find(String tool, Map<String, String> environment) {
        String path = environment.get("PATH");
        if (path == null || path.isEmpty()) {
            throw new ToolNotFoundException("PATH is not set.");
        }
        String fileName = isWindows() ? tool + ".exe" : tool;
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isEmpty()) {
                continue;
            }
            Path candidate = Path.of(dir, fileName);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return candidate;
            }
        }
        throw new ToolNotFoundException("The " + tool + " utility could not be found.");
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
    }
}
