package com.github.danielflower.mavenplugins.releaseplan.plan;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Changelog contents as they will be after the packages planned so far, so that several packages writing to the
 * same changelog file add up instead of overwriting each other.
 */
class OldChangelogs {

    private final Map<Path, String> changelogs = new HashMap<>();

    /**
     * @return the changelog content, or null if the file does not exist yet
     */
    String getOrRead(Path changelogPath) throws IOException {
        Path key = changelogPath.toAbsolutePath().normalize();
        String planned = changelogs.get(key);
        if (planned != null) {
            return planned;
        }
        if (!Files.isRegularFile(key)) {
            return null;
        }
        return new String(Files.readAllBytes(key), StandardCharsets.UTF_8);
    }

    void put(Path changelogPath, String changelog) {
        changelogs.put(changelogPath.toAbsolutePath().normalize(), changelog);
    }
}
