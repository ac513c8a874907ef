package com.github.danielflower.mavenplugins.releaseplan.report;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reading and extending markdown changelogs where each release starts with a <code>## [version]</code> heading,
 * newest first.
 */
public final class Changelogs {

    public static final String HEADER = "# Changelog\n"
        + "\n"
        + "All notable changes to this project will be documented in this file.\n"
        + "\n"
        + "The format is based on [Keep a Changelog](https://keepachangelog.com/en/1.0.0/),\n"
        + "and this project adheres to [Semantic Versioning](https://semver.org/spec/v2.0.0.html).\n";

    private static final Pattern RELEASE_HEADING = Pattern.compile("(?m)^## \\[(?<version>[^\\]]+)\\]");
    private static final String UNRELEASED = "unreleased";

    private Changelogs() {
    }

    /**
     * @return the version of the newest release in the changelog
     */
    public static Optional<String> lastVersion(String changelog) {
        Matcher matcher = RELEASE_HEADING.matcher(changelog);
        while (matcher.find()) {
            String version = matcher.group("version").trim();
            if (!version.equalsIgnoreCase(UNRELEASED)) {
                return Optional.of(version);
            }
        }
        return Optional.empty();
    }

    /**
     * A new changelog holding a single release.
     */
    public static String create(String entry) {
        return HEADER + "\n" + entry;
    }

    /**
     * Inserts a release above the newest release of an existing changelog, keeping everything before it (the
     * header and an unreleased section) in place.
     */
    public static String prepend(String oldChangelog, String entry) {
        Matcher matcher = RELEASE_HEADING.matcher(oldChangelog);
        while (matcher.find()) {
            if (!matcher.group("version").trim().equalsIgnoreCase(UNRELEASED)) {
                return oldChangelog.substring(0, matcher.start()) + entry + "\n" + oldChangelog.substring(matcher.start());
            }
        }
        String separator = oldChangelog.isEmpty() || oldChangelog.endsWith("\n\n") ? "" : oldChangelog.endsWith("\n") ? "\n" : "\n\n";
        return oldChangelog + separator + entry;
    }
}
