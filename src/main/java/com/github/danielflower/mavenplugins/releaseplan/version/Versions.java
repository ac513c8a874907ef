package com.github.danielflower.mavenplugins.releaseplan.version;

import com.vdurmont.semver4j.Semver;
import com.vdurmont.semver4j.SemverException;

import java.util.Arrays;
import java.util.Collection;
import java.util.Optional;

/**
 * Helpers around {@link Semver} for strict major.minor.patch[-pre][+build] versions.
 */
public final class Versions {

    private Versions() {
    }

    public static Semver parse(String version) {
        return new Semver(version, Semver.SemverType.STRICT);
    }

    public static Optional<Semver> tryParse(String version) {
        if (version == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(parse(version.trim()));
        } catch (SemverException e) {
            return Optional.empty();
        }
    }

    public static boolean isPrerelease(Semver version) {
        return preReleaseTokens(version).length > 0;
    }

    public static String[] preReleaseTokens(Semver version) {
        String[] tokens = version.getSuffixTokens();
        return tokens == null ? new String[0] : tokens;
    }

    public static Semver of(int major, int minor, int patch) {
        return parse(major + "." + minor + "." + patch);
    }

    public static Semver incrementPatch(Semver version) {
        return of(version.getMajor(), version.getMinor(), version.getPatch() + 1);
    }

    /**
     * 1.0.0-alpha.1 becomes 1.0.0-alpha.2; 1.0.0-rc becomes 1.0.0-rc.1. A version without a pre-release gets the
     * next patch with pre-release "1", so the result is still greater than the input.
     */
    public static Semver incrementPrerelease(Semver version) {
        String[] tokens = preReleaseTokens(version);
        if (tokens.length == 0) {
            return parse(incrementPatch(version).getValue() + "-1");
        }
        String[] next = Arrays.copyOf(tokens, tokens.length);
        String last = next[next.length - 1];
        if (last.matches("\\d+")) {
            next[next.length - 1] = String.valueOf(Long.parseLong(last) + 1);
        } else {
            next = Arrays.copyOf(next, next.length + 1);
            next[next.length - 1] = "1";
        }
        return parse(version.getMajor() + "." + version.getMinor() + "." + version.getPatch() + "-" + String.join(".", next));
    }

    public static boolean isGreater(Semver a, Semver b) {
        return a.compareTo(b) > 0;
    }

    public static boolean isSame(Semver a, Semver b) {
        return a.compareTo(b) == 0;
    }

    public static Optional<Semver> max(Collection<Semver> versions) {
        Semver max = null;
        for (Semver version : versions) {
            if (max == null || isGreater(version, max)) {
                max = version;
            }
        }
        return Optional.ofNullable(max);
    }
}
