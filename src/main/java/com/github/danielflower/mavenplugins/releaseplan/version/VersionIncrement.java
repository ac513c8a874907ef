package com.github.danielflower.mavenplugins.releaseplan.version;

import com.vdurmont.semver4j.Semver;

/**
 * The part of a version that a release moves forward.
 */
public enum VersionIncrement {
    MAJOR {
        @Override
        public Semver apply(Semver version) {
            return Versions.of(version.getMajor() + 1, 0, 0);
        }
    },
    MINOR {
        @Override
        public Semver apply(Semver version) {
            return Versions.of(version.getMajor(), version.getMinor() + 1, 0);
        }
    },
    PATCH {
        @Override
        public Semver apply(Semver version) {
            return Versions.incrementPatch(version);
        }
    },
    PRERELEASE {
        @Override
        public Semver apply(Semver version) {
            return Versions.incrementPrerelease(version);
        }
    };

    /**
     * Returns the next version. Build metadata is never carried over.
     */
    public abstract Semver apply(Semver version);
}
