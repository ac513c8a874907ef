package com.github.danielflower.mavenplugins.releaseplan.version;

import com.vdurmont.semver4j.Semver;
import org.apache.maven.artifact.versioning.DefaultArtifactVersion;
import org.apache.maven.artifact.versioning.InvalidVersionSpecificationException;
import org.apache.maven.artifact.versioning.VersionRange;

import java.util.Optional;

/**
 * The version requirement a package declares on one of its dependencies. Either a single version, as Maven writes
 * them, or a range such as <code>[1.0,2.0)</code>.
 */
public class VersionConstraint {

    private final String text;
    private final Semver exact;
    private final VersionRange range;

    private VersionConstraint(String text, Semver exact, VersionRange range) {
        this.text = text;
        this.exact = exact;
        this.range = range;
    }

    /**
     * @return the parsed constraint, or null if the text is empty or a property reference such as
     * <code>${project.version}</code> that does not pin a version
     */
    public static VersionConstraint parse(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty() || trimmed.contains("${")) {
            return null;
        }
        if (trimmed.startsWith("[") || trimmed.startsWith("(")) {
            try {
                return new VersionConstraint(trimmed, null, VersionRange.createFromVersionSpec(trimmed));
            } catch (InvalidVersionSpecificationException e) {
                return null;
            }
        }
        Optional<Semver> exact = Versions.tryParse(trimmed);
        return exact.isPresent() ? new VersionConstraint(trimmed, exact.get(), null) : null;
    }

    /**
     * True when a dependency on this constraint has to be rewritten for the dependent to pick up {@code newVersion}.
     */
    public boolean isOutdatedBy(Semver newVersion) {
        if (exact != null) {
            return Versions.isGreater(newVersion, exact);
        }
        return !range.containsVersion(new DefaultArtifactVersion(newVersion.getValue()));
    }

    public boolean isRange() {
        return range != null;
    }

    @Override
    public String toString() {
        return text;
    }
}
