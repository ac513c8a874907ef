package com.github.danielflower.mavenplugins.releaseplan.plan;

import com.github.danielflower.mavenplugins.releaseplan.compat.CompatibilityCheck;
import com.github.danielflower.mavenplugins.releaseplan.diff.Commit;
import com.vdurmont.semver4j.Semver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The planned release of one package.
 */
public final class UpdateResult {

    private final Semver nextVersion;
    private final String changelog;
    private final CompatibilityCheck compatibilityCheck;
    private final Semver lastPublishedVersion;
    private final List<Commit> commits;

    public UpdateResult(Semver nextVersion, String changelog, CompatibilityCheck compatibilityCheck,
                        Semver lastPublishedVersion, List<Commit> commits) {
        this.nextVersion = nextVersion;
        this.changelog = changelog;
        this.compatibilityCheck = compatibilityCheck;
        this.lastPublishedVersion = lastPublishedVersion;
        this.commits = Collections.unmodifiableList(new ArrayList<>(commits));
    }

    public Semver getNextVersion() {
        return nextVersion;
    }

    /**
     * @return the complete new content of the changelog file, or null if the changelog is not updated
     */
    public String getChangelog() {
        return changelog;
    }

    public CompatibilityCheck getCompatibilityCheck() {
        return compatibilityCheck;
    }

    /**
     * @return the last published version, or null if the package was never published
     */
    public Semver getLastPublishedVersion() {
        return lastPublishedVersion;
    }

    public List<Commit> getCommits() {
        return commits;
    }

    @Override
    public String toString() {
        return nextVersion + compatibilityCheck.describe() + " (" + commits.size() + " commits)";
    }
}
