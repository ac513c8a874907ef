package com.github.danielflower.mavenplugins.releaseplan.diff;

import com.github.danielflower.mavenplugins.releaseplan.compat.CompatibilityCheck;
import com.vdurmont.semver4j.Semver;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * What changed in a package since it was last published. Commits are kept newest first, in the order the history
 * walk found them.
 */
public class Diff {

    private final List<Commit> commits = new ArrayList<>();
    private final boolean registryPackageExists;
    private boolean versionPublished = true;
    private CompatibilityCheck compatibilityCheck = CompatibilityCheck.skipped();
    private Semver registryVersion;

    public Diff(boolean registryPackageExists) {
        this.registryPackageExists = registryPackageExists;
    }

    public void addCommit(Commit commit) {
        commits.add(commit);
    }

    /**
     * Adds the commits that are not already part of this diff.
     */
    public void addCommits(Collection<Commit> toAdd) {
        for (Commit commit : toAdd) {
            if (!commits.contains(commit)) {
                commits.add(commit);
            }
        }
    }

    public List<Commit> getCommits() {
        return Collections.unmodifiableList(commits);
    }

    public List<Commit> commitsInOrder(boolean oldestFirst) {
        List<Commit> result = new ArrayList<>(commits);
        if (oldestFirst) {
            Collections.reverse(result);
        }
        return result;
    }

    public boolean hasChanged() {
        return !commits.isEmpty();
    }

    /**
     * @return true if a package with this name has been published before
     */
    public boolean isRegistryPackageExists() {
        return registryPackageExists;
    }

    /**
     * @return false if the local version was already bumped and that version is not published yet
     */
    public boolean isVersionPublished() {
        return versionPublished;
    }

    public void setVersionUnpublished(Semver lastPublishedVersion) {
        this.versionPublished = false;
        this.registryVersion = lastPublishedVersion;
    }

    /**
     * @return the last published version when the local version is already ahead of it, otherwise null
     */
    public Semver getRegistryVersion() {
        return registryVersion;
    }

    public CompatibilityCheck getCompatibilityCheck() {
        return compatibilityCheck;
    }

    public void setCompatibilityCheck(CompatibilityCheck compatibilityCheck) {
        this.compatibilityCheck = compatibilityCheck;
    }

    /**
     * A version bump is only due when the package was published, the published version is the local one, and
     * something changed since.
     */
    public boolean shouldUpdateVersion() {
        return registryPackageExists && !commits.isEmpty() && versionPublished;
    }

    public boolean anyCommitMatches(Pattern pattern) {
        for (Commit commit : commits) {
            if (pattern.matcher(commit.getMessage()).find()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "Diff{commits=" + commits.size() + ", registryPackageExists=" + registryPackageExists
            + ", versionPublished=" + versionPublished + ", compatibility=" + compatibilityCheck + "}";
    }
}
