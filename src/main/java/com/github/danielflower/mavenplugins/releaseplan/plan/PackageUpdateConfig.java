package com.github.danielflower.mavenplugins.releaseplan.plan;

import com.github.danielflower.mavenplugins.releaseplan.version.VersionPolicy;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * How a single package is planned. Packages without configuration of their own use the request's default.
 */
public class PackageUpdateConfig {

    public static final PackageUpdateConfig DEFAULT = builder().build();

    private final VersionPolicy policy;
    private final boolean release;
    private final boolean changelogUpdate;
    private final Path changelogPath;
    private final boolean compatibilityCheck;
    private final String tagNameTemplate;
    private final Boolean gitOnly;
    private final String versionGroup;
    private final List<String> changelogInclude;

    private PackageUpdateConfig(Builder builder) {
        this.policy = builder.policy;
        this.release = builder.release;
        this.changelogUpdate = builder.changelogUpdate;
        this.changelogPath = builder.changelogPath;
        this.compatibilityCheck = builder.compatibilityCheck;
        this.tagNameTemplate = builder.tagNameTemplate;
        this.gitOnly = builder.gitOnly;
        this.versionGroup = builder.versionGroup;
        this.changelogInclude = Collections.unmodifiableList(new ArrayList<>(builder.changelogInclude));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder starting from the settings of this config
     */
    public Builder toBuilder() {
        return new Builder()
            .policy(policy)
            .release(release)
            .changelogUpdate(changelogUpdate)
            .changelogPath(changelogPath)
            .compatibilityCheck(compatibilityCheck)
            .tagNameTemplate(tagNameTemplate)
            .gitOnly(gitOnly)
            .versionGroup(versionGroup)
            .changelogInclude(changelogInclude);
    }

    public VersionPolicy getPolicy() {
        return policy;
    }

    /**
     * @return false if the package is never part of a plan
     */
    public boolean isRelease() {
        return release;
    }

    public boolean isChangelogUpdate() {
        return changelogUpdate;
    }

    /**
     * @return the changelog file, or null for <code>CHANGELOG.md</code> in the package directory
     */
    public Path getChangelogPath() {
        return changelogPath;
    }

    public boolean isCompatibilityCheck() {
        return compatibilityCheck;
    }

    /**
     * @return the release tag template, or null for the default one
     */
    public String getTagNameTemplate() {
        return tagNameTemplate;
    }

    /**
     * @return whether only release tags are used to find the published version, or null if not set
     */
    public Boolean getGitOnly() {
        return gitOnly;
    }

    public String getVersionGroup() {
        return versionGroup;
    }

    /**
     * @return packages whose commits also go into this package's changelog
     */
    public List<String> getChangelogInclude() {
        return changelogInclude;
    }

    public static class Builder {
        private VersionPolicy policy = VersionPolicy.DEFAULT;
        private boolean release = true;
        private boolean changelogUpdate = true;
        private Path changelogPath;
        private boolean compatibilityCheck;
        private String tagNameTemplate;
        private Boolean gitOnly;
        private String versionGroup;
        private List<String> changelogInclude = new ArrayList<>();

        private Builder() {
        }

        public Builder policy(VersionPolicy policy) {
            this.policy = policy;
            return this;
        }

        public Builder release(boolean release) {
            this.release = release;
            return this;
        }

        public Builder changelogUpdate(boolean changelogUpdate) {
            this.changelogUpdate = changelogUpdate;
            return this;
        }

        public Builder changelogPath(Path changelogPath) {
            this.changelogPath = changelogPath;
            return this;
        }

        public Builder compatibilityCheck(boolean compatibilityCheck) {
            this.compatibilityCheck = compatibilityCheck;
            return this;
        }

        public Builder tagNameTemplate(String tagNameTemplate) {
            this.tagNameTemplate = tagNameTemplate;
            return this;
        }

        public Builder gitOnly(Boolean gitOnly) {
            this.gitOnly = gitOnly;
            return this;
        }

        public Builder versionGroup(String versionGroup) {
            this.versionGroup = versionGroup;
            return this;
        }

        public Builder changelogInclude(List<String> changelogInclude) {
            this.changelogInclude = new ArrayList<>(changelogInclude);
            return this;
        }

        public PackageUpdateConfig build() {
            return new PackageUpdateConfig(this);
        }
    }
}
