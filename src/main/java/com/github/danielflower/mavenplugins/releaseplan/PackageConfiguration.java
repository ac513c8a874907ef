package com.github.danielflower.mavenplugins.releaseplan;

import com.github.danielflower.mavenplugins.releaseplan.plan.PackageUpdateConfig;
import com.github.danielflower.mavenplugins.releaseplan.version.VersionPolicy;

import java.nio.file.Paths;
import java.util.List;

/**
 * Settings for a single module, given in the plugin configuration as
 * <pre>
 * {@code
 * <packages>
 *     <package>
 *         <name>my-artifact-id</name>
 *         <versionGroup>core</versionGroup>
 *     </package>
 * </packages>
 * }
 * </pre>
 * Anything left out falls back to the plugin-wide setting.
 */
public class PackageConfiguration {

    /**
     * The artifactId of the module.
     */
    private String name;
    private String versionGroup;
    private List<String> changelogInclude;
    private String changelogPath;
    private Boolean changelogUpdate;
    private Boolean compatibilityCheck;
    private Boolean release;
    private Boolean gitOnly;
    private String tagNameTemplate;
    private Boolean featuresAlwaysIncrementMinor;
    private Boolean breakingAlwaysIncrementMajor;
    private String customMajorIncrementRegex;
    private String customMinorIncrementRegex;

    /**
     * A readme outside the module directory that is published with the module, relative to the project root.
     */
    private String readme;

    /**
     * Whether the module produces an executable, so changes to the lockfile count as changes to the module.
     */
    private boolean executable;

    public PackageConfiguration() {
    }

    public PackageConfiguration(String name) {
        this.name = name;
    }

    public PackageUpdateConfig toUpdateConfig(PackageUpdateConfig defaults) throws ValidationException {
        PackageUpdateConfig.Builder builder = defaults.toBuilder();
        VersionPolicy policy = defaults.getPolicy();
        if (featuresAlwaysIncrementMinor != null) {
            policy = policy.withFeaturesAlwaysIncrementMinor(featuresAlwaysIncrementMinor);
        }
        if (breakingAlwaysIncrementMajor != null) {
            policy = policy.withBreakingAlwaysIncrementMajor(breakingAlwaysIncrementMajor);
        }
        if (customMajorIncrementRegex != null) {
            policy = policy.withCustomMajorIncrementRegex(customMajorIncrementRegex);
        }
        if (customMinorIncrementRegex != null) {
            policy = policy.withCustomMinorIncrementRegex(customMinorIncrementRegex);
        }
        builder.policy(policy);
        if (versionGroup != null) {
            builder.versionGroup(versionGroup);
        }
        if (changelogInclude != null) {
            builder.changelogInclude(changelogInclude);
        }
        if (changelogPath != null) {
            builder.changelogPath(Paths.get(changelogPath));
        }
        if (changelogUpdate != null) {
            builder.changelogUpdate(changelogUpdate);
        }
        if (compatibilityCheck != null) {
            builder.compatibilityCheck(compatibilityCheck);
        }
        if (release != null) {
            builder.release(release);
        }
        if (gitOnly != null) {
            builder.gitOnly(gitOnly);
        }
        if (tagNameTemplate != null) {
            builder.tagNameTemplate(tagNameTemplate);
        }
        return builder.build();
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getVersionGroup() {
        return versionGroup;
    }

    public void setVersionGroup(String versionGroup) {
        this.versionGroup = versionGroup;
    }

    public List<String> getChangelogInclude() {
        return changelogInclude;
    }

    public void setChangelogInclude(List<String> changelogInclude) {
        this.changelogInclude = changelogInclude;
    }

    public String getChangelogPath() {
        return changelogPath;
    }

    public void setChangelogPath(String changelogPath) {
        this.changelogPath = changelogPath;
    }

    public Boolean getChangelogUpdate() {
        return changelogUpdate;
    }

    public void setChangelogUpdate(Boolean changelogUpdate) {
        this.changelogUpdate = changelogUpdate;
    }

    public Boolean getCompatibilityCheck() {
        return compatibilityCheck;
    }

    public void setCompatibilityCheck(Boolean compatibilityCheck) {
        this.compatibilityCheck = compatibilityCheck;
    }

    public Boolean getRelease() {
        return release;
    }

    public void setRelease(Boolean release) {
        this.release = release;
    }

    public Boolean getGitOnly() {
        return gitOnly;
    }

    public void setGitOnly(Boolean gitOnly) {
        this.gitOnly = gitOnly;
    }

    public String getTagNameTemplate() {
        return tagNameTemplate;
    }

    public void setTagNameTemplate(String tagNameTemplate) {
        this.tagNameTemplate = tagNameTemplate;
    }

    public Boolean getFeaturesAlwaysIncrementMinor() {
        return featuresAlwaysIncrementMinor;
    }

    public void setFeaturesAlwaysIncrementMinor(Boolean featuresAlwaysIncrementMinor) {
        this.featuresAlwaysIncrementMinor = featuresAlwaysIncrementMinor;
    }

    public Boolean getBreakingAlwaysIncrementMajor() {
        return breakingAlwaysIncrementMajor;
    }

    public void setBreakingAlwaysIncrementMajor(Boolean breakingAlwaysIncrementMajor) {
        this.breakingAlwaysIncrementMajor = breakingAlwaysIncrementMajor;
    }

    public String getCustomMajorIncrementRegex() {
        return customMajorIncrementRegex;
    }

    public void setCustomMajorIncrementRegex(String customMajorIncrementRegex) {
        this.customMajorIncrementRegex = customMajorIncrementRegex;
    }

    public String getCustomMinorIncrementRegex() {
        return customMinorIncrementRegex;
    }

    public void setCustomMinorIncrementRegex(String customMinorIncrementRegex) {
        this.customMinorIncrementRegex = customMinorIncrementRegex;
    }

    public String getReadme() {
        return readme;
    }

    public void setReadme(String readme) {
        this.readme = readme;
    }

    public boolean isExecutable() {
        return executable;
    }

    public void setExecutable(boolean executable) {
        this.executable = executable;
    }
}
