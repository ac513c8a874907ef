package com.github.danielflower.mavenplugins.releaseplan.plan;

import com.github.danielflower.mavenplugins.releaseplan.diff.ReleaseTagPattern;
import com.github.danielflower.mavenplugins.releaseplan.report.CompareLinks;
import com.github.danielflower.mavenplugins.releaseplan.workspace.Package;
import com.github.danielflower.mavenplugins.releaseplan.workspace.Workspace;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Everything a planning run needs to know besides the repository itself.
 */
public class UpdateRequest {

    public static final String CHANGELOG_FILE_NAME = "CHANGELOG.md";

    private final Workspace workspace;
    private final PackageUpdateConfig defaultConfig;
    private final Map<String, PackageUpdateConfig> packageConfigs;
    private final String singlePackage;
    private final boolean allowDirty;
    private final Pattern releaseCommits;
    private final boolean sortCommitsOldestFirst;
    private final String repositoryUrl;
    private final LocalDate releaseDate;

    private UpdateRequest(Builder builder) {
        this.workspace = builder.workspace;
        this.defaultConfig = builder.defaultConfig;
        this.packageConfigs = new HashMap<>(builder.packageConfigs);
        this.singlePackage = builder.singlePackage;
        this.allowDirty = builder.allowDirty;
        this.releaseCommits = builder.releaseCommits;
        this.sortCommitsOldestFirst = builder.sortCommitsOldestFirst;
        this.repositoryUrl = builder.repositoryUrl;
        this.releaseDate = builder.releaseDate;
    }

    public static Builder builder(Workspace workspace) {
        return new Builder(workspace);
    }

    public Workspace getWorkspace() {
        return workspace;
    }

    public PackageUpdateConfig configFor(String packageName) {
        return packageConfigs.getOrDefault(packageName, defaultConfig);
    }

    public String getSinglePackage() {
        return singlePackage;
    }

    public boolean isAllowDirty() {
        return allowDirty;
    }

    /**
     * @return packages are only planned when one of their commits matches this, or null to plan every package
     */
    public Pattern getReleaseCommits() {
        return releaseCommits;
    }

    public boolean isSortCommitsOldestFirst() {
        return sortCommitsOldestFirst;
    }

    public String getRepositoryUrl() {
        return repositoryUrl;
    }

    public LocalDate getReleaseDate() {
        return releaseDate;
    }

    public Path changelogPath(Package pkg) {
        Path configured = configFor(pkg.getName()).getChangelogPath();
        if (configured == null) {
            return pkg.getDirectory().resolve(CHANGELOG_FILE_NAME);
        }
        return workspace.getRootDirectory().resolve(configured);
    }

    public ReleaseTagPattern tagPattern(Package pkg) {
        String template = configFor(pkg.getName()).getTagNameTemplate();
        if (template == null || template.isEmpty()) {
            template = ReleaseTagPattern.defaultTemplate(workspace.isMultiPackage());
        }
        return new ReleaseTagPattern(template, pkg.getName());
    }

    /**
     * Compare links between the release tags of every package, or no links when no repository URL is set.
     */
    public CompareLinks compareLinks() {
        Map<String, ReleaseTagPattern> tagPatterns = new HashMap<>();
        for (Package pkg : workspace.getPackages()) {
            tagPatterns.put(pkg.getName(), tagPattern(pkg));
        }
        return new CompareLinks(repositoryUrl, tagPatterns);
    }

    public boolean isGitOnly(Package pkg) {
        Boolean gitOnly = configFor(pkg.getName()).getGitOnly();
        return gitOnly != null && gitOnly;
    }

    public static class Builder {
        private final Workspace workspace;
        private PackageUpdateConfig defaultConfig = PackageUpdateConfig.DEFAULT;
        private final Map<String, PackageUpdateConfig> packageConfigs = new HashMap<>();
        private String singlePackage;
        private boolean allowDirty;
        private Pattern releaseCommits;
        private boolean sortCommitsOldestFirst;
        private String repositoryUrl;
        private LocalDate releaseDate = LocalDate.now();

        private Builder(Workspace workspace) {
            this.workspace = workspace;
        }

        public Builder defaultConfig(PackageUpdateConfig defaultConfig) {
            this.defaultConfig = defaultConfig;
            return this;
        }

        public Builder packageConfig(String packageName, PackageUpdateConfig config) {
            this.packageConfigs.put(packageName, config);
            return this;
        }

        public Builder singlePackage(String singlePackage) {
            this.singlePackage = singlePackage;
            return this;
        }

        public Builder allowDirty(boolean allowDirty) {
            this.allowDirty = allowDirty;
            return this;
        }

        public Builder releaseCommits(Pattern releaseCommits) {
            this.releaseCommits = releaseCommits;
            return this;
        }

        public Builder sortCommitsOldestFirst(boolean sortCommitsOldestFirst) {
            this.sortCommitsOldestFirst = sortCommitsOldestFirst;
            return this;
        }

        public Builder repositoryUrl(String repositoryUrl) {
            this.repositoryUrl = repositoryUrl;
            return this;
        }

        public Builder releaseDate(LocalDate releaseDate) {
            this.releaseDate = releaseDate;
            return this;
        }

        public UpdateRequest build() {
            return new UpdateRequest(this);
        }
    }
}
