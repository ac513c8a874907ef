package com.github.danielflower.mavenplugins.releaseplan.report;

import com.github.danielflower.mavenplugins.releaseplan.diff.ReleaseTagPattern;
import com.github.danielflower.mavenplugins.releaseplan.version.Versions;
import com.vdurmont.semver4j.Semver;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Links comparing two release tags of a package on the repository's web site.
 */
public class CompareLinks {

    private final String repositoryUrl;
    private final Map<String, ReleaseTagPattern> tagPatterns;

    /**
     * @param repositoryUrl the web URL of the repository, or null for no links
     * @param tagPatterns   the release tag pattern of each package, by package name
     */
    public CompareLinks(String repositoryUrl, Map<String, ReleaseTagPattern> tagPatterns) {
        this.repositoryUrl = repositoryUrl;
        this.tagPatterns = new HashMap<>(tagPatterns);
    }

    public static CompareLinks none() {
        return new CompareLinks(null, Collections.<String, ReleaseTagPattern>emptyMap());
    }

    /**
     * @return the link from the release tag of {@code previousVersion} to the one of {@code nextVersion}, or null
     * if there is no repository URL, no tag pattern for the package or no usable previous version
     */
    public String between(String packageName, String previousVersion, Semver nextVersion) {
        if (repositoryUrl == null || repositoryUrl.isEmpty() || previousVersion == null) {
            return null;
        }
        ReleaseTagPattern tagPattern = tagPatterns.get(packageName);
        Optional<Semver> previous = Versions.tryParse(previousVersion);
        if (tagPattern == null || !previous.isPresent()) {
            return null;
        }
        String base = repositoryUrl.endsWith("/") ? repositoryUrl.substring(0, repositoryUrl.length() - 1) : repositoryUrl;
        return base + "/compare/" + tagPattern.tagName(previous.get()) + "..." + tagPattern.tagName(nextVersion);
    }
}
