package com.github.danielflower.mavenplugins.releaseplan.version;

import com.vdurmont.semver4j.Semver;

import java.util.List;
import java.util.Optional;

/**
 * Maps the commits of a pending release to a semantic version increment, following
 * <a href="https://www.conventionalcommits.org/en/v1.0.0/#how-does-this-relate-to-semverare">conventional commits</a>.
 * <ul>
 *     <li>No commits: no release.</li>
 *     <li>Current version is a pre-release: the pre-release number goes up.</li>
 *     <li>Breaking change: major, or minor while the version is 0.x (unless the policy says otherwise).</li>
 *     <li>Feature: minor, or patch while the version is 0.x (unless the policy says otherwise).</li>
 *     <li>Anything else, including messages that are not conventional commits: patch.</li>
 * </ul>
 */
public class VersionRuleEngine {

    private final VersionPolicy policy;

    public VersionRuleEngine(VersionPolicy policy) {
        this.policy = policy;
    }

    public Optional<VersionIncrement> nextIncrement(Semver current, List<String> commitMessages) {
        if (commitMessages.isEmpty()) {
            return Optional.empty();
        }
        if (Versions.isPrerelease(current)) {
            return Optional.of(VersionIncrement.PRERELEASE);
        }

        boolean breaking = false;
        boolean feature = false;
        boolean customMinor = false;
        for (String message : commitMessages) {
            Optional<ConventionalCommit> parsed = ConventionalCommit.parse(message);
            if (!parsed.isPresent()) {
                continue;
            }
            ConventionalCommit commit = parsed.get();
            breaking |= commit.isBreaking() || policy.isCustomMajor(commit);
            feature |= commit.isFeature();
            customMinor |= policy.isCustomMinor(commit);
        }
        boolean preOne = current.getMajor() == 0;

        if (breaking && (!preOne || policy.isBreakingAlwaysIncrementMajor())) {
            return Optional.of(VersionIncrement.MAJOR);
        }
        if ((feature && (!preOne || policy.isFeaturesAlwaysIncrementMinor()))
            || (preOne && current.getMinor() != 0 && breaking)
            || customMinor) {
            return Optional.of(VersionIncrement.MINOR);
        }
        return Optional.of(VersionIncrement.PATCH);
    }

    /**
     * @return the version after applying the increment for these commits, or {@code current} if there are none
     */
    public Semver nextVersion(Semver current, List<String> commitMessages) {
        Optional<VersionIncrement> increment = nextIncrement(current, commitMessages);
        return increment.isPresent() ? increment.get().apply(current) : current;
    }
}
