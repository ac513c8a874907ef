package com.github.danielflower.mavenplugins.releaseplan.version;

import com.vdurmont.semver4j.Semver;
import org.apache.maven.plugin.logging.Log;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Unifies the versions of packages that must release together: named version groups, and the packages that take
 * their version from the workspace.
 */
public class VersionCoordinator {

    private final Log log;

    public VersionCoordinator(Log log) {
        this.log = log;
    }

    /**
     * @param candidates    the next version each package would get on its own, keyed by package name
     * @param groupOfPackage the version group of each package that belongs to one
     * @return the agreed version of every group: the highest candidate among its members
     */
    public Map<String, Semver> groupVersions(Map<String, Semver> candidates, Map<String, String> groupOfPackage) {
        Map<String, Semver> groups = new LinkedHashMap<>();
        for (Map.Entry<String, String> membership : groupOfPackage.entrySet()) {
            Semver candidate = candidates.get(membership.getKey());
            if (candidate == null) {
                continue;
            }
            Semver highest = groups.get(membership.getValue());
            if (highest == null || Versions.isGreater(candidate, highest)) {
                groups.put(membership.getValue(), candidate);
            }
        }
        log.debug("Version groups: " + groups);
        return groups;
    }

    /**
     * @param currentWorkspaceVersion the version currently declared by the workspace, or null if it has none
     * @param inheritedCandidates     the candidate next versions of packages that inherit the workspace version
     * @return the highest candidate that is not lower than the current workspace version, or empty if there is none
     */
    public Optional<Semver> workspaceVersion(Semver currentWorkspaceVersion, Collection<Semver> inheritedCandidates) {
        if (currentWorkspaceVersion == null) {
            return Optional.empty();
        }
        Collection<Semver> qualifying = new ArrayList<>();
        for (Semver candidate : inheritedCandidates) {
            if (!Versions.isGreater(currentWorkspaceVersion, candidate)) {
                qualifying.add(candidate);
            }
        }
        Optional<Semver> result = Versions.max(qualifying);
        if (result.isPresent()) {
            log.debug("New workspace version: " + result.get());
        }
        return result;
    }

    /**
     * Picks the version a package releases with. The workspace version wins over a version group.
     */
    public Semver resolve(String packageName, Semver ownCandidate, boolean versionInherited, Semver workspaceVersion,
                          String group, Map<String, Semver> groupVersions) {
        if (versionInherited && workspaceVersion != null) {
            if (group != null) {
                log.warn(packageName + " inherits the workspace version, so its version group " + group + " is ignored");
            }
            log.debug("Next version of " + packageName + " is the workspace version " + workspaceVersion);
            return workspaceVersion;
        }
        if (group != null && groupVersions.containsKey(group)) {
            return groupVersions.get(group);
        }
        return ownCandidate;
    }
}
