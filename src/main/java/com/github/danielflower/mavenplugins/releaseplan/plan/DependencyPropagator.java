package com.github.danielflower.mavenplugins.releaseplan.plan;

import com.github.danielflower.mavenplugins.releaseplan.diff.Commit;
import com.github.danielflower.mavenplugins.releaseplan.version.VersionConstraint;
import com.github.danielflower.mavenplugins.releaseplan.version.Versions;
import com.github.danielflower.mavenplugins.releaseplan.workspace.Dependency;
import com.github.danielflower.mavenplugins.releaseplan.workspace.Package;
import com.vdurmont.semver4j.Semver;
import org.apache.maven.plugin.logging.Log;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Releases the packages that only need a new version because a local dependency they pin got one. This repeats
 * until a round adds nothing, so bumps cascade through chains of dependencies. Each package is added once at most.
 */
public class DependencyPropagator {

    public static final String COMMIT_PREFIX = "chore: updated the following local packages: ";

    private final Log log;

    public DependencyPropagator(Log log) {
        this.log = log;
    }

    /**
     * @param changed    the new version of every package already in the plan, keyed by package name
     * @param candidates published packages without changes of their own
     */
    public Propagation propagate(Map<String, Semver> changed, List<Package> candidates) {
        Map<String, Semver> changedSoFar = new LinkedHashMap<>(changed);
        Set<String> processed = new HashSet<>(changed.keySet());
        List<Scheduled> scheduled = new ArrayList<>();
        int waves = 0;

        while (true) {
            Map<String, Semver> changedView = Collections.unmodifiableMap(new LinkedHashMap<>(changedSoFar));
            List<Scheduled> wave = new ArrayList<>();
            for (Package candidate : candidates) {
                if (processed.contains(candidate.getName())) {
                    continue;
                }
                List<String> updatedDependencies = updatedDependencies(candidate, changedView);
                if (!updatedDependencies.isEmpty()) {
                    Semver next = Versions.isPrerelease(candidate.getVersion())
                        ? Versions.incrementPrerelease(candidate.getVersion())
                        : Versions.incrementPatch(candidate.getVersion());
                    log.info(candidate.getName() + ": dependencies changed. Next version is " + next);
                    wave.add(new Scheduled(candidate, next, updatedDependencies));
                }
            }
            if (wave.isEmpty()) {
                break;
            }
            waves++;
            for (Scheduled s : wave) {
                processed.add(s.getPackage().getName());
                changedSoFar.put(s.getPackage().getName(), s.getNextVersion());
            }
            scheduled.addAll(wave);
        }
        return new Propagation(scheduled, waves);
    }

    /**
     * @return the names of the changed packages this package pins to a version the change moves past
     */
    static List<String> updatedDependencies(Package pkg, Map<String, Semver> changed) {
        List<String> names = new ArrayList<>();
        for (Dependency dependency : pkg.getDependencies()) {
            if (!dependency.isLocal() || !dependency.hasVersionConstraint() || names.contains(dependency.getName())) {
                continue;
            }
            Semver newVersion = changed.get(dependency.getName());
            if (newVersion == null) {
                continue;
            }
            VersionConstraint constraint = VersionConstraint.parse(dependency.getVersionConstraint());
            if (constraint != null && constraint.isOutdatedBy(newVersion)) {
                names.add(dependency.getName());
            }
        }
        return names;
    }

    public static final class Scheduled {
        private final Package pkg;
        private final Semver nextVersion;
        private final List<String> updatedDependencies;

        Scheduled(Package pkg, Semver nextVersion, List<String> updatedDependencies) {
            this.pkg = pkg;
            this.nextVersion = nextVersion;
            this.updatedDependencies = Collections.unmodifiableList(updatedDependencies);
        }

        public Package getPackage() {
            return pkg;
        }

        public Semver getNextVersion() {
            return nextVersion;
        }

        public List<String> getUpdatedDependencies() {
            return updatedDependencies;
        }

        public Commit getCommit() {
            return Commit.synthetic(COMMIT_PREFIX + String.join(", ", updatedDependencies));
        }
    }

    public static final class Propagation {
        private final List<Scheduled> scheduled;
        private final int waves;

        Propagation(List<Scheduled> scheduled, int waves) {
            this.scheduled = Collections.unmodifiableList(scheduled);
            this.waves = waves;
        }

        /**
         * @return the packages to release, in the order they were found
         */
        public List<Scheduled> getScheduled() {
            return scheduled;
        }

        public int getWaves() {
            return waves;
        }
    }
}
