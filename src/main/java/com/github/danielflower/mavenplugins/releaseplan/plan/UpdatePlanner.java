package com.github.danielflower.mavenplugins.releaseplan.plan;

import com.github.danielflower.mavenplugins.releaseplan.ValidationException;
import com.github.danielflower.mavenplugins.releaseplan.compat.CompatibilityCheck;
import com.github.danielflower.mavenplugins.releaseplan.compat.CompatibilityChecker;
import com.github.danielflower.mavenplugins.releaseplan.diff.Commit;
import com.github.danielflower.mavenplugins.releaseplan.diff.Diff;
import com.github.danielflower.mavenplugins.releaseplan.diff.DiffDetector;
import com.github.danielflower.mavenplugins.releaseplan.diff.PublishedSnapshot;
import com.github.danielflower.mavenplugins.releaseplan.report.ChangelogRenderer;
import com.github.danielflower.mavenplugins.releaseplan.report.Changelogs;
import com.github.danielflower.mavenplugins.releaseplan.version.ConventionalCommit;
import com.github.danielflower.mavenplugins.releaseplan.version.VersionCoordinator;
import com.github.danielflower.mavenplugins.releaseplan.version.VersionRuleEngine;
import com.github.danielflower.mavenplugins.releaseplan.version.Versions;
import com.github.danielflower.mavenplugins.releaseplan.workspace.Package;
import com.github.danielflower.mavenplugins.releaseplan.workspace.Workspace;
import com.vdurmont.semver4j.Semver;
import org.apache.maven.plugin.logging.Log;
import org.eclipse.jgit.api.errors.GitAPIException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Works out the full release plan of a workspace: which packages get a new version, which version, and what goes
 * into their changelogs.
 */
public class UpdatePlanner {

    public static final int DEFAULT_COMPATIBILITY_THREADS = 4;

    private final Log log;
    private final DiffDetector diffDetector;
    private final VersionCoordinator coordinator;
    private final DependencyPropagator propagator;
    private final ChangelogRenderer changelogRenderer;
    private final CompatibilityChecker compatibilityChecker;
    private final int compatibilityThreads;

    /**
     * @param compatibilityChecker compares APIs with the published versions, or null if no check is configured
     */
    public UpdatePlanner(Log log, DiffDetector diffDetector, VersionCoordinator coordinator, DependencyPropagator propagator,
                         ChangelogRenderer changelogRenderer, CompatibilityChecker compatibilityChecker, int compatibilityThreads) {
        this.log = log;
        this.diffDetector = diffDetector;
        this.coordinator = coordinator;
        this.propagator = propagator;
        this.changelogRenderer = changelogRenderer;
        this.compatibilityChecker = compatibilityChecker;
        this.compatibilityThreads = Math.max(1, compatibilityThreads);
    }

    /**
     * @throws ValidationException   if the working copy is dirty or the request names an unknown package
     * @throws CancellationException if the run is cancelled before the plan is complete
     */
    public UpdatePlan plan(UpdateRequest request, UpdateRun run) throws ValidationException {
        if (!request.isAllowDirty()) {
            diffDetector.ensureCleanWorkingCopy();
        }
        UpdatePlan plan = new UpdatePlan();
        Map<Package, Diff> diffs = diffPackages(request, run, selectPackages(request), plan);
        includeChangelogCommits(request, diffs);
        checkCompatibility(request, run, diffs);

        Workspace workspace = request.getWorkspace();
        Map<String, Semver> candidates = new LinkedHashMap<>();
        Map<String, String> groupOfPackage = new HashMap<>();
        List<Semver> inheritedCandidates = new ArrayList<>();
        for (Map.Entry<Package, Diff> entry : diffs.entrySet()) {
            Package pkg = entry.getKey();
            Semver candidate = candidateVersion(request, pkg, entry.getValue());
            candidates.put(pkg.getName(), candidate);
            boolean followsWorkspace = pkg.isVersionInherited() && workspace.getVersion() != null;
            if (followsWorkspace) {
                inheritedCandidates.add(candidate);
            }
            String group = request.configFor(pkg.getName()).getVersionGroup();
            if (group != null && !followsWorkspace) {
                groupOfPackage.put(pkg.getName(), group);
            }
        }
        Map<String, Semver> groupVersions = coordinator.groupVersions(candidates, groupOfPackage);
        Semver workspaceVersion = coordinator.workspaceVersion(workspace.getVersion(), inheritedCandidates).orElse(null);
        if (workspaceVersion != null) {
            plan.setWorkspaceVersion(workspaceVersion);
        }

        OldChangelogs oldChangelogs = new OldChangelogs();
        List<Package> propagationCandidates = new ArrayList<>();
        for (Map.Entry<Package, Diff> entry : diffs.entrySet()) {
            run.throwIfCancelled();
            Package pkg = entry.getKey();
            Diff diff = entry.getValue();
            if (request.getReleaseCommits() != null && !diff.anyCommitMatches(request.getReleaseCommits())) {
                log.info(pkg.getName() + ": no commit matches " + request.getReleaseCommits().pattern());
                continue;
            }
            String group = request.configFor(pkg.getName()).getVersionGroup();
            Semver next = coordinator.resolve(pkg.getName(), candidates.get(pkg.getName()), pkg.isVersionInherited(),
                workspaceVersion, group, groupVersions);
            if (!Versions.isSame(next, pkg.getVersion()) || !diff.isRegistryPackageExists()) {
                log.info(pkg.getName() + ": next version is " + next.getValue() + diff.getCompatibilityCheck().describe());
                List<Commit> commits = diff.commitsInOrder(request.isSortCommitsOldestFirst());
                addResult(request, plan, oldChangelogs, pkg, next, commits, diff.getCompatibilityCheck(), lastPublishedVersion(pkg));
            } else if (diff.isVersionPublished()) {
                propagationCandidates.add(pkg);
            }
        }

        Map<String, Semver> changed = new LinkedHashMap<>();
        for (UpdatePlan.Entry entry : plan.getUpdates()) {
            changed.put(entry.getPackage().getName(), entry.getResult().getNextVersion());
        }
        DependencyPropagator.Propagation propagation = propagator.propagate(changed, propagationCandidates);
        for (DependencyPropagator.Scheduled scheduled : propagation.getScheduled()) {
            addResult(request, plan, oldChangelogs, scheduled.getPackage(), scheduled.getNextVersion(),
                Arrays.asList(scheduled.getCommit()), CompatibilityCheck.skipped(), scheduled.getPackage().getVersion());
        }
        plan.setPropagationWaves(propagation.getWaves());
        return plan;
    }

    private List<Package> selectPackages(UpdateRequest request) throws ValidationException {
        List<Package> selected = new ArrayList<>();
        for (Package pkg : request.getWorkspace().getPublishablePackages()) {
            if (!request.configFor(pkg.getName()).isRelease()) {
                log.debug(pkg.getName() + ": release disabled");
                continue;
            }
            if (request.getSinglePackage() != null && !request.getSinglePackage().equals(pkg.getName())) {
                continue;
            }
            selected.add(pkg);
        }
        if (request.getSinglePackage() != null && selected.isEmpty()) {
            String summary = "There is no releasable package named " + request.getSinglePackage();
            List<String> messages = new ArrayList<>();
            messages.add(summary);
            messages.add("Releasable packages are:");
            for (Package pkg : request.getWorkspace().getPublishablePackages()) {
                messages.add(" * " + pkg.getName());
            }
            throw new ValidationException(summary, messages);
        }
        return selected;
    }

    /**
     * One package at a time, as every diff moves the same working copy through history.
     */
    private Map<Package, Diff> diffPackages(UpdateRequest request, UpdateRun run, List<Package> packages, UpdatePlan plan) {
        Map<Package, Diff> diffs = new LinkedHashMap<>();
        for (Package pkg : packages) {
            run.throwIfCancelled();
            try {
                Diff diff = diffDetector.diff(pkg, request.tagPattern(pkg), request.isGitOnly(pkg));
                log.debug(pkg.getName() + ": " + diff);
                diffs.put(pkg, diff);
            } catch (ValidationException e) {
                plan.addFailure(new UpdatePlan.PackageFailure(pkg.getName(), "diff", e.getMessages()));
            } catch (IOException | GitAPIException e) {
                plan.addFailure(new UpdatePlan.PackageFailure(pkg.getName(), "diff",
                    Arrays.asList("Failed to retrieve the changes of " + pkg.getName(), String.valueOf(e.getMessage()))));
            }
        }
        return diffs;
    }

    private void includeChangelogCommits(UpdateRequest request, Map<Package, Diff> diffs) {
        Map<String, List<Commit>> ownCommits = new HashMap<>();
        for (Map.Entry<Package, Diff> entry : diffs.entrySet()) {
            ownCommits.put(entry.getKey().getName(), new ArrayList<>(entry.getValue().getCommits()));
        }
        for (Map.Entry<Package, Diff> entry : diffs.entrySet()) {
            if (!entry.getValue().isRegistryPackageExists()) {
                continue;
            }
            for (String included : request.configFor(entry.getKey().getName()).getChangelogInclude()) {
                List<Commit> commits = ownCommits.get(included);
                if (commits != null) {
                    entry.getValue().addCommits(commits);
                }
            }
        }
    }

    private void checkCompatibility(UpdateRequest request, UpdateRun run, Map<Package, Diff> diffs) {
        Map<Package, PublishedSnapshot> toCheck = new LinkedHashMap<>();
        for (Map.Entry<Package, Diff> entry : diffs.entrySet()) {
            Package pkg = entry.getKey();
            Optional<PublishedSnapshot> snapshot = diffDetector.publishedSnapshot(pkg.getName());
            if (request.configFor(pkg.getName()).isCompatibilityCheck() && pkg.isLibrary()
                && snapshot.isPresent() && entry.getValue().shouldUpdateVersion()) {
                toCheck.put(pkg, snapshot.get());
            }
        }
        if (toCheck.isEmpty()) {
            return;
        }
        if (compatibilityChecker == null || !compatibilityChecker.isAvailable()) {
            if (run.firstTime("compatibility-checker-unavailable")) {
                log.warn("The compatibility check tool is not available, so API compatibility will not be checked");
            }
            return;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(compatibilityThreads, toCheck.size()));
        try {
            Map<Package, Future<CompatibilityCheck>> futures = new LinkedHashMap<>();
            for (Map.Entry<Package, PublishedSnapshot> entry : toCheck.entrySet()) {
                final Package pkg = entry.getKey();
                final Path publishedDirectory = entry.getValue().getContentDirectory();
                futures.put(pkg, executor.submit(new Callable<CompatibilityCheck>() {
                    @Override
                    public CompatibilityCheck call() throws IOException {
                        return compatibilityChecker.check(pkg, publishedDirectory);
                    }
                }));
            }
            for (Map.Entry<Package, Future<CompatibilityCheck>> entry : futures.entrySet()) {
                try {
                    diffs.get(entry.getKey()).setCompatibilityCheck(entry.getValue().get());
                } catch (ExecutionException e) {
                    log.warn("Could not check the API compatibility of " + entry.getKey().getName() + ": " + e.getCause().getMessage());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while checking API compatibility");
        } finally {
            executor.shutdownNow();
        }
    }

    private Semver candidateVersion(UpdateRequest request, Package pkg, Diff diff) {
        if (!diff.shouldUpdateVersion()) {
            return pkg.getVersion();
        }
        List<String> messages = new ArrayList<>();
        for (Commit commit : diff.getCommits()) {
            messages.add(commit.getMessage());
        }
        return new VersionRuleEngine(request.configFor(pkg.getName()).getPolicy()).nextVersion(pkg.getVersion(), messages);
    }

    private Semver lastPublishedVersion(Package pkg) {
        Optional<PublishedSnapshot> snapshot = diffDetector.publishedSnapshot(pkg.getName());
        return snapshot.isPresent() ? snapshot.get().getVersion() : null;
    }

    private void addResult(UpdateRequest request, UpdatePlan plan, OldChangelogs oldChangelogs, Package pkg, Semver next,
                           List<Commit> commits, CompatibilityCheck compatibilityCheck, Semver lastPublished) {
        String changelog = null;
        if (request.configFor(pkg.getName()).isChangelogUpdate()) {
            Path changelogPath = request.changelogPath(pkg);
            try {
                changelog = changelog(request, pkg, next, commits, oldChangelogs.getOrRead(changelogPath));
                oldChangelogs.put(changelogPath, changelog);
            } catch (IOException e) {
                plan.addFailure(new UpdatePlan.PackageFailure(pkg.getName(), "changelog",
                    Arrays.asList("Could not read " + changelogPath, String.valueOf(e.getMessage()))));
                return;
            }
        }
        plan.add(pkg, new UpdateResult(next, changelog, compatibilityCheck, lastPublished, commits));
    }

    String changelog(UpdateRequest request, Package pkg, Semver next, List<Commit> commits, String oldChangelog) {
        List<Commit> entries = new ArrayList<>();
        for (Commit commit : commits) {
            // only the first line of a free-form message makes sense in a changelog
            entries.add(ConventionalCommit.parse(commit.getMessage()).isPresent() ? commit : commit.withMessage(commit.getShortMessage()));
        }
        String lastVersion = oldChangelog == null ? null : Changelogs.lastVersion(oldChangelog).orElse(null);
        String previousVersion = null;
        if (!Versions.isSame(next, pkg.getVersion())) {
            previousVersion = lastVersion != null ? lastVersion : pkg.getVersion().getValue();
        } else if (lastVersion != null && lastVersion.equals(next.getValue())) {
            log.debug(pkg.getName() + ": the changelog already describes " + next.getValue());
            return oldChangelog;
        }
        String entry = changelogRenderer.render(pkg.getName(), next, request.getReleaseDate(), entries, previousVersion);
        return oldChangelog == null ? Changelogs.create(entry) : Changelogs.prepend(oldChangelog, entry);
    }
}
