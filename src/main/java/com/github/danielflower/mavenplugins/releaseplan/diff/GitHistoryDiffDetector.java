package com.github.danielflower.mavenplugins.releaseplan.diff;

import com.github.danielflower.mavenplugins.releaseplan.ValidationException;
import com.github.danielflower.mavenplugins.releaseplan.version.Versions;
import com.github.danielflower.mavenplugins.releaseplan.workspace.Package;
import org.apache.maven.plugin.logging.Log;
import org.eclipse.jgit.api.errors.CheckoutConflictException;
import org.eclipse.jgit.api.errors.GitAPIException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Works out what changed in a package since it was last published by walking back through the commits that touched
 * the package, comparing the package at each commit with the published copy until they match.
 */
public class GitHistoryDiffDetector implements DiffDetector {

    private final Log log;
    private final SourceControlGateway git;
    private final PublishedSnapshotLocator snapshotLocator;
    private final PackageContentComparator comparator;
    private final PackagedFileSetCalculator fileSetCalculator;
    private final ManifestReader manifestReader;
    private final Path lockfile;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, PublishedSnapshot> snapshots = new HashMap<>();
    private WalkState state = WalkState.AT_HEAD;

    /**
     * @param lockfile the workspace lockfile compared for executable packages, or null if there is none
     */
    public GitHistoryDiffDetector(Log log, SourceControlGateway git, PublishedSnapshotLocator snapshotLocator,
                                  PackageContentComparator comparator, PackagedFileSetCalculator fileSetCalculator,
                                  ManifestReader manifestReader, Path lockfile) {
        this.log = log;
        this.git = git;
        this.snapshotLocator = snapshotLocator;
        this.comparator = comparator;
        this.fileSetCalculator = fileSetCalculator;
        this.manifestReader = manifestReader;
        this.lockfile = lockfile;
    }

    @Override
    public void ensureCleanWorkingCopy() throws ValidationException {
        git.errorIfNotClean();
    }

    @Override
    public Optional<PublishedSnapshot> publishedSnapshot(String packageName) {
        return Optional.ofNullable(snapshots.get(packageName));
    }

    WalkState state() {
        return state;
    }

    @Override
    public Diff diff(Package pkg, ReleaseTagPattern tagPattern, boolean gitOnly) throws ValidationException, IOException, GitAPIException {
        lock.lock();
        try {
            Optional<PublishedSnapshot> snapshot = snapshotLocator.locate(pkg, tagPattern, gitOnly);
            if (snapshot.isPresent()) {
                snapshots.put(pkg.getName(), snapshot.get());
                log.debug(pkg.getName() + ": last published as " + snapshot.get());
            } else {
                snapshots.remove(pkg.getName());
                log.debug(pkg.getName() + ": never published");
            }
            Diff diff;
            try {
                diff = walk(pkg, tagPattern, snapshot.orElse(null));
            } catch (ValidationException | IOException | GitAPIException | RuntimeException e) {
                restoreHeadAfterFailure(pkg, e);
                throw e;
            }
            restoreHead(pkg);
            return diff;
        } finally {
            lock.unlock();
        }
    }

    private Diff walk(Package pkg, ReleaseTagPattern tagPattern, PublishedSnapshot snapshot) throws ValidationException, IOException, GitAPIException {
        Path repoRoot = git.workingDirectory();
        List<String> pathsToCheck = RepoPaths.pathsToCheck(repoRoot, pkg);
        String packagePath = RepoPaths.relativize(repoRoot, pkg.getDirectory());

        state = WalkState.WALKING;
        checkoutHead(pkg);
        Map<String, String> headConstraints = snapshot == null ? null : manifestReader.dependencyConstraints(pkg.getManifest());
        String headLockfileHash = (lockfile != null && pkg.isExecutable() && Files.isRegularFile(lockfile))
            ? fileSetCalculator.hashOf(lockfile) : null;

        Diff diff = new Diff(snapshot != null);
        try {
            checkoutCommitAt(pkg, pathsToCheck, true);
        } catch (NoMoreHistoryException e) {
            log.debug(pkg.getName() + ": no commit touches " + pathsToCheck);
            return diff;
        }

        String tagName = tagPattern.tagName(pkg.getVersion());
        Optional<String> tagCommit = git.tagCommit(tagName);
        if (tagCommit.isPresent()) {
            if (snapshot == null) {
                throw new ValidationException("The tag " + tagName + " exists but " + pkg.getName() + " has not been published",
                    Arrays.asList("Package " + pkg.getName() + " was not found in the registry, but the git tag " + tagName + " exists.",
                        "Publish " + pkg.getName() + " " + pkg.getVersion() + " manually before planning a new release."));
            }
            if (!Versions.isSame(snapshot.getVersion(), pkg.getVersion())) {
                throw new ValidationException("The tag " + tagName + " exists but " + pkg.getName() + " " + pkg.getVersion() + " has not been published",
                    Arrays.asList("Package " + pkg.getName() + " has version " + pkg.getVersion() + " but the last published version is "
                            + snapshot.getVersion() + " (" + snapshot.describeSource() + "), and the git tag " + tagName + " exists.",
                        "Publish " + pkg.getName() + " " + pkg.getVersion() + " manually before planning a new release."));
            }
        }

        while (true) {
            String current = git.currentCommit();
            if (snapshot != null) {
                if (comparator.arePackagesEqual(pkg, snapshot) || isCommitTooOld(current, tagCommit, snapshot.getPublishedAtCommit())) {
                    log.debug(pkg.getName() + ": next version calculated from the commits after " + current);
                    if (!diff.hasChanged()) {
                        addDependencyUpdateIfAny(diff, pkg, snapshot, headConstraints, headLockfileHash);
                    }
                    break;
                } else if (!Versions.isSame(snapshot.getVersion(), pkg.getVersion())) {
                    log.info(pkg.getName() + ": the local version " + pkg.getVersion() + " differs from the published version "
                        + snapshot.getVersion() + ", so it will not be updated");
                    diff.setVersionUnpublished(snapshot.getVersion());
                    break;
                } else if (areChangedFilesInPackage(pkg, packagePath, current)) {
                    diff.addCommit(git.readCommit(current));
                }
            } else if (areChangedFilesInPackage(pkg, packagePath, current)) {
                diff.addCommit(git.readCommit(current));
            }
            try {
                checkoutCommitAt(pkg, pathsToCheck, false);
            } catch (NoMoreHistoryException e) {
                log.debug(pkg.getName() + ": there are no other commits");
                break;
            }
        }
        return diff;
    }

    private boolean isCommitTooOld(String current, Optional<String> tagCommit, Optional<String> publishedAtCommit) throws IOException {
        if (tagCommit.isPresent() && git.isAncestor(current, tagCommit.get())) {
            log.debug("Stopping at " + current + " as it is an ancestor of the commit tagged with the current version (" + tagCommit.get() + ")");
            return true;
        }
        if (publishedAtCommit.isPresent() && git.isAncestor(current, publishedAtCommit.get())) {
            log.debug("Stopping at " + current + " as it is an ancestor of the commit the last version was published from (" + publishedAtCommit.get() + ")");
            return true;
        }
        return false;
    }

    /**
     * A package can contain other packages in sub-directories, so a commit only counts if it touched a file that
     * is packaged with this one, or the readme it ships from elsewhere.
     */
    private boolean areChangedFilesInPackage(Package pkg, String packagePath, String commit) {
        SortedSet<String> packagedFiles;
        try {
            packagedFiles = fileSetCalculator.filesFor(pkg.getDirectory(), pkg.getManifestFileName());
        } catch (IOException e) {
            log.debug(pkg.getName() + ": could not list the packaged files at " + commit + ": " + e);
            return true;
        }
        Set<String> changedFiles;
        try {
            changedFiles = git.filesChangedIn(commit);
        } catch (IOException e) {
            log.warn(pkg.getName() + ": could not list the files changed in " + commit + ", assuming the package changed: " + e.getMessage());
            return true;
        }
        for (String file : packagedFiles) {
            if (changedFiles.contains(RepoPaths.join(packagePath, file))) {
                return true;
            }
        }
        return RepoPaths.hasExternalReadme(pkg)
            && changedFiles.contains(RepoPaths.relativize(git.workingDirectory(), pkg.getReadme()));
    }

    private void addDependencyUpdateIfAny(Diff diff, Package pkg, PublishedSnapshot snapshot,
                                          Map<String, String> headConstraints, String headLockfileHash) throws ValidationException, IOException {
        Path publishedManifest = snapshot.getContentDirectory().resolve(pkg.getManifestFileName());
        Map<String, String> publishedConstraints = Files.isRegularFile(publishedManifest)
            ? manifestReader.dependencyConstraints(publishedManifest) : new HashMap<>();
        if (!publishedConstraints.equals(headConstraints)) {
            diff.addCommit(Commit.synthetic("chore: update " + pkg.getManifestFileName() + " dependencies"));
        } else if (headLockfileHash != null && isLockfileUpdated(snapshot, headLockfileHash)) {
            diff.addCommit(Commit.synthetic("chore: update " + lockfile.getFileName() + " dependencies"));
        } else {
            log.info(pkg.getName() + ": already up to date");
        }
    }

    private boolean isLockfileUpdated(PublishedSnapshot snapshot, String headLockfileHash) throws IOException {
        Path published = snapshot.getContentDirectory().resolve(lockfile.getFileName().toString());
        return Files.isRegularFile(published) && !fileSetCalculator.hashOf(published).equals(headLockfileHash);
    }

    private void restoreHead(Package pkg) throws ValidationException, IOException, GitAPIException {
        state = WalkState.RESTORING;
        checkoutHead(pkg);
        state = WalkState.AT_HEAD;
    }

    private void restoreHeadAfterFailure(Package pkg, Exception failure) {
        try {
            restoreHead(pkg);
        } catch (ValidationException | IOException | GitAPIException | RuntimeException e) {
            failure.addSuppressed(e);
        }
    }

    private void checkoutHead(Package pkg) throws ValidationException, IOException, GitAPIException {
        try {
            git.checkoutHead();
        } catch (CheckoutConflictException e) {
            throw checkoutConflict(pkg, e);
        }
    }

    private String checkoutCommitAt(Package pkg, List<String> paths, boolean last) throws ValidationException, IOException, GitAPIException, NoMoreHistoryException {
        try {
            return last ? git.checkoutLastCommitAt(paths) : git.checkoutPreviousCommitAt(paths);
        } catch (CheckoutConflictException e) {
            throw checkoutConflict(pkg, e);
        }
    }

    private ValidationException checkoutConflict(Package pkg, CheckoutConflictException e) {
        List<String> messages = new ArrayList<>();
        messages.add("Could not move " + git.workingDirectory() + " through the history of " + pkg.getName()
            + " because local changes would be overwritten.");
        if (e.getConflictingPaths() != null) {
            for (String path : e.getConflictingPaths()) {
                messages.add(" * " + path);
            }
        }
        messages.add("The allowDirty option cannot be used in this case. Commit or revert these changes first.");
        return new ValidationException("Cannot check out the history of " + pkg.getName(), messages, e);
    }
}
