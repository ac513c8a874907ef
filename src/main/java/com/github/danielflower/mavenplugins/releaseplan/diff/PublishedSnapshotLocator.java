package com.github.danielflower.mavenplugins.releaseplan.diff;

import com.github.danielflower.mavenplugins.releaseplan.version.Versions;
import com.github.danielflower.mavenplugins.releaseplan.workspace.Package;
import com.vdurmont.semver4j.Semver;
import org.apache.maven.plugin.logging.Log;
import org.codehaus.plexus.util.FileUtils;
import org.eclipse.jgit.api.errors.GitAPIException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Finds the last published version of a package, looking both at the registry and at release tags.
 */
public class PublishedSnapshotLocator {

    private final Log log;
    private final SourceControlGateway git;
    private final PublishedArtifactResolver registry;
    private Path exportRoot;

    /**
     * @param registry where published packages are downloaded from, or null to rely on release tags only
     */
    public PublishedSnapshotLocator(Log log, SourceControlGateway git, PublishedArtifactResolver registry) {
        this.log = log;
        this.git = git;
        this.registry = registry;
    }

    public Optional<PublishedSnapshot> locate(Package pkg, ReleaseTagPattern tagPattern, boolean gitOnly) throws IOException, GitAPIException {
        Optional<RegistrySnapshot> fromRegistry = (gitOnly || registry == null) ? Optional.empty() : registry.latestPublished(pkg);
        Optional<TagSnapshot> fromTag = latestTag(pkg, tagPattern);
        return choose(log, fromRegistry, fromTag);
    }

    /**
     * The higher version wins. When both sources have the same version the registry copy is used, since that is
     * what users actually download, and a warning is logged if the tag points at a different commit.
     */
    static Optional<PublishedSnapshot> choose(Log log, Optional<RegistrySnapshot> fromRegistry, Optional<TagSnapshot> fromTag) {
        if (!fromTag.isPresent()) {
            return fromRegistry.isPresent() ? Optional.<PublishedSnapshot>of(fromRegistry.get()) : Optional.<PublishedSnapshot>empty();
        }
        if (!fromRegistry.isPresent()) {
            return Optional.<PublishedSnapshot>of(fromTag.get());
        }
        RegistrySnapshot registrySnapshot = fromRegistry.get();
        TagSnapshot tagSnapshot = fromTag.get();
        if (Versions.isGreater(tagSnapshot.getVersion(), registrySnapshot.getVersion())) {
            log.debug("Using " + tagSnapshot + " as it is newer than " + registrySnapshot);
            return Optional.of(tagSnapshot);
        }
        if (Versions.isSame(tagSnapshot.getVersion(), registrySnapshot.getVersion())
            && registrySnapshot.getPublishedAtCommit().isPresent()
            && !registrySnapshot.getPublishedAtCommit().equals(tagSnapshot.getPublishedAtCommit())) {
            log.warn(registrySnapshot.getPackageName() + " " + registrySnapshot.getVersion() + " was published from commit "
                + registrySnapshot.getPublishedAtCommit().get() + " but " + tagSnapshot.getTagName() + " points at "
                + tagSnapshot.getPublishedAtCommit().orElse("nothing") + ". Using the registry version.");
        }
        return Optional.of(registrySnapshot);
    }

    Optional<TagSnapshot> latestTag(Package pkg, ReleaseTagPattern tagPattern) throws IOException, GitAPIException {
        String latestTag = null;
        Semver latestVersion = null;
        for (String tagName : git.tagNames()) {
            Optional<Semver> version = tagPattern.versionOf(tagName);
            if (version.isPresent() && (latestVersion == null || Versions.isGreater(version.get(), latestVersion))) {
                latestTag = tagName;
                latestVersion = version.get();
            }
        }
        if (latestTag == null) {
            log.debug("No release tag of " + pkg.getName() + " matches " + tagPattern);
            return Optional.empty();
        }
        Optional<String> commit = git.tagCommit(latestTag);
        if (!commit.isPresent()) {
            return Optional.empty();
        }
        log.debug("Latest release of " + pkg.getName() + ": tag " + latestTag + " (version " + latestVersion + ")");

        Path target = exportRoot().resolve(pkg.getName() + "-" + latestVersion.getValue());
        Files.createDirectories(target);
        for (String path : RepoPaths.pathsToCheck(git.workingDirectory(), pkg)) {
            git.exportTree(commit.get(), path, target);
        }
        return Optional.of(new TagSnapshot(pkg.getName(), latestVersion, target, latestTag, commit.get()));
    }

    /**
     * Deletes the directory that release tags were exported to, if any.
     */
    public void cleanUp() {
        if (exportRoot == null) {
            return;
        }
        try {
            FileUtils.deleteDirectory(exportRoot.toFile());
            exportRoot = null;
        } catch (IOException e) {
            log.warn("Could not delete " + exportRoot + ": " + e.getMessage());
        }
    }

    private Path exportRoot() throws IOException {
        if (exportRoot == null) {
            exportRoot = Files.createTempDirectory("release-plan-tags");
        }
        return exportRoot;
    }
}
