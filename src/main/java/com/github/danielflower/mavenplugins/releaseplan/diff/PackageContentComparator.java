package com.github.danielflower.mavenplugins.releaseplan.diff;

import com.github.danielflower.mavenplugins.releaseplan.workspace.Package;
import org.apache.maven.plugin.logging.Log;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.HashSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Decides whether the package in the working copy is identical to a published snapshot.
 */
public class PackageContentComparator {

    private final Log log;
    private final PackagedFileSetCalculator fileSetCalculator;
    private final Set<String> ignoredFileNames;

    /**
     * @param ignoredFileNames names of generated files, such as lockfiles, whose content is not compared
     */
    public PackageContentComparator(Log log, PackagedFileSetCalculator fileSetCalculator, Collection<String> ignoredFileNames) {
        this.log = log;
        this.fileSetCalculator = fileSetCalculator;
        this.ignoredFileNames = new HashSet<>(ignoredFileNames);
    }

    public boolean arePackagesEqual(Package pkg, PublishedSnapshot snapshot) throws IOException {
        Path localDir = pkg.getDirectory();
        Path publishedDir = snapshot.getContentDirectory();
        log.debug("Comparing " + localDir + " with " + snapshot);

        if (!areFilesEqual(pkg.getManifest(), publishedDir.resolve(pkg.getManifestFileName()))) {
            log.debug(pkg.getName() + ": " + pkg.getManifestFileName() + " is different");
            return false;
        }
        if (isReadmeUpdated(pkg, publishedDir)) {
            log.debug(pkg.getName() + ": readme updated");
            return false;
        }

        SortedSet<String> localFiles = fileSetCalculator.filesFor(localDir, pkg.getManifestFileName());
        SortedSet<String> publishedFiles = new TreeSet<>(fileSetCalculator.filesFor(publishedDir, pkg.getManifestFileName()));
        if (RepoPaths.hasExternalReadme(pkg)) {
            // the exported snapshot carries the external readme at its root, which isReadmeUpdated already compared
            String readmeName = pkg.getReadme().getFileName().toString();
            if (!localFiles.contains(readmeName)) {
                publishedFiles.remove(readmeName);
            }
        }
        if (!localFiles.equals(publishedFiles)) {
            log.debug(pkg.getName() + ": files were added or removed");
            return false;
        }

        for (String relativePath : localFiles) {
            Path local = localDir.resolve(relativePath);
            String fileName = local.getFileName().toString();
            if (Files.isSymbolicLink(local) || !Files.exists(local)
                || ignoredFileNames.contains(fileName) || fileName.equals(pkg.getManifestFileName())) {
                continue;
            }
            if (!areFilesEqual(local, publishedDir.resolve(relativePath))) {
                log.debug(pkg.getName() + ": " + relativePath + " is different");
                return false;
            }
        }
        return true;
    }

    /**
     * @return true if the package ships a readme from outside its directory and that readme differs from the
     * published one. A published package without a readme never shipped it, so that counts as unchanged.
     */
    public boolean isReadmeUpdated(Package pkg, Path publishedDir) throws IOException {
        Path readme = pkg.getReadme();
        if (readme == null) {
            return false;
        }
        if (!Files.isRegularFile(readme)) {
            log.warn("The readme " + readme + " of " + pkg.getName() + " does not exist");
            return false;
        }
        Path publishedReadme = publishedDir.resolve(readme.getFileName().toString());
        if (!Files.isRegularFile(publishedReadme)) {
            log.debug(pkg.getName() + ": the published package has no " + publishedReadme.getFileName());
            return false;
        }
        return !areFilesEqual(readme, publishedReadme);
    }

    boolean areFilesEqual(Path first, Path second) throws IOException {
        if (!Files.isRegularFile(first) || !Files.isRegularFile(second)) {
            return false;
        }
        return fileSetCalculator.hashOf(first).equals(fileSetCalculator.hashOf(second));
    }
}
