package com.github.danielflower.mavenplugins.releaseplan.diff;

import com.vdurmont.semver4j.Semver;

import java.nio.file.Path;
import java.util.Optional;

/**
 * A package as it was when it was last released: its version, its files, and the commit it was released from when
 * that is known.
 */
public abstract class PublishedSnapshot {

    private final String packageName;
    private final Semver version;
    private final Path contentDirectory;
    private final String publishedAtCommit;

    protected PublishedSnapshot(String packageName, Semver version, Path contentDirectory, String publishedAtCommit) {
        this.packageName = packageName;
        this.version = version;
        this.contentDirectory = contentDirectory;
        this.publishedAtCommit = publishedAtCommit;
    }

    public String getPackageName() {
        return packageName;
    }

    public Semver getVersion() {
        return version;
    }

    public Path getContentDirectory() {
        return contentDirectory;
    }

    public Optional<String> getPublishedAtCommit() {
        return Optional.ofNullable(publishedAtCommit);
    }

    public abstract String describeSource();

    @Override
    public String toString() {
        return packageName + " " + version + " from " + describeSource();
    }
}
