package com.github.danielflower.mavenplugins.releaseplan.diff;

import com.vdurmont.semver4j.Semver;

import java.nio.file.Path;

/**
 * The extracted contents of a package version downloaded from the package registry.
 */
public class RegistrySnapshot extends PublishedSnapshot {

    public RegistrySnapshot(String packageName, Semver version, Path contentDirectory, String publishedAtCommit) {
        super(packageName, version, contentDirectory, publishedAtCommit);
    }

    @Override
    public String describeSource() {
        return "the registry (" + getContentDirectory() + ")";
    }
}
