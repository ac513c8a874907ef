package com.github.danielflower.mavenplugins.releaseplan.diff;

import com.vdurmont.semver4j.Semver;

import java.nio.file.Path;

/**
 * A package version reconstructed from the tree of its release tag.
 */
public class TagSnapshot extends PublishedSnapshot {

    private final String tagName;

    public TagSnapshot(String packageName, Semver version, Path contentDirectory, String tagName, String tagCommit) {
        super(packageName, version, contentDirectory, tagCommit);
        this.tagName = tagName;
    }

    public String getTagName() {
        return tagName;
    }

    @Override
    public String describeSource() {
        return "git tag " + tagName;
    }
}
