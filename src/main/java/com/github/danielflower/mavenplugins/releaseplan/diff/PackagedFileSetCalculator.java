package com.github.danielflower.mavenplugins.releaseplan.diff;

import java.io.IOException;
import java.nio.file.Path;
import java.util.SortedSet;

/**
 * Works out which files would end up in a package if it were published from a directory.
 */
public interface PackagedFileSetCalculator {

    /**
     * @param packageDir   the package directory, either in the working copy or a published snapshot
     * @param manifestName the file name of the package manifest
     * @return paths relative to {@code packageDir}, using forward slashes
     * @throws IOException if the files cannot be listed, including when the directory has no manifest
     */
    SortedSet<String> filesFor(Path packageDir, String manifestName) throws IOException;

    String hashOf(Path file) throws IOException;
}
