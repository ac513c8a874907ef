package com.github.danielflower.mavenplugins.releaseplan.compat;

import com.github.danielflower.mavenplugins.releaseplan.workspace.Package;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Compares the public API of a package with its last published version.
 */
public interface CompatibilityChecker {

    /**
     * @return false if the tool doing the comparison cannot be run on this machine
     */
    boolean isAvailable();

    CompatibilityCheck check(Package pkg, Path publishedDirectory) throws IOException;
}
