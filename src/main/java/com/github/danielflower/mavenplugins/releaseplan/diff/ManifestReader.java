package com.github.danielflower.mavenplugins.releaseplan.diff;

import com.github.danielflower.mavenplugins.releaseplan.ValidationException;

import java.nio.file.Path;
import java.util.Map;

/**
 * Reads the parts of a package manifest the history walk needs.
 */
public interface ManifestReader {

    /**
     * @param manifest the manifest file
     * @return the version constraint of every declared dependency, keyed by dependency name; a dependency without a
     * constraint maps to an empty string
     * @throws ValidationException if the manifest cannot be read or parsed
     */
    Map<String, String> dependencyConstraints(Path manifest) throws ValidationException;
}
