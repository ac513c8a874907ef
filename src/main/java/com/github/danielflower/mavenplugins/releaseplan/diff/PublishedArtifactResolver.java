package com.github.danielflower.mavenplugins.releaseplan.diff;

import com.github.danielflower.mavenplugins.releaseplan.workspace.Package;

import java.io.IOException;
import java.util.Optional;

public interface PublishedArtifactResolver {

    /**
     * @return the highest published version of the package, or empty if it was never published
     */
    Optional<RegistrySnapshot> latestPublished(Package pkg) throws IOException;
}
