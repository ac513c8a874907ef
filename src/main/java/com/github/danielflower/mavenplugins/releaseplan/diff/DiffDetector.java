package com.github.danielflower.mavenplugins.releaseplan.diff;

import com.github.danielflower.mavenplugins.releaseplan.ValidationException;
import com.github.danielflower.mavenplugins.releaseplan.workspace.Package;
import org.eclipse.jgit.api.errors.GitAPIException;

import java.io.IOException;
import java.util.Optional;

public interface DiffDetector {

    void ensureCleanWorkingCopy() throws ValidationException;

    /**
     * @param tagPattern how release tags of this package are named
     * @param gitOnly    if true, only release tags are used to find the last published version
     */
    Diff diff(Package pkg, ReleaseTagPattern tagPattern, boolean gitOnly) throws ValidationException, IOException, GitAPIException;

    /**
     * @return the last published snapshot found by the most recent diff of this package, if any
     */
    Optional<PublishedSnapshot> publishedSnapshot(String packageName);
}
