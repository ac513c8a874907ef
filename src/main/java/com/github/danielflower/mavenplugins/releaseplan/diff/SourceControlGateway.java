package com.github.danielflower.mavenplugins.releaseplan.diff;

import com.github.danielflower.mavenplugins.releaseplan.ValidationException;
import org.eclipse.jgit.api.errors.GitAPIException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The working copy the history walk moves around in. Paths are relative to the repository root and use
 * forward slashes; an empty path stands for the whole repository.
 */
public interface SourceControlGateway {

    Path workingDirectory();

    boolean isClean() throws GitAPIException;

    void errorIfNotClean() throws ValidationException;

    /**
     * Puts the working copy back on the branch (or commit) that was checked out when the run started.
     */
    void checkoutHead() throws GitAPIException, IOException;

    void checkout(String commitId) throws GitAPIException, IOException;

    /**
     * Checks out the newest commit, starting from the current one, that touched any of the paths.
     *
     * @return the id of the checked out commit
     * @throws NoMoreHistoryException if no commit touched the paths
     */
    String checkoutLastCommitAt(Collection<String> paths) throws GitAPIException, IOException, NoMoreHistoryException;

    /**
     * Checks out the commit before the current one that touched any of the paths.
     *
     * @return the id of the checked out commit
     * @throws NoMoreHistoryException if there is no such commit
     */
    String checkoutPreviousCommitAt(Collection<String> paths) throws GitAPIException, IOException, NoMoreHistoryException;

    String currentCommit() throws IOException;

    Commit readCommit(String commitId) throws IOException;

    default String commitMessage(String commitId) throws IOException {
        return readCommit(commitId).getMessage();
    }

    Set<String> filesChangedIn(String commitId) throws IOException;

    /**
     * @return true if {@code ancestor} is reachable from {@code descendant}, including when they are the same commit
     */
    boolean isAncestor(String ancestor, String descendant) throws IOException;

    Optional<String> tagCommit(String tagName) throws IOException;

    List<String> tagNames() throws GitAPIException;

    /**
     * Writes the files under {@code path} as they were at {@code commitId} into {@code target}, with {@code path}
     * stripped from their names.
     */
    void exportTree(String commitId, String path, Path target) throws IOException;
}
