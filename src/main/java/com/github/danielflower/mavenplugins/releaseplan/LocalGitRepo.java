package com.github.danielflower.mavenplugins.releaseplan;

import com.github.danielflower.mavenplugins.releaseplan.diff.Commit;
import com.github.danielflower.mavenplugins.releaseplan.diff.NoMoreHistoryException;
import com.github.danielflower.mavenplugins.releaseplan.diff.SourceControlGateway;
import org.apache.maven.plugin.logging.Log;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.LogCommand;
import org.eclipse.jgit.api.Status;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.errors.RepositoryNotFoundException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.FileMode;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.Ref;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.treewalk.EmptyTreeIterator;
import org.eclipse.jgit.treewalk.TreeWalk;
import org.eclipse.jgit.treewalk.filter.PathFilter;
import org.eclipse.jgit.treewalk.filter.TreeFilter;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public class LocalGitRepo implements SourceControlGateway {

    public final Git git;
    private boolean hasReverted = false; // A premature optimisation? In the normal case, file reverting occurs twice, which this bool prevents
    private String originalHead;

    LocalGitRepo(Git git) {
        this.git = git;
    }

    @Override
    public Path workingDirectory() {
        return git.getRepository().getWorkTree().toPath();
    }

    @Override
    public boolean isClean() throws GitAPIException {
        return git.status().call().isClean();
    }

    @Override
    public void errorIfNotClean() throws ValidationException {
        Status status = currentStatus();
        boolean isClean = status.isClean();
        if (!isClean) {
            String summary = "Cannot plan a release with uncommitted changes. Please check the following files:";
            List<String> message = new ArrayList<String>();
            message.add(summary);
            Set<String> uncommittedChanges = status.getUncommittedChanges();
            if (uncommittedChanges.size() > 0) {
                message.add("Uncommitted:");
                for (String path : uncommittedChanges) {
                    message.add(" * " + path);
                }
            }
            Set<String> untracked = status.getUntracked();
            if (untracked.size() > 0) {
                message.add("Untracked:");
                for (String path : untracked) {
                    message.add(" * " + path);
                }
            }
            message.add("Please commit or revert these changes, or set allowDirty to true.");
            throw new ValidationException(summary, message);
        }
    }

    private Status currentStatus() throws ValidationException {
        Status status;
        try {
            status = git.status().call();
        } catch (GitAPIException e) {
            throw new ValidationException("Error while checking if the Git repo is clean", e);
        }
        return status;
    }

    @Override
    public void checkoutHead() throws GitAPIException, IOException {
        git.checkout().setName(originalHead()).call();
    }

    /**
     * The branch checked out when this repo was first moved, or the commit if the head was already detached.
     */
    private String originalHead() throws IOException {
        if (originalHead == null) {
            originalHead = git.getRepository().getFullBranch();
        }
        return originalHead;
    }

    @Override
    public void checkout(String commitId) throws GitAPIException, IOException {
        originalHead();
        git.checkout().setName(commitId).call();
    }

    @Override
    public String checkoutLastCommitAt(Collection<String> paths) throws GitAPIException, IOException, NoMoreHistoryException {
        for (RevCommit commit : logAt(paths)) {
            checkout(commit.getName());
            return commit.getName();
        }
        throw new NoMoreHistoryException("No commit touched " + paths);
    }

    @Override
    public String checkoutPreviousCommitAt(Collection<String> paths) throws GitAPIException, IOException, NoMoreHistoryException {
        String current = currentCommit();
        for (RevCommit commit : logAt(paths)) {
            if (!commit.getName().equals(current)) {
                checkout(commit.getName());
                return commit.getName();
            }
        }
        throw new NoMoreHistoryException("No commit before " + current + " touched " + paths);
    }

    private Iterable<RevCommit> logAt(Collection<String> paths) throws GitAPIException, IOException {
        LogCommand log = git.log().add(headId());
        for (String path : paths) {
            if (!path.isEmpty()) {
                log.addPath(path);
            }
        }
        return log.call();
    }

    private ObjectId headId() throws IOException {
        ObjectId head = git.getRepository().resolve(Constants.HEAD);
        if (head == null) {
            throw new IOException("The repository at " + workingDirectory() + " has no commits");
        }
        return head;
    }

    @Override
    public String currentCommit() throws IOException {
        return headId().getName();
    }

    @Override
    public Commit readCommit(String commitId) throws IOException {
        try (RevWalk walk = new RevWalk(git.getRepository())) {
            RevCommit commit = walk.parseCommit(git.getRepository().resolve(commitId));
            return new Commit(commit.getName(), commit.getFullMessage(),
                person(commit.getAuthorIdent()), person(commit.getCommitterIdent()), null);
        }
    }

    private static Commit.Person person(PersonIdent ident) {
        return ident == null ? null : new Commit.Person(ident.getName(), ident.getEmailAddress(), ident.getWhen());
    }

    @Override
    public Set<String> filesChangedIn(String commitId) throws IOException {
        Repository repo = git.getRepository();
        Set<String> files = new LinkedHashSet<>();
        try (RevWalk walk = new RevWalk(repo); TreeWalk treeWalk = new TreeWalk(repo)) {
            RevCommit commit = walk.parseCommit(repo.resolve(commitId));
            if (commit.getParentCount() > 0) {
                treeWalk.addTree(walk.parseCommit(commit.getParent(0)).getTree());
            } else {
                treeWalk.addTree(new EmptyTreeIterator());
            }
            treeWalk.addTree(commit.getTree());
            treeWalk.setRecursive(true);
            treeWalk.setFilter(TreeFilter.ANY_DIFF);
            for (DiffEntry entry : DiffEntry.scan(treeWalk)) {
                if (!DiffEntry.DEV_NULL.equals(entry.getOldPath())) {
                    files.add(entry.getOldPath());
                }
                if (!DiffEntry.DEV_NULL.equals(entry.getNewPath())) {
                    files.add(entry.getNewPath());
                }
            }
        }
        return files;
    }

    @Override
    public boolean isAncestor(String ancestor, String descendant) throws IOException {
        Repository repo = git.getRepository();
        try (RevWalk walk = new RevWalk(repo)) {
            return walk.isMergedInto(walk.parseCommit(repo.resolve(ancestor)), walk.parseCommit(repo.resolve(descendant)));
        }
    }

    @Override
    public Optional<String> tagCommit(String tagName) throws IOException {
        Repository repo = git.getRepository();
        Ref ref = repo.exactRef(Constants.R_TAGS + tagName);
        if (ref == null) {
            return Optional.empty();
        }
        try (RevWalk walk = new RevWalk(repo)) {
            return Optional.of(walk.parseCommit(ref.getObjectId()).getName());
        }
    }

    @Override
    public List<String> tagNames() throws GitAPIException {
        List<String> names = new ArrayList<>();
        for (Ref ref : git.tagList().call()) {
            names.add(Repository.shortenRefName(ref.getName()));
        }
        return names;
    }

    @Override
    public void exportTree(String commitId, String path, Path target) throws IOException {
        Repository repo = git.getRepository();
        try (RevWalk walk = new RevWalk(repo); TreeWalk treeWalk = new TreeWalk(repo)) {
            treeWalk.addTree(walk.parseCommit(repo.resolve(commitId)).getTree());
            treeWalk.setRecursive(true);
            if (!path.isEmpty()) {
                treeWalk.setFilter(PathFilter.create(path));
            }
            while (treeWalk.next()) {
                if (treeWalk.getFileMode(0) == FileMode.GITLINK) {
                    continue;
                }
                String entryPath = treeWalk.getPathString();
                String relative;
                if (path.isEmpty()) {
                    relative = entryPath;
                } else if (entryPath.equals(path)) {
                    relative = treeWalk.getNameString();
                } else {
                    relative = entryPath.substring(path.length() + 1);
                }
                Path file = target.resolve(relative);
                Files.createDirectories(file.getParent());
                try (OutputStream out = Files.newOutputStream(file)) {
                    repo.open(treeWalk.getObjectId(0)).copyTo(out);
                }
            }
        }
    }

    public boolean revertChanges(Log log, List<File> changedFiles) {
        if (hasReverted) {
            return true;
        }
        boolean hasErrors = false;
        File workTree = workingDir(log);
        for (File changedFile : changedFiles) {
            hasErrors = revertFile(log, changedFile, hasErrors, workTree);
        }
        hasReverted = true;
        return !hasErrors;
    }

    private boolean revertFile(Log log, File changedFile, boolean hasErrors, File workTree) {
        try {
            String pathRelativeToWorkingTree = Repository.stripWorkDir(workTree, changedFile);
            git.checkout().addPath(pathRelativeToWorkingTree).call();
        } catch (Exception e) {
            hasErrors = true;
            log.error("Unable to revert changes to " + changedFile + " - you may need to manually revert this file. Error was: " + e.getMessage());
        }
        return hasErrors;
    }

    private File workingDir(Log log) {
        try {
            return git.getRepository().getWorkTree().getCanonicalFile();
        } catch (IOException e) {
            log.warn("Could not resolve the canonical working directory of the Git repo: " + e.getMessage());
            return git.getRepository().getWorkTree().getAbsoluteFile();
        }
    }

    /**
     * Opens the Git repository in the given directory.
     *
     * @throws ValidationException if anything goes wrong
     */
    public static LocalGitRepo fromDir(File gitDir) throws ValidationException {
        Git git;
        try {
            git = Git.open(gitDir);
        } catch (RepositoryNotFoundException rnfe) {
            String fullPathOfCurrentDir = pathOf(gitDir);
            File gitRoot = getGitRootIfItExistsInOneOfTheParentDirectories(new File(fullPathOfCurrentDir));
            String summary;
            List<String> messages = new ArrayList<String>();
            if (gitRoot == null) {
                summary = "Releases can only be planned in Git repositories.";
                messages.add(summary);
                messages.add(fullPathOfCurrentDir + " is not a Git repository.");
            } else {
                summary = "The release plan plugin can only be run from the root folder of your Git repository";
                messages.add(summary);
                messages.add(fullPathOfCurrentDir + " is not the root of a Git repository");
                messages.add("Try running the plugin from " + pathOf(gitRoot));
            }
            throw new ValidationException(summary, messages);
        } catch (Exception e) {
            throw new ValidationException("Could not open git repository. Is " + pathOf(gitDir) + " a git repository?", Arrays.asList("Exception returned when accessing the git repo:", e.toString()));
        }
        return new LocalGitRepo(git);
    }

    private static String pathOf(File file) {
        try {
            return file.getCanonicalPath();
        } catch (IOException e) {
            return file.getAbsolutePath();
        }
    }

    private static File getGitRootIfItExistsInOneOfTheParentDirectories(File candidateDir) {
        while (candidateDir != null && /* HACK ATTACK! Maybe.... */ !candidateDir.getName().equals("target")) {
            if (new File(candidateDir, ".git").isDirectory()) {
                return candidateDir;
            }
            candidateDir = candidateDir.getParentFile();
        }
        return null;
    }
}
