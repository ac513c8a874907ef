package com.github.danielflower.mavenplugins.releaseplan;

import com.github.danielflower.mavenplugins.releaseplan.diff.Commit;
import com.github.danielflower.mavenplugins.releaseplan.diff.NoMoreHistoryException;
import org.apache.maven.plugin.logging.SystemStreamLog;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.revwalk.RevCommit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;

import static java.util.Arrays.asList;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class LocalGitRepoTest {

    private static final PersonIdent AUTHOR = new PersonIdent("Ada Example", "ada@example.org");

    @TempDir
    Path dir;

    private Git git;
    private LocalGitRepo repo;
    private String first;
    private String second;
    private String third;

    @BeforeEach
    void createHistory() throws Exception {
        git = Git.init().setDirectory(dir.toFile()).call();
        first = commit("feat: first", "core/pom.xml", "v1", "README.md", "# Readme");
        second = commit("docs: other module", "other/pom.xml", "o1");
        third = commit("fix: second\n\nWith a body", "core/src/A.java", "class A {}");
        git.tag().setName("core-v1.0.0").setAnnotated(false).setObjectId(git.getRepository().parseCommit(git.getRepository().resolve(first))).call();
        repo = new LocalGitRepo(git);
    }

    @AfterEach
    void closeRepo() {
        git.close();
    }

    private String commit(String message, String... pathsAndContents) throws Exception {
        for (int i = 0; i < pathsAndContents.length; i += 2) {
            write(pathsAndContents[i], pathsAndContents[i + 1]);
            git.add().addFilepattern(pathsAndContents[i]).call();
        }
        RevCommit commit = git.commit().setMessage(message).setAuthor(AUTHOR).setCommitter(AUTHOR).call();
        return commit.getName();
    }

    private void write(String path, String content) throws IOException {
        Path file = dir.resolve(path);
        Files.createDirectories(file.getParent());
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void walksBackThroughTheCommitsOfAPath() throws Exception {
        assertThat(repo.checkoutLastCommitAt(asList("core"))).isEqualTo(third);
        assertThat(repo.checkoutPreviousCommitAt(asList("core"))).isEqualTo(first);
        assertThat(dir.resolve("core/src/A.java")).doesNotExist();
        assertThatThrownBy(() -> repo.checkoutPreviousCommitAt(asList("core"))).isInstanceOf(NoMoreHistoryException.class);

        repo.checkoutHead();

        assertThat(repo.currentCommit()).isEqualTo(third);
        assertThat(git.getRepository().getFullBranch()).startsWith("refs/heads/");
        assertThat(dir.resolve("core/src/A.java")).exists();
    }

    @Test
    void readsCommitDetails() throws Exception {
        Commit commit = repo.readCommit(third);
        assertThat(commit.getMessage()).isEqualTo("fix: second\n\nWith a body");
        assertThat(commit.getShortMessage()).isEqualTo("fix: second");
        assertThat(commit.getAuthor().getName()).isEqualTo("Ada Example");
        assertThat(commit.getAuthor().getEmail()).isEqualTo("ada@example.org");
    }

    @Test
    void listsChangedFiles() throws Exception {
        assertThat(repo.filesChangedIn(first)).containsExactlyInAnyOrder("core/pom.xml", "README.md");
        assertThat(repo.filesChangedIn(third)).containsExactly("core/src/A.java");
    }

    @Test
    void knowsAncestry() throws Exception {
        assertThat(repo.isAncestor(first, third)).isTrue();
        assertThat(repo.isAncestor(third, third)).isTrue();
        assertThat(repo.isAncestor(third, first)).isFalse();
    }

    @Test
    void findsTags() throws Exception {
        assertThat(repo.tagNames()).containsExactly("core-v1.0.0");
        assertThat(repo.tagCommit("core-v1.0.0")).contains(first);
        assertThat(repo.tagCommit("core-v9.9.9")).isEmpty();
    }

    @Test
    void exportsDirectoriesAndSingleFiles() throws Exception {
        Path target = Files.createDirectories(dir.resolve("target/export"));

        repo.exportTree(third, "core", target);
        repo.exportTree(third, "README.md", target);

        assertThat(target.resolve("pom.xml")).hasContent("v1");
        assertThat(target.resolve("src/A.java")).hasContent("class A {}");
        assertThat(target.resolve("README.md")).hasContent("# Readme");
        assertThat(target.resolve("other")).doesNotExist();
    }

    @Test
    void dirtyWorkingCopiesAreReported() throws Exception {
        repo.errorIfNotClean();
        write("core/src/B.java", "class B {}");

        ValidationException e = catchThrowableOfType(repo::errorIfNotClean, ValidationException.class);
        assertThat(e.getMessages()).contains("Untracked:", " * core/src/B.java");
    }

    @Test
    void revertsChangedFiles() throws Exception {
        write("core/pom.xml", "changed");

        boolean reverted = repo.revertChanges(new SystemStreamLog(), Collections.singletonList(dir.resolve("core/pom.xml").toFile()));

        assertThat(reverted).isTrue();
        assertThat(dir.resolve("core/pom.xml")).hasContent("v1");
    }

    @Test
    void onlyGitRepositoriesCanBeOpened() throws Exception {
        File notARepo = Files.createTempDirectory("not-a-repo").toFile();
        try {
            assertThatThrownBy(() -> LocalGitRepo.fromDir(notARepo)).isInstanceOf(ValidationException.class);
        } finally {
            notARepo.delete();
        }
        assertThat(LocalGitRepo.fromDir(dir.toFile()).currentCommit()).isEqualTo(third);
    }
}
