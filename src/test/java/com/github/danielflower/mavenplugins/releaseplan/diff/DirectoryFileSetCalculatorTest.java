package com.github.danielflower.mavenplugins.releaseplan.diff;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectoryFileSetCalculatorTest {

    @TempDir
    Path dir;

    private final DirectoryFileSetCalculator calculator = new DirectoryFileSetCalculator();

    @Test
    void listsPackagedFilesSkippingBuildOutputAndNestedPackages() throws Exception {
        InMemorySourceControl.write(dir.resolve("pom.xml"), "<project/>");
        InMemorySourceControl.write(dir.resolve("src/main/java/A.java"), "class A {}");
        InMemorySourceControl.write(dir.resolve("target/classes/A.class"), "binary");
        InMemorySourceControl.write(dir.resolve("nested/pom.xml"), "<project/>");
        InMemorySourceControl.write(dir.resolve("nested/src/B.java"), "class B {}");
        InMemorySourceControl.write(dir.resolve(DirectoryRegistryResolver.VCS_INFO_FILE), "abc");

        assertThat(calculator.filesFor(dir, "pom.xml")).containsExactly("pom.xml", "src/main/java/A.java");
    }

    @Test
    void aDirectoryWithoutAManifestIsAnError() {
        assertThatThrownBy(() -> calculator.filesFor(dir, "pom.xml")).isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void hashesDependOnlyOnContent() throws Exception {
        InMemorySourceControl.write(dir.resolve("a.txt"), "same");
        InMemorySourceControl.write(dir.resolve("b.txt"), "same");
        InMemorySourceControl.write(dir.resolve("c.txt"), "different");

        assertThat(calculator.hashOf(dir.resolve("a.txt"))).isEqualTo(calculator.hashOf(dir.resolve("b.txt")))
            .isNotEqualTo(calculator.hashOf(dir.resolve("c.txt")));
    }
}
