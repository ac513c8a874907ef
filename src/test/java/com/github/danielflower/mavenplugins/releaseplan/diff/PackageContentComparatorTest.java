package com.github.danielflower.mavenplugins.releaseplan.diff;

import com.github.danielflower.mavenplugins.releaseplan.version.Versions;
import com.github.danielflower.mavenplugins.releaseplan.workspace.Package;
import org.apache.maven.plugin.logging.SystemStreamLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

class PackageContentComparatorTest {

    @TempDir
    Path tempDir;

    private Path local;
    private Path published;
    private RegistrySnapshot snapshot;
    private final PackageContentComparator comparator = new PackageContentComparator(new SystemStreamLog(),
        new DirectoryFileSetCalculator(), Collections.singletonList("deps.lock"));

    @BeforeEach
    void createPackages() throws IOException {
        local = Files.createDirectories(tempDir.resolve("local/core"));
        published = Files.createDirectories(tempDir.resolve("published"));
        for (Path dir : new Path[]{local, published}) {
            InMemorySourceControl.write(dir.resolve("pom.xml"), "<project/>");
            InMemorySourceControl.write(dir.resolve("src/A.java"), "class A {}");
        }
        snapshot = new RegistrySnapshot("core", Versions.parse("1.0.0"), published, null);
    }

    private Package core() {
        return Package.builder("core", Versions.parse("1.0.0"), local).build();
    }

    @Test
    void identicalPackagesAreEqual() throws IOException {
        assertThat(comparator.arePackagesEqual(core(), snapshot)).isTrue();
    }

    @Test
    void changedContentIsDetected() throws IOException {
        InMemorySourceControl.write(local.resolve("src/A.java"), "class A { int x; }");
        assertThat(comparator.arePackagesEqual(core(), snapshot)).isFalse();
    }

    @Test
    void addedFilesAreDetected() throws IOException {
        InMemorySourceControl.write(local.resolve("src/B.java"), "class B {}");
        assertThat(comparator.arePackagesEqual(core(), snapshot)).isFalse();
    }

    @Test
    void changedManifestsAreDetected() throws IOException {
        InMemorySourceControl.write(local.resolve("pom.xml"), "<project><version>2</version></project>");
        assertThat(comparator.arePackagesEqual(core(), snapshot)).isFalse();
    }

    @Test
    void ignoredFilesMayDiffer() throws IOException {
        InMemorySourceControl.write(local.resolve("deps.lock"), "a");
        InMemorySourceControl.write(published.resolve("deps.lock"), "b");
        assertThat(comparator.arePackagesEqual(core(), snapshot)).isTrue();
    }

    @Test
    void anExternalReadmeMustMatchThePublishedOne() throws IOException {
        Path readme = tempDir.resolve("local/README.md");
        InMemorySourceControl.write(readme, "# Core");
        Package withReadme = Package.builder("core", Versions.parse("1.0.0"), local).readme(readme).build();

        assertThat(comparator.isReadmeUpdated(withReadme, published)).isFalse();
        InMemorySourceControl.write(published.resolve("README.md"), "# Old core");
        assertThat(comparator.isReadmeUpdated(withReadme, published)).isTrue();
        InMemorySourceControl.write(published.resolve("README.md"), "# Core");
        assertThat(comparator.isReadmeUpdated(withReadme, published)).isFalse();
        assertThat(comparator.isReadmeUpdated(core(), published)).isFalse();
    }

    @Test
    void anExternalReadmeInThePublishedCopyIsNotAnAddedFile() throws IOException {
        Path readme = tempDir.resolve("local/README.md");
        InMemorySourceControl.write(readme, "# Core");
        InMemorySourceControl.write(published.resolve("README.md"), "# Core");
        Package withReadme = Package.builder("core", Versions.parse("1.0.0"), local).readme(readme).build();

        assertThat(comparator.arePackagesEqual(withReadme, snapshot)).isTrue();
        assertThat(comparator.arePackagesEqual(core(), snapshot)).isFalse();
    }
}
