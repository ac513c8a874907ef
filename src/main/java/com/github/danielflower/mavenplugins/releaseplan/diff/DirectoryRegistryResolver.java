package com.github.danielflower.mavenplugins.releaseplan.diff;

import com.github.danielflower.mavenplugins.releaseplan.version.Versions;
import com.github.danielflower.mavenplugins.releaseplan.workspace.Package;
import com.vdurmont.semver4j.Semver;
import org.apache.maven.plugin.logging.Log;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Reads published packages from a directory laid out as <code>&lt;root&gt;/&lt;package&gt;/&lt;version&gt;/</code>,
 * each version directory holding the extracted artifact. An optional {@value #VCS_INFO_FILE} file in a version
 * directory holds the id of the commit the version was published from.
 */
public class DirectoryRegistryResolver implements PublishedArtifactResolver {

    public static final String VCS_INFO_FILE = ".vcs_info";

    private static final DirectoryStream.Filter<Path> DIRECTORIES = new DirectoryStream.Filter<Path>() {
        @Override
        public boolean accept(Path entry) {
            return Files.isDirectory(entry);
        }
    };

    private final Log log;
    private final Path root;

    public DirectoryRegistryResolver(Log log, Path root) {
        this.log = log;
        this.root = root;
    }

    @Override
    public Optional<RegistrySnapshot> latestPublished(Package pkg) throws IOException {
        Path packageDir = root.resolve(pkg.getName());
        if (!Files.isDirectory(packageDir)) {
            log.debug(pkg.getName() + " not found in registry directory " + root);
            return Optional.empty();
        }
        Semver latest = null;
        Path latestDir = null;
        try (DirectoryStream<Path> versions = Files.newDirectoryStream(packageDir, DIRECTORIES)) {
            for (Path versionDir : versions) {
                Optional<Semver> version = Versions.tryParse(versionDir.getFileName().toString());
                if (!version.isPresent()) {
                    log.debug("Ignoring " + versionDir + " as its name is not a version");
                    continue;
                }
                if (latest == null || Versions.isGreater(version.get(), latest)) {
                    latest = version.get();
                    latestDir = versionDir;
                }
            }
        }
        if (latest == null) {
            return Optional.empty();
        }
        return Optional.of(new RegistrySnapshot(pkg.getName(), latest, latestDir, readPublishedCommit(latestDir)));
    }

    private static String readPublishedCommit(Path versionDir) throws IOException {
        Path vcsInfo = versionDir.resolve(VCS_INFO_FILE);
        if (!Files.isRegularFile(vcsInfo)) {
            return null;
        }
        List<String> lines = Files.readAllLines(vcsInfo, StandardCharsets.UTF_8);
        for (String line : lines) {
            if (!line.trim().isEmpty()) {
                return line.trim();
            }
        }
        return null;
    }
}
