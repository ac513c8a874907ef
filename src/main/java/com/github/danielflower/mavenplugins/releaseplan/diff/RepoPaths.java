package com.github.danielflower.mavenplugins.releaseplan.diff;

import com.github.danielflower.mavenplugins.releaseplan.workspace.Package;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

final class RepoPaths {

    private RepoPaths() {
    }

    /**
     * @return {@code path} relative to the repository root with forward slashes; empty for the root itself
     */
    static String relativize(Path repoRoot, Path path) {
        return repoRoot.toAbsolutePath().normalize()
            .relativize(path.toAbsolutePath().normalize())
            .toString()
            .replace('\\', '/');
    }

    /**
     * The paths whose history matters to a package: its directory and a readme it ships from elsewhere.
     */
    static List<String> pathsToCheck(Path repoRoot, Package pkg) {
        List<String> paths = new ArrayList<>();
        paths.add(relativize(repoRoot, pkg.getDirectory()));
        if (hasExternalReadme(pkg)) {
            paths.add(relativize(repoRoot, pkg.getReadme()));
        }
        return paths;
    }

    /**
     * True when the package ships a readme that lives outside its own directory.
     */
    static boolean hasExternalReadme(Package pkg) {
        return pkg.getReadme() != null
            && !pkg.getReadme().toAbsolutePath().normalize().startsWith(pkg.getDirectory().toAbsolutePath().normalize());
    }

    static String join(String directory, String file) {
        return directory.isEmpty() ? file : directory + "/" + file;
    }
}
