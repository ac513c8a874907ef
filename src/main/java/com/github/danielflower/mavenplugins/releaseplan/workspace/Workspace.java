package com.github.danielflower.mavenplugins.releaseplan.workspace;

import com.vdurmont.semver4j.Semver;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * All packages of a repository, in build order, plus the version shared by packages that inherit it.
 */
public class Workspace {

    private final Path rootDirectory;
    private final Semver version;
    private final List<Package> packages;

    /**
     * @param version the workspace version inherited by packages without a version of their own, or null if the
     *                workspace does not declare one
     */
    public Workspace(Path rootDirectory, Semver version, List<Package> packages) {
        this.rootDirectory = rootDirectory;
        this.version = version;
        this.packages = Collections.unmodifiableList(new ArrayList<>(packages));
    }

    public Path getRootDirectory() {
        return rootDirectory;
    }

    public Semver getVersion() {
        return version;
    }

    public List<Package> getPackages() {
        return packages;
    }

    public List<Package> getPublishablePackages() {
        List<Package> publishable = new ArrayList<>();
        for (Package pkg : packages) {
            if (pkg.isPublishable()) {
                publishable.add(pkg);
            }
        }
        return publishable;
    }

    public boolean isMultiPackage() {
        return getPublishablePackages().size() > 1;
    }

    public Package find(String name) {
        for (Package p : packages) {
            if (p.getName().equals(name)) {
                return p;
            }
        }
        return null;
    }
}
