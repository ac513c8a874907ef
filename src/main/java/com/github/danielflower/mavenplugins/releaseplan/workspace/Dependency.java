package com.github.danielflower.mavenplugins.releaseplan.workspace;

/**
 * A dependency declared in a package manifest.
 */
public class Dependency {

    private final String name;
    private final String versionConstraint;
    private final boolean local;

    /**
     * @param name              the name of the referenced package
     * @param versionConstraint the version requirement as written in the manifest, or null if none is written
     * @param local             true if the dependency points at another package of the same workspace
     */
    public Dependency(String name, String versionConstraint, boolean local) {
        this.name = name;
        this.versionConstraint = versionConstraint;
        this.local = local;
    }

    public String getName() {
        return name;
    }

    public String getVersionConstraint() {
        return versionConstraint;
    }

    public boolean isLocal() {
        return local;
    }

    public boolean hasVersionConstraint() {
        return versionConstraint != null && !versionConstraint.trim().isEmpty();
    }

    @Override
    public String toString() {
        return name + (hasVersionConstraint() ? " " + versionConstraint : "") + (local ? " (local)" : "");
    }
}
