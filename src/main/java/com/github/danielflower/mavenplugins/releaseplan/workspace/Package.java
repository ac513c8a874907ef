package com.github.danielflower.mavenplugins.releaseplan.workspace;

import com.vdurmont.semver4j.Semver;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A releasable unit of the workspace: one module with its own manifest and version.
 */
public class Package {

    private final String name;
    private final Semver version;
    private final Path directory;
    private final String manifestFileName;
    private final List<Dependency> dependencies;
    private final boolean versionInherited;
    private final Path readme;
    private final boolean library;
    private final boolean executable;
    private final boolean publishable;

    private Package(Builder builder) {
        this.name = builder.name;
        this.version = builder.version;
        this.directory = builder.directory;
        this.manifestFileName = builder.manifestFileName;
        this.dependencies = Collections.unmodifiableList(new ArrayList<>(builder.dependencies));
        this.versionInherited = builder.versionInherited;
        this.readme = builder.readme;
        this.library = builder.library;
        this.executable = builder.executable;
        this.publishable = builder.publishable;
    }

    public static Builder builder(String name, Semver version, Path directory) {
        return new Builder(name, version, directory);
    }

    public String getName() {
        return name;
    }

    public Semver getVersion() {
        return version;
    }

    public Path getDirectory() {
        return directory;
    }

    public String getManifestFileName() {
        return manifestFileName;
    }

    public Path getManifest() {
        return directory.resolve(manifestFileName);
    }

    public List<Dependency> getDependencies() {
        return dependencies;
    }

    public boolean isVersionInherited() {
        return versionInherited;
    }

    /**
     * @return a readme that lives outside the package directory but is shipped with the package, or null
     */
    public Path getReadme() {
        return readme;
    }

    public boolean isLibrary() {
        return library;
    }

    public boolean isExecutable() {
        return executable;
    }

    public boolean isPublishable() {
        return publishable;
    }

    @Override
    public String toString() {
        return name + " " + version;
    }

    public static class Builder {
        private final String name;
        private final Semver version;
        private final Path directory;
        private String manifestFileName = "pom.xml";
        private final List<Dependency> dependencies = new ArrayList<>();
        private boolean versionInherited;
        private Path readme;
        private boolean library = true;
        private boolean executable;
        private boolean publishable = true;

        private Builder(String name, Semver version, Path directory) {
            this.name = name;
            this.version = version;
            this.directory = directory;
        }

        public Builder manifestFileName(String manifestFileName) {
            this.manifestFileName = manifestFileName;
            return this;
        }

        public Builder dependency(Dependency dependency) {
            this.dependencies.add(dependency);
            return this;
        }

        public Builder dependencies(List<Dependency> dependencies) {
            this.dependencies.addAll(dependencies);
            return this;
        }

        public Builder versionInherited(boolean versionInherited) {
            this.versionInherited = versionInherited;
            return this;
        }

        public Builder readme(Path readme) {
            this.readme = readme;
            return this;
        }

        public Builder library(boolean library) {
            this.library = library;
            return this;
        }

        public Builder executable(boolean executable) {
            this.executable = executable;
            return this;
        }

        public Builder publishable(boolean publishable) {
            this.publishable = publishable;
            return this;
        }

        public Package build() {
            return new Package(this);
        }
    }
}
