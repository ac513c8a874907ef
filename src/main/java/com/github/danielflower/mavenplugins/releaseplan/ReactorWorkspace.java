package com.github.danielflower.mavenplugins.releaseplan;

import com.github.danielflower.mavenplugins.releaseplan.version.Versions;
import com.github.danielflower.mavenplugins.releaseplan.workspace.Dependency;
import com.github.danielflower.mavenplugins.releaseplan.workspace.Package;
import com.github.danielflower.mavenplugins.releaseplan.workspace.Workspace;
import com.vdurmont.semver4j.Semver;
import org.apache.maven.model.Model;
import org.apache.maven.model.Parent;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.project.MavenProject;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Describes a Maven reactor as a workspace: each module is a package named after its artifactId, the
 * aggregator's version is the workspace version, and modules without a version of their own inherit it.
 */
public final class ReactorWorkspace {

    public static final String DEPLOY_SKIP_PROPERTY = "maven.deploy.skip";

    private ReactorWorkspace() {
    }

    /**
     * @param configs per-module settings keyed by artifactId
     * @throws ValidationException if a module version is not a semantic version
     */
    public static Workspace fromProjects(Log log, MavenProject rootProject, List<MavenProject> projects,
                                         Map<String, PackageConfiguration> configs) throws ValidationException {
        Set<String> reactorModules = new HashSet<>();
        for (MavenProject project : projects) {
            reactorModules.add(project.getGroupId() + ":" + project.getArtifactId());
        }
        Path root = rootProject.getBasedir().toPath();

        List<Package> packages = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (MavenProject project : projects) {
            Optional<Semver> version = Versions.tryParse(project.getVersion());
            if (!version.isPresent()) {
                errors.add(" * " + project.getArtifactId() + " " + project.getVersion());
                continue;
            }
            Model originalModel = project.getOriginalModel();
            Package.Builder builder = Package.builder(project.getArtifactId(), version.get(), project.getBasedir().toPath())
                .manifestFileName(project.getFile().getName())
                .versionInherited(originalModel.getVersion() == null)
                .library(!"pom".equals(project.getPackaging()))
                .publishable(!"true".equalsIgnoreCase(project.getProperties().getProperty(DEPLOY_SKIP_PROPERTY)));

            Parent parent = originalModel.getParent();
            if (parent != null) {
                builder.dependency(new Dependency(parent.getArtifactId(), parent.getVersion(),
                    reactorModules.contains(parent.getGroupId() + ":" + parent.getArtifactId())));
            }
            for (org.apache.maven.model.Dependency dependency : originalModel.getDependencies()) {
                String groupId = dependency.getGroupId();
                if ("${project.groupId}".equals(groupId)) {
                    groupId = project.getGroupId();
                }
                builder.dependency(new Dependency(dependency.getArtifactId(), dependency.getVersion(),
                    reactorModules.contains(groupId + ":" + dependency.getArtifactId())));
            }

            PackageConfiguration config = configs.get(project.getArtifactId());
            if (config != null) {
                builder.executable(config.isExecutable());
                if (config.getReadme() != null) {
                    builder.readme(root.resolve(config.getReadme()));
                }
            }
            Package pkg = builder.build();
            log.debug("Found package " + pkg);
            packages.add(pkg);
        }
        if (!errors.isEmpty()) {
            String summary = "Release plans need semantic versions, such as 1.2.3 or 1.2.3-SNAPSHOT";
            List<String> messages = new ArrayList<>();
            messages.add(summary);
            messages.add("The following modules have other versions:");
            messages.addAll(errors);
            throw new ValidationException(summary, messages);
        }
        return new Workspace(root, Versions.tryParse(rootProject.getVersion()).orElse(null), packages);
    }
}
