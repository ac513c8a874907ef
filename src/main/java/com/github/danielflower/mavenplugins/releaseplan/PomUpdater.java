package com.github.danielflower.mavenplugins.releaseplan;

import com.github.danielflower.mavenplugins.releaseplan.plan.UpdatePlan;
import com.github.danielflower.mavenplugins.releaseplan.plan.UpdateRequest;
import com.github.danielflower.mavenplugins.releaseplan.version.VersionConstraint;
import com.vdurmont.semver4j.Semver;
import org.apache.maven.model.Dependency;
import org.apache.maven.model.Model;
import org.apache.maven.model.Parent;
import org.apache.maven.model.io.xpp3.MavenXpp3Writer;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.project.MavenProject;
import org.codehaus.plexus.util.WriterFactory;

import java.io.File;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a plan to disk: new module versions, dependency versions pointing at them, and changelogs. If anything
 * fails, the files changed so far are reverted.
 */
public class PomUpdater {

    private final Log log;
    private final LocalGitRepo repo;
    private final MavenProject rootProject;
    private final List<MavenProject> projects;

    public PomUpdater(Log log, LocalGitRepo repo, MavenProject rootProject, List<MavenProject> projects) {
        this.log = log;
        this.repo = repo;
        this.rootProject = rootProject;
        this.projects = projects;
    }

    /**
     * @return the files that were changed or created
     */
    public List<File> apply(UpdatePlan plan, UpdateRequest request) throws ValidationException {
        Map<String, Semver> newVersions = new HashMap<>();
        for (UpdatePlan.Entry entry : plan.getUpdates()) {
            newVersions.put(entry.getPackage().getName(), entry.getResult().getNextVersion());
        }
        Semver workspaceVersion = plan.getWorkspaceVersion().orElse(null);

        List<File> changedFiles = new ArrayList<>();
        List<File> createdFiles = new ArrayList<>();
        try {
            for (MavenProject project : projects) {
                boolean isRoot = project.getBasedir().equals(rootProject.getBasedir());
                if (alterModel(project, newVersions, isRoot ? workspaceVersion : null, workspaceVersion)) {
                    File pom = project.getFile().getCanonicalFile();
                    changedFiles.add(pom);
                    try (Writer fileWriter = WriterFactory.newXmlWriter(pom)) {
                        new MavenXpp3Writer().write(fileWriter, project.getOriginalModel());
                    }
                }
            }
            for (UpdatePlan.Entry entry : plan.getUpdates()) {
                String changelog = entry.getResult().getChangelog();
                if (changelog == null) {
                    continue;
                }
                Path changelogPath = request.changelogPath(entry.getPackage());
                File changelogFile = changelogPath.toFile().getCanonicalFile();
                if (!changedFiles.contains(changelogFile) && !createdFiles.contains(changelogFile)) {
                    (Files.exists(changelogPath) ? changedFiles : createdFiles).add(changelogFile);
                }
                Files.write(changelogPath, changelog.getBytes(StandardCharsets.UTF_8));
                log.debug("Wrote " + changelogPath);
            }
        } catch (Exception e) {
            log.info("Going to revert changes because there was an error.");
            if (!repo.revertChanges(log, changedFiles)) {
                log.warn("Could not revert changes - working directory is no longer clean. Please revert changes manually");
            }
            for (File created : createdFiles) {
                if (!created.delete() && created.exists()) {
                    log.warn("Could not delete " + created);
                }
            }
            throw new ValidationException("Unexpected exception while setting the new versions in the pom", e);
        }
        List<File> result = new ArrayList<>(changedFiles);
        result.addAll(createdFiles);
        return result;
    }

    /**
     * @return true if the model was changed
     */
    private boolean alterModel(MavenProject project, Map<String, Semver> newVersions, Semver newOwnWorkspaceVersion,
                               Semver workspaceVersion) {
        Model originalModel = project.getOriginalModel();
        boolean changed = false;

        Semver newVersion = newVersions.get(project.getArtifactId());
        if (newOwnWorkspaceVersion != null && originalModel.getVersion() != null) {
            newVersion = newOwnWorkspaceVersion;
        }
        if (newVersion != null && originalModel.getVersion() != null && !newVersion.getValue().equals(originalModel.getVersion())) {
            log.info("Going to release " + project.getArtifactId() + " " + newVersion.getValue());
            originalModel.setVersion(newVersion.getValue());
            changed = true;
        }

        Parent parent = originalModel.getParent();
        if (parent != null) {
            Semver parentVersion = isRootArtifact(parent.getArtifactId()) && workspaceVersion != null
                ? workspaceVersion : newVersions.get(parent.getArtifactId());
            if (parentVersion != null && isReactorModule(parent.getGroupId(), parent.getArtifactId())
                && !parentVersion.getValue().equals(parent.getVersion())) {
                parent.setVersion(parentVersion.getValue());
                log.debug(" Parent " + parent.getArtifactId() + " rewritten to version " + parentVersion.getValue());
                changed = true;
            }
        }

        List<Dependency> dependencies = new ArrayList<>(originalModel.getDependencies());
        if (originalModel.getDependencyManagement() != null) {
            dependencies.addAll(originalModel.getDependencyManagement().getDependencies());
        }
        for (Dependency dependency : dependencies) {
            Semver dependencyVersion = newVersions.get(dependency.getArtifactId());
            if (dependencyVersion == null || !isReactorModule(groupIdOf(project, dependency), dependency.getArtifactId())) {
                continue;
            }
            VersionConstraint constraint = VersionConstraint.parse(dependency.getVersion());
            if (constraint != null && constraint.isOutdatedBy(dependencyVersion)) {
                dependency.setVersion(dependencyVersion.getValue());
                log.debug(" Dependency on " + dependency.getArtifactId() + " rewritten to version " + dependencyVersion.getValue());
                changed = true;
            } else {
                log.debug(" Dependency on " + dependency.getArtifactId() + " kept at version " + dependency.getVersion());
            }
        }
        return changed;
    }

    private static String groupIdOf(MavenProject project, Dependency dependency) {
        return "${project.groupId}".equals(dependency.getGroupId()) ? project.getGroupId() : dependency.getGroupId();
    }

    private boolean isRootArtifact(String artifactId) {
        return rootProject.getArtifactId().equals(artifactId);
    }

    private boolean isReactorModule(String groupId, String artifactId) {
        for (MavenProject project : projects) {
            if (project.getArtifactId().equals(artifactId) && (groupId == null || project.getGroupId().equals(groupId))) {
                return true;
            }
        }
        return false;
    }
}
