package com.github.danielflower.mavenplugins.releaseplan;

import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugins.annotations.Parameter;
import org.apache.maven.project.MavenProject;

import java.util.List;

public abstract class BaseMojo extends AbstractMojo {

    /**
     * The Maven Project.
     */
    @Parameter(property = "project", required = true, readonly = true, defaultValue = "${project}")
    protected MavenProject project;

    @Parameter(property = "projects", required = true, readonly = true, defaultValue = "${reactorProjects}")
    protected List<MavenProject> projects;

    /**
     * If true, the plan is calculated even when the working copy has uncommitted changes.
     */
    @Parameter(alias = "allowDirty", defaultValue = "false", property = "allowDirty")
    protected boolean allowDirty;

    static void printBigErrorMessageAndThrow(Log log, String terseMessage, List<String> linesToLog, Throwable cause) throws MojoExecutionException {
        log.error("");
        log.error("");
        log.error("");
        log.error("************************************");
        log.error("Could not calculate the release plan");
        log.error("************************************");
        log.error("");
        log.error("");
        for (String line : linesToLog) {
            log.error(line);
        }
        log.error("");
        log.error("");
        throw new MojoExecutionException(terseMessage, cause);
    }
}
