package com.github.danielflower.mavenplugins.releaseplan;

import com.github.danielflower.mavenplugins.releaseplan.compat.CommandLineCompatibilityChecker;
import com.github.danielflower.mavenplugins.releaseplan.compat.CompatibilityChecker;
import com.github.danielflower.mavenplugins.releaseplan.diff.DiffDetector;
import com.github.danielflower.mavenplugins.releaseplan.diff.DirectoryFileSetCalculator;
import com.github.danielflower.mavenplugins.releaseplan.diff.DirectoryRegistryResolver;
import com.github.danielflower.mavenplugins.releaseplan.diff.GitHistoryDiffDetector;
import com.github.danielflower.mavenplugins.releaseplan.diff.PackageContentComparator;
import com.github.danielflower.mavenplugins.releaseplan.diff.PublishedSnapshotLocator;
import com.github.danielflower.mavenplugins.releaseplan.plan.DependencyPropagator;
import com.github.danielflower.mavenplugins.releaseplan.plan.PackageUpdateConfig;
import com.github.danielflower.mavenplugins.releaseplan.plan.UpdatePlan;
import com.github.danielflower.mavenplugins.releaseplan.plan.UpdatePlanner;
import com.github.danielflower.mavenplugins.releaseplan.plan.UpdateRequest;
import com.github.danielflower.mavenplugins.releaseplan.plan.UpdateRun;
import com.github.danielflower.mavenplugins.releaseplan.report.IssueLinkLookup;
import com.github.danielflower.mavenplugins.releaseplan.report.MarkdownChangelogRenderer;
import com.github.danielflower.mavenplugins.releaseplan.report.PlanReport;
import com.github.danielflower.mavenplugins.releaseplan.version.VersionCoordinator;
import com.github.danielflower.mavenplugins.releaseplan.version.VersionPolicy;
import com.github.danielflower.mavenplugins.releaseplan.workspace.Workspace;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static java.util.Arrays.asList;

/**
 * Works out which modules need a release, their next versions and their changelogs, and writes them to the poms
 * and changelog files.
 */
@Mojo(
    name = "plan",
    requiresDirectInvocation = true, // this moves the working copy through history, so it should not be bound to a phase
    inheritByDefault = true, // so you can configure this in a shared parent pom
    requiresProject = true, // this can only run against a maven project
    aggregator = true // the plugin should only run once against the aggregator pom
)
public class PlanMojo extends BaseMojo {

    /**
     * If true, the plan is only printed and no file is changed.
     */
    @Parameter(alias = "dryRun", defaultValue = "false", property = "dryRun")
    private boolean dryRun;

    /**
     * <p>
     * A directory holding the published modules, laid out as <code>module/version/</code> with the extracted
     * artifact in each version directory. When it is not set, release tags are the only record of what was
     * published.
     * </p>
     */
    @Parameter(property = "registryDirectory")
    private File registryDirectory;

    /**
     * The release tag name of a module, using <code>{package}</code> and <code>{version}</code>. Defaults to
     * <code>{package}-v{version}</code>, or <code>v{version}</code> when there is a single module.
     */
    @Parameter(property = "tagNameTemplate")
    private String tagNameTemplate;

    /**
     * A regular expression; modules are only released when one of their new commits matches it.
     */
    @Parameter(property = "releaseCommits")
    private String releaseCommits;

    @Parameter(alias = "sortCommitsOldestFirst", defaultValue = "false", property = "sortCommitsOldestFirst")
    private boolean sortCommitsOldestFirst;

    /**
     * The artifactId of the only module to plan.
     */
    @Parameter(property = "singlePackage")
    private String singlePackage;

    @Parameter(alias = "changelogUpdate", defaultValue = "true", property = "changelogUpdate")
    private boolean changelogUpdate;

    /**
     * If true, the API of each changed library module is compared with its published version using
     * {@link #compatibilityCommand}.
     */
    @Parameter(alias = "compatibilityCheck", defaultValue = "false", property = "compatibilityCheck")
    private boolean compatibilityCheck;

    /**
     * The tool comparing two versions of a module, with <code>{package}</code>, <code>{current}</code> and
     * <code>{baseline}</code> placeholders. Exit code 0 means the APIs are compatible.
     */
    @Parameter(property = "compatibilityCommand")
    private String compatibilityCommand;

    @Parameter(alias = "compatibilityThreads", defaultValue = "4", property = "compatibilityThreads")
    private int compatibilityThreads;

    @Parameter(alias = "featuresAlwaysIncrementMinor", defaultValue = "false", property = "featuresAlwaysIncrementMinor")
    private boolean featuresAlwaysIncrementMinor;

    @Parameter(alias = "breakingAlwaysIncrementMajor", defaultValue = "false", property = "breakingAlwaysIncrementMajor")
    private boolean breakingAlwaysIncrementMajor;

    /**
     * Commits whose type matches this regular expression count as breaking changes.
     */
    @Parameter(property = "customMajorIncrementRegex")
    private String customMajorIncrementRegex;

    /**
     * Commits whose type matches this regular expression count as features.
     */
    @Parameter(property = "customMinorIncrementRegex")
    private String customMinorIncrementRegex;

    /**
     * If true, only release tags are used to find the published version of each module.
     */
    @Parameter(alias = "gitOnly", defaultValue = "false", property = "gitOnly")
    private boolean gitOnly;

    /**
     * A lockfile, relative to the project root, whose changes count as changes to executable modules.
     */
    @Parameter(property = "lockfile")
    private String lockfile;

    /**
     * The web URL of the repository, used for compare links in changelogs.
     */
    @Parameter(property = "repositoryUrl")
    private String repositoryUrl;

    /**
     * <p>
     * A URL with an <code>{issue}</code> placeholder. References such as <code>#{123}</code> in commit messages
     * become links to it in changelogs.
     * </p>
     */
    @Parameter(property = "issueUrlTemplate")
    private String issueUrlTemplate;

    @Parameter(alias = "issueIdPrefix", defaultValue = "#{")
    private String issueIdPrefix;

    @Parameter(alias = "issueIdSuffix", defaultValue = "}")
    private String issueIdSuffix;

    /**
     * Settings of individual modules.
     */
    @Parameter(alias = "packages")
    private List<PackageConfiguration> packages;

    @Override
    public void execute() throws MojoExecutionException, MojoFailureException {
        Log log = getLog();

        PublishedSnapshotLocator snapshotLocator = null;
        try {
            LocalGitRepo repo = LocalGitRepo.fromDir(project.getBasedir());
            Map<String, PackageConfiguration> configs = packageConfigurations();
            Workspace workspace = ReactorWorkspace.fromProjects(log, project, projects, configs);
            UpdateRequest request = updateRequest(workspace, configs);

            DirectoryFileSetCalculator fileSetCalculator = new DirectoryFileSetCalculator();
            Path lockfilePath = lockfile == null ? null : workspace.getRootDirectory().resolve(lockfile);
            List<String> ignoredFiles = lockfilePath == null ? Collections.<String>emptyList()
                : Collections.singletonList(lockfilePath.getFileName().toString());
            snapshotLocator = new PublishedSnapshotLocator(log, repo,
                registryDirectory == null ? null : new DirectoryRegistryResolver(log, registryDirectory.toPath()));
            DiffDetector diffDetector = new GitHistoryDiffDetector(log, repo, snapshotLocator,
                new PackageContentComparator(log, fileSetCalculator, ignoredFiles), fileSetCalculator,
                new PomManifestReader(), lockfilePath);

            CompatibilityChecker compatibilityChecker = compatibilityCommand == null ? null
                : new CommandLineCompatibilityChecker(log, compatibilityCommand);
            UpdatePlanner planner = new UpdatePlanner(log, diffDetector, new VersionCoordinator(log),
                new DependencyPropagator(log),
                new MarkdownChangelogRenderer(new IssueLinkLookup(issueUrlTemplate), issueIdPrefix, issueIdSuffix,
                    request.compareLinks()),
                compatibilityChecker, compatibilityThreads);

            UpdatePlan plan = planner.plan(request, new UpdateRun());
            new PlanReport(log).print(plan);
            if (plan.hasFailures()) {
                List<String> messages = new ArrayList<>();
                messages.add("Some modules could not be planned, so nothing was changed:");
                for (UpdatePlan.PackageFailure failure : plan.getFailures()) {
                    messages.add(" * " + failure.getPackageName() + " (" + failure.getStage() + ")");
                    for (String message : failure.getMessages()) {
                        messages.add("     " + message);
                    }
                }
                printBigErrorMessageAndThrow(log, "Could not plan " + plan.getFailures().size() + " module(s)", messages, null);
            }
            if (dryRun) {
                log.info("Dry run: no files were changed");
            } else if (!plan.isEmpty()) {
                new PomUpdater(log, repo, project, projects).apply(plan, request);
            }
        } catch (ValidationException e) {
            printBigErrorMessageAndThrow(log, e.getMessage(), e.getMessages(), e);
        } finally {
            if (snapshotLocator != null) {
                snapshotLocator.cleanUp();
            }
        }
    }

    private Map<String, PackageConfiguration> packageConfigurations() throws ValidationException {
        Map<String, PackageConfiguration> configs = new HashMap<>();
        if (packages == null) {
            return configs;
        }
        for (PackageConfiguration config : packages) {
            if (config.getName() == null) {
                String summary = "Each entry of packages needs a name";
                throw new ValidationException(summary, asList(summary, "Use the artifactId of the module as the name."));
            }
            configs.put(config.getName(), config);
        }
        return configs;
    }

    private UpdateRequest updateRequest(Workspace workspace, Map<String, PackageConfiguration> configs) throws ValidationException {
        VersionPolicy policy = VersionPolicy.DEFAULT
            .withFeaturesAlwaysIncrementMinor(featuresAlwaysIncrementMinor)
            .withBreakingAlwaysIncrementMajor(breakingAlwaysIncrementMajor)
            .withCustomMajorIncrementRegex(customMajorIncrementRegex)
            .withCustomMinorIncrementRegex(customMinorIncrementRegex);
        PackageUpdateConfig defaults = PackageUpdateConfig.builder()
            .policy(policy)
            .changelogUpdate(changelogUpdate)
            .compatibilityCheck(compatibilityCheck)
            .tagNameTemplate(tagNameTemplate)
            .gitOnly(gitOnly)
            .build();

        UpdateRequest.Builder builder = UpdateRequest.builder(workspace)
            .defaultConfig(defaults)
            .singlePackage(singlePackage)
            .allowDirty(allowDirty)
            .releaseCommits(compileReleaseCommits())
            .sortCommitsOldestFirst(sortCommitsOldestFirst)
            .repositoryUrl(repositoryUrl);
        for (PackageConfiguration config : configs.values()) {
            builder.packageConfig(config.getName(), config.toUpdateConfig(defaults));
        }
        return builder.build();
    }

    private Pattern compileReleaseCommits() throws ValidationException {
        if (releaseCommits == null || releaseCommits.isEmpty()) {
            return null;
        }
        try {
            return Pattern.compile(releaseCommits);
        } catch (PatternSyntaxException e) {
            String summary = "The releaseCommits setting is not a valid regular expression";
            throw new ValidationException(summary, asList(summary, " * " + releaseCommits, e.getDescription()), e);
        }
    }
}
