package com.github.danielflower.mavenplugins.releaseplan.report;

import com.github.danielflower.mavenplugins.releaseplan.diff.Commit;
import com.github.danielflower.mavenplugins.releaseplan.version.ConventionalCommit;
import com.vdurmont.semver4j.Semver;
import org.apache.commons.lang3.text.StrLookup;
import org.apache.commons.lang3.text.StrSubstitutor;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Renders a release as markdown with the commits grouped into Added, Fixed and Other.
 */
public class MarkdownChangelogRenderer implements ChangelogRenderer {

    public static final String DEFAULT_ISSUE_PREFIX = "#{";
    public static final String DEFAULT_ISSUE_SUFFIX = "}";

    static final String ADDED = "Added";
    static final String FIXED = "Fixed";
    static final String OTHER = "Other";

    private final StrSubstitutor strSubstitutor;
    private final CompareLinks compareLinks;

    public MarkdownChangelogRenderer() {
        this(new IssueLinkLookup(null), DEFAULT_ISSUE_PREFIX, DEFAULT_ISSUE_SUFFIX);
    }

    public MarkdownChangelogRenderer(StrLookup<String> issueLookup, String issueIdPrefix, String issueIdSuffix) {
        this(issueLookup, issueIdPrefix, issueIdSuffix, CompareLinks.none());
    }

    public MarkdownChangelogRenderer(StrLookup<String> issueLookup, String issueIdPrefix, String issueIdSuffix,
                                     CompareLinks compareLinks) {
        this.strSubstitutor = new StrSubstitutor(issueLookup, issueIdPrefix, issueIdSuffix, StrSubstitutor.DEFAULT_ESCAPE);
        this.compareLinks = compareLinks;
    }

    @Override
    public String render(String packageName, Semver nextVersion, LocalDate releaseDate, List<Commit> commits, String previousVersion) {
        Map<String, List<String>> sections = new LinkedHashMap<>();
        sections.put(ADDED, new ArrayList<>());
        sections.put(FIXED, new ArrayList<>());
        sections.put(OTHER, new ArrayList<>());
        for (Commit commit : commits) {
            Optional<ConventionalCommit> conventional = ConventionalCommit.parse(commit.getMessage());
            String section = conventional.isPresent() ? sectionOf(conventional.get()) : OTHER;
            sections.get(section).add(strSubstitutor.replace(line(commit, conventional)));
        }

        StringBuilder result = new StringBuilder();
        result.append("## [").append(nextVersion.getValue()).append("]");
        String releaseLink = compareLinks.between(packageName, previousVersion, nextVersion);
        if (releaseLink != null) {
            result.append("(").append(releaseLink).append(")");
        }
        result.append(" - ").append(releaseDate.format(DateTimeFormatter.ISO_LOCAL_DATE)).append("\n");
        for (Map.Entry<String, List<String>> section : sections.entrySet()) {
            if (section.getValue().isEmpty()) {
                continue;
            }
            result.append("\n### ").append(section.getKey()).append("\n\n");
            for (String line : section.getValue()) {
                result.append("- ").append(line).append("\n");
            }
        }
        return result.toString();
    }

    private static String sectionOf(ConventionalCommit commit) {
        if (commit.isFeature()) {
            return ADDED;
        }
        if (commit.isFix()) {
            return FIXED;
        }
        return OTHER;
    }

    private static String line(Commit commit, Optional<ConventionalCommit> conventional) {
        if (!conventional.isPresent()) {
            return commit.getShortMessage();
        }
        ConventionalCommit c = conventional.get();
        StringBuilder line = new StringBuilder();
        if (c.isBreaking()) {
            line.append("[**breaking**] ");
        }
        if (c.getScope() != null) {
            line.append("*(").append(c.getScope()).append(")* ");
        }
        line.append(c.getSubject());
        return line.toString();
    }
}
