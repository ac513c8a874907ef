package com.github.danielflower.mavenplugins.releaseplan.report;

import com.github.danielflower.mavenplugins.releaseplan.diff.Commit;
import com.github.danielflower.mavenplugins.releaseplan.diff.ReleaseTagPattern;
import com.github.danielflower.mavenplugins.releaseplan.version.Versions;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Collections;

import static java.util.Arrays.asList;
import static org.assertj.core.api.Assertions.assertThat;

class MarkdownChangelogRendererTest {

    private static final LocalDate DATE = LocalDate.of(2024, 5, 17);

    @Test
    void groupsCommitsBySection() {
        String entry = new MarkdownChangelogRenderer().render("core", Versions.parse("1.2.0"), DATE, asList(
            new Commit("1", "feat: arrays"),
            new Commit("2", "fix(parser): trailing commas"),
            new Commit("3", "chore: bump plugins"),
            new Commit("4", "feat!: drop the old api")), null);

        assertThat(entry).isEqualTo("## [1.2.0] - 2024-05-17\n"
            + "\n### Added\n\n"
            + "- arrays\n"
            + "- [**breaking**] drop the old api\n"
            + "\n### Fixed\n\n"
            + "- *(parser)* trailing commas\n"
            + "\n### Other\n\n"
            + "- bump plugins\n");
    }

    @Test
    void linksTheHeadingToTheComparisonWithThePreviousRelease() {
        MarkdownChangelogRenderer renderer = new MarkdownChangelogRenderer(new IssueLinkLookup(null), "#{", "}",
            new CompareLinks("https://example.org/", Collections.singletonMap("core",
                new ReleaseTagPattern(ReleaseTagPattern.SINGLE_PACKAGE_TEMPLATE, "core"))));

        String entry = renderer.render("core", Versions.parse("1.2.0"), DATE, Collections.<Commit>emptyList(), "1.1.0");

        assertThat(entry).isEqualTo("## [1.2.0](https://example.org/compare/v1.1.0...v1.2.0) - 2024-05-17\n");
    }

    @Test
    void firstReleasesAndUnknownPackagesAreNotLinked() {
        MarkdownChangelogRenderer renderer = new MarkdownChangelogRenderer(new IssueLinkLookup(null), "#{", "}",
            new CompareLinks("https://example.org", Collections.singletonMap("core",
                new ReleaseTagPattern(ReleaseTagPattern.MULTI_PACKAGE_TEMPLATE, "core"))));

        assertThat(renderer.render("core", Versions.parse("0.1.0"), DATE, Collections.<Commit>emptyList(), null))
            .isEqualTo("## [0.1.0] - 2024-05-17\n");
        assertThat(renderer.render("other", Versions.parse("1.0.1"), DATE, Collections.<Commit>emptyList(), "1.0.0"))
            .isEqualTo("## [1.0.1] - 2024-05-17\n");
        assertThat(renderer.render("core", Versions.parse("1.0.1"), DATE, Collections.<Commit>emptyList(), "1.0.0"))
            .isEqualTo("## [1.0.1](https://example.org/compare/core-v1.0.0...core-v1.0.1) - 2024-05-17\n");
    }

    @Test
    void issueReferencesBecomeLinks() {
        MarkdownChangelogRenderer renderer = new MarkdownChangelogRenderer(
            new IssueLinkLookup("https://issues.example.org/browse/{issue}"), "#{", "}");

        String entry = renderer.render("core", Versions.parse("1.0.1"), DATE,
            asList(new Commit("1", "fix: crash on startup #{CORE-12}")), null);

        assertThat(entry).contains("- crash on startup [CORE-12](https://issues.example.org/browse/CORE-12)\n");
    }

    @Test
    void issueReferencesAreLeftAloneWithoutATemplate() {
        String entry = new MarkdownChangelogRenderer().render("core", Versions.parse("1.0.1"), DATE,
            asList(new Commit("1", "fix: crash #{12}")), null);

        assertThat(entry).contains("- crash #{12}\n");
    }
}
