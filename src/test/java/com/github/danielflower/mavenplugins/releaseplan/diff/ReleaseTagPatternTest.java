package com.github.danielflower.mavenplugins.releaseplan.diff;

import com.github.danielflower.mavenplugins.releaseplan.version.Versions;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReleaseTagPatternTest {

    @Test
    void namesTagsFromTheTemplate() {
        assertThat(new ReleaseTagPattern(ReleaseTagPattern.MULTI_PACKAGE_TEMPLATE, "core").tagName(Versions.parse("1.2.3")))
            .isEqualTo("core-v1.2.3");
        assertThat(new ReleaseTagPattern(ReleaseTagPattern.SINGLE_PACKAGE_TEMPLATE, "core").tagName(Versions.parse("1.2.3")))
            .isEqualTo("v1.2.3");
    }

    @Test
    void readsVersionsBackFromMatchingTags() {
        ReleaseTagPattern pattern = new ReleaseTagPattern(ReleaseTagPattern.MULTI_PACKAGE_TEMPLATE, "core");
        assertThat(pattern.versionOf("core-v1.2.3").get().getValue()).isEqualTo("1.2.3");
        assertThat(pattern.versionOf("core-v2.0.0-rc.1").get().getValue()).isEqualTo("2.0.0-rc.1");
    }

    @Test
    void ignoresTagsOfOtherPackages() {
        ReleaseTagPattern pattern = new ReleaseTagPattern(ReleaseTagPattern.MULTI_PACKAGE_TEMPLATE, "core");
        assertThat(pattern.versionOf("core-api-v1.2.3")).isEmpty();
        assertThat(pattern.versionOf("v1.2.3")).isEmpty();
        assertThat(pattern.versionOf("core-v1.2")).isEmpty();
    }

    @Test
    void packageNamesAreMatchedLiterally() {
        ReleaseTagPattern pattern = new ReleaseTagPattern("{package}@{version}", "a.b");
        assertThat(pattern.versionOf("a.b@1.0.0")).isPresent();
        assertThat(pattern.versionOf("axb@1.0.0")).isEmpty();
    }

    @Test
    void picksTheDefaultTemplateFromThePackageCount() {
        assertThat(ReleaseTagPattern.defaultTemplate(true)).isEqualTo("{package}-v{version}");
        assertThat(ReleaseTagPattern.defaultTemplate(false)).isEqualTo("v{version}");
    }
}
