package com.github.danielflower.mavenplugins.releaseplan;

import com.github.danielflower.mavenplugins.releaseplan.plan.PackageUpdateConfig;
import com.github.danielflower.mavenplugins.releaseplan.version.ConventionalCommit;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

import static java.util.Arrays.asList;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PackageConfigurationTest {

    private final PackageUpdateConfig defaults = PackageUpdateConfig.builder()
        .changelogUpdate(false)
        .tagNameTemplate("v{version}")
        .build();

    @Test
    void unsetValuesFallBackToTheDefaults() throws ValidationException {
        PackageUpdateConfig config = new PackageConfiguration("core").toUpdateConfig(defaults);

        assertThat(config.isChangelogUpdate()).isFalse();
        assertThat(config.getTagNameTemplate()).isEqualTo("v{version}");
        assertThat(config.isRelease()).isTrue();
        assertThat(config.getVersionGroup()).isNull();
    }

    @Test
    void setValuesOverrideTheDefaults() throws ValidationException {
        PackageConfiguration configuration = new PackageConfiguration("core");
        configuration.setChangelogUpdate(true);
        configuration.setRelease(false);
        configuration.setVersionGroup("platform");
        configuration.setChangelogInclude(asList("core-api"));
        configuration.setChangelogPath("docs/CHANGES.md");
        configuration.setGitOnly(true);
        configuration.setCustomMinorIncrementRegex("^perf$");

        PackageUpdateConfig config = configuration.toUpdateConfig(defaults);

        assertThat(config.isChangelogUpdate()).isTrue();
        assertThat(config.isRelease()).isFalse();
        assertThat(config.getVersionGroup()).isEqualTo("platform");
        assertThat(config.getChangelogInclude()).containsExactly("core-api");
        assertThat(config.getChangelogPath()).isEqualTo(Paths.get("docs/CHANGES.md"));
        assertThat(config.getGitOnly()).isTrue();
        assertThat(config.getPolicy().isCustomMinor(ConventionalCommit.parse("perf: faster").get())).isTrue();
    }

    @Test
    void invalidRegexesAreRejected() {
        PackageConfiguration configuration = new PackageConfiguration("core");
        configuration.setCustomMajorIncrementRegex("[");

        assertThatThrownBy(() -> configuration.toUpdateConfig(defaults)).isInstanceOf(ValidationException.class);
    }
}
