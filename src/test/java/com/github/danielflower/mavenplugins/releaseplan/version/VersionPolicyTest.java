package com.github.danielflower.mavenplugins.releaseplan.version;

import com.github.danielflower.mavenplugins.releaseplan.ValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VersionPolicyTest {

    @Test
    void invalidRegexesAreReportedWithTheSettingName() {
        assertThatThrownBy(() -> VersionPolicy.DEFAULT.withCustomMajorIncrementRegex("(oops"))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("customMajorIncrementRegex");
    }

    @Test
    void emptyRegexesAreIgnored() throws ValidationException {
        VersionPolicy policy = VersionPolicy.DEFAULT.withCustomMinorIncrementRegex("");
        assertThat(policy.isCustomMinor(ConventionalCommit.parse("feat: x").get())).isFalse();
    }

    @Test
    void withMethodsLeaveTheOriginalAlone() {
        VersionPolicy changed = VersionPolicy.DEFAULT.withFeaturesAlwaysIncrementMinor(true);
        assertThat(changed.isFeaturesAlwaysIncrementMinor()).isTrue();
        assertThat(VersionPolicy.DEFAULT.isFeaturesAlwaysIncrementMinor()).isFalse();
    }
}
