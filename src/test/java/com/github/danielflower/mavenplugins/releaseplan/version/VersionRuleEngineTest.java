package com.github.danielflower.mavenplugins.releaseplan.version;

import com.github.danielflower.mavenplugins.releaseplan.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;

import static java.util.Arrays.asList;
import static org.assertj.core.api.Assertions.assertThat;

class VersionRuleEngineTest {

    private final VersionRuleEngine engine = new VersionRuleEngine(VersionPolicy.DEFAULT);

    private String next(String current, String... messages) {
        return engine.nextVersion(Versions.parse(current), asList(messages)).getValue();
    }

    @Test
    void noCommitsMeansNoRelease() {
        assertThat(engine.nextIncrement(Versions.parse("1.2.3"), Collections.<String>emptyList())).isEmpty();
        assertThat(engine.nextVersion(Versions.parse("1.2.3"), Collections.<String>emptyList()).getValue()).isEqualTo("1.2.3");
    }

    @Test
    void fixesAndOtherCommitsBumpThePatch() {
        assertThat(next("1.2.3", "fix: null check")).isEqualTo("1.2.4");
        assertThat(next("1.2.3", "docs: typo")).isEqualTo("1.2.4");
        assertThat(next("0.1.0", "fix: null check")).isEqualTo("0.1.1");
    }

    @Test
    void messagesThatAreNotConventionalCountAsPatches() {
        assertThat(next("1.2.3", "Tidied up the build")).isEqualTo("1.2.4");
    }

    @Test
    void featuresBumpTheMinorAfterOneDotZero() {
        assertThat(next("1.2.3", "fix: a", "feat: b")).isEqualTo("1.3.0");
    }

    @Test
    void featuresBumpThePatchBeforeOneDotZero() {
        assertThat(next("0.2.3", "feat: b")).isEqualTo("0.2.4");
    }

    @Test
    void breakingChangesBumpTheMajorAfterOneDotZero() {
        assertThat(next("1.2.3", "feat!: removed the old api")).isEqualTo("2.0.0");
        assertThat(next("1.2.3", "fix: thing\n\nBREAKING CHANGE: config moved")).isEqualTo("2.0.0");
    }

    @Test
    void breakingChangesBumpTheMinorBeforeOneDotZero() {
        assertThat(next("0.2.3", "feat!: removed the old api")).isEqualTo("0.3.0");
    }

    @Test
    void breakingChangesOnZeroDotZeroBumpThePatch() {
        assertThat(next("0.0.3", "feat!: removed the old api")).isEqualTo("0.0.4");
    }

    @Test
    void preReleasesOnlyMoveThePreReleaseNumber() {
        assertThat(next("1.0.0-alpha.1", "feat!: big change")).isEqualTo("1.0.0-alpha.2");
        assertThat(next("1.0.0-rc", "fix: small change")).isEqualTo("1.0.0-rc.1");
    }

    @Test
    void policyCanForceMinorAndMajorBumpsBeforeOneDotZero() {
        VersionRuleEngine forced = new VersionRuleEngine(VersionPolicy.DEFAULT
            .withFeaturesAlwaysIncrementMinor(true)
            .withBreakingAlwaysIncrementMajor(true));
        assertThat(forced.nextVersion(Versions.parse("0.2.3"), asList("feat: b")).getValue()).isEqualTo("0.3.0");
        assertThat(forced.nextVersion(Versions.parse("0.2.3"), asList("fix!: b")).getValue()).isEqualTo("1.0.0");
    }

    @Test
    void customRegexesMatchCommitTypes() throws ValidationException {
        VersionRuleEngine custom = new VersionRuleEngine(VersionPolicy.DEFAULT
            .withCustomMajorIncrementRegex("^major$")
            .withCustomMinorIncrementRegex("^(minor|perf)$"));
        List<String> perf = asList("perf: faster lookups");
        assertThat(custom.nextVersion(Versions.parse("1.2.3"), perf).getValue()).isEqualTo("1.3.0");
        assertThat(custom.nextVersion(Versions.parse("1.2.3"), asList("major: rewrite")).getValue()).isEqualTo("2.0.0");
        assertThat(custom.nextVersion(Versions.parse("1.2.3"), asList("chore: deps")).getValue()).isEqualTo("1.2.4");
    }

    @Test
    void theNextVersionIsAlwaysGreater() {
        for (String current : asList("0.0.1", "0.1.0", "1.0.0", "1.0.0-beta", "2.5.9-rc.3")) {
            for (String message : asList("fix: a", "feat: a", "feat!: a", "whatever")) {
                assertThat(Versions.isGreater(Versions.parse(next(current, message)), Versions.parse(current)))
                    .as(current + " with " + message)
                    .isTrue();
            }
        }
    }
}
