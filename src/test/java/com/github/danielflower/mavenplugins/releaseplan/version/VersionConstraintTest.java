package com.github.danielflower.mavenplugins.releaseplan.version;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class VersionConstraintTest {

    @Test
    void exactVersionsAreOutdatedByAnyHigherVersion() {
        VersionConstraint constraint = VersionConstraint.parse("0.1.1");
        assertThat(constraint.isRange()).isFalse();
        assertThat(constraint.isOutdatedBy(Versions.parse("0.1.2"))).isTrue();
        assertThat(constraint.isOutdatedBy(Versions.parse("0.1.1"))).isFalse();
    }

    @Test
    void rangesAreOutdatedWhenTheyNoLongerMatch() {
        VersionConstraint constraint = VersionConstraint.parse("[0.1.0,0.2.0)");
        assertThat(constraint.isRange()).isTrue();
        assertThat(constraint.isOutdatedBy(Versions.parse("0.1.5"))).isFalse();
        assertThat(constraint.isOutdatedBy(Versions.parse("0.2.0"))).isTrue();
    }

    @Test
    void rangesMayUseShortVersionsAndOpenBounds() {
        VersionConstraint bounded = VersionConstraint.parse("[1.0,2.0)");
        assertThat(bounded.isOutdatedBy(Versions.parse("1.4.0"))).isFalse();
        assertThat(bounded.isOutdatedBy(Versions.parse("2.0.0"))).isTrue();

        VersionConstraint open = VersionConstraint.parse("[1.0,)");
        assertThat(open.isOutdatedBy(Versions.parse("9.0.0"))).isFalse();
    }

    @Test
    void malformedRangesDoNotPinAVersion() {
        assertThat(VersionConstraint.parse("[2.0,1.0)")).isNull();
    }

    @Test
    void propertiesAndBlanksDoNotPinAVersion() {
        assertThat(VersionConstraint.parse("${project.version}")).isNull();
        assertThat(VersionConstraint.parse("  ")).isNull();
        assertThat(VersionConstraint.parse(null)).isNull();
    }
}
