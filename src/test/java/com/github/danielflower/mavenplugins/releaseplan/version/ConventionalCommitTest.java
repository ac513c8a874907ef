package com.github.danielflower.mavenplugins.releaseplan.version;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConventionalCommitTest {

    @Test
    void parsesTypeScopeAndSubject() {
        ConventionalCommit commit = ConventionalCommit.parse("feat(parser): support arrays\n\nLonger body").get();
        assertThat(commit.getType()).isEqualTo("feat");
        assertThat(commit.getScope()).isEqualTo("parser");
        assertThat(commit.getSubject()).isEqualTo("support arrays");
        assertThat(commit.isFeature()).isTrue();
        assertThat(commit.isBreaking()).isFalse();
    }

    @Test
    void breakingChangesCanBeMarkedInTheHeaderOrAFooter() {
        assertThat(ConventionalCommit.parse("fix!: drop java 8").get().isBreaking()).isTrue();
        assertThat(ConventionalCommit.parse("fix(api)!: drop java 8").get().isBreaking()).isTrue();
        assertThat(ConventionalCommit.parse("fix: x\n\nBREAKING CHANGE: the config moved").get().isBreaking()).isTrue();
        assertThat(ConventionalCommit.parse("fix: x\n\nBREAKING-CHANGE: the config moved").get().isBreaking()).isTrue();
    }

    @Test
    void typesAreLowerCased() {
        assertThat(ConventionalCommit.parse("Fix: x").get().isFix()).isTrue();
    }

    @Test
    void otherMessagesAreNotParsed() {
        assertThat(ConventionalCommit.parse("Merge branch 'main'")).isEmpty();
        assertThat(ConventionalCommit.parse("fix:no space")).isEmpty();
        assertThat(ConventionalCommit.parse("")).isEmpty();
        assertThat(ConventionalCommit.parse(null)).isEmpty();
    }
}
