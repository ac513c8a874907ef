package com.github.danielflower.mavenplugins.releaseplan.report;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IssueLinkLookupTest {

    @Test
    void buildsMarkdownLinks() {
        assertThat(new IssueLinkLookup("https://github.com/example/repo/issues/{issue}").lookup("42"))
            .isEqualTo("[42](https://github.com/example/repo/issues/42)");
    }

    @Test
    void returnsNothingWithoutATemplate() {
        assertThat(new IssueLinkLookup(null).lookup("42")).isNull();
        assertThat(new IssueLinkLookup("https://x/{issue}").lookup(" ")).isNull();
    }
}
