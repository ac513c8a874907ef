package com.github.danielflower.mavenplugins.releaseplan.plan;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UpdateRunTest {

    @Test
    void warningsAreAnnouncedOncePerRun() {
        UpdateRun run = new UpdateRun();
        assertThat(run.firstTime("tool-missing")).isTrue();
        assertThat(run.firstTime("tool-missing")).isFalse();
        assertThat(new UpdateRun().firstTime("tool-missing")).isTrue();
    }

    @Test
    void cancelledRunsStop() {
        UpdateRun run = new UpdateRun();
        run.throwIfCancelled();
        run.cancel();
        assertThat(run.isCancelled()).isTrue();
        assertThatThrownBy(run::throwIfCancelled).isInstanceOf(CancellationException.class);
    }
}
