package com.github.danielflower.mavenplugins.releaseplan.compat;

import com.github.danielflower.mavenplugins.releaseplan.ValidationException;
import com.github.danielflower.mavenplugins.releaseplan.version.Versions;
import com.github.danielflower.mavenplugins.releaseplan.workspace.Package;
import org.apache.maven.plugin.logging.SystemStreamLog;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandLineCompatibilityCheckerTest {

    @TempDir
    Path dir;

    private final SystemStreamLog log = new SystemStreamLog();

    private Package core() {
        return Package.builder("core", Versions.parse("1.0.0"), dir).build();
    }

    @Test
    void anEmptyCommandIsRejected() {
        assertThatThrownBy(() -> new CommandLineCompatibilityChecker(log, "  "))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void unknownToolsAreNotAvailable() throws ValidationException {
        assertThat(new CommandLineCompatibilityChecker(log, "no-such-api-checker-anywhere {baseline}").isAvailable()).isFalse();
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void exitCodeZeroMeansCompatible() throws Exception {
        CommandLineCompatibilityChecker checker = new CommandLineCompatibilityChecker(log, "sh -c 'exit 0'");
        assertThat(checker.isAvailable()).isTrue();
        assertThat(checker.check(core(), dir).getOutcome()).isEqualTo(CompatibilityCheck.Outcome.COMPATIBLE);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void otherExitCodesAreIncompatibleWithTheToolOutput() throws Exception {
        CommandLineCompatibilityChecker checker = new CommandLineCompatibilityChecker(log, "sh -c 'echo removed {package}; exit 3'");
        CompatibilityCheck check = checker.check(core(), dir);
        assertThat(check.getOutcome()).isEqualTo(CompatibilityCheck.Outcome.INCOMPATIBLE);
        assertThat(check.getDetails()).isEqualTo("removed core");
    }
}
