package com.contentcuration.curator.service.process;

import com.contentcuration.curator.exception.CollaboratorException;
import com.contentcuration.curator.exception.CollaboratorTimeoutException;
import com.contentcuration.curator.service.process.ExternalCommandRunner.CommandResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ExternalCommandRunnerTest {

    private final ExternalCommandRunner runner = new ExternalCommandRunner();

    @Test
    @DisplayName("Stdin is piped through and stdout captured")
    void pipesStdin() {
        CommandResult result = runner.run("cat", List.of("cat"), "rate me", null, Duration.ofSeconds(10));

        assertThat(result.succeeded()).isTrue();
        assertThat(result.stdout()).isEqualTo("rate me");
    }

    @Test
    @DisplayName("Exit code and stderr are reported")
    void capturesFailure() {
        CommandResult result = runner.run("sh", List.of("sh", "-c", "echo broken >&2; exit 3"), null, null,
                Duration.ofSeconds(10));

        assertThat(result.exitCode()).isEqualTo(3);
        assertThat(result.stderr()).contains("broken");
    }

    @Test
    @DisplayName("A tool that exits without reading its input still reports exit code and stderr")
    void toolExitsBeforeReadingInput() {
        String largeInput = "x".repeat(4 * 1024 * 1024);

        CommandResult result = runner.run("sh", List.of("sh", "-c", "echo refused >&2; exit 4"), largeInput, null,
                Duration.ofSeconds(10));

        assertThat(result.exitCode()).isEqualTo(4);
        assertThat(result.stderr()).contains("refused");
    }

    @Test
    @DisplayName("A run over its bound is killed and reported as a timeout")
    void timesOut() {
        assertThatThrownBy(() -> runner.run("sleeper", List.of("sleep", "5"), null, null, Duration.ofMillis(200)))
                .isInstanceOf(CollaboratorTimeoutException.class)
                .hasMessageContaining("sleeper timed out");
    }

    @Test
    @DisplayName("A missing executable is a collaborator failure")
    void missingExecutable() {
        assertThatThrownBy(() -> runner.run("ghost", List.of("definitely-not-installed-tool-42"), null, null,
                Duration.ofSeconds(5)))
                .isInstanceOf(CollaboratorException.class);
    }
}
