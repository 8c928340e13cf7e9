package com.contentcuration.curator.service.process;

import com.contentcuration.curator.exception.CollaboratorException;
import com.contentcuration.curator.exception.CollaboratorTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external tool to completion under a time bound.
 *
 * <p>Output streams are redirected to temporary files so a chatty process can never block on a
 * full pipe while stdin is still being written.
 */
@Component
@Slf4j
public class ExternalCommandRunner {

    public record CommandResult(int exitCode, String stdout, String stderr) {

        public boolean succeeded() {
            return exitCode == 0;
        }
    }

    /**
     * @param collaborator name used in errors and logs
     * @param command      executable and arguments
     * @param stdin        text piped to the process, or null for none
     * @param workingDir   working directory, or null to inherit
     * @param timeout      upper bound for the whole run
     * @throws CollaboratorTimeoutException when the bound is exceeded (the process is killed)
     * @throws CollaboratorException        when the process cannot be started or awaited
     */
    public CommandResult run(String collaborator, List<String> command, String stdin,
                             Path workingDir, Duration timeout) {
        Path stdoutFile = null;
        Path stderrFile = null;
        Process process = null;
        try {
            stdoutFile = Files.createTempFile("curator-out-", ".log");
            stderrFile = Files.createTempFile("curator-err-", ".log");

            ProcessBuilder pb = new ProcessBuilder(command);
            if (workingDir != null) {
                pb.directory(workingDir.toFile());
            }
            pb.redirectOutput(stdoutFile.toFile());
            pb.redirectError(stderrFile.toFile());
            if (stdin == null) {
                pb.redirectInput(ProcessBuilder.Redirect.from(nullDevice()));
            }

            log.debug("Running {}: {}", collaborator, String.join(" ", command));
            process = pb.start();

            if (stdin != null) {
                writeStdin(collaborator, process, stdin);
            }

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new CollaboratorTimeoutException(collaborator, timeout);
            }

            return new CommandResult(
                    process.exitValue(),
                    Files.readString(stdoutFile, StandardCharsets.UTF_8),
                    Files.readString(stderrFile, StandardCharsets.UTF_8));

        } catch (IOException e) {
            if (process != null) {
                process.destroyForcibly();
            }
            throw new CollaboratorException("Failed to run " + collaborator + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                process.destroyForcibly();
            }
            throw new CollaboratorException("Interrupted while waiting for " + collaborator, e);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    /**
     * A tool that exits before reading all of its input breaks the pipe; its exit code and stderr
     * are still collected by the caller.
     */
    private static void writeStdin(String collaborator, Process process, String stdin) {
        try (OutputStream in = process.getOutputStream()) {
            in.write(stdin.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.debug("{} stopped reading its input: {}", collaborator, e.getMessage());
        }
    }

    private static File nullDevice() {
        boolean windows = System.getProperty("os.name", "").toLowerCase().startsWith("windows");
        return new File(windows ? "NUL" : "/dev/null");
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete temp file {}: {}", file, e.getMessage());
        }
    }
}
