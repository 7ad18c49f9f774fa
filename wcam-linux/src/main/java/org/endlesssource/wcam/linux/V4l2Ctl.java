package org.endlesssource.wcam.linux;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@code v4l2-ctl} from v4l-utils and returns its textual output.
 * Output is redirected to temporary files so a chatty process never blocks on a full pipe.
 */
class V4l2Ctl {
    private static final Logger logger = LoggerFactory.getLogger(V4l2Ctl.class);
    static final String EXECUTABLE = "v4l2-ctl";

    private final Duration timeout;

    V4l2Ctl(Duration timeout) {
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    static Optional<Path> findExecutable() {
        String path = System.getenv("PATH");
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Path.of(dir, EXECUTABLE);
            if (Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Output of {@code --list-devices}. v4l2-ctl exits with an error when no device node exists at all,
     * which is reported as an empty listing.
     */
    String listDevices() {
        Result result = run("--list-devices");
        if (result.exitCode() != 0) {
            logger.debug("v4l2-ctl --list-devices exited with {}: {}", result.exitCode(), result.stderr());
        }
        return result.stdout();
    }

    /**
     * Output of {@code --list-formats-ext} for one node, empty when the node cannot be queried.
     */
    String listFormats(String node) {
        Result result = run("--list-formats-ext", "-d", node);
        if (result.exitCode() != 0) {
            logger.debug("v4l2-ctl --list-formats-ext -d {} exited with {}: {}", node, result.exitCode(), result.stderr());
            return "";
        }
        return result.stdout();
    }

    /**
     * @throws IllegalStateException if the process times out or is interrupted
     * @throws UncheckedIOException  if the process cannot be started
     */
    Result run(String... args) {
        List<String> command = new ArrayList<>();
        command.add(EXECUTABLE);
        command.addAll(List.of(args));
        ProcessBuilder pb = new ProcessBuilder(command);
        Path stdoutFile = null;
        Path stderrFile = null;
        try {
            stdoutFile = Files.createTempFile("wcam_v4l2_out", ".txt");
            stderrFile = Files.createTempFile("wcam_v4l2_err", ".txt");
            pb.redirectOutput(stdoutFile.toFile());
            pb.redirectError(stderrFile.toFile());

            Process p = pb.start();
            boolean finished = p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                p.destroyForcibly();
                throw new IllegalStateException("Command timed out after " + timeout.toMillis() + " ms: "
                        + String.join(" ", command));
            }
            String out = Files.readString(stdoutFile, StandardCharsets.UTF_8);
            String err = Files.readString(stderrFile, StandardCharsets.UTF_8).trim();
            return new Result(p.exitValue(), out, err);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to run " + String.join(" ", command), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while running " + String.join(" ", command), e);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            logger.debug("Could not delete temporary file {}: {}", file, e.getMessage());
        }
    }

    record Result(int exitCode, String stdout, String stderr) {
    }
}
