package io.billbatch.render.engine;

import io.billbatch.render.EngineUnavailableException;
import io.billbatch.render.OutputFormat;
import io.billbatch.render.RenderException;
import io.billbatch.render.RenderRequest;
import io.billbatch.render.RenderingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Base for engines driven through an external executable. The document is written to a temp
 * file, the executable renders it into another temp file, and the output bytes are read back.
 */
public abstract class CommandLineEngine implements RenderingEngine {
    private static final Logger log = LoggerFactory.getLogger(CommandLineEngine.class);

    static final Duration PROBE_TIMEOUT = Duration.ofSeconds(5);
    private static final int MAX_LOG_CHARS = 2000;

    private final String name;
    private final List<String> executables;
    private final Duration processTimeout;

    private volatile String resolvedExecutable;

    protected CommandLineEngine(String name, List<String> executables, Duration processTimeout) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.executables = List.copyOf(Objects.requireNonNull(executables, "executables must not be null"));
        this.processTimeout = Objects.requireNonNull(processTimeout, "processTimeout must not be null");
        if (this.executables.isEmpty()) {
            throw new IllegalArgumentException(name + ": at least one executable candidate is required");
        }
        if (processTimeout.isZero() || processTimeout.isNegative()) {
            throw new IllegalArgumentException(name + ": processTimeout must be positive");
        }
    }

    /**
     * Command line that renders {@code input} into {@code output}.
     */
    protected abstract List<String> buildCommand(String executable, Path input, Path output, RenderRequest request);

    @Override
    public String name() {
        return name;
    }

    public List<String> executables() {
        return executables;
    }

    @Override
    public boolean probe() {
        String found = resolveExecutable();
        resolvedExecutable = found;
        return found != null;
    }

    @Override
    public byte[] render(RenderRequest request) throws RenderException {
        OutputFormat format = request.format();
        if (!supportedFormats().contains(format)) {
            throw new RenderException(name + " does not support " + format);
        }
        String executable = resolvedExecutable;
        if (executable == null) {
            executable = resolveExecutable();
            if (executable == null) {
                throw new EngineUnavailableException("no working executable among " + executables);
            }
            resolvedExecutable = executable;
        }

        Path workDir = null;
        try {
            workDir = Files.createTempDirectory("billbatch-" + name + "-");
            Path input = workDir.resolve("input.html");
            Path output = workDir.resolve("output" + format.extension());
            Path processLog = workDir.resolve("process.log");
            Files.writeString(input, HtmlPageStyles.apply(request.html(), request.options()), StandardCharsets.UTF_8);

            List<String> command = buildCommand(executable, input, output, request);
            log.debug("Rendering source={} engine={} command={}", request.sourceName(), name, command);

            int exitCode = run(command, processLog, request);
            if (!Files.isRegularFile(output) || Files.size(output) == 0) {
                throw new RenderException(name + " produced no output (exit=" + exitCode + "): " + tail(processLog));
            }
            if (exitCode != 0) {
                log.warn("{} exited with code {} but produced output source={}", name, exitCode, request.sourceName());
            }
            return Files.readAllBytes(output);
        } catch (IOException e) {
            throw new RenderException(name + " I/O failure: " + e.getMessage(), e);
        } finally {
            deleteQuietly(workDir);
        }
    }

    private int run(List<String> command, Path processLog, RenderRequest request) throws RenderException, IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        pb.redirectOutput(processLog.toFile());

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            resolvedExecutable = null;
            throw new EngineUnavailableException("failed to start " + command.get(0) + ": " + e.getMessage(), e);
        }

        try {
            if (!process.waitFor(processTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new RenderException(name + " timed out after " + processTimeout + " rendering " + request.sourceName());
            }
            return process.exitValue();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new RenderException(name + " interrupted while rendering " + request.sourceName(), e);
        }
    }

    /**
     * First candidate whose {@code --version} exits 0 within {@link #PROBE_TIMEOUT}; null if none.
     */
    private String resolveExecutable() {
        for (String candidate : executables) {
            if (versionCheck(candidate)) {
                return candidate;
            }
        }
        log.debug("No executable found for engine={} candidates={}", name, executables);
        return null;
    }

    private static boolean versionCheck(String executable) {
        List<String> command = new ArrayList<>();
        command.add(executable);
        command.add("--version");
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        try {
            Process process = pb.start();
            if (!process.waitFor(PROBE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                return false;
            }
            return process.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String tail(Path processLog) {
        try {
            if (!Files.isRegularFile(processLog)) {
                return "";
            }
            String text = Files.readString(processLog, StandardCharsets.UTF_8).trim();
            return text.length() <= MAX_LOG_CHARS ? text : text.substring(text.length() - MAX_LOG_CHARS);
        } catch (IOException e) {
            return "(process log unreadable: " + e.getMessage() + ")";
        }
    }

    private static void deleteQuietly(Path dir) {
        if (dir == null) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.debug("Could not delete temp file {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.debug("Could not clean temp dir {}: {}", dir, e.getMessage());
        }
    }
}
