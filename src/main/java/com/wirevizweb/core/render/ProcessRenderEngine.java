package com.wirevizweb.core.render;

import com.wirevizweb.core.format.ImageFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the {@code wireviz} command line tool as a child process.
 *
 * <p>stdout and stderr are merged into {@value #ENGINE_LOG} in the output
 * directory. Only its tail is kept for error messages.
 */
@Component
public class ProcessRenderEngine implements RenderEngine {

    private static final Logger log = LoggerFactory.getLogger(ProcessRenderEngine.class);

    static final String ENGINE_LOG = "engine.log";

    /** Tail of the engine output kept for error messages. */
    static final int MAX_DIAGNOSTIC_CHARS = 8 * 1024;

    private final EngineProperties properties;
    private final EngineCommandBuilder commandBuilder;

    public ProcessRenderEngine(EngineProperties properties, EngineCommandBuilder commandBuilder) {
        this.properties = properties;
        this.commandBuilder = commandBuilder;
    }

    @Override
    public void render(Path input, Path outputDir, ImageFormat format) {
        List<String> command = commandBuilder.build(input, outputDir, format);
        Path engineLog = outputDir.resolve(ENGINE_LOG);
        int timeoutSeconds = properties.getTimeoutSeconds();
        log.debug("Running: {}", String.join(" ", command));

        Process process;
        try {
            process = new ProcessBuilder(command)
                    .directory(outputDir.toFile())
                    .redirectErrorStream(true)
                    .redirectOutput(engineLog.toFile())
                    .start();
        } catch (IOException e) {
            throw new RenderEngineException("Could not start rendering engine '" + command.get(0) + "': "
                    + e.getMessage(), RenderEngineException.NO_EXIT_CODE, "", e);
        }

        boolean finished;
        try {
            finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new RenderEngineException("Interrupted while waiting for rendering engine",
                    RenderEngineException.NO_EXIT_CODE, readTail(engineLog), e);
        }

        if (!finished) {
            terminate(process);
            log.warn("Rendering engine timed out after {}s", timeoutSeconds);
            throw new RenderEngineException("Rendering engine timed out after " + timeoutSeconds + "s",
                    RenderEngineException.NO_EXIT_CODE, readTail(engineLog));
        }

        int exitCode = process.exitValue();
        String output = readTail(engineLog);
        if (exitCode != 0) {
            log.warn("Rendering engine exited with code {}", exitCode);
            throw new RenderEngineException("Rendering engine failed with exit code " + exitCode,
                    exitCode, output);
        }
        if (!output.isBlank()) {
            log.debug("engine: {}", output.strip());
        }
    }

    @Override
    public boolean isAvailable() {
        List<String> command = properties.getCommand();
        if (command == null || command.isEmpty() || command.get(0).isBlank()) {
            return false;
        }
        return resolveExecutable(command.get(0), System.getenv("PATH")) != null;
    }

    @Override
    public String describe() {
        return String.join(" ", properties.getCommand());
    }

    /**
     * Finds an executable by absolute/relative path, or by searching {@code path}.
     *
     * @return the resolved file, or null if nothing executable was found
     */
    static Path resolveExecutable(String executable, String path) {
        if (executable.contains(File.separator) || executable.contains("/")) {
            Path candidate = Path.of(executable);
            return Files.isRegularFile(candidate) && Files.isExecutable(candidate) ? candidate : null;
        }
        if (path == null || path.isBlank()) {
            return null;
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Path.of(dir, executable);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private static void terminate(Process process) {
        process.destroyForcibly();
        try {
            if (!process.waitFor(5, TimeUnit.SECONDS)) {
                log.warn("Rendering engine (pid {}) did not exit after kill", process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static String readTail(Path file) {
        if (!Files.exists(file)) {
            return "";
        }
        try {
            String text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            return text.length() <= MAX_DIAGNOSTIC_CHARS
                    ? text
                    : "..." + text.substring(text.length() - MAX_DIAGNOSTIC_CHARS);
        } catch (IOException e) {
            log.debug("Could not read engine log {}: {}", file, e.getMessage());
            return "";
        }
    }
}
