package com.wirevizweb.core.render;

import com.wirevizweb.core.format.ImageFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs {@link ProcessRenderEngine} against {@code fake-wireviz.sh}.
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessRenderEngineTest {

    @TempDir
    Path workspace;

    private EngineProperties properties;
    private ProcessRenderEngine engine;

    @BeforeEach
    void setUp() {
        properties = FakeWireviz.properties(workspace, 10);
        engine = new ProcessRenderEngine(properties, new EngineCommandBuilder(properties));
    }

    private Path stage(String description) throws IOException {
        return Files.writeString(workspace.resolve("input.yml"), description);
    }

    @Test
    @DisplayName("default format writes input.svg")
    void rendersSvg() throws IOException {
        engine.render(stage("connectors: {}"), workspace, ImageFormat.SVG);

        assertTrue(Files.readString(workspace.resolve("input.svg")).startsWith("<svg"));
    }

    @Test
    @DisplayName("png is requested through -f and writes PNG magic")
    void rendersPng() throws IOException {
        engine.render(stage("connectors: {}"), workspace, ImageFormat.PNG);

        byte[] png = Files.readAllBytes(workspace.resolve("input.png"));
        assertEquals((byte) 0x89, png[0]);
        assertEquals("PNG", new String(png, 1, 3));
    }

    @Test
    @DisplayName("non-zero exit carries code and diagnostics")
    void nonZeroExit() throws IOException {
        Path input = stage("BROKEN");

        var e = assertThrows(RenderEngineException.class, () -> engine.render(input, workspace, ImageFormat.SVG));

        assertEquals(1, e.getExitCode());
        assertTrue(e.getEngineOutput().contains("malformed harness description"), e.getEngineOutput());
        assertFalse(Files.exists(workspace.resolve("input.svg")));
    }

    @Test
    @DisplayName("engine exceeding the timeout is killed")
    void timeout() throws IOException {
        properties.getEngine().setTimeoutSeconds(1);
        Path input = stage("SLEEP");

        long start = System.currentTimeMillis();
        var e = assertThrows(RenderEngineException.class, () -> engine.render(input, workspace, ImageFormat.SVG));

        assertTrue(e.getMessage().contains("timed out"));
        assertEquals(RenderEngineException.NO_EXIT_CODE, e.getExitCode());
        assertTrue(System.currentTimeMillis() - start < 20_000);
    }

    @Test
    @DisplayName("missing executable is an engine error, not an I/O leak")
    void missingExecutable() throws IOException {
        properties.getEngine().setCommand(List.of("/nonexistent/wireviz"));
        Path input = stage("connectors: {}");

        var e = assertThrows(RenderEngineException.class, () -> engine.render(input, workspace, ImageFormat.SVG));

        assertTrue(e.getMessage().contains("Could not start"));
        assertInstanceOf(IOException.class, e.getCause());
    }

    @Test
    @DisplayName("availability follows the configured executable")
    void availability() {
        assertTrue(engine.isAvailable(), "sh should be on PATH");
        assertEquals("sh " + FakeWireviz.script(), engine.describe());

        properties.getEngine().setCommand(List.of("definitely-not-installed-wireviz"));
        assertFalse(engine.isAvailable());
    }

    @Test
    @DisplayName("resolveExecutable searches PATH entries")
    void resolveExecutable() {
        assertNotNull(ProcessRenderEngine.resolveExecutable("sh", "/nonexistent:/bin:/usr/bin"));
        assertNull(ProcessRenderEngine.resolveExecutable("sh", ""));
        assertNull(ProcessRenderEngine.resolveExecutable("/nonexistent/sh", "/bin"));
    }

    @Test
    @DisplayName("diagnostics keep the tail of long output")
    void readTailTruncates() throws IOException {
        Path log = Files.writeString(workspace.resolve("long.log"),
                "x".repeat(ProcessRenderEngine.MAX_DIAGNOSTIC_CHARS) + "END");

        String tail = ProcessRenderEngine.readTail(log);

        assertTrue(tail.startsWith("..."));
        assertTrue(tail.endsWith("END"));
        assertEquals("", ProcessRenderEngine.readTail(workspace.resolve("absent.log")));
    }
}
