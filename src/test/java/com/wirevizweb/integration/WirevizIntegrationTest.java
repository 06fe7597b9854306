package com.wirevizweb.integration;

import com.wirevizweb.core.format.ImageFormat;
import com.wirevizweb.core.metrics.RenderMetrics;
import com.wirevizweb.core.plantuml.PlantUmlCodec;
import com.wirevizweb.core.render.EngineCommandBuilder;
import com.wirevizweb.core.render.EngineProperties;
import com.wirevizweb.core.render.ProcessRenderEngine;
import com.wirevizweb.core.render.RenderRequest;
import com.wirevizweb.core.render.RenderService;
import com.wirevizweb.core.render.RenderedArtifact;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Renders the demo harness with a real wireviz installation.
 * Requires {@code wireviz} (and Graphviz) on the PATH.
 * Run with: mvn test -Dgroups=integration
 */
@Tag("integration")
class WirevizIntegrationTest {

    @TempDir
    Path workRoot;

    private RenderService service;

    @BeforeEach
    void setUp() {
        var properties = new EngineProperties();
        properties.getEngine().setWorkRoot(workRoot.toString());
        var engine = new ProcessRenderEngine(properties, new EngineCommandBuilder(properties));
        assumeTrue(engine.isAvailable(), "wireviz not found on PATH");
        service = new RenderService(engine, properties, new PlantUmlCodec(),
                new RenderMetrics(new SimpleMeterRegistry()));
    }

    private static byte[] demo01() throws Exception {
        try (InputStream in = WirevizIntegrationTest.class.getResourceAsStream("/fixtures/demo01.yml")) {
            assertNotNull(in);
            return in.readAllBytes();
        }
    }

    @Test
    void rendersSvgWithRealEngine() throws Exception {
        RenderedArtifact artifact = service.render(
                new RenderRequest(demo01(), List.of(), ImageFormat.SVG, "demo01.yml"));

        assertEquals("demo01.svg", artifact.filename());
        assertEquals("image/svg+xml", artifact.mimeType());
        assertTrue(new String(artifact.content(), StandardCharsets.UTF_8).contains("<svg"));
        try (var entries = Files.list(workRoot)) {
            assertEquals(0, entries.count(), "workspace should be removed");
        }
    }

    @Test
    void rendersPngWithRealEngine() throws Exception {
        RenderedArtifact artifact = service.render(
                new RenderRequest(demo01(), List.of(), ImageFormat.PNG, "demo01.yml"));

        byte[] content = artifact.content();
        assertEquals("demo01.png", artifact.filename());
        assertEquals((byte) 0x89, content[0]);
        assertEquals("PNG", new String(content, 1, 3, StandardCharsets.US_ASCII));
    }

    @Test
    void rendersPlantUmlFixtureWithRealEngine() throws Exception {
        String encoded;
        try (InputStream in = WirevizIntegrationTest.class.getResourceAsStream("/fixtures/demo01.plantuml")) {
            assertNotNull(in);
            encoded = new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
        }

        RenderedArtifact artifact = service.renderEncoded(encoded, ImageFormat.SVG);

        assertEquals("rendered.svg", artifact.filename());
        assertTrue(artifact.content().length > 0);
    }
}
