package com.wirevizweb.core.render;

import com.wirevizweb.core.format.ImageFormat;
import com.wirevizweb.core.logging.RenderMdc;
import com.wirevizweb.core.metrics.RenderMetrics;
import com.wirevizweb.core.plantuml.DecodeException;
import com.wirevizweb.core.plantuml.PlantUmlCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;

/**
 * Turns a description document into an image.
 *
 * <p>Each call runs linearly: create workspace, stage the description and its
 * assets, run the {@link RenderEngine}, read the output back, and remove the
 * workspace. Nothing is retried and nothing is shared between calls.
 */
@Service
public class RenderService {

    private static final Logger log = LoggerFactory.getLogger(RenderService.class);

    /** Base name used when the client gave no filename, and for decoded documents. */
    static final String FALLBACK_BASE_NAME = "rendered";

    private final RenderEngine engine;
    private final EngineProperties properties;
    private final PlantUmlCodec codec;
    private final RenderMetrics metrics;

    public RenderService(RenderEngine engine, EngineProperties properties,
                         PlantUmlCodec codec, RenderMetrics metrics) {
        this.engine = engine;
        this.properties = properties;
        this.codec = codec;
        this.metrics = metrics;
    }

    /**
     * Renders a description document with its assets.
     *
     * @throws RenderEngineException  if the engine fails, times out or writes nothing
     * @throws RenderRequestException if an asset cannot be staged under a safe name
     * @throws StagingException       on workspace I/O failures
     */
    public RenderedArtifact render(RenderRequest request) {
        ImageFormat format = request.format();
        String renderId = UUID.randomUUID().toString().substring(0, 8);
        RenderMdc.setRender(renderId, format.token());
        long start = System.currentTimeMillis();
        String outcome = "failure";

        try (RenderWorkspace workspace = RenderWorkspace.create(workRoot())) {
            Path input = workspace.write(properties.getInputFileName(), request.description());
            for (Asset asset : request.assets()) {
                workspace.writeAsset(properties.getResourcesDir(), asset);
            }
            log.info("Rendering {} ({} bytes, {} assets) as {}",
                    displayName(request.sourceFilename()), request.description().length,
                    request.assets().size(), format.token());

            engine.render(input, workspace.root(), format);

            Path output = workspace.root().resolve(baseName(properties.getInputFileName()) + "." + format.extension());
            if (!Files.isRegularFile(output)) {
                throw new RenderEngineException("Rendering engine produced no " + output.getFileName(),
                        RenderEngineException.NO_EXIT_CODE, ProcessRenderEngine.readTail(workspace.root().resolve(ProcessRenderEngine.ENGINE_LOG)));
            }
            byte[] content = workspace.read(output);
            var artifact = new RenderedArtifact(content, format.mimeType(),
                    outputFilename(request.sourceFilename(), format));
            outcome = "success";
            log.info("Rendered {} ({} bytes)", artifact.filename(), content.length);
            return artifact;
        } catch (RenderEngineException e) {
            metrics.recordRenderFailure("engine");
            throw e;
        } catch (RenderRequestException e) {
            metrics.recordRenderFailure("request");
            throw e;
        } catch (StagingException e) {
            metrics.recordRenderFailure("staging");
            log.error("Render staging failed: {}", e.getMessage(), e);
            throw e;
        } finally {
            metrics.recordRender(format.token(), outcome, System.currentTimeMillis() - start);
            RenderMdc.clear();
        }
    }

    /**
     * Decodes a PlantUML-encoded description and renders it. The artifact is
     * named {@code rendered.<ext>}.
     *
     * @throws DecodeException if {@code encoded} is malformed
     */
    public RenderedArtifact renderEncoded(String encoded, ImageFormat format) {
        String description;
        try {
            description = codec.decode(encoded);
            metrics.recordDecode(true);
        } catch (DecodeException e) {
            metrics.recordDecode(false);
            log.info("Rejected encoded description: {}", e.getMessage());
            throw e;
        }
        return render(new RenderRequest(description.getBytes(StandardCharsets.UTF_8), List.of(),
                format, FALLBACK_BASE_NAME));
    }

    /**
     * {@code demo01.yaml} becomes {@code demo01.svg}; directories in the
     * client name are dropped.
     */
    static String outputFilename(String sourceFilename, ImageFormat format) {
        String base = FALLBACK_BASE_NAME;
        if (sourceFilename != null && !sourceFilename.isBlank()) {
            String normalized = sourceFilename.replace('\\', '/');
            String name = normalized.substring(normalized.lastIndexOf('/') + 1).strip();
            String stem = baseName(name);
            if (!stem.isEmpty() && !stem.equals(".") && !stem.equals("..")) {
                base = stem;
            }
        }
        return base + "." + format.extension();
    }

    static String baseName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private Path workRoot() {
        String workRoot = properties.getWorkRoot();
        return workRoot == null || workRoot.isBlank() ? null : Path.of(workRoot);
    }

    private static String displayName(String sourceFilename) {
        return sourceFilename == null || sourceFilename.isBlank() ? "<unnamed>" : sourceFilename;
    }
}
