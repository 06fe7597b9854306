package com.wirevizweb.dispatch.cli;

import com.wirevizweb.core.format.FormatNegotiator;
import com.wirevizweb.core.format.ImageFormat;
import com.wirevizweb.core.format.UnsupportedFormatException;
import com.wirevizweb.core.render.Asset;
import com.wirevizweb.core.render.RenderEngineException;
import com.wirevizweb.core.render.RenderRequest;
import com.wirevizweb.core.render.RenderRequestException;
import com.wirevizweb.core.render.RenderService;
import com.wirevizweb.core.render.RenderedArtifact;
import com.wirevizweb.core.render.StagingException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: wireviz-web render &lt;file.yml&gt;
 * <p>
 * Renders a description locally through the same pipeline the HTTP
 * endpoint uses and writes the image next to the input (or into {@code -o}).
 */
@Command(name = "render", mixinStandardHelpOptions = true, description = "Render a WireViz description to an image")
@Component
public class RenderCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "WireViz YAML description file")
    private Path input;

    @Option(names = {"--format", "-f"}, description = "Output format: svg, png", defaultValue = "svg")
    private String format;

    @Option(names = {"--image", "-i"}, description = "Image referenced by the description (repeatable)")
    private List<Path> images = new ArrayList<>();

    @Option(names = {"--output-dir", "-o"}, description = "Directory for the rendered image (default: input's directory)")
    private Path outputDir;

    private final RenderService renderService;
    private final FormatNegotiator formatNegotiator;

    public RenderCommand(RenderService renderService, FormatNegotiator formatNegotiator) {
        this.renderService = renderService;
        this.formatNegotiator = formatNegotiator;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        ImageFormat imageFormat;
        try {
            imageFormat = formatNegotiator.mimeTypeToToken(formatNegotiator.tokenToMimeType(format));
        } catch (UnsupportedFormatException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        RenderRequest request;
        try {
            var assets = new ArrayList<Asset>();
            for (Path image : images) {
                assets.add(new Asset(image.getFileName().toString(), Files.readAllBytes(image)));
            }
            request = new RenderRequest(Files.readAllBytes(input), assets, imageFormat,
                    input.getFileName().toString());
        } catch (IOException e) {
            ConsoleOutput.error("Could not read input: " + e.getMessage());
            return 2;
        }

        ConsoleOutput.info("Rendering " + input + " as " + imageFormat.mimeType());

        RenderedArtifact artifact;
        try {
            artifact = renderService.render(request);
        } catch (RenderEngineException e) {
            ConsoleOutput.error(e.getMessage());
            ConsoleOutput.engineOutput(e.getEngineOutput());
            return 1;
        } catch (RenderRequestException | StagingException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        Path targetDir = outputDir != null ? outputDir : parentOf(input);
        Path target = targetDir.resolve(artifact.filename());
        try {
            Files.createDirectories(targetDir);
            Files.write(target, artifact.content());
        } catch (IOException e) {
            ConsoleOutput.error("Could not write " + target + ": " + e.getMessage());
            return 1;
        }

        ConsoleOutput.success("Wrote " + target + " (" + ConsoleOutput.formatBytes(artifact.content().length) + ")");
        return 0;
    }

    private static Path parentOf(Path file) {
        Path parent = file.toAbsolutePath().getParent();
        return parent != null ? parent : Path.of(".");
    }
}
