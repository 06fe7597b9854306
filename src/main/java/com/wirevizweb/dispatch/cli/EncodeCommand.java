package com.wirevizweb.dispatch.cli;

import com.wirevizweb.core.plantuml.PlantUmlCodec;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: wireviz-web encode &lt;file.yml&gt;
 * <p>
 * Encodes a description for use in {@code GET /plantuml/{imagetype}/{encoded}}.
 */
@Command(name = "encode", mixinStandardHelpOptions = true, description = "Encode a description for /plantuml links")
@Component
public class EncodeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "WireViz YAML description file")
    private Path input;

    @Option(names = {"--link", "-l"}, description = "Print a /plantuml/svg/... path instead of the bare encoding")
    private boolean link;

    private final PlantUmlCodec codec;

    public EncodeCommand(PlantUmlCodec codec) {
        this.codec = codec;
    }

    @Override
    public Integer call() {
        String text;
        try {
            text = Files.readString(input, StandardCharsets.UTF_8);
        } catch (IOException e) {
            ConsoleOutput.error("Could not read " + input + ": " + e.getMessage());
            return 2;
        }
        String encoded = codec.encode(text);
        System.out.println(link ? "/plantuml/svg/" + encoded : encoded);
        return 0;
    }
}
