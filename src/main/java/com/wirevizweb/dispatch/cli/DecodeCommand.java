package com.wirevizweb.dispatch.cli;

import com.wirevizweb.core.plantuml.DecodeException;
import com.wirevizweb.core.plantuml.PlantUmlCodec;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: wireviz-web decode &lt;encoded&gt;
 * <p>
 * Prints the description carried by a PlantUML-encoded string, e.g. the last
 * path segment of a {@code /plantuml/svg/...} link. Output is the bare
 * document so it can be redirected into a file.
 */
@Command(name = "decode", mixinStandardHelpOptions = true, description = "Decode a PlantUML-encoded description")
@Component
public class DecodeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "PlantUML-encoded text")
    private String encoded;

    private final PlantUmlCodec codec;

    public DecodeCommand(PlantUmlCodec codec) {
        this.codec = codec;
    }

    @Override
    public Integer call() {
        try {
            System.out.print(codec.decode(encoded));
            System.out.flush();
            return 0;
        } catch (DecodeException e) {
            ConsoleOutput.error("Cannot decode: " + e.getMessage());
            return 1;
        }
    }
}
