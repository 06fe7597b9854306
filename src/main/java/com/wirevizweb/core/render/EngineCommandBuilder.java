package com.wirevizweb.core.render;

import com.wirevizweb.core.format.ImageFormat;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Builds the engine's argument array.
 *
 * <p>Arguments are handed to {@link ProcessBuilder} as-is, never to a shell.
 * Only flags in {@link #ALLOWED_FLAGS} may be emitted, flag values may not
 * look like flags, and every path must live inside the render workspace.
 */
@Component
public class EngineCommandBuilder {

    static final String OUTPUT_DIR_FLAG = "-o";
    static final String FORMAT_FLAG = "-f";
    static final Set<String> ALLOWED_FLAGS = Set.of(OUTPUT_DIR_FLAG, FORMAT_FLAG);

    private final EngineProperties properties;

    public EngineCommandBuilder(EngineProperties properties) {
        this.properties = properties;
    }

    /**
     * @param input     staged description file
     * @param outputDir render workspace root, also the engine's output directory
     * @param format    desired output format
     * @return the full command line, executable first
     */
    public List<String> build(Path input, Path outputDir, ImageFormat format) {
        List<String> executable = properties.getCommand();
        if (executable == null || executable.isEmpty() || executable.get(0).isBlank()) {
            throw new IllegalStateException("wireviz.engine.command is not configured");
        }

        Path root = outputDir.toAbsolutePath().normalize();
        Path source = input.toAbsolutePath().normalize();
        if (!source.startsWith(root) || source.equals(root)) {
            throw new IllegalArgumentException("Input " + source + " is outside workspace " + root);
        }

        var args = new ArrayList<>(executable);
        args.add(checkedValue(source.toString()));
        addFlag(args, OUTPUT_DIR_FLAG, root.toString());
        if (!format.token().equals(properties.getDefaultFormat())) {
            addFlag(args, FORMAT_FLAG, format.token());
        }
        return List.copyOf(args);
    }

    private static void addFlag(List<String> args, String flag, String value) {
        if (!ALLOWED_FLAGS.contains(flag)) {
            throw new IllegalArgumentException("Flag not allowed: " + flag);
        }
        args.add(flag);
        args.add(checkedValue(value));
    }

    private static String checkedValue(String value) {
        if (value == null || value.isBlank() || value.startsWith("-")) {
            throw new IllegalArgumentException("Refusing engine argument: '" + value + "'");
        }
        return value;
    }
}
