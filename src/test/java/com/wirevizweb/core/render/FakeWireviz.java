package com.wirevizweb.core.render;

import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Path;
import java.util.List;

/**
 * Locates {@code fake-wireviz.sh}, a shell stand-in for the wireviz CLI.
 * The script is run through {@code sh} so it needs no executable bit.
 */
public final class FakeWireviz {

    private FakeWireviz() {}

    public static List<String> command() {
        return List.of("sh", script().toString());
    }

    public static Path script() {
        URL url = FakeWireviz.class.getResource("/fake-wireviz.sh");
        if (url == null) {
            throw new IllegalStateException("fake-wireviz.sh missing from test resources");
        }
        try {
            return Path.of(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    public static EngineProperties properties(Path workRoot, int timeoutSeconds) {
        var properties = new EngineProperties();
        properties.getEngine().setCommand(command());
        properties.getEngine().setWorkRoot(workRoot.toString());
        properties.getEngine().setTimeoutSeconds(timeoutSeconds);
        return properties;
    }
}
