package com.wirevizweb.core.health;

import com.wirevizweb.core.render.EngineProperties;
import com.wirevizweb.core.render.RenderEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final RenderEngine renderEngine;
    private final EngineProperties properties;

    public HealthCheckService(
            @Autowired(required = false) RenderEngine renderEngine,
            EngineProperties properties) {
        this.renderEngine = renderEngine;
        this.properties = properties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkEngine());
        results.add(checkWorkRoot());
        return results;
    }

    private HealthStatus checkEngine() {
        if (renderEngine == null) {
            return new HealthStatus("engine", HealthStatus.Status.DOWN,
                    "No RenderEngine configured", Map.of());
        }
        if (renderEngine.isAvailable()) {
            return new HealthStatus("engine", HealthStatus.Status.UP,
                    "Rendering engine found: " + renderEngine.describe(), Map.of());
        }
        return new HealthStatus("engine", HealthStatus.Status.DOWN,
                "Rendering engine not found: " + renderEngine.describe(), Map.of());
    }

    private HealthStatus checkWorkRoot() {
        String configured = properties.getWorkRoot();
        Path root = configured == null || configured.isBlank()
                ? Path.of(System.getProperty("java.io.tmpdir"))
                : Path.of(configured);
        Map<String, String> metadata = Map.of("path", root.toString());

        if (!Files.exists(root)) {
            // created on first render
            return new HealthStatus("workspace", HealthStatus.Status.DEGRADED,
                    "Work root does not exist yet", metadata);
        }
        if (!Files.isDirectory(root) || !Files.isWritable(root)) {
            return new HealthStatus("workspace", HealthStatus.Status.DOWN,
                    "Work root is not a writable directory", metadata);
        }
        try {
            long usable = Files.getFileStore(root).getUsableSpace();
            return new HealthStatus("workspace", HealthStatus.Status.UP,
                    "Work root writable", Map.of("path", root.toString(),
                    "usableBytes", String.valueOf(usable)));
        } catch (IOException e) {
            log.warn("Work root health check failed: {}", e.getMessage());
            return new HealthStatus("workspace", HealthStatus.Status.DEGRADED,
                    "Could not read file store: " + e.getMessage(), metadata);
        }
    }
}
