package com.wirevizweb.core.render;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@ConfigurationProperties(prefix = "wireviz")
public class EngineProperties {

    private Engine engine = new Engine();

    // -- Engine accessors (delegate to nested) --
    public List<String> getCommand() { return engine.command; }
    public String getDefaultFormat() { return engine.defaultFormat; }
    public int getTimeoutSeconds() { return engine.timeoutSeconds; }
    public String getWorkRoot() { return engine.workRoot; }
    public String getInputFileName() { return engine.inputFileName; }
    public String getResourcesDir() { return engine.resourcesDir; }

    public Engine getEngine() { return engine; }
    public void setEngine(Engine engine) { this.engine = engine; }

    public static class Engine {
        /** Executable followed by any fixed leading arguments, e.g. {@code [python3, -m, wireviz]}. */
        private List<String> command = List.of("wireviz");
        /** Format the engine writes when no {@code -f} flag is given. */
        private String defaultFormat = "svg";
        private int timeoutSeconds = 60;
        /** Parent directory for per-render workspaces; blank means the system temp dir. */
        private String workRoot = "";
        private String inputFileName = "input.yml";
        private String resourcesDir = "resources";

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public String getDefaultFormat() { return defaultFormat; }
        public void setDefaultFormat(String defaultFormat) { this.defaultFormat = defaultFormat; }
        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }
        public String getWorkRoot() { return workRoot; }
        public void setWorkRoot(String workRoot) { this.workRoot = workRoot; }
        public String getInputFileName() { return inputFileName; }
        public void setInputFileName(String inputFileName) { this.inputFileName = inputFileName; }
        public String getResourcesDir() { return resourcesDir; }
        public void setResourcesDir(String resourcesDir) { this.resourcesDir = resourcesDir; }
    }
}
