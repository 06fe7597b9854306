package com.wirevizweb.core.render;

/**
 * Thrown when the rendering engine cannot be started, exits non-zero, times
 * out, or leaves no output behind.
 */
public class RenderEngineException extends RuntimeException {

    /** Exit code used when the engine never produced one. */
    public static final int NO_EXIT_CODE = -1;

    private final int exitCode;
    private final String engineOutput;

    public RenderEngineException(String message, int exitCode, String engineOutput) {
        super(message);
        this.exitCode = exitCode;
        this.engineOutput = engineOutput == null ? "" : engineOutput;
    }

    public RenderEngineException(String message, int exitCode, String engineOutput, Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
        this.engineOutput = engineOutput == null ? "" : engineOutput;
    }

    public int getExitCode() {
        return exitCode;
    }

    /**
     * Combined stdout/stderr of the engine, possibly truncated to its tail.
     */
    public String getEngineOutput() {
        return engineOutput;
    }
}
