package com.tracecfg.core;

import java.io.IOException;

/**
 * The external renderer could not be started, exited with a non-zero code,
 * or did not finish in time.
 */
public class RenderException extends IOException {
    private final int exitCode;
    private final String rendererOutput;

    public RenderException(String message, int exitCode, String rendererOutput) {
        super(message);
        this.exitCode = exitCode;
        this.rendererOutput = rendererOutput == null ? "" : rendererOutput;
    }

    public RenderException(String message, int exitCode, String rendererOutput, Throwable cause) {
        super(message, cause);
        this.exitCode = exitCode;
        this.rendererOutput = rendererOutput == null ? "" : rendererOutput;
    }

    /**
     * @return the renderer's exit code, or -1 if it never exited on its own
     */
    public int getExitCode() {
        return exitCode;
    }

    public String getRendererOutput() {
        return rendererOutput;
    }
}
