package com.tracecfg.core;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Settings for {@link GraphvizRenderer}. Defaults can be overridden through
 * the {@code tracecfg.dot.executable}, {@code tracecfg.dot.timeoutSeconds},
 * {@code tracecfg.dot.dpi} and {@code tracecfg.tmpdir} system properties.
 */
public class RendererOptions {

    public static final String DOT_EXECUTABLE_PROPERTY = "tracecfg.dot.executable";
    public static final String TIMEOUT_PROPERTY = "tracecfg.dot.timeoutSeconds";
    public static final String DPI_PROPERTY = "tracecfg.dot.dpi";
    public static final String TEMP_DIRECTORY_PROPERTY = "tracecfg.tmpdir";

    static final String DEFAULT_DOT_EXECUTABLE = "dot";
    static final long DEFAULT_TIMEOUT_SECONDS = 60;
    static final int DEFAULT_DPI = 300;

    private final String dotExecutable;
    private final long timeoutSeconds;
    private final int dpi;
    private final Path tempDirectory;

    public RendererOptions(String dotExecutable, long timeoutSeconds, int dpi, Path tempDirectory) {
        if (dotExecutable == null || dotExecutable.trim().isEmpty()) {
            throw new IllegalArgumentException("dot executable must be set");
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeout must be positive, got " + timeoutSeconds);
        }
        if (dpi <= 0) {
            throw new IllegalArgumentException("dpi must be positive, got " + dpi);
        }
        this.dotExecutable = dotExecutable;
        this.timeoutSeconds = timeoutSeconds;
        this.dpi = dpi;
        this.tempDirectory = tempDirectory;
    }

    public static RendererOptions defaults() {
        return new RendererOptions(DEFAULT_DOT_EXECUTABLE, DEFAULT_TIMEOUT_SECONDS, DEFAULT_DPI, null);
    }

    public static RendererOptions fromSystemProperties() {
        String executable = System.getProperty(DOT_EXECUTABLE_PROPERTY, DEFAULT_DOT_EXECUTABLE);
        long timeout = parseLong(TIMEOUT_PROPERTY, DEFAULT_TIMEOUT_SECONDS);
        long dpi = parseLong(DPI_PROPERTY, DEFAULT_DPI);
        if (dpi < 1 || dpi > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("System property " + DPI_PROPERTY + " is out of range: " + dpi);
        }
        String tmp = System.getProperty(TEMP_DIRECTORY_PROPERTY);
        return new RendererOptions(executable, timeout, (int) dpi, tmp == null ? null : Paths.get(tmp));
    }

    private static long parseLong(String property, long fallback) {
        String value = System.getProperty(property);
        if (value == null || value.trim().isEmpty()) {
            return fallback;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("System property " + property + " is not a number: " + value, e);
        }
    }

    public RendererOptions withDotExecutable(String executable) {
        return new RendererOptions(executable, timeoutSeconds, dpi, tempDirectory);
    }

    public RendererOptions withTimeoutSeconds(long seconds) {
        return new RendererOptions(dotExecutable, seconds, dpi, tempDirectory);
    }

    public RendererOptions withDpi(int newDpi) {
        return new RendererOptions(dotExecutable, timeoutSeconds, newDpi, tempDirectory);
    }

    public RendererOptions withTempDirectory(Path directory) {
        return new RendererOptions(dotExecutable, timeoutSeconds, dpi, directory);
    }

    public String getDotExecutable() {
        return dotExecutable;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public int getDpi() {
        return dpi;
    }

    /**
     * @return directory for scratch files, or null for the platform default
     */
    public Path getTempDirectory() {
        return tempDirectory;
    }
}
