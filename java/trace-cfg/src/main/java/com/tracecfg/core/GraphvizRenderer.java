package com.tracecfg.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Graphviz {@code dot} as a subprocess.
 *
 * The description is written to a scratch {@code .dot} file, {@code dot}
 * writes the image to a second scratch file and its console output to a
 * third; all three are deleted before {@link #render} returns or throws.
 */
public class GraphvizRenderer implements GraphRenderer {

    private static final String TEMP_PREFIX = "trace_cfg_";

    private final RendererOptions options;

    public GraphvizRenderer() {
        this(RendererOptions.fromSystemProperties());
    }

    public GraphvizRenderer(RendererOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options must not be null");
        }
        this.options = options;
    }

    @Override
    public byte[] render(String description, ImageFormat format) throws RenderException {
        if (description == null || format == null) {
            throw new IllegalArgumentException("description and format are required");
        }

        List<Path> scratch = new ArrayList<>();
        try {
            Path input = createScratchFile(scratch, ".dot");
            Files.write(input, description.getBytes(StandardCharsets.UTF_8));
            Path output = createScratchFile(scratch, "." + format.getExtension());
            Path console = createScratchFile(scratch, ".log");
            return runDot(input, output, console, format);
        } catch (RenderException e) {
            throw e;
        } catch (IOException e) {
            throw new RenderException("Failed to prepare renderer files: " + e.getMessage(), -1, "", e);
        } finally {
            for (Path path : scratch) {
                deleteScratchFile(path);
            }
        }
    }

    private byte[] runDot(Path input, Path output, Path console, ImageFormat format) throws IOException {
        List<String> command = new ArrayList<>();
        command.add(options.getDotExecutable());
        command.add("-T" + format.getGraphvizType());
        command.add("-Gdpi=" + options.getDpi());
        command.add(input.toString());
        command.add("-o");
        command.add(output.toString());

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        pb.redirectOutput(console.toFile());

        Process p;
        try {
            p = pb.start();
        } catch (IOException e) {
            throw new RenderException("Failed to start renderer `" + options.getDotExecutable() + "`: "
                + e.getMessage(), -1, "", e);
        }
        try {
            p.getOutputStream().close();
        } catch (IOException e) {
            p.destroyForcibly();
            throw new RenderException("Failed to close renderer input: " + e.getMessage(), -1, "", e);
        }

        try {
            boolean completed = p.waitFor(options.getTimeoutSeconds(), TimeUnit.SECONDS);
            if (!completed) {
                p.destroyForcibly();
                p.waitFor(5, TimeUnit.SECONDS);
                throw new RenderException("Renderer timed out after " + options.getTimeoutSeconds()
                    + " seconds", -1, readConsole(console));
            }
        } catch (InterruptedException e) {
            p.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new RenderException("Interrupted while waiting for the renderer", -1, "", e);
        }

        int exitCode = p.exitValue();
        if (exitCode != 0) {
            String consoleText = readConsole(console);
            throw new RenderException("Renderer exited with code " + exitCode
                + (consoleText.isEmpty() ? "" : ": " + consoleText.trim()), exitCode, consoleText);
        }
        return Files.readAllBytes(output);
    }

    private Path createScratchFile(List<Path> scratch, String suffix) throws IOException {
        Path directory = options.getTempDirectory();
        Path file = directory == null
            ? Files.createTempFile(TEMP_PREFIX, suffix)
            : Files.createTempFile(directory, TEMP_PREFIX, suffix);
        scratch.add(file);
        return file;
    }

    private String readConsole(Path console) {
        try {
            return new String(Files.readAllBytes(console), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "<renderer output unavailable: " + e.getMessage() + ">";
        }
    }

    private void deleteScratchFile(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            System.err.println("Cleanup failed for " + path + ": " + e.getMessage());
        }
    }
}
