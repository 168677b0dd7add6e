package com.tracecfg.maven;

import com.tracecfg.core.GraphSerializer;
import com.tracecfg.core.GraphvizRenderer;
import com.tracecfg.core.ImageFormat;
import com.tracecfg.core.RenderException;
import com.tracecfg.core.RendererOptions;
import com.tracecfg.core.Trace;
import com.tracecfg.core.TraceReader;
import com.tracecfg.core.domain.BlockOverlap;
import com.tracecfg.core.domain.ControlFlowGraph;
import com.tracecfg.core.domain.MidBlockTargetPolicy;
import com.tracecfg.core.domain.SequenceException;
import com.tracecfg.core.domain.ValidationException;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;
import org.apache.maven.project.MavenProject;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Builds a control-flow graph from an execution trace and writes it as DOT
 * and/or rendered images into the build directory.
 */
@Mojo(name = "render", defaultPhase = LifecyclePhase.VERIFY, threadSafe = true)
public class RenderCfgMojo extends AbstractMojo {

    private static final String DOT_FORMAT = "dot";

    @Parameter(defaultValue = "${project}", readonly = true)
    private MavenProject project;

    @Parameter(property = "tracecfg.traceFile", required = true)
    private File traceFile;

    /** Decimal or 0x-prefixed; defaults to the trace's entry line or first event. */
    @Parameter(property = "tracecfg.entryAddress")
    private String entryAddress;

    @Parameter(property = "tracecfg.outputDirectory", defaultValue = "${project.build.directory}/trace-cfg")
    private File outputDirectory;

    @Parameter(property = "tracecfg.outputName", defaultValue = "cfg")
    private String outputName;

    @Parameter(property = "tracecfg.formats", defaultValue = "dot")
    private String formats;

    @Parameter(property = "tracecfg.dot.executable", defaultValue = "dot")
    private String dotExecutable;

    @Parameter(property = "tracecfg.dot.timeoutSeconds", defaultValue = "60")
    private long timeoutSeconds;

    @Parameter(property = "tracecfg.dot.dpi", defaultValue = "300")
    private int dpi;

    @Parameter(property = "tracecfg.midBlockTargetPolicy", defaultValue = "ALLOW")
    private String midBlockTargetPolicy;

    @Parameter(property = "tracecfg.failOnRenderError", defaultValue = "true")
    private boolean failOnRenderError;

    @Parameter(property = "tracecfg.skip", defaultValue = "false")
    private boolean skip;

    @Override
    public void execute() throws MojoExecutionException, MojoFailureException {
        if (skip) {
            getLog().info("Trace CFG rendering skipped");
            return;
        }
        if (project != null && "pom".equals(project.getPackaging())) {
            getLog().info("Skipping trace CFG rendering for pom project " + project.getArtifactId());
            return;
        }
        if (traceFile == null || !traceFile.isFile()) {
            throw new MojoFailureException("Trace file not found: " + traceFile);
        }

        List<String> requested = parseFormats();
        MidBlockTargetPolicy policy = parsePolicy();

        getLog().info("Building control-flow graph from " + traceFile);
        ControlFlowGraph graph;
        try {
            Trace trace = new TraceReader().read(traceFile.toPath());
            Long entry = entryAddress == null || entryAddress.trim().isEmpty()
                ? null
                : TraceReader.parseAddress("entryAddress", entryAddress.trim());
            graph = trace.replay(entry, policy);
            getLog().info("Replayed " + trace.getEvents().size() + " events into "
                + graph.getBlockCount() + " blocks");
        } catch (ValidationException | SequenceException e) {
            throw new MojoFailureException("Invalid trace " + traceFile + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new MojoExecutionException("Failed to read trace " + traceFile, e);
        }

        for (BlockOverlap overlap : graph.getOverlaps()) {
            getLog().warn("Overlapping block: " + overlap);
        }

        RendererOptions options;
        try {
            options = new RendererOptions(dotExecutable, timeoutSeconds, dpi, null);
        } catch (IllegalArgumentException e) {
            throw new MojoFailureException("Invalid renderer settings: " + e.getMessage(), e);
        }
        GraphSerializer serializer = new GraphSerializer(new GraphvizRenderer(options));
        Path outputBase = outputDirectory.toPath().resolve(outputName);
        try {
            Files.createDirectories(outputDirectory.toPath());
        } catch (IOException e) {
            throw new MojoExecutionException("Failed to create " + outputDirectory, e);
        }

        for (String format : requested) {
            try {
                if (DOT_FORMAT.equals(format)) {
                    Path dotFile = outputBase.resolveSibling(outputName + "." + DOT_FORMAT);
                    serializer.writeDot(graph, dotFile);
                    getLog().info("Wrote " + dotFile);
                } else {
                    Path written = serializer.writeImage(graph, outputBase, ImageFormat.fromName(format));
                    getLog().info("Wrote " + written);
                }
            } catch (RenderException e) {
                if (failOnRenderError) {
                    throw new MojoExecutionException("Rendering " + format + " failed: " + e.getMessage(), e);
                }
                getLog().warn("Rendering " + format + " failed: " + e.getMessage());
                if (!e.getRendererOutput().isEmpty()) {
                    getLog().debug(e.getRendererOutput());
                }
            } catch (IOException e) {
                throw new MojoExecutionException("Failed to write " + format + " output", e);
            }
        }
    }

    private List<String> parseFormats() throws MojoFailureException {
        List<String> parsed = new ArrayList<>();
        for (String raw : (formats == null ? DOT_FORMAT : formats).split(",")) {
            String format = raw.trim().toLowerCase(Locale.ROOT);
            if (format.isEmpty() || parsed.contains(format)) {
                continue;
            }
            if (!DOT_FORMAT.equals(format)) {
                try {
                    ImageFormat.fromName(format);
                } catch (IllegalArgumentException e) {
                    throw new MojoFailureException(e.getMessage() + " (supported: dot, png, pdf, svg)", e);
                }
            }
            parsed.add(format);
        }
        return parsed;
    }

    private MidBlockTargetPolicy parsePolicy() throws MojoFailureException {
        if (midBlockTargetPolicy == null) {
            return MidBlockTargetPolicy.ALLOW;
        }
        try {
            return MidBlockTargetPolicy.valueOf(midBlockTargetPolicy.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new MojoFailureException("Unknown midBlockTargetPolicy: " + midBlockTargetPolicy, e);
        }
    }
}
