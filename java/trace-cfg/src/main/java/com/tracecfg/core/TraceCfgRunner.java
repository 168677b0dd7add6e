package com.tracecfg.core;

import com.tracecfg.core.domain.BlockOverlap;
import com.tracecfg.core.domain.ControlFlowGraph;
import com.tracecfg.core.domain.MidBlockTargetPolicy;
import com.tracecfg.core.domain.SequenceException;
import com.tracecfg.core.domain.ValidationException;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Trace CFG Runner: replays a trace file and writes the resulting graph as DOT
 * text and, optionally, as an image rendered by Graphviz.
 */
public class TraceCfgRunner {

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_INVALID_TRACE = 3;
    static final int EXIT_RENDER_FAILED = 4;

    private static final String USAGE =
        "Usage: --trace <file> [--entry <address>] [--dot <file>] [--image <base>] [--format png|pdf|svg]\n"
            + "       [--dot-executable <path>] [--timeout <seconds>] [--dpi <n>] [--reject-overlaps]";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Map<String, String> options = parseArgs(args);
        if (options.containsKey("error")) {
            err.println(options.get("error"));
            err.println(USAGE);
            return EXIT_USAGE;
        }
        String tracePath = options.get("trace");
        if (tracePath == null) {
            err.println(USAGE);
            return EXIT_USAGE;
        }
        Path traceFile = Paths.get(tracePath);
        if (!Files.isRegularFile(traceFile)) {
            err.println("Trace file not found: " + traceFile);
            return EXIT_USAGE;
        }

        RendererOptions rendererOptions;
        ImageFormat format;
        Long entryOverride;
        try {
            rendererOptions = buildRendererOptions(options);
            format = ImageFormat.fromName(options.getOrDefault("format", "png"));
            entryOverride = options.containsKey("entry")
                ? TraceReader.parseAddress("entry", options.get("entry"))
                : null;
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        MidBlockTargetPolicy policy = options.containsKey("reject-overlaps")
            ? MidBlockTargetPolicy.REJECT
            : MidBlockTargetPolicy.ALLOW;

        ControlFlowGraph graph;
        try {
            Trace trace = new TraceReader().read(traceFile);
            graph = trace.replay(entryOverride, policy);
        } catch (ValidationException | SequenceException e) {
            err.println("Invalid trace " + traceFile + ": " + e.getMessage());
            return EXIT_INVALID_TRACE;
        } catch (IOException e) {
            err.println("Failed to read " + traceFile + ": " + e.getMessage());
            return EXIT_USAGE;
        }

        for (BlockOverlap overlap : graph.getOverlaps()) {
            err.println("warning: " + overlap);
        }

        GraphSerializer serializer = new GraphSerializer(new GraphvizRenderer(rendererOptions));
        String dotPath = options.get("dot");
        String imageBase = options.get("image");
        try {
            if (dotPath != null) {
                serializer.writeDot(graph, Paths.get(dotPath));
                err.println("Wrote " + dotPath);
            }
            if (imageBase != null) {
                Path written = serializer.writeImage(graph, Paths.get(imageBase), format);
                err.println("Wrote " + written);
            }
            if (dotPath == null && imageBase == null) {
                out.print(serializer.toDot(graph));
            }
        } catch (RenderException e) {
            err.println("Rendering failed: " + e.getMessage());
            return EXIT_RENDER_FAILED;
        } catch (IOException e) {
            err.println("Failed to write output: " + e.getMessage());
            return EXIT_RENDER_FAILED;
        }
        return EXIT_OK;
    }

    private static RendererOptions buildRendererOptions(Map<String, String> options) {
        RendererOptions rendererOptions = RendererOptions.fromSystemProperties();
        if (options.containsKey("dot-executable")) {
            rendererOptions = rendererOptions.withDotExecutable(options.get("dot-executable"));
        }
        try {
            if (options.containsKey("timeout")) {
                rendererOptions = rendererOptions.withTimeoutSeconds(Long.parseLong(options.get("timeout")));
            }
            if (options.containsKey("dpi")) {
                rendererOptions = rendererOptions.withDpi(Integer.parseInt(options.get("dpi")));
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number: " + e.getMessage(), e);
        }
        return rendererOptions;
    }

    private static Map<String, String> parseArgs(String[] args) {
        Map<String, String> options = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--reject-overlaps".equals(arg)) {
                options.put("reject-overlaps", "true");
            } else if (arg.startsWith("--") && isValued(arg)) {
                if (i + 1 >= args.length) {
                    options.put("error", "Missing value for " + arg);
                    return options;
                }
                options.put(arg.substring(2), args[++i]);
            } else {
                options.put("error", "Unknown argument: " + arg);
                return options;
            }
        }
        return options;
    }

    private static boolean isValued(String arg) {
        switch (arg) {
            case "--trace":
            case "--entry":
            case "--dot":
            case "--image":
            case "--format":
            case "--dot-executable":
            case "--timeout":
            case "--dpi":
                return true;
            default:
                return false;
        }
    }
}
