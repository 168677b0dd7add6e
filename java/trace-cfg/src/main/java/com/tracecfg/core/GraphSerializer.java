package com.tracecfg.core;

import com.tracecfg.core.domain.BasicBlock;
import com.tracecfg.core.domain.BlockEdge;
import com.tracecfg.core.domain.ControlFlowGraph;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Graph description writer.
 *
 * Produces Graphviz DOT text for a {@link ControlFlowGraph} and hands it to a
 * {@link GraphRenderer} when an image is requested:
 * - one boxed node per block, labelled with its instructions
 * - one edge per registered successor, labelled with its traversal count
 * - edge colour picked from the source block's out-degree
 */
public class GraphSerializer {

    static final String GRAPH_NAME = "pyCFG";
    static final String UNEXPLORED_LABEL = "Unexplored";
    static final String UNEXPLORED_COLOR = "webmaroon";
    static final String EXPLORED_COLOR = "gray0";
    static final String SINGLE_EDGE_COLOR = "blue";
    static final String FIRST_BRANCH_COLOR = "red";
    static final String OTHER_EDGE_COLOR = "green";

    private final GraphRenderer renderer;

    public GraphSerializer() {
        this(new GraphvizRenderer());
    }

    public GraphSerializer(GraphRenderer renderer) {
        this.renderer = renderer;
    }

    // ============================================
    // 1. DESCRIPTION TEXT
    // ============================================

    public String toDot(ControlFlowGraph graph) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph ").append(GRAPH_NAME).append(" {\n");

        for (BasicBlock block : graph.getBlocks()) {
            String label = block.isExplored() ? block.toEscapedString() : UNEXPLORED_LABEL;
            String color = block.isExplored() ? EXPLORED_COLOR : UNEXPLORED_COLOR;
            sb.append('\t').append(nodeName(block))
                .append(" [shape=box]")
                .append("[label=\"").append(label).append("\"]")
                .append("[color=\"").append(color).append("\"]")
                .append("[penwidth=2]")
                .append("[fontname=\"Comic Sans MS\"]")
                .append('\n');
        }

        for (BasicBlock block : graph.getBlocks()) {
            int outDegree = block.getEdgeCount();
            for (BlockEdge edge : block.edges()) {
                BasicBlock target = graph.getBlock(edge.getTargetIndex());
                sb.append('\t').append(nodeName(block))
                    .append(" -> ").append(nodeName(target))
                    .append(" [label=\"").append(edge.getTraversalCount()).append("\"]")
                    .append("[color=\"").append(edgeColor(outDegree, edge.getOrdinal())).append("\"]")
                    .append('\n');
            }
        }

        sb.append("}\n");
        return sb.toString();
    }

    static String edgeColor(int outDegree, int ordinal) {
        if (outDegree == 1) {
            return SINGLE_EDGE_COLOR;
        }
        if (outDegree == 2 && ordinal == 0) {
            return FIRST_BRANCH_COLOR;
        }
        return OTHER_EDGE_COLOR;
    }

    private static String nodeName(BasicBlock block) {
        return "node_" + Long.toUnsignedString(block.getStartAddress());
    }

    public void writeDot(ControlFlowGraph graph, Path output) throws IOException {
        Files.write(output, toDot(graph).getBytes(StandardCharsets.UTF_8));
    }

    // ============================================
    // 2. IMAGES
    // ============================================

    public byte[] render(ControlFlowGraph graph, ImageFormat format) throws RenderException {
        if (renderer == null) {
            throw new RenderException("No renderer configured", -1, "");
        }
        return renderer.render(toDot(graph), format);
    }

    /**
     * Renders the graph to {@code <outputBase>.<extension>}.
     *
     * @return the written file
     */
    public Path writeImage(ControlFlowGraph graph, Path outputBase, ImageFormat format) throws IOException {
        byte[] image = render(graph, format);
        Path target = outputBase.resolveSibling(outputBase.getFileName() + "." + format.getExtension());
        Files.write(target, image);
        return target;
    }
}
