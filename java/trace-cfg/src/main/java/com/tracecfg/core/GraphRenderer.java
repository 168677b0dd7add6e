package com.tracecfg.core;

/**
 * Turns a graph description into an image. Implementations call out to
 * layout machinery the graph itself knows nothing about.
 */
public interface GraphRenderer {

    /**
     * @param description DOT text as produced by {@link GraphSerializer#toDot}
     * @param format      requested image format
     * @return the rendered image
     * @throws RenderException if the renderer is unavailable or fails
     */
    byte[] render(String description, ImageFormat format) throws RenderException;
}
