package com.tracecfg.core;

import java.nio.file.Paths;

import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

public class RendererOptionsTest {

    @After
    public void clearProperties() {
        System.clearProperty(RendererOptions.DOT_EXECUTABLE_PROPERTY);
        System.clearProperty(RendererOptions.TIMEOUT_PROPERTY);
        System.clearProperty(RendererOptions.DPI_PROPERTY);
        System.clearProperty(RendererOptions.TEMP_DIRECTORY_PROPERTY);
    }

    @Test
    public void readsSystemProperties() {
        System.setProperty(RendererOptions.DOT_EXECUTABLE_PROPERTY, "/opt/graphviz/bin/dot");
        System.setProperty(RendererOptions.TIMEOUT_PROPERTY, "12");
        System.setProperty(RendererOptions.DPI_PROPERTY, " 96 ");
        System.setProperty(RendererOptions.TEMP_DIRECTORY_PROPERTY, "/var/tmp");

        RendererOptions options = RendererOptions.fromSystemProperties();

        Assert.assertEquals("/opt/graphviz/bin/dot", options.getDotExecutable());
        Assert.assertEquals(12, options.getTimeoutSeconds());
        Assert.assertEquals(96, options.getDpi());
        Assert.assertEquals(Paths.get("/var/tmp"), options.getTempDirectory());
    }

    @Test
    public void unsetPropertiesFallBackToDefaults() {
        RendererOptions options = RendererOptions.fromSystemProperties();
        Assert.assertEquals(RendererOptions.DEFAULT_DPI, options.getDpi());
        Assert.assertNull(options.getTempDirectory());
    }

    @Test(expected = IllegalArgumentException.class)
    public void dpiBeyondIntRangeIsRejected() {
        System.setProperty(RendererOptions.DPI_PROPERTY, "4294967297");
        RendererOptions.fromSystemProperties();
    }

    @Test(expected = IllegalArgumentException.class)
    public void nonNumericTimeoutIsRejected() {
        System.setProperty(RendererOptions.TIMEOUT_PROPERTY, "soon");
        RendererOptions.fromSystemProperties();
    }
}
