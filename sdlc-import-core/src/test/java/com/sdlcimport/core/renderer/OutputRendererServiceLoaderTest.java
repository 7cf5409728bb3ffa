package com.sdlcimport.core.renderer;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration test validating SPI registration for {@link OutputRenderer} implementations.
 */
class OutputRendererServiceLoaderTest {

    @Test
    void serviceLoader_discoversFileSystemRenderer() {
        List<OutputRenderer> renderers = ServiceLoader.load(OutputRenderer.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();

        assertThat(renderers)
            .extracting(OutputRenderer::getId)
            .containsExactly("filesystem");
    }
}
