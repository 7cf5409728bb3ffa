package com.sdlcimport.core.renderer;

import java.util.List;

/**
 * Files produced for one render call.
 *
 * @param files generated files
 */
public record GeneratedOutput(List<GeneratedFile> files) {

    public GeneratedOutput {
        files = files == null ? List.of() : List.copyOf(files);
    }

    /**
     * Creates an output with a single file.
     *
     * @param file the file
     * @return output
     */
    public static GeneratedOutput of(GeneratedFile file) {
        return new GeneratedOutput(List.of(file));
    }
}
