package com.sdlcimport.core.generator;

import java.util.List;
import java.util.Objects;

/**
 * Represents a generated diagram.
 *
 * @param type diagram type
 * @param title diagram title
 * @param content diagram source (Mermaid)
 * @param format source format identifier (e.g. {@code mermaid})
 * @param technologies technology ids referenced by the diagram
 * @param placeholder true when the diagram was generated without any technology
 */
public record GeneratedDiagram(
    DiagramType type,
    String title,
    String content,
    String format,
    List<String> technologies,
    boolean placeholder
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedDiagram {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(format, "format must not be null");
        technologies = technologies == null ? List.of() : List.copyOf(technologies);
    }

    /**
     * Returns the diagram id.
     *
     * @return kebab-case id of the diagram type
     */
    public String id() {
        return type.getId();
    }
}
