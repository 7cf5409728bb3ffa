package com.sdlcimport.core.generator.impl;

import com.sdlcimport.core.generator.DiagramType;
import com.sdlcimport.core.generator.GeneratedDiagram;
import com.sdlcimport.core.generator.GeneratorConfig;
import com.sdlcimport.core.generator.TechnologyLandscape;
import com.sdlcimport.core.model.DecisionRecord;
import com.sdlcimport.core.model.DecisionStatus;
import com.sdlcimport.core.model.EvidenceRef;
import com.sdlcimport.core.model.MatchStrength;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MermaidGenerator}.
 */
class MermaidGeneratorTest {

    private MermaidGenerator generator;
    private GeneratorConfig config;

    @BeforeEach
    void setUp() {
        generator = new MermaidGenerator();
        config = GeneratorConfig.defaults();
    }

    @Test
    void getId_returnsCorrectId() {
        assertThat(generator.getId()).isEqualTo("mermaid");
    }

    @Test
    void getSupportedDiagramTypes_returnsAllTypes() {
        assertThat(generator.getSupportedDiagramTypes()).containsExactlyInAnyOrder(DiagramType.values());
    }

    @Test
    void generate_withNullLandscape_throwsException() {
        assertThatThrownBy(() -> generator.generate(null, DiagramType.TECHNOLOGY_STACK, config))
            .isInstanceOf(NullPointerException.class);
    }

    @Test
    void generate_emptyLandscape_returnsPlaceholder() {
        TechnologyLandscape empty = new TechnologyLandscape("demo", List.of());

        GeneratedDiagram stack = generator.generate(empty, DiagramType.TECHNOLOGY_STACK, config);
        GeneratedDiagram container = generator.generate(empty, DiagramType.C4_CONTAINER, config);

        assertThat(stack.placeholder()).isTrue();
        assertThat(stack.content()).contains("No technologies detected");
        assertThat(container.content()).startsWith("C4Container").contains("No technologies detected");
        assertThat(stack.technologies()).isEmpty();
    }

    @Test
    void generate_technologyStack_groupsByCategory() {
        // Given
        TechnologyLandscape landscape = landscape();

        // When
        GeneratedDiagram diagram = generator.generate(landscape, DiagramType.TECHNOLOGY_STACK, config);

        // Then
        assertThat(diagram.id()).isEqualTo("technology-stack");
        assertThat(diagram.title()).isEqualTo("Technology Stack");
        assertThat(diagram.content())
            .startsWith("graph TB\n")
            .contains("subgraph cat_database[\"database\"]")
            .contains("database_postgresql[\"PostgreSQL\"]")
            .contains("framework_spring_boot[\"Spring Boot\"]");
        assertThat(diagram.technologies()).containsExactly("spring-boot", "postgresql", "kafka", "openapi");
        assertThat(diagram.placeholder()).isFalse();
    }

    @Test
    void generate_technologyStack_honorsDirectionAndNodeLimit() {
        TechnologyLandscape landscape = new TechnologyLandscape("demo", List.of(
            decision("database", "postgresql", "PostgreSQL"),
            decision("database", "mongodb", "MongoDB")));
        GeneratorConfig custom = new GeneratorConfig("LR", 1);

        GeneratedDiagram diagram = generator.generate(landscape, DiagramType.TECHNOLOGY_STACK, custom);

        assertThat(diagram.content()).startsWith("graph LR").contains("PostgreSQL").doesNotContain("MongoDB");
    }

    @Test
    void generate_c4Container_drawsStoresQueuesAndRelations() {
        GeneratedDiagram diagram = generator.generate(landscape(), DiagramType.C4_CONTAINER, config);

        assertThat(diagram.content())
            .contains("title Container Diagram for shop")
            .contains("Container(app, \"Application\", \"Spring Boot\"")
            .contains("ContainerDb(database_postgresql, \"PostgreSQL\"")
            .contains("ContainerQueue(messaging_kafka, \"Apache Kafka\"")
            .contains("Rel(user, app, \"Uses\", \"OpenAPI\")")
            .contains("Rel(app, database_postgresql, \"Reads/writes\")");
    }

    @Test
    void generate_dataFlow_routesClientThroughApi() {
        GeneratedDiagram diagram = generator.generate(landscape(), DiagramType.DATA_FLOW, config);

        assertThat(diagram.content())
            .startsWith("graph LR\n")
            .contains("client --> api_openapi")
            .contains("api_openapi --> app")
            .contains("app -->|\"read/write\"| database_postgresql")
            .contains("messaging_kafka -.->|\"consume\"| app");
    }

    @Test
    void generate_removedDecisions_areNotDrawn() {
        TechnologyLandscape landscape = new TechnologyLandscape("demo", List.of(
            decision("database", "postgresql", "PostgreSQL").withStatus(DecisionStatus.REMOVED)));

        assertThat(landscape.isEmpty()).isTrue();
        assertThat(generator.generate(landscape, DiagramType.DATA_FLOW, config).placeholder()).isTrue();
    }

    @Test
    void generate_quotesInNames_areEscaped() {
        TechnologyLandscape landscape = new TechnologyLandscape("demo", List.of(
            decision("database", "odd", "Odd \"Quoted\" DB")));

        assertThat(generator.generate(landscape, DiagramType.TECHNOLOGY_STACK, config).content())
            .contains("[\"Odd 'Quoted' DB\"]");
    }

    private static TechnologyLandscape landscape() {
        return new TechnologyLandscape("shop", List.of(
            decision("framework", "spring-boot", "Spring Boot"),
            decision("database", "postgresql", "PostgreSQL"),
            decision("messaging", "kafka", "Apache Kafka"),
            decision("api", "openapi", "OpenAPI")));
    }

    private static DecisionRecord decision(String category, String technologyId, String name) {
        return new DecisionRecord("ADR-IMPORT-001", category, technologyId, name, null, "rationale", null, 0.8,
            List.of(new EvidenceRef("pom.xml", 1, MatchStrength.CONTENT)), DecisionStatus.ACCEPTED, null);
    }
}
