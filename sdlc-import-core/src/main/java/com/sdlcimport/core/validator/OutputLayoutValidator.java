package com.sdlcimport.core.validator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sdlcimport.core.generator.DiagramType;
import com.sdlcimport.core.renderer.ArtifactRenderer;
import com.sdlcimport.core.renderer.OutputLayout;
import com.sdlcimport.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Checks an existing output directory: every YAML artifact must parse and the mandatory
 * artifacts must be present.
 *
 * <p>The threat model and debt report are optional since a run may skip them.
 */
public class OutputLayoutValidator {

    private static final Logger log = LoggerFactory.getLogger(OutputLayoutValidator.class);

    private final ObjectMapper mapper = ArtifactRenderer.createMapper();

    /**
     * Validates an output directory.
     *
     * @param outputDirectory directory written by an import run
     * @return problems found, empty when valid
     * @throws IOException if the directory cannot be listed
     */
    public List<String> validate(Path outputDirectory) throws IOException {
        List<String> problems = new ArrayList<>();
        if (!Files.isDirectory(outputDirectory)) {
            problems.add("Output directory does not exist: " + outputDirectory);
            return problems;
        }

        List<String> required = new ArrayList<>();
        required.add(OutputLayout.QUALITY_REPORT);
        required.add(OutputLayout.SUMMARY);
        for (DiagramType type : DiagramType.values()) {
            required.add(OutputLayout.diagramPath(type));
        }
        for (String artifact : required) {
            if (!Files.isRegularFile(outputDirectory.resolve(artifact))) {
                problems.add("Missing required artifact: " + artifact);
            }
        }

        List<Path> yamlFiles;
        try (Stream<Path> walk = Files.walk(outputDirectory)) {
            yamlFiles = walk.filter(Files::isRegularFile)
                .filter(p -> p.getFileName().toString().endsWith(".yml"))
                .sorted()
                .toList();
        }
        for (Path file : yamlFiles) {
            String relative = FileUtils.toRelativePath(outputDirectory, file);
            try {
                JsonNode tree = mapper.readTree(file.toFile());
                if (tree == null || !tree.isObject()) {
                    problems.add("Artifact is not a YAML mapping: " + relative);
                } else if (tree.path("failed").asBoolean(false)) {
                    problems.add("Artifact is flagged as failed: " + relative);
                }
            } catch (IOException e) {
                problems.add("Artifact does not parse: " + relative + " (" + e.getMessage() + ")");
            }
        }

        log.info("Validated {} YAML artifact(s) in {}: {} problem(s)", yamlFiles.size(), outputDirectory, problems.size());
        return problems;
    }
}
