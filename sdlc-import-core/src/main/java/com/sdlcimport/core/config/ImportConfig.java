package com.sdlcimport.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;

/**
 * Root configuration for SDLC import runs.
 *
 * <p>Loaded from {@code sdlc-import.yaml}. Every section is optional and fills its own
 * defaults, so a partial file only overrides what it names.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "billing-service"
 *
 * scan:
 *   maxFiles: 20000
 *   excludeDirectories: [".git", "node_modules", "target"]
 *
 * detection:
 *   signatureFiles: ["config/extra-signatures.yaml"]
 *   minEvidence: 1
 *
 * validation:
 *   acceptThreshold: 0.85
 *   reviewThreshold: 0.70
 *
 * diagrams:
 *   direction: LR
 *   maxNodesPerCategory: 8
 * }</pre>
 *
 * @param project project metadata
 * @param output output settings
 * @param scan tree scanner limits and exclusions
 * @param detection technology detector settings
 * @param scoring confidence scorer settings
 * @param reconciliation decision reconciler settings
 * @param analysis analyzer runner settings
 * @param validation post-generation validator settings
 * @param debt debt detector settings
 * @param threats threat modeler settings
 * @param diagrams diagram synthesizer settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ImportConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("output") OutputConfig output,
    @JsonProperty("scan") ScanConfig scan,
    @JsonProperty("detection") DetectionConfig detection,
    @JsonProperty("scoring") ScoringConfig scoring,
    @JsonProperty("reconciliation") ReconciliationConfig reconciliation,
    @JsonProperty("analysis") AnalysisConfig analysis,
    @JsonProperty("validation") ValidationConfig validation,
    @JsonProperty("debt") DebtConfig debt,
    @JsonProperty("threats") ThreatConfig threats,
    @JsonProperty("diagrams") DiagramConfig diagrams
) {
    /**
     * Compact constructor filling absent sections with their defaults.
     */
    public ImportConfig {
        project = project == null ? new ProjectInfo(null, null) : project;
        output = output == null ? new OutputConfig(null) : output;
        scan = scan == null ? new ScanConfig(null, null, null, null, null) : scan;
        detection = detection == null ? new DetectionConfig(null, null) : detection;
        scoring = scoring == null ? new ScoringConfig(null, null, null) : scoring;
        reconciliation = reconciliation == null ? new ReconciliationConfig(null, null, null) : reconciliation;
        analysis = analysis == null ? new AnalysisConfig(null) : analysis;
        validation = validation == null ? new ValidationConfig(null, null, null, null, null, null) : validation;
        debt = debt == null ? new DebtConfig(null, null) : debt;
        threats = threats == null ? new ThreatConfig(null) : threats;
        diagrams = diagrams == null ? new DiagramConfig(null, null) : diagrams;
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static ImportConfig defaults() {
        return new ImportConfig(null, null, null, null, null, null, null, null, null, null, null);
    }

    /**
     * Project metadata.
     *
     * @param name project name used in artifact headers
     * @param description optional description
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description
    ) {
        public ProjectInfo {
            if (name == null || name.isBlank()) {
                name = "project";
            }
        }
    }

    /**
     * Output configuration.
     *
     * @param directory output directory, relative paths resolve against the scanned root
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory
    ) {
        public OutputConfig {
            if (directory == null || directory.isBlank()) {
                directory = "sdlc-import";
            }
        }
    }

    /**
     * Tree scanner limits and exclusion rules.
     *
     * @param maxFiles file-count ceiling; exceeding it aborts the run
     * @param maxTotalBytes total-byte ceiling; exceeding it aborts the run
     * @param maxContentBytes per-file cap on content reads
     * @param excludeDirectories directory names skipped anywhere in the tree
     * @param excludePatterns glob patterns of files skipped (generated or minified code)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScanConfig(
        @JsonProperty("maxFiles") Integer maxFiles,
        @JsonProperty("maxTotalBytes") Long maxTotalBytes,
        @JsonProperty("maxContentBytes") Integer maxContentBytes,
        @JsonProperty("excludeDirectories") List<String> excludeDirectories,
        @JsonProperty("excludePatterns") List<String> excludePatterns
    ) {
        public static final List<String> DEFAULT_EXCLUDED_DIRECTORIES = List.of(
            ".git", ".hg", ".svn", "node_modules", "target", "build", "dist", "vendor",
            ".venv", "venv", "__pycache__", ".idea", ".vs", "bin", "obj", "out",
            "coverage", ".gradle", ".mvn", ".tox", ".next", ".terraform"
        );

        public static final List<String> DEFAULT_EXCLUDED_PATTERNS = List.of(
            "**/*.min.js", "**/*.min.css", "**/*.map", "**/*.lock", "**/package-lock.json",
            "**/generated/**", "**/*.generated.*", "**/*_pb2.py", "**/*.pb.go", "**/*.Designer.cs"
        );

        public ScanConfig {
            if (maxFiles == null || maxFiles <= 0) {
                maxFiles = 50_000;
            }
            if (maxTotalBytes == null || maxTotalBytes <= 0) {
                maxTotalBytes = 512L * 1024 * 1024;
            }
            if (maxContentBytes == null || maxContentBytes <= 0) {
                maxContentBytes = 256 * 1024;
            }
            excludeDirectories = excludeDirectories == null
                ? DEFAULT_EXCLUDED_DIRECTORIES : List.copyOf(excludeDirectories);
            excludePatterns = excludePatterns == null
                ? DEFAULT_EXCLUDED_PATTERNS : List.copyOf(excludePatterns);
        }
    }

    /**
     * Technology detector settings.
     *
     * @param signatureFiles extra signature YAML files, applied after the built-in catalog
     * @param minEvidence minimum distinct evidence files for a decision (inclusive)
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DetectionConfig(
        @JsonProperty("signatureFiles") List<String> signatureFiles,
        @JsonProperty("minEvidence") Integer minEvidence
    ) {
        public DetectionConfig {
            signatureFiles = signatureFiles == null ? List.of() : List.copyOf(signatureFiles);
            if (minEvidence == null || minEvidence < 1) {
                minEvidence = 1;
            }
        }
    }

    /**
     * Confidence scorer settings.
     *
     * @param highThreshold lower bound of the HIGH level
     * @param mediumThreshold lower bound of the MEDIUM level
     * @param quantitySaturation evidence count at which the quantity term reaches 1.0
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ScoringConfig(
        @JsonProperty("highThreshold") Double highThreshold,
        @JsonProperty("mediumThreshold") Double mediumThreshold,
        @JsonProperty("quantitySaturation") Integer quantitySaturation
    ) {
        public ScoringConfig {
            if (highThreshold == null) {
                highThreshold = 0.8;
            }
            if (mediumThreshold == null) {
                mediumThreshold = 0.5;
            }
            if (mediumThreshold > highThreshold) {
                throw new IllegalArgumentException("mediumThreshold must not exceed highThreshold");
            }
            if (quantitySaturation == null || quantitySaturation < 1) {
                quantitySaturation = 10;
            }
        }
    }

    /**
     * Decision reconciler settings.
     *
     * @param storePath decision store path, relative to the output directory
     * @param similarityThreshold minimum similarity for a same-category alias match
     * @param duplicateThreshold similarity below which a duplicate is logged as drift
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ReconciliationConfig(
        @JsonProperty("storePath") String storePath,
        @JsonProperty("similarityThreshold") Double similarityThreshold,
        @JsonProperty("duplicateThreshold") Double duplicateThreshold
    ) {
        public ReconciliationConfig {
            if (storePath == null || storePath.isBlank()) {
                storePath = "corpus/decision-store.yml";
            }
            if (similarityThreshold == null) {
                similarityThreshold = 0.85;
            }
            if (duplicateThreshold == null) {
                duplicateThreshold = 0.9;
            }
        }
    }

    /**
     * Analyzer runner settings.
     *
     * @param threads size of the fixed analyzer pool
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record AnalysisConfig(
        @JsonProperty("threads") Integer threads
    ) {
        public AnalysisConfig {
            if (threads == null || threads < 1) {
                threads = 3;
            }
        }
    }

    /**
     * Post-generation validator settings.
     *
     * @param pollutionThreshold share of non-production evidence above which a decision is removed
     * @param nonProductionPatterns glob patterns of non-production paths
     * @param pollutionExemptCategories categories never removed for pollution
     * @param acceptThreshold minimum score for ACCEPT (inclusive)
     * @param reviewThreshold minimum score for REVIEW (inclusive)
     * @param penalties score penalties per issue kind
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidationConfig(
        @JsonProperty("pollutionThreshold") Double pollutionThreshold,
        @JsonProperty("nonProductionPatterns") List<String> nonProductionPatterns,
        @JsonProperty("pollutionExemptCategories") List<String> pollutionExemptCategories,
        @JsonProperty("acceptThreshold") Double acceptThreshold,
        @JsonProperty("reviewThreshold") Double reviewThreshold,
        @JsonProperty("penalties") PenaltyConfig penalties
    ) {
        public static final List<String> DEFAULT_NON_PRODUCTION_PATTERNS = List.of(
            "**/test/**", "**/tests/**", "**/__tests__/**", "**/spec/**", "**/testdata/**",
            "**/fixtures/**", "**/fixture/**", "**/mocks/**", "**/mock/**", "**/__mocks__/**",
            "**/stubs/**", "**/examples/**", "**/example/**", "**/samples/**", "**/sample/**",
            "**/docs/**", "**/doc/**", "**/*Test.*", "**/*Tests.*", "**/*_test.*", "**/test_*.py",
            "**/*.spec.*", "**/*.test.*", "**/.github/**", "**/.vscode/**", "**/.devcontainer/**",
            "**/tools/**"
        );

        public ValidationConfig {
            if (pollutionThreshold == null) {
                pollutionThreshold = 0.7;
            }
            nonProductionPatterns = nonProductionPatterns == null
                ? DEFAULT_NON_PRODUCTION_PATTERNS : List.copyOf(nonProductionPatterns);
            pollutionExemptCategories = pollutionExemptCategories == null
                ? List.of("testing", "ci-cd") : List.copyOf(pollutionExemptCategories);
            if (acceptThreshold == null) {
                acceptThreshold = 0.85;
            }
            if (reviewThreshold == null) {
                reviewThreshold = 0.70;
            }
            if (reviewThreshold > acceptThreshold) {
                throw new IllegalArgumentException("reviewThreshold must not exceed acceptThreshold");
            }
            penalties = penalties == null ? new PenaltyConfig(null, null, null, null, null) : penalties;
        }
    }

    /**
     * Score penalties applied by the validator.
     *
     * @param removedDecision per decision removed for evidence pollution
     * @param incompleteReport per regenerated threat/debt report
     * @param regeneratedDiagram per diagram marked for regeneration
     * @param missingArtifact per missing required artifact
     * @param failedAnalyzer per failed analyzer
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PenaltyConfig(
        @JsonProperty("removedDecision") Double removedDecision,
        @JsonProperty("incompleteReport") Double incompleteReport,
        @JsonProperty("regeneratedDiagram") Double regeneratedDiagram,
        @JsonProperty("missingArtifact") Double missingArtifact,
        @JsonProperty("failedAnalyzer") Double failedAnalyzer
    ) {
        public PenaltyConfig {
            removedDecision = removedDecision == null ? 0.05 : removedDecision;
            incompleteReport = incompleteReport == null ? 0.10 : incompleteReport;
            regeneratedDiagram = regeneratedDiagram == null ? 0.05 : regeneratedDiagram;
            missingArtifact = missingArtifact == null ? 0.05 : missingArtifact;
            failedAnalyzer = failedAnalyzer == null ? 0.10 : failedAnalyzer;
        }
    }

    /**
     * Debt detector settings.
     *
     * @param maxLinesPerFile source files longer than this are reported as oversized
     * @param ruleFiles extra debt rule YAML files
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DebtConfig(
        @JsonProperty("maxLinesPerFile") Integer maxLinesPerFile,
        @JsonProperty("ruleFiles") List<String> ruleFiles
    ) {
        public DebtConfig {
            if (maxLinesPerFile == null || maxLinesPerFile < 1) {
                maxLinesPerFile = 1000;
            }
            ruleFiles = ruleFiles == null ? List.of() : List.copyOf(ruleFiles);
        }
    }

    /**
     * Threat modeler settings.
     *
     * @param ruleFiles extra threat rule YAML files
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ThreatConfig(
        @JsonProperty("ruleFiles") List<String> ruleFiles
    ) {
        public ThreatConfig {
            ruleFiles = ruleFiles == null ? List.of() : List.copyOf(ruleFiles);
        }
    }

    /**
     * Diagram synthesizer settings.
     *
     * @param direction Mermaid flowchart direction: TB, BT, LR or RL
     * @param maxNodesPerCategory technologies drawn per category in the stack diagram
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DiagramConfig(
        @JsonProperty("direction") String direction,
        @JsonProperty("maxNodesPerCategory") Integer maxNodesPerCategory
    ) {
        public static final List<String> DIRECTIONS = List.of("TB", "BT", "LR", "RL");

        public DiagramConfig {
            direction = direction == null || direction.isBlank() ? "TB" : direction.trim().toUpperCase(Locale.ROOT);
            if (!DIRECTIONS.contains(direction)) {
                throw new IllegalArgumentException("diagrams.direction must be one of " + DIRECTIONS);
            }
            if (maxNodesPerCategory == null || maxNodesPerCategory < 1) {
                maxNodesPerCategory = Integer.MAX_VALUE;
            }
        }
    }
}
