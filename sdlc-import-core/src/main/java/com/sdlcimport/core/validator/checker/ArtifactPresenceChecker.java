package com.sdlcimport.core.validator.checker;

import com.sdlcimport.core.analyzer.ArtifactKind;
import com.sdlcimport.core.generator.DiagramType;
import com.sdlcimport.core.model.DecisionRecord;
import com.sdlcimport.core.model.DecisionStatus;
import com.sdlcimport.core.model.QualityIssue;
import com.sdlcimport.core.renderer.OutputLayout;
import com.sdlcimport.core.validator.CheckResult;
import com.sdlcimport.core.validator.QualityChecker;
import com.sdlcimport.core.validator.ValidationContext;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Verifies that every required artifact exists.
 *
 * <p>Required are the decision files of this run, every diagram, and the threat model and
 * debt report unless skipped. An artifact whose rendering failed counts as missing even if an
 * older copy is on disk.
 */
public class ArtifactPresenceChecker implements QualityChecker {

    @Override
    public String getId() {
        return "artifact-presence";
    }

    @Override
    public CheckResult check(ValidationContext context) {
        List<QualityIssue> issues = new ArrayList<>();
        for (String artifact : requiredArtifacts(context)) {
            String failure = context.rendered().failures().get(artifact);
            if (failure != null) {
                issues.add(QualityIssue.critical(getId(), "Artifact " + artifact + " could not be written: " + failure,
                    artifact, context.config().penalties().missingArtifact()));
            } else if (!context.renderer().exists(artifact)) {
                issues.add(QualityIssue.critical(getId(), "Required artifact " + artifact + " is missing",
                    artifact, context.config().penalties().missingArtifact()));
            }
        }
        return CheckResult.of(issues);
    }

    /**
     * Returns the artifacts this run must have produced.
     *
     * @param context validation context
     * @return relative paths
     */
    static Set<String> requiredArtifacts(ValidationContext context) {
        Set<String> required = new LinkedHashSet<>();
        Set<String> removedPaths = new LinkedHashSet<>();
        for (DecisionRecord decision : context.decisions()) {
            if (decision.status() != DecisionStatus.NEW && decision.status() != DecisionStatus.ENRICHMENT) {
                continue;
            }
            if (context.removedDecisionKeys().contains(decision.identityKey())) {
                removedPaths.add(OutputLayout.decisionPath(decision));
            } else {
                required.add(OutputLayout.decisionPath(decision));
            }
        }
        if (!context.skippedKinds().contains(ArtifactKind.DIAGRAMS)) {
            for (DiagramType type : DiagramType.values()) {
                required.add(OutputLayout.diagramPath(type));
            }
        }
        if (!context.skippedKinds().contains(ArtifactKind.THREAT_MODEL)) {
            required.add(OutputLayout.THREAT_MODEL);
        }
        if (!context.skippedKinds().contains(ArtifactKind.DEBT_REPORT)) {
            required.add(OutputLayout.TECH_DEBT);
        }
        for (String path : context.rendered().expectedPaths()) {
            if (!removedPaths.contains(path)) {
                required.add(path);
            }
        }
        return required;
    }
}
