package com.sdlcimport.core.decision;

import com.sdlcimport.core.model.Consequences;
import com.sdlcimport.core.model.SynthesisMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Produces decision rationales in template or narrative mode.
 *
 * <p>Both modes start from the same {@link RationaleTemplate#skeleton skeleton}. Narrative mode
 * appends the model's elaboration after a blank line:
 * <pre>
 * skeleton + "\n\n" + elaboration
 * </pre>
 * A {@link SynthesisException}, a blank elaboration or any runtime failure of the model is
 * logged and answered with the template rationale.
 */
public class RationaleSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(RationaleSynthesizer.class);

    private final NarrativeModel narrativeModel;
    private final boolean narrativeEnabled;

    /**
     * Creates a synthesizer.
     *
     * @param narrativeModel model used for narrative mode and consequences
     * @param narrativeEnabled false to always produce template rationales
     */
    public RationaleSynthesizer(NarrativeModel narrativeModel, boolean narrativeEnabled) {
        this.narrativeModel = Objects.requireNonNull(narrativeModel, "narrativeModel must not be null");
        this.narrativeEnabled = narrativeEnabled;
    }

    /**
     * Synthesizes the rationale for one technology.
     *
     * @param technologyId technology id
     * @param technologyName technology display name
     * @param category decision category
     * @param evidencePaths distinct evidence file paths
     * @return rationale, mode and consequences
     */
    public SynthesizedRationale synthesize(String technologyId, String technologyName, String category,
                                           Collection<String> evidencePaths) {
        List<String> sorted = new ArrayList<>(evidencePaths);
        sorted.sort(null);
        String skeleton = RationaleTemplate.skeleton(technologyName, category, sorted);
        Consequences consequences = consequencesOf(category, technologyId);

        if (!narrativeEnabled) {
            return new SynthesizedRationale(skeleton, SynthesisMode.TEMPLATE, consequences);
        }

        try {
            String elaboration = narrativeModel.elaborate(
                new NarrativeRequest(technologyId, technologyName, category, skeleton, sorted));
            if (elaboration == null || elaboration.isBlank()) {
                throw new SynthesisException("Model " + narrativeModel.getId() + " returned a blank elaboration");
            }
            return new SynthesizedRationale(skeleton + "\n\n" + elaboration.trim(), SynthesisMode.NARRATIVE, consequences);
        } catch (SynthesisException e) {
            log.debug("Narrative synthesis unavailable for {}:{}, using template: {}", category, technologyId, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Narrative model {} failed for {}:{}, using template", narrativeModel.getId(), category, technologyId, e);
        }
        return new SynthesizedRationale(skeleton, SynthesisMode.TEMPLATE, consequences);
    }

    private Consequences consequencesOf(String category, String technologyId) {
        try {
            return narrativeModel.consequences(category, technologyId);
        } catch (RuntimeException e) {
            log.warn("Consequence lookup failed for {}:{}", category, technologyId, e);
            return Consequences.none();
        }
    }
}
