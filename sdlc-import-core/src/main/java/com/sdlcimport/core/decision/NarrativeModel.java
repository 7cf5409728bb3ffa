package com.sdlcimport.core.decision;

import com.sdlcimport.core.model.Consequences;

/**
 * Text-generation seam of narrative synthesis.
 *
 * <p>A model receives the template skeleton and returns an elaboration paragraph; the
 * synthesizer appends it after the skeleton. Implementations may be offline catalogs or
 * clients of a generation service.
 */
public interface NarrativeModel {

    /**
     * Returns the model identifier used in logs.
     *
     * @return model id
     */
    String getId();

    /**
     * Elaborates a rationale skeleton.
     *
     * @param request technology, category, skeleton and evidence
     * @return non-blank elaboration paragraph
     * @throws SynthesisException if the model cannot elaborate this request
     */
    String elaborate(NarrativeRequest request) throws SynthesisException;

    /**
     * Returns the known consequences of adopting a technology for a category.
     *
     * @param category decision category
     * @param technologyId technology id
     * @return consequences, empty when none are known
     */
    default Consequences consequences(String category, String technologyId) {
        return Consequences.none();
    }
}
