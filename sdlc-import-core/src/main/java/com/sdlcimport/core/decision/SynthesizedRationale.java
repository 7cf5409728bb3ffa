package com.sdlcimport.core.decision;

import com.sdlcimport.core.model.Consequences;
import com.sdlcimport.core.model.SynthesisMode;

import java.util.Objects;

/**
 * Rationale produced by the {@link RationaleSynthesizer}.
 *
 * @param text rationale text; first paragraph is the template skeleton
 * @param mode mode that produced the text
 * @param consequences known consequences
 */
public record SynthesizedRationale(String text, SynthesisMode mode, Consequences consequences) {

    public SynthesizedRationale {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        consequences = consequences == null ? Consequences.none() : consequences;
    }
}
