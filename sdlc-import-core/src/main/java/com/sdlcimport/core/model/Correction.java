package com.sdlcimport.core.model;

import java.util.Objects;

/**
 * An automatic correction applied by a validator checker.
 *
 * @param checkerId checker that applied the correction
 * @param description what was changed
 * @param artifact affected artifact path, may be null
 */
public record Correction(String checkerId, String description, String artifact) {

    public Correction {
        Objects.requireNonNull(checkerId, "checkerId must not be null");
        Objects.requireNonNull(description, "description must not be null");
    }
}
