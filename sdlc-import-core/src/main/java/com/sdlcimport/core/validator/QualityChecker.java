package com.sdlcimport.core.validator;

/**
 * One step of post-generation validation.
 *
 * <p>Checkers run in a fixed order; each sees the corrections of the checkers before it.
 */
public interface QualityChecker {

    /**
     * Returns the checker id used in issues and corrections.
     *
     * @return checker id
     */
    String getId();

    /**
     * Inspects the generated artifacts and applies corrections.
     *
     * @param context validation context
     * @return issues, corrections and removals
     */
    CheckResult check(ValidationContext context);
}
