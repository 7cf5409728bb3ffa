package com.sdlcimport.core.model;

import java.util.Objects;

/**
 * A technical debt item.
 *
 * @param id item identifier (e.g. {@code TD-001})
 * @param ruleId debt rule that produced the item
 * @param title short description
 * @param priority priority tier
 * @param category debt category (e.g. {@code code-smell}, {@code dependency-age})
 * @param location file path, optionally suffixed with {@code :line}
 * @param effortEstimateHours estimated remediation effort in hours
 */
public record DebtItem(
    String id,
    String ruleId,
    String title,
    DebtPriority priority,
    String category,
    String location,
    double effortEstimateHours
) {
    /**
     * Compact constructor with validation.
     */
    public DebtItem {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(priority, "priority must not be null");
        Objects.requireNonNull(category, "category must not be null");
        Objects.requireNonNull(location, "location must not be null");
        if (effortEstimateHours < 0) {
            throw new IllegalArgumentException("effortEstimateHours must be >= 0");
        }
    }
}
