package com.sdlcimport.core.pipeline;

import java.util.Objects;

/**
 * A follow-up ticket for a human.
 *
 * @param kind what the ticket is about (e.g. {@code low-confidence-decision}, {@code critical-threat})
 * @param reference id of the decision or finding
 * @param title ticket title
 * @param description ticket body
 */
public record TicketRequest(String kind, String reference, String title, String description) {

    public TicketRequest {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(reference, "reference must not be null");
        Objects.requireNonNull(title, "title must not be null");
        description = description == null ? "" : description;
    }
}
