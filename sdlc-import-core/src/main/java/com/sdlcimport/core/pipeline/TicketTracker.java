package com.sdlcimport.core.pipeline;

/**
 * Files follow-up tickets for low-confidence decisions and critical threats.
 */
public interface TicketTracker {

    /**
     * Files a ticket.
     *
     * @param request ticket content
     * @return ticket id
     */
    String fileTicket(TicketRequest request);
}
