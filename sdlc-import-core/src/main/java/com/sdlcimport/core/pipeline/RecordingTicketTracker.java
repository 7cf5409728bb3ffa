package com.sdlcimport.core.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * In-memory {@link TicketTracker}; filed tickets are listed in the run summary.
 */
public class RecordingTicketTracker implements TicketTracker {

    private static final Logger log = LoggerFactory.getLogger(RecordingTicketTracker.class);

    private final List<TicketRequest> tickets = Collections.synchronizedList(new ArrayList<>());

    @Override
    public String fileTicket(TicketRequest request) {
        tickets.add(request);
        String id = "TICKET-" + tickets.size();
        log.info("Filed {} for {}: {}", id, request.reference(), request.title());
        return id;
    }

    /**
     * Returns the tickets filed so far.
     *
     * @return tickets in filing order
     */
    public List<TicketRequest> getTickets() {
        synchronized (tickets) {
            return List.copyOf(tickets);
        }
    }
}
