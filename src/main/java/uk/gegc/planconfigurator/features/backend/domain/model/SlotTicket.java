package uk.gegc.planconfigurator.features.backend.domain.model;

/**
 * Sequence token carried by an outstanding call. Only the ticket with the highest
 * sequence for its slot may apply its result.
 */
public record SlotTicket(String slot, long sequence) {
}
