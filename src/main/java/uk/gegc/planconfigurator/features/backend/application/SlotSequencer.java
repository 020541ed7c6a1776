package uk.gegc.planconfigurator.features.backend.application;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Component;
import uk.gegc.planconfigurator.features.backend.domain.model.SlotTicket;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues monotonically increasing tickets per slot. A ticket is current while no newer
 * ticket has been issued for the same slot; results of stale tickets are discarded.
 */
@Component
public class SlotSequencer {

    private final AtomicLong sequence = new AtomicLong();
    private final Cache<String, Long> latestBySlot;

    public SlotSequencer() {
        this(Duration.ofHours(1));
    }

    SlotSequencer(Duration retention) {
        this.latestBySlot = Caffeine.newBuilder()
                .expireAfterWrite(retention)
                .build();
    }

    public SlotTicket issue(String slot) {
        long next = sequence.incrementAndGet();
        latestBySlot.asMap().merge(slot, next, Math::max);
        return new SlotTicket(slot, next);
    }

    public boolean isCurrent(SlotTicket ticket) {
        Long latest = latestBySlot.getIfPresent(ticket.slot());
        // an evicted slot has no newer ticket
        return latest == null || latest == ticket.sequence();
    }

    /**
     * Invalidates every outstanding ticket for the slot.
     */
    public void supersede(String slot) {
        issue(slot);
    }
}
