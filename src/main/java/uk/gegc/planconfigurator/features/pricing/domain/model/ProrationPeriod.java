package uk.gegc.planconfigurator.features.pricing.domain.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Billing cycle {@code [cycleStart, cycleEnd)} and the date the plan takes effect in it.
 */
public record ProrationPeriod(LocalDate cycleStart, LocalDate cycleEnd, LocalDate effectiveDate) {

    public ProrationPeriod {
        Objects.requireNonNull(cycleStart, "cycleStart must not be null");
        Objects.requireNonNull(cycleEnd, "cycleEnd must not be null");
        Objects.requireNonNull(effectiveDate, "effectiveDate must not be null");
        if (!cycleEnd.isAfter(cycleStart)) {
            throw new IllegalArgumentException("cycleEnd must be after cycleStart");
        }
    }

    public long periodDays() {
        return ChronoUnit.DAYS.between(cycleStart, cycleEnd);
    }

    /**
     * Days from the effective date to the end of the cycle, clamped to the cycle.
     */
    public long remainingDays() {
        if (!effectiveDate.isAfter(cycleStart)) {
            return periodDays();
        }
        if (!effectiveDate.isBefore(cycleEnd)) {
            return 0;
        }
        return ChronoUnit.DAYS.between(effectiveDate, cycleEnd);
    }
}
