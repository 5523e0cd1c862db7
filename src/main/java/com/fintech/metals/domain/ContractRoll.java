package com.fintech.metals.domain;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Most recent mapping of month slots to contract-month labels for one instrument.
 * Consumers resolve "current/next/third month" through this, never through a label
 * they cached themselves.
 *
 * @param instrument Instrument name
 * @param labels Labels in slot order (index 0 = month1)
 * @param updatedAt When the roll was last observed to change
 */
public record ContractRoll(String instrument, List<String> labels, Instant updatedAt) {

    /** Number of month slots tracked per instrument. */
    public static final int MAX_SLOTS = 3;

    public ContractRoll {
        labels = List.copyOf(labels);
    }

    public Optional<String> labelFor(MonthSlot slot) {
        int index = slot.position() - 1;
        return index < labels.size() ? Optional.of(labels.get(index)) : Optional.empty();
    }
}
