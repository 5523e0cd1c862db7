package com.fintech.metals.storage;

import com.fintech.metals.domain.ContractRoll;
import com.fintech.metals.domain.DailyQuote;
import com.fintech.metals.domain.QuoteSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Everything one upstream payload writes, committed all-or-nothing.
 *
 * @param appends Snapshots that passed the dedup gate, appended to history
 * @param dailyUpserts Rows that replace the same-day row for their contract month
 * @param roll New contract roll, or {@code null} when unchanged
 */
public record PersistBatch(List<QuoteSnapshot> appends, List<DailyQuote> dailyUpserts, ContractRoll roll) {

    public PersistBatch {
        appends = appends == null ? List.of() : List.copyOf(appends);
        dailyUpserts = dailyUpserts == null ? List.of() : List.copyOf(dailyUpserts);
    }

    public Optional<ContractRoll> rollChange() {
        return Optional.ofNullable(roll);
    }

    public boolean isEmpty() {
        return appends.isEmpty() && dailyUpserts.isEmpty() && roll == null;
    }
}
