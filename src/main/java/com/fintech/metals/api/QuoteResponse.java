package com.fintech.metals.api;

import com.fintech.metals.domain.QuoteSnapshot;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Stored quotes of one instrument.
 */
@Schema(description = "Quotes of one instrument")
public record QuoteResponse(
    @Schema(description = "Instrument name", example = "mcx-aluminium")
    String instrument,

    List<Quote> quotes
) {

    @Schema(description = "One stored snapshot")
    public record Quote(
        @Schema(example = "CONTRACT_MONTH")
        String family,
        @Schema(example = "JAN25")
        String contractMonth,
        @Schema(example = "2025-01-10T03:35:00Z")
        Instant observedAt,
        @Schema(example = "241.00")
        BigDecimal price,
        @Schema(example = "-1.25")
        BigDecimal delta,
        @Schema(example = "-0.52")
        BigDecimal deltaPercent,
        @Schema(example = "scheduled-poll")
        String source
    ) {

        static Quote from(QuoteSnapshot snapshot) {
            return new Quote(
                snapshot.family().name(),
                snapshot.contractMonth(),
                snapshot.observedAt(),
                snapshot.price(),
                snapshot.delta(),
                snapshot.deltaPercent(),
                snapshot.source()
            );
        }
    }

    public static QuoteResponse from(String instrument, List<QuoteSnapshot> snapshots) {
        return new QuoteResponse(instrument, snapshots.stream().map(Quote::from).toList());
    }
}
