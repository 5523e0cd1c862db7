package com.fintech.metals.ingestion;

import com.fintech.metals.domain.SeriesFamily;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * One configured upstream feed.
 *
 * @param name Unique feed name, used in logs, metrics and the manual trigger
 * @param url Endpoint to read from
 * @param mode Delivery mode
 * @param family Family of the snapshots this feed produces
 * @param instrument Instrument name stamped on produced snapshots (supplier feeds use the company name instead)
 * @param timeout Upper bound for the single network read
 * @param trackedNames Supplier names to keep; empty keeps all
 */
public record FeedDefinition(
    String name,
    String url,
    FeedMode mode,
    SeriesFamily family,
    String instrument,
    Duration timeout,
    List<String> trackedNames
) {

    public FeedDefinition {
        Objects.requireNonNull(mode, "Feed mode cannot be null");
        Objects.requireNonNull(family, "Feed family cannot be null");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Feed name cannot be blank");
        }
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Feed url cannot be blank for feed " + name);
        }
        if (instrument == null || instrument.isBlank()) {
            throw new IllegalArgumentException("Feed instrument cannot be blank for feed " + name);
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Feed timeout must be positive for feed " + name);
        }
        trackedNames = trackedNames == null ? List.of() : List.copyOf(trackedNames);
    }

    public boolean tracks(String supplierName) {
        return trackedNames.isEmpty() || trackedNames.contains(supplierName);
    }
}
