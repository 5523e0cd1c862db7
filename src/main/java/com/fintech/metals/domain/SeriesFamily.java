package com.fintech.metals.domain;

/**
 * Instrument families fed by the upstream quote feeds.
 * Each family maps to a different upstream payload shape and write policy.
 */
public enum SeriesFamily {

    /** Spot (cash) price of a metal, one value per reading. */
    SPOT(false),

    /** Three-month forward price streamed by the exchange feed. */
    THREE_MONTH(false),

    /** Per-contract-month futures prices (month1/month2/month3 slots). */
    CONTRACT_MONTH(true),

    /** Supplier/company premium updates, accumulated per company name. */
    SUPPLIER(false);

    private final boolean contractMonths;

    SeriesFamily(boolean contractMonths) {
        this.contractMonths = contractMonths;
    }

    /** Returns true if snapshots of this family carry a rolling contract-month label. */
    public boolean hasContractMonths() {
        return contractMonths;
    }

    /**
     * Returns true if this family also keeps a same-day "latest wins" row
     * per instrument and contract month, next to the append-only history.
     */
    public boolean keepsDailyLatest() {
        return contractMonths;
    }
}
