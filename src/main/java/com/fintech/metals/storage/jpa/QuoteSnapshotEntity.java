package com.fintech.metals.storage.jpa;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Append-only history row. Rows are inserted once and never updated.
 */
@Entity
@Table(
    name = "quote_snapshots",
    indexes = {
        @Index(name = "idx_snapshots_series_time", columnList = "instrument, contract_month, observed_at"),
        @Index(name = "idx_snapshots_source_series", columnList = "source, instrument, contract_month, observed_at")
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuoteSnapshotEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * SPOT, THREE_MONTH, CONTRACT_MONTH or SUPPLIER
     */
    @Column(nullable = false, length = 20)
    private String family;

    @Column(nullable = false, length = 64)
    private String instrument;

    @Column(name = "contract_month", nullable = false, length = 32)
    private String contractMonth;

    @Column(name = "observed_at", nullable = false, updatable = false)
    private Instant observedAt;

    @Column(nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal price;

    @Column(nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal delta;

    @Column(name = "delta_percent", nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal deltaPercent;

    @Column(nullable = false, length = 64, updatable = false)
    private String source;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
