package com.fintech.metals.storage.jpa;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Same-day latest row: one per (instrument, contract month, trade date), replaced on every write.
 */
@Entity
@Table(
    name = "daily_quotes",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_daily_quote", columnNames = {"instrument", "contract_month", "trade_date"})
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailyQuoteEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 20)
    private String family;

    @Column(nullable = false, length = 64)
    private String instrument;

    @Column(name = "contract_month", nullable = false, length = 32)
    private String contractMonth;

    @Column(name = "trade_date", nullable = false)
    private LocalDate tradeDate;

    @Column(name = "observed_at", nullable = false)
    private Instant observedAt;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(nullable = false, precision = 12, scale = 2)
    private BigDecimal delta;

    @Column(name = "delta_percent", nullable = false, precision = 12, scale = 2)
    private BigDecimal deltaPercent;

    @Column(nullable = false, length = 64)
    private String source;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = Instant.now();
    }
}
