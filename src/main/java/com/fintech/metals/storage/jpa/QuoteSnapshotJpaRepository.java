package com.fintech.metals.storage.jpa;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface QuoteSnapshotJpaRepository extends JpaRepository<QuoteSnapshotEntity, Long> {

    @Query("SELECT s FROM QuoteSnapshotEntity s " +
           "WHERE s.instrument = :instrument " +
           "AND s.contractMonth = :contractMonth " +
           "AND s.observedAt >= :fromTime " +
           "AND s.observedAt < :toTime " +
           "ORDER BY s.observedAt ASC, s.id ASC")
    List<QuoteSnapshotEntity> findByRange(
        @Param("instrument") String instrument,
        @Param("contractMonth") String contractMonth,
        @Param("fromTime") Instant fromTime,
        @Param("toTime") Instant toTime
    );

    /**
     * Rows equal in value to a candidate, newest first. Callers page to a single row.
     */
    @Query("SELECT s FROM QuoteSnapshotEntity s " +
           "WHERE s.source = :source " +
           "AND s.instrument = :instrument " +
           "AND s.contractMonth = :contractMonth " +
           "AND s.price = :price " +
           "AND s.delta = :delta " +
           "AND s.deltaPercent = :deltaPercent " +
           "AND s.observedAt > :fromTime " +
           "AND s.observedAt <= :toTime " +
           "ORDER BY s.observedAt DESC, s.id DESC")
    List<QuoteSnapshotEntity> findMatches(
        @Param("source") String source,
        @Param("instrument") String instrument,
        @Param("contractMonth") String contractMonth,
        @Param("price") BigDecimal price,
        @Param("delta") BigDecimal delta,
        @Param("deltaPercent") BigDecimal deltaPercent,
        @Param("fromTime") Instant fromTime,
        @Param("toTime") Instant toTime,
        Pageable pageable
    );

    Optional<QuoteSnapshotEntity> findFirstByInstrumentAndContractMonthOrderByObservedAtDescIdDesc(
        String instrument,
        String contractMonth
    );

    @Query("SELECT s FROM QuoteSnapshotEntity s " +
           "WHERE s.instrument = :instrument " +
           "AND s.observedAt = (SELECT MAX(s2.observedAt) FROM QuoteSnapshotEntity s2 " +
           "                    WHERE s2.instrument = s.instrument AND s2.contractMonth = s.contractMonth) " +
           "ORDER BY s.contractMonth ASC, s.id ASC")
    List<QuoteSnapshotEntity> findLatestPerContractMonth(@Param("instrument") String instrument);
}
