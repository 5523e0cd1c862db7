package com.fintech.metals.storage.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface DailyQuoteJpaRepository extends JpaRepository<DailyQuoteEntity, Long> {

    Optional<DailyQuoteEntity> findByInstrumentAndContractMonthAndTradeDate(
        String instrument,
        String contractMonth,
        LocalDate tradeDate
    );

    List<DailyQuoteEntity> findByInstrumentAndTradeDateOrderByContractMonthAsc(String instrument, LocalDate tradeDate);
}
