package com.fintech.metals.api;

import com.fintech.metals.service.QuoteQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDate;

/**
 * Raw stored quotes: latest per contract month and the same-day table.
 */
@RestController
@RequestMapping("/api/v1/quotes")
@Validated
@Tag(name = "Quotes", description = "Stored quote snapshots")
public class QuoteController {

    private final QuoteQueryService queryService;

    public QuoteController(QuoteQueryService queryService) {
        this.queryService = queryService;
    }

    @Operation(summary = "Latest stored snapshot per contract month of an instrument")
    @GetMapping("/latest")
    public ResponseEntity<QuoteResponse> getLatest(
            @Parameter(description = "Instrument name", example = "mcx-aluminium", required = true)
            @RequestParam
            @NotBlank(message = "Instrument is required and cannot be blank")
            String instrument) {
        String name = instrument.trim();
        return ResponseEntity.ok(QuoteResponse.from(name, queryService.latest(name)));
    }

    @Operation(summary = "Same-day latest rows of an instrument for one trade date")
    @GetMapping("/daily")
    public ResponseEntity<QuoteResponse> getDaily(
            @Parameter(description = "Instrument name", example = "mcx-aluminium", required = true)
            @RequestParam
            @NotBlank(message = "Instrument is required and cannot be blank")
            String instrument,

            @Parameter(description = "Trade date in the exchange timezone", example = "2025-01-10", required = true)
            @RequestParam
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
            LocalDate date) {
        String name = instrument.trim();
        return ResponseEntity.ok(QuoteResponse.from(name, queryService.daily(name, date)));
    }
}
