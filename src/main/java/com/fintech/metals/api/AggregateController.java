package com.fintech.metals.api;

import com.fintech.metals.aggregation.AggregationQuery;
import com.fintech.metals.aggregation.AggregationReport;
import com.fintech.metals.calendar.TradingCalendar;
import com.fintech.metals.domain.MonthSlot;
import com.fintech.metals.service.QuoteQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/**
 * Session-bounded aggregates for dashboards.
 */
@RestController
@RequestMapping("/api/v1")
@Validated
@Tag(name = "Aggregates", description = "Minute-collapsed price series and statistics")
public class AggregateController {

    private static final Logger log = LoggerFactory.getLogger(AggregateController.class);

    private final QuoteQueryService queryService;
    private final TradingCalendar calendar;

    public AggregateController(QuoteQueryService queryService, TradingCalendar calendar) {
        this.queryService = queryService;
        this.calendar = calendar;
    }

    /**
     * GET /api/v1/aggregates
     *
     * Without a range, the window is today's session once it has opened and the previous
     * trading session before that.
     */
    @Operation(
        summary = "Get the aggregated price series of an instrument",
        description = """
            Returns one point per minute (last observation wins) inside trading sessions,
            plus count, min, max, avg, first, last, delta and percent change.

            **Example Request:**
            ```
            GET /api/v1/aggregates?instrument=mcx-aluminium&month=current
            ```
            """
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Aggregate computed (or served from cache with cached=true)",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = AggregateResponse.class),
                examples = @ExampleObject(
                    name = "Sample Response",
                    value = """
                        {
                          "success": true,
                          "instrument": "mcx-aluminium",
                          "contractMonth": "JAN25",
                          "data": [
                            {"time": "2025-01-10T03:35:00Z", "value": 241.00},
                            {"time": "2025-01-10T03:40:00Z", "value": 243.00}
                          ],
                          "stats": {"count": 2, "min": 241.00, "max": 243.00, "avg": 242.0000,
                                    "first": 241.00, "last": 243.00, "delta": 2.00, "deltaPercent": 0.8299},
                          "tradingStatus": {"open": true, "reason": "in-session", "hours": "09:00 - 23:30 Asia/Kolkata"},
                          "cached": false
                        }
                        """
                )
            )
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid parameters",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "503",
            description = "Store unavailable and no cached result",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    @GetMapping("/aggregates")
    public ResponseEntity<AggregateResponse> getAggregates(
            @Parameter(description = "Instrument name", example = "mcx-aluminium", required = true)
            @RequestParam
            @NotBlank(message = "Instrument is required and cannot be blank")
            String instrument,

            @Parameter(description = "Contract-month slot: current, next or third", example = "current")
            @RequestParam(required = false)
            String month,

            @Parameter(description = "Window start, ISO-8601 instant (inclusive). Give with rangeEnd, or omit both for the effective session", example = "2025-01-10T03:30:00Z")
            @RequestParam(required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
            Instant rangeStart,

            @Parameter(description = "Window end, ISO-8601 instant (exclusive). Give with rangeStart, or omit both for the effective session", example = "2025-01-10T18:01:00Z")
            @RequestParam(required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME)
            Instant rangeEnd,

            @Parameter(description = "Maximum number of points returned", example = "500")
            @RequestParam(required = false)
            Integer limit) {

        AggregationQuery query = new AggregationQuery(
            instrument.trim(),
            MonthSlot.fromParam(month),
            rangeStart,
            rangeEnd,
            queryService.resolveLimit(limit)
        );
        AggregationReport report = queryService.aggregate(query);

        log.debug("Aggregate query: instrument={}, month={}, points={}, cached={}",
                 query.instrument(), report.contractMonth(), report.points().size(), report.cached());
        return ResponseEntity.ok(AggregateResponse.from(report, calendar));
    }
}
