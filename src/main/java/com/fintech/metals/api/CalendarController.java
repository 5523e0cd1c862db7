package com.fintech.metals.api;

import com.fintech.metals.calendar.TradingCalendar;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

@RestController
@RequestMapping("/api/v1/calendar")
@Tag(name = "Calendar", description = "Trading session state")
public class CalendarController {

    private final TradingCalendar calendar;
    private final Clock clock;

    public CalendarController(TradingCalendar calendar, Clock clock) {
        this.calendar = calendar;
        this.clock = clock;
    }

    @Operation(summary = "Whether the market is open right now, and why not if closed")
    @GetMapping("/status")
    public ResponseEntity<TradingStatusResponse> getStatus() {
        return ResponseEntity.ok(TradingStatusResponse.from(calendar.isOpen(clock.instant()), calendar));
    }
}
