package com.fintech.metals.api;

import com.fintech.metals.ingestion.CycleOutcome;
import com.fintech.metals.ingestion.FeedDefinition;
import com.fintech.metals.ingestion.IngestionScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Optional;

/**
 * Manual trigger and status of the ingestion loop.
 */
@RestController
@RequestMapping("/api/v1/ingestion")
@Tag(name = "Ingestion", description = "Polling loop control")
public class IngestionController {

    private final IngestionScheduler scheduler;

    public IngestionController(IngestionScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Operation(
        summary = "Run one ingestion cycle now",
        description = "Shares the lock with the background loop and obeys the trading calendar. " +
                      "Repeating the call does not create duplicate history rows."
    )
    @PostMapping("/run")
    public ResponseEntity<List<CycleOutcome>> run(
            @Parameter(description = "Run only this feed", example = "mcx-aluminium")
            @RequestParam(required = false)
            String feed) {
        return ResponseEntity.ok(scheduler.triggerNow(Optional.ofNullable(feed).filter(name -> !name.isBlank())));
    }

    @Operation(summary = "Current state of the ingestion loop")
    @GetMapping("/status")
    public ResponseEntity<IngestionStatusResponse> status() {
        List<String> feeds = scheduler.feeds().stream().map(FeedDefinition::name).toList();
        return ResponseEntity.ok(IngestionStatusResponse.from(scheduler.status(), feeds));
    }
}
