package com.ofacwatch.screening.controller;

import com.ofacwatch.screening.config.ScreeningProperties;
import com.ofacwatch.screening.dedup.DedupStore;
import com.ofacwatch.screening.dto.AlertResponse;
import com.ofacwatch.screening.dto.MonitorStatusResponse;
import com.ofacwatch.screening.dto.TriggerResponse;
import com.ofacwatch.screening.exception.SourceBusyException;
import com.ofacwatch.screening.exception.SourceNotFoundException;
import com.ofacwatch.screening.presenter.AlertFeedPresenter;
import com.ofacwatch.screening.scheduler.PollingScheduler;
import com.ofacwatch.screening.search.SanctionsSearchService;
import com.ofacwatch.screening.search.SearchHit;
import com.ofacwatch.screening.sync.SnapshotRefreshJob;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only monitor API plus the manual cycle trigger.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/monitor")
@RequiredArgsConstructor
@Tag(name = "Monitor", description = "Sanctions mention monitoring")
public class MonitorController {

    private final PollingScheduler pollingScheduler;
    private final AlertFeedPresenter alertFeed;
    private final DedupStore dedupStore;
    private final SnapshotRefreshJob snapshotRefreshJob;
    private final SanctionsSearchService searchService;
    private final ScreeningProperties properties;

    @GetMapping("/status")
    @Operation(summary = "Sanctions snapshot, per-source polling state and alert counters")
    public ResponseEntity<MonitorStatusResponse> getStatus() {
        MonitorStatusResponse status = MonitorStatusResponse.builder()
                .snapshot(snapshotRefreshJob.status())
                .sources(pollingScheduler.statuses())
                .schedulerRunning(pollingScheduler.isRunning())
                .alertsPublished(alertFeed.count())
                .alertsRecorded(dedupStore.size())
                .feedCapacity(alertFeed.capacity())
                .defaultFetchInterval(properties.getDefaultFetchInterval())
                .snapshotRefreshInterval(properties.getSnapshot().getRefreshInterval())
                .build();
        return ResponseEntity.ok(status);
    }

    @GetMapping("/results")
    @Operation(summary = "Most recent alerts first")
    public ResponseEntity<List<AlertResponse>> getResults(
            @RequestParam(defaultValue = "false") boolean onlyMatches,
            @RequestParam(defaultValue = "200") int limit) {
        int bounded = Math.max(1, Math.min(limit, alertFeed.capacity()));
        log.debug("Fetching results - onlyMatches: {}, limit: {}", onlyMatches, bounded);

        List<AlertResponse> alerts = alertFeed.recent(bounded, onlyMatches).stream()
                .map(AlertResponse::from)
                .toList();
        return ResponseEntity.ok(alerts);
    }

    @GetMapping("/search")
    @Operation(summary = "Fuzzy search of the sanctions list")
    public ResponseEntity<List<SearchHit>> search(
            @RequestParam(defaultValue = "") String q,
            @RequestParam(defaultValue = "20") int limit) {
        if (q.isBlank()) {
            return ResponseEntity.ok(List.of());
        }
        return ResponseEntity.ok(searchService.search(q.trim(), limit));
    }

    @PostMapping("/sources/{sourceId}/trigger")
    @Operation(summary = "Run one polling cycle for a source now")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Cycle started"),
            @ApiResponse(responseCode = "404", description = "Unknown source"),
            @ApiResponse(responseCode = "409", description = "Source busy or scheduler stopping")
    })
    public ResponseEntity<TriggerResponse> trigger(@PathVariable String sourceId)
            throws SourceNotFoundException, SourceBusyException {
        if (!pollingScheduler.isKnownSource(sourceId)) {
            throw new SourceNotFoundException(sourceId);
        }
        if (!pollingScheduler.triggerNow(sourceId)) {
            throw new SourceBusyException(sourceId);
        }
        log.info("Manual cycle triggered for source {}", sourceId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(new TriggerResponse(sourceId, true));
    }
}
