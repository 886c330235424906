package com.fintech.marketmaking.api;

import com.fintech.marketmaking.domain.MarketEvent;
import com.fintech.marketmaking.service.BacktestReport;
import com.fintech.marketmaking.service.BacktestService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for running backtests and retrieving their reports.
 */
@RestController
@RequestMapping("/api/v1/backtests")
@Validated
@Tag(name = "Backtests", description = "Market-making and closing-auction strategy backtests")
public class BacktestController {

    private static final Logger log = LoggerFactory.getLogger(BacktestController.class);

    private final BacktestService backtestService;

    public BacktestController(BacktestService backtestService) {
        this.backtestService = backtestService;
    }

    /**
     * POST /api/v1/backtests
     *
     * Runs the strategy over the supplied events and returns the report.
     */
    @Operation(
        summary = "Run a backtest",
        description = """
            Replays the supplied events per security through a fresh session of the chosen strategy.
            Each security is simulated independently; the report is stored and can be fetched by run id.

            **Strategies:** v1_baseline, v2_price_follow_qty_cooldown, v2_1_stop_loss,
            v3_liquidity_monitor, closing_auction
            """
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Backtest completed",
            content = @Content(mediaType = "application/json",
                schema = @Schema(implementation = BacktestReport.class))
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Unknown strategy, missing or out-of-order events",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = ErrorResponse.class),
                examples = @ExampleObject(
                    name = "Unknown strategy",
                    value = """
                        {
                          "status": 400,
                          "error": "SERVICE_VALIDATION_ERROR",
                          "message": "Unknown strategy: v9",
                          "path": "/api/v1/backtests",
                          "timestamp": "2025-12-09T10:30:00Z"
                        }
                        """
                )
            )
        ),
        @ApiResponse(
            responseCode = "500",
            description = "A session failed",
            content = @Content(mediaType = "application/json",
                schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    @PostMapping
    public ResponseEntity<BacktestReport> runBacktest(@Valid @RequestBody BacktestRequest request) {
        Map<String, List<MarketEvent>> events = new LinkedHashMap<>();
        request.events().forEach((security, payloads) -> events.put(
            security,
            payloads == null ? List.of() : payloads.stream().map(EventPayload::toEvent).toList()));

        log.debug("Backtest requested: strategy={}, mode={}, securities={}",
            request.strategy(), request.mode(), events.keySet());

        BacktestReport report = backtestService.runBacktest(request.strategy(), request.mode(), events);
        return ResponseEntity.ok(report);
    }

    /**
     * GET /api/v1/backtests
     */
    @Operation(summary = "List stored backtest reports, most recent first")
    @GetMapping
    public List<BacktestReport> recentRuns() {
        return backtestService.recentRuns();
    }

    /**
     * GET /api/v1/backtests/{runId}
     */
    @Operation(summary = "Get a stored backtest report")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Report found"),
        @ApiResponse(
            responseCode = "404",
            description = "Unknown or evicted run id",
            content = @Content(mediaType = "application/json",
                schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    @GetMapping("/{runId}")
    public ResponseEntity<BacktestReport> getRun(
            @Parameter(description = "Run identifier returned by POST /api/v1/backtests", required = true)
            @PathVariable UUID runId) {
        return backtestService.findRun(runId)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new RunNotFoundException(runId));
    }

    /**
     * GET /api/v1/backtests/strategies
     */
    @Operation(summary = "List available strategy variants")
    @GetMapping("/strategies")
    public List<StrategyInfo> strategies() {
        return backtestService.strategies().stream()
            .map(StrategyInfo::of)
            .toList();
    }
}
