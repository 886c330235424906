package com.fintech.marketmaking.api;

import com.fintech.marketmaking.service.ExecutionMode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;
import java.util.Map;

/**
 * Body of POST /api/v1/backtests.
 */
@Schema(description = "Backtest request: a strategy and time-ordered events per security")
public record BacktestRequest(

    @Schema(description = "Strategy code or name, the configured default when omitted",
            example = "v2_price_follow_qty_cooldown")
    String strategy,

    @Schema(description = "Execution mode, PARALLEL when omitted", example = "PARALLEL")
    ExecutionMode mode,

    @Schema(description = "Events per security, in timestamp order")
    @NotEmpty(message = "At least one security with events is required")
    Map<String, List<@Valid EventPayload>> events
) {}
