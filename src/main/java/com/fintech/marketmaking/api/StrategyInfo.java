package com.fintech.marketmaking.api;

import com.fintech.marketmaking.strategy.StrategyVariant;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Listing entry for an available strategy variant.
 */
@Schema(description = "Available strategy variant")
public record StrategyInfo(
    @Schema(example = "BASELINE") String name,
    @Schema(example = "v1_baseline") String code,
    String description
) {

    public static StrategyInfo of(StrategyVariant variant) {
        return new StrategyInfo(variant.name(), variant.code(), variant.description());
    }
}
