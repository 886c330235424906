package com.fintech.marketmaking.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for API documentation.
 *
 * Access the interactive API documentation at:
 * - Swagger UI: http://localhost:8080/swagger-ui/index.html
 * - OpenAPI JSON: http://localhost:8080/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI marketMakingOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Market-Making Backtest API")
                        .description("""
                                Order book reconstruction and market-making fill simulation.

                                **Features:**
                                - Per-security limit order book rebuilt from bid/ask/trade events
                                - Queue-position fill simulation against our resting quotes
                                - Position and realized/unrealized PnL accounting
                                - Strategy variants: baseline refill, price-follow with cooldown,
                                  stop-loss, liquidity monitor, closing auction

                                **Tech Stack:**
                                - Spring Boot 3.2
                                - LMAX Disruptor (streaming ingestion)
                                - Micrometer / Prometheus
                                """)
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:8080")
                                .description("Local Development Server")
                ));
    }
}
