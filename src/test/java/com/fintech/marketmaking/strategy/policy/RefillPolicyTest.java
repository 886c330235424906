package com.fintech.marketmaking.strategy.policy;

import com.fintech.marketmaking.domain.Side;
import com.fintech.marketmaking.domain.TradeSide;
import com.fintech.marketmaking.strategy.SideState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Refill Policy Tests")
class RefillPolicyTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2025, 3, 3, 10, 30);
    private static final Duration INTERVAL = Duration.ofSeconds(60);

    @Nested
    @DisplayName("Timed refill")
    class Timed {

        private final TimedRefillPolicy policy = new TimedRefillPolicy(INTERVAL);

        @Test
        @DisplayName("A side that never quoted may quote immediately")
        void testIdleSideEligible() {
            assertThat(policy.mayRequote(new SideState(Side.BID), T0)).isTrue();
        }

        @ParameterizedTest(name = "{0}s after placement: eligible={1}")
        @CsvSource({
            "0, false",
            "59, false",
            "60, true",
            "90, true"
        })
        @DisplayName("Eligible again once the interval has elapsed since placement")
        void testIntervalSincePlacement(long seconds, boolean expected) {
            SideState state = new SideState(Side.BID);
            state.place(10.00, 200, 50, T0);

            assertThat(policy.mayRequote(state, T0.plusSeconds(seconds))).isEqualTo(expected);
        }

        @Test
        @DisplayName("A fill restarts the timer")
        void testFillRestartsTimer() {
            SideState state = new SideState(Side.ASK);
            state.place(10.10, 0, 50, T0);
            state.recordFill(T0.plusSeconds(50));

            assertThat(policy.mayRequote(state, T0.plusSeconds(70))).isFalse();
            assertThat(policy.mayRequote(state, T0.plusSeconds(110))).isTrue();
        }

        @Test
        @DisplayName("Always offers the full size and never keeps queue position")
        void testFullSizeFreshOrder() {
            SideState state = new SideState(Side.BID);
            state.place(10.00, 0, 50, T0);
            state.consume(30);

            assertThat(policy.offerSize(state, T0.plusSeconds(61), 50)).isEqualTo(50);
            assertThat(policy.keepsQueuePositionAtSamePrice()).isFalse();
        }
    }

    @Nested
    @DisplayName("Cooldown refill")
    class Cooldown {

        private final CooldownRefillPolicy policy = new CooldownRefillPolicy(INTERVAL);

        @Test
        @DisplayName("Requotes on every event")
        void testAlwaysRequotes() {
            SideState state = new SideState(Side.BID);
            state.place(10.00, 0, 50, T0);

            assertThat(policy.mayRequote(state, T0.plusSeconds(1))).isTrue();
            assertThat(policy.keepsQueuePositionAtSamePrice()).isTrue();
        }

        @Test
        @DisplayName("Offers only the unfilled remainder during cooldown, full size after")
        void testRemainderDuringCooldown() {
            // Given - 30 of 50 filled
            SideState state = new SideState(Side.BID);
            state.place(10.00, 0, 50, T0);
            state.consume(30);
            state.recordFill(T0);

            // Then
            assertThat(policy.offerSize(state, T0.plusSeconds(10), 50)).isEqualTo(20);
            assertThat(policy.offerSize(state, T0.plusSeconds(59), 50)).isEqualTo(20);
            assertThat(policy.offerSize(state, T0.plusSeconds(60), 50)).isEqualTo(50);
        }

        @Test
        @DisplayName("Without a fill there is no cooldown")
        void testNoFillNoCooldown() {
            SideState state = new SideState(Side.ASK);
            state.place(10.10, 0, 50, T0);

            assertThat(policy.inCooldown(state, T0.plusSeconds(1))).isFalse();
            assertThat(policy.offerSize(state, T0.plusSeconds(1), 50)).isEqualTo(50);
        }
    }

    @ParameterizedTest(name = "{0} fill")
    @EnumSource(TradeSide.class)
    @DisplayName("A buy restarts the bid timer, a sell the ask timer")
    void testTimerMapping(TradeSide side) {
        Side expected = side == TradeSide.BUY ? Side.BID : Side.ASK;

        assertThat(side.quoteSide()).isEqualTo(expected);
        assertThat(expected.fillDirection()).isEqualTo(side);
    }
}
