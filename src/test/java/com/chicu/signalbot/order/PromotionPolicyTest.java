package com.chicu.signalbot.order;

import com.chicu.signalbot.common.enums.ExecutionMode;
import com.chicu.signalbot.common.enums.StrategyTag;
import com.chicu.signalbot.common.enums.TradeSide;
import com.chicu.signalbot.common.time.Timeframe;
import com.chicu.signalbot.signal.Signal;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PromotionPolicyTest {

    private final PromotionPolicy policy = new PromotionPolicy();

    @Test
    void supervised_neverPromotes() {
        assertFalse(policy.shouldAutoPromote(signal(100, 5.0, EnumSet.of(StrategyTag.FIB)), ExecutionMode.SUPERVISED));
    }

    @Test
    void strict_requiresConfidenceFibAndRr() {
        assertTrue(policy.shouldAutoPromote(signal(70, 2.0, EnumSet.of(StrategyTag.FIB)), ExecutionMode.STRICT));
        assertFalse(policy.shouldAutoPromote(signal(69, 2.0, EnumSet.of(StrategyTag.FIB)), ExecutionMode.STRICT));
        assertFalse(policy.shouldAutoPromote(signal(90, 1.9, EnumSet.of(StrategyTag.FIB)), ExecutionMode.STRICT));
        assertFalse(policy.shouldAutoPromote(signal(90, 3.0, EnumSet.of(StrategyTag.FVG)), ExecutionMode.STRICT),
                "без FIB строгий режим не берёт");
    }

    @Test
    void explore_isLooser() {
        assertTrue(policy.shouldAutoPromote(signal(50, 1.5, EnumSet.of(StrategyTag.SR)), ExecutionMode.EXPLORE));
        assertFalse(policy.shouldAutoPromote(signal(49, 3.0, EnumSet.of(StrategyTag.SR)), ExecutionMode.EXPLORE));
        assertFalse(policy.shouldAutoPromote(signal(80, 1.4, EnumSet.of(StrategyTag.SR)), ExecutionMode.EXPLORE));
    }

    @Test
    void positionSize_riskOverStopDistance() {
        assertEquals(20.0, policy.positionSize(100, 95, 100), 1e-12);
        assertEquals(0.333333, policy.positionSize(100, 400, 100), 1e-12);
        assertThrows(IllegalArgumentException.class, () -> policy.positionSize(100, 100, 100));
    }

    private static Signal signal(int confidence, double rr, Set<StrategyTag> tags) {
        return Signal.builder()
                .id("sig")
                .symbol("BTCUSDT")
                .timeframe(Timeframe.H1)
                .side(TradeSide.LONG)
                .entry(100)
                .stop(95)
                .take(100 + 5 * rr)
                .confidence(confidence)
                .tags(tags)
                .reason("test")
                .createdAt(Instant.EPOCH)
                .riskReward(rr)
                .build();
    }
}
