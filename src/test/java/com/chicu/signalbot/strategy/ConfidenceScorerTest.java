package com.chicu.signalbot.strategy;

import com.chicu.signalbot.common.enums.MarketBias;
import com.chicu.signalbot.common.enums.StrategyTag;
import com.chicu.signalbot.common.enums.TradeSide;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ConfidenceScorerTest {

    private final ConfidenceScorer scorer = new ConfidenceScorer();

    @Test
    void sumsWeightedComponents() {
        Set<StrategyTag> tags = EnumSet.of(StrategyTag.FIB, StrategyTag.FVG, StrategyTag.TREND);

        // 25 + 20 + 20 + 6 (rsi 44) + 30 (rr 2)
        assertEquals(100, scorer.score(TradeSide.LONG, tags, 44, 2.0, StrategyConfig.defaults()));
        // 25 + 20 + 20 + 0 + 15
        assertEquals(80, scorer.score(TradeSide.LONG, tags, 50, 1.0, StrategyConfig.defaults()));
    }

    @Test
    void rsiComponentIgnoredWhenRsiDisabled() {
        StrategyConfig cfg = StrategyConfig.defaults().toBuilder().rsiEnabled(false).build();

        assertEquals(35, scorer.score(TradeSide.SHORT, EnumSet.of(StrategyTag.SR), 10, 4.0 / 3, cfg));
    }

    @Test
    void rrBonusIsCapped() {
        assertEquals(40, scorer.score(TradeSide.LONG, EnumSet.noneOf(StrategyTag.class), 50, 10, StrategyConfig.defaults()));
    }

    @Test
    void weightsScaleComponents() {
        StrategyConfig cfg = StrategyConfig.defaults().toBuilder()
                .weights(new StrategyWeights(0.5, 0, 1, 1, 1, 0))
                .build();

        // FIB 20 × 0.5, FVG обнулён, RR обнулён
        assertEquals(10, scorer.score(TradeSide.LONG, EnumSet.of(StrategyTag.FIB, StrategyTag.FVG), 50, 3, cfg));
    }

    @Test
    void biasBonus_onlyForMatchingSide_andClamped() {
        StrategyConfig bullish = StrategyConfig.defaults().toBuilder().marketBias(MarketBias.BULLISH).build();
        Set<StrategyTag> sr = EnumSet.of(StrategyTag.SR);

        assertEquals(55, scorer.score(TradeSide.LONG, sr, 50, 2.0, bullish));
        assertEquals(45, scorer.score(TradeSide.SHORT, sr, 50, 2.0, bullish));

        Set<StrategyTag> all = EnumSet.allOf(StrategyTag.class);
        assertEquals(100, scorer.score(TradeSide.LONG, all, 20, 5, bullish));
    }
}
