package com.chicu.signalbot.strategy;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StrategyConfigTest {

    @Test
    void presetsAreValid() {
        assertDoesNotThrow(() -> StrategyConfig.balanced().validate());
        assertDoesNotThrow(() -> StrategyConfig.highProb().validate());
        assertDoesNotThrow(() -> StrategyConfig.highR().validate());
    }

    @Test
    void presetByName_isLenient() {
        assertEquals(0.5, StrategyConfig.preset("high-prob").getWeights().rr());
        assertEquals(StrategyConfig.highR(), StrategyConfig.preset("HIGH_R"));
        assertEquals(StrategyConfig.balanced(), StrategyConfig.preset(null));
        assertThrows(IllegalArgumentException.class, () -> StrategyConfig.preset("yolo"));
    }

    @Test
    void highR_raisesRrThresholds() {
        StrategyConfig r = StrategyConfig.highR();
        StrategyConfig d = StrategyConfig.defaults();

        assertTrue(r.getMinRrFib() > d.getMinRrFib());
        assertTrue(r.getMinRrSr() > d.getMinRrSr());
        assertEquals(1.0, r.getWeights().rr());
    }

    @Test
    void outOfRangeValues_areRejected() {
        StrategyConfig d = StrategyConfig.defaults();

        assertThrows(IllegalArgumentException.class,
                () -> d.toBuilder().weights(new StrategyWeights(1.2, 1, 1, 1, 1, 1)).build().validate());
        assertThrows(IllegalArgumentException.class,
                () -> d.toBuilder().weights(new StrategyWeights(1, 1, 1, 1, 1, -0.1)).build().validate());
        assertThrows(IllegalArgumentException.class, () -> d.toBuilder().minCandles(5).build().validate());
        assertThrows(IllegalArgumentException.class, () -> d.toBuilder().pivotLookback(0).build().validate());
        assertThrows(IllegalArgumentException.class, () -> d.toBuilder().srProximityPct(0.001).build().validate());
        assertThrows(IllegalArgumentException.class, () -> d.toBuilder().minRrSr(0.5).build().validate());
        assertThrows(IllegalArgumentException.class, () -> d.toBuilder().weights(null).build().validate());
    }
}
