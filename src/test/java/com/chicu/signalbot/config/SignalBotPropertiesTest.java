package com.chicu.signalbot.config;

import com.chicu.signalbot.common.enums.MarketBias;
import com.chicu.signalbot.common.time.Timeframe;
import com.chicu.signalbot.strategy.StrategyConfig;
import com.chicu.signalbot.strategy.StrategyWeights;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SignalBotPropertiesTest {

    @Test
    void defaultsAreValid() {
        SignalBotProperties p = new SignalBotProperties();

        assertDoesNotThrow(p::validate);
        assertEquals(List.of(Timeframe.M5, Timeframe.M15, Timeframe.H1), p.scanTimeframes());
        assertEquals(StrategyConfig.balanced(), p.toStrategyConfig());
    }

    @Test
    void strategyOverridesApplyOnTopOfPreset() {
        SignalBotProperties p = new SignalBotProperties();
        p.getStrategy().setPreset("highR");
        p.getStrategy().setRsiEnabled(false);
        p.getStrategy().setMarketBias(MarketBias.BEARISH);

        StrategyConfig cfg = p.toStrategyConfig();

        assertFalse(cfg.isRsiEnabled());
        assertTrue(cfg.isFibEnabled());
        assertEquals(MarketBias.BEARISH, cfg.getMarketBias());
        assertEquals(StrategyConfig.highR().getMinRrSr(), cfg.getMinRrSr());
    }

    @Test
    void orderTtl_defaultsOverridesAndUnknown() {
        SignalBotProperties p = new SignalBotProperties();
        p.getOrders().getTtl().put("1h", Duration.ofHours(3));

        assertEquals(Duration.ofMinutes(30), p.orderTtl(Timeframe.M5));
        assertEquals(Duration.ofHours(3), p.orderTtl(Timeframe.H1));
        assertEquals(Duration.ofHours(24), p.orderTtl(Timeframe.D1));
        assertEquals(Duration.ofHours(6), p.orderTtl(null));
    }

    @Test
    void invalidValues_failFast() {
        SignalBotProperties badInterval = new SignalBotProperties();
        badInterval.getEngine().setScanInterval(Duration.ZERO);
        assertThrows(IllegalArgumentException.class, badInterval::validate);

        SignalBotProperties noSymbols = new SignalBotProperties();
        noSymbols.getScan().setSymbols(List.of());
        assertThrows(IllegalArgumentException.class, noSymbols::validate);

        SignalBotProperties badTtlKey = new SignalBotProperties();
        badTtlKey.getOrders().getTtl().put("3m", Duration.ofMinutes(10));
        assertThrows(IllegalArgumentException.class, badTtlKey::validate);

        SignalBotProperties badWeights = new SignalBotProperties();
        badWeights.getStrategy().setWeights(new StrategyWeights(2, 1, 1, 1, 1, 1));
        assertThrows(IllegalArgumentException.class, badWeights::validate);

        SignalBotProperties badPreset = new SignalBotProperties();
        badPreset.getStrategy().setPreset("moon");
        assertThrows(IllegalArgumentException.class, badPreset::validate);
    }
}
