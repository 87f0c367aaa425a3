package com.chicu.signalbot.strategy;

import com.chicu.signalbot.common.enums.StrategyTag;
import com.chicu.signalbot.common.enums.TradeSide;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Уверенность сигнала 0..100.
 *
 * Базовые компоненты (каждый умножается на свой вес):
 * TREND 25, FIB 20, FVG 20, SR 15, RSI до 20 (удаление от 50), бонус RR до 40.
 * Сверху +10, если сторона совпадает с уклоном рынка. Итог зажимается в [0, 100].
 */
@Component
public class ConfidenceScorer {

    static final double TREND_POINTS = 25;
    static final double FIB_POINTS = 20;
    static final double FVG_POINTS = 20;
    static final double SR_POINTS = 15;
    static final double RSI_MAX_POINTS = 20;
    static final double RR_POINTS_PER_UNIT = 15;
    static final double RR_MAX_POINTS = 40;
    static final double BIAS_BONUS = 10;

    public int score(TradeSide side, Set<StrategyTag> tags, double rsi, double rr, StrategyConfig config) {
        StrategyWeights w = config.getWeights();

        double total = 0;
        if (tags.contains(StrategyTag.TREND)) total += TREND_POINTS * w.trend();
        if (tags.contains(StrategyTag.FIB)) total += FIB_POINTS * w.fib();
        if (tags.contains(StrategyTag.FVG)) total += FVG_POINTS * w.fvg();
        if (tags.contains(StrategyTag.SR)) total += SR_POINTS * w.sr();

        if (config.isRsiEnabled() && Double.isFinite(rsi)) {
            total += Math.min(RSI_MAX_POINTS, Math.abs(rsi - 50)) * w.rsi();
        }
        if (Double.isFinite(rr) && rr > 0) {
            total += Math.min(RR_MAX_POINTS, rr * RR_POINTS_PER_UNIT) * w.rr();
        }

        total = clamp(total);
        if (config.getMarketBias().favours(side)) {
            total = clamp(total + BIAS_BONUS);
        }
        return (int) Math.round(total);
    }

    private static double clamp(double v) {
        return Math.max(0, Math.min(100, v));
    }
}
