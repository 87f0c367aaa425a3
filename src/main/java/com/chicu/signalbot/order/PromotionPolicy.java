package com.chicu.signalbot.order;

import com.chicu.signalbot.common.enums.ExecutionMode;
import com.chicu.signalbot.common.enums.StrategyTag;
import com.chicu.signalbot.signal.Signal;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Когда бот сам превращает сигнал в ордер и каким размером.
 *
 * SUPERVISED — никогда,
 * STRICT — уверенность ≥ 70, тег FIB, RR ≥ 2,
 * EXPLORE — уверенность ≥ 50, RR ≥ 1.5.
 */
@Component
public class PromotionPolicy {

    static final int STRICT_MIN_CONFIDENCE = 70;
    static final double STRICT_MIN_RR = 2.0;
    static final int EXPLORE_MIN_CONFIDENCE = 50;
    static final double EXPLORE_MIN_RR = 1.5;

    private static final int SIZE_SCALE = 6;

    public boolean shouldAutoPromote(Signal signal, ExecutionMode mode) {
        if (signal == null || mode == null) {
            return false;
        }
        switch (mode) {
            case STRICT:
                return signal.confidence() >= STRICT_MIN_CONFIDENCE
                        && signal.hasTag(StrategyTag.FIB)
                        && signal.riskReward() >= STRICT_MIN_RR;
            case EXPLORE:
                return signal.confidence() >= EXPLORE_MIN_CONFIDENCE
                        && signal.riskReward() >= EXPLORE_MIN_RR;
            case SUPERVISED:
            default:
                return false;
        }
    }

    /**
     * Размер позиции так, чтобы стоп стоил ровно riskPerTrade.
     */
    public double positionSize(double entry, double stop, double riskPerTrade) {
        double risk = Math.abs(entry - stop);
        if (risk == 0 || !Double.isFinite(risk)) {
            throw new IllegalArgumentException("Cannot size a position with zero risk");
        }
        return BigDecimal.valueOf(riskPerTrade / risk)
                .setScale(SIZE_SCALE, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
