package com.chicu.signalbot.strategy;

import lombok.Builder;

/**
 * Веса компонентов уверенности, каждый в [0, 1].
 */
@Builder(toBuilder = true)
public record StrategyWeights(double fib, double fvg, double sr, double trend, double rsi, double rr) {

    public static StrategyWeights balanced() {
        return new StrategyWeights(1, 1, 1, 1, 1, 1);
    }

    void validate() {
        check("fib", fib);
        check("fvg", fvg);
        check("sr", sr);
        check("trend", trend);
        check("rsi", rsi);
        check("rr", rr);
    }

    private static void check(String name, double w) {
        if (!Double.isFinite(w) || w < 0 || w > 1) {
            throw new IllegalArgumentException("Weight '" + name + "' must be in [0,1], got " + w);
        }
    }
}
