package com.chicu.signalbot.strategy;

import com.chicu.signalbot.common.enums.MarketBias;
import lombok.Builder;
import lombok.Value;

import java.util.Locale;

/**
 * Закрытая конфигурация детектора сетапов.
 *
 * Все поля имеют документированные дефолты ({@link #defaults()}),
 * неизвестных ключей нет. Проверка — {@link #validate()}, вызывается детектором на входе.
 */
@Value
@Builder(toBuilder = true)
public class StrategyConfig {

    // =====================================================
    // ВКЛЮЧЕНИЕ ПРАВИЛ
    // =====================================================

    @Builder.Default boolean fibEnabled = true;
    @Builder.Default boolean fvgEnabled = true;
    @Builder.Default boolean srEnabled = true;
    /** Выключенный TREND снимает требование совпадения с трендом и тег TREND. */
    @Builder.Default boolean trendEnabled = true;
    /** Выключенный RSI снимает RSI-фильтр Fib+FVG и правило экстремумов. */
    @Builder.Default boolean rsiEnabled = true;

    // =====================================================
    // СКОРИНГ
    // =====================================================

    @Builder.Default StrategyWeights weights = StrategyWeights.balanced();
    @Builder.Default MarketBias marketBias = MarketBias.NEUTRAL;

    // =====================================================
    // ПАРАМЕТРЫ ПРАВИЛ
    // =====================================================

    /** Минимум свечей для анализа. */
    @Builder.Default int minCandles = 60;
    @Builder.Default int pivotLookback = 3;
    /** Близость к уровню SR, доля цены (0.002–0.005). */
    @Builder.Default double srProximityPct = 0.003;

    @Builder.Default double minRrFibFvg = 1.5;
    @Builder.Default double minRrFib = 1.5;
    @Builder.Default double minRrFvg = 1.5;
    @Builder.Default double minRrSr = 2.0;
    @Builder.Default double minRrRsi = 1.5;

    public static StrategyConfig defaults() {
        return StrategyConfig.builder().build();
    }

    // =====================================================
    // ПРЕСЕТЫ
    // =====================================================

    /** Все веса 1. */
    public static StrategyConfig balanced() {
        return defaults();
    }

    /** Вероятность важнее размера: вес RR снижен. */
    public static StrategyConfig highProb() {
        return StrategyConfig.builder()
                .weights(StrategyWeights.balanced().toBuilder().rr(0.5).build())
                .build();
    }

    /** Размер важнее вероятности: RR на полном весе, остальное ослаблено, пороги RR выше. */
    public static StrategyConfig highR() {
        return StrategyConfig.builder()
                .weights(new StrategyWeights(0.8, 0.8, 0.6, 0.8, 0.5, 1.0))
                .minRrFibFvg(1.6)
                .minRrFib(2.0)
                .minRrFvg(2.0)
                .minRrSr(2.5)
                .minRrRsi(2.0)
                .build();
    }

    /**
     * Пресет по имени: balanced / highProb / highR (регистр и дефисы не важны).
     */
    public static StrategyConfig preset(String name) {
        if (name == null || name.isBlank()) {
            return balanced();
        }
        String key = name.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
        switch (key) {
            case "balanced":
                return balanced();
            case "highprob":
                return highProb();
            case "highr":
                return highR();
            default:
                throw new IllegalArgumentException("Unknown strategy preset: " + name);
        }
    }

    // =====================================================
    // VALIDATION
    // =====================================================

    public StrategyConfig validate() {
        if (weights == null) {
            throw new IllegalArgumentException("weights are required");
        }
        if (marketBias == null) {
            throw new IllegalArgumentException("marketBias is required");
        }
        weights.validate();

        if (minCandles < 10) {
            throw new IllegalArgumentException("minCandles must be >= 10, got " + minCandles);
        }
        if (pivotLookback < 1 || pivotLookback * 2 + 1 > minCandles) {
            throw new IllegalArgumentException("pivotLookback out of range: " + pivotLookback);
        }
        if (!(srProximityPct >= 0.002 && srProximityPct <= 0.005)) {
            throw new IllegalArgumentException("srProximityPct must be in [0.002, 0.005], got " + srProximityPct);
        }
        checkRr("minRrFibFvg", minRrFibFvg);
        checkRr("minRrFib", minRrFib);
        checkRr("minRrFvg", minRrFvg);
        checkRr("minRrSr", minRrSr);
        checkRr("minRrRsi", minRrRsi);
        return this;
    }

    private static void checkRr(String name, double v) {
        if (!Double.isFinite(v) || v < 1.0) {
            throw new IllegalArgumentException(name + " must be >= 1.0, got " + v);
        }
    }
}
