package com.chicu.signalbot.indicators;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Чистые функции теханализа.
 *
 * Все функции stateless и терпимы к коротким рядам:
 * вместо исключения возвращают нейтральные значения (0, 50, пустой список).
 */
@UtilityClass
public class TechnicalIndicators {

    public static final int DEFAULT_RSI_PERIOD = 14;
    public static final int DEFAULT_PIVOT_LOOKBACK = 3;
    public static final int DEFAULT_SLOPE_PERIOD = 20;

    private static final double NEUTRAL_RSI = 50.0;

    // =====================================================
    // EMA / RSI
    // =====================================================

    /**
     * Экспоненциальная средняя. Затравка = values[0], k = 2 / (period + 1).
     * Длина результата равна длине входа.
     */
    public static double[] ema(double[] values, int period) {
        if (values == null || values.length == 0) {
            return new double[0];
        }
        if (period < 1) {
            throw new IllegalArgumentException("period must be >= 1");
        }
        double k = 2.0 / (period + 1);
        double[] out = new double[values.length];
        out[0] = values[0];
        for (int i = 1; i < values.length; i++) {
            out[i] = values[i] * k + out[i - 1] * (1 - k);
        }
        return out;
    }

    /**
     * RSI на EMA-сглаженных приростах/потерях.
     * Первое значение (нет истории) — 50. Нулевые потери при ненулевых приростах — 100.
     * Все значения лежат в [0, 100].
     */
    public static double[] rsi(double[] values, int period) {
        if (values == null || values.length == 0) {
            return new double[0];
        }
        int n = values.length;
        double[] gains = new double[n];
        double[] losses = new double[n];
        for (int i = 1; i < n; i++) {
            double diff = values[i] - values[i - 1];
            gains[i] = diff > 0 ? diff : 0;
            losses[i] = diff < 0 ? -diff : 0;
        }

        double[] avgGain = ema(gains, period);
        double[] avgLoss = ema(losses, period);

        double[] out = new double[n];
        out[0] = NEUTRAL_RSI;
        for (int i = 1; i < n; i++) {
            double g = avgGain[i];
            double l = avgLoss[i];
            if (!Double.isFinite(g) || !Double.isFinite(l)) {
                out[i] = NEUTRAL_RSI;
            } else if (l == 0) {
                out[i] = g == 0 ? NEUTRAL_RSI : 100.0;
            } else {
                out[i] = 100.0 - 100.0 / (1.0 + g / l);
            }
        }
        return out;
    }

    public static double[] rsi(double[] values) {
        return rsi(values, DEFAULT_RSI_PERIOD);
    }

    // =====================================================
    // PIVOTS / SWING
    // =====================================================

    /**
     * Пивоты со строгим доминированием в окне ±lookback.
     * Бар, который одновременно high и low, считается high.
     */
    public static List<Pivot> findPivots(double[] high, double[] low, int lookback) {
        List<Pivot> pivots = new ArrayList<>();
        if (high == null || low == null || lookback < 1) {
            return pivots;
        }
        int n = Math.min(high.length, low.length);

        for (int i = lookback; i < n - lookback; i++) {
            boolean isHigh = true;
            boolean isLow = true;
            for (int j = 1; j <= lookback; j++) {
                if (high[i] <= high[i - j] || high[i] <= high[i + j]) isHigh = false;
                if (low[i] >= low[i - j] || low[i] >= low[i + j]) isLow = false;
                if (!isHigh && !isLow) break;
            }
            if (isHigh) {
                pivots.add(new Pivot(i, high[i], Pivot.Type.HIGH));
            } else if (isLow) {
                pivots.add(new Pivot(i, low[i], Pivot.Type.LOW));
            }
        }
        return pivots;
    }

    /**
     * Последний свинг по двум последним пивотам.
     * low → high = UP, high → low = DOWN, два одинаковых подряд — свинга нет.
     */
    public static Optional<Swing> lastSwing(double[] high, double[] low, int lookback) {
        return lastSwing(findPivots(high, low, lookback));
    }

    public static Optional<Swing> lastSwing(List<Pivot> pivots) {
        if (pivots == null || pivots.size() < 2) {
            return Optional.empty();
        }
        Pivot p0 = pivots.get(pivots.size() - 2);
        Pivot p1 = pivots.get(pivots.size() - 1);

        if (p0.isLow() && p1.isHigh()) {
            return Optional.of(new Swing(Swing.Direction.UP, p0.index(), p1.index(), p1.price(), p0.price()));
        }
        if (p0.isHigh() && p1.isLow()) {
            return Optional.of(new Swing(Swing.Direction.DOWN, p0.index(), p1.index(), p0.price(), p1.price()));
        }
        return Optional.empty();
    }

    // =====================================================
    // FVG
    // =====================================================

    /**
     * Трёхсвечные разрывы в порядке формирования.
     * Флаг filled выставляется, если любой более поздний бар прошёл дальнюю границу полосы.
     */
    public static List<FairValueGap> detectFvg(double[] high, double[] low) {
        List<FairValueGap> gaps = new ArrayList<>();
        if (high == null || low == null) {
            return gaps;
        }
        int n = Math.min(high.length, low.length);

        for (int i = 2; i < n; i++) {
            double h0 = high[i - 2];
            double l0 = low[i - 2];

            if (low[i] > h0) {
                gaps.add(new FairValueGap(true, h0, low[i], i, isFilled(high, low, n, i, true, h0)));
            }
            if (high[i] < l0) {
                gaps.add(new FairValueGap(false, high[i], l0, i, isFilled(high, low, n, i, false, l0)));
            }
        }
        return gaps;
    }

    private static boolean isFilled(double[] high, double[] low, int n, int formedAt, boolean bullish, double farEdge) {
        for (int k = formedAt + 1; k < n; k++) {
            if (bullish ? low[k] < farEdge : high[k] > farEdge) {
                return true;
            }
        }
        return false;
    }

    // =====================================================
    // FIB / SLOPE / RR
    // =====================================================

    /** a + (b − a) × ratio. */
    public static double fibLevel(double a, double b, double ratio) {
        return a + (b - a) * ratio;
    }

    /**
     * Наклон МНК по последним {@code period} значениям.
     * Если значений меньше — 0.
     */
    public static double slope(double[] values, int period) {
        if (values == null || period < 2 || values.length < period) {
            return 0;
        }
        double sumX = 0, sumY = 0, sumXY = 0, sumXX = 0;
        int offset = values.length - period;
        for (int i = 0; i < period; i++) {
            double y = values[offset + i];
            sumX += i;
            sumY += y;
            sumXY += i * y;
            sumXX += (double) i * i;
        }
        double denom = period * sumXX - sumX * sumX;
        if (denom == 0) {
            return 0;
        }
        return (period * sumXY - sumX * sumY) / denom;
    }

    public static double slope(double[] values) {
        return slope(values, DEFAULT_SLOPE_PERIOD);
    }

    /**
     * |take − entry| / |entry − stop|.
     *
     * @return null, если риск нулевой или какой-то аргумент не задан
     */
    public static Double computeRr(Double entry, Double stop, Double take) {
        if (entry == null || stop == null || take == null) {
            return null;
        }
        double risk = Math.abs(entry - stop);
        if (risk == 0 || !Double.isFinite(risk)) {
            return null;
        }
        return Math.abs(take - entry) / risk;
    }
}
