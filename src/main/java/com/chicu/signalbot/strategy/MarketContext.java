package com.chicu.signalbot.strategy;

import com.chicu.signalbot.indicators.FairValueGap;
import com.chicu.signalbot.indicators.Pivot;
import com.chicu.signalbot.indicators.Swing;
import com.chicu.signalbot.indicators.TechnicalIndicators;
import com.chicu.signalbot.market.model.Candle;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Индикаторы, посчитанные один раз на вызов детектора.
 */
record MarketContext(
        double[] highs,
        double[] lows,
        double price,
        double trendSlope,
        double rsi,
        List<Pivot> pivots,
        Optional<Swing> swing,
        List<FairValueGap> gaps
) {

    static final int EMA_PERIOD = 50;

    static MarketContext of(List<Candle> candles, int pivotLookback) {
        int n = candles.size();
        double[] closes = new double[n];
        double[] highs = new double[n];
        double[] lows = new double[n];
        for (int i = 0; i < n; i++) {
            Candle c = candles.get(i);
            closes[i] = c.close();
            highs[i] = c.high();
            lows[i] = c.low();
        }

        double[] ema50 = TechnicalIndicators.ema(closes, EMA_PERIOD);
        double[] rsi = TechnicalIndicators.rsi(closes);
        List<Pivot> pivots = TechnicalIndicators.findPivots(highs, lows, pivotLookback);

        return new MarketContext(
                highs,
                lows,
                closes[n - 1],
                TechnicalIndicators.slope(ema50),
                rsi[n - 1],
                pivots,
                TechnicalIndicators.lastSwing(pivots),
                TechnicalIndicators.detectFvg(highs, lows)
        );
    }

    boolean trendUp() {
        return trendSlope > 0;
    }

    boolean trendDown() {
        return trendSlope < 0;
    }

    /** Последний незакрытый разрыв нужной полярности, подходящий под условие. */
    Optional<FairValueGap> lastOpenGap(boolean bullish, Predicate<FairValueGap> filter) {
        for (int i = gaps.size() - 1; i >= 0; i--) {
            FairValueGap g = gaps.get(i);
            if (g.bullish() == bullish && !g.filled() && filter.test(g)) {
                return Optional.of(g);
            }
        }
        return Optional.empty();
    }

    double minLow(int from, int toInclusive) {
        double m = Double.POSITIVE_INFINITY;
        for (int i = Math.max(0, from); i <= Math.min(lows.length - 1, toInclusive); i++) {
            m = Math.min(m, lows[i]);
        }
        return m;
    }

    double maxHigh(int from, int toInclusive) {
        double m = Double.NEGATIVE_INFINITY;
        for (int i = Math.max(0, from); i <= Math.min(highs.length - 1, toInclusive); i++) {
            m = Math.max(m, highs[i]);
        }
        return m;
    }

    int lastIndex() {
        return highs.length - 1;
    }
}
