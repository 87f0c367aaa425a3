package com.chicu.signalbot.indicators;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TechnicalIndicatorsTest {

    @Test
    void ema_seedsWithFirstValue_andKeepsLength() {
        double[] out = TechnicalIndicators.ema(new double[]{10, 20, 30}, 3);

        assertEquals(3, out.length);
        assertEquals(10.0, out[0], 1e-12);
        // k = 0.5
        assertEquals(15.0, out[1], 1e-12);
        assertEquals(22.5, out[2], 1e-12);
    }

    @Test
    void ema_emptyInput_returnsEmpty() {
        assertEquals(0, TechnicalIndicators.ema(new double[0], 14).length);
    }

    @Test
    void rsi_lengthMatchesInput_andValuesWithinBounds() {
        double[] closes = new double[120];
        for (int i = 0; i < closes.length; i++) {
            closes[i] = 100 + 10 * Math.sin(i / 5.0) + (i % 7 == 0 ? -3 : 1);
        }

        double[] rsi = TechnicalIndicators.rsi(closes, 14);

        assertEquals(closes.length, rsi.length, "длина RSI должна совпадать с входом");
        for (double v : rsi) {
            assertTrue(v >= 0 && v <= 100, "RSI вне [0,100]: " + v);
        }
    }

    @Test
    void rsi_shortHistory_isNeutral() {
        double[] rsi = TechnicalIndicators.rsi(new double[]{42.0});
        assertArrayEquals(new double[]{50.0}, rsi);

        double[] flat = TechnicalIndicators.rsi(new double[]{5, 5, 5, 5});
        for (double v : flat) {
            assertEquals(50.0, v, 1e-12);
        }
    }

    @Test
    void rsi_onlyGains_is100() {
        double[] rsi = TechnicalIndicators.rsi(new double[]{1, 2, 3, 4, 5});
        assertEquals(100.0, rsi[4], 1e-12);
    }

    @Test
    void findPivots_requiresStrictDomination() {
        double[] high = {1, 2, 3, 9, 3, 2, 1, 2, 3, 3, 2, 1, 0};
        double[] low = {0.5, 1.5, 2.5, 8, 2.5, 1.5, 0.2, 1.5, 2.5, 2.5, 1.5, 0.5, -1};

        List<Pivot> pivots = TechnicalIndicators.findPivots(high, low, 3);

        assertEquals(2, pivots.size());
        assertEquals(new Pivot(3, 9, Pivot.Type.HIGH), pivots.get(0));
        assertEquals(new Pivot(6, 0.2, Pivot.Type.LOW), pivots.get(1));
        // равные вершины на 8 и 9 не дают пивот
    }

    @Test
    void lastSwing_lowThenHigh_isUp() {
        List<Pivot> pivots = List.of(
                new Pivot(5, 90, Pivot.Type.HIGH),
                new Pivot(10, 100, Pivot.Type.LOW),
                new Pivot(20, 120, Pivot.Type.HIGH));

        Optional<Swing> swing = TechnicalIndicators.lastSwing(pivots);

        assertTrue(swing.isPresent());
        assertEquals(new Swing(Swing.Direction.UP, 10, 20, 120, 100), swing.get());
    }

    @Test
    void lastSwing_sameTypeTwice_isEmpty() {
        List<Pivot> pivots = List.of(
                new Pivot(10, 100, Pivot.Type.HIGH),
                new Pivot(20, 110, Pivot.Type.HIGH));

        assertTrue(TechnicalIndicators.lastSwing(pivots).isEmpty());
        assertTrue(TechnicalIndicators.lastSwing(List.of()).isEmpty());
    }

    @Test
    void detectFvg_findsBullishAndBearishBands_andMarksFilled() {
        //            0    1    2    3    4    5
        double[] high = {105, 107, 110, 109, 104, 106};
        double[] low = {103, 104, 108, 101, 100, 104};

        List<FairValueGap> gaps = TechnicalIndicators.detectFvg(high, low);

        FairValueGap bull = gaps.get(0);
        assertTrue(bull.bullish());
        assertEquals(105, bull.bottom(), 1e-12);
        assertEquals(108, bull.top(), 1e-12);
        assertEquals(2, bull.index());
        assertTrue(bull.filled(), "бар 3 ушёл ниже 105 — разрыв закрыт");

        FairValueGap bear = gaps.stream().filter(g -> !g.bullish()).findFirst().orElseThrow();
        assertEquals(104, bear.bottom(), 1e-12);
        assertEquals(108, bear.top(), 1e-12);
        assertEquals(4, bear.index());
        assertFalse(bear.filled());
    }

    @Test
    void fibLevel_interpolates() {
        assertEquals(107.64, TechnicalIndicators.fibLevel(120, 100, 0.618), 1e-9);
        assertEquals(104.28, TechnicalIndicators.fibLevel(120, 100, 0.786), 1e-9);
    }

    @Test
    void slope_linearSeries_andShortInput() {
        double[] line = new double[30];
        for (int i = 0; i < line.length; i++) line[i] = 3 + 2.0 * i;

        assertEquals(2.0, TechnicalIndicators.slope(line, 20), 1e-9);
        assertEquals(0.0, TechnicalIndicators.slope(new double[]{1, 2, 3}, 20));
    }

    @Test
    void computeRr_ratio_andNullOnZeroRisk() {
        assertEquals(2.0, TechnicalIndicators.computeRr(100.0, 95.0, 110.0), 1e-12);
        assertEquals(2.0, TechnicalIndicators.computeRr(100.0, 105.0, 90.0), 1e-12);
        assertNull(TechnicalIndicators.computeRr(100.0, 100.0, 110.0));
        assertNull(TechnicalIndicators.computeRr(null, 95.0, 110.0));
    }
}
