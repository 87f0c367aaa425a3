package com.chicu.signalbot.indicators;

/**
 * Трёхсвечной разрыв (FVG).
 *
 * Бычий: low[i] > high[i-2], полоса [high[i-2], low[i]].
 * Медвежий: high[i] < low[i-2], полоса [high[i], low[i-2]].
 *
 * @param bullish полярность
 * @param bottom  нижняя граница полосы
 * @param top     верхняя граница полосы
 * @param index   бар, на котором разрыв сформировался (i)
 * @param filled  true, если какой-то более поздний бар прошёл дальнюю границу
 */
public record FairValueGap(boolean bullish, double bottom, double top, int index, boolean filled) {

    public boolean contains(double price) {
        return price >= bottom && price <= top;
    }

    /** Пересекается ли полоса с диапазоном [lo, hi]. */
    public boolean overlaps(double lo, double hi) {
        return bottom <= hi && top >= lo;
    }

    /** Дальняя граница: за ней разрыв считается закрытым. */
    public double farEdge() {
        return bullish ? bottom : top;
    }
}
