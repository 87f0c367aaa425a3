package com.chicu.signalbot.trade;

import com.chicu.signalbot.common.enums.ExecutionMode;
import com.chicu.signalbot.common.enums.TradeStatus;
import lombok.Builder;

import java.util.Locale;

/**
 * Фильтр выборки сделок, null — без фильтра.
 */
@Builder
public record TradeFilter(TradeStatus status, String symbol, ExecutionMode mode, Integer limit) {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    /** Символы хранятся в верхнем регистре. */
    public TradeFilter {
        symbol = (symbol == null || symbol.isBlank()) ? null : symbol.trim().toUpperCase(Locale.ROOT);
    }

    public static TradeFilter all() {
        return new TradeFilter(null, null, null, null);
    }

    public int effectiveLimit() {
        if (limit == null || limit <= 0) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }
}
