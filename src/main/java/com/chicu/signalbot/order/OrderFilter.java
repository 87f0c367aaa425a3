package com.chicu.signalbot.order;

import com.chicu.signalbot.common.enums.ExecutionMode;
import com.chicu.signalbot.common.enums.OrderStatus;
import lombok.Builder;

import java.util.Locale;

/**
 * Фильтр выборки ордеров, null — без фильтра.
 */
@Builder
public record OrderFilter(OrderStatus status, String symbol, ExecutionMode mode, Integer limit) {

    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    /** Символы хранятся в верхнем регистре. */
    public OrderFilter {
        symbol = (symbol == null || symbol.isBlank()) ? null : symbol.trim().toUpperCase(Locale.ROOT);
    }

    public static OrderFilter all() {
        return new OrderFilter(null, null, null, null);
    }

    public int effectiveLimit() {
        if (limit == null || limit <= 0) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }
}
