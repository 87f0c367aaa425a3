package com.chicu.signalbot.order;

import com.chicu.signalbot.domain.OrderEntity;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Счётчики ордеров по статусу, режиму, исполнителю и символу.
 */
public record OrderStats(
        int total,
        Map<String, Integer> byStatus,
        Map<String, Integer> byMode,
        Map<String, Integer> byExecutor,
        Map<String, Integer> bySymbol
) {

    public static OrderStats of(List<OrderEntity> orders) {
        Map<String, Integer> byStatus = new TreeMap<>();
        Map<String, Integer> byMode = new TreeMap<>();
        Map<String, Integer> byExecutor = new TreeMap<>();
        Map<String, Integer> bySymbol = new TreeMap<>();

        for (OrderEntity o : orders) {
            byStatus.merge(o.getStatus().name(), 1, Integer::sum);
            byMode.merge(o.getMode().name(), 1, Integer::sum);
            byExecutor.merge(o.getExecutor(), 1, Integer::sum);
            bySymbol.merge(o.getSymbol(), 1, Integer::sum);
        }
        return new OrderStats(orders.size(), byStatus, byMode, byExecutor, bySymbol);
    }
}
