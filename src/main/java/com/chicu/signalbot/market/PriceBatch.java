package com.chicu.signalbot.market;

import java.util.Map;
import java.util.Optional;

/**
 * Цены одного тика: что удалось получить и что упало.
 */
public record PriceBatch(Map<String, Double> prices, Map<String, String> failures) {

    public PriceBatch {
        prices = prices == null ? Map.of() : Map.copyOf(prices);
        failures = failures == null ? Map.of() : Map.copyOf(failures);
    }

    public Optional<Double> price(String symbol) {
        return Optional.ofNullable(prices.get(symbol));
    }

    public String failure(String symbol) {
        return failures.get(symbol);
    }
}
