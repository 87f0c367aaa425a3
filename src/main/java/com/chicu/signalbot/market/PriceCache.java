package com.chicu.signalbot.market;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Последние наблюдённые цены по символам.
 * Живёт в состоянии движка: создаётся при старте, выбрасывается при остановке.
 */
public class PriceCache {

    public record Quote(double price, Instant observedAt) {
    }

    private final Map<String, Quote> quotes = new ConcurrentHashMap<>();

    public void record(String symbol, double price, Instant at) {
        quotes.put(symbol, new Quote(price, at));
    }

    public void recordAll(Map<String, Double> prices, Instant at) {
        prices.forEach((s, p) -> record(s, p, at));
    }

    public Optional<Quote> last(String symbol) {
        return Optional.ofNullable(quotes.get(symbol));
    }

    public Map<String, Quote> snapshot() {
        return Map.copyOf(quotes);
    }

    public int size() {
        return quotes.size();
    }
}
