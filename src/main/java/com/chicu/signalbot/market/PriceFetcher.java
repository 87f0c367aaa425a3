package com.chicu.signalbot.market;

import com.chicu.signalbot.config.SignalBotProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Параллельная загрузка текущих цен: одна задача на символ.
 * Результат собирается только после завершения (или таймаута) всех задач.
 */
@Slf4j
@Component
public class PriceFetcher {

    private final MarketDataProvider marketData;
    private final ExecutorService fetchExecutor;
    private final long timeoutNanos;

    public PriceFetcher(MarketDataProvider marketData,
                        @Qualifier("marketFetchExecutor") ExecutorService fetchExecutor,
                        SignalBotProperties properties) {
        this.marketData = marketData;
        this.fetchExecutor = fetchExecutor;
        this.timeoutNanos = properties.getScan().getFetchTimeout().toNanos();
    }

    public PriceBatch fetch(Collection<String> symbols) {
        Map<String, Future<Double>> futures = new LinkedHashMap<>();
        for (String symbol : new LinkedHashSet<>(symbols)) {
            futures.put(symbol, fetchExecutor.submit(() -> marketData.getCurrentPrice(symbol)));
        }

        long deadline = System.nanoTime() + timeoutNanos;
        Map<String, Double> prices = new LinkedHashMap<>();
        Map<String, String> failures = new LinkedHashMap<>();

        for (Map.Entry<String, Future<Double>> e : futures.entrySet()) {
            String symbol = e.getKey();
            try {
                long wait = Math.max(0, deadline - System.nanoTime());
                prices.put(symbol, e.getValue().get(wait, TimeUnit.NANOSECONDS));
            } catch (TimeoutException ex) {
                e.getValue().cancel(true);
                failures.put(symbol, "timeout");
                log.warn("⏳ [PRICE] {} timed out", symbol);
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                failures.put(symbol, String.valueOf(cause.getMessage()));
                log.warn("⚠️ [PRICE] {} unavailable: {}", symbol, cause.getMessage());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                futures.values().forEach(f -> f.cancel(true));
                throw new IllegalStateException("Price fetch interrupted", ex);
            }
        }
        return new PriceBatch(prices, failures);
    }
}
