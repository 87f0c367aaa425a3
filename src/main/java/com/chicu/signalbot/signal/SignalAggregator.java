package com.chicu.signalbot.signal;

import com.chicu.signalbot.common.time.Timeframe;
import com.chicu.signalbot.market.MarketDataException;
import com.chicu.signalbot.market.MarketDataProvider;
import com.chicu.signalbot.market.model.Candle;
import com.chicu.signalbot.strategy.SetupDetector;
import com.chicu.signalbot.strategy.StrategyConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Сканер: параллельно по всем (symbol, timeframe), затем дедуп, фильтры и лимит на символ.
 *
 * Падение одной пары не останавливает проход: ошибка попадает в {@link ScanReport}.
 */
@Slf4j
@Service
public class SignalAggregator {

    private final MarketDataProvider marketData;
    private final SetupDetector detector;
    private final ExecutorService fetchExecutor;

    public SignalAggregator(MarketDataProvider marketData,
                            SetupDetector detector,
                            @Qualifier("marketFetchExecutor") ExecutorService fetchExecutor) {
        this.marketData = marketData;
        this.detector = detector;
        this.fetchExecutor = fetchExecutor;
    }

    /**
     * Полный проход сканера.
     *
     * @param klinesLimit  сколько свечей запрашивать на пару
     * @param pairTimeout  максимум ожидания одной пары
     */
    public ScanResult scan(List<String> symbols, List<Timeframe> timeframes, int klinesLimit,
                           StrategyConfig config, SignalFilter filter, Duration pairTimeout) {
        if (config == null || filter == null) {
            throw new IllegalArgumentException("config and filter are required");
        }
        config.validate();

        Instant startedAt = Instant.now();

        // =====================================================
        // FAN-OUT
        // =====================================================
        Map<String, Future<List<Signal>>> futures = new LinkedHashMap<>();
        for (String symbol : symbols) {
            for (Timeframe tf : timeframes) {
                futures.put(symbol + "/" + tf.getCode(),
                        fetchExecutor.submit(() -> analyzePair(symbol, tf, klinesLimit, config)));
            }
        }

        // =====================================================
        // MERGE (после завершения всех задач)
        // =====================================================
        long deadline = System.nanoTime() + pairTimeout.toNanos();
        List<Signal> candidates = new ArrayList<>();
        List<String> failures = new ArrayList<>();

        for (Map.Entry<String, Future<List<Signal>>> e : futures.entrySet()) {
            String pair = e.getKey();
            Future<List<Signal>> f = e.getValue();
            try {
                long waitNanos = Math.max(0, deadline - System.nanoTime());
                candidates.addAll(f.get(waitNanos, TimeUnit.NANOSECONDS));
            } catch (TimeoutException ex) {
                f.cancel(true);
                failures.add(pair + ": timeout");
                log.warn("⏳ [SCAN] {} timed out", pair);
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                failures.add(pair + ": " + cause.getMessage());
                if (cause instanceof MarketDataException) {
                    log.warn("⚠️ [SCAN] {} skipped: {}", pair, cause.getMessage());
                } else {
                    log.error("❌ [SCAN] {} analysis failed", pair, cause);
                }
            } catch (CancellationException ex) {
                failures.add(pair + ": cancelled");
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                futures.values().forEach(x -> x.cancel(true));
                throw new IllegalStateException("Scan interrupted", ex);
            }
        }

        List<Signal> signals = select(candidates, filter);

        ScanReport report = new ScanReport(
                startedAt,
                Instant.now(),
                futures.size(),
                failures.size(),
                candidates.size(),
                signals.size(),
                failures
        );
        log.info("🔎 [SCAN] {}", report.summary());
        return new ScanResult(signals, report);
    }

    private List<Signal> analyzePair(String symbol, Timeframe tf, int limit, StrategyConfig config)
            throws MarketDataException {
        List<Candle> candles = marketData.getKlines(symbol, tf, limit);
        return detector.detect(symbol, tf, candles, config, Instant.now());
    }

    // =====================================================
    // DEDUP / FILTER / CAP
    // =====================================================

    /**
     * Дедуп по (symbol, timeframe, side), затем фильтры и лимит на символ.
     * При равном createdAt остаётся сигнал, встретившийся первым.
     */
    public static List<Signal> select(List<Signal> candidates, SignalFilter filter) {
        Map<Signal.SignalKey, Signal> latest = new LinkedHashMap<>();
        for (Signal s : candidates) {
            latest.merge(s.key(), s, (prev, next) ->
                    next.createdAt().isAfter(prev.createdAt()) ? next : prev);
        }

        Map<String, List<Signal>> bySymbol = new LinkedHashMap<>();
        for (Signal s : latest.values()) {
            if (s.confidence() < filter.minConfidence() || !s.hasAnyTag(filter.tagFilter())) {
                continue;
            }
            bySymbol.computeIfAbsent(s.symbol(), k -> new ArrayList<>()).add(s);
        }

        Comparator<Signal> order = comparator(filter.ordering());
        List<Signal> out = new ArrayList<>();
        for (List<Signal> list : bySymbol.values()) {
            list.sort(order);
            int cap = filter.maxSignalsPerSymbol();
            out.addAll(cap > 0 && list.size() > cap ? list.subList(0, cap) : list);
        }
        out.sort(order);
        return out;
    }

    static Comparator<Signal> comparator(SignalOrdering ordering) {
        if (ordering == SignalOrdering.TIME) {
            return Comparator.comparing(Signal::createdAt).reversed()
                    .thenComparing(Comparator.comparingInt(Signal::confidence).reversed());
        }
        return Comparator.comparingInt(Signal::confidence).reversed()
                .thenComparing(Comparator.comparingDouble(Signal::riskReward).reversed())
                .thenComparing(Comparator.comparingInt((Signal s) -> s.timeframe().getStepSeconds()).reversed());
    }
}
