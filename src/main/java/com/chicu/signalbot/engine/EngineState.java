package com.chicu.signalbot.engine;

import com.chicu.signalbot.common.TickReport;
import com.chicu.signalbot.market.PriceCache;
import com.chicu.signalbot.signal.ScanResult;
import com.chicu.signalbot.signal.ScanReport;
import com.chicu.signalbot.signal.Signal;
import lombok.Getter;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Состояние одного запуска движка.
 * Создаётся в start(), выбрасывается в stop(); пишут только тики, читатели получают снимки.
 */
@Getter
public class EngineState {

    private final Instant startedAt;
    private final PriceCache priceCache = new PriceCache();

    private volatile List<Signal> lastSignals = List.of();
    private volatile ScanReport lastScan;
    private volatile TickReport lastOrderTick;
    private volatile TickReport lastTradeTick;

    private final AtomicLong scans = new AtomicLong();
    private final AtomicLong promoted = new AtomicLong();

    public EngineState(Instant startedAt) {
        this.startedAt = startedAt;
    }

    void publishScan(ScanResult result) {
        this.lastSignals = List.copyOf(result.signals());
        this.lastScan = result.report();
        scans.incrementAndGet();
    }

    void publishOrderTick(TickReport report) {
        this.lastOrderTick = report;
    }

    void publishTradeTick(TickReport report) {
        this.lastTradeTick = report;
    }

    void countPromotion() {
        promoted.incrementAndGet();
    }
}
