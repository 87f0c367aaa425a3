package com.chicu.signalbot.engine;

import com.chicu.signalbot.common.TickReport;
import com.chicu.signalbot.common.enums.ExecutionMode;
import com.chicu.signalbot.signal.ScanReport;
import lombok.Builder;

import java.time.Duration;
import java.time.Instant;

/**
 * Снимок состояния движка для хоста.
 */
@Builder
public record EngineStatus(
        boolean running,
        Instant startedAt,
        Duration uptime,
        ExecutionMode mode,
        Stats stats,
        ScanReport lastScan,
        TickReport lastOrderTick,
        TickReport lastTradeTick
) {

    @Builder
    public record Stats(
            int activeSignals,
            long pendingOrders,
            long openTrades,
            long scans,
            long promotedSignals,
            long skippedTicks
    ) {
    }
}
