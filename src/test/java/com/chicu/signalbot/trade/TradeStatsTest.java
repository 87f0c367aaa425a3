package com.chicu.signalbot.trade;

import com.chicu.signalbot.common.enums.TradeStatus;
import com.chicu.signalbot.domain.TradeEntity;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TradeStatsTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Test
    void metricsCountClosedTradesOnly() {
        TradeStats stats = TradeStats.of(List.of(
                closed(1L, 200.0, 2.0, 1),
                closed(2L, -100.0, -1.0, 2),
                closed(3L, 50.0, 0.5, 3),
                TradeEntity.builder().status(TradeStatus.OPEN).build()), 5000, 100);

        assertEquals(3, stats.totalTrades());
        assertEquals(2, stats.winningTrades());
        assertEquals(1, stats.losingTrades());
        assertEquals(66.666, stats.winRate(), 1e-3);
        assertEquals(150.0, stats.totalPnl(), 1e-9);
        assertEquals(50.0, stats.avgPnl(), 1e-9);
        assertEquals(0.5, stats.avgR(), 1e-9);
        assertEquals(1, stats.openTrades());
    }

    @Test
    void equityDrawdownExpectancyAndProfitFactor() {
        // порядок в списке перемешан: кривая строится по closedAt
        TradeStats stats = TradeStats.of(List.of(
                closed(2L, -100.0, -1.0, 2),
                closed(1L, 200.0, 2.0, 1),
                closed(4L, 100.0, 1.0, 4),
                closed(3L, -100.0, -1.0, 3)), 5000, 100);

        assertEquals(1.0, stats.totalR(), 1e-9);
        assertEquals(5100.0, stats.equity(), 1e-9, "5000 + 1R × 100");
        assertEquals(200.0, stats.maxDrawdown(), 1e-9, "пик 5200 → дно 5000");
        assertEquals(200.0 / 5200 * 100, stats.maxDrawdownPct(), 1e-9);
        assertEquals(1.5, stats.profitFactor(), 1e-9, "300 прибыли / 200 убытка");
        assertEquals(0.25, stats.expectancyR(), 1e-9, "0.5 × 1.5R − 0.5 × 1R");
    }

    @Test
    void noLosses_profitFactorIsUndefined() {
        TradeStats stats = TradeStats.of(List.of(closed(1L, 200.0, 2.0, 1)), 5000, 100);

        assertNull(stats.profitFactor());
        assertEquals(0.0, stats.maxDrawdown());
        assertEquals(5200.0, stats.equity(), 1e-9);
    }

    @Test
    void emptyListIsAllZeros() {
        TradeStats stats = TradeStats.of(List.of(), 5000, 100);

        assertEquals(0, stats.totalTrades());
        assertEquals(0.0, stats.winRate());
        assertEquals(0.0, stats.avgR());
        assertEquals(5000.0, stats.equity(), "без сделок капитал равен начальному");
        assertEquals(0.0, stats.expectancyR());
    }

    private static TradeEntity closed(Long id, double pnl, double r, int hour) {
        return TradeEntity.builder()
                .id(id)
                .symbol("BTCUSDT")
                .status(TradeStatus.CLOSED)
                .pnl(pnl)
                .realizedR(r)
                .closedAt(T0.plusSeconds(3600L * hour))
                .build();
    }
}
