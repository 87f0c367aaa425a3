package com.chicu.signalbot.trade;

import com.chicu.signalbot.common.enums.PnlAccountingMode;
import com.chicu.signalbot.common.enums.TradeSide;
import com.chicu.signalbot.common.enums.TradeStatus;
import com.chicu.signalbot.domain.TradeEntity;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PerformanceCalculatorTest {

    @Test
    void realizedR_isSigned() {
        assertEquals(2.0, PerformanceCalculator.realizedR(TradeSide.LONG, 100, 95, 110), 1e-12);
        assertEquals(-1.0, PerformanceCalculator.realizedR(TradeSide.LONG, 100, 95, 95), 1e-12);
        assertEquals(2.0, PerformanceCalculator.realizedR(TradeSide.SHORT, 100, 105, 90), 1e-12);
        assertEquals(-0.5, PerformanceCalculator.realizedR(TradeSide.SHORT, 100, 104, 102), 1e-12);
        assertNull(PerformanceCalculator.realizedR(TradeSide.LONG, 100, 100, 110));
    }

    @Test
    void pnl_rMultiple_scalesByRiskPerTrade() {
        assertEquals(250.0, PerformanceCalculator.pnl(PnlAccountingMode.R_MULTIPLE, 2.5, 100,
                TradeSide.LONG, 100, 125, 1), 1e-12);
        assertEquals(0.0, PerformanceCalculator.pnl(PnlAccountingMode.R_MULTIPLE, null, 100,
                TradeSide.LONG, 100, 125, 1));
    }

    @Test
    void pnl_percent_usesNotional() {
        // 10% от номинала 2 × 100
        assertEquals(20.0, PerformanceCalculator.pnl(PnlAccountingMode.PERCENT, 2.0, 100,
                TradeSide.LONG, 100, 110, 2), 1e-9);
        assertEquals(-20.0, PerformanceCalculator.pnl(PnlAccountingMode.PERCENT, -2.0, 100,
                TradeSide.SHORT, 100, 110, 2), 1e-9);
    }

    @Test
    void equityCurve_runsInCloseOrder_andSkipsOpenOrUnscoredTrades() {
        Instant t0 = Instant.parse("2024-03-01T10:00:00Z");
        List<EquityPoint> curve = PerformanceCalculator.equityCurve(List.of(
                TradeEntity.builder().id(2L).status(TradeStatus.CLOSED).realizedR(-1.0).closedAt(t0.plusSeconds(60)).build(),
                TradeEntity.builder().id(1L).status(TradeStatus.CLOSED).realizedR(2.0).closedAt(t0).build(),
                TradeEntity.builder().id(3L).status(TradeStatus.CLOSED).closedAt(t0.plusSeconds(120)).build(),
                TradeEntity.builder().id(4L).status(TradeStatus.OPEN).build()
        ), 5000, 100);

        assertEquals(2, curve.size());
        assertEquals(1L, curve.get(0).tradeId());
        assertEquals(5200.0, curve.get(0).equity(), 1e-9);
        assertEquals(1.0, curve.get(1).runningR(), 1e-9);
        assertEquals(5100.0, curve.get(1).equity(), 1e-9);
        assertEquals(100.0, PerformanceCalculator.maxDrawdown(curve, 5000), 1e-9);
    }
}
