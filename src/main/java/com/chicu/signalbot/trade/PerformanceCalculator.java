package com.chicu.signalbot.trade;

import com.chicu.signalbot.common.enums.PnlAccountingMode;
import com.chicu.signalbot.common.enums.TradeSide;
import com.chicu.signalbot.domain.TradeEntity;
import lombok.experimental.UtilityClass;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@UtilityClass
public class PerformanceCalculator {

    /**
     * ((exit − entry) × dir) / |entry − stop|. null при нулевом риске.
     */
    public static Double realizedR(TradeSide side, double entry, double stop, double exit) {
        double risk = Math.abs(entry - stop);
        if (risk == 0 || !Double.isFinite(risk)) {
            return null;
        }
        return (exit - entry) * side.direction() / risk;
    }

    /**
     * R_MULTIPLE: R × риск на сделку.
     * PERCENT: доля движения × номинал позиции (size × entry).
     */
    public static double pnl(PnlAccountingMode mode, Double realizedR, double riskPerTrade,
                             TradeSide side, double entry, double exit, double size) {
        if (mode == PnlAccountingMode.PERCENT) {
            if (entry == 0) {
                return 0;
            }
            double pct = (exit - entry) / entry * side.direction();
            return pct * size * entry;
        }
        return realizedR == null ? 0 : realizedR * riskPerTrade;
    }

    /**
     * Кривая капитала по закрытым сделкам с R, в порядке закрытия.
     * equity = initialCapital + ΣR × riskPerTrade.
     */
    public static List<EquityPoint> equityCurve(List<TradeEntity> trades, double initialCapital, double riskPerTrade) {
        List<TradeEntity> closed = new ArrayList<>();
        for (TradeEntity t : trades) {
            if (!t.isOpen() && t.getRealizedR() != null) {
                closed.add(t);
            }
        }
        closed.sort(Comparator.comparing(TradeEntity::getClosedAt, Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
                .thenComparing(TradeEntity::getId, Comparator.nullsLast(Comparator.<Long>naturalOrder())));

        List<EquityPoint> curve = new ArrayList<>(closed.size());
        double runningR = 0;
        for (TradeEntity t : closed) {
            runningR += t.getRealizedR();
            curve.add(new EquityPoint(t.getClosedAt(), t.getId(), t.getSymbol(),
                    t.getRealizedR(), runningR, initialCapital + runningR * riskPerTrade));
        }
        return curve;
    }

    /** Максимальная просадка от пика, в валюте. Стартовый пик — initialCapital. */
    public static double maxDrawdown(List<EquityPoint> curve, double initialCapital) {
        double peak = initialCapital;
        double maxDd = 0;
        for (EquityPoint p : curve) {
            peak = Math.max(peak, p.equity());
            maxDd = Math.max(maxDd, peak - p.equity());
        }
        return maxDd;
    }
}
