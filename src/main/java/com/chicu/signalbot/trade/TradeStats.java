package com.chicu.signalbot.trade;

import com.chicu.signalbot.domain.TradeEntity;

import java.util.List;

/**
 * Сводка по сделкам. Метрики считаются по закрытым сделкам.
 *
 * @param expectancyR  winRate × avgWinR − lossRate × avgLossR, в R на сделку
 * @param profitFactor сумма прибыли / сумма убытков; null, если убыточных не было
 * @param equity       initialCapital + ΣR × riskPerTrade
 * @param maxDrawdown  просадка от пика кривой капитала, в валюте
 */
public record TradeStats(
        int totalTrades,
        int winningTrades,
        int losingTrades,
        double winRate,
        double totalPnl,
        double avgPnl,
        double avgR,
        double totalR,
        double expectancyR,
        Double profitFactor,
        double equity,
        double maxDrawdown,
        double maxDrawdownPct,
        int openTrades
) {

    public static TradeStats of(List<TradeEntity> trades, double initialCapital, double riskPerTrade) {
        int closed = 0, wins = 0, losses = 0, open = 0, withR = 0, winsR = 0, lossesR = 0;
        double totalPnl = 0, totalR = 0, grossProfit = 0, grossLoss = 0, sumWinR = 0, sumLossR = 0;

        for (TradeEntity t : trades) {
            if (t.isOpen()) {
                open++;
                continue;
            }
            closed++;
            double pnl = t.getPnl() != null ? t.getPnl() : 0;
            totalPnl += pnl;
            if (pnl > 0) {
                wins++;
                grossProfit += pnl;
            } else if (pnl < 0) {
                losses++;
                grossLoss -= pnl;
            }
            Double r = t.getRealizedR();
            if (r != null) {
                totalR += r;
                withR++;
                if (r > 0) {
                    winsR++;
                    sumWinR += r;
                } else if (r < 0) {
                    lossesR++;
                    sumLossR -= r;
                }
            }
        }

        double expectancy = 0;
        if (withR > 0) {
            double avgWin = winsR == 0 ? 0 : sumWinR / winsR;
            double avgLoss = lossesR == 0 ? 0 : sumLossR / lossesR;
            expectancy = (double) winsR / withR * avgWin - (double) lossesR / withR * avgLoss;
        }

        List<EquityPoint> curve = PerformanceCalculator.equityCurve(trades, initialCapital, riskPerTrade);
        double maxDd = PerformanceCalculator.maxDrawdown(curve, initialCapital);
        double peak = initialCapital;
        double maxDdPct = 0;
        for (EquityPoint p : curve) {
            peak = Math.max(peak, p.equity());
            if (peak > 0) {
                maxDdPct = Math.max(maxDdPct, (peak - p.equity()) / peak * 100);
            }
        }

        return new TradeStats(
                closed,
                wins,
                losses,
                closed == 0 ? 0 : wins * 100.0 / closed,
                totalPnl,
                closed == 0 ? 0 : totalPnl / closed,
                withR == 0 ? 0 : totalR / withR,
                totalR,
                expectancy,
                grossLoss == 0 ? null : grossProfit / grossLoss,
                initialCapital + totalR * riskPerTrade,
                maxDd,
                maxDdPct,
                open
        );
    }
}
