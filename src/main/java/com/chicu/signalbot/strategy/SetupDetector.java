package com.chicu.signalbot.strategy;

import com.chicu.signalbot.common.enums.StrategyTag;
import com.chicu.signalbot.common.enums.TradeSide;
import com.chicu.signalbot.common.time.Timeframe;
import com.chicu.signalbot.indicators.FairValueGap;
import com.chicu.signalbot.indicators.Pivot;
import com.chicu.signalbot.indicators.Swing;
import com.chicu.signalbot.indicators.TechnicalIndicators;
import com.chicu.signalbot.market.model.Candle;
import com.chicu.signalbot.signal.Signal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Поиск сетапов по одному (symbol, timeframe).
 *
 * Правила проверяются для каждой стороны по приоритету {@link SetupRule}.
 * Кандидат становится сигналом только если уровни лежат по правильные стороны от входа
 * и RR не ниже минимума правила.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SetupDetector {

    static final double FIB_618 = 0.618;
    static final double FIB_786 = 0.786;
    static final double FIB_500 = 0.5;
    /** Допуск над уровнем 0.618 для чистого Fib-отката, доля диапазона свинга. */
    static final double FIB_TOLERANCE = 0.01;

    static final double RSI_LONG_MIN = 40;
    static final double RSI_LONG_MAX = 70;
    static final double RSI_SHORT_MIN = 30;
    static final double RSI_SHORT_MAX = 60;
    static final double RSI_OVERSOLD = 30;
    static final double RSI_OVERBOUGHT = 70;

    static final int RECENT_BARS = 10;
    static final double FVG_REWARD_MULTIPLE = 2.0;
    static final double SR_REWARD_MULTIPLE = 2.5;
    static final double RSI_REWARD_MULTIPLE = 2.0;

    private final ConfidenceScorer scorer;

    public List<Signal> detect(String symbol, Timeframe timeframe, List<Candle> candles,
                               StrategyConfig config, Instant now) {
        if (config == null) {
            throw new IllegalArgumentException("StrategyConfig is required");
        }
        config.validate();

        if (candles == null || candles.size() < config.getMinCandles()) {
            log.debug("[SETUP] {} {}: not enough candles ({})", symbol, timeframe,
                    candles == null ? 0 : candles.size());
            return List.of();
        }

        MarketContext ctx = MarketContext.of(candles, config.getPivotLookback());
        List<Signal> out = new ArrayList<>();

        for (TradeSide side : TradeSide.values()) {
            Optional<Candidate> fibFvg = fibFvgConfluence(side, ctx, config);
            fibFvg.ifPresent(c -> accept(c, symbol, timeframe, ctx, config, now, out));

            if (fibFvg.isEmpty()) {
                fibPullback(side, ctx, config).ifPresent(c -> accept(c, symbol, timeframe, ctx, config, now, out));
            }
            fvgRetest(side, ctx, config).ifPresent(c -> accept(c, symbol, timeframe, ctx, config, now, out));
            srProximity(side, ctx, config).ifPresent(c -> accept(c, symbol, timeframe, ctx, config, now, out));
            rsiExtreme(side, ctx, config).ifPresent(c -> accept(c, symbol, timeframe, ctx, config, now, out));
        }

        if (!out.isEmpty()) {
            log.debug("[SETUP] {} {}: {} candidate(s)", symbol, timeframe, out.size());
        }
        return out;
    }

    // =====================================================
    // RULE 1: FIB + FVG
    // =====================================================

    private Optional<Candidate> fibFvgConfluence(TradeSide side, MarketContext ctx, StrategyConfig cfg) {
        if (!cfg.isFibEnabled() || !cfg.isFvgEnabled() || ctx.swing().isEmpty()) {
            return Optional.empty();
        }
        Swing swing = ctx.swing().get();
        boolean longSide = side == TradeSide.LONG;

        if (swing.isUp() != longSide || !trendAgrees(side, ctx, cfg)) {
            return Optional.empty();
        }
        if (cfg.isRsiEnabled()) {
            double min = longSide ? RSI_LONG_MIN : RSI_SHORT_MIN;
            double max = longSide ? RSI_LONG_MAX : RSI_SHORT_MAX;
            if (ctx.rsi() < min || ctx.rsi() > max) {
                return Optional.empty();
            }
        }

        FibLevels fib = FibLevels.of(swing);
        double zoneLow = Math.min(fib.l618(), fib.l786());
        double zoneHigh = Math.max(fib.l618(), fib.l786());

        if (!between(ctx.price(), fib.l786(), fib.l500())) {
            return Optional.empty();
        }

        Optional<FairValueGap> gap = ctx.lastOpenGap(longSide, g -> g.overlaps(zoneLow, zoneHigh));
        if (gap.isEmpty()) {
            return Optional.empty();
        }

        double entry = fib.l618();
        double stop = longSide
                ? ctx.minLow(swing.fromIndex(), swing.toIndex())
                : ctx.maxHigh(swing.fromIndex(), swing.toIndex());
        double take = longSide ? swing.high() : swing.low();

        Set<StrategyTag> tags = EnumSet.of(StrategyTag.FIB, StrategyTag.FVG);
        addTrendTag(tags, cfg);
        if (cfg.isRsiEnabled()) tags.add(StrategyTag.RSI);

        FairValueGap g = gap.get();
        String reason = String.format(Locale.ROOT,
                "Fib 0.618/0.786 zone %.4f-%.4f + %s FVG %.4f-%.4f, RSI %.1f",
                zoneLow, zoneHigh, longSide ? "bullish" : "bearish", g.bottom(), g.top(), ctx.rsi());

        return Optional.of(new Candidate(SetupRule.FIB_FVG, side, entry, stop, take, tags, reason, cfg.getMinRrFibFvg()));
    }

    // =====================================================
    // RULE 2: чистый Fib-откат
    // =====================================================

    private Optional<Candidate> fibPullback(TradeSide side, MarketContext ctx, StrategyConfig cfg) {
        if (!cfg.isFibEnabled() || ctx.swing().isEmpty()) {
            return Optional.empty();
        }
        Swing swing = ctx.swing().get();
        boolean longSide = side == TradeSide.LONG;
        if (swing.isUp() != longSide) {
            return Optional.empty();
        }

        FibLevels fib = FibLevels.of(swing);
        double tolerance = swing.range() * FIB_TOLERANCE;
        double edge = longSide ? fib.l618() + tolerance : fib.l618() - tolerance;
        double price = ctx.price();

        // цена внутри [0.786, 0.618 ± допуск], строго не на 0.786
        if (!between(price, fib.l786(), edge) || price == fib.l786()) {
            return Optional.empty();
        }

        Set<StrategyTag> tags = EnumSet.of(StrategyTag.FIB);
        if (trendAgrees(side, ctx, cfg)) addTrendTag(tags, cfg);

        String reason = String.format(Locale.ROOT,
                "Fib pullback to %.4f (0.618=%.4f, 0.786=%.4f)", price, fib.l618(), fib.l786());
        double take = longSide ? swing.high() : swing.low();

        return Optional.of(new Candidate(SetupRule.FIB_PULLBACK, side, price, fib.l786(), take, tags, reason, cfg.getMinRrFib()));
    }

    // =====================================================
    // RULE 3: ретест FVG по тренду
    // =====================================================

    private Optional<Candidate> fvgRetest(TradeSide side, MarketContext ctx, StrategyConfig cfg) {
        if (!cfg.isFvgEnabled() || !trendAgrees(side, ctx, cfg)) {
            return Optional.empty();
        }
        boolean longSide = side == TradeSide.LONG;
        double price = ctx.price();

        Optional<FairValueGap> gap = ctx.lastOpenGap(longSide, g -> g.contains(price) && g.farEdge() != price);
        if (gap.isEmpty()) {
            return Optional.empty();
        }

        FairValueGap g = gap.get();
        double stop = g.farEdge();
        double risk = Math.abs(price - stop);
        double take = longSide ? price + FVG_REWARD_MULTIPLE * risk : price - FVG_REWARD_MULTIPLE * risk;

        Set<StrategyTag> tags = EnumSet.of(StrategyTag.FVG);
        addTrendTag(tags, cfg);

        String reason = String.format(Locale.ROOT,
                "%s FVG retest %.4f-%.4f", longSide ? "Bullish" : "Bearish", g.bottom(), g.top());
        return Optional.of(new Candidate(SetupRule.FVG_RETEST, side, price, stop, take, tags, reason, cfg.getMinRrFvg()));
    }

    // =====================================================
    // RULE 4: близость к уровню SR
    // =====================================================

    private Optional<Candidate> srProximity(TradeSide side, MarketContext ctx, StrategyConfig cfg) {
        if (!cfg.isSrEnabled() || ctx.pivots().isEmpty()) {
            return Optional.empty();
        }
        Pivot level = ctx.pivots().get(ctx.pivots().size() - 1);
        boolean longSide = side == TradeSide.LONG;
        if (level.isLow() != longSide) {
            return Optional.empty();
        }

        double price = ctx.price();
        double distance = Math.abs(price - level.price()) / price;
        boolean rightSide = longSide ? price >= level.price() : price <= level.price();
        if (distance > cfg.getSrProximityPct() || !rightSide) {
            return Optional.empty();
        }

        int last = ctx.lastIndex();
        double stop = longSide
                ? Math.min(ctx.minLow(last - RECENT_BARS + 1, last), level.price())
                : Math.max(ctx.maxHigh(last - RECENT_BARS + 1, last), level.price());
        double risk = Math.abs(price - stop);
        double take = longSide ? price + SR_REWARD_MULTIPLE * risk : price - SR_REWARD_MULTIPLE * risk;

        Set<StrategyTag> tags = EnumSet.of(StrategyTag.SR);
        if (trendAgrees(side, ctx, cfg)) addTrendTag(tags, cfg);

        String reason = String.format(Locale.ROOT,
                "Price %.4f near %s %.4f (%.2f%%)", price, longSide ? "support" : "resistance",
                level.price(), distance * 100);
        return Optional.of(new Candidate(SetupRule.SR_PROXIMITY, side, price, stop, take, tags, reason, cfg.getMinRrSr()));
    }

    // =====================================================
    // RULE 5: экстремумы RSI против тренда
    // =====================================================

    private Optional<Candidate> rsiExtreme(TradeSide side, MarketContext ctx, StrategyConfig cfg) {
        if (!cfg.isRsiEnabled()) {
            return Optional.empty();
        }
        boolean longSide = side == TradeSide.LONG;
        boolean extreme = longSide ? ctx.rsi() < RSI_OVERSOLD : ctx.rsi() > RSI_OVERBOUGHT;
        // возврат к среднему: сигнал против текущего тренда
        boolean stretched = !cfg.isTrendEnabled() || (longSide ? ctx.trendDown() : ctx.trendUp());
        if (!extreme || !stretched) {
            return Optional.empty();
        }

        int last = ctx.lastIndex();
        double price = ctx.price();
        double stop = longSide
                ? ctx.minLow(last - RECENT_BARS + 1, last)
                : ctx.maxHigh(last - RECENT_BARS + 1, last);
        double risk = Math.abs(price - stop);
        double take = longSide ? price + RSI_REWARD_MULTIPLE * risk : price - RSI_REWARD_MULTIPLE * risk;

        String reason = String.format(Locale.ROOT, "RSI %s %.1f, mean reversion",
                longSide ? "oversold" : "overbought", ctx.rsi());
        return Optional.of(new Candidate(SetupRule.RSI_EXTREME, side, price, stop, take,
                EnumSet.of(StrategyTag.RSI), reason, cfg.getMinRrRsi()));
    }

    // =====================================================
    // ОБЩЕЕ
    // =====================================================

    private void accept(Candidate c, String symbol, Timeframe timeframe, MarketContext ctx,
                        StrategyConfig cfg, Instant now, List<Signal> out) {
        if (!geometryOk(c)) {
            log.debug("[SETUP] {} {} {} {}: bad geometry entry={} stop={} take={}",
                    symbol, timeframe, c.rule(), c.side(), c.entry(), c.stop(), c.take());
            return;
        }
        Double rr = TechnicalIndicators.computeRr(c.entry(), c.stop(), c.take());
        if (rr == null || rr < c.minRr()) {
            log.debug("[SETUP] {} {} {} {}: RR {} below {}", symbol, timeframe, c.rule(), c.side(), rr, c.minRr());
            return;
        }

        int confidence = scorer.score(c.side(), c.tags(), ctx.rsi(), rr, cfg);

        out.add(Signal.builder()
                .id(UUID.randomUUID().toString())
                .symbol(symbol)
                .timeframe(timeframe)
                .side(c.side())
                .entry(c.entry())
                .stop(c.stop())
                .take(c.take())
                .confidence(confidence)
                .tags(c.tags())
                .reason(c.rule() + ": " + c.reason())
                .createdAt(now)
                .riskReward(rr)
                .build());
    }

    private static boolean geometryOk(Candidate c) {
        if (!(c.entry() > 0) || !(c.stop() > 0) || !(c.take() > 0)
                || !Double.isFinite(c.entry()) || !Double.isFinite(c.stop()) || !Double.isFinite(c.take())) {
            return false;
        }
        return c.side() == TradeSide.LONG
                ? c.stop() < c.entry() && c.entry() < c.take()
                : c.take() < c.entry() && c.entry() < c.stop();
    }

    private static boolean trendAgrees(TradeSide side, MarketContext ctx, StrategyConfig cfg) {
        if (!cfg.isTrendEnabled()) {
            return true;
        }
        return side == TradeSide.LONG ? ctx.trendUp() : ctx.trendDown();
    }

    private static void addTrendTag(Set<StrategyTag> tags, StrategyConfig cfg) {
        if (cfg.isTrendEnabled()) {
            tags.add(StrategyTag.TREND);
        }
    }

    private static boolean between(double v, double a, double b) {
        return v >= Math.min(a, b) && v <= Math.max(a, b);
    }

    /**
     * Уровни отката для свинга: от экстремума конца свинга к его началу.
     */
    private record FibLevels(double l500, double l618, double l786) {
        static FibLevels of(Swing s) {
            double from = s.isUp() ? s.high() : s.low();
            double to = s.isUp() ? s.low() : s.high();
            return new FibLevels(
                    TechnicalIndicators.fibLevel(from, to, FIB_500),
                    TechnicalIndicators.fibLevel(from, to, FIB_618),
                    TechnicalIndicators.fibLevel(from, to, FIB_786)
            );
        }
    }

    private record Candidate(SetupRule rule, TradeSide side, double entry, double stop, double take,
                             Set<StrategyTag> tags, String reason, double minRr) {
    }
}
