package com.chicu.signalbot.trade.impl;

import com.chicu.signalbot.common.TickReport;
import com.chicu.signalbot.common.UserNote;
import com.chicu.signalbot.common.enums.CloseReason;
import com.chicu.signalbot.common.enums.TradeSide;
import com.chicu.signalbot.common.enums.TradeStatus;
import com.chicu.signalbot.common.exception.InvalidTransitionException;
import com.chicu.signalbot.common.exception.NotFoundException;
import com.chicu.signalbot.config.SignalBotProperties;
import com.chicu.signalbot.domain.OrderEntity;
import com.chicu.signalbot.domain.TradeEntity;
import com.chicu.signalbot.guard.PriceSanityGuard;
import com.chicu.signalbot.journal.LifecycleJournal;
import com.chicu.signalbot.market.PriceBatch;
import com.chicu.signalbot.market.PriceCache;
import com.chicu.signalbot.market.PriceFetcher;
import com.chicu.signalbot.repository.TradeRepository;
import com.chicu.signalbot.trade.EquityPoint;
import com.chicu.signalbot.trade.ExitDecision;
import com.chicu.signalbot.trade.PerformanceCalculator;
import com.chicu.signalbot.trade.TradeFilter;
import com.chicu.signalbot.trade.TradeLifecycleService;
import com.chicu.signalbot.trade.TradeStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class TradeLifecycleServiceImpl implements TradeLifecycleService {

    private static final String KIND = "trade-monitor";

    private final TradeRepository tradeRepository;
    private final PriceFetcher priceFetcher;
    private final PriceSanityGuard guard;
    private final LifecycleJournal journal;
    private final SignalBotProperties properties;

    // =====================================================
    // OPEN
    // =====================================================

    @Override
    public TradeEntity openFromOrder(OrderEntity order, double fillPrice, Instant now) {
        if (order.getId() != null) {
            Optional<TradeEntity> existing = tradeRepository.findByOrderId(order.getId());
            if (existing.isPresent()) {
                log.info("♻️ [TRADE] order #{} already has trade #{}", order.getId(), existing.get().getId());
                return existing.get();
            }
        }

        guard.checkLevels(order.getSide(), fillPrice, order.getStop(), order.getTake())
                .throwIfFailed("Trade levels for order #" + order.getId());

        TradeEntity trade = TradeEntity.builder()
                .orderId(order.getId())
                .symbol(order.getSymbol())
                .timeframe(order.getTimeframe())
                .side(order.getSide())
                .entry(fillPrice)
                .stop(order.getStop())
                .take(order.getTake())
                .size(order.getSize())
                .mode(order.getMode())
                .executor(order.getExecutor())
                .status(TradeStatus.OPEN)
                .openedAt(now)
                .build();

        TradeEntity saved = tradeRepository.save(trade);
        journal.tradeTransition(saved, null, "order_filled", fillPrice, now);

        log.info("🟢 [TRADE] opened #{} {} {} entry={} stop={} take={} size={}",
                saved.getId(), saved.getSymbol(), saved.getSide(),
                saved.getEntry(), saved.getStop(), saved.getTake(), saved.getSize());
        return saved;
    }

    // =====================================================
    // MONITOR
    // =====================================================

    @Override
    public TickReport monitorTick(Instant now, PriceCache priceCache) {
        List<TradeEntity> open = tradeRepository.findByStatusOrderByOpenedAtAsc(TradeStatus.OPEN);
        if (open.isEmpty()) {
            return TickReport.empty(KIND, now);
        }

        PriceBatch batch = priceFetcher.fetch(open.stream().map(TradeEntity::getSymbol).collect(Collectors.toList()));
        priceCache.recordAll(batch.prices(), now);

        int transitions = 0;
        List<String> errors = new ArrayList<>();

        for (TradeEntity trade : open) {
            try {
                Optional<ExitDecision> decision = decide(trade, batch, priceCache, now);
                if (decision.isEmpty()) {
                    if (batch.price(trade.getSymbol()).isEmpty()) {
                        errors.add("#" + trade.getId() + " " + trade.getSymbol() + ": " + batch.failure(trade.getSymbol()));
                    }
                    continue;
                }
                close(trade, decision.get(), now);
                transitions++;
            } catch (DataAccessException | IllegalArgumentException e) {
                errors.add("#" + trade.getId() + ": " + e.getMessage());
                log.warn("⚠️ [TRADE] #{} not processed, retry next tick: {}", trade.getId(), e.getMessage());
            }
        }

        TickReport report = new TickReport(KIND, now, open.size(), transitions, errors.size(), errors);
        log.info("📊 [TRADE] {}", report.summary());
        return report;
    }

    private Optional<ExitDecision> decide(TradeEntity trade, PriceBatch batch, PriceCache cache, Instant now) {
        Optional<Double> price = batch.price(trade.getSymbol());
        if (price.isPresent()) {
            return evaluateExit(trade, price.get(), now);
        }
        // цены нет: по TTL закрываем по последней наблюдённой
        if (isStale(trade, now)) {
            return cache.last(trade.getSymbol())
                    .map(q -> new ExitDecision(CloseReason.TTL, q.price()));
        }
        return Optional.empty();
    }

    @Override
    public Optional<ExitDecision> evaluateExit(TradeEntity trade, double price, Instant now) {
        if (!trade.isOpen()) {
            return Optional.empty();
        }
        if (trade.getSide() == TradeSide.LONG) {
            if (price <= trade.getStop()) return Optional.of(new ExitDecision(CloseReason.STOP, trade.getStop()));
            if (price >= trade.getTake()) return Optional.of(new ExitDecision(CloseReason.TAKE, trade.getTake()));
        } else {
            if (price >= trade.getStop()) return Optional.of(new ExitDecision(CloseReason.STOP, trade.getStop()));
            if (price <= trade.getTake()) return Optional.of(new ExitDecision(CloseReason.TAKE, trade.getTake()));
        }
        if (isStale(trade, now)) {
            return Optional.of(new ExitDecision(CloseReason.TTL, price));
        }
        return Optional.empty();
    }

    private boolean isStale(TradeEntity trade, Instant now) {
        Duration ttl = properties.getTrades().getTtl();
        return Duration.between(trade.getOpenedAt(), now).compareTo(ttl) > 0;
    }

    // =====================================================
    // CLOSE
    // =====================================================

    @Override
    public TradeEntity closeTrade(Long tradeId, double exitPrice, String reason, Instant now) {
        TradeEntity trade = getTrade(tradeId);
        if (!trade.isOpen()) {
            throw new InvalidTransitionException("Trade #" + tradeId + " is already " + trade.getStatus());
        }
        guard.checkExit(trade.getEntry(), exitPrice).throwIfFailed("Exit price for trade #" + tradeId);

        String note = UserNote.normalize(reason);
        return close(trade, new ExitDecision(CloseReason.MANUAL, exitPrice), note, now);
    }

    private TradeEntity close(TradeEntity trade, ExitDecision decision, Instant now) {
        return close(trade, decision, null, now);
    }

    private TradeEntity close(TradeEntity trade, ExitDecision decision, String note, Instant now) {
        String reasonCode = decision.reason().code();
        double exit = decision.price();
        Double r = PerformanceCalculator.realizedR(trade.getSide(), trade.getEntry(), trade.getStop(), exit);
        double pnl = PerformanceCalculator.pnl(
                properties.getTrades().getAccountingMode(),
                r,
                properties.getRisk().getRiskPerTrade(),
                trade.getSide(),
                trade.getEntry(),
                exit,
                trade.getSize()
        );

        TradeEntity closed = trade.toBuilder()
                .status(TradeStatus.CLOSED)
                .exit(exit)
                .closedAt(now)
                .closeReason(reasonCode)
                .closeNote(note)
                .realizedR(r)
                .pnl(pnl)
                .build();

        TradeEntity saved = tradeRepository.save(closed);
        journal.tradeTransition(saved, TradeStatus.OPEN.name(), reasonCode, exit, now);

        log.info("{} [TRADE] closed #{} {} {} reason={} exit={} R={} pnl={}",
                pnl >= 0 ? "✅" : "🔻", saved.getId(), saved.getSymbol(), saved.getSide(),
                reasonCode, exit, r, pnl);
        return saved;
    }

    // =====================================================
    // QUERIES
    // =====================================================

    @Override
    public List<TradeEntity> getTrades(TradeFilter filter) {
        TradeFilter f = filter != null ? filter : TradeFilter.all();
        return tradeRepository.search(f.status(), f.symbol(), f.mode(), PageRequest.of(0, f.effectiveLimit()));
    }

    @Override
    public TradeEntity getTrade(Long id) {
        return tradeRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Trade #" + id + " not found"));
    }

    @Override
    public TradeStats getStats(TradeFilter filter) {
        TradeFilter f = filter != null ? filter : TradeFilter.all();
        SignalBotProperties.Risk risk = properties.getRisk();
        return TradeStats.of(tradeRepository.search(f.status(), f.symbol(), f.mode(), Pageable.unpaged()),
                risk.getInitialCapital(), risk.getRiskPerTrade());
    }

    @Override
    public List<EquityPoint> getEquityCurve(TradeFilter filter) {
        TradeFilter f = filter != null ? filter : TradeFilter.all();
        SignalBotProperties.Risk risk = properties.getRisk();
        return PerformanceCalculator.equityCurve(
                tradeRepository.search(TradeStatus.CLOSED, f.symbol(), f.mode(), Pageable.unpaged()),
                risk.getInitialCapital(), risk.getRiskPerTrade());
    }
}
