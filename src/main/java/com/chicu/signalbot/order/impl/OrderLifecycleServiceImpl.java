package com.chicu.signalbot.order.impl;

import com.chicu.signalbot.common.TickReport;
import com.chicu.signalbot.common.UserNote;
import com.chicu.signalbot.common.enums.ExecutionMode;
import com.chicu.signalbot.common.enums.OrderStatus;
import com.chicu.signalbot.common.enums.TradeSide;
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
import com.chicu.signalbot.order.OrderFilter;
import com.chicu.signalbot.order.OrderLifecycleService;
import com.chicu.signalbot.order.OrderRequest;
import com.chicu.signalbot.order.OrderStats;
import com.chicu.signalbot.order.PromotionPolicy;
import com.chicu.signalbot.repository.OrderRepository;
import com.chicu.signalbot.repository.TradeRepository;
import com.chicu.signalbot.signal.Signal;
import com.chicu.signalbot.trade.TradeLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class OrderLifecycleServiceImpl implements OrderLifecycleService {

    private static final String KIND = "order-monitor";

    static final String REASON_CREATED = "created";
    static final String REASON_TTL = "ttl";
    static final String REASON_TOUCHED = "price_touched_entry";
    static final String REASON_RECONCILED = "reconciled_existing_trade";
    static final String REASON_MANUAL = "manual";

    private final OrderRepository orderRepository;
    private final TradeRepository tradeRepository;
    private final TradeLifecycleService tradeLifecycle;
    private final PriceFetcher priceFetcher;
    private final PriceSanityGuard guard;
    private final PromotionPolicy promotionPolicy;
    private final LifecycleJournal journal;
    private final SignalBotProperties properties;

    // =====================================================
    // CREATE
    // =====================================================

    @Override
    public OrderEntity createOrder(OrderRequest request, Instant now) {
        if (request == null || request.symbol() == null || request.symbol().isBlank()) {
            throw new IllegalArgumentException("symbol is required");
        }
        guard.checkLevels(request.side(), request.entry(), request.stop(), request.take())
                .throwIfFailed("Order levels");

        double size = request.size() != null
                ? request.size()
                : promotionPolicy.positionSize(request.entry(), request.stop(), properties.getRisk().getRiskPerTrade());
        if (!(size > 0) || !Double.isFinite(size)) {
            throw new IllegalArgumentException("size must be > 0, got " + size);
        }

        ExecutionMode mode = request.mode() != null ? request.mode() : ExecutionMode.SUPERVISED;

        OrderEntity order = OrderEntity.builder()
                .signalId(request.signalId())
                .symbol(request.symbol().trim().toUpperCase(Locale.ROOT))
                .timeframe(request.timeframe())
                .side(request.side())
                .entry(request.entry())
                .stop(request.stop())
                .take(request.take())
                .size(size)
                .status(OrderStatus.PENDING)
                .mode(mode)
                .executor(mode.getExecutor())
                .statusReason(REASON_CREATED)
                .statusChangedAt(now)
                .createdAt(now)
                .expiresAt(now.plus(properties.orderTtl(request.timeframe())))
                .build();

        OrderEntity saved = orderRepository.save(order);
        journal.orderTransition(saved, null, REASON_CREATED, saved.getEntry(), now);

        log.info("📝 [ORDER] created #{} {} {} {} entry={} stop={} take={} size={} mode={} expiresAt={}",
                saved.getId(), saved.getSymbol(), saved.getTimeframe(), saved.getSide(),
                saved.getEntry(), saved.getStop(), saved.getTake(), saved.getSize(),
                saved.getMode(), saved.getExpiresAt());
        return saved;
    }

    @Override
    public OrderEntity promote(Signal signal, ExecutionMode mode, Instant now) {
        if (signal == null) {
            throw new IllegalArgumentException("signal is required");
        }
        return createOrder(OrderRequest.builder()
                .signalId(signal.id())
                .symbol(signal.symbol())
                .timeframe(signal.timeframe())
                .side(signal.side())
                .entry(signal.entry())
                .stop(signal.stop())
                .take(signal.take())
                .mode(mode)
                .build(), now);
    }

    // =====================================================
    // CANCEL
    // =====================================================

    @Override
    public OrderEntity cancel(Long orderId, String reason, Instant now) {
        OrderEntity order = getOrder(orderId);
        if (!order.isPending()) {
            throw new InvalidTransitionException("Order #" + orderId + " is already " + order.getStatus());
        }
        String note = UserNote.normalize(reason);
        OrderEntity canceled = transition(order.toBuilder().note(note).build(),
                OrderStatus.CANCELED, REASON_MANUAL, null, now);
        log.info("🛑 [ORDER] canceled #{} {} note={}", canceled.getId(), canceled.getSymbol(), note);
        return canceled;
    }

    // =====================================================
    // MONITOR
    // =====================================================

    @Override
    public TickReport monitorTick(Instant now, PriceCache priceCache) {
        List<OrderEntity> pending = orderRepository.findByStatusOrderByCreatedAtAsc(OrderStatus.PENDING);
        if (pending.isEmpty()) {
            return TickReport.empty(KIND, now);
        }

        int transitions = 0;
        List<String> errors = new ArrayList<>();
        List<OrderEntity> awaitingPrice = new ArrayList<>();

        // 1) сверка и TTL: цена не нужна
        for (OrderEntity order : pending) {
            try {
                Optional<TradeEntity> existing = tradeRepository.findByOrderId(order.getId());
                if (existing.isPresent()) {
                    markFilled(order, existing.get().getEntry(), REASON_RECONCILED, now);
                    transitions++;
                } else if (order.isExpiredAt(now)) {
                    transition(order, OrderStatus.EXPIRED, REASON_TTL, null, now);
                    log.info("⌛ [ORDER] expired #{} {} (ttl={})", order.getId(), order.getSymbol(), order.ttl());
                    transitions++;
                } else {
                    awaitingPrice.add(order);
                }
            } catch (DataAccessException e) {
                errors.add("#" + order.getId() + ": " + e.getMessage());
                log.warn("⚠️ [ORDER] #{} not processed, retry next tick: {}", order.getId(), e.getMessage());
            }
        }

        // 2) касание цены входа
        if (!awaitingPrice.isEmpty()) {
            PriceBatch batch = priceFetcher.fetch(
                    awaitingPrice.stream().map(OrderEntity::getSymbol).collect(Collectors.toList()));
            priceCache.recordAll(batch.prices(), now);

            for (OrderEntity order : awaitingPrice) {
                Optional<Double> price = batch.price(order.getSymbol());
                if (price.isEmpty()) {
                    errors.add("#" + order.getId() + " " + order.getSymbol() + ": " + batch.failure(order.getSymbol()));
                    continue;
                }
                if (!touchedEntry(order, price.get())) {
                    continue;
                }
                try {
                    fill(order, now);
                    transitions++;
                } catch (DataAccessException | IllegalArgumentException e) {
                    errors.add("#" + order.getId() + ": " + e.getMessage());
                    log.warn("⚠️ [ORDER] #{} fill failed, stays PENDING: {}", order.getId(), e.getMessage());
                }
            }
        }

        TickReport report = new TickReport(KIND, now, pending.size(), transitions, errors.size(), errors);
        log.info("📊 [ORDER] {}", report.summary());
        return report;
    }

    static boolean touchedEntry(OrderEntity order, double price) {
        return order.getSide() == TradeSide.LONG
                ? price <= order.getEntry()
                : price >= order.getEntry();
    }

    /**
     * Исполнение: сначала сделка, потом статус ордера.
     * Если сделка не создалась — ордер остаётся PENDING.
     * Если упала запись ордера — следующий тик найдёт сделку и только отметит ордер.
     */
    private void fill(OrderEntity order, Instant now) {
        TradeEntity trade = tradeLifecycle.openFromOrder(order, order.getEntry(), now);
        markFilled(order, trade.getEntry(), REASON_TOUCHED, now);
    }

    private void markFilled(OrderEntity order, double fillPrice, String reason, Instant now) {
        OrderEntity filled = order.toBuilder()
                .status(OrderStatus.FILLED)
                .filledAt(now)
                .fillPrice(fillPrice)
                .statusReason(reason)
                .statusChangedAt(now)
                .build();
        OrderEntity saved = orderRepository.save(filled);
        journal.orderTransition(saved, OrderStatus.PENDING.name(), reason, fillPrice, now);
        log.info("✅ [ORDER] filled #{} {} {} at {} ({})",
                saved.getId(), saved.getSymbol(), saved.getSide(), fillPrice, reason);
    }

    private OrderEntity transition(OrderEntity order, OrderStatus to, String reason, Double price, Instant now) {
        OrderEntity next = order.toBuilder()
                .status(to)
                .statusReason(reason)
                .statusChangedAt(now)
                .build();
        OrderEntity saved = orderRepository.save(next);
        journal.orderTransition(saved, order.getStatus().name(), reason, price, now);
        return saved;
    }

    // =====================================================
    // QUERIES
    // =====================================================

    @Override
    public boolean hasPendingFor(Signal signal) {
        return orderRepository.existsBySymbolAndTimeframeAndSideAndStatus(
                signal.symbol(), signal.timeframe(), signal.side(), OrderStatus.PENDING);
    }

    @Override
    public List<OrderEntity> getOrders(OrderFilter filter) {
        OrderFilter f = filter != null ? filter : OrderFilter.all();
        return orderRepository.search(f.status(), f.symbol(), f.mode(), PageRequest.of(0, f.effectiveLimit()));
    }

    @Override
    public OrderEntity getOrder(Long id) {
        return orderRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Order #" + id + " not found"));
    }

    @Override
    public OrderStats getStats(OrderFilter filter) {
        OrderFilter f = filter != null ? filter : OrderFilter.all();
        return OrderStats.of(orderRepository.search(f.status(), f.symbol(), f.mode(), Pageable.unpaged()));
    }
}
