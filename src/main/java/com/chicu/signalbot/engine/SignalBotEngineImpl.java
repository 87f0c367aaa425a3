package com.chicu.signalbot.engine;

import com.chicu.signalbot.common.TickReport;
import com.chicu.signalbot.common.enums.ExecutionMode;
import com.chicu.signalbot.common.enums.OrderStatus;
import com.chicu.signalbot.common.enums.TradeStatus;
import com.chicu.signalbot.common.exception.NotFoundException;
import com.chicu.signalbot.common.time.Timeframe;
import com.chicu.signalbot.config.SignalBotProperties;
import com.chicu.signalbot.domain.OrderEntity;
import com.chicu.signalbot.domain.TradeEntity;
import com.chicu.signalbot.order.OrderFilter;
import com.chicu.signalbot.order.OrderLifecycleService;
import com.chicu.signalbot.order.OrderRequest;
import com.chicu.signalbot.order.PromotionPolicy;
import com.chicu.signalbot.repository.OrderRepository;
import com.chicu.signalbot.repository.TradeRepository;
import com.chicu.signalbot.signal.ScanResult;
import com.chicu.signalbot.signal.Signal;
import com.chicu.signalbot.signal.SignalAggregator;
import com.chicu.signalbot.signal.SignalFilter;
import com.chicu.signalbot.strategy.StrategyConfig;
import com.chicu.signalbot.trade.TradeFilter;
import com.chicu.signalbot.trade.TradeLifecycleService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

@Slf4j
@Service
public class SignalBotEngineImpl implements SignalBotEngine {

    private final SchedulerService scheduler;
    private final SignalAggregator aggregator;
    private final OrderLifecycleService orders;
    private final TradeLifecycleService trades;
    private final PromotionPolicy promotionPolicy;
    private final OrderRepository orderRepository;
    private final TradeRepository tradeRepository;
    private final SignalBotProperties properties;

    private final StrategyConfig strategyConfig;
    private final SignalFilter signalFilter;
    private final List<Timeframe> timeframes;

    /** Один замок на вид задачи: тик и ручные операции не пересекаются. */
    private final ReentrantLock scanLock = new ReentrantLock();
    private final ReentrantLock orderLock = new ReentrantLock();
    private final ReentrantLock tradeLock = new ReentrantLock();

    private final Object lifecycle = new Object();
    private volatile EngineState state;

    public SignalBotEngineImpl(SchedulerService scheduler,
                               SignalAggregator aggregator,
                               OrderLifecycleService orders,
                               TradeLifecycleService trades,
                               PromotionPolicy promotionPolicy,
                               OrderRepository orderRepository,
                               TradeRepository tradeRepository,
                               SignalBotProperties properties) {
        this.scheduler = scheduler;
        this.aggregator = aggregator;
        this.orders = orders;
        this.trades = trades;
        this.promotionPolicy = promotionPolicy;
        this.orderRepository = orderRepository;
        this.tradeRepository = tradeRepository;
        this.properties = properties;

        // fail-fast: ошибки конфигурации видны при старте приложения
        properties.validate();
        this.strategyConfig = properties.toStrategyConfig();
        this.timeframes = properties.scanTimeframes();
        SignalBotProperties.Scan scan = properties.getScan();
        this.signalFilter = SignalFilter.builder()
                .minConfidence(scan.getMinConfidence())
                .tagFilter(scan.getTagFilter())
                .maxSignalsPerSymbol(scan.getMaxSignalsPerSymbol())
                .ordering(scan.getOrdering())
                .build();
    }

    // =====================================================
    // START / STOP
    // =====================================================

    @EventListener(ApplicationReadyEvent.class)
    public void autoStart() {
        if (properties.getEngine().isAutoStart()) {
            start();
        }
    }

    @Override
    public boolean start() {
        synchronized (lifecycle) {
            if (state != null) {
                log.info("ℹ️ [ENGINE] already running since {}", state.getStartedAt());
                return false;
            }
            state = new EngineState(Instant.now());

            SignalBotProperties.Engine cfg = properties.getEngine();
            scheduler.scheduleAtFixedRate(TaskKind.SIGNAL_SCAN.getKey(), this::scanTick, cfg.getScanInterval());
            scheduler.scheduleAtFixedRate(TaskKind.ORDER_MONITOR.getKey(), this::orderTick, cfg.getOrderMonitorInterval());
            scheduler.scheduleAtFixedRate(TaskKind.TRADE_MONITOR.getKey(), this::tradeTick, cfg.getTradeMonitorInterval());

            log.info("🚀 [ENGINE] started: symbols={} timeframes={} mode={}",
                    properties.getScan().getSymbols(), timeframes, properties.getPromotion().getMode());
            return true;
        }
    }

    @PreDestroy
    public void shutdown() {
        stop();
    }

    @Override
    public boolean stop() {
        synchronized (lifecycle) {
            if (state == null) {
                return false;
            }
            Duration timeout = properties.getEngine().getStopTimeout();
            boolean interrupted = false;
            for (TaskKind kind : TaskKind.values()) {
                if (interrupted) {
                    // ждать уже нельзя, но таймер снять обязаны
                    scheduler.cancel(kind.getKey());
                    continue;
                }
                try {
                    if (!scheduler.cancelAndAwait(kind.getKey(), timeout)) {
                        log.warn("⚠️ [ENGINE] {} tick did not finish within {}", kind, timeout);
                    }
                } catch (InterruptedException e) {
                    interrupted = true;
                    log.warn("⚠️ [ENGINE] interrupted while stopping {}, cancelling the rest without waiting", kind);
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
            state = null;
            log.info("🛑 [ENGINE] stopped");
            return true;
        }
    }

    @Override
    public boolean isRunning() {
        return state != null;
    }

    // =====================================================
    // TICKS
    // =====================================================

    void scanTick() {
        runIfFree(scanLock, TaskKind.SIGNAL_SCAN, () -> doScan(state));
    }

    void orderTick() {
        runIfFree(orderLock, TaskKind.ORDER_MONITOR, () -> {
            EngineState s = state;
            if (s == null) return;
            TickReport report = orders.monitorTick(Instant.now(), s.getPriceCache());
            s.publishOrderTick(report);
        });
    }

    void tradeTick() {
        runIfFree(tradeLock, TaskKind.TRADE_MONITOR, () -> {
            EngineState s = state;
            if (s == null) return;
            TickReport report = trades.monitorTick(Instant.now(), s.getPriceCache());
            s.publishTradeTick(report);
        });
    }

    private void runIfFree(ReentrantLock lock, TaskKind kind, Runnable body) {
        if (!lock.tryLock()) {
            log.info("⏭ [ENGINE] {} busy (manual call in progress), tick skipped", kind);
            return;
        }
        try {
            body.run();
        } finally {
            lock.unlock();
        }
    }

    private <T> T exclusive(ReentrantLock lock, Supplier<T> body) {
        lock.lock();
        try {
            return body.get();
        } finally {
            lock.unlock();
        }
    }

    // =====================================================
    // SCAN + AUTO-PROMOTION
    // =====================================================

    @Override
    public List<Signal> scanForSignals() {
        return exclusive(scanLock, () -> doScan(state));
    }

    private List<Signal> doScan(EngineState s) {
        ScanResult result = aggregator.scan(
                properties.getScan().getSymbols(),
                timeframes,
                properties.getScan().getKlinesLimit(),
                strategyConfig,
                signalFilter,
                properties.getScan().getFetchTimeout()
        );
        if (s != null) {
            s.publishScan(result);
        }
        autoPromote(result.signals(), s);
        return result.signals();
    }

    private void autoPromote(List<Signal> signals, EngineState s) {
        ExecutionMode mode = properties.getPromotion().getMode();
        if (mode == ExecutionMode.SUPERVISED) {
            return;
        }
        exclusive(orderLock, () -> {
            for (Signal signal : signals) {
                if (!promotionPolicy.shouldAutoPromote(signal, mode)) {
                    continue;
                }
                try {
                    if (orders.hasPendingFor(signal)) {
                        log.debug("[ENGINE] {} {} {} already has a pending order", signal.symbol(), signal.timeframe(), signal.side());
                        continue;
                    }
                    orders.promote(signal, mode, Instant.now());
                    if (s != null) s.countPromotion();
                } catch (DataAccessException | IllegalArgumentException e) {
                    log.warn("⚠️ [ENGINE] auto-promotion of {} {} failed: {}", signal.symbol(), signal.side(), e.getMessage());
                }
            }
            return null;
        });
    }

    // =====================================================
    // HOST OPERATIONS
    // =====================================================

    @Override
    public List<Signal> getSignals() {
        EngineState s = state;
        return s == null ? List.of() : s.getLastSignals();
    }

    @Override
    public OrderEntity promoteSignal(String signalId, ExecutionMode mode) {
        Signal signal = getSignals().stream()
                .filter(x -> x.id().equals(signalId))
                .findFirst()
                .orElseThrow(() -> new NotFoundException("Signal " + signalId + " not found in the last scan"));
        ExecutionMode m = mode != null ? mode : ExecutionMode.SUPERVISED;
        return exclusive(orderLock, () -> orders.promote(signal, m, Instant.now()));
    }

    @Override
    public OrderEntity createOrder(OrderRequest request) {
        return exclusive(orderLock, () -> orders.createOrder(request, Instant.now()));
    }

    @Override
    public OrderEntity cancelOrder(Long orderId, String reason) {
        return exclusive(orderLock, () -> orders.cancel(orderId, reason, Instant.now()));
    }

    @Override
    public TradeEntity closeTrade(Long tradeId, double exitPrice, String reason) {
        return exclusive(tradeLock, () -> trades.closeTrade(tradeId, exitPrice, reason, Instant.now()));
    }

    @Override
    public List<OrderEntity> getOrders(OrderFilter filter) {
        return orders.getOrders(filter);
    }

    @Override
    public List<TradeEntity> getTrades(TradeFilter filter) {
        return trades.getTrades(filter);
    }

    @Override
    public EngineStatus getStatus() {
        EngineState s = state;
        long skipped = 0;
        for (TaskKind kind : TaskKind.values()) {
            skipped += scheduler.getSkippedTicks(kind.getKey());
        }

        EngineStatus.Stats stats = EngineStatus.Stats.builder()
                .activeSignals(s == null ? 0 : s.getLastSignals().size())
                .pendingOrders(orderRepository.countByStatus(OrderStatus.PENDING))
                .openTrades(tradeRepository.countByStatus(TradeStatus.OPEN))
                .scans(s == null ? 0 : s.getScans().get())
                .promotedSignals(s == null ? 0 : s.getPromoted().get())
                .skippedTicks(skipped)
                .build();

        return EngineStatus.builder()
                .running(s != null)
                .startedAt(s == null ? null : s.getStartedAt())
                .uptime(s == null ? Duration.ZERO : Duration.between(s.getStartedAt(), Instant.now()))
                .mode(properties.getPromotion().getMode())
                .stats(stats)
                .lastScan(s == null ? null : s.getLastScan())
                .lastOrderTick(s == null ? null : s.getLastOrderTick())
                .lastTradeTick(s == null ? null : s.getLastTradeTick())
                .build();
    }
}
