package com.chicu.signalbot.order;

import com.chicu.signalbot.common.TickReport;
import com.chicu.signalbot.common.enums.ExecutionMode;
import com.chicu.signalbot.domain.OrderEntity;
import com.chicu.signalbot.market.PriceCache;
import com.chicu.signalbot.signal.Signal;

import java.time.Instant;
import java.util.List;

/**
 * Жизненный цикл лимитного ордера: PENDING → FILLED | CANCELED | EXPIRED.
 */
public interface OrderLifecycleService {

    /**
     * Новый PENDING-ордер. Некорректные уровни — IllegalArgumentException.
     */
    OrderEntity createOrder(OrderRequest request, Instant now);

    /**
     * Ордер из сигнала. Размер считается от риска на сделку.
     */
    OrderEntity promote(Signal signal, ExecutionMode mode, Instant now);

    /**
     * Отмена PENDING-ордера. Терминальный ордер — InvalidTransitionException.
     */
    OrderEntity cancel(Long orderId, String reason, Instant now);

    /**
     * Один проход по PENDING-ордерам: сверка с уже открытыми сделками, TTL, затем касание цены входа.
     */
    TickReport monitorTick(Instant now, PriceCache priceCache);

    /** Есть ли уже PENDING-ордер на тот же (symbol, timeframe, side). */
    boolean hasPendingFor(Signal signal);

    List<OrderEntity> getOrders(OrderFilter filter);

    OrderEntity getOrder(Long id);

    OrderStats getStats(OrderFilter filter);
}
