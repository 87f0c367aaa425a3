package com.chicu.signalbot.trade;

import com.chicu.signalbot.common.TickReport;
import com.chicu.signalbot.domain.OrderEntity;
import com.chicu.signalbot.domain.TradeEntity;
import com.chicu.signalbot.market.PriceCache;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Жизненный цикл сделки: открытие по исполненному ордеру, мониторинг выхода, закрытие.
 */
public interface TradeLifecycleService {

    /**
     * Открывает сделку по ордеру. Если сделка для ордера уже есть — возвращает её.
     */
    TradeEntity openFromOrder(OrderEntity order, double fillPrice, Instant now);

    /**
     * Один проход по открытым сделкам: стоп, тейк, затем TTL.
     * Ошибка по одной сделке не мешает остальным.
     */
    TickReport monitorTick(Instant now, PriceCache priceCache);

    /**
     * Ручное закрытие. Закрытая сделка — {@link com.chicu.signalbot.common.exception.InvalidTransitionException}.
     */
    TradeEntity closeTrade(Long tradeId, double exitPrice, String reason, Instant now);

    /** Чистая проверка условий выхода, без побочных эффектов. */
    Optional<ExitDecision> evaluateExit(TradeEntity trade, double price, Instant now);

    List<TradeEntity> getTrades(TradeFilter filter);

    TradeEntity getTrade(Long id);

    TradeStats getStats(TradeFilter filter);

    /** Кривая капитала по закрытым сделкам, статус фильтра не учитывается. */
    List<EquityPoint> getEquityCurve(TradeFilter filter);
}
