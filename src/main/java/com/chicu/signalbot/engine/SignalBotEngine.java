package com.chicu.signalbot.engine;

import com.chicu.signalbot.common.enums.ExecutionMode;
import com.chicu.signalbot.domain.OrderEntity;
import com.chicu.signalbot.domain.TradeEntity;
import com.chicu.signalbot.order.OrderFilter;
import com.chicu.signalbot.order.OrderRequest;
import com.chicu.signalbot.signal.Signal;
import com.chicu.signalbot.trade.TradeFilter;

import java.util.List;

/**
 * Фасад движка для хоста (REST, CLI, тесты).
 *
 * Операции, меняющие ордера и сделки, выполняются под тем же замком,
 * что и соответствующий периодический тик.
 */
public interface SignalBotEngine {

    /** @return false, если уже запущен */
    boolean start();

    /** Останавливает таймеры и ждёт текущие тики. @return false, если уже остановлен */
    boolean stop();

    boolean isRunning();

    /** Внеочередной проход сканера (с автопродвижением по текущему режиму). */
    List<Signal> scanForSignals();

    /** Последний снимок сигналов запущенного движка; пусто, если остановлен. */
    List<Signal> getSignals();

    OrderEntity promoteSignal(String signalId, ExecutionMode mode);

    OrderEntity createOrder(OrderRequest request);

    OrderEntity cancelOrder(Long orderId, String reason);

    TradeEntity closeTrade(Long tradeId, double exitPrice, String reason);

    List<OrderEntity> getOrders(OrderFilter filter);

    List<TradeEntity> getTrades(TradeFilter filter);

    EngineStatus getStatus();
}
