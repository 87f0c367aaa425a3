package com.chicu.signalbot.order.impl;

import com.chicu.signalbot.common.TickReport;
import com.chicu.signalbot.common.enums.OrderStatus;
import com.chicu.signalbot.common.enums.TradeSide;
import com.chicu.signalbot.common.enums.TradeStatus;
import com.chicu.signalbot.common.time.Timeframe;
import com.chicu.signalbot.config.SignalBotProperties;
import com.chicu.signalbot.domain.OrderEntity;
import com.chicu.signalbot.domain.TradeEntity;
import com.chicu.signalbot.guard.PriceSanityGuard;
import com.chicu.signalbot.journal.LifecycleEvent;
import com.chicu.signalbot.journal.LifecycleJournal;
import com.chicu.signalbot.market.PriceBatch;
import com.chicu.signalbot.market.PriceCache;
import com.chicu.signalbot.market.PriceFetcher;
import com.chicu.signalbot.order.OrderRequest;
import com.chicu.signalbot.order.PromotionPolicy;
import com.chicu.signalbot.repository.LifecycleEventRepository;
import com.chicu.signalbot.repository.OrderRepository;
import com.chicu.signalbot.repository.TradeRepository;
import com.chicu.signalbot.trade.impl.TradeLifecycleServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Ордер → сделка → закрытие на настоящих репозиториях (H2).
 */
@DataJpaTest
class OrderTradeLifecycleJpaTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Autowired OrderRepository orderRepository;
    @Autowired TradeRepository tradeRepository;
    @Autowired LifecycleEventRepository eventRepository;

    private final PriceFetcher priceFetcher = mock(PriceFetcher.class);

    private LifecycleJournal journal;
    private OrderLifecycleServiceImpl orders;
    private TradeLifecycleServiceImpl trades;

    @BeforeEach
    void setUp() {
        SignalBotProperties properties = new SignalBotProperties();
        journal = new LifecycleJournal(eventRepository);
        trades = new TradeLifecycleServiceImpl(tradeRepository, priceFetcher, new PriceSanityGuard(), journal, properties);
        orders = new OrderLifecycleServiceImpl(orderRepository, tradeRepository, trades, priceFetcher,
                new PriceSanityGuard(), new PromotionPolicy(), journal, properties);
    }

    @Test
    void pendingFillsOnce_tradeClosesAtStop() {
        OrderEntity order = orders.createOrder(OrderRequest.builder()
                .symbol("BTCUSDT")
                .timeframe(Timeframe.H1)
                .side(TradeSide.LONG)
                .entry(100)
                .stop(95)
                .take(110)
                .build(), T0);
        Long orderId = order.getId();
        PriceCache cache = new PriceCache();

        // 1) цена коснулась входа
        when(priceFetcher.fetch(anyCollection())).thenReturn(price(99.8));
        TickReport fill = orders.monitorTick(T0.plusSeconds(60), cache);

        assertEquals(1, fill.transitions());
        assertEquals(OrderStatus.FILLED, orderRepository.findById(orderId).orElseThrow().getStatus());
        TradeEntity trade = tradeRepository.findByOrderId(orderId).orElseThrow();
        assertEquals(TradeStatus.OPEN, trade.getStatus());
        assertEquals(100.0, trade.getEntry(), "вход по уровню ордера");

        // 2) та же цена: ни ордер, ни сделка не меняются
        assertEquals(0, orders.monitorTick(T0.plusSeconds(120), cache).transitions());
        assertEquals(0, trades.monitorTick(T0.plusSeconds(120), cache).transitions());
        assertEquals(1, tradeRepository.count(), "вторая сделка не создана");

        // 3) стоп
        when(priceFetcher.fetch(anyCollection())).thenReturn(price(94.0));
        assertEquals(1, trades.monitorTick(T0.plusSeconds(180), cache).transitions());

        TradeEntity closed = tradeRepository.findById(trade.getId()).orElseThrow();
        assertEquals(TradeStatus.CLOSED, closed.getStatus());
        assertEquals("stop", closed.getCloseReason());
        assertEquals(95.0, closed.getExit());
        assertEquals(-1.0, closed.getRealizedR(), 1e-9);
        assertEquals(-100.0, closed.getPnl(), 1e-9);

        assertEquals(List.of("created", "price_touched_entry"), reasons(LifecycleEvent.EntityType.ORDER, orderId));
        assertEquals(List.of("order_filled", "stop"), reasons(LifecycleEvent.EntityType.TRADE, trade.getId()));
    }

    private List<String> reasons(LifecycleEvent.EntityType type, Long id) {
        return journal.history(type, id).stream().map(LifecycleEvent::getReason).collect(Collectors.toList());
    }

    private static PriceBatch price(double p) {
        return new PriceBatch(Map.of("BTCUSDT", p), Map.of());
    }
}
