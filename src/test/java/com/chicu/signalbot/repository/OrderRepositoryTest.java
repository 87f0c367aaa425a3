package com.chicu.signalbot.repository;

import com.chicu.signalbot.common.enums.ExecutionMode;
import com.chicu.signalbot.common.enums.OrderStatus;
import com.chicu.signalbot.common.enums.TradeSide;
import com.chicu.signalbot.common.time.Timeframe;
import com.chicu.signalbot.domain.OrderEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class OrderRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    @Autowired
    OrderRepository repository;

    @BeforeEach
    void seed() {
        repository.save(order("BTCUSDT", TradeSide.LONG, OrderStatus.PENDING, ExecutionMode.SUPERVISED, T0));
        repository.save(order("BTCUSDT", TradeSide.SHORT, OrderStatus.FILLED, ExecutionMode.STRICT, T0.plusSeconds(60)));
        repository.save(order("ETHUSDT", TradeSide.LONG, OrderStatus.PENDING, ExecutionMode.EXPLORE, T0.plusSeconds(120)));
        repository.save(order("ETHUSDT", TradeSide.LONG, OrderStatus.CANCELED, ExecutionMode.SUPERVISED, T0.plusSeconds(180)));
    }

    @Test
    void search_withoutFilters_newestFirst() {
        List<OrderEntity> all = repository.search(null, null, null, Pageable.unpaged());

        assertEquals(4, all.size());
        assertEquals(T0.plusSeconds(180), all.get(0).getCreatedAt());
        assertEquals(T0, all.get(3).getCreatedAt());
    }

    @Test
    void search_combinesFilters_andLimit() {
        assertEquals(2, repository.search(OrderStatus.PENDING, null, null, Pageable.unpaged()).size());
        assertEquals(1, repository.search(OrderStatus.PENDING, "ETHUSDT", null, Pageable.unpaged()).size());
        assertEquals(2, repository.search(null, null, ExecutionMode.SUPERVISED, Pageable.unpaged()).size());
        assertEquals(1, repository.search(null, "BTCUSDT", null, PageRequest.of(0, 1)).size());
    }

    @Test
    void pendingLookups() {
        assertEquals(2, repository.countByStatus(OrderStatus.PENDING));
        assertTrue(repository.existsBySymbolAndTimeframeAndSideAndStatus(
                "BTCUSDT", Timeframe.H1, TradeSide.LONG, OrderStatus.PENDING));
        assertFalse(repository.existsBySymbolAndTimeframeAndSideAndStatus(
                "BTCUSDT", Timeframe.H1, TradeSide.SHORT, OrderStatus.PENDING));

        List<OrderEntity> pending = repository.findByStatusOrderByCreatedAtAsc(OrderStatus.PENDING);
        assertEquals("BTCUSDT", pending.get(0).getSymbol());
        assertEquals("ETHUSDT", pending.get(1).getSymbol());
    }

    private static OrderEntity order(String symbol, TradeSide side, OrderStatus status, ExecutionMode mode, Instant at) {
        boolean longSide = side == TradeSide.LONG;
        return OrderEntity.builder()
                .symbol(symbol)
                .timeframe(Timeframe.H1)
                .side(side)
                .entry(100)
                .stop(longSide ? 95 : 105)
                .take(longSide ? 110 : 90)
                .size(20)
                .status(status)
                .mode(mode)
                .executor(mode.getExecutor())
                .statusReason("created")
                .statusChangedAt(at)
                .createdAt(at)
                .expiresAt(at.plus(Duration.ofHours(6)))
                .build();
    }
}
