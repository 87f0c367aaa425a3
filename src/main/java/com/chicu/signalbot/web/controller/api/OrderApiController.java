package com.chicu.signalbot.web.controller.api;

import com.chicu.signalbot.common.enums.ExecutionMode;
import com.chicu.signalbot.common.enums.OrderStatus;
import com.chicu.signalbot.domain.OrderEntity;
import com.chicu.signalbot.engine.SignalBotEngine;
import com.chicu.signalbot.order.OrderFilter;
import com.chicu.signalbot.order.OrderLifecycleService;
import com.chicu.signalbot.order.OrderRequest;
import com.chicu.signalbot.order.OrderStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderApiController {

    private final SignalBotEngine engine;
    private final OrderLifecycleService orders;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<OrderEntity> list(@RequestParam(required = false) OrderStatus status,
                                  @RequestParam(required = false) String symbol,
                                  @RequestParam(required = false) ExecutionMode mode,
                                  @RequestParam(required = false) Integer limit) {
        return engine.getOrders(new OrderFilter(status, symbol, mode, limit));
    }

    @GetMapping(value = "/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public OrderStats stats(@RequestParam(required = false) String symbol,
                            @RequestParam(required = false) ExecutionMode mode) {
        return orders.getStats(new OrderFilter(null, symbol, mode, null));
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public OrderEntity get(@PathVariable Long id) {
        return orders.getOrder(id);
    }

    /** Ручной ордер (режим human). */
    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public OrderEntity create(@RequestBody OrderRequest request) {
        OrderEntity order = engine.createOrder(request);
        log.info("📝 API: order #{} created for {}", order.getId(), order.getSymbol());
        return order;
    }

    @PostMapping(value = "/{id}/cancel", produces = MediaType.APPLICATION_JSON_VALUE)
    public OrderEntity cancel(@PathVariable Long id,
                              @RequestParam(required = false) String reason) {
        return engine.cancelOrder(id, reason);
    }
}
