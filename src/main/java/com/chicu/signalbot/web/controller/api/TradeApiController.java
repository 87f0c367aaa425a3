package com.chicu.signalbot.web.controller.api;

import com.chicu.signalbot.common.enums.ExecutionMode;
import com.chicu.signalbot.common.enums.TradeStatus;
import com.chicu.signalbot.domain.TradeEntity;
import com.chicu.signalbot.engine.SignalBotEngine;
import com.chicu.signalbot.trade.EquityPoint;
import com.chicu.signalbot.trade.TradeFilter;
import com.chicu.signalbot.trade.TradeLifecycleService;
import com.chicu.signalbot.trade.TradeStats;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/trades")
@RequiredArgsConstructor
public class TradeApiController {

    private final SignalBotEngine engine;
    private final TradeLifecycleService trades;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<TradeEntity> list(@RequestParam(required = false) TradeStatus status,
                                  @RequestParam(required = false) String symbol,
                                  @RequestParam(required = false) ExecutionMode mode,
                                  @RequestParam(required = false) Integer limit) {
        return engine.getTrades(new TradeFilter(status, symbol, mode, limit));
    }

    @GetMapping(value = "/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public TradeStats stats(@RequestParam(required = false) String symbol,
                            @RequestParam(required = false) ExecutionMode mode) {
        return trades.getStats(new TradeFilter(null, symbol, mode, null));
    }

    @GetMapping(value = "/equity-curve", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<EquityPoint> equityCurve(@RequestParam(required = false) String symbol,
                                         @RequestParam(required = false) ExecutionMode mode) {
        return trades.getEquityCurve(new TradeFilter(null, symbol, mode, null));
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    public TradeEntity get(@PathVariable Long id) {
        return trades.getTrade(id);
    }

    @PostMapping(value = "/{id}/close", produces = MediaType.APPLICATION_JSON_VALUE)
    public TradeEntity close(@PathVariable Long id,
                             @RequestParam double exitPrice,
                             @RequestParam(required = false) String reason) {
        return engine.closeTrade(id, exitPrice, reason);
    }
}
