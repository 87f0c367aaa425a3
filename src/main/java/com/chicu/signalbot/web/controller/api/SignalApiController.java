package com.chicu.signalbot.web.controller.api;

import com.chicu.signalbot.common.enums.ExecutionMode;
import com.chicu.signalbot.domain.OrderEntity;
import com.chicu.signalbot.engine.SignalBotEngine;
import com.chicu.signalbot.signal.Signal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/signals")
@RequiredArgsConstructor
public class SignalApiController {

    private final SignalBotEngine engine;

    /** Последний снимок сканера. */
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Signal> list() {
        return engine.getSignals();
    }

    @PostMapping(value = "/scan", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<Signal> scan() {
        List<Signal> signals = engine.scanForSignals();
        log.info("🔎 API: manual scan -> {} signals", signals.size());
        return signals;
    }

    @PostMapping(value = "/{id}/promote", produces = MediaType.APPLICATION_JSON_VALUE)
    public OrderEntity promote(@PathVariable String id,
                               @RequestParam(defaultValue = "SUPERVISED") ExecutionMode mode) {
        return engine.promoteSignal(id, mode);
    }
}
