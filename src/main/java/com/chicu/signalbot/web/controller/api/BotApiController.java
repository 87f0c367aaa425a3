package com.chicu.signalbot.web.controller.api;

import com.chicu.signalbot.engine.EngineStatus;
import com.chicu.signalbot.engine.SignalBotEngine;
import com.chicu.signalbot.web.dto.ApiResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/api/bot")
@RequiredArgsConstructor
public class BotApiController {

    private final SignalBotEngine engine;

    @GetMapping(value = "/status", produces = MediaType.APPLICATION_JSON_VALUE)
    public EngineStatus status() {
        return engine.getStatus();
    }

    @PostMapping(value = "/start", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ApiResponse> start() {
        boolean started = engine.start();
        log.info("🚀 API: start requested, started={}", started);
        return ResponseEntity.ok(ApiResponse.ok(started ? "started" : "already running"));
    }

    @PostMapping(value = "/stop", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ApiResponse> stop() {
        boolean stopped = engine.stop();
        log.info("⏹ API: stop requested, stopped={}", stopped);
        return ResponseEntity.ok(ApiResponse.ok(stopped ? "stopped" : "not running"));
    }
}
