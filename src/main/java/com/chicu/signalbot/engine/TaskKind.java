package com.chicu.signalbot.engine;

/**
 * Периодические задачи движка и их ключи в планировщике.
 */
public enum TaskKind {
    SIGNAL_SCAN("signal-scan"),
    ORDER_MONITOR("order-monitor"),
    TRADE_MONITOR("trade-monitor");

    private final String key;

    TaskKind(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
