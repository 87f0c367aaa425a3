package com.chicu.signalbot.common.enums;

public enum OrderStatus {
    PENDING,
    FILLED,
    CANCELED,
    EXPIRED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
