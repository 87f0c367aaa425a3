package com.chicu.signalbot.common.enums;

public enum TradeStatus {
    OPEN,
    CLOSED
}
