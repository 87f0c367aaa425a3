package com.chicu.signalbot.common.enums;

/**
 * Направление позиции.
 */
public enum TradeSide {
    LONG,
    SHORT;

    /** +1 для LONG, -1 для SHORT. */
    public int direction() {
        return this == LONG ? 1 : -1;
    }
}
