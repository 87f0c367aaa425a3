package com.chicu.signalbot.common.enums;

public enum MarketBias {
    BULLISH,
    NEUTRAL,
    BEARISH;

    /** Совпадает ли сторона сделки с общим уклоном рынка. */
    public boolean favours(TradeSide side) {
        return (this == BULLISH && side == TradeSide.LONG)
                || (this == BEARISH && side == TradeSide.SHORT);
    }
}
