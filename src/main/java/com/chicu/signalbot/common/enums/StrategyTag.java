package com.chicu.signalbot.common.enums;

/**
 * Метки причин сигнала.
 */
public enum StrategyTag {
    FIB,
    FVG,
    SR,
    TREND,
    RSI
}
