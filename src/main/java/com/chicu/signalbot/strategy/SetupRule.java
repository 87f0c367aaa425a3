package com.chicu.signalbot.strategy;

/**
 * Правила детектора в порядке приоритета.
 */
public enum SetupRule {
    FIB_FVG,
    FIB_PULLBACK,
    FVG_RETEST,
    SR_PROXIMITY,
    RSI_EXTREME
}
