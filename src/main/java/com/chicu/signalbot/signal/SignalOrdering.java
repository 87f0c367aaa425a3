package com.chicu.signalbot.signal;

/**
 * Порядок сигналов внутри символа при обрезке по лимиту.
 */
public enum SignalOrdering {
    /** уверенность, затем RR, затем старший таймфрейм */
    CONFIDENCE,
    /** сначала самые свежие */
    TIME
}
