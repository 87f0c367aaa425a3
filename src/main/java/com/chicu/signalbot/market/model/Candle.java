package com.chicu.signalbot.market.model;

/**
 * OHLCV-свеча. time — начало бара, epoch millis.
 */
public record Candle(long time, double open, double high, double low, double close, double volume) {
}
