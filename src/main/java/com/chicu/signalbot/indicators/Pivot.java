package com.chicu.signalbot.indicators;

/**
 * Локальный экстремум (pivot) на баре {@code index}.
 */
public record Pivot(int index, double price, Type type) {

    public enum Type { HIGH, LOW }

    public boolean isHigh() {
        return type == Type.HIGH;
    }

    public boolean isLow() {
        return type == Type.LOW;
    }
}
