package com.chicu.signalbot.indicators;

/**
 * Последний завершённый свинг между двумя чередующимися пивотами.
 *
 * @param direction UP (low → high) или DOWN (high → low)
 * @param fromIndex индекс первого пивота
 * @param toIndex   индекс второго пивота
 * @param high      цена верхнего пивота
 * @param low       цена нижнего пивота
 */
public record Swing(Direction direction, int fromIndex, int toIndex, double high, double low) {

    public enum Direction { UP, DOWN }

    public boolean isUp() {
        return direction == Direction.UP;
    }

    public double range() {
        return high - low;
    }
}
