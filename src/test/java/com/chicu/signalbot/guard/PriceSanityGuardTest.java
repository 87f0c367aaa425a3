package com.chicu.signalbot.guard;

import com.chicu.signalbot.common.enums.TradeSide;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PriceSanityGuardTest {

    private final PriceSanityGuard guard = new PriceSanityGuard();

    @Test
    void validLevels_pass() {
        assertTrue(guard.checkLevels(TradeSide.LONG, 100, 95, 110).ok());
        assertTrue(guard.checkLevels(TradeSide.SHORT, 100, 105, 90).ok());
    }

    @Test
    void wrongSideOrdering_isBlocked() {
        GuardResult r = guard.checkLevels(TradeSide.LONG, 100, 105, 110);

        assertFalse(r.ok());
        assertTrue(r.errorsAsText().contains("LONG"), r.errorsAsText());
        assertFalse(guard.checkLevels(TradeSide.SHORT, 100, 95, 90).ok());
    }

    @Test
    void zeroRisk_isBlocked() {
        GuardResult r = guard.checkLevels(TradeSide.LONG, 100, 100, 110);
        assertTrue(r.errorsAsText().contains("zero risk"));
    }

    @Test
    void orderOfMagnitudeMismatch_isRejectedNotRescaled() {
        // стоп в 10 раз меньше входа: похоже на ошибку масштаба
        GuardResult r = guard.checkLevels(TradeSide.LONG, 100, 10, 110);

        assertFalse(r.ok());
        assertTrue(r.errorsAsText().contains("order of magnitude"), r.errorsAsText());
        assertFalse(guard.checkLevels(TradeSide.LONG, 100, 95, 1500).ok());
    }

    @Test
    void nonPositiveOrMissing_isBlocked() {
        assertFalse(guard.checkLevels(TradeSide.LONG, 0, 95, 110).ok());
        assertFalse(guard.checkLevels(TradeSide.LONG, 100, -1, 110).ok());
        assertFalse(guard.checkLevels(TradeSide.LONG, Double.NaN, 95, 110).ok());
        assertFalse(guard.checkLevels(null, 100, 95, 110).ok());
    }

    @Test
    void exitPrice() {
        assertTrue(guard.checkExit(100, 97).ok());
        assertFalse(guard.checkExit(100, 0).ok());
        assertFalse(guard.checkExit(100, 2000).ok());
    }

    @Test
    void throwIfFailed_raisesIllegalArgument() {
        GuardResult blocked = GuardResult.fail("boom");

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> blocked.throwIfFailed("Order levels"));
        assertEquals("Order levels: boom", ex.getMessage());
        assertDoesNotThrow(() -> GuardResult.pass().throwIfFailed("x"));
    }
}
