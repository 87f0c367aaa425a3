package com.chicu.signalbot.guard;

import com.chicu.signalbot.common.enums.TradeSide;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Проверка уровней ордера/сделки.
 *
 * Уровни, отличающиеся от входа на порядок (×10 и больше), не масштабируются,
 * а отклоняются как ошибка данных.
 */
@Slf4j
@Component
public class PriceSanityGuard {

    static final double MAGNITUDE_LIMIT = 10.0;

    /**
     * Уровни входа: все положительные, риск > 0, стоп и тейк по правильные стороны от входа.
     */
    public GuardResult checkLevels(TradeSide side, double entry, double stop, double take) {
        List<String> errors = new ArrayList<>();

        if (side == null) {
            errors.add("side is required");
        }
        positive("entry", entry, errors);
        positive("stop", stop, errors);
        positive("take", take, errors);
        if (!errors.isEmpty()) {
            return GuardResult.block(errors);
        }

        magnitude("stop", entry, stop, errors);
        magnitude("take", entry, take, errors);

        if (entry == stop) {
            errors.add("zero risk: entry == stop");
        } else if (side == TradeSide.LONG && !(stop < entry && entry < take)) {
            errors.add("LONG requires stop < entry < take");
        } else if (side == TradeSide.SHORT && !(take < entry && entry < stop)) {
            errors.add("SHORT requires take < entry < stop");
        }

        if (!errors.isEmpty()) {
            log.warn("🧯 [GUARD] rejected levels side={} entry={} stop={} take={}: {}",
                    side, entry, stop, take, errors);
            return GuardResult.block(errors);
        }
        return GuardResult.pass();
    }

    /**
     * Цена выхода: положительная и того же порядка, что и вход.
     */
    public GuardResult checkExit(double entry, double exit) {
        List<String> errors = new ArrayList<>();
        positive("exit", exit, errors);
        if (errors.isEmpty()) {
            magnitude("exit", entry, exit, errors);
        }
        return errors.isEmpty() ? GuardResult.pass() : GuardResult.block(errors);
    }

    private static void positive(String name, double v, List<String> errors) {
        if (!Double.isFinite(v) || v <= 0) {
            errors.add(name + " must be a positive number, got " + v);
        }
    }

    private static void magnitude(String name, double entry, double level, List<String> errors) {
        double ratio = level / entry;
        if (ratio >= MAGNITUDE_LIMIT || ratio <= 1 / MAGNITUDE_LIMIT) {
            errors.add(name + " " + level + " is off by an order of magnitude from entry " + entry);
        }
    }
}
