package com.chicu.signalbot.guard;

import lombok.Builder;

import java.util.ArrayList;
import java.util.List;

@Builder
public record GuardResult(boolean ok, List<String> errors) {

    // =====================================================
    // SAFETY
    // =====================================================

    public GuardResult {
        errors = errors != null ? List.copyOf(errors) : List.of();

        // ❗ защита от логической ошибки
        if (ok && !errors.isEmpty()) {
            throw new IllegalStateException("GuardResult: ok=true but errors not empty: " + errors);
        }
        if (!ok && errors.isEmpty()) {
            throw new IllegalStateException("GuardResult: ok=false without errors");
        }
    }

    // =====================================================
    // FACTORIES
    // =====================================================

    public static GuardResult pass() {
        return new GuardResult(true, List.of());
    }

    public static GuardResult block(List<String> errors) {
        return new GuardResult(false, new ArrayList<>(errors));
    }

    public static GuardResult fail(String error) {
        return block(List.of(error));
    }

    public String errorsAsText() {
        return String.join("; ", errors);
    }

    /** Бросает IllegalArgumentException, если проверка не пройдена. */
    public void throwIfFailed(String what) {
        if (!ok) {
            throw new IllegalArgumentException(what + ": " + errorsAsText());
        }
    }
}
