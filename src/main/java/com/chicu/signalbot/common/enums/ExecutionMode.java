package com.chicu.signalbot.common.enums;

/**
 * Режим исполнения сигналов.
 *
 * SUPERVISED — только руками (human),
 * STRICT / EXPLORE — бот сам продвигает сигналы в ордера.
 */
public enum ExecutionMode {
    SUPERVISED("human"),
    STRICT("bot_strict"),
    EXPLORE("bot_explore");

    private final String executor;

    ExecutionMode(String executor) {
        this.executor = executor;
    }

    /** Кто исполнил ордер: human / bot_strict / bot_explore. */
    public String getExecutor() {
        return executor;
    }
}
