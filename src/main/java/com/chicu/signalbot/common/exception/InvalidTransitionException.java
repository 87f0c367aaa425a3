package com.chicu.signalbot.common.exception;

/**
 * Попытка перевести ордер/сделку из терминального или неподходящего статуса.
 */
public class InvalidTransitionException extends IllegalStateException {

    public InvalidTransitionException(String message) {
        super(message);
    }
}
