package com.chicu.signalbot.market;

/**
 * Ошибка получения рыночных данных (сеть, биржа, формат ответа).
 * Вызывающий код обрабатывает её по паре/записи и продолжает работу.
 */
public class MarketDataException extends Exception {

    public MarketDataException(String message) {
        super(message);
    }

    public MarketDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
