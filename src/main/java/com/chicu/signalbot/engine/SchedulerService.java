package com.chicu.signalbot.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Планировщик периодических задач по строковому ключу.
 *
 * Крутит Runnable по таймеру и ничего не знает про ордера и сигналы.
 * Тик, наступивший пока предыдущий ещё выполняется, пропускается.
 */
public interface SchedulerService {

    /**
     * Запускает периодическую задачу. Задача с тем же ключом перезапускается.
     *
     * @param key      уникальный ключ задачи (например: "order-monitor")
     * @param task     логика одного тика
     * @param interval интервал между тиками
     */
    void scheduleAtFixedRate(String key, Runnable task, Duration interval);

    /**
     * Остановка по ключу без прерывания текущего тика.
     */
    void cancel(String key);

    /**
     * Остановка и ожидание завершения текущего тика.
     *
     * @return false, если тик не завершился за timeout
     */
    boolean cancelAndAwait(String key, Duration timeout) throws InterruptedException;

    /**
     * Активна ли задача по ключу.
     */
    boolean isActive(String key);

    /**
     * Выполняется ли сейчас тик задачи.
     */
    boolean isRunning(String key);

    /**
     * Сколько тиков пропущено из-за незавершённого предыдущего.
     */
    long getSkippedTicks(String key);

    Optional<Instant> getStartedAt(String key);
}
