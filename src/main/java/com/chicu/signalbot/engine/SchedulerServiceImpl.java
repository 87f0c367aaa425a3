package com.chicu.signalbot.engine;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

@Slf4j
@Service
public class SchedulerServiceImpl implements SchedulerService {

    /**
     * Пул таймеров. daemon=true чтобы не блокировать завершение приложения.
     */
    private final ScheduledExecutorService executor =
            Executors.newScheduledThreadPool(
                    Math.max(2, Runtime.getRuntime().availableProcessors()),
                    r -> {
                        Thread t = new Thread(r);
                        t.setDaemon(true);
                        t.setName("BotScheduler-" + t.getId());
                        return t;
                    }
            );

    /** key → задача */
    private final Map<String, Task> tasks = new ConcurrentHashMap<>();

    /**
     * Запущенная задача: future таймера и замок «один тик за раз».
     */
    private static final class Task {
        final ReentrantLock running = new ReentrantLock();
        final AtomicLong skipped = new AtomicLong();
        final Instant startedAt = Instant.now();
        volatile ScheduledFuture<?> future;
    }

    // ==============================================================
    // ▶️ START TASK
    // ==============================================================
    @Override
    public void scheduleAtFixedRate(String key, Runnable task, Duration interval) {
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be > 0");
        }

        // если задача существует — отменяем перед созданием новой
        cancel(key);

        Task t = new Task();
        long intervalMs = interval.toMillis();
        Runnable guarded = () -> runGuarded(key, t, task, intervalMs);

        t.future = executor.scheduleAtFixedRate(
                guarded,
                0,                   // старт немедленно
                intervalMs,
                TimeUnit.MILLISECONDS
        );
        tasks.put(key, t);

        log.info("⏱ Scheduler: started '{}' (interval={}s)", key, interval.toSeconds());
    }

    private void runGuarded(String key, Task t, Runnable task, long intervalMs) {
        // тик наступил, пока выполнялся предыдущий: опоздание не меньше интервала
        ScheduledFuture<?> f = t.future;
        if (f != null && -f.getDelay(TimeUnit.MILLISECONDS) >= intervalMs) {
            long n = t.skipped.incrementAndGet();
            log.warn("⏭ Scheduler: '{}' tick was due during previous run, skipped (total {})", key, n);
            return;
        }
        if (!t.running.tryLock()) {
            long n = t.skipped.incrementAndGet();
            log.warn("⏭ Scheduler: '{}' previous tick still running, skipped (total {})", key, n);
            return;
        }
        try {
            task.run();
        } catch (RuntimeException e) {
            // исключение в periodic-задаче гасит таймер, поэтому логируем и ждём следующего тика
            log.error("❌ Scheduler: tick '{}' failed: {}", key, e.getMessage(), e);
        } finally {
            t.running.unlock();
        }
    }

    // ==============================================================
    // ⏹ CANCEL
    // ==============================================================
    @Override
    public void cancel(String key) {
        Task t = tasks.remove(key);
        if (t != null && t.future != null) {
            t.future.cancel(false);
            log.info("🛑 Scheduler: cancelled task '{}'", key);
        }
    }

    @Override
    public boolean cancelAndAwait(String key, Duration timeout) throws InterruptedException {
        Task t = tasks.remove(key);
        if (t == null) {
            return true;
        }
        if (t.future != null) {
            t.future.cancel(false);
        }
        // дождаться текущего тика: замок свободен, значит тик завершён
        if (t.running.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            t.running.unlock();
            log.info("🛑 Scheduler: cancelled task '{}'", key);
            return true;
        }
        log.warn("⚠️ Scheduler: task '{}' still running after {}s", key, timeout.toSeconds());
        return false;
    }

    // ==============================================================
    // ℹ STATUS
    // ==============================================================
    @Override
    public boolean isActive(String key) {
        Task t = tasks.get(key);
        return t != null && t.future != null && !t.future.isCancelled() && !t.future.isDone();
    }

    @Override
    public boolean isRunning(String key) {
        Task t = tasks.get(key);
        return t != null && t.running.isLocked();
    }

    @Override
    public long getSkippedTicks(String key) {
        Task t = tasks.get(key);
        return t == null ? 0 : t.skipped.get();
    }

    @Override
    public Optional<Instant> getStartedAt(String key) {
        Task t = tasks.get(key);
        return t == null ? Optional.empty() : Optional.of(t.startedAt);
    }

    // ==============================================================
    // 🛑 SHUTDOWN
    // ==============================================================
    @PreDestroy
    public void shutdown() {
        log.info("💤 SchedulerServiceImpl shutting down…");
        executor.shutdownNow();
    }
}
