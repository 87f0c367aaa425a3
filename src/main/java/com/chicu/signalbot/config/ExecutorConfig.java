package com.chicu.signalbot.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

@Configuration
public class ExecutorConfig {

    /**
     * Счётчик в имени потока, без Thread.getId().
     * Имена вида: market-fetch-1, market-fetch-2, ...
     */
    private static final class FetchThreadFactory implements ThreadFactory {
        private final AtomicLong ctr = new AtomicLong(1);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setName("market-fetch-" + ctr.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Ограниченный пул для загрузки свечей/цен внутри одного тика.
     */
    @Bean(destroyMethod = "shutdownNow")
    @Qualifier("marketFetchExecutor")
    public ExecutorService marketFetchExecutor(SignalBotProperties properties) {
        int threads = Math.max(1, properties.getEngine().getFetchThreads());
        return new ThreadPoolExecutor(
                threads,
                threads,
                60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new FetchThreadFactory()
        );
    }
}
