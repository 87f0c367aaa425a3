package com.chicu.signalbot.config.http;

import com.chicu.signalbot.config.SignalBotProperties;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP-клиент для публичных market-эндпоинтов.
 *
 * Все таймауты не длиннее signalbot.scan.fetch-timeout: поток market-fetch
 * не должен висеть на сокете дольше, чем сканер ждёт пару.
 */
@Configuration
public class MarketRestTemplateConfig {

    @Bean
    public PoolingHttpClientConnectionManager marketConnManager(SignalBotProperties properties) {
        int threads = Math.max(1, properties.getEngine().getFetchThreads());
        return PoolingHttpClientConnectionManagerBuilder.create()
                .setDefaultConnectionConfig(connectionConfig(properties))
                .setMaxConnTotal(threads * 2)
                .setMaxConnPerRoute(threads * 2)
                .build();
    }

    @Bean
    public CloseableHttpClient marketHttpClient(PoolingHttpClientConnectionManager marketConnManager,
                                                SignalBotProperties properties) {
        return HttpClients.custom()
                .setConnectionManager(marketConnManager)
                .setDefaultRequestConfig(requestConfig(properties))
                .evictExpiredConnections()
                .evictIdleConnections(Timeout.ofSeconds(20))
                .build();
    }

    @Bean
    @Qualifier("marketRestTemplate")
    public RestTemplate marketRestTemplate(CloseableHttpClient marketHttpClient) {
        return new RestTemplate(new HttpComponentsClientHttpRequestFactory(marketHttpClient));
    }

    // подключение и чтение сокета
    static ConnectionConfig connectionConfig(SignalBotProperties properties) {
        Duration fetch = properties.getScan().getFetchTimeout();
        return ConnectionConfig.custom()
                .setConnectTimeout(timeout(min(properties.getMarket().getConnectTimeout(), fetch)))
                .setSocketTimeout(timeout(fetch))
                .build();
    }

    static RequestConfig requestConfig(SignalBotProperties properties) {
        Duration fetch = properties.getScan().getFetchTimeout();
        return RequestConfig.custom()
                .setConnectionRequestTimeout(timeout(min(properties.getMarket().getConnectTimeout(), fetch))) // ждать коннект из пула
                .setResponseTimeout(timeout(fetch))
                .build();
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static Timeout timeout(Duration d) {
        return Timeout.ofMilliseconds(d.toMillis());
    }
}
