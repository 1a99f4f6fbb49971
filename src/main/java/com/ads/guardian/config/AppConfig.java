package com.ads.guardian.config;

import com.ads.guardian.action.Sleeper;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AppConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(30))
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleeper();
    }

    /**
     * Bounded pool for per-entity platform calls within a tick.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService guardianWorkerPool(GuardianSettings settings) {
        return Executors.newFixedThreadPool(settings.getWorkerPoolSize(),
                new ThreadFactoryBuilder().setNameFormat("guardian-worker-%d").setDaemon(true).build());
    }

    /**
     * Single thread running ticks; triggers never queue on it (see GuardianScheduler).
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService guardianTickExecutor() {
        return Executors.newSingleThreadExecutor(
                new ThreadFactoryBuilder().setNameFormat("guardian-tick-%d").setDaemon(true).build());
    }
}
