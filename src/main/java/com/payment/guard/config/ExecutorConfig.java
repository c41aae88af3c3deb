package com.payment.guard.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pool the time-limited history lookups run on, so a slow store never holds a request thread
 * past the limiter's timeout. The queue is bounded: once every thread is busy and the queue is full,
 * new lookups are rejected and the caller falls back to the degraded assessment instead of piling up
 * work behind a stalled store.
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "historyExecutor", destroyMethod = "shutdown")
    public ExecutorService historyExecutor(@Value("${guard.risk.history-threads:8}") int threads,
                                           @Value("${guard.risk.history-queue-capacity:100}") int queueCapacity) {
        AtomicInteger counter = new AtomicInteger();
        return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                runnable -> {
                    Thread thread = new Thread(runnable, "history-lookup-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }
}
