package com.example.berry.common.config;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import javax.annotation.PreDestroy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TaskExecutionConfig {

    private final List<ExecutorService> executors = new ArrayList<>();

    /**
     * Short-lived fire-and-forget work: remote commands, fades, progress saves. A full queue
     * rejects; callers handle {@link java.util.concurrent.RejectedExecutionException}.
     */
    @Bean
    public ExecutorService commandExecutor() {
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                2,
                4,
                30L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(32),
                new NamedThreadFactory("command-"),
                new ThreadPoolExecutor.AbortPolicy());
        executors.add(executor);
        return executor;
    }

    /**
     * Single consumer of the play request mailbox.
     */
    @Bean
    public ExecutorService playRequestExecutor() {
        ExecutorService executor = Executors.newSingleThreadExecutor(new NamedThreadFactory("play-request-"));
        executors.add(executor);
        return executor;
    }

    @PreDestroy
    public void shutdown() {
        for (ExecutorService executor : executors) {
            executor.shutdown();
        }
    }

    private static class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger idx = new AtomicInteger(1);
        private final String prefix;

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + idx.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
