package com.opsmonitor.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class MonitoringConfig {

    /**
     * Fixed workers behind a queue that holds at most one tick's worth of jobs. Anything beyond that is
     * rejected and the caller fails the run instead of letting it wait unseen.
     */
    @Bean(name = "monitoringWorkerPool", destroyMethod = "shutdown")
    public ExecutorService monitoringWorkerPool(MonitoringProperties properties) {
        int workers = properties.getScheduler().getWorkerCount();
        return new ThreadPoolExecutor(
            workers,
            workers,
            0L,
            TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(properties.getScheduler().getMaxJobsPerTick()),
            namedThreads("monitoring-job"),
            new ThreadPoolExecutor.AbortPolicy()
        );
    }

    @Bean(name = "credentialExecutor", destroyMethod = "shutdown")
    public ExecutorService credentialExecutor(MonitoringProperties properties) {
        // three providers, up to three secrets each, per concurrently loading job
        int size = Math.max(4, properties.getScheduler().getWorkerCount() * 3);
        return Executors.newFixedThreadPool(size, namedThreads("credential-loader"));
    }

    @Bean(name = "agentHttpExecutor", destroyMethod = "shutdown")
    public ExecutorService agentHttpExecutor(MonitoringProperties properties) {
        int size = Math.max(2, properties.getScheduler().getWorkerCount());
        return Executors.newFixedThreadPool(size, namedThreads("agent-http"));
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
