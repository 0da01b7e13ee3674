package com.contractlink.harvester.config;

import com.contractlink.harvester.harvest.http.RetryPolicy;
import com.contractlink.harvester.harvest.http.Sleeper;
import com.contractlink.harvester.harvest.model.SourceId;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class HarvestConfig {

    @Bean(name = "harvestExecutor", destroyMethod = "shutdownNow")
    public ExecutorService harvestExecutor(HarvesterProperties properties) {
        int size = Math.max(SourceId.values().length, properties.getGlobalConcurrency());
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(size, runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("harvest-scraper-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(HarvesterProperties properties) {
        int size = Math.max(4, properties.getGlobalConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean
    public RetryPolicy retryPolicy(HarvesterProperties properties) {
        return RetryPolicy.from(properties.getRetry(), Sleeper.THREAD);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
