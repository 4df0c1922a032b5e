package com.example.Attrition.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ThreadPoolExecutor;

@Slf4j
@Configuration
public class AttritionConfig {

    /**
     * Zone used to turn calendar days into instants and to decide what "today" is.
     */
    @Bean
    public ZoneId attritionZone(@Value("${attrition.zone:UTC}") String zone) {
        return ZoneId.of(zone);
    }

    @Bean
    public Clock clock(ZoneId attritionZone) {
        return Clock.system(attritionZone);
    }

    /**
     * Pool for the per-employee scoring fan-out of company reports. Sized to what the
     * attendance store can serve concurrently; saturation runs the task on the caller.
     */
    @Bean(name = "riskScoringExecutor")
    public ThreadPoolTaskExecutor riskScoringExecutor(@Value("${attrition.report.parallelism:4}") int parallelism) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("risk-scoring-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        log.info("Risk scoring executor initialized with {} thread(s)", parallelism);
        return executor;
    }
}
