package com.scholary.langtag.config;

import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async scan execution.
 *
 * <p>A single worker thread runs scan jobs, so two scans never classify files at the same time.
 * Further submissions wait in a bounded queue.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "taskExecutor")
  public Executor taskExecutor(@Value("${scan.queue-capacity:100}") int queueCapacity) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix("scan-");
    executor.initialize();
    return executor;
  }
}
