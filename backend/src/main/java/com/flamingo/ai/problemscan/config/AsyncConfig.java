package com.flamingo.ai.problemscan.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors for the per-segment matching fan-out. */
@Configuration
public class AsyncConfig {

  /**
   * Runs one match lookup per detected problem. Lookups are I/O bound (search plus an optional LLM
   * call), so the pool is sized well above the core count.
   */
  @Bean(name = "matchingExecutor")
  public Executor matchingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(8);
    executor.setMaxPoolSize(32);
    executor.setQueueCapacity(200);
    executor.setThreadNamePrefix("match-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
