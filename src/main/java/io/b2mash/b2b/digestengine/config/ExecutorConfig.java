package io.b2mash.b2b.digestengine.config;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pools and the clock shared by the scheduler and dispatch paths. Each pool is bounded; the
 * dispatch pool falls back to caller-runs when saturated so ingestion applies back-pressure instead
 * of dropping matches.
 */
@Configuration
public class ExecutorConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  /** Runs one {@code ExecutionRunner.run} per due schedule. */
  @Bean(name = "scheduleRunnerExecutor")
  public ThreadPoolTaskExecutor scheduleRunnerExecutor(
      @Value("${digest-engine.scheduler.runner-threads:4}") int threads) {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(1_000);
    executor.setThreadNamePrefix("digest-run-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }

  /** Caps concurrent outbound notification sends. */
  @Bean(name = "notificationDispatchExecutor")
  public ThreadPoolTaskExecutor notificationDispatchExecutor(NotificationProperties properties) {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.dispatchThreads());
    executor.setMaxPoolSize(properties.dispatchThreads());
    executor.setQueueCapacity(properties.dispatchQueueCapacity());
    executor.setThreadNamePrefix("notify-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }

  /** Hosts blocking collaborator calls so they can be abandoned on timeout. */
  @Bean(name = "collaboratorExecutor")
  public ThreadPoolTaskExecutor collaboratorExecutor(
      @Value("${digest-engine.execution.collaborator-threads:8}") int threads) {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(256);
    executor.setThreadNamePrefix("collab-");
    return executor;
  }
}
