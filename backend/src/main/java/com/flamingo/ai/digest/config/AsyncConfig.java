package com.flamingo.ai.digest.config;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for worker threads, scheduling and the pipeline clock. */
@Configuration
@EnableScheduling
public class AsyncConfig {

  /** Runs the long-lived claim loops, one thread per worker. */
  @Bean(name = "enrichmentWorkerExecutor")
  public ThreadPoolTaskExecutor enrichmentWorkerExecutor(PipelineConfig pipelineConfig) {
    int workers = pipelineConfig.getWorker().getWorkers();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(workers);
    executor.setMaxPoolSize(workers);
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("enrichment-worker-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }

  /** Processes the messages of a claimed batch. */
  @Bean(name = "enrichmentTaskExecutor")
  public ThreadPoolTaskExecutor enrichmentTaskExecutor(PipelineConfig pipelineConfig) {
    PipelineConfig.Worker worker = pipelineConfig.getWorker();
    int threads = worker.getWorkers() * worker.getFanOut();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(threads * 2);
    executor.setThreadNamePrefix("enrichment-task-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.initialize();
    return executor;
  }

  /** Runs provider calls so the caller can stop waiting at the provider timeout. */
  @Bean(name = "providerCallExecutor")
  public ThreadPoolTaskExecutor providerCallExecutor(PipelineConfig pipelineConfig) {
    PipelineConfig.Worker worker = pipelineConfig.getWorker();
    int threads = worker.getWorkers() * worker.getFanOut();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(threads * 4);
    executor.setThreadNamePrefix("provider-call-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.initialize();
    return executor;
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
