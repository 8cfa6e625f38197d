package com.aiadvent.codegraph.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

@Configuration
@EnableScheduling
@EnableConfigurationProperties({IndexWorkerProperties.class, CodeGraphProperties.class})
public class IndexWorkerConfiguration {

  @Bean(name = "indexWorkerExecutor", destroyMethod = "shutdown")
  public ExecutorService indexWorkerExecutor(IndexWorkerProperties properties) {
    return Executors.newFixedThreadPool(
        properties.getWorkerCount(), daemonThreads("index-worker-"));
  }

  static ThreadFactory daemonThreads(String prefix) {
    return new ThreadFactory() {
      private final AtomicInteger index = new AtomicInteger();

      @Override
      public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable);
        thread.setName(prefix + index.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      }
    };
  }
}
