package dev.codescope.config;

import dev.codescope.search.SearchProperties;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools for the blocking calls of a search.
 *
 * <p>The dense and keyword fetches share {@code searchExecutor}. The reranker gets its own small
 * pool with a bounded backlog, so an abandoned rerank call can never hold a thread the fetches
 * need. A full backlog rejects the submit and the request goes on without reranking.
 */
@Configuration
public class SearchExecutionConfig {

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService searchExecutor(SearchProperties searchProperties) {
    return Executors.newFixedThreadPool(
        Math.max(2, searchProperties.getExecutorPoolSize()), daemonThreads("search-"));
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService rerankExecutor(SearchProperties searchProperties) {
    return boundedRerankPool(
        searchProperties.getRerankPoolSize(), searchProperties.getRerankQueueCapacity());
  }

  /** Single-threaded scheduler for the query cache sweep. */
  @Bean
  public ThreadPoolTaskScheduler cacheSweepScheduler() {
    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(1);
    scheduler.setThreadNamePrefix("query-cache-sweep-");
    scheduler.setDaemon(true);
    scheduler.setRemoveOnCancelPolicy(true);
    return scheduler;
  }

  static ExecutorService boundedRerankPool(int threads, int queueCapacity) {
    int size = Math.max(1, threads);
    BlockingQueue<Runnable> queue =
        queueCapacity == 0 ? new SynchronousQueue<>() : new ArrayBlockingQueue<>(queueCapacity);
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        queue,
        daemonThreads("rerank-"),
        new ThreadPoolExecutor.AbortPolicy()) {
      @Override
      protected void beforeExecute(Thread thread, Runnable task) {
        // a cancelled call may leave the interrupt flag set on a reused thread
        Thread.interrupted();
        super.beforeExecute(thread, task);
      }
    };
  }

  private static ThreadFactory daemonThreads(String prefix) {
    AtomicInteger counter = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
