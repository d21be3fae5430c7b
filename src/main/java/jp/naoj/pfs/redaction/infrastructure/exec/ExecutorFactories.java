package jp.naoj.pfs.redaction.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the executors that fan out per-proposal redaction.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size executor for redaction workers.
   *
   * <p>The queue is bounded by {@code queueCapacity}; submissions beyond it are rejected, so callers
   * size it to the number of proposals they submit.</p>
   *
   * @param size number of worker threads to allocate
   * @param queueCapacity maximum number of waiting tasks
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread; {@code null} logs the failure
   * @return configured executor service
   */
  public static ExecutorService newRedactionPool(
      int size, int queueCapacity, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "pfs-redact" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler,
        (t, ex) -> log.error("Uncaught failure on redaction worker {}", t.getName(), ex));
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(true);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(queueCapacity),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }
}
