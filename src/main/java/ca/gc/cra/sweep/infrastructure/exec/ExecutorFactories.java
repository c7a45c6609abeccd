package ca.gc.cra.sweep.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the executors the sweep uses.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a single-thread executor for a scoped background task such as the full-battery heartbeat.
   *
   * @param prefix thread-name prefix used to tag the worker thread
   * @param handler uncaught exception handler installed on the worker thread
   * @return executor with exactly one worker thread
   */
  public static ExecutorService newScopedWorker(String prefix, UncaughtExceptionHandler handler) {
    ThreadFactory factory = namedThreadFactory(prefix, handler);
    return new ThreadPoolExecutor(
        1,
        1,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds a thread factory producing daemon threads named {@code prefix-N}.
   *
   * @param prefix thread-name prefix; defaults to {@code sweep-worker} when blank
   * @param handler uncaught exception handler; {@code null} keeps the JVM default
   * @return thread factory
   */
  public static ThreadFactory namedThreadFactory(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "sweep-worker" : prefix;
    UncaughtExceptionHandler effectiveHandler =
        handler != null ? handler : Thread.getDefaultUncaughtExceptionHandler();
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(true);
      if (effectiveHandler != null) {
        thread.setUncaughtExceptionHandler(effectiveHandler);
      }
      return thread;
    };
  }
}
