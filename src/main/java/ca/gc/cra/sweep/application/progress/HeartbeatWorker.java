package ca.gc.cra.sweep.application.progress;

import ca.gc.cra.sweep.infrastructure.exec.ExecutorFactories;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Scoped background worker emitting a numbered beat on a fixed period.
 * <p><strong>Why:</strong> The full battery runs for minutes without progress points; the beat is the only
 * liveness signal while it runs.</p>
 * <p><strong>Role:</strong> Opened immediately before the long step in a try-with-resources block and closed
 * immediately after, on every exit path.</p>
 * <p><strong>Thread-safety:</strong> {@link #close()} may be called from any thread and is idempotent. The
 * beat callback runs on the worker thread.</p>
 * <p><strong>Observability:</strong> Logs a warning when the worker does not stop within the join bound.</p>
 *
 * <p>State is limited to a stop signal and a beat counter.</p>
 *
 * @since 0.1.0
 */
public final class HeartbeatWorker implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(HeartbeatWorker.class);
  static final String THREAD_PREFIX = "sweep-heartbeat";

  private final CountDownLatch stopSignal = new CountDownLatch(1);
  private final AtomicInteger beats = new AtomicInteger();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final AtomicInteger stopCount = new AtomicInteger();
  private final HeartbeatSettings settings;
  private final ExecutorService executor;

  private HeartbeatWorker(HeartbeatSettings settings, IntConsumer onBeat) {
    this.settings = settings;
    this.executor = ExecutorFactories.newScopedWorker(
        THREAD_PREFIX,
        (thread, ex) -> log.error("Heartbeat thread {} terminated unexpectedly", thread.getName(), ex));
    this.executor.execute(() -> beatUntilStopped(onBeat));
  }

  /**
   * Starts a worker that invokes {@code onBeat} with 1, 2, 3, ... once per period until closed.
   *
   * @param settings beat period and join bound
   * @param onBeat callback receiving the beat index
   * @return running worker; close it to stop
   */
  public static HeartbeatWorker start(HeartbeatSettings settings, IntConsumer onBeat) {
    Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(onBeat, "onBeat");
    return new HeartbeatWorker(settings, onBeat);
  }

  private void beatUntilStopped(IntConsumer onBeat) {
    long periodMillis = settings.period().toMillis();
    try {
      while (!stopSignal.await(periodMillis, TimeUnit.MILLISECONDS)) {
        int index = beats.incrementAndGet();
        try {
          onBeat.accept(index);
        } catch (RuntimeException ex) {
          log.warn("Heartbeat {} could not be published", index, ex);
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.debug("Heartbeat worker interrupted after {} beats", beats.get());
    }
  }

  /**
   * Returns the number of beats emitted so far.
   *
   * @return beat count
   */
  public int beats() {
    return beats.get();
  }

  /**
   * Returns how many times the stop-and-join sequence ran. Stays at one however often {@link #close()} is
   * called.
   *
   * @return stop count
   */
  public int stopCount() {
    return stopCount.get();
  }

  /**
   * Indicates whether the worker thread has finished.
   *
   * @return {@code true} once the worker terminated
   */
  public boolean isTerminated() {
    return executor.isTerminated();
  }

  /**
   * Signals the worker to stop and waits up to the join bound; forces interruption past it.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    stopCount.incrementAndGet();
    stopSignal.countDown();
    executor.shutdown();
    long timeoutMillis = settings.joinTimeout().toMillis();
    try {
      if (!executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
        log.warn("Heartbeat worker still active after {} ms; interrupting", timeoutMillis);
        executor.shutdownNow();
        if (!executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
          log.error("Heartbeat worker failed to terminate");
        }
      }
    } catch (InterruptedException ex) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
