package ca.gc.cra.reach.application.pipeline;

import ca.gc.cra.reach.infrastructure.exec.ExecutorFactories;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * One fixed-size worker pool with bounded in-flight submissions, used for a single pipeline phase.
 *
 * <p>{@link #submit(Runnable)} blocks the submitting thread while {@code maxInFlight} tasks are queued or
 * running. Worker failures are captured and rethrown by {@link #awaitCompletion()}. Workers carry the MDC
 * {@code phase} key while running a task. Not reusable: submit, await, close.</p>
 */
final class BoundedPhase implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(BoundedPhase.class);
  private static final long AWAIT_POLL_SECONDS = 1L;

  private final String phase;
  private final ExecutorService pool;
  private final Semaphore permits;
  private final AtomicReference<Throwable> failure = new AtomicReference<>();

  BoundedPhase(String phase, int workers, int maxInFlight) {
    if (maxInFlight < workers) {
      throw new IllegalArgumentException("maxInFlight must be at least workers");
    }
    this.phase = phase;
    this.permits = new Semaphore(maxInFlight);
    this.pool = ExecutorFactories.newProbePool(workers, "reach-" + phase, this::onUncaught);
  }

  void submit(Runnable task) throws InterruptedException {
    rethrowFailure();
    permits.acquire();
    try {
      pool.execute(() -> {
        MDC.put("phase", phase);
        try {
          task.run();
        } catch (RuntimeException | Error ex) {
          failure.compareAndSet(null, ex);
          throw ex;
        } finally {
          MDC.remove("phase");
          permits.release();
        }
      });
    } catch (RejectedExecutionException ex) {
      permits.release();
      throw ex;
    }
  }

  /**
   * Stops accepting work and waits for every submitted task to finish.
   *
   * @throws InterruptedException if interrupted while waiting; running workers are interrupted too
   * @throws IllegalStateException if a worker failed
   */
  void awaitCompletion() throws InterruptedException {
    pool.shutdown();
    try {
      while (!pool.awaitTermination(AWAIT_POLL_SECONDS, TimeUnit.SECONDS)) {
        log.trace("Waiting for {} workers to drain", phase);
      }
    } catch (InterruptedException ex) {
      pool.shutdownNow();
      throw ex;
    }
    rethrowFailure();
  }

  @Override
  public void close() {
    if (!pool.isTerminated()) {
      pool.shutdownNow();
    }
  }

  private void onUncaught(Thread thread, Throwable ex) {
    failure.compareAndSet(null, ex);
    log.error("{} worker {} failed", phase, thread.getName(), ex);
  }

  private void rethrowFailure() {
    Throwable ex = failure.get();
    if (ex != null) {
      throw new IllegalStateException(phase + " worker failed", ex);
    }
  }
}
