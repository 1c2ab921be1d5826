package ca.gc.cra.reach.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pools for the liveness prefilter and the scan engine.
 */
public final class ExecutorFactories {
  private static final String DEFAULT_PREFIX = "reach-probe";

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size pool of non-daemon worker threads named {@code <prefix>-<n>}.
   *
   * <p>The queue is unbounded; callers bound in-flight submissions themselves so the submitting thread blocks
   * instead of seeing rejections.</p>
   *
   * @param size worker count
   * @param prefix thread-name prefix such as {@code reach-scan}; blank means {@value #DEFAULT_PREFIX}
   * @param handler installed on each worker; {@code null} ignores uncaught failures
   * @return executor that must be shut down by the caller
   */
  public static ExecutorService newProbePool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive (was " + size + ")");
    }
    String name = prefix == null || prefix.isBlank() ? DEFAULT_PREFIX : prefix.trim();
    ThreadFactory threads = new ProbeThreadFactory(name, handler);
    return new ThreadPoolExecutor(size, size, 0L, TimeUnit.MILLISECONDS, new LinkedBlockingQueue<>(), threads);
  }

  private static final class ProbeThreadFactory implements ThreadFactory {
    private final String prefix;
    private final UncaughtExceptionHandler handler;
    private final AtomicInteger next = new AtomicInteger();

    ProbeThreadFactory(String prefix, UncaughtExceptionHandler handler) {
      this.prefix = prefix;
      this.handler = handler;
    }

    @Override
    public Thread newThread(Runnable task) {
      Thread thread = new Thread(task, prefix + "-" + next.getAndIncrement());
      thread.setDaemon(false);
      if (handler != null) {
        thread.setUncaughtExceptionHandler(handler);
      }
      return thread;
    }
  }
}
