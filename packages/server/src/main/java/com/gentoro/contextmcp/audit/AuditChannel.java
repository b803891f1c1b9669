package com.gentoro.contextmcp.audit;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fire-and-forget sink for side effects that must never fail or slow down a business operation:
 * tool-call and security audit rows, search analytics and usage metrics.
 *
 * <p>Failures are logged and counted. The counters are the only place they become visible; {@link
 * #stats()} is exposed through the stats resource.
 */
public class AuditChannel implements AutoCloseable {
  private static final org.slf4j.Logger log =
      com.gentoro.contextmcp.logging.LoggingService.getLogger(AuditChannel.class);

  public static final int DEFAULT_QUEUE_CAPACITY = 10_000;

  private final Executor executor;
  private final ExecutorService ownedExecutor;
  private final AtomicLong submitted = new AtomicLong();
  private final AtomicLong completed = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();
  private final AtomicLong pending = new AtomicLong();

  /** Channel delivering on the given executor; the caller keeps ownership of it. */
  public AuditChannel(Executor executor) {
    this.executor = executor;
    this.ownedExecutor = null;
  }

  private AuditChannel(ExecutorService executor) {
    this.executor = executor;
    this.ownedExecutor = executor;
  }

  /** Channel backed by one daemon worker thread, drained on {@link #close()}. */
  public static AuditChannel singleThreaded() {
    return singleThreaded(DEFAULT_QUEUE_CAPACITY);
  }

  /**
   * Like {@link #singleThreaded()} with at most {@code queueCapacity} entries waiting. Entries
   * submitted while the queue is full are dropped and counted as failures.
   */
  public static AuditChannel singleThreaded(int queueCapacity) {
    if (queueCapacity < 1) {
      throw new IllegalArgumentException("queueCapacity must be positive: " + queueCapacity);
    }
    return new AuditChannel(
        new ThreadPoolExecutor(
            1,
            1,
            0L,
            TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(queueCapacity),
            r -> {
              Thread t = new Thread(r, "context-audit-channel");
              t.setDaemon(true);
              return t;
            },
            new ThreadPoolExecutor.AbortPolicy()));
  }

  public void submit(String kind, Runnable task) {
    submitted.incrementAndGet();
    pending.incrementAndGet();
    try {
      executor.execute(
          () -> {
            try {
              task.run();
              completed.incrementAndGet();
            } catch (RuntimeException e) {
              recordFailure(kind, e);
            } finally {
              pending.decrementAndGet();
            }
          });
    } catch (RejectedExecutionException e) {
      pending.decrementAndGet();
      recordFailure(kind, e);
    }
  }

  /** Count a side-effect failure that happened outside of the channel's own tasks. */
  public void recordFailure(String kind, Throwable cause) {
    failed.incrementAndGet();
    log.warn("Failed to record {} entry: {}", kind, cause.toString(), cause);
  }

  public AuditChannelStats stats() {
    return new AuditChannelStats(submitted.get(), completed.get(), failed.get(), pending.get());
  }

  @Override
  public void close() {
    if (ownedExecutor == null) return;
    ownedExecutor.shutdown();
    try {
      if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Audit channel did not drain in time; {} entries pending", pending.get());
        ownedExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      ownedExecutor.shutdownNow();
    }
  }

  public record AuditChannelStats(long submitted, long completed, long failed, long pending) {}
}
