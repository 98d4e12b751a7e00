package ca.gc.cra.units.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the executors used to drain external renderer processes.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Builds an elastic pool of daemon threads that reads process output streams.
   *
   * <p>Threads are created on demand, retired after 30 seconds idle, and never keep the JVM alive.</p>
   *
   * @param prefix thread-name prefix; blank values fall back to {@code units-drain}
   * @param handler uncaught exception handler; {@code null} logs the failure at WARN
   * @return configured executor service
   */
  public static ExecutorService newDrainPool(String prefix, UncaughtExceptionHandler handler) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "units-drain" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler,
        (thread, ex) -> log.warn("Uncaught failure on {}", thread.getName(), ex));
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
        0,
        Integer.MAX_VALUE,
        30L,
        TimeUnit.SECONDS,
        new SynchronousQueue<>(),
        factory);
  }
}
