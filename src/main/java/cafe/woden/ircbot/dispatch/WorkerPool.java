package cafe.woden.ircbot.dispatch;

import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs threaded handlers and interval jobs off the reader thread.
 *
 * <p>In-flight tasks are tracked so {@link #cancelAll()} can interrupt them when the connection
 * closes. A saturated executor rejects new work; rejected tasks are logged and dropped.
 */
public final class WorkerPool {
  private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

  private final ListeningExecutorService executor;
  private final Set<Future<?>> inFlight = ConcurrentHashMap.newKeySet();

  public WorkerPool(ExecutorService executor) {
    this.executor =
        MoreExecutors.listeningDecorator(Objects.requireNonNull(executor, "executor"));
  }

  /** @return false when the task was rejected */
  public boolean submit(String name, Runnable task) {
    Objects.requireNonNull(task, "task");
    try {
      ListenableFuture<?> f = executor.submit(task);
      inFlight.add(f);
      // Runs at once when the task already finished.
      f.addListener(() -> inFlight.remove(f), MoreExecutors.directExecutor());
      return true;
    } catch (RejectedExecutionException e) {
      log.warn("[ircbot] Worker pool saturated; dropping {}", name);
      return false;
    }
  }

  public int inFlight() {
    inFlight.removeIf(Future::isDone);
    return inFlight.size();
  }

  /** Interrupts every tracked task. */
  public int cancelAll() {
    int n = 0;
    for (Future<?> f : List.copyOf(inFlight)) {
      if (f.cancel(true)) n++;
    }
    inFlight.clear();
    if (n > 0) log.info("[ircbot] Cancelled {} running handler(s)", n);
    return n;
  }

  public void shutdown() {
    cancelAll();
    executor.shutdownNow();
  }

  public boolean awaitIdle(long timeout, TimeUnit unit) throws InterruptedException {
    long deadline = System.nanoTime() + unit.toNanos(timeout);
    while (inFlight() > 0) {
      if (System.nanoTime() >= deadline) return false;
      Thread.sleep(5);
    }
    return true;
  }
}
