package cafe.woden.ircbot.util;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/** Shared helpers for creating bot-owned executors and threads with readable names. */
public final class NamedThreads {
  private static final Set<ExecutorService> TRACKED_EXECUTORS = ConcurrentHashMap.newKeySet();

  private NamedThreads() {}

  public static ThreadFactory namedFactory(String baseName, boolean daemon) {
    String base = normalize(baseName);
    AtomicInteger seq = new AtomicInteger(1);
    return r -> {
      Thread t = new Thread(r, base + "-" + seq.getAndIncrement());
      t.setDaemon(daemon);
      return t;
    };
  }

  public static ScheduledExecutorService newSingleThreadScheduledExecutor(String baseName) {
    return track(Executors.newSingleThreadScheduledExecutor(namedFactory(baseName, true)));
  }

  /**
   * Bounded pool for handler work.
   *
   * <p>Submissions beyond {@code queueCapacity} pending tasks are rejected rather than queued.
   */
  public static ThreadPoolExecutor newBoundedPool(
      String baseName, int coreThreads, int maxThreads, int queueCapacity) {
    int core = Math.max(1, coreThreads);
    int max = Math.max(core, maxThreads);
    int capacity = Math.max(1, queueCapacity);
    ThreadPoolExecutor pool =
        new ThreadPoolExecutor(
            core,
            max,
            60L,
            TimeUnit.SECONDS,
            new ArrayBlockingQueue<>(capacity),
            namedFactory(baseName, true),
            new ThreadPoolExecutor.AbortPolicy());
    return track(pool);
  }

  public static Thread start(String name, boolean daemon, Runnable task) {
    Thread t = new Thread(task, normalize(name));
    t.setDaemon(daemon);
    t.start();
    return t;
  }

  public static int shutdownTrackedExecutorsNow() {
    int count = 0;
    for (ExecutorService exec : List.copyOf(TRACKED_EXECUTORS)) {
      if (exec == null) continue;
      if (exec.isShutdown() || exec.isTerminated()) continue;
      exec.shutdownNow();
      count++;
    }
    TRACKED_EXECUTORS.clear();
    return count;
  }

  private static <E extends ExecutorService> E track(E exec) {
    TRACKED_EXECUTORS.removeIf(e -> e == null || e.isShutdown() || e.isTerminated());
    TRACKED_EXECUTORS.add(exec);
    return exec;
  }

  private static String normalize(String name) {
    String s = Objects.toString(name, "").trim();
    return s.isEmpty() ? "ircbot-thread" : s;
  }
}
