package cafe.woden.ircbot.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.ircbot.util.NamedThreads;
import com.google.common.util.concurrent.MoreExecutors;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class WorkerPoolTest {

  @Test
  void finishedTasksAreNoLongerTracked() throws Exception {
    WorkerPool direct = new WorkerPool(MoreExecutors.newDirectExecutorService());
    AtomicInteger runs = new AtomicInteger();

    assertTrue(direct.submit("quick", runs::incrementAndGet));
    assertEquals(1, runs.get());
    assertEquals(0, direct.inFlight());

    WorkerPool threaded = new WorkerPool(NamedThreads.newBoundedPool("ircbot-pool-test", 2, 2, 8));
    try {
      for (int i = 0; i < 20; i++) threaded.submit("job" + i, runs::incrementAndGet);
      assertTrue(threaded.awaitIdle(5, TimeUnit.SECONDS));
      assertEquals(21, runs.get());
    } finally {
      threaded.shutdown();
    }
  }

  @Test
  void cancelAllInterruptsRunningTasks() throws Exception {
    WorkerPool pool = new WorkerPool(NamedThreads.newBoundedPool("ircbot-cancel-test", 1, 1, 1));
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch interrupted = new CountDownLatch(1);
    try {
      pool.submit(
          "sleeper",
          () -> {
            started.countDown();
            try {
              Thread.sleep(60_000);
            } catch (InterruptedException e) {
              interrupted.countDown();
            }
          });
      assertTrue(started.await(5, TimeUnit.SECONDS));
      assertEquals(1, pool.inFlight());

      assertEquals(1, pool.cancelAll());

      assertTrue(interrupted.await(5, TimeUnit.SECONDS));
      assertEquals(0, pool.inFlight());
    } finally {
      pool.shutdown();
    }
  }

  @Test
  void shutDownPoolDropsWork() {
    WorkerPool pool = new WorkerPool(MoreExecutors.newDirectExecutorService());
    pool.shutdown();

    assertFalse(pool.submit("late", () -> {}));
  }
}
