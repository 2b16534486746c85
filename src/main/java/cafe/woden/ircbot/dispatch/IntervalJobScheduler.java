package cafe.woden.ircbot.dispatch;

import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import java.util.Collection;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fires interval jobs on an RxJava ticker and runs them on the worker pool.
 *
 * <p>The first run happens one period after {@link #start(Collection)}. A failing job is logged
 * and keeps its schedule.
 */
public final class IntervalJobScheduler {
  private static final Logger log = LoggerFactory.getLogger(IntervalJobScheduler.class);

  private final Scheduler scheduler;
  private final WorkerPool workers;
  private final CompositeDisposable running = new CompositeDisposable();

  public IntervalJobScheduler(Scheduler scheduler, WorkerPool workers) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.workers = Objects.requireNonNull(workers, "workers");
  }

  public void start(Collection<IntervalJob> jobs) {
    if (jobs == null) return;
    for (IntervalJob job : jobs) {
      long periodMs = job.period().toMillis();
      running.add(
          Flowable.interval(periodMs, periodMs, TimeUnit.MILLISECONDS, scheduler)
              .onBackpressureDrop()
              .subscribe(
                  tick -> workers.submit(job.id(), () -> run(job)),
                  err -> log.warn("[ircbot] Interval ticker for {} failed", job.id(), err)));
      log.debug("[ircbot] Started interval job {} every {}ms", job.id(), periodMs);
    }
  }

  public int size() {
    return running.size();
  }

  public void stop() {
    running.clear();
  }

  private static void run(IntervalJob job) {
    try {
      job.task().run();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } catch (Exception e) {
      log.error("[ircbot] Interval job {} failed", job.id(), e);
    }
  }
}
