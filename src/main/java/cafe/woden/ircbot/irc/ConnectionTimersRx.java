package cafe.woden.ircbot.irc;

import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.Disposable;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RxJava-driven liveness timers for a connection.
 *
 * <p>One ticker does two jobs: it closes the connection when nothing has been received for the
 * timeout, and it sends a keep-alive PING once half the timeout passes without any outbound
 * traffic. The PING itself counts as outbound traffic, so it repeats at most every half timeout.
 */
public final class ConnectionTimersRx {
  private static final Logger log = LoggerFactory.getLogger(ConnectionTimersRx.class);

  private static final long DEFAULT_CHECK_PERIOD_MS = 1_000L;

  private final Scheduler scheduler;
  private final LongSupplier clock;
  private final long checkPeriodMs;

  public ConnectionTimersRx(Scheduler scheduler, LongSupplier clock) {
    this(scheduler, clock, DEFAULT_CHECK_PERIOD_MS);
  }

  public ConnectionTimersRx(Scheduler scheduler, LongSupplier clock, long checkPeriodMs) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.checkPeriodMs = Math.max(1L, checkPeriodMs);
  }

  public long now() {
    return clock.getAsLong();
  }

  void startWatchdog(
      ConnectionState c, Duration timeout, Runnable onTimeout, Runnable sendKeepAlive) {
    if (c == null) return;
    long timeoutMs = timeout == null ? 0 : timeout.toMillis();
    if (timeoutMs <= 0) {
      stopWatchdog(c);
      return;
    }

    long now = clock.getAsLong();
    c.lastInboundMs.set(now);
    if (c.lastOutboundMs.get() == 0) c.lastOutboundMs.set(now);
    c.localTimeoutEmitted.set(false);

    Disposable d =
        Flowable.interval(checkPeriodMs, checkPeriodMs, TimeUnit.MILLISECONDS, scheduler)
            .subscribe(
                tick -> check(c, timeoutMs, onTimeout, sendKeepAlive),
                err -> log.debug("[ircbot] Watchdog ticker error", err));

    Disposable prev = c.watchdogDisposable.getAndSet(d);
    if (prev != null && !prev.isDisposed()) prev.dispose();
  }

  void stopWatchdog(ConnectionState c) {
    if (c == null) return;
    Disposable prev = c.watchdogDisposable.getAndSet(null);
    if (prev != null && !prev.isDisposed()) prev.dispose();
  }

  private void check(ConnectionState c, long timeoutMs, Runnable onTimeout, Runnable keepAlive) {
    long now = clock.getAsLong();
    long inboundIdle = now - c.lastInboundMs.get();
    if (inboundIdle > timeoutMs) {
      if (c.localTimeoutEmitted.compareAndSet(false, true)) {
        log.warn("[ircbot] Ping timeout (no inbound traffic for {}s)", inboundIdle / 1000);
        stopWatchdog(c);
        onTimeout.run();
      }
      return;
    }

    long outboundIdle = now - c.lastOutboundMs.get();
    if (outboundIdle >= timeoutMs / 2) {
      log.debug("[ircbot] No outbound traffic for {}ms; sending keep-alive PING", outboundIdle);
      keepAlive.run();
    }
  }
}
