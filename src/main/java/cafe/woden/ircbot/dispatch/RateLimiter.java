package cafe.woden.ircbot.dispatch;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Last-invocation timestamps keyed by (scope identity, handler).
 *
 * <p>A denied attempt restarts the cooldown: repeated triggering inside the period keeps the
 * handler blocked until the caller goes quiet for a full period. Entries are never pruned.
 */
public final class RateLimiter {
  private final LongSupplier clock;
  private final Map<String, Long> lastInvocation = new HashMap<>();

  public RateLimiter(LongSupplier clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public long now() {
    return clock.getAsLong();
  }

  /**
   * Returns {@code true} when {@code key} was stamped less than {@code periodMs} ago, and stamps it
   * with the current time in that case.
   */
  public synchronized boolean deny(String key, long periodMs) {
    if (periodMs <= 0) return false;
    Long last = lastInvocation.get(key);
    long now = clock.getAsLong();
    if (last == null || now - last >= periodMs) return false;
    lastInvocation.put(key, now);
    return true;
  }

  public synchronized void stamp(String key) {
    lastInvocation.put(key, clock.getAsLong());
  }

  public synchronized int size() {
    return lastInvocation.size();
  }
}
