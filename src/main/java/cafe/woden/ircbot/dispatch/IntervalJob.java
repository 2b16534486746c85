package cafe.woden.ircbot.dispatch;

import java.time.Duration;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** A task run on the worker pool every {@code period}. */
@ValueObject
public record IntervalJob(String plugin, String name, Duration period, IntervalTask task) {

  public IntervalJob {
    plugin = Objects.toString(plugin, "").trim();
    name = Objects.toString(name, "").trim();
    Objects.requireNonNull(period, "period");
    Objects.requireNonNull(task, "task");
    if (period.isZero() || period.isNegative()) {
      throw new IllegalArgumentException("interval must be positive: " + period);
    }
  }

  public static IntervalJob every(Duration period, String name, IntervalTask task) {
    return new IntervalJob("", name, period, task);
  }

  public IntervalJob withPlugin(String plugin) {
    return new IntervalJob(plugin, name, period, task);
  }

  public String id() {
    return plugin.isEmpty() ? name : plugin + "." + name;
  }
}
