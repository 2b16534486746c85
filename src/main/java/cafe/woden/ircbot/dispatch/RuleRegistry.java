package cafe.woden.ircbot.dispatch;

import com.google.common.collect.ImmutableList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Registered handlers grouped by priority, plus interval jobs. */
public final class RuleRegistry {
  private static final Logger log = LoggerFactory.getLogger(RuleRegistry.class);

  private final Map<Priority, List<HandlerDescriptor>> byPriority = new EnumMap<>(Priority.class);
  private final List<IntervalJob> jobs = new CopyOnWriteArrayList<>();

  public RuleRegistry() {
    for (Priority p : Priority.values()) byPriority.put(p, new CopyOnWriteArrayList<>());
  }

  public void register(HandlerDescriptor handler) {
    Objects.requireNonNull(handler, "handler");
    byPriority.get(handler.priority()).add(handler);
    log.debug(
        "[ircbot] Registered {} handler {} ({} pattern(s), events {})",
        handler.kind(),
        handler.id(),
        handler.patterns().size(),
        handler.events());
  }

  public void registerJob(IntervalJob job) {
    jobs.add(Objects.requireNonNull(job, "job"));
    log.debug("[ircbot] Registered interval job {} every {}", job.id(), job.period());
  }

  /** Handlers of {@code priority} in registration order. */
  public List<HandlerDescriptor> handlers(Priority priority) {
    return byPriority.get(priority);
  }

  public ImmutableList<HandlerDescriptor> all() {
    ImmutableList.Builder<HandlerDescriptor> b = ImmutableList.builder();
    for (Priority p : Priority.values()) b.addAll(byPriority.get(p));
    return b.build();
  }

  public ImmutableList<IntervalJob> jobs() {
    return ImmutableList.copyOf(jobs);
  }
}
