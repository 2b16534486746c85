package cafe.woden.ircbot.dispatch;

/** Body of an {@link IntervalJob}. */
@FunctionalInterface
public interface IntervalTask {
  void run() throws Exception;
}
