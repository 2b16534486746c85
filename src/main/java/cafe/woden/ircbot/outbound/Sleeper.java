package cafe.woden.ircbot.outbound;

/** Blocking pause used for output pacing; tests substitute one that advances a fake clock. */
@FunctionalInterface
public interface Sleeper {
  Sleeper THREAD = Thread::sleep;

  void sleep(long millis) throws InterruptedException;
}
