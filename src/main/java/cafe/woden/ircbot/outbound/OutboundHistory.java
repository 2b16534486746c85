package cafe.woden.ircbot.outbound;

import com.google.common.collect.EvictingQueue;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The most recent sends to one recipient. Not thread-safe; {@link FloodControlQueue} holds this
 * object's monitor around every read-modify-write.
 */
final class OutboundHistory {

  record Sent(long atMs, String text) {}

  private final EvictingQueue<Sent> sent;

  OutboundHistory(int capacity) {
    this.sent = EvictingQueue.create(Math.max(1, capacity));
  }

  Sent last() {
    Sent last = null;
    for (Sent s : sent) last = s;
    return last;
  }

  /** Up to {@code n} most recent sends, oldest first. */
  List<Sent> recent(int n) {
    List<Sent> all = new ArrayList<>(sent);
    int from = Math.max(0, all.size() - Math.max(0, n));
    return all.subList(from, all.size());
  }

  static int count(List<Sent> window, String text) {
    int c = 0;
    for (Sent s : window) {
      if (Objects.equals(s.text(), text)) c++;
    }
    return c;
  }

  static long earliest(List<Sent> window, String text) {
    for (Sent s : window) {
      if (Objects.equals(s.text(), text)) return s.atMs();
    }
    return -1;
  }

  void add(long atMs, String text) {
    sent.add(new Sent(atMs, text));
  }

  int size() {
    return sent.size();
  }
}
