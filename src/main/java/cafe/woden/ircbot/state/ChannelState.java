package cafe.woden.ircbot.state;

import cafe.woden.ircbot.irc.IrcCaseMapping;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Members of one joined channel and their privilege bitmasks, keyed by case-folded nickname.
 *
 * <p>Mutated only by {@link PrivilegeTracker} on the reader thread; handlers on worker threads
 * read it concurrently.
 */
public final class ChannelState {
  private final String name;
  private final Map<String, Integer> privileges = new ConcurrentHashMap<>();
  private final Map<String, String> displayNicks = new ConcurrentHashMap<>();

  ChannelState(String name) {
    this.name = Objects.toString(name, "");
  }

  public String name() {
    return name;
  }

  public boolean contains(String nick) {
    return privileges.containsKey(IrcCaseMapping.fold(nick));
  }

  /** Bitmask for {@code nick}; 0 when absent. */
  public int privileges(String nick) {
    return privileges.getOrDefault(IrcCaseMapping.fold(nick), 0);
  }

  public boolean has(String nick, Privilege privilege) {
    return privilege.in(privileges(nick));
  }

  /** True when {@code nick} holds {@code privilege} or any higher level. */
  public boolean hasAtLeast(String nick, Privilege privilege) {
    return privileges(nick) >= privilege.bit();
  }

  /** Snapshot of display nickname to bitmask. */
  public ImmutableMap<String, Integer> members() {
    ImmutableMap.Builder<String, Integer> b = ImmutableMap.builder();
    privileges.forEach((k, v) -> b.put(displayNicks.getOrDefault(k, k), v));
    return b.build();
  }

  public int size() {
    return privileges.size();
  }

  void put(String nick, int mask) {
    String key = IrcCaseMapping.fold(nick);
    if (key.isEmpty()) return;
    privileges.put(key, mask);
    displayNicks.put(key, nick);
  }

  void join(String nick) {
    String key = IrcCaseMapping.fold(nick);
    if (key.isEmpty()) return;
    privileges.putIfAbsent(key, 0);
    displayNicks.put(key, nick);
  }

  void grant(String nick, Privilege p) {
    String key = IrcCaseMapping.fold(nick);
    if (key.isEmpty()) return;
    privileges.merge(key, p.bit(), (a, b) -> a | b);
    displayNicks.putIfAbsent(key, nick);
  }

  void revoke(String nick, Privilege p) {
    String key = IrcCaseMapping.fold(nick);
    privileges.computeIfPresent(key, (k, v) -> v & ~p.bit());
  }

  boolean remove(String nick) {
    String key = IrcCaseMapping.fold(nick);
    displayNicks.remove(key);
    return privileges.remove(key) != null;
  }

  void rename(String oldNick, String newNick) {
    String oldKey = IrcCaseMapping.fold(oldNick);
    Integer mask = privileges.remove(oldKey);
    displayNicks.remove(oldKey);
    if (mask == null) return;
    put(newNick, mask);
  }

  @Override
  public String toString() {
    return "ChannelState(" + name + ", " + members() + ")";
  }
}
