package cafe.woden.ircbot.bot;

import cafe.woden.ircbot.irc.IrcCaseMapping;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** {@link KeyValueStore} that lives as long as the process. A null value removes the key. */
public class InMemoryKeyValueStore implements KeyValueStore {

  private final Map<String, Map<String, String>> nicks = new ConcurrentHashMap<>();
  private final Map<String, Map<String, String>> channels = new ConcurrentHashMap<>();

  @Override
  public Optional<String> nickValue(String nick, String key) {
    return get(nicks, nick, key);
  }

  @Override
  public void setNickValue(String nick, String key, String value) {
    put(nicks, nick, key, value);
  }

  @Override
  public Optional<String> channelValue(String channel, String key) {
    return get(channels, channel, key);
  }

  @Override
  public void setChannelValue(String channel, String key, String value) {
    put(channels, channel, key, value);
  }

  private static Optional<String> get(
      Map<String, Map<String, String>> table, String identity, String key) {
    Map<String, String> values = table.get(IrcCaseMapping.fold(identity));
    if (values == null) return Optional.empty();
    return Optional.ofNullable(values.get(Objects.toString(key, "")));
  }

  private static void put(
      Map<String, Map<String, String>> table, String identity, String key, String value) {
    String id = IrcCaseMapping.fold(identity);
    if (id.isEmpty()) return;
    String k = Objects.toString(key, "");
    if (value == null) {
      Map<String, String> values = table.get(id);
      if (values != null) values.remove(k);
      return;
    }
    table.computeIfAbsent(id, x -> new ConcurrentHashMap<>()).put(k, value);
  }
}
