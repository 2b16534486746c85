package cafe.woden.ircbot.bot;

import java.util.Optional;

/** Per-nick and per-channel settings. Identities are compared case-insensitively. */
public interface KeyValueStore {

  Optional<String> nickValue(String nick, String key);

  void setNickValue(String nick, String key, String value);

  Optional<String> channelValue(String channel, String key);

  void setChannelValue(String channel, String key, String value);
}
