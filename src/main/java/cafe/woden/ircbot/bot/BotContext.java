package cafe.woden.ircbot.bot;

import cafe.woden.ircbot.cap.CapabilityRequest;
import cafe.woden.ircbot.dispatch.Trigger;
import cafe.woden.ircbot.state.ChannelState;
import cafe.woden.ircbot.state.Privilege;
import java.util.List;
import java.util.Optional;

/** What handlers may do with the bot. */
public interface BotContext {

  /** Current nickname. */
  String nick();

  default void say(String recipient, String text) {
    say(recipient, text, 1);
  }

  /** Sends a PRIVMSG through flood control, split into at most {@code maxMessages} lines. */
  void say(String recipient, String text, int maxMessages);

  /** Answers {@code trigger} in its channel (prefixed with the sender's nick) or privately. */
  void reply(Trigger trigger, String text);

  void action(String recipient, String text);

  void notice(String recipient, String text);

  /** Writes {@code args} followed by {@code " :" + trailing} (when not null), unpaced. */
  void write(List<String> args, String trailing);

  /** Writes one protocol line as-is, unpaced. */
  void writeRaw(String line);

  void join(String channel);

  void join(String channel, String key);

  void part(String channel, String reason);

  /** Sends QUIT and closes the connection. */
  void quit(String reason);

  Optional<ChannelState> channel(String name);

  boolean hasPrivilege(String channel, String nick, Privilege privilege);

  boolean isCapabilityEnabled(String capability);

  /** Marks {@code plugin}'s part of {@code request} done; sends CAP END if that completes it. */
  void resumeCapabilityNegotiation(CapabilityRequest request, String plugin);

  KeyValueStore store();
}
