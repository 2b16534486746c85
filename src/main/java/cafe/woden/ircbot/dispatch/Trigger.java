package cafe.woden.ircbot.dispatch;

import cafe.woden.ircbot.irc.Ctcp;
import cafe.woden.ircbot.irc.Hostmask;
import cafe.woden.ircbot.irc.IrcLineParseUtil;
import cafe.woden.ircbot.irc.IrcMessage;
import com.google.common.collect.ImmutableList;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * A message that matched a handler, with the match groups and the sender's standing.
 *
 * <p>{@code sender} is where replies go: the channel for channel messages, the sender's nick for
 * private ones.
 */
public record Trigger(
    IrcMessage message,
    String sender,
    ImmutableList<String> groups,
    String command,
    String args,
    boolean admin,
    boolean owner) {

  public Trigger {
    Objects.requireNonNull(message, "message");
    sender = Objects.toString(sender, "");
    groups = groups == null ? ImmutableList.of() : groups;
    command = Objects.toString(command, "");
    args = Objects.toString(args, "");
  }

  static Trigger of(
      IrcMessage message, String sender, Matcher match, HandlerKind kind, boolean admin, boolean owner) {
    ImmutableList.Builder<String> g = ImmutableList.builder();
    for (int i = 0; i <= match.groupCount(); i++) g.add(Objects.toString(match.group(i), ""));
    String command = "";
    String args = "";
    if (kind == HandlerKind.COMMAND) {
      command = match.group(HandlerDescriptor.COMMAND_GROUP);
      args = match.group(HandlerDescriptor.ARGS_GROUP);
    }
    return new Trigger(message, sender, g.build(), command, args, admin, owner);
  }

  public String nick() {
    return message.nick();
  }

  public Hostmask source() {
    return message.source();
  }

  public String host() {
    return message.source().host();
  }

  /** The inbound command or numeric, e.g. {@code PRIVMSG} or {@code 001}. */
  public String event() {
    return message.command();
  }

  /** Message text, with any CTCP wrapping already removed. */
  public String text() {
    return message.text();
  }

  public Optional<String> intent() {
    return message.tag(Ctcp.INTENT_TAG);
  }

  /** Match group {@code i}; empty when the group did not participate or does not exist. */
  public String group(int i) {
    return i >= 0 && i < groups.size() ? groups.get(i) : "";
  }

  /** For command handlers: the text after the command name, else empty. */
  @Override
  public String args() {
    return args;
  }

  public boolean isPrivate() {
    return !IrcLineParseUtil.looksLikeChannel(sender);
  }
}
