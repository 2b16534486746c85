package cafe.woden.ircbot.state;

import cafe.woden.ircbot.irc.IrcCaseMapping;
import cafe.woden.ircbot.irc.IrcLineParseUtil;
import cafe.woden.ircbot.irc.IrcMessage;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Channel membership and privileges, kept current from NAMES, JOIN, PART, KICK, QUIT, NICK, MODE
 * and ISUPPORT lines.
 *
 * <p>All updates come from the reader thread through {@link #onMessage(IrcMessage)}.
 */
public final class PrivilegeTracker {
  private static final Logger log = LoggerFactory.getLogger(PrivilegeTracker.class);

  private final Supplier<String> botNick;
  private final Map<String, ChannelState> channels = new ConcurrentHashMap<>();
  private volatile ModeTable modes = ModeTable.defaults();

  public PrivilegeTracker(Supplier<String> botNick) {
    this.botNick = Objects.requireNonNull(botNick, "botNick");
  }

  public Optional<ChannelState> channel(String name) {
    return Optional.ofNullable(channels.get(IrcCaseMapping.fold(name)));
  }

  public ImmutableSet<String> channelNames() {
    ImmutableSet.Builder<String> b = ImmutableSet.builder();
    for (ChannelState c : channels.values()) b.add(c.name());
    return b.build();
  }

  /** Bitmask of {@code nick} in {@code channel}; 0 when either is unknown. */
  public int privileges(String channel, String nick) {
    return channel(channel).map(c -> c.privileges(nick)).orElse(0);
  }

  public ModeTable modes() {
    return modes;
  }

  public void onMessage(IrcMessage m) {
    if (m == null) return;
    switch (m.command()) {
      case "353" -> onNames(m);
      case "JOIN" -> onJoin(m);
      case "PART" -> onPart(m);
      case "KICK" -> onKick(m);
      case "QUIT" -> onQuit(m);
      case "NICK" -> onNick(m);
      case "MODE" -> onMode(m);
      case "005" -> onIsupport(m);
      default -> {}
    }
  }

  private void onNames(IrcMessage m) {
    // :server 353 <me> <symbol> <channel> :<prefixed names>
    String channel = m.params().size() >= 4 ? m.param(2) : m.param(1);
    if (!IrcLineParseUtil.looksLikeChannel(channel)) return;
    ChannelState state = channels.computeIfAbsent(IrcCaseMapping.fold(channel), k -> new ChannelState(channel));
    ModeTable t = modes;
    for (String entry : m.text().trim().split("\\s+")) {
      if (entry.isEmpty()) continue;
      int mask = 0;
      int i = 0;
      while (i < entry.length()) {
        Privilege p = t.privilegeForPrefix(entry.charAt(i));
        if (p == null) break;
        mask |= p.bit();
        i++;
      }
      String nick = entry.substring(i);
      int bang = nick.indexOf('!');
      if (bang >= 0) nick = nick.substring(0, bang);
      if (nick.isEmpty()) continue;
      state.put(nick, mask);
    }
  }

  private void onJoin(IrcMessage m) {
    String nick = m.nick();
    for (String channel : m.param(0).split(",")) {
      if (channel.isEmpty()) continue;
      String key = IrcCaseMapping.fold(channel);
      if (isMe(nick)) {
        channels.put(key, new ChannelState(channel));
        log.debug("[ircbot] Joined {}", channel);
      }
      channels.computeIfAbsent(key, k -> new ChannelState(channel)).join(nick);
    }
  }

  private void onPart(IrcMessage m) {
    String nick = m.nick();
    for (String channel : m.param(0).split(",")) {
      leave(channel, nick);
    }
  }

  private void onKick(IrcMessage m) {
    // :op KICK <channel> <victim> :<reason>
    leave(m.param(0), m.param(1));
  }

  private void leave(String channel, String nick) {
    if (channel == null || channel.isEmpty()) return;
    String key = IrcCaseMapping.fold(channel);
    if (isMe(nick)) {
      channels.remove(key);
      log.debug("[ircbot] Left {}", channel);
      return;
    }
    ChannelState state = channels.get(key);
    if (state != null) state.remove(nick);
  }

  private void onQuit(IrcMessage m) {
    String nick = m.nick();
    for (ChannelState state : channels.values()) state.remove(nick);
  }

  private void onNick(IrcMessage m) {
    String oldNick = m.nick();
    String newNick = m.param(0);
    if (oldNick.isEmpty() || newNick.isEmpty()) return;
    for (ChannelState state : channels.values()) state.rename(oldNick, newNick);
  }

  private void onMode(IrcMessage m) {
    String channel = m.param(0);
    if (!IrcLineParseUtil.looksLikeChannel(channel)) return;
    ChannelState state = channels.get(IrcCaseMapping.fold(channel));
    if (state == null) return;

    List<String> params = m.params();
    if (params.size() < 2) return;
    String modeString = params.get(1);
    int argIndex = 2;
    boolean adding = true;
    ModeTable t = modes;
    for (int i = 0; i < modeString.length(); i++) {
      char c = modeString.charAt(i);
      if (c == '+') {
        adding = true;
        continue;
      }
      if (c == '-') {
        adding = false;
        continue;
      }
      if (!t.takesParam(c, adding)) continue;
      String arg = argIndex < params.size() ? params.get(argIndex) : "";
      argIndex++;

      Privilege p = t.privilegeForMode(c);
      if (p == null || arg.isEmpty()) continue;
      if (adding) state.grant(arg, p);
      else state.revoke(arg, p);
    }
  }

  private void onIsupport(IrcMessage m) {
    List<String> params = m.params();
    int end = m.hasTrailing() ? params.size() - 1 : params.size();
    ModeTable t = modes;
    for (int i = 1; i < end; i++) {
      String token = params.get(i);
      int eq = token.indexOf('=');
      if (eq < 0) continue;
      String key = token.substring(0, eq);
      String value = token.substring(eq + 1);
      if ("PREFIX".equals(key)) t = t.withPrefix(value);
      else if ("CHANMODES".equals(key)) t = t.withChanModes(value);
    }
    if (t != modes) {
      log.debug("[ircbot] Mode table updated from ISUPPORT: {}", t);
      modes = t;
    }
  }

  private boolean isMe(String nick) {
    return IrcCaseMapping.equals(nick, botNick.get());
  }
}
