package cafe.woden.ircbot.dispatch;

import cafe.woden.ircbot.irc.Hostmask;
import cafe.woden.ircbot.irc.IrcCaseMapping;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Who may trigger what: owner and admins, nick and host block lists, and per-channel module
 * allow lists.
 */
public final class AccessPolicy {
  private static final Logger log = LoggerFactory.getLogger(AccessPolicy.class);

  /** Plugin name that channel module restrictions never exclude. */
  public static final String CORE_PLUGIN = "core";

  private final String owner;
  private final ImmutableSet<String> admins;
  private final ImmutableList<Entry> nickBlocks;
  private final ImmutableList<Entry> hostBlocks;
  private final ImmutableMap<String, ImmutableSet<String>> channelModules;

  private record Entry(String literal, Pattern pattern) {}

  public AccessPolicy(
      String owner,
      Collection<String> admins,
      Collection<String> nickBlocks,
      Collection<String> hostBlocks,
      Map<String, ? extends Collection<String>> channelModules) {
    this.owner = IrcCaseMapping.fold(Objects.toString(owner, "").trim());
    ImmutableSet.Builder<String> a = ImmutableSet.builder();
    if (!this.owner.isEmpty()) a.add(this.owner);
    if (admins != null) {
      for (String n : admins) {
        String f = IrcCaseMapping.fold(Objects.toString(n, "").trim());
        if (!f.isEmpty()) a.add(f);
      }
    }
    this.admins = a.build();
    this.nickBlocks = compile(nickBlocks, true);
    this.hostBlocks = compile(hostBlocks, false);

    ImmutableMap.Builder<String, ImmutableSet<String>> m = ImmutableMap.builder();
    if (channelModules != null) {
      channelModules.forEach(
          (channel, modules) -> {
            if (channel == null || modules == null) return;
            m.put(
                IrcCaseMapping.fold(channel.trim()),
                ImmutableSet.copyOf(modules.stream().map(s -> s.trim().toLowerCase(Locale.ROOT)).toList()));
          });
    }
    this.channelModules = m.buildKeepingLast();
  }

  public static AccessPolicy open() {
    return new AccessPolicy("", List.of(), List.of(), List.of(), Map.of());
  }

  public boolean isOwner(String nick) {
    return !owner.isEmpty() && owner.equals(IrcCaseMapping.fold(nick));
  }

  public boolean isAdmin(String nick) {
    String f = IrcCaseMapping.fold(nick);
    return !f.isEmpty() && admins.contains(f);
  }

  public boolean isBlocked(Hostmask source) {
    if (source == null) return false;
    String nick = IrcCaseMapping.fold(source.nick());
    if (!nick.isEmpty()) {
      for (Entry e : nickBlocks) {
        if (e.literal().equals(nick) || (e.pattern() != null && e.pattern().matcher(nick).find())) {
          return true;
        }
      }
    }
    String host = source.host().toLowerCase(Locale.ROOT);
    if (!host.isEmpty()) {
      for (Entry e : hostBlocks) {
        if (host.contains(e.literal())) return true;
        if (e.pattern() != null && e.pattern().matcher(host).find()) return true;
      }
    }
    return false;
  }

  /**
   * Whether handlers from {@code plugin} may run in {@code channel}. Channels without an allow
   * list allow everything; the core plugin is always allowed.
   */
  public boolean isModuleAllowed(String channel, String plugin) {
    String p = Objects.toString(plugin, "").trim().toLowerCase(Locale.ROOT);
    if (CORE_PLUGIN.equals(p)) return true;
    ImmutableSet<String> allowed = channelModules.get(IrcCaseMapping.fold(channel));
    return allowed == null || allowed.contains(p);
  }

  private static ImmutableList<Entry> compile(Collection<String> entries, boolean fold) {
    ImmutableList.Builder<Entry> out = ImmutableList.builder();
    if (entries == null) return out.build();
    for (String raw : entries) {
      String v = Objects.toString(raw, "").trim();
      if (v.isEmpty()) continue;
      String literal = fold ? IrcCaseMapping.fold(v) : v.toLowerCase(Locale.ROOT);
      Pattern p = null;
      try {
        p = Pattern.compile(v, Pattern.CASE_INSENSITIVE);
      } catch (PatternSyntaxException e) {
        log.warn("[ircbot] Block entry '{}' is not a valid pattern; matching it literally", v);
      }
      out.add(new Entry(literal, p));
    }
    return out.build();
  }
}
