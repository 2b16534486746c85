package cafe.woden.ircbot.dispatch;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Everything the dispatcher needs to know about one handler, fixed at registration.
 *
 * <p>Built through {@link Builder}; {@link Builder#build(String, String)} compiles the patterns
 * once the bot's nickname and command prefix are known.
 */
@ValueObject
public record HandlerDescriptor(
    String plugin,
    String name,
    HandlerKind kind,
    ImmutableList<Pattern> patterns,
    ImmutableList<String> commands,
    ImmutableSet<String> events,
    Priority priority,
    boolean threaded,
    RateLimits rateLimits,
    boolean unblockable,
    ImmutableSet<String> intents,
    Handler handler) {

  public static final String DEFAULT_EVENT = "PRIVMSG";

  /** Named groups of a command pattern; the prefix may carry groups of its own. */
  static final String COMMAND_GROUP = "command";

  static final String ARGS_GROUP = "args";

  static final int PATTERN_FLAGS = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

  /** Cooldown periods; {@link Duration#ZERO} disables a scope. */
  @ValueObject
  public record RateLimits(Duration user, Duration channel, Duration global) {
    public static final RateLimits NONE = new RateLimits(Duration.ZERO, Duration.ZERO, Duration.ZERO);

    public RateLimits {
      user = nonNegative(user);
      channel = nonNegative(channel);
      global = nonNegative(global);
    }

    public boolean any() {
      return !user.isZero() || !channel.isZero() || !global.isZero();
    }

    private static Duration nonNegative(Duration d) {
      return d == null || d.isNegative() ? Duration.ZERO : d;
    }
  }

  public HandlerDescriptor {
    plugin = Objects.toString(plugin, "").trim();
    name = Objects.toString(name, "").trim();
    Objects.requireNonNull(kind, "kind");
    patterns = patterns == null ? ImmutableList.of() : patterns;
    commands = commands == null ? ImmutableList.of() : commands;
    events = events == null || events.isEmpty() ? ImmutableSet.of(DEFAULT_EVENT) : events;
    priority = priority == null ? Priority.MEDIUM : priority;
    rateLimits = rateLimits == null ? RateLimits.NONE : rateLimits;
    intents = intents == null ? ImmutableSet.of() : intents;
    Objects.requireNonNull(handler, "handler");
    if (patterns.isEmpty()) throw new IllegalArgumentException("handler has no patterns: " + name);
  }

  /** Stable key used for rate limiting. */
  public String id() {
    return plugin.isEmpty() ? name : plugin + "." + name;
  }

  public HandlerDescriptor withPlugin(String owner) {
    return new HandlerDescriptor(
        owner, name, kind, patterns, commands, events, priority, threaded, rateLimits, unblockable,
        intents, handler);
  }

  public static Builder rule(String... regexes) {
    return new Builder(HandlerKind.RULE, Arrays.asList(regexes));
  }

  public static Builder command(String... names) {
    return new Builder(HandlerKind.COMMAND, Arrays.asList(names));
  }

  public static Builder event(String... events) {
    return new Builder(HandlerKind.EVENT, List.of()).events(events);
  }

  public static final class Builder {
    private final HandlerKind kind;
    private final List<String> sources;
    private final Set<String> events = new LinkedHashSet<>();
    private final Set<String> intents = new LinkedHashSet<>();
    private String name = "";
    private Priority priority = Priority.MEDIUM;
    private boolean threaded = true;
    private Duration userRate = Duration.ZERO;
    private Duration channelRate = Duration.ZERO;
    private Duration globalRate = Duration.ZERO;
    private boolean unblockable;
    private Handler handler;

    private Builder(HandlerKind kind, List<String> sources) {
      this.kind = kind;
      this.sources = new ArrayList<>();
      for (String s : sources) {
        String v = Objects.toString(s, "").trim();
        if (!v.isEmpty()) this.sources.add(v);
      }
      if (kind != HandlerKind.EVENT && this.sources.isEmpty()) {
        throw new IllegalArgumentException(kind + " handler needs at least one pattern or name");
      }
    }

    public Builder named(String name) {
      this.name = Objects.toString(name, "").trim();
      return this;
    }

    public Builder events(String... names) {
      for (String e : names) {
        String v = Objects.toString(e, "").trim().toUpperCase(Locale.ROOT);
        if (!v.isEmpty()) events.add(v);
      }
      return this;
    }

    public Builder intents(String... names) {
      for (String i : names) {
        String v = Objects.toString(i, "").trim().toUpperCase(Locale.ROOT);
        if (!v.isEmpty()) intents.add(v);
      }
      return this;
    }

    public Builder priority(Priority priority) {
      this.priority = Objects.requireNonNull(priority, "priority");
      return this;
    }

    /** {@code false} runs the handler inline on the reader thread. Defaults to {@code true}. */
    public Builder threaded(boolean threaded) {
      this.threaded = threaded;
      return this;
    }

    public Builder rate(Duration perUser) {
      this.userRate = perUser;
      return this;
    }

    public Builder channelRate(Duration perChannel) {
      this.channelRate = perChannel;
      return this;
    }

    public Builder globalRate(Duration global) {
      this.globalRate = global;
      return this;
    }

    public Builder unblockable() {
      this.unblockable = true;
      return this;
    }

    public Builder handler(Handler handler) {
      this.handler = handler;
      return this;
    }

    /**
     * Compiles the patterns. Rule patterns have {@code $nick} replaced by the nickname followed by
     * {@code [,:]} and whitespace; command names become
     * {@code (?:<prefix>)(?<command><name>)(?:\s+(?<args>.*))?}.
     *
     * @throws java.util.regex.PatternSyntaxException for an invalid pattern
     */
    public HandlerDescriptor build(String botNick, String commandPrefix) {
      ImmutableList.Builder<Pattern> compiled = ImmutableList.builder();
      ImmutableList<String> commands = ImmutableList.of();
      switch (kind) {
        case RULE -> {
          for (String regex : sources) compiled.add(compileRule(regex, botNick));
        }
        case COMMAND -> {
          commands = ImmutableList.copyOf(sources);
          String prefix = Objects.toString(commandPrefix, "").isEmpty() ? "\\." : commandPrefix;
          for (String command : sources) compiled.add(compileCommand(prefix, command));
        }
        case EVENT -> compiled.add(Pattern.compile(".*", PATTERN_FLAGS | Pattern.DOTALL));
      }
      String n = name.isEmpty() ? defaultName() : name;
      return new HandlerDescriptor(
          "",
          n,
          kind,
          compiled.build(),
          commands,
          ImmutableSet.copyOf(events),
          priority,
          threaded,
          new RateLimits(userRate, channelRate, globalRate),
          unblockable,
          ImmutableSet.copyOf(intents),
          handler);
    }

    private String defaultName() {
      if (kind == HandlerKind.EVENT) return "event:" + String.join(",", events);
      return kind.name().toLowerCase(Locale.ROOT) + ":" + sources.get(0);
    }
  }

  static Pattern compileRule(String regex, String botNick) {
    String nick = Objects.toString(botNick, "");
    String expanded = regex.replace("$nick", Pattern.quote(nick) + "[,:]\\s+");
    return Pattern.compile(expanded, PATTERN_FLAGS);
  }

  static Pattern compileCommand(String prefix, String command) {
    // (?!\S) keeps ".helpme" from triggering "help".
    return Pattern.compile(
        "(?:" + prefix + ")(?<" + COMMAND_GROUP + ">" + command + ")(?!\\S)(?:\\s+(?<"
            + ARGS_GROUP + ">.*))?",
        PATTERN_FLAGS);
  }
}
