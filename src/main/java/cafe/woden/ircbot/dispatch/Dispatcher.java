package cafe.woden.ircbot.dispatch;

import cafe.woden.ircbot.irc.Ctcp;
import cafe.woden.ircbot.irc.IrcCaseMapping;
import cafe.woden.ircbot.irc.IrcLineParseUtil;
import cafe.woden.ircbot.irc.IrcMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides which handlers run for an inbound message, and how.
 *
 * <p>Handlers are tried by priority (high, medium, low), then registration order. A handler is
 * skipped when the message's event is not one it listens to; when the sender is blocked, unless
 * the handler is unblockable or the sender is an admin; when the channel does not allow its
 * plugin; or when it lists CTCP intents and the message carries none of them. Each pattern that
 * matches at the start of the text is one invocation, so a handler with several patterns can run
 * more than once per line.
 *
 * <p>Rate limits apply per user, per channel and globally; the first scope that denies wins and
 * has its cooldown restarted. Unless the handler returns {@link HandlerResult#NOLIMIT}, every
 * applicable scope is stamped after it finishes, including when it throws.
 */
public final class Dispatcher {
  private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

  private final RuleRegistry registry;
  private final RateLimiter limiter;
  private final AccessPolicy access;
  private final WorkerPool workers;
  private final HandlerErrorReporter errors;
  private final Supplier<String> botNick;

  public Dispatcher(
      RuleRegistry registry,
      RateLimiter limiter,
      AccessPolicy access,
      WorkerPool workers,
      HandlerErrorReporter errors,
      Supplier<String> botNick) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.limiter = Objects.requireNonNull(limiter, "limiter");
    this.access = access == null ? AccessPolicy.open() : access;
    this.workers = Objects.requireNonNull(workers, "workers");
    this.errors = Objects.requireNonNull(errors, "errors");
    this.botNick = Objects.requireNonNull(botNick, "botNick");
  }

  /** @return how many invocations were started */
  public int dispatch(IrcMessage m) {
    if (m == null) return 0;
    String event = m.command();
    String text = m.text();
    String nick = m.nick();
    String sender = m.replyTarget(botNick.get());
    boolean channelMessage = IrcLineParseUtil.looksLikeChannel(sender);
    Optional<String> intent = m.tag(Ctcp.INTENT_TAG);

    boolean blocked = access.isBlocked(m.source());
    boolean admin = access.isAdmin(nick);
    boolean owner = access.isOwner(nick);

    int started = 0;
    for (Priority priority : Priority.values()) {
      for (HandlerDescriptor h : registry.handlers(priority)) {
        if (!h.events().contains(event)) continue;
        if (blocked && !h.unblockable() && !admin) {
          log.debug("[ircbot] {} is blocked; skipping {}", m.source(), h.id());
          continue;
        }
        if (channelMessage && !access.isModuleAllowed(sender, h.plugin())) continue;
        if (!h.intents().isEmpty()
            && (intent.isEmpty() || !h.intents().contains(intent.get()))) {
          continue;
        }

        for (Pattern p : h.patterns()) {
          Matcher matcher = p.matcher(text);
          if (!matcher.lookingAt()) continue;
          Trigger trigger = Trigger.of(m, sender, matcher, h.kind(), admin, owner);
          List<String> scopes = scopes(h, trigger, channelMessage);
          if (!admin && !h.unblockable() && rateLimited(h, scopes)) {
            log.info("[ircbot] {} is rate limited for {}", h.id(), nick);
            continue;
          }
          if (invoke(h, trigger, scopes)) started++;
        }
      }
    }
    return started;
  }

  private boolean invoke(HandlerDescriptor h, Trigger trigger, List<String> scopes) {
    Runnable call = () -> call(h, trigger, scopes);
    if (h.threaded()) return workers.submit(h.id(), call);
    call.run();
    return true;
  }

  private void call(HandlerDescriptor h, Trigger trigger, List<String> scopes) {
    HandlerResult result = HandlerResult.OK;
    try {
      HandlerResult r = h.handler().handle(trigger);
      if (r != null) result = r;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.debug("[ircbot] Handler {} interrupted", h.id());
    } catch (Exception e) {
      errors.report(h, trigger, e);
    }
    if (result == HandlerResult.NOLIMIT) return;
    for (String key : scopes) limiter.stamp(key);
  }

  private boolean rateLimited(HandlerDescriptor h, List<String> scopes) {
    HandlerDescriptor.RateLimits r = h.rateLimits();
    for (String key : scopes) {
      long period = periodFor(r, key);
      if (limiter.deny(key, period)) return true;
    }
    return false;
  }

  private static long periodFor(HandlerDescriptor.RateLimits r, String key) {
    if (key.startsWith("user:")) return r.user().toMillis();
    if (key.startsWith("channel:")) return r.channel().toMillis();
    return r.global().toMillis();
  }

  /** Rate-limit keys for the scopes that apply to this invocation. */
  static List<String> scopes(HandlerDescriptor h, Trigger trigger, boolean channelMessage) {
    HandlerDescriptor.RateLimits r = h.rateLimits();
    List<String> keys = new ArrayList<>(3);
    if (!r.user().isZero()) keys.add("user:" + IrcCaseMapping.fold(trigger.nick()) + ":" + h.id());
    if (channelMessage && !r.channel().isZero()) {
      keys.add("channel:" + IrcCaseMapping.fold(trigger.sender()) + ":" + h.id());
    }
    if (!r.global().isZero()) keys.add("global:" + h.id());
    return keys;
  }
}
