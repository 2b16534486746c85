package cafe.woden.ircbot.bot;

import cafe.woden.ircbot.cap.CapabilityNegotiation;
import cafe.woden.ircbot.cap.CapabilityRequest;
import cafe.woden.ircbot.cap.SaslAuthenticator;
import cafe.woden.ircbot.config.BotProperties;
import cafe.woden.ircbot.dispatch.AccessPolicy;
import cafe.woden.ircbot.dispatch.HandlerDescriptor;
import cafe.woden.ircbot.dispatch.HandlerResult;
import cafe.woden.ircbot.dispatch.Priority;
import cafe.woden.ircbot.irc.CloseReason;
import cafe.woden.ircbot.irc.Ctcp;
import cafe.woden.ircbot.irc.IrcCaseMapping;
import cafe.woden.ircbot.irc.IrcMessage;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Scheduler;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Protocol handlers every bot carries: state tracking, capability negotiation, SASL, post-welcome
 * setup, join retries and CTCP replies.
 *
 * <p>All run at {@link Priority#HIGH}. Everything but the CTCP replies runs inline on the reader
 * thread and ignores blocks and rate limits; CTCP replies go through the flood queue, so they run
 * on a worker.
 */
final class CoreProtocolHandlers implements BotPlugin {
  private static final Logger log = LoggerFactory.getLogger(CoreProtocolHandlers.class);

  static final CapabilityRequest MULTI_PREFIX = CapabilityRequest.of("multi-prefix");

  private final IrcBot bot;
  private final BotProperties props;
  private final Scheduler scheduler;
  private final AtomicBoolean welcomed = new AtomicBoolean(false);
  private final Map<String, AtomicInteger> joinAttempts = new ConcurrentHashMap<>();

  CoreProtocolHandlers(IrcBot bot, BotProperties props, Scheduler scheduler) {
    this.bot = Objects.requireNonNull(bot, "bot");
    this.props = Objects.requireNonNull(props, "props");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  @Override
  public String name() {
    return AccessPolicy.CORE_PLUGIN;
  }

  @Override
  public void setup(PluginRegistrar registrar) {
    registrar.register(
        core(HandlerDescriptor.event("353", "JOIN", "PART", "KICK", "QUIT", "NICK", "MODE", "005"))
            .named("track")
            .handler(
                t -> {
                  IrcMessage m = t.message();
                  String before = bot.nick();
                  bot.tracker().onMessage(m);
                  if ("NICK".equals(m.command()) && IrcCaseMapping.equals(m.nick(), before)) {
                    bot.nickChanged(m.param(0));
                  }
                  return HandlerResult.OK;
                }));

    registrar.register(
        core(HandlerDescriptor.event("CAP"))
            .named("cap")
            .handler(
                t -> {
                  bot.coordinator().onCap(t.message());
                  return HandlerResult.OK;
                }));

    registrar.registerCapability(MULTI_PREFIX, (req, ack) -> CapabilityNegotiation.DONE);

    registrar.register(
        core(HandlerDescriptor.event("001", "251"))
            .named("welcome")
            .handler(
                t -> {
                  if ("001".equals(t.event())) bot.nickChanged(t.message().param(0));
                  if (welcomed.compareAndSet(false, true)) afterWelcome();
                  return HandlerResult.OK;
                }));

    registrar.register(
        core(HandlerDescriptor.event("477"))
            .named("join-retry")
            .handler(
                t -> {
                  retryJoin(t.message().param(1));
                  return HandlerResult.OK;
                }));

    registrar.register(
        HandlerDescriptor.event("PRIVMSG")
            .named("ctcp")
            .priority(Priority.HIGH)
            .intents("VERSION", "PING", "TIME")
            .rate(Duration.ofSeconds(5))
            .handler(
                t -> {
                  String intent = t.intent().orElse("");
                  String reply =
                      switch (intent) {
                        case "VERSION" -> IrcBot.VERSION;
                        case "PING" -> t.text();
                        case "TIME" ->
                            ZonedDateTime.now().format(DateTimeFormatter.RFC_1123_DATE_TIME);
                        default -> null;
                      };
                  if (reply == null) return HandlerResult.NOLIMIT;
                  bot.notice(t.nick(), new Ctcp(intent, reply).wrap());
                  return HandlerResult.OK;
                }));

    if (props.sasl().enabled()) setupSasl(registrar);
  }

  private void setupSasl(PluginRegistrar registrar) {
    SaslAuthenticator sasl =
        new SaslAuthenticator(
            props.saslUsername(),
            props.sasl().password(),
            props.sasl().mechanism(),
            bot::writeRaw,
            () -> bot.resumeCapabilityNegotiation(SaslAuthenticator.REQUEST, name()),
            reason -> bot.quit(reason, CloseReason.AUTHENTICATION_FAILED));
    registrar.registerCapability(SaslAuthenticator.REQUEST, sasl::onCapability);

    registrar.register(
        core(HandlerDescriptor.event("AUTHENTICATE"))
            .named("sasl-challenge")
            .handler(
                t -> {
                  sasl.onAuthenticate(t.message().param(0));
                  return HandlerResult.OK;
                }));
    registrar.register(
        core(HandlerDescriptor.event("902", "903", "904", "905", "906", "907"))
            .named("sasl-result")
            .handler(
                t -> {
                  sasl.onNumeric(t.event());
                  return HandlerResult.OK;
                }));
  }

  private void afterWelcome() {
    BotProperties.Identity id = props.identity();
    if (!id.modes().isBlank()) {
      bot.writeRaw("MODE " + bot.nick() + " +" + id.modes().trim());
    }
    if (!id.nickservPassword().isEmpty() && !props.sasl().enabled()) {
      bot.write(List.of("PRIVMSG", "NickServ"), "IDENTIFY " + id.nickservPassword());
    }
    for (String entry : props.channels()) {
      String[] parts = Objects.toString(entry, "").trim().split("\\s+", 2);
      if (parts[0].isEmpty()) continue;
      log.info("[ircbot] Joining {}", parts[0]);
      bot.join(parts[0], parts.length > 1 ? parts[1] : null);
    }
  }

  /** 477: the channel needs a registered nick; try again after a delay, up to a limit. */
  private void retryJoin(String channel) {
    String ch = Objects.toString(channel, "").trim();
    if (ch.isEmpty()) return;
    BotProperties.JoinRetry retry = props.joinRetry();
    int attempt =
        joinAttempts.computeIfAbsent(IrcCaseMapping.fold(ch), k -> new AtomicInteger())
            .incrementAndGet();
    if (attempt > retry.maxAttempts()) {
      log.warn("[ircbot] Giving up joining {} after {} attempts", ch, retry.maxAttempts());
      return;
    }
    log.info("[ircbot] Cannot join {} yet; retrying in {}", ch, retry.delay());
    Completable.timer(retry.delay().toMillis(), TimeUnit.MILLISECONDS, scheduler)
        .subscribe(
            () -> bot.join(ch),
            err -> log.warn("[ircbot] Join retry for {} failed", ch, err));
  }

  int joinAttempts(String channel) {
    AtomicInteger n = joinAttempts.get(IrcCaseMapping.fold(channel));
    return n == null ? 0 : n.get();
  }

  private static HandlerDescriptor.Builder core(HandlerDescriptor.Builder b) {
    return b.priority(Priority.HIGH).threaded(false).unblockable();
  }
}
