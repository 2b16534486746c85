package cafe.woden.ircbot.cap;

import cafe.woden.ircbot.irc.IrcMessage;
import cafe.woden.ircbot.irc.LineSink;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.Disposable;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives capability negotiation from inbound {@code CAP} lines.
 *
 * <p>Collects a possibly multi-line {@code LS} reply, asks the {@link CapabilityNegotiator} to
 * request what is available, routes {@code ACK}/{@code NAK} to it, and sends {@code CAP END}
 * exactly once: when negotiation completes, when nothing could be requested, when a callback
 * reports {@link CapabilityNegotiation#ERROR}, or when the deadline passes with callbacks still
 * pending.
 */
public final class CapabilityNegotiationCoordinator {
  private static final Logger log = LoggerFactory.getLogger(CapabilityNegotiationCoordinator.class);

  private final CapabilityNegotiator negotiator;
  private final LineSink sink;
  private final Scheduler scheduler;
  private final Duration deadline;
  private final Consumer<String> quit;

  private final Map<String, String> lsAccumulator = new LinkedHashMap<>();
  private final Map<String, String> advertised = new ConcurrentHashMap<>();
  private final Set<String> enabled = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean lsComplete = new AtomicBoolean(false);
  private final AtomicBoolean endSent = new AtomicBoolean(false);
  private final AtomicReference<Disposable> deadlineDisposable = new AtomicReference<>();

  public CapabilityNegotiationCoordinator(
      CapabilityNegotiator negotiator,
      LineSink sink,
      Scheduler scheduler,
      Duration deadline,
      Consumer<String> quit) {
    this.negotiator = Objects.requireNonNull(negotiator, "negotiator");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.deadline = deadline == null ? Duration.ZERO : deadline;
    this.quit = quit == null ? reason -> {} : quit;
  }

  public CapabilityNegotiator negotiator() {
    return negotiator;
  }

  /** Opens negotiation; must be sent before NICK/USER. */
  public void begin() {
    sink.writeLine("CAP LS 302");
  }

  /** Handles a {@code CAP <target> <subcommand> [*] :<caps>} line. */
  public void onCap(IrcMessage m) {
    if (m == null || !"CAP".equals(m.command())) return;
    String sub = m.param(1).toUpperCase(Locale.ROOT);
    boolean more = m.params().size() >= 4 && "*".equals(m.param(2));
    String caps = m.text();

    switch (sub) {
      case "LS" -> onLs(caps, more);
      case "ACK" -> onAnswer(CapabilityRequest.parse(caps), true);
      case "NAK" -> onAnswer(CapabilityRequest.parse(caps), false);
      case "NEW" -> onNew(caps);
      case "DEL" -> onDel(caps);
      case "LIST" -> log.debug("[ircbot] CAP LIST: {}", caps);
      default -> log.debug("[ircbot] Ignoring CAP {}", sub);
    }
  }

  private void onLs(String caps, boolean more) {
    lsAccumulator.putAll(parseAdvertised(caps));
    if (more) return;

    if (!lsComplete.compareAndSet(false, true)) {
      log.debug("[ircbot] Ignoring repeated CAP LS reply");
      lsAccumulator.clear();
      return;
    }
    advertised.putAll(lsAccumulator);
    lsAccumulator.clear();
    log.info("[ircbot] Server capabilities: {}", advertised.keySet());

    List<CapabilityRequest> sent = negotiator.requestAvailable(advertised.keySet(), sink);
    if (sent.isEmpty()) {
      log.info("[ircbot] No capability negotiation");
      end();
      return;
    }
    armDeadline();
  }

  private void onAnswer(CapabilityRequest request, boolean ack) {
    if (!negotiator.isRequested(request)) {
      log.debug("[ircbot] Ignoring CAP {} for unrequested {}", ack ? "ACK" : "NAK", request);
      return;
    }
    // Updated before the callbacks run, so they see the new state.
    for (String t : request.tokens()) {
      boolean disable = t.startsWith("-");
      String name = disable ? t.substring(1) : t;
      if (ack && !disable) enabled.add(name);
      else if (ack || !disable) enabled.remove(name);
    }

    boolean wasComplete = negotiator.isComplete();
    Optional<List<CapabilityNegotiator.Outcome>> outcomes;
    try {
      outcomes = ack ? negotiator.acknowledge(request) : negotiator.deny(request);
    } catch (RuntimeException e) {
      log.error("[ircbot] Error on CAP {} \"{}\"", ack ? "ACK" : "NAK", request, e);
      end();
      quit.accept("Error negotiating capabilities.");
      return;
    }
    if (outcomes.isEmpty()) return;

    log.debug("[ircbot] CAP {} {} -> {}", ack ? "ACK" : "NAK", request, outcomes.get());
    boolean error =
        outcomes.get().stream().anyMatch(o -> o.result() == CapabilityNegotiation.ERROR);
    if (error) {
      log.error("[ircbot] Capability negotiation failed for request: \"{}\"", request);
      end();
      quit.accept("Error negotiating capabilities.");
      return;
    }
    if (!wasComplete && negotiator.isComplete()) {
      log.info("[ircbot] Capability negotiation ended successfully");
      end();
    }
  }

  private void onNew(String caps) {
    Map<String, String> added = parseAdvertised(caps);
    advertised.putAll(added);
    log.info("[ircbot] Server added capabilities: {}", added.keySet());
    if (!lsComplete.get()) return;
    negotiator.requestAvailable(advertised.keySet(), sink);
  }

  private void onDel(String caps) {
    Set<String> removed = parseAdvertised(caps).keySet();
    log.info("[ircbot] Server removed capabilities: {}", removed);
    for (String c : removed) {
      advertised.remove(c);
      enabled.remove(c);
    }
  }

  /**
   * Marks {@code plugin}'s part of {@code request} done and ends negotiation when that completes
   * it.
   */
  public void resume(CapabilityRequest request, String plugin) {
    CapabilityNegotiator.Resumption r = negotiator.resume(request, plugin);
    if (r.completedNow()) {
      log.info("[ircbot] Capability negotiation ended successfully after {} resumed", plugin);
      end();
    }
  }

  private void armDeadline() {
    if (deadline.isZero() || deadline.isNegative()) return;
    Disposable d =
        Completable.timer(deadline.toMillis(), TimeUnit.MILLISECONDS, scheduler)
            .subscribe(
                () -> {
                  if (endSent.get()) return;
                  log.warn(
                      "[ircbot] Capability negotiation still pending after {}s; forcing CAP END",
                      deadline.toSeconds());
                  end();
                },
                err -> log.debug("[ircbot] Capability deadline error", err));
    Disposable prev = deadlineDisposable.getAndSet(d);
    if (prev != null && !prev.isDisposed()) prev.dispose();
  }

  private void end() {
    if (!endSent.compareAndSet(false, true)) return;
    cancelDeadline();
    sink.writeLine("CAP END");
  }

  public void cancelDeadline() {
    Disposable d = deadlineDisposable.getAndSet(null);
    if (d != null && !d.isDisposed()) d.dispose();
  }

  public boolean isEnded() {
    return endSent.get();
  }

  public boolean isEnabled(String capability) {
    return capability != null && enabled.contains(capability.toLowerCase(Locale.ROOT));
  }

  public ImmutableSet<String> enabled() {
    return ImmutableSet.copyOf(enabled);
  }

  public ImmutableMap<String, String> advertised() {
    return ImmutableMap.copyOf(advertised);
  }

  /** Value advertised for {@code capability} (e.g. the mechanism list of {@code sasl}). */
  public Optional<String> advertisedValue(String capability) {
    return Optional.ofNullable(advertised.get(Objects.toString(capability, "").toLowerCase(Locale.ROOT)));
  }

  static Map<String, String> parseAdvertised(String caps) {
    Map<String, String> out = new LinkedHashMap<>();
    String s = Objects.toString(caps, "").trim();
    if (s.isEmpty()) return out;
    for (String token : s.split("\\s+")) {
      String t = token.startsWith(":") ? token.substring(1) : token;
      if (t.startsWith("-")) t = t.substring(1);
      if (t.isEmpty()) continue;
      int eq = t.indexOf('=');
      String name = (eq >= 0 ? t.substring(0, eq) : t).toLowerCase(Locale.ROOT);
      String value = eq >= 0 ? t.substring(eq + 1) : "";
      if (!name.isEmpty()) out.put(name, value);
    }
    return out;
  }
}
