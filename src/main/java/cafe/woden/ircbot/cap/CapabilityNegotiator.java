package cafe.woden.ircbot.cap;

import cafe.woden.ircbot.irc.IrcLineParseUtil;
import cafe.woden.ircbot.irc.LineSink;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks capability requests from registration through the server's answer.
 *
 * <p>A request moves registered, then requested, then acknowledged or denied. The last two are
 * exclusive but reversible: a later NAK moves an acknowledged request to denied and vice versa.
 * Every plugin that registered the same request has its own completion flag; negotiation is
 * complete when every requested request has all of its plugins done.
 */
public final class CapabilityNegotiator {
  private static final Logger log = LoggerFactory.getLogger(CapabilityNegotiator.class);

  /** {@code "CAP * ACK "} takes 10 of the 510 usable bytes. */
  public static final int MAX_REQUEST_BYTES = 500;

  private final Map<CapabilityRequest, Map<String, Registration>> registered =
      new LinkedHashMap<>();
  private final Set<CapabilityRequest> requested = new LinkedHashSet<>();
  private final Set<CapabilityRequest> acknowledged = new LinkedHashSet<>();
  private final Set<CapabilityRequest> denied = new LinkedHashSet<>();

  /** Result of one plugin callback. */
  public record Outcome(String plugin, boolean done, CapabilityNegotiation result) {}

  /** Completion before and after a resume. */
  public record Resumption(boolean wasComplete, boolean isComplete) {
    public boolean completedNow() {
      return !wasComplete && isComplete;
    }
  }

  private static final class Registration {
    final CapabilityCallback callback;
    boolean done;

    Registration(CapabilityCallback callback) {
      this.callback = callback;
    }
  }

  /**
   * Register {@code request} for {@code plugin}. A later registration by the same plugin replaces
   * the earlier callback.
   *
   * @throws CapabilityRequestTooLongException when the encoded request exceeds 500 bytes
   */
  public synchronized void register(
      String plugin, CapabilityRequest request, CapabilityCallback callback) {
    Objects.requireNonNull(request, "request");
    if (request.encodedLength() > MAX_REQUEST_BYTES) {
      throw new CapabilityRequestTooLongException(request);
    }
    String name = Objects.toString(plugin, "").trim();
    registered.computeIfAbsent(request, k -> new LinkedHashMap<>()).put(name, new Registration(callback));
    log.debug("[ircbot] Capability request registered by {}: {}", name, request);
  }

  /**
   * Sends one {@code CAP REQ} for every registered, not yet requested, request whose capabilities
   * are all in {@code available}.
   *
   * @return the requests sent, in registration order
   */
  public synchronized List<CapabilityRequest> requestAvailable(
      Set<String> available, LineSink sink) {
    Set<String> caps = available == null ? Set.of() : available;
    List<CapabilityRequest> sent = new ArrayList<>();
    for (Map.Entry<CapabilityRequest, Map<String, Registration>> e : registered.entrySet()) {
      CapabilityRequest req = e.getKey();
      if (requested.contains(req)) continue;
      if (!caps.containsAll(req.requiredCapabilities())) {
        log.debug("[ircbot] Unable to negotiate capability request: {}", req);
        continue;
      }
      for (Registration r : e.getValue().values()) r.done = false;
      requested.add(req);
      sent.add(req);
      log.debug("[ircbot] Capability negotiation request: {}", req);
      sink.writeLine(IrcLineParseUtil.compose(List.of("CAP", "REQ"), req.encoded()));
    }
    return sent;
  }

  /**
   * Marks {@code request} acknowledged and runs every owning plugin's callback.
   *
   * @return empty when the request was never sent
   */
  public Optional<List<Outcome>> acknowledge(CapabilityRequest request) {
    synchronized (this) {
      if (!requested.contains(request)) {
        log.debug("[ircbot] Received CAP ACK for an unknown CAP REQ: {}", request);
        return Optional.empty();
      }
      acknowledged.add(request);
      denied.remove(request);
    }
    return Optional.of(callbacks(request, true));
  }

  /**
   * Marks {@code request} denied and runs every owning plugin's callback.
   *
   * @return empty when the request was never sent
   */
  public Optional<List<Outcome>> deny(CapabilityRequest request) {
    synchronized (this) {
      if (!requested.contains(request)) {
        log.debug("[ircbot] Received CAP NAK for an unknown CAP REQ: {}", request);
        return Optional.empty();
      }
      denied.add(request);
      acknowledged.remove(request);
    }
    return Optional.of(callbacks(request, false));
  }

  /**
   * Marks {@code plugin}'s part of {@code request} done. Unknown requests and plugins leave the
   * state unchanged.
   */
  public synchronized Resumption resume(CapabilityRequest request, String plugin) {
    boolean was = isComplete();
    if (!requested.contains(request)) return new Resumption(was, was);
    Registration r = registered.getOrDefault(request, Map.of()).get(Objects.toString(plugin, ""));
    if (r == null) return new Resumption(was, was);
    r.done = true;
    return new Resumption(was, isComplete());
  }

  public synchronized boolean isComplete() {
    for (CapabilityRequest req : requested) {
      for (Registration r : registered.getOrDefault(req, Map.of()).values()) {
        if (!r.done) return false;
      }
    }
    return true;
  }

  public synchronized boolean isRegistered(CapabilityRequest request) {
    return registered.containsKey(request);
  }

  public synchronized boolean isRequested(CapabilityRequest request) {
    return requested.contains(request);
  }

  public synchronized boolean isAcknowledged(CapabilityRequest request) {
    return acknowledged.contains(request);
  }

  public synchronized boolean isDenied(CapabilityRequest request) {
    return denied.contains(request);
  }

  public synchronized ImmutableSet<CapabilityRequest> registered() {
    return ImmutableSet.copyOf(registered.keySet());
  }

  public synchronized ImmutableSet<CapabilityRequest> requested() {
    return ImmutableSet.copyOf(requested);
  }

  private List<Outcome> callbacks(CapabilityRequest request, boolean ack) {
    List<Map.Entry<String, Registration>> owners;
    synchronized (this) {
      owners = List.copyOf(registered.getOrDefault(request, Map.of()).entrySet());
    }
    ImmutableList.Builder<Outcome> out = ImmutableList.builder();
    for (Map.Entry<String, Registration> e : owners) {
      Registration r = e.getValue();
      CapabilityNegotiation result =
          r.callback == null ? null : r.callback.onResult(request, ack);
      boolean done = result == null || result == CapabilityNegotiation.DONE;
      synchronized (this) {
        r.done = done;
      }
      out.add(new Outcome(e.getKey(), done, result));
    }
    return out.build();
  }
}
