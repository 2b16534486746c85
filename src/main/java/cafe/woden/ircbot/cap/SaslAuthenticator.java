package cafe.woden.ircbot.cap;

import cafe.woden.ircbot.irc.LineSink;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SASL authentication during capability negotiation.
 *
 * <p>Supported mechanisms: {@code PLAIN} and {@code EXTERNAL}. The {@code sasl} request returns
 * {@link CapabilityNegotiation#CONTINUE} on ACK and resumes negotiation once the server reports
 * success (903/907) or failure (902/904/905/906). A failure also quits.
 */
public final class SaslAuthenticator {
  private static final Logger log = LoggerFactory.getLogger(SaslAuthenticator.class);

  public static final CapabilityRequest REQUEST = CapabilityRequest.of("sasl");

  // IRCv3 SASL uses 400-byte base64 chunks.
  static final int SASL_CHUNK_LEN = 400;

  private final String username;
  private final String password;
  private final String mechanism;
  private final LineSink sink;
  private final Runnable resume;
  private final Consumer<String> fail;

  private final AtomicBoolean started = new AtomicBoolean(false);
  private final AtomicBoolean finished = new AtomicBoolean(false);

  public SaslAuthenticator(
      String username,
      String password,
      String mechanism,
      LineSink sink,
      Runnable resume,
      Consumer<String> fail) {
    this.username = Objects.toString(username, "");
    this.password = Objects.toString(password, "");
    String mech = Objects.toString(mechanism, "").trim().toUpperCase(Locale.ROOT);
    this.mechanism = mech.isEmpty() ? "PLAIN" : mech;
    if (!"PLAIN".equals(this.mechanism) && !"EXTERNAL".equals(this.mechanism)) {
      throw new IllegalArgumentException("Unsupported SASL mechanism: " + mechanism);
    }
    this.sink = Objects.requireNonNull(sink, "sink");
    this.resume = Objects.requireNonNull(resume, "resume");
    this.fail = fail == null ? reason -> {} : fail;
  }

  public String mechanism() {
    return mechanism;
  }

  /** Callback for the {@code sasl} capability request. */
  public CapabilityNegotiation onCapability(CapabilityRequest request, boolean acknowledged) {
    if (!acknowledged) {
      log.warn("[ircbot] Server refused the sasl capability; continuing without authentication");
      return CapabilityNegotiation.DONE;
    }
    if (!started.compareAndSet(false, true)) return CapabilityNegotiation.CONTINUE;
    log.info("[ircbot] Starting SASL mechanism {}", mechanism);
    sink.writeLine("AUTHENTICATE " + mechanism);
    return CapabilityNegotiation.CONTINUE;
  }

  /** Handles an inbound {@code AUTHENTICATE <data>} line. */
  public void onAuthenticate(String data) {
    if (!started.get() || finished.get()) return;
    if (!"+".equals(Objects.toString(data, "").trim())) {
      log.debug("[ircbot] Ignoring unexpected SASL challenge for {}", mechanism);
      return;
    }
    sendResponse(tokenFor(mechanism));
  }

  /** Handles the SASL result numerics; anything else is ignored. */
  public void onNumeric(String numeric) {
    if (!started.get()) return;
    switch (Objects.toString(numeric, "")) {
      case "903", "907" -> {
        if (!finished.compareAndSet(false, true)) return;
        log.info("[ircbot] SASL authentication successful ({})", numeric);
        resume.run();
      }
      case "902", "904", "905", "906" -> {
        if (!finished.compareAndSet(false, true)) return;
        log.error("[ircbot] SASL authentication failed ({})", numeric);
        resume.run();
        fail.accept("SASL authentication failed (" + numeric + ")");
      }
      default -> {}
    }
  }

  private String tokenFor(String mech) {
    if ("EXTERNAL".equals(mech)) return "";
    String payload = username + "\0" + username + "\0" + password;
    return Base64.getEncoder().encodeToString(payload.getBytes(StandardCharsets.UTF_8));
  }

  private void sendResponse(String b64) {
    if (b64 == null || b64.isEmpty()) {
      sink.writeLine("AUTHENTICATE +");
      return;
    }
    int idx = 0;
    while (idx < b64.length()) {
      int end = Math.min(b64.length(), idx + SASL_CHUNK_LEN);
      sink.writeLine("AUTHENTICATE " + b64.substring(idx, end));
      idx = end;
    }
    // If the last chunk was exactly 400 bytes, an empty terminator follows.
    if (b64.length() % SASL_CHUNK_LEN == 0) {
      sink.writeLine("AUTHENTICATE +");
    }
  }
}
