package cafe.woden.ircbot.irc;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.LongSupplier;
import javax.net.ssl.SSLSocket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One socket to one server.
 *
 * <p>The reader thread calls {@link #readLoop()}, which frames, decodes and parses inbound lines,
 * answers PING itself and hands every other message to the message handler in arrival order.
 * {@link #writeLine(String)} may be called from any thread; writes are serialized so lines never
 * interleave, and every line is cut to 510 bytes of content before CRLF is appended.
 */
public final class IrcConnection implements LineSink, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(IrcConnection.class);
  private static final Logger raw = LoggerFactory.getLogger("cafe.woden.ircbot.raw");

  public static final int MAX_LINE_BYTES = 510;

  private static final int READ_CHUNK = 4096;
  private static final String NICK_IN_USE = "433";

  private final InputStream in;
  private final OutputStream out;
  private final Closeable resource;
  private final LongSupplier clock;

  private final LineFramer framer = new LineFramer();
  private final LineDecoder decoder = new LineDecoder();
  private final ConnectionState state = new ConnectionState();

  private final Object writeLock = new Object();
  private final AtomicBoolean closing = new AtomicBoolean(false);
  private volatile boolean writable = true;
  private final AtomicReference<CloseReason> closeReason = new AtomicReference<>();

  private final List<Runnable> shutdownHooks = new CopyOnWriteArrayList<>();
  private final List<Consumer<CloseReason>> closeListeners = new CopyOnWriteArrayList<>();
  private volatile Consumer<IrcMessage> messageHandler = m -> {};
  private volatile ConnectionTimersRx timers;

  public IrcConnection(
      InputStream in, OutputStream out, Closeable resource, LongSupplier clock) {
    this.in = Objects.requireNonNull(in, "in");
    this.out = Objects.requireNonNull(out, "out");
    this.resource = resource == null ? () -> {} : resource;
    this.clock = clock == null ? System::currentTimeMillis : clock;
  }

  /** Opens a plain or TLS socket to {@code host:port}. */
  public static IrcConnection open(
      String host, int port, boolean tls, boolean trustAllCertificates, Duration connectTimeout)
      throws IOException {
    int timeoutMs = connectTimeout == null ? 0 : (int) connectTimeout.toMillis();
    Socket socket = new Socket();
    try {
      socket.connect(new InetSocketAddress(host, port), timeoutMs);
      if (tls) {
        SSLSocket ssl =
            (SSLSocket)
                TlsSocketFactories.sslSocketFactory(trustAllCertificates)
                    .createSocket(socket, host, port, true);
        ssl.startHandshake();
        socket = ssl;
      }
    } catch (IOException e) {
      try {
        socket.close();
      } catch (IOException closeError) {
        e.addSuppressed(closeError);
      }
      throw e;
    }
    log.info("[ircbot] Connected to {}:{}{}", host, port, tls ? " (TLS)" : "");
    return new IrcConnection(
        socket.getInputStream(), socket.getOutputStream(), socket, System::currentTimeMillis);
  }

  public void onMessage(Consumer<IrcMessage> handler) {
    this.messageHandler = handler == null ? m -> {} : handler;
  }

  public void addShutdownHook(Runnable hook) {
    if (hook != null) shutdownHooks.add(hook);
  }

  public void addCloseListener(Consumer<CloseReason> listener) {
    if (listener != null) closeListeners.add(listener);
  }

  /** Starts the inactivity watchdog and the keep-alive PING. */
  public void startWatchdog(ConnectionTimersRx timers, Duration timeout, String pingToken) {
    this.timers = Objects.requireNonNull(timers, "timers");
    String token = Objects.toString(pingToken, "").trim();
    String ping = token.isEmpty() ? "PING :keepalive" : "PING :" + token;
    timers.startWatchdog(
        state, timeout, () -> close(CloseReason.PING_TIMEOUT), () -> writeLine(ping));
  }

  public boolean isOpen() {
    return !closing.get();
  }

  public Optional<CloseReason> closeReason() {
    return Optional.ofNullable(closeReason.get());
  }

  public long lastInboundMs() {
    return state.lastInboundMs.get();
  }

  public long lastOutboundMs() {
    return state.lastOutboundMs.get();
  }

  /**
   * Reads until end of stream, a transport error or {@link #close(CloseReason)}.
   *
   * <p>Blocks the calling thread. End of stream closes with {@link CloseReason#SERVER_CLOSED}.
   */
  public void readLoop() {
    byte[] chunk = new byte[READ_CHUNK];
    try {
      while (isOpen()) {
        int n = in.read(chunk);
        if (n < 0) break;
        for (byte[] line : framer.feed(chunk, 0, n)) {
          if (!isOpen()) return;
          handleLine(line);
        }
      }
      close(CloseReason.SERVER_CLOSED);
    } catch (IOException e) {
      if (isOpen()) {
        log.warn("[ircbot] Read failed: {}", e.toString());
        close(CloseReason.TRANSPORT_ERROR);
      }
    }
  }

  void handleLine(byte[] bytes) {
    Optional<String> decoded = decoder.decode(bytes);
    if (decoded.isEmpty()) {
      log.debug("[ircbot] Dropping undecodable line ({} bytes)", bytes.length);
      return;
    }
    String line = decoded.get();
    if (line.isBlank()) return;

    state.touchInbound(clock.getAsLong());
    raw.trace(">> {}", line);

    IrcMessage m;
    try {
      m = IrcMessageParser.parse(line);
    } catch (IrcParseException e) {
      log.debug("[ircbot] Dropping unparseable line: {}", e.getMessage());
      return;
    }

    switch (m.command()) {
      case "PING":
        writeLine(IrcLineParseUtil.compose(List.of("PONG"), m.text()));
        return;
      case NICK_IN_USE:
        log.error("[ircbot] Nickname {} is already in use; closing", m.param(1));
        close(CloseReason.NICK_IN_USE);
        return;
      case "ERROR":
        log.warn("[ircbot] Server error: {}", m.text());
        break;
      default:
        break;
    }

    try {
      messageHandler.accept(m);
    } catch (RuntimeException e) {
      log.error("[ircbot] Message handler failed for {}", m.command(), e);
    }
  }

  @Override
  public void writeLine(String line) {
    String content =
        IrcLineParseUtil.truncateUtf8(IrcLineParseUtil.stripLineBreaks(line), MAX_LINE_BYTES);
    byte[] bytes = (content + "\r\n").getBytes(StandardCharsets.UTF_8);

    IOException failure = null;
    synchronized (writeLock) {
      if (!writable) {
        log.debug("[ircbot] Dropping write after close: {}", content);
        return;
      }
      try {
        out.write(bytes);
        out.flush();
        state.touchOutbound(clock.getAsLong());
        raw.trace("<< {}", content);
      } catch (IOException e) {
        failure = e;
      }
    }
    if (failure != null) {
      log.warn("[ircbot] Write failed: {}", failure.toString());
      close(CloseReason.TRANSPORT_ERROR);
    }
  }

  /**
   * Closes once. Shutdown hooks run first and may still write; then timers stop, the socket
   * closes and close listeners are told the reason.
   */
  public void close(CloseReason reason) {
    if (!closing.compareAndSet(false, true)) return;
    CloseReason r = reason == null ? CloseReason.SHUTDOWN : reason;
    closeReason.set(r);
    log.info("[ircbot] Closing connection ({})", r);

    for (Runnable hook : shutdownHooks) {
      try {
        hook.run();
      } catch (RuntimeException e) {
        log.warn("[ircbot] Shutdown hook failed", e);
      }
    }

    ConnectionTimersRx t = timers;
    if (t != null) t.stopWatchdog(state);

    synchronized (writeLock) {
      writable = false;
    }
    try {
      resource.close();
    } catch (IOException e) {
      log.debug("[ircbot] Error while closing socket: {}", e.toString());
    }

    for (Consumer<CloseReason> listener : closeListeners) {
      try {
        listener.accept(r);
      } catch (RuntimeException e) {
        log.warn("[ircbot] Close listener failed", e);
      }
    }
  }

  @Override
  public void close() {
    close(CloseReason.SHUTDOWN);
  }
}
