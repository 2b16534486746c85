package cafe.woden.ircbot.outbound;

import cafe.woden.ircbot.irc.IrcCaseMapping;
import cafe.woden.ircbot.irc.IrcLineParseUtil;
import cafe.woden.ircbot.irc.LineSink;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Paces and filters chat messages per recipient before they reach the connection.
 *
 * <p>Sends to one recipient are serialized on that recipient's history, so pacing sleeps only
 * hold up other sends to the same recipient. A text repeated at least {@code loopThreshold}
 * times among the last {@code loopLookback} sends, the first of them within {@code loopWindow},
 * goes out as the placeholder instead; once the placeholder itself has gone out
 * {@code placeholderLimit} times in that window, the send is dropped.
 */
public final class FloodControlQueue {
  private static final Logger log = LoggerFactory.getLogger(FloodControlQueue.class);

  private final LineSink sink;
  private final FloodSettings settings;
  private final LongSupplier clock;
  private final Sleeper sleeper;
  private final Map<String, OutboundHistory> histories = new ConcurrentHashMap<>();

  public FloodControlQueue(
      LineSink sink, FloodSettings settings, LongSupplier clock, Sleeper sleeper) {
    this.sink = Objects.requireNonNull(sink, "sink");
    this.settings = settings == null ? FloodSettings.DEFAULTS : settings;
    this.clock = clock == null ? System::currentTimeMillis : clock;
    this.sleeper = sleeper == null ? Sleeper.THREAD : sleeper;
  }

  public FloodSettings settings() {
    return settings;
  }

  /** Sends {@code text} as PRIVMSG, split into at most {@code maxMessages} fragments. */
  public void say(String recipient, String text, int maxMessages) {
    send("PRIVMSG", recipient, text, maxMessages);
  }

  public void notice(String recipient, String text) {
    send("NOTICE", recipient, text, 1);
  }

  /**
   * Sends {@code text} to {@code recipient} with {@code command}, fragment by fragment.
   *
   * @return the number of lines written
   */
  public int send(String command, String recipient, String text, int maxMessages) {
    String target = IrcLineParseUtil.stripLineBreaks(recipient).trim();
    if (target.isEmpty()) return 0;
    String body = IrcLineParseUtil.stripLineBreaks(text);
    int written = 0;
    for (String fragment :
        MessageSplitter.split(body, settings.maxFragmentBytes(), Math.max(1, maxMessages))) {
      if (Thread.currentThread().isInterrupted()) break;
      if (sendOne(command, target, fragment)) written++;
    }
    return written;
  }

  private boolean sendOne(String command, String recipient, String text) {
    OutboundHistory history =
        histories.computeIfAbsent(
            IrcCaseMapping.fold(recipient), k -> new OutboundHistory(settings.historySize()));

    synchronized (history) {
      OutboundHistory.Sent last = history.last();
      if (last != null) {
        long elapsed = clock.getAsLong() - last.atMs();
        if (elapsed < settings.pacingWindow().toMillis()) {
          long wait = settings.waitMillis(text.length()) - elapsed;
          if (wait > 0 && !pause(wait)) return false;
        }
      }

      long now = clock.getAsLong();
      String out = text;
      List<OutboundHistory.Sent> window = history.recent(settings.loopLookback());
      if (looping(window, text, now)) {
        out = settings.placeholder();
        if (OutboundHistory.count(window, out) >= settings.placeholderLimit()) {
          log.debug("[ircbot] Suppressing repeated message to {}", recipient);
          return false;
        }
      }

      sink.writeLine(command + " " + recipient + " :" + out);
      history.add(clock.getAsLong(), out);
      return true;
    }
  }

  private boolean looping(List<OutboundHistory.Sent> window, String text, long now) {
    if (OutboundHistory.count(window, text) < settings.loopThreshold()) return false;
    long first = OutboundHistory.earliest(window, text);
    return first >= 0 && now - first < settings.loopWindow().toMillis();
  }

  private boolean pause(long millis) {
    try {
      sleeper.sleep(millis);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.debug("[ircbot] Interrupted while pacing output; dropping message");
      return false;
    }
  }
}
