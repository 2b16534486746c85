package cafe.woden.ircbot.irc;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Client-to-client requests carried inside PRIVMSG/NOTICE text wrapped in {@code \x01}.
 *
 * <p>The first word is the intent ({@code VERSION}, {@code ACTION}, ...); the rest is the text.
 */
public record Ctcp(String intent, String text) {

  public static final char DELIMITER = '\u0001';
  public static final String INTENT_TAG = "intent";

  public Ctcp {
    intent = Objects.toString(intent, "").trim().toUpperCase(Locale.ROOT);
    text = Objects.toString(text, "");
  }

  public static Optional<Ctcp> unwrap(String text) {
    String t = Objects.toString(text, "");
    if (t.length() < 2 || t.charAt(0) != DELIMITER) return Optional.empty();
    String body = t.substring(1);
    if (body.endsWith(String.valueOf(DELIMITER))) body = body.substring(0, body.length() - 1);
    if (body.isBlank()) return Optional.empty();
    int sp = body.indexOf(' ');
    if (sp < 0) return Optional.of(new Ctcp(body, ""));
    return Optional.of(new Ctcp(body.substring(0, sp), body.substring(sp + 1)));
  }

  public String wrap() {
    return text.isEmpty()
        ? DELIMITER + intent + DELIMITER
        : DELIMITER + intent + " " + text + DELIMITER;
  }

  /**
   * For a PRIVMSG or NOTICE carrying a CTCP request, returns a copy with the intent recorded in the
   * {@code intent} tag and the last parameter replaced by the unwrapped text. Anything else is
   * returned unchanged.
   */
  public static IrcMessage tagIntent(IrcMessage m) {
    if (m == null) return null;
    if (!"PRIVMSG".equals(m.command()) && !"NOTICE".equals(m.command())) return m;
    Optional<Ctcp> ctcp = unwrap(m.text());
    if (ctcp.isEmpty()) return m;

    Map<String, String> tags = new LinkedHashMap<>(m.tags());
    tags.put(INTENT_TAG, ctcp.get().intent());
    List<String> params = new ArrayList<>(m.params());
    params.set(params.size() - 1, ctcp.get().text());
    return new IrcMessage(tags, m.source(), m.command(), params, m.hasTrailing(), m.raw());
  }
}
