package cafe.woden.ircbot.irc;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * One parsed protocol line.
 *
 * <p>Immutable. {@code params} holds the middle parameters followed by the trailing parameter
 * when the line had one ({@code hasTrailing}). Tag values are unescaped; a tag sent without a
 * value maps to the empty string.
 */
@ValueObject
public record IrcMessage(
    Map<String, String> tags,
    Hostmask source,
    String command,
    List<String> params,
    boolean hasTrailing,
    String raw) {

  public IrcMessage {
    tags = tags == null ? Map.of() : Map.copyOf(tags);
    source = source == null ? Hostmask.EMPTY : source;
    command = Objects.toString(command, "");
    params = params == null ? List.of() : List.copyOf(params);
    raw = Objects.toString(raw, "");
  }

  public Optional<String> tag(String key) {
    return Optional.ofNullable(tags.get(key));
  }

  public boolean hasTag(String key) {
    return tags.containsKey(key);
  }

  public String param(int index) {
    return index >= 0 && index < params.size() ? params.get(index) : "";
  }

  public Optional<String> trailing() {
    if (!hasTrailing || params.isEmpty()) return Optional.empty();
    return Optional.of(params.get(params.size() - 1));
  }

  /** Trailing parameter, or the last parameter when there is none, or empty. */
  public String text() {
    return params.isEmpty() ? "" : params.get(params.size() - 1);
  }

  public String nick() {
    return source.nick();
  }

  public boolean isNumeric() {
    return IrcLineParseUtil.looksNumeric(command);
  }

  /**
   * Where a reply to this message should go.
   *
   * <p>A message addressed to the bot itself is answered to its sender; anything else is answered
   * to its first parameter (normally a channel). Empty when the message has no parameters.
   */
  public String replyTarget(String botNick) {
    if (params.isEmpty()) return "";
    String target = params.get(0);
    if (IrcCaseMapping.equals(target, botNick)) return source.nick();
    return target;
  }

  public boolean isFromChannel(String botNick) {
    return IrcLineParseUtil.looksLikeChannel(replyTarget(botNick));
  }
}
