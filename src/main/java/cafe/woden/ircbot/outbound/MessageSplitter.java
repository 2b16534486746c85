package cafe.woden.ircbot.outbound;

import cafe.woden.ircbot.irc.IrcLineParseUtil;
import com.google.common.collect.ImmutableList;
import java.util.Objects;

/**
 * Splits long text into fragments of at most {@code maxBytes} UTF-8 bytes, cutting at the last
 * whitespace before the limit (or mid-word when there is none).
 *
 * <p>At most {@code maxMessages} fragments are produced; the last one carries whatever remains
 * and is left for the connection to truncate.
 */
public final class MessageSplitter {

  private MessageSplitter() {}

  public static ImmutableList<String> split(String text, int maxBytes, int maxMessages) {
    String remaining = Objects.toString(text, "");
    int limit = Math.max(1, maxMessages);
    ImmutableList.Builder<String> out = ImmutableList.builder();
    int count = 0;
    while (count < limit - 1 && IrcLineParseUtil.utf8Length(remaining) > maxBytes) {
      String head = IrcLineParseUtil.truncateUtf8(remaining, maxBytes);
      int cut = lastWhitespace(head);
      if (cut <= 0) cut = head.length();
      out.add(remaining.substring(0, cut));
      remaining = stripLeadingWhitespace(remaining.substring(cut));
      count++;
    }
    out.add(remaining);
    return out.build();
  }

  private static int lastWhitespace(String s) {
    for (int i = s.length() - 1; i >= 0; i--) {
      if (Character.isWhitespace(s.charAt(i))) return i;
    }
    return -1;
  }

  private static String stripLeadingWhitespace(String s) {
    int i = 0;
    while (i < s.length() && Character.isWhitespace(s.charAt(i))) i++;
    return s.substring(i);
  }
}
