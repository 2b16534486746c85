package cafe.woden.ircbot.irc;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/** Small, dependency-free helpers shared by the parser, tracker and outbound layers. */
public final class IrcLineParseUtil {

  private IrcLineParseUtil() {}

  public static boolean looksNumeric(String s) {
    if (s == null || s.isBlank()) return false;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      if (c < '0' || c > '9') return false;
    }
    return true;
  }

  public static boolean looksLikeChannel(String s) {
    if (s == null || s.isBlank()) return false;
    char c = s.charAt(0);
    return c == '#' || c == '&' || c == '+' || c == '!';
  }

  /** Remove CR and LF so a value can never smuggle a second protocol line. */
  public static String stripLineBreaks(String s) {
    String v = Objects.toString(s, "");
    if (v.indexOf('\r') < 0 && v.indexOf('\n') < 0) return v;
    return v.replace("\r", "").replace("\n", "");
  }

  /**
   * Join {@code args} with spaces and append {@code trailing} after {@code " :"} when it is not
   * null. Line breaks are removed from every part.
   */
  public static String compose(List<String> args, String trailing) {
    StringBuilder sb = new StringBuilder();
    if (args != null) {
      for (String a : args) {
        String v = stripLineBreaks(a).trim();
        if (v.isEmpty()) continue;
        if (sb.length() > 0) sb.append(' ');
        sb.append(v);
      }
    }
    if (trailing != null) sb.append(" :").append(stripLineBreaks(trailing));
    return sb.toString();
  }

  public static int utf8Length(String s) {
    return Objects.toString(s, "").getBytes(StandardCharsets.UTF_8).length;
  }

  /**
   * Longest prefix of {@code s} whose UTF-8 encoding fits in {@code maxBytes}, never splitting a
   * surrogate pair.
   */
  public static String truncateUtf8(String s, int maxBytes) {
    String v = Objects.toString(s, "");
    if (maxBytes <= 0) return "";
    int bytes = 0;
    int i = 0;
    while (i < v.length()) {
      int cp = v.codePointAt(i);
      int len = utf8Width(cp);
      if (bytes + len > maxBytes) break;
      bytes += len;
      i += Character.charCount(cp);
    }
    return v.substring(0, i);
  }

  private static int utf8Width(int cp) {
    if (cp < 0x80) return 1;
    if (cp < 0x800) return 2;
    if (cp < 0x10000) return 3;
    return 4;
  }
}
