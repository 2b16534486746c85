package cafe.woden.ircbot.irc;

import java.util.Objects;

/**
 * RFC 1459 case folding for nicknames and channel names.
 *
 * <p>ASCII letters fold to lower case and {@code {}|^} fold to {@code []\~}, so "Foo{}" and
 * "foo[]" are the same identity. Every identity key in the bot (privilege maps, rate limits,
 * block lists, outbound history) goes through {@link #fold(String)}.
 */
public final class IrcCaseMapping {

  private IrcCaseMapping() {}

  public static String fold(String name) {
    String s = Objects.toString(name, "");
    StringBuilder sb = null;
    for (int i = 0; i < s.length(); i++) {
      char c = s.charAt(i);
      char f = foldChar(c);
      if (f != c && sb == null) {
        sb = new StringBuilder(s.length());
        sb.append(s, 0, i);
      }
      if (sb != null) sb.append(f);
    }
    return sb == null ? s : sb.toString();
  }

  public static boolean equals(String a, String b) {
    if (a == null || b == null) return a == b;
    return fold(a).equals(fold(b));
  }

  private static char foldChar(char c) {
    if (c >= 'A' && c <= 'Z') return (char) (c + ('a' - 'A'));
    switch (c) {
      case '{':
        return '[';
      case '}':
        return ']';
      case '|':
        return '\\';
      case '^':
        return '~';
      default:
        return c;
    }
  }
}
