package cafe.woden.ircbot.irc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses a single decoded protocol line.
 *
 * <p>Grammar: {@code [@tags SP] [:source SP] command *(SP middle) [SP :trailing]}. The trailing
 * parameter starts at the first {@code " :"} after the command and runs to the end of the line,
 * spaces and colons included.
 */
public final class IrcMessageParser {

  private IrcMessageParser() {}

  public static IrcMessage parse(String line) {
    if (line == null) throw new IrcParseException("null line");
    String rest = line;
    if (rest.endsWith("\r")) rest = rest.substring(0, rest.length() - 1);
    if (rest.isBlank()) throw new IrcParseException("empty line");

    Map<String, String> tags = Map.of();
    if (rest.startsWith("@")) {
      int sp = rest.indexOf(' ');
      if (sp < 0) throw new IrcParseException("tags without command: " + line);
      tags = parseTags(rest.substring(1, sp));
      rest = skipSpaces(rest, sp);
    }

    Hostmask source = Hostmask.EMPTY;
    if (rest.startsWith(":")) {
      int sp = rest.indexOf(' ');
      if (sp < 0) throw new IrcParseException("source without command: " + line);
      source = Hostmask.parse(rest.substring(1, sp));
      rest = skipSpaces(rest, sp);
    }

    String trailing = null;
    int colon = rest.indexOf(" :");
    String head = rest;
    if (colon >= 0) {
      head = rest.substring(0, colon);
      trailing = rest.substring(colon + 2);
    }

    List<String> tokens = splitSpaces(head);
    if (tokens.isEmpty()) throw new IrcParseException("missing command: " + line);

    String command = tokens.get(0).toUpperCase(Locale.ROOT);
    List<String> params = new ArrayList<>(tokens.subList(1, tokens.size()));
    if (trailing != null) params.add(trailing);

    return new IrcMessage(tags, source, command, params, trailing != null, line);
  }

  static Map<String, String> parseTags(String section) {
    if (section == null || section.isEmpty()) return Map.of();
    LinkedHashMap<String, String> out = new LinkedHashMap<>();
    int idx = 0;
    while (idx < section.length()) {
      int next = section.indexOf(';', idx);
      if (next < 0) next = section.length();
      String part = section.substring(idx, next);
      idx = next + 1;

      if (part.isEmpty()) continue;
      int eq = part.indexOf('=');
      String key = eq >= 0 ? part.substring(0, eq) : part;
      if (key.isEmpty()) continue;
      String value = eq >= 0 ? unescapeTagValue(part.substring(eq + 1)) : "";
      out.put(key, value);
    }
    return out.isEmpty() ? Map.of() : Collections.unmodifiableMap(out);
  }

  static String unescapeTagValue(String v) {
    if (v == null || v.indexOf('\\') < 0) return v == null ? "" : v;
    StringBuilder sb = new StringBuilder(v.length());
    for (int i = 0; i < v.length(); i++) {
      char c = v.charAt(i);
      if (c != '\\') {
        sb.append(c);
        continue;
      }
      if (i + 1 >= v.length()) break;
      char n = v.charAt(++i);
      switch (n) {
        case ':':
          sb.append(';');
          break;
        case 's':
          sb.append(' ');
          break;
        case 'r':
          sb.append('\r');
          break;
        case 'n':
          sb.append('\n');
          break;
        default:
          sb.append(n);
      }
    }
    return sb.toString();
  }

  private static String skipSpaces(String s, int from) {
    int i = from;
    while (i < s.length() && s.charAt(i) == ' ') i++;
    return s.substring(i);
  }

  private static List<String> splitSpaces(String s) {
    List<String> out = new ArrayList<>();
    int i = 0;
    while (i < s.length()) {
      while (i < s.length() && s.charAt(i) == ' ') i++;
      int start = i;
      while (i < s.length() && s.charAt(i) != ' ') i++;
      if (i > start) out.add(s.substring(start, i));
    }
    return out;
  }
}
