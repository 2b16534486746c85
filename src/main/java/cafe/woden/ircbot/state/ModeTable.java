package cafe.woden.ircbot.state;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * How channel modes and NAMES prefixes map to privileges, as advertised by {@code 005 PREFIX} and
 * {@code CHANMODES}.
 *
 * <p>Defaults: {@code PREFIX=(yqaohv)!~&@%+} and {@code CHANMODES=beI,k,l,*}.
 */
@ValueObject
public record ModeTable(
    ImmutableMap<Character, Privilege> modePrivileges,
    ImmutableMap<Character, Privilege> prefixPrivileges,
    ImmutableSet<Character> listModes,
    ImmutableSet<Character> alwaysParamModes,
    ImmutableSet<Character> setParamModes) {

  public static final String DEFAULT_PREFIX = "(yqaohv)!~&@%+";
  public static final String DEFAULT_CHANMODES = "beI,k,l,*";

  private static final ModeTable DEFAULTS =
      new ModeTable(
              ImmutableMap.of(), ImmutableMap.of(), ImmutableSet.of(), ImmutableSet.of(), ImmutableSet.of())
          .withPrefix(DEFAULT_PREFIX)
          .withChanModes(DEFAULT_CHANMODES);

  public ModeTable {
    modePrivileges = Objects.requireNonNullElse(modePrivileges, ImmutableMap.of());
    prefixPrivileges = Objects.requireNonNullElse(prefixPrivileges, ImmutableMap.of());
    listModes = Objects.requireNonNullElse(listModes, ImmutableSet.of());
    alwaysParamModes = Objects.requireNonNullElse(alwaysParamModes, ImmutableSet.of());
    setParamModes = Objects.requireNonNullElse(setParamModes, ImmutableSet.of());
  }

  public static ModeTable defaults() {
    return DEFAULTS;
  }

  /** Applies an ISUPPORT {@code PREFIX} value such as {@code (ov)@+}. Malformed values are ignored. */
  public ModeTable withPrefix(String value) {
    String v = Objects.toString(value, "").trim();
    int close = v.indexOf(')');
    if (!v.startsWith("(") || close < 0) return this;
    String letters = v.substring(1, close);
    String prefixes = v.substring(close + 1);
    if (letters.length() != prefixes.length()) return this;

    ImmutableMap.Builder<Character, Privilege> modes = ImmutableMap.builder();
    ImmutableMap.Builder<Character, Privilege> pfx = ImmutableMap.builder();
    for (int i = 0; i < letters.length(); i++) {
      Privilege p = Privilege.forModeLetter(letters.charAt(i));
      if (p == null) continue;
      modes.put(letters.charAt(i), p);
      pfx.put(prefixes.charAt(i), p);
    }
    return new ModeTable(
        modes.buildKeepingLast(), pfx.buildKeepingLast(), listModes, alwaysParamModes, setParamModes);
  }

  /** Applies an ISUPPORT {@code CHANMODES} value ({@code A,B,C,D}). */
  public ModeTable withChanModes(String value) {
    String[] groups = Objects.toString(value, "").split(",", -1);
    if (groups.length < 3) return this;
    return new ModeTable(
        modePrivileges, prefixPrivileges, chars(groups[0]), chars(groups[1]), chars(groups[2]));
  }

  /** Whether {@code mode} consumes a parameter in a MODE line. */
  public boolean takesParam(char mode, boolean adding) {
    if (modePrivileges.containsKey(mode)) return true;
    if (listModes.contains(mode) || alwaysParamModes.contains(mode)) return true;
    return adding && setParamModes.contains(mode);
  }

  public Privilege privilegeForMode(char mode) {
    return modePrivileges.get(mode);
  }

  public Privilege privilegeForPrefix(char prefix) {
    return prefixPrivileges.get(prefix);
  }

  private static ImmutableSet<Character> chars(String s) {
    ImmutableSet.Builder<Character> b = ImmutableSet.builder();
    for (char c : s.toCharArray()) b.add(c);
    return b.build();
  }
}
