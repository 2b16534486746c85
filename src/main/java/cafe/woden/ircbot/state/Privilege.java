package cafe.woden.ircbot.state;

import java.util.EnumSet;
import java.util.Set;

/** Channel privilege levels. Values are bits and combine additively. */
public enum Privilege {
  VOICE(1),
  HALFOP(2),
  OP(4),
  ADMIN(8),
  OWNER(16),
  OPER(32);

  private final int bit;

  Privilege(int bit) {
    this.bit = bit;
  }

  public int bit() {
    return bit;
  }

  public boolean in(int mask) {
    return (mask & bit) != 0;
  }

  public static int mask(Privilege... privileges) {
    int m = 0;
    for (Privilege p : privileges) m |= p.bit;
    return m;
  }

  public static Set<Privilege> of(int mask) {
    EnumSet<Privilege> out = EnumSet.noneOf(Privilege.class);
    for (Privilege p : values()) {
      if (p.in(mask)) out.add(p);
    }
    return out;
  }

  /** Privilege granted by a channel mode letter, or null for letters that grant none. */
  public static Privilege forModeLetter(char mode) {
    return switch (mode) {
      case 'v' -> VOICE;
      case 'h' -> HALFOP;
      case 'o' -> OP;
      case 'a' -> ADMIN;
      case 'q' -> OWNER;
      case 'y', 'Y' -> OPER;
      default -> null;
    };
  }
}
