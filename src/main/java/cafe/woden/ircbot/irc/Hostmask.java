package cafe.woden.ircbot.irc;

import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Message source split into nick, user and host.
 *
 * <p>Any part may be empty: a server source like {@code irc.example.net} has only a nick part.
 */
@ValueObject
public record Hostmask(String nick, String user, String host) {

  public static final Hostmask EMPTY = new Hostmask("", "", "");

  public Hostmask {
    nick = Objects.toString(nick, "");
    user = Objects.toString(user, "");
    host = Objects.toString(host, "");
  }

  /** Parse {@code nick!user@host}; the {@code !user} and {@code @host} parts are optional. */
  public static Hostmask parse(String source) {
    String s = Objects.toString(source, "");
    if (s.isEmpty()) return EMPTY;
    int bang = s.indexOf('!');
    int at = s.indexOf('@', bang < 0 ? 0 : bang);
    if (bang < 0 && at < 0) return new Hostmask(s, "", "");
    if (bang < 0) return new Hostmask(s.substring(0, at), "", s.substring(at + 1));
    if (at < 0) return new Hostmask(s.substring(0, bang), s.substring(bang + 1), "");
    return new Hostmask(s.substring(0, bang), s.substring(bang + 1, at), s.substring(at + 1));
  }

  public boolean isEmpty() {
    return nick.isEmpty() && user.isEmpty() && host.isEmpty();
  }

  @Override
  public String toString() {
    if (user.isEmpty() && host.isEmpty()) return nick;
    return nick + "!" + user + "@" + host;
  }
}
