package cafe.woden.ircbot.irc;

/** A line that does not follow the protocol grammar. */
public class IrcParseException extends IllegalArgumentException {
  public IrcParseException(String message) {
    super(message);
  }
}
