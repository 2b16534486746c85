package cafe.woden.ircbot.irc;

/** Where finished protocol lines are written. Implementations add the line terminator. */
@FunctionalInterface
public interface LineSink {
  void writeLine(String line);
}
