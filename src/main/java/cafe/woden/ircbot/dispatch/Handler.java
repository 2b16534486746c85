package cafe.woden.ircbot.dispatch;

/** Code run for a matching message. Exceptions are caught and reported by the dispatcher. */
@FunctionalInterface
public interface Handler {
  HandlerResult handle(Trigger trigger) throws Exception;
}
