package cafe.woden.ircbot.dispatch;

/** What a handler returns. */
public enum HandlerResult {
  OK,
  /** Do not count this invocation against rate limits. */
  NOLIMIT
}
