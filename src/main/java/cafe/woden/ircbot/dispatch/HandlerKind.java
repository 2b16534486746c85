package cafe.woden.ircbot.dispatch;

/** How a handler decides which messages it wants. */
public enum HandlerKind {
  /** Regular expressions matched against the message text. */
  RULE,
  /** Command names following the command prefix. */
  COMMAND,
  /** Every message of the listed event types. */
  EVENT
}
