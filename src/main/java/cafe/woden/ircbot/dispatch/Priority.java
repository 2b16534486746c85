package cafe.woden.ircbot.dispatch;

/** Order in which handlers are tried for each inbound message. */
public enum Priority {
  HIGH,
  MEDIUM,
  LOW
}
