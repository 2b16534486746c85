package cafe.woden.ircbot.cap;

/** What a capability callback reports after the server acknowledged or denied its request. */
public enum CapabilityNegotiation {
  /** Finished; negotiation may end as far as this plugin is concerned. */
  DONE,
  /** Follow-up work is pending; the plugin will resume negotiation itself. */
  CONTINUE,
  /** The bot cannot work without this request; negotiation ends and the bot quits. */
  ERROR
}
