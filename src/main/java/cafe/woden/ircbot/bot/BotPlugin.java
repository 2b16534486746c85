package cafe.woden.ircbot.bot;

/** A named group of handlers, capability requests and jobs. */
public interface BotPlugin {

  /** Name used for channel module restrictions, rate-limit keys and capability ownership. */
  String name();

  void setup(PluginRegistrar registrar);
}
