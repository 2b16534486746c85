package cafe.woden.ircbot.bot;

import cafe.woden.ircbot.cap.CapabilityCallback;
import cafe.woden.ircbot.cap.CapabilityRequest;
import cafe.woden.ircbot.dispatch.HandlerDescriptor;
import cafe.woden.ircbot.dispatch.IntervalJob;

/** Registration surface handed to {@link BotPlugin#setup(PluginRegistrar)}. */
public interface PluginRegistrar {

  BotContext bot();

  /**
   * Compiles and registers a handler.
   *
   * @throws java.util.regex.PatternSyntaxException for an invalid pattern
   */
  HandlerDescriptor register(HandlerDescriptor.Builder handler);

  /**
   * @throws cafe.woden.ircbot.cap.CapabilityRequestTooLongException when the request cannot fit
   *     on one line
   */
  void registerCapability(CapabilityRequest request, CapabilityCallback callback);

  void registerJob(IntervalJob job);

  /** Runs when the connection closes, before the socket is released. */
  void addShutdownHook(Runnable hook);
}
