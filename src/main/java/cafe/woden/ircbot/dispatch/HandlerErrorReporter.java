package cafe.woden.ircbot.dispatch;

import java.util.Objects;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs a handler failure and tells the trigger's reply target about it.
 *
 * <p>The message is a short, stable signature: {@code <ExceptionType>: <message> (<File>:<line>)}
 * using the frame that threw.
 */
public final class HandlerErrorReporter {
  private static final Logger log = LoggerFactory.getLogger(HandlerErrorReporter.class);

  private final BiConsumer<String, String> say;

  public HandlerErrorReporter(BiConsumer<String, String> say) {
    this.say = say == null ? (to, text) -> {} : say;
  }

  public void report(HandlerDescriptor handler, Trigger trigger, Throwable error) {
    String signature = signature(error);
    log.error(
        "[ircbot] Handler {} failed on {} from {}: {}",
        handler.id(),
        trigger.event(),
        trigger.nick(),
        signature,
        error);
    String target = trigger.sender();
    if (target.isEmpty()) return;
    try {
      say.accept(target, signature);
    } catch (RuntimeException e) {
      log.warn("[ircbot] Could not report handler failure to {}", target, e);
    }
  }

  public static String signature(Throwable error) {
    if (error == null) return "";
    StringBuilder sb = new StringBuilder(error.getClass().getSimpleName());
    String msg = Objects.toString(error.getMessage(), "").trim();
    if (!msg.isEmpty()) sb.append(": ").append(msg);
    StackTraceElement[] trace = error.getStackTrace();
    if (trace != null && trace.length > 0) {
      StackTraceElement top = trace[0];
      String file = top.getFileName() == null ? top.getClassName() : top.getFileName();
      sb.append(" (").append(file).append(':').append(top.getLineNumber()).append(')');
    }
    return sb.toString();
  }
}
