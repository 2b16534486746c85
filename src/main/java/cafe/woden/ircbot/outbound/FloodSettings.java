package cafe.woden.ircbot.outbound;

import java.time.Duration;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Pacing and loop-suppression parameters.
 *
 * <p>A send within {@code pacingWindow} of the previous one to the same recipient waits
 * {@code baseWaitSeconds + max(0, length - penaltyThreshold) / penaltyDivisor} seconds after it.
 */
@ValueObject
public record FloodSettings(
    Duration pacingWindow,
    double baseWaitSeconds,
    int penaltyThreshold,
    double penaltyDivisor,
    int historySize,
    int loopLookback,
    int loopThreshold,
    Duration loopWindow,
    String placeholder,
    int placeholderLimit,
    int maxFragmentBytes) {

  public static final FloodSettings DEFAULTS =
      new FloodSettings(
          Duration.ofSeconds(3), 0.7, 50, 70.0, 10, 8, 5, Duration.ofSeconds(120), "…", 3, 400);

  public FloodSettings {
    pacingWindow = pacingWindow == null ? Duration.ofSeconds(3) : pacingWindow;
    if (baseWaitSeconds < 0) baseWaitSeconds = 0;
    if (penaltyThreshold < 0) penaltyThreshold = 0;
    if (penaltyDivisor <= 0) penaltyDivisor = 70.0;
    if (historySize <= 0) historySize = 10;
    if (loopLookback <= 0) loopLookback = 8;
    if (loopLookback > historySize) loopLookback = historySize;
    if (loopThreshold <= 0) loopThreshold = 5;
    loopWindow = loopWindow == null ? Duration.ofSeconds(120) : loopWindow;
    placeholder = Objects.toString(placeholder, "").isEmpty() ? "…" : placeholder;
    if (placeholderLimit <= 0) placeholderLimit = 3;
    if (maxFragmentBytes <= 0) maxFragmentBytes = 400;
  }

  /** Milliseconds a message of {@code length} characters must trail the previous send by. */
  public long waitMillis(int length) {
    double penalty = Math.max(0, length - penaltyThreshold) / penaltyDivisor;
    return Math.round((baseWaitSeconds + penalty) * 1000.0);
  }
}
