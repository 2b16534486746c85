package cafe.woden.ircbot.cap;

/** Called when the server acknowledges ({@code true}) or denies a registered request. */
@FunctionalInterface
public interface CapabilityCallback {
  CapabilityNegotiation onResult(CapabilityRequest request, boolean acknowledged);
}
