package cafe.woden.ircbot.cap;

/**
 * A request that would not fit on one {@code CAP * ACK} line (500 bytes of tokens).
 */
public class CapabilityRequestTooLongException extends IllegalArgumentException {
  private final CapabilityRequest request;

  public CapabilityRequestTooLongException(CapabilityRequest request) {
    super("Capability request too long: " + request.encoded());
    this.request = request;
  }

  public CapabilityRequest request() {
    return request;
  }
}
