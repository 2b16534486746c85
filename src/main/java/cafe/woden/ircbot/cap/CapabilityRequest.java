package cafe.woden.ircbot.cap;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * A set of capability tokens requested together and acknowledged or denied as a whole.
 *
 * <p>Tokens are sorted and de-duplicated so the same request always has the same identity. A
 * token prefixed with {@code -} asks for the capability to be disabled.
 */
@ValueObject
public record CapabilityRequest(ImmutableList<String> tokens) {

  public CapabilityRequest {
    TreeSet<String> sorted = new TreeSet<>();
    if (tokens != null) {
      for (String t : tokens) {
        String n = normalizeToken(t);
        if (n != null) sorted.add(n);
      }
    }
    if (sorted.isEmpty()) throw new IllegalArgumentException("capability request is empty");
    tokens = ImmutableList.copyOf(sorted);
  }

  public static CapabilityRequest of(String... tokens) {
    return new CapabilityRequest(ImmutableList.copyOf(Arrays.asList(tokens)));
  }

  public static CapabilityRequest of(Collection<String> tokens) {
    return new CapabilityRequest(ImmutableList.copyOf(tokens));
  }

  /** Parse the space-separated token list of a {@code CAP REQ/ACK/NAK} line. */
  public static CapabilityRequest parse(String text) {
    String t = text == null ? "" : text.trim();
    return of(t.isEmpty() ? List.of() : Arrays.asList(t.split("\\s+")));
  }

  /** Capability names this request needs the server to advertise, without the {@code -} prefix. */
  public ImmutableSet<String> requiredCapabilities() {
    ImmutableSet.Builder<String> b = ImmutableSet.builder();
    for (String t : tokens) b.add(t.startsWith("-") ? t.substring(1) : t);
    return b.build();
  }

  /** The request as it appears on the wire. */
  public String encoded() {
    return String.join(" ", tokens);
  }

  public int encodedLength() {
    return encoded().getBytes(StandardCharsets.UTF_8).length;
  }

  static String normalizeToken(String cap) {
    if (cap == null) return null;
    String normalized = cap.trim();
    if (normalized.isEmpty()) return null;
    if (normalized.startsWith(":")) normalized = normalized.substring(1).trim();
    boolean negated = false;
    if (normalized.startsWith("-")) {
      negated = true;
      normalized = normalized.substring(1).trim();
    }
    int eq = normalized.indexOf('=');
    if (eq >= 0) normalized = normalized.substring(0, eq).trim();
    if (normalized.isEmpty()) return null;
    normalized = normalized.toLowerCase(Locale.ROOT);
    return negated ? "-" + normalized : normalized;
  }

  @Override
  public String toString() {
    return encoded();
  }
}
