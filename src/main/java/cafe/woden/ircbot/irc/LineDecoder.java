package cafe.woden.ircbot.irc;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Turns raw line bytes into text.
 *
 * <p>Strict UTF-8 is tried first, then strict windows-1252, then ISO-8859-1. A line that none of
 * them accept is reported as empty and dropped by the caller.
 */
public final class LineDecoder {

  private static final List<Charset> DEFAULT_CHAIN =
      List.of(StandardCharsets.UTF_8, Charset.forName("windows-1252"), StandardCharsets.ISO_8859_1);

  private final List<Charset> chain;

  public LineDecoder() {
    this(DEFAULT_CHAIN);
  }

  LineDecoder(List<Charset> chain) {
    this.chain = List.copyOf(chain);
  }

  public Optional<String> decode(byte[] line) {
    if (line == null) return Optional.empty();
    for (Charset cs : chain) {
      try {
        return Optional.of(
            cs.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(line))
                .toString());
      } catch (CharacterCodingException e) {
        // next charset
      }
    }
    return Optional.empty();
  }
}
