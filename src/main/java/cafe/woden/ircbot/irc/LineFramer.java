package cafe.woden.ircbot.irc;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits an inbound byte stream into lines.
 *
 * <p>Bytes accumulate until a {@code \n} arrives; the line is emitted without its terminator and
 * without a trailing {@code \r}. The output does not depend on how the stream was chunked. Not
 * thread-safe: owned by the reader.
 */
public final class LineFramer {

  private static final int INITIAL_CAPACITY = 1024;

  private byte[] buf = new byte[INITIAL_CAPACITY];
  private int count;

  public List<byte[]> feed(byte[] chunk) {
    return chunk == null ? List.of() : feed(chunk, 0, chunk.length);
  }

  public List<byte[]> feed(byte[] chunk, int offset, int length) {
    if (chunk == null || length <= 0) return List.of();
    List<byte[]> lines = new ArrayList<>();
    int end = offset + length;
    for (int i = offset; i < end; i++) {
      byte b = chunk[i];
      if (b == '\n') {
        int len = count;
        if (len > 0 && buf[len - 1] == '\r') len--;
        lines.add(Arrays.copyOf(buf, len));
        count = 0;
      } else {
        append(b);
      }
    }
    return lines;
  }

  /** Bytes received after the last complete line. */
  public int pending() {
    return count;
  }

  private void append(byte b) {
    if (count == buf.length) buf = Arrays.copyOf(buf, buf.length * 2);
    buf[count++] = b;
  }
}
