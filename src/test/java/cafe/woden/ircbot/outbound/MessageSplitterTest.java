package cafe.woden.ircbot.outbound;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class MessageSplitterTest {

  @Test
  void shortTextIsOneFragment() {
    assertEquals(List.of("hello"), MessageSplitter.split("hello", 400, 3));
  }

  @Test
  void cutsAtLastWhitespaceBeforeTheLimit() {
    assertEquals(List.of("aaa bbb", "ccc"), MessageSplitter.split("aaa bbb ccc", 8, 5));
  }

  @Test
  void lastFragmentCarriesTheRemainder() {
    assertEquals(List.of("aaa", "bbb ccc ddd"), MessageSplitter.split("aaa bbb ccc ddd", 4, 2));
  }

  @Test
  void unbrokenTextIsCutAtTheByteLimit() {
    assertEquals(List.of("abcd", "efgh", "ij"), MessageSplitter.split("abcdefghij", 4, 5));
  }

  @Test
  void multiByteCharactersAreNeverSplit() {
    assertEquals(List.of("éé", "é"), MessageSplitter.split("ééé", 5, 5));
  }
}
