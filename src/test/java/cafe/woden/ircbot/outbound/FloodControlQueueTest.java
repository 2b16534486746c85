package cafe.woden.ircbot.outbound;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class FloodControlQueueTest {

  private final AtomicLong now = new AtomicLong(1_000_000);
  private final List<Long> sleeps = new ArrayList<>();
  private final List<String> lines = new ArrayList<>();

  // Sleeping advances the fake clock.
  private final Sleeper sleeper =
      ms -> {
        sleeps.add(ms);
        now.addAndGet(ms);
      };

  private final FloodControlQueue queue =
      new FloodControlQueue(lines::add, FloodSettings.DEFAULTS, now::get, sleeper);

  @Test
  void firstMessageIsImmediateAndFollowUpsArePaced() {
    queue.say("#c", "one", 1);
    queue.say("#c", "two", 1);

    assertEquals(List.of("PRIVMSG #c :one", "PRIVMSG #c :two"), lines);
    assertEquals(List.of(700L), sleeps);
  }

  @Test
  void longMessagesWaitLonger() {
    FloodSettings s = FloodSettings.DEFAULTS;
    assertEquals(700L, s.waitMillis(50));
    assertEquals(2_129L, s.waitMillis(150));
  }

  @Test
  void pacingIsPerRecipient() {
    queue.say("#a", "x", 1);
    queue.say("#b", "x", 1);
    queue.notice("alice", "x");

    assertTrue(sleeps.isEmpty());
    assertEquals("NOTICE alice :x", lines.get(2));
  }

  @Test
  void messagesOutsideThePacingWindowAreNotDelayed() {
    queue.say("#c", "one", 1);
    now.addAndGet(3_000);
    queue.say("#c", "two", 1);

    assertTrue(sleeps.isEmpty());
  }

  @Test
  void repeatedTextBecomesPlaceholderThenIsDropped() {
    for (int i = 0; i < 10; i++) queue.say("#c", "spam", 1);

    assertEquals(
        List.of(
            "PRIVMSG #c :spam",
            "PRIVMSG #c :spam",
            "PRIVMSG #c :spam",
            "PRIVMSG #c :spam",
            "PRIVMSG #c :spam",
            "PRIVMSG #c :…",
            "PRIVMSG #c :…",
            "PRIVMSG #c :…"),
        lines);
  }

  @Test
  void longTextIsSplitAtWhitespaceUpToTheLimit() {
    String word = "word ";
    String text = word.repeat(200).trim();

    int written = queue.send("PRIVMSG", "#c", text, 2);

    assertEquals(2, written);
    assertTrue(lines.get(0).length() <= "PRIVMSG #c :".length() + 400);
    assertTrue(lines.get(0).endsWith("word"));
  }

  @Test
  void lineBreaksCannotInjectCommands() {
    queue.say("#c\r\n", "hi\r\nQUIT :x", 1);
    assertEquals(List.of("PRIVMSG #c :hiQUIT :x"), lines);
  }
}
