package cafe.woden.ircbot.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.regex.Matcher;
import java.util.regex.PatternSyntaxException;
import org.junit.jupiter.api.Test;

class HandlerDescriptorTest {

  private static final Handler NOOP = t -> HandlerResult.OK;

  @Test
  void commandPatternCapturesNameAndArguments() {
    HandlerDescriptor d = HandlerDescriptor.command("help", "h").handler(NOOP).build("bot", "[.!]");

    Matcher m = d.patterns().get(0).matcher("!HELP  me please");
    assertTrue(m.lookingAt());
    assertEquals("HELP", m.group("command"));
    assertEquals("me please", m.group("args"));

    assertFalse(d.patterns().get(0).matcher(".helpme").lookingAt());
    assertTrue(d.patterns().get(1).matcher(".h").lookingAt());
    assertEquals("command:help", d.name());
    assertEquals(HandlerDescriptor.DEFAULT_EVENT, d.events().iterator().next());
  }

  @Test
  void groupsInTheCommandPrefixDoNotShiftArguments() {
    HandlerDescriptor d = HandlerDescriptor.command("seen").handler(NOOP).build("bot", "(\\.|!)");

    Matcher m = d.patterns().get(0).matcher("!seen alice");
    assertTrue(m.lookingAt());
    assertEquals("seen", m.group("command"));
    assertEquals("alice", m.group("args"));
  }

  @Test
  void ruleExpandsNickPlaceholder() {
    HandlerDescriptor d = HandlerDescriptor.rule("$nickhello").handler(NOOP).build("Bot|away", ".");

    assertTrue(d.patterns().get(0).matcher("bot|AWAY: hello").lookingAt());
    assertTrue(d.patterns().get(0).matcher("Bot|away,   hello").lookingAt());
    assertFalse(d.patterns().get(0).matcher("Botaaway: hello").lookingAt());
  }

  @Test
  void eventHandlerMatchesAnything() {
    HandlerDescriptor d = HandlerDescriptor.event("join").handler(NOOP).build("bot", ".");

    assertTrue(d.events().contains("JOIN"));
    assertTrue(d.patterns().get(0).matcher("").lookingAt());
    assertTrue(d.patterns().get(0).matcher("multi\nline").matches());
  }

  @Test
  void buildsDefaultsAndOptions() {
    HandlerDescriptor d =
        HandlerDescriptor.rule("x")
            .named("ex")
            .priority(Priority.LOW)
            .threaded(false)
            .rate(Duration.ofSeconds(5))
            .channelRate(Duration.ofSeconds(-1))
            .intents("action")
            .handler(NOOP)
            .build("bot", ".")
            .withPlugin("demo");

    assertEquals("demo.ex", d.id());
    assertEquals(Priority.LOW, d.priority());
    assertFalse(d.threaded());
    assertEquals(Duration.ZERO, d.rateLimits().channel());
    assertTrue(d.rateLimits().any());
    assertTrue(d.intents().contains("ACTION"));
  }

  @Test
  void invalidPatternsAndMissingHandlersFail() {
    assertThrows(
        PatternSyntaxException.class,
        () -> HandlerDescriptor.rule("(unclosed").handler(NOOP).build("bot", "."));
    assertThrows(
        NullPointerException.class, () -> HandlerDescriptor.rule("x").build("bot", "."));
    assertThrows(IllegalArgumentException.class, () -> HandlerDescriptor.command());
  }
}
