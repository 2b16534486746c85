package cafe.woden.ircbot.irc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CtcpTest {

  @Test
  void tagsIntentAndStripsDelimiters() {
    IrcMessage m = IrcMessageParser.parse(":a!b@c PRIVMSG #chan :\u0001ACTION waves\u0001");

    IrcMessage tagged = Ctcp.tagIntent(m);

    assertEquals("ACTION", tagged.tag(Ctcp.INTENT_TAG).orElseThrow());
    assertEquals("waves", tagged.text());
    assertEquals("#chan", tagged.param(0));
  }

  @Test
  void requestWithoutTextAndMissingClosingDelimiter() {
    IrcMessage m = IrcMessageParser.parse(":a!b@c PRIVMSG bot :\u0001version");

    IrcMessage tagged = Ctcp.tagIntent(m);

    assertEquals("VERSION", tagged.tag(Ctcp.INTENT_TAG).orElseThrow());
    assertEquals("", tagged.text());
  }

  @Test
  void plainMessagesAreUnchanged() {
    IrcMessage m = IrcMessageParser.parse(":a!b@c PRIVMSG #chan :hello");
    assertSame(m, Ctcp.tagIntent(m));
    assertFalse(Ctcp.unwrap("\u0001").isPresent());
  }

  @Test
  void wrapRoundsOutReply() {
    assertEquals("\u0001PING 123\u0001", new Ctcp("ping", "123").wrap());
    assertTrue(new Ctcp("VERSION", "").wrap().endsWith("VERSION\u0001"));
  }
}
