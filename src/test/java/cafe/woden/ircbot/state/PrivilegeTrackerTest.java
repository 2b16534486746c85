package cafe.woden.ircbot.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.ircbot.irc.IrcMessageParser;
import java.util.Set;
import org.junit.jupiter.api.Test;

class PrivilegeTrackerTest {

  private final PrivilegeTracker tracker = new PrivilegeTracker(() -> "Bot");

  private void server(String line) {
    tracker.onMessage(IrcMessageParser.parse(line));
  }

  private void joinedWithNames() {
    server(":bot!b@h JOIN #Chan");
    server(":srv 353 Bot = #chan :@alice +bob ~carol @+dave Bot");
  }

  @Test
  void namesReplyGrantsPrefixPrivileges() {
    joinedWithNames();

    ChannelState chan = tracker.channel("#CHAN").orElseThrow();
    assertTrue(chan.has("alice", Privilege.OP));
    assertTrue(chan.has("bob", Privilege.VOICE));
    assertTrue(chan.has("carol", Privilege.OWNER));
    assertEquals(Set.of(Privilege.OP, Privilege.VOICE), Privilege.of(chan.privileges("dave")));
    assertEquals(0, chan.privileges("bot"));
    assertEquals(5, chan.size());
  }

  @Test
  void modeChangesConsumeParametersInOrder() {
    joinedWithNames();

    server(":alice!a@h MODE #chan +o-v+b bob bob *!*@spam");
    server(":alice!a@h MODE #chan +k-o secret alice");

    ChannelState chan = tracker.channel("#chan").orElseThrow();
    assertEquals(Set.of(Privilege.OP), Privilege.of(chan.privileges("bob")));
    assertFalse(chan.has("alice", Privilege.OP));
    assertTrue(chan.hasAtLeast("bob", Privilege.HALFOP));
  }

  @Test
  void nickQuitPartAndKickUpdateMembership() {
    joinedWithNames();

    server(":alice!a@h NICK :Alicia");
    server(":bob!b@h QUIT :bye");
    server(":carol!c@h PART #chan :later");

    ChannelState chan = tracker.channel("#chan").orElseThrow();
    assertTrue(chan.has("alicia", Privilege.OP));
    assertFalse(chan.contains("alice"));
    assertFalse(chan.contains("bob"));
    assertFalse(chan.contains("carol"));
    assertTrue(chan.members().containsKey("Alicia"));

    server(":alicia!a@h KICK #chan Bot :out");
    assertTrue(tracker.channel("#chan").isEmpty());
    assertEquals(0, tracker.privileges("#chan", "alicia"));
  }

  @Test
  void ownJoinResetsStaleChannelState() {
    joinedWithNames();
    server(":bot!b@h JOIN #chan");

    assertEquals(1, tracker.channel("#chan").orElseThrow().size());
  }

  @Test
  void isupportReplacesModeTable() {
    server(":srv 005 Bot PREFIX=(ov)@+ CHANMODES=b,k,l,imnpst :are supported by this server");
    server(":bot!b@h JOIN #c");
    server(":srv 353 Bot = #c :@alice ~weird");

    assertNull(tracker.modes().privilegeForPrefix('~'));
    ChannelState chan = tracker.channel("#c").orElseThrow();
    assertTrue(chan.has("alice", Privilege.OP));
    assertTrue(chan.contains("~weird"));
  }

  @Test
  void privilegeBitsAreOrdered() {
    assertTrue(Privilege.OWNER.bit() > Privilege.ADMIN.bit());
    assertEquals(Privilege.OP, Privilege.forModeLetter('o'));
    assertEquals(Privilege.VOICE.bit() | Privilege.OP.bit(), Privilege.mask(Privilege.VOICE, Privilege.OP));
  }
}
