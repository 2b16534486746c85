package cafe.woden.ircbot.cap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.junit.jupiter.api.Test;

class SaslAuthenticatorTest {

  private final List<String> lines = new ArrayList<>();
  private final Runnable resume = mock(Runnable.class);

  @SuppressWarnings("unchecked")
  private final Consumer<String> fail = mock(Consumer.class);

  private SaslAuthenticator plain(String user, String password) {
    return new SaslAuthenticator(user, password, "plain", lines::add, resume, fail);
  }

  @Test
  void plainSendsUserUserPasswordInBase64() {
    SaslAuthenticator sasl = plain("ircbot", "secret");

    assertEquals(
        CapabilityNegotiation.CONTINUE, sasl.onCapability(SaslAuthenticator.REQUEST, true));
    sasl.onAuthenticate("+");
    sasl.onNumeric("903");

    assertEquals(
        List.of("AUTHENTICATE PLAIN", "AUTHENTICATE aXJjYm90AGlyY2JvdABzZWNyZXQ="), lines);
    verify(resume).run();
    verify(fail, never()).accept(anyString());
  }

  @Test
  void longTokensAreChunkedAndTerminatedWhenExact() {
    // "u\0u\0" + 296 bytes = 300 bytes -> exactly 400 base64 characters.
    SaslAuthenticator sasl = plain("u", "p".repeat(296));
    sasl.onCapability(SaslAuthenticator.REQUEST, true);

    sasl.onAuthenticate("+");

    assertEquals(3, lines.size());
    assertEquals(400, lines.get(1).length() - "AUTHENTICATE ".length());
    assertEquals("AUTHENTICATE +", lines.get(2));
  }

  @Test
  void tokensLongerThanOneChunkAreSplit() {
    SaslAuthenticator sasl = plain("u", "p".repeat(400));
    sasl.onCapability(SaslAuthenticator.REQUEST, true);

    sasl.onAuthenticate("+");

    assertEquals(3, lines.size());
    assertEquals(400, lines.get(1).length() - "AUTHENTICATE ".length());
    assertTrue(lines.get(2).length() - "AUTHENTICATE ".length() < 400);
  }

  @Test
  void externalSendsEmptyResponse() {
    SaslAuthenticator sasl =
        new SaslAuthenticator("", "", "EXTERNAL", lines::add, resume, fail);
    sasl.onCapability(SaslAuthenticator.REQUEST, true);
    sasl.onAuthenticate("+");

    assertEquals(List.of("AUTHENTICATE EXTERNAL", "AUTHENTICATE +"), lines);
  }

  @Test
  void failureResumesThenFailsOnce() {
    SaslAuthenticator sasl = plain("u", "p");
    sasl.onCapability(SaslAuthenticator.REQUEST, true);

    sasl.onNumeric("904");
    sasl.onNumeric("904");

    verify(resume, times(1)).run();
    verify(fail, times(1)).accept("SASL authentication failed (904)");
  }

  @Test
  void refusalIsDoneWithoutAuthenticating() {
    SaslAuthenticator sasl = plain("u", "p");

    assertEquals(CapabilityNegotiation.DONE, sasl.onCapability(SaslAuthenticator.REQUEST, false));
    sasl.onAuthenticate("+");

    assertTrue(lines.isEmpty());
  }

  @Test
  void unknownMechanismIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new SaslAuthenticator("u", "p", "SCRAM-SHA-256", lines::add, resume, fail));
  }
}
