package cafe.woden.ircbot.cap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CapabilityNegotiatorTest {

  private final List<String> lines = new ArrayList<>();
  private final CapabilityNegotiator negotiator = new CapabilityNegotiator();

  @Test
  void requestIdentityIgnoresOrderAndCase() {
    assertEquals(CapabilityRequest.of("b", "A"), CapabilityRequest.parse(":a b"));
    assertEquals("-away-notify echo-message", CapabilityRequest.of("echo-message=1", "-away-notify").encoded());
    assertThrows(IllegalArgumentException.class, () -> CapabilityRequest.parse("  "));
  }

  @Test
  void sharedRequestIsSentOnceAndCompletesWhenEveryOwnerIsDone() {
    CapabilityRequest req = CapabilityRequest.of("account-tag", "extended-join");
    negotiator.register("one", req, (r, ack) -> CapabilityNegotiation.DONE);
    negotiator.register("two", req, (r, ack) -> CapabilityNegotiation.CONTINUE);

    List<CapabilityRequest> sent =
        negotiator.requestAvailable(Set.of("account-tag", "extended-join", "sasl"), lines::add);

    assertEquals(List.of(req), sent);
    assertEquals(List.of("CAP REQ :account-tag extended-join"), lines);

    List<CapabilityNegotiator.Outcome> outcomes = negotiator.acknowledge(req).orElseThrow();
    assertEquals(2, outcomes.size());
    assertTrue(negotiator.isAcknowledged(req));
    assertFalse(negotiator.isComplete());

    assertFalse(negotiator.resume(req, "unknown").completedNow());
    assertTrue(negotiator.resume(req, "two").completedNow());
    assertTrue(negotiator.isComplete());
  }

  @Test
  void requestsNeedingUnadvertisedCapabilitiesAreNotSent() {
    negotiator.register("p", CapabilityRequest.of("sasl", "chghost"), (r, ack) -> null);

    assertTrue(negotiator.requestAvailable(Set.of("sasl"), lines::add).isEmpty());
    assertTrue(lines.isEmpty());
    assertTrue(negotiator.isComplete());
  }

  @Test
  void alreadyRequestedRequestsAreSkipped() {
    CapabilityRequest req = CapabilityRequest.of("echo-message");
    negotiator.register("p", req, (r, ack) -> CapabilityNegotiation.DONE);

    negotiator.requestAvailable(Set.of("echo-message"), lines::add);
    negotiator.requestAvailable(Set.of("echo-message"), lines::add);

    assertEquals(1, lines.size());
  }

  @Test
  void answersForUnknownRequestsAreIgnored() {
    CapabilityRequest req = CapabilityRequest.of("multi-prefix");
    assertTrue(negotiator.acknowledge(req).isEmpty());
    assertTrue(negotiator.deny(req).isEmpty());
  }

  @Test
  void denialRunsCallbackWithFalse() {
    CapabilityRequest req = CapabilityRequest.of("multi-prefix");
    List<Boolean> answers = new ArrayList<>();
    negotiator.register(
        "p",
        req,
        (r, ack) -> {
          answers.add(ack);
          return null;
        });
    negotiator.requestAvailable(Set.of("multi-prefix"), lines::add);

    CapabilityNegotiator.Outcome outcome = negotiator.deny(req).orElseThrow().get(0);

    assertEquals(List.of(false), answers);
    assertTrue(outcome.done());
    assertTrue(negotiator.isDenied(req));
  }

  @Test
  void answersAreReversibleAndCallbacksSeeEachPolarity() {
    CapabilityRequest req = CapabilityRequest.of("away-notify");
    List<Boolean> answers = new ArrayList<>();
    negotiator.register(
        "p",
        req,
        (r, ack) -> {
          answers.add(ack);
          return CapabilityNegotiation.DONE;
        });
    negotiator.requestAvailable(Set.of("away-notify"), lines::add);

    negotiator.acknowledge(req).orElseThrow();
    assertTrue(negotiator.isAcknowledged(req));
    assertFalse(negotiator.isDenied(req));

    negotiator.deny(req).orElseThrow();
    assertFalse(negotiator.isAcknowledged(req));
    assertTrue(negotiator.isDenied(req));

    negotiator.acknowledge(req).orElseThrow();
    assertTrue(negotiator.isAcknowledged(req));
    assertFalse(negotiator.isDenied(req));

    assertEquals(List.of(true, false, true), answers);
    assertTrue(negotiator.isComplete());
  }

  @Test
  void overlongRequestIsRejectedAtRegistration() {
    List<String> caps = new ArrayList<>();
    for (int i = 0; i < 60; i++) caps.add("vendor.example/cap" + i);
    CapabilityRequest big = CapabilityRequest.of(caps);

    CapabilityRequestTooLongException e =
        assertThrows(
            CapabilityRequestTooLongException.class,
            () -> negotiator.register("p", big, (r, ack) -> null));
    assertEquals(big, e.request());
    assertFalse(negotiator.isRegistered(big));
  }
}
