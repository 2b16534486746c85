package cafe.woden.ircbot.dispatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.ircbot.irc.Ctcp;
import cafe.woden.ircbot.irc.IrcMessage;
import cafe.woden.ircbot.irc.IrcMessageParser;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class DispatcherTest {

  private final AtomicLong now = new AtomicLong(1_000_000);
  private final RuleRegistry registry = new RuleRegistry();
  private final List<String> calls = new ArrayList<>();
  private final List<String> said = new ArrayList<>();
  private final ExecutorService executor = Executors.newSingleThreadExecutor();
  private final WorkerPool workers = new WorkerPool(executor);

  private final Dispatcher dispatcher =
      new Dispatcher(
          registry,
          new RateLimiter(now::get),
          new AccessPolicy(
              "boss", List.of(), List.of("troll"), List.of(), Map.of("#quiet", List.of("admin"))),
          workers,
          new HandlerErrorReporter((to, text) -> said.add(to + " " + text)),
          () -> "bot");

  @AfterEach
  void stopWorkers() {
    workers.shutdown();
  }

  private void register(String plugin, HandlerDescriptor.Builder b) {
    registry.register(b.threaded(false).build("bot", "\\.").withPlugin(plugin));
  }

  private static IrcMessage msg(String line) {
    return Ctcp.tagIntent(IrcMessageParser.parse(line));
  }

  private Handler record(String label) {
    return t -> {
      synchronized (calls) {
        calls.add(label + ":" + t.sender() + ":" + t.args());
      }
      return HandlerResult.OK;
    };
  }

  @Test
  void runsByPriorityThenRegistrationOrder() {
    register("p", HandlerDescriptor.command("go").named("low").priority(Priority.LOW).handler(record("low")));
    register("p", HandlerDescriptor.command("go").named("mid1").handler(record("mid1")));
    register("p", HandlerDescriptor.command("go").named("high").priority(Priority.HIGH).handler(record("high")));
    register("p", HandlerDescriptor.command("go").named("mid2").handler(record("mid2")));

    int started = dispatcher.dispatch(msg(":alice!a@h PRIVMSG #c :.go now"));

    assertEquals(4, started);
    assertEquals(List.of("high:#c:now", "mid1:#c:now", "mid2:#c:now", "low:#c:now"), calls);
  }

  @Test
  void commandArgumentsSurviveACapturingPrefix() {
    registry.register(
        HandlerDescriptor.command("seen")
            .threaded(false)
            .handler(record("seen"))
            .build("bot", "(\\.|!)")
            .withPlugin("p"));

    dispatcher.dispatch(msg(":alice!a@h PRIVMSG #c :!seen bob"));

    assertEquals(List.of("seen:#c:bob"), calls);
  }

  @Test
  void privateMessagesReplyToSender() {
    register("p", HandlerDescriptor.rule("hi").handler(record("hi")));

    dispatcher.dispatch(msg(":alice!a@h PRIVMSG bot :hi there"));

    assertEquals(List.of("hi:alice:"), calls);
  }

  @Test
  void eachMatchingPatternIsOneInvocation() {
    register("p", HandlerDescriptor.rule("a", "a.*", "b").handler(record("r")));

    assertEquals(2, dispatcher.dispatch(msg(":alice!a@h PRIVMSG #c :abc")));
  }

  @Test
  void blockedUsersOnlyReachUnblockableHandlers() {
    register("p", HandlerDescriptor.rule(".*").named("normal").handler(record("normal")));
    register("p", HandlerDescriptor.rule(".*").named("always").unblockable().handler(record("always")));

    dispatcher.dispatch(msg(":troll!t@h PRIVMSG #c :hello"));

    assertEquals(List.of("always:#c:"), calls);
  }

  @Test
  void channelModuleRestrictionsApplyToChannelMessagesOnly() {
    register("fun", HandlerDescriptor.rule("x").handler(record("fun")));
    register("admin", HandlerDescriptor.rule("x").handler(record("admin")));

    dispatcher.dispatch(msg(":alice!a@h PRIVMSG #quiet :x"));
    dispatcher.dispatch(msg(":alice!a@h PRIVMSG bot :x"));

    assertEquals(List.of("admin:#quiet:", "fun:alice:", "admin:alice:"), calls);
  }

  @Test
  void intentFilterRequiresMatchingCtcp() {
    register("p", HandlerDescriptor.rule("waves").intents("ACTION").handler(record("action")));

    dispatcher.dispatch(msg(":alice!a@h PRIVMSG #c :waves"));
    dispatcher.dispatch(msg(":alice!a@h PRIVMSG #c :\u0001VERSION\u0001"));
    dispatcher.dispatch(msg(":alice!a@h PRIVMSG #c :\u0001ACTION waves\u0001"));

    assertEquals(List.of("action:#c:"), calls);
  }

  @Test
  void rateLimitedUnlessAdminOrNoLimit() {
    register(
        "p",
        HandlerDescriptor.command("slow").rate(Duration.ofSeconds(20)).handler(record("slow")));
    register(
        "p",
        HandlerDescriptor.command("free")
            .rate(Duration.ofSeconds(20))
            .handler(
                t -> {
                  calls.add("free");
                  return HandlerResult.NOLIMIT;
                }));

    dispatcher.dispatch(msg(":alice!a@h PRIVMSG #c :.slow"));
    now.addAndGet(5_000);
    dispatcher.dispatch(msg(":alice!a@h PRIVMSG #c :.slow"));
    dispatcher.dispatch(msg(":bob!b@h PRIVMSG #c :.slow"));
    dispatcher.dispatch(msg(":boss!b@h PRIVMSG #c :.slow"));
    dispatcher.dispatch(msg(":alice!a@h PRIVMSG #c :.free"));
    dispatcher.dispatch(msg(":alice!a@h PRIVMSG #c :.free"));

    assertEquals(List.of("slow:#c:", "slow:#c:", "slow:#c:", "free", "free"), calls);
  }

  @Test
  void failuresAreReportedToTheSenderAndStillStampLimits() {
    register(
        "p",
        HandlerDescriptor.command("boom")
            .channelRate(Duration.ofSeconds(30))
            .handler(
                t -> {
                  throw new IllegalStateException("kaput");
                }));

    dispatcher.dispatch(msg(":alice!a@h PRIVMSG #c :.boom"));
    dispatcher.dispatch(msg(":bob!b@h PRIVMSG #c :.boom"));

    assertEquals(1, said.size());
    assertTrue(said.get(0).startsWith("#c IllegalStateException: kaput (DispatcherTest.java:"));
  }

  @Test
  void threadedHandlersRunOnWorkers() throws Exception {
    List<String> threads = new ArrayList<>();
    registry.register(
        HandlerDescriptor.rule("x")
            .handler(
                t -> {
                  synchronized (threads) {
                    threads.add(Thread.currentThread().getName());
                  }
                  return HandlerResult.OK;
                })
            .build("bot", "\\.")
            .withPlugin("p"));

    dispatcher.dispatch(msg(":alice!a@h PRIVMSG #c :x"));
    assertTrue(workers.awaitIdle(5, TimeUnit.SECONDS));

    synchronized (threads) {
      assertEquals(1, threads.size());
      assertNotEquals(Thread.currentThread().getName(), threads.get(0));
    }
  }

  @Test
  void eventsFilterByCommand() {
    register("p", HandlerDescriptor.event("JOIN").handler(record("join")));

    dispatcher.dispatch(msg(":alice!a@h JOIN #c"));
    dispatcher.dispatch(msg(":alice!a@h PRIVMSG #c :JOIN"));

    assertEquals(List.of("join:#c:"), calls);
  }
}
