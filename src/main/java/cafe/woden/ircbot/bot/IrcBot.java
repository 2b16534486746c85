package cafe.woden.ircbot.bot;

import cafe.woden.ircbot.cap.CapabilityCallback;
import cafe.woden.ircbot.cap.CapabilityNegotiationCoordinator;
import cafe.woden.ircbot.cap.CapabilityNegotiator;
import cafe.woden.ircbot.cap.CapabilityRequest;
import cafe.woden.ircbot.config.BotProperties;
import cafe.woden.ircbot.dispatch.AccessPolicy;
import cafe.woden.ircbot.dispatch.Dispatcher;
import cafe.woden.ircbot.dispatch.HandlerDescriptor;
import cafe.woden.ircbot.dispatch.HandlerErrorReporter;
import cafe.woden.ircbot.dispatch.IntervalJob;
import cafe.woden.ircbot.dispatch.IntervalJobScheduler;
import cafe.woden.ircbot.dispatch.RateLimiter;
import cafe.woden.ircbot.dispatch.RuleRegistry;
import cafe.woden.ircbot.dispatch.Trigger;
import cafe.woden.ircbot.dispatch.WorkerPool;
import cafe.woden.ircbot.irc.CloseReason;
import cafe.woden.ircbot.irc.ConnectionTimersRx;
import cafe.woden.ircbot.irc.Ctcp;
import cafe.woden.ircbot.irc.IrcConnection;
import cafe.woden.ircbot.irc.IrcLineParseUtil;
import cafe.woden.ircbot.irc.IrcMessage;
import cafe.woden.ircbot.outbound.FloodControlQueue;
import cafe.woden.ircbot.outbound.Sleeper;
import cafe.woden.ircbot.state.ChannelState;
import cafe.woden.ircbot.state.Privilege;
import cafe.woden.ircbot.state.PrivilegeTracker;
import io.reactivex.rxjava3.core.Scheduler;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One bot: its registry, negotiation, privilege state, dispatcher and outbound queue, bound to
 * one connection at a time.
 *
 * <p>Everything is per instance, so several bots can share a process. {@link #run(ConnectionFactory)}
 * connects, registers and reads until the connection closes, then reports why.
 */
@ApplicationLayer
public final class IrcBot implements BotContext {
  private static final Logger log = LoggerFactory.getLogger(IrcBot.class);

  public static final String VERSION = "ircafe-bot 0.1.0";

  private final BotProperties props;
  private final KeyValueStore store;
  private final LongSupplier clock;

  private final RuleRegistry registry = new RuleRegistry();
  private final CapabilityNegotiator negotiator = new CapabilityNegotiator();
  private final CapabilityNegotiationCoordinator coordinator;
  private final PrivilegeTracker tracker;
  private final RateLimiter limiter;
  private final WorkerPool workers;
  private final Dispatcher dispatcher;
  private final IntervalJobScheduler jobs;
  private final FloodControlQueue flood;
  private final ConnectionTimersRx timers;

  private final List<Runnable> shutdownHooks = new CopyOnWriteArrayList<>();
  private final AtomicReference<IrcConnection> connection = new AtomicReference<>();
  private volatile String nick;

  public IrcBot(
      BotProperties props,
      List<BotPlugin> plugins,
      KeyValueStore store,
      Scheduler scheduler,
      ExecutorService workerExecutor,
      LongSupplier clock,
      Sleeper sleeper) {
    this.props = Objects.requireNonNull(props, "props");
    this.store = store == null ? new InMemoryKeyValueStore() : store;
    this.clock = clock == null ? System::currentTimeMillis : clock;
    this.nick = props.identity().nick();

    BotProperties.Access a = props.access();
    AccessPolicy access =
        new AccessPolicy(a.owner(), a.admins(), a.nickBlocks(), a.hostBlocks(), a.channelModules());

    this.tracker = new PrivilegeTracker(this::nick);
    this.limiter = new RateLimiter(this.clock);
    this.workers = new WorkerPool(Objects.requireNonNull(workerExecutor, "workerExecutor"));
    this.flood =
        new FloodControlQueue(this::writeRaw, props.flood().toSettings(), this.clock, sleeper);
    this.dispatcher =
        new Dispatcher(
            registry,
            limiter,
            access,
            workers,
            new HandlerErrorReporter(this::say),
            this::nick);
    this.jobs = new IntervalJobScheduler(scheduler, workers);
    this.timers = new ConnectionTimersRx(scheduler, this.clock);
    this.coordinator =
        new CapabilityNegotiationCoordinator(
            negotiator,
            this::writeRaw,
            scheduler,
            props.capNegotiationTimeout(),
            reason -> quit(reason, CloseReason.QUIT));

    setupPlugin(new CoreProtocolHandlers(this, props, scheduler));
    if (plugins != null) {
      for (BotPlugin p : plugins) setupPlugin(p);
    }
  }

  /** Connects, registers and reads until the connection closes. */
  public CloseReason run(ConnectionFactory factory) {
    IrcConnection conn;
    BotProperties.Server s = props.server();
    try {
      conn = factory.open(s);
    } catch (IOException e) {
      log.error("[ircbot] Could not connect to {}:{}: {}", s.host(), s.port(), e.toString());
      return CloseReason.TRANSPORT_ERROR;
    }
    attach(conn);
    conn.readLoop();
    return conn.closeReason().orElse(CloseReason.SERVER_CLOSED);
  }

  /** Binds {@code conn}, starts timers and sends the registration burst. Does not read. */
  void attach(IrcConnection conn) {
    connection.set(conn);
    conn.onMessage(this::onMessage);
    for (Runnable hook : shutdownHooks) conn.addShutdownHook(hook);
    conn.addShutdownHook(this::stopWork);
    conn.startWatchdog(timers, props.timeout(), props.server().host());

    coordinator.begin();
    BotProperties.Server s = props.server();
    if (!s.password().isEmpty()) writeRaw("PASS " + s.password());
    writeRaw("NICK " + props.identity().nick());
    write(List.of("USER", props.identity().user(), "0", "*"), props.identity().realName());

    jobs.start(registry.jobs());
  }

  void onMessage(IrcMessage raw) {
    IrcMessage m = Ctcp.tagIntent(raw);
    dispatcher.dispatch(m);
  }

  private void stopWork() {
    jobs.stop();
    coordinator.cancelDeadline();
    workers.cancelAll();
  }

  private void setupPlugin(BotPlugin plugin) {
    String name = Objects.toString(plugin.name(), "").trim();
    if (name.isEmpty()) throw new IllegalArgumentException("plugin name is required");
    plugin.setup(new Registrar(name));
    log.info("[ircbot] Loaded plugin {}", name);
  }

  private final class Registrar implements PluginRegistrar {
    private final String plugin;

    Registrar(String plugin) {
      this.plugin = plugin;
    }

    @Override
    public BotContext bot() {
      return IrcBot.this;
    }

    @Override
    public HandlerDescriptor register(HandlerDescriptor.Builder handler) {
      HandlerDescriptor d =
          handler.build(props.identity().nick(), props.commandPrefix()).withPlugin(plugin);
      registry.register(d);
      return d;
    }

    @Override
    public void registerCapability(CapabilityRequest request, CapabilityCallback callback) {
      negotiator.register(plugin, request, callback);
    }

    @Override
    public void registerJob(IntervalJob job) {
      registry.registerJob(job.withPlugin(plugin));
    }

    @Override
    public void addShutdownHook(Runnable hook) {
      if (hook != null) shutdownHooks.add(hook);
    }
  }

  // ---- engine accessors used by the core handlers and tests

  PrivilegeTracker tracker() {
    return tracker;
  }

  CapabilityNegotiationCoordinator coordinator() {
    return coordinator;
  }

  RuleRegistry registry() {
    return registry;
  }

  WorkerPool workers() {
    return workers;
  }

  void nickChanged(String newNick) {
    String n = Objects.toString(newNick, "").trim();
    if (n.isEmpty() || n.equals(nick)) return;
    log.info("[ircbot] Nick is now {}", n);
    nick = n;
  }

  void quit(String reason, CloseReason closeReason) {
    write(List.of("QUIT"), Objects.toString(reason, ""));
    IrcConnection conn = connection.get();
    if (conn != null) conn.close(closeReason);
  }

  public Optional<IrcConnection> connection() {
    return Optional.ofNullable(connection.get());
  }

  /** Closes the current connection, if any. */
  public void shutdown() {
    IrcConnection conn = connection.get();
    if (conn != null && conn.isOpen()) quit("Shutting down", CloseReason.SHUTDOWN);
    workers.shutdown();
  }

  // ---- BotContext

  @Override
  public String nick() {
    return nick;
  }

  @Override
  public void say(String recipient, String text, int maxMessages) {
    flood.say(recipient, text, maxMessages);
  }

  @Override
  public void reply(Trigger trigger, String text) {
    if (trigger.isPrivate()) say(trigger.sender(), text);
    else say(trigger.sender(), trigger.nick() + ": " + text);
  }

  @Override
  public void action(String recipient, String text) {
    say(recipient, new Ctcp("ACTION", text).wrap());
  }

  @Override
  public void notice(String recipient, String text) {
    flood.notice(recipient, text);
  }

  @Override
  public void write(List<String> args, String trailing) {
    writeRaw(IrcLineParseUtil.compose(args, trailing));
  }

  @Override
  public void writeRaw(String line) {
    IrcConnection conn = connection.get();
    if (conn == null) {
      log.debug("[ircbot] Not connected; dropping {}", line);
      return;
    }
    conn.writeLine(line);
  }

  @Override
  public void join(String channel) {
    join(channel, null);
  }

  @Override
  public void join(String channel, String key) {
    List<String> args = new ArrayList<>(List.of("JOIN", Objects.toString(channel, "")));
    if (key != null && !key.isBlank()) args.add(key);
    write(args, null);
  }

  @Override
  public void part(String channel, String reason) {
    write(List.of("PART", Objects.toString(channel, "")), reason);
  }

  @Override
  public void quit(String reason) {
    quit(reason, CloseReason.QUIT);
  }

  @Override
  public Optional<ChannelState> channel(String name) {
    return tracker.channel(name);
  }

  @Override
  public boolean hasPrivilege(String channel, String nick, Privilege privilege) {
    return privilege.in(tracker.privileges(channel, nick));
  }

  @Override
  public boolean isCapabilityEnabled(String capability) {
    return coordinator.isEnabled(capability);
  }

  @Override
  public void resumeCapabilityNegotiation(CapabilityRequest request, String plugin) {
    coordinator.resume(request, plugin);
  }

  @Override
  public KeyValueStore store() {
    return store;
  }
}
