package cafe.woden.ircbot.config;

import cafe.woden.ircbot.outbound.FloodSettings;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Bot configuration.
 *
 * <p>Example YAML:
 * <pre>
 * bot:
 *   server:
 *     host: irc.libera.chat
 *     tls: true
 *   identity:
 *     nick: mybot
 *   channels: ["#mybot"]
 *   access:
 *     owner: me
 * </pre>
 */
@ConfigurationProperties(prefix = "bot")
public record BotProperties(
    Server server,
    Identity identity,
    Sasl sasl,
    Duration timeout,
    Access access,
    List<String> channels,
    String commandPrefix,
    Flood flood,
    Workers workers,
    Duration capNegotiationTimeout,
    JoinRetry joinRetry,
    Boolean autostart) {

  public record Server(
      String host,
      Integer port,
      boolean tls,
      boolean trustAllCertificates,
      String password,
      Duration connectTimeout) {
    public Server {
      if (host == null) host = "";
      host = host.trim();
      if (port == null || port <= 0) port = tls ? 6697 : 6667;
      if (port > 65535) {
        throw new IllegalArgumentException("bot.server.port is invalid: " + port);
      }
      if (password == null) password = "";
      if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
        connectTimeout = Duration.ofSeconds(20);
      }
    }
  }

  public record Identity(
      String nick, String user, String realName, String modes, String nickservPassword) {
    public Identity {
      if (nick == null || nick.isBlank()) nick = "ircbot";
      nick = nick.trim();
      if (nick.contains(" ")) {
        throw new IllegalArgumentException("bot.identity.nick must not contain spaces: " + nick);
      }
      if (user == null || user.isBlank()) user = nick;
      if (realName == null || realName.isBlank()) realName = nick;
      if (modes == null) modes = "B";
      if (nickservPassword == null) nickservPassword = "";
    }
  }

  public record Sasl(boolean enabled, String username, String password, String mechanism) {
    public Sasl {
      if (username == null) username = "";
      if (password == null) password = "";
      if (mechanism == null || mechanism.isBlank()) mechanism = "PLAIN";
      mechanism = mechanism.trim().toUpperCase(Locale.ROOT);
      if (!"PLAIN".equals(mechanism) && !"EXTERNAL".equals(mechanism)) {
        throw new IllegalArgumentException("bot.sasl.mechanism must be PLAIN or EXTERNAL: " + mechanism);
      }
    }
  }

  public record Access(
      String owner,
      List<String> admins,
      List<String> nickBlocks,
      List<String> hostBlocks,
      Map<String, List<String>> channelModules) {
    public Access {
      if (owner == null) owner = "";
      if (admins == null) admins = List.of();
      if (nickBlocks == null) nickBlocks = List.of();
      if (hostBlocks == null) hostBlocks = List.of();
      if (channelModules == null) channelModules = Map.of();
    }
  }

  public record Flood(
      Duration pacingWindow,
      Double baseWaitSeconds,
      Integer penaltyThreshold,
      Double penaltyDivisor,
      Integer historySize,
      Integer loopLookback,
      Integer loopThreshold,
      Duration loopWindow,
      String placeholder,
      Integer placeholderLimit,
      Integer maxFragmentBytes) {
    public Flood {
      FloodSettings d = FloodSettings.DEFAULTS;
      if (pacingWindow == null) pacingWindow = d.pacingWindow();
      if (baseWaitSeconds == null) baseWaitSeconds = d.baseWaitSeconds();
      if (penaltyThreshold == null) penaltyThreshold = d.penaltyThreshold();
      if (penaltyDivisor == null) penaltyDivisor = d.penaltyDivisor();
      if (historySize == null) historySize = d.historySize();
      if (loopLookback == null) loopLookback = d.loopLookback();
      if (loopThreshold == null) loopThreshold = d.loopThreshold();
      if (loopWindow == null) loopWindow = d.loopWindow();
      if (placeholder == null || placeholder.isEmpty()) placeholder = d.placeholder();
      if (placeholderLimit == null) placeholderLimit = d.placeholderLimit();
      if (maxFragmentBytes == null) maxFragmentBytes = d.maxFragmentBytes();
    }

    public FloodSettings toSettings() {
      return new FloodSettings(
          pacingWindow,
          baseWaitSeconds,
          penaltyThreshold,
          penaltyDivisor,
          historySize,
          loopLookback,
          loopThreshold,
          loopWindow,
          placeholder,
          placeholderLimit,
          maxFragmentBytes);
    }
  }

  public record Workers(int coreThreads, int maxThreads, int queueCapacity) {
    public Workers {
      if (coreThreads <= 0) coreThreads = 4;
      if (maxThreads < coreThreads) maxThreads = Math.max(coreThreads, 16);
      if (queueCapacity <= 0) queueCapacity = 256;
    }
  }

  public record JoinRetry(Duration delay, int maxAttempts) {
    public JoinRetry {
      if (delay == null || delay.isNegative()) delay = Duration.ofSeconds(6);
      if (maxAttempts <= 0) maxAttempts = 10;
    }
  }

  public BotProperties {
    if (server == null) server = new Server("", null, false, false, "", null);
    if (identity == null) identity = new Identity(null, null, null, null, null);
    if (sasl == null) sasl = new Sasl(false, "", "", "PLAIN");
    if (timeout == null || timeout.isNegative()) timeout = Duration.ofSeconds(120);
    if (access == null) access = new Access(null, null, null, null, null);
    if (channels == null) channels = List.of();
    if (commandPrefix == null || commandPrefix.isEmpty()) commandPrefix = "\\.";
    if (flood == null) {
      flood = new Flood(null, null, null, null, null, null, null, null, null, null, null);
    }
    if (workers == null) workers = new Workers(0, 0, 0);
    if (capNegotiationTimeout == null || capNegotiationTimeout.isNegative()) {
      capNegotiationTimeout = Duration.ofSeconds(30);
    }
    if (joinRetry == null) joinRetry = new JoinRetry(null, 0);
    if (autostart == null) autostart = Boolean.TRUE;

    if (autostart && server.host().isEmpty()) {
      throw new IllegalArgumentException("bot.server.host is required when bot.autostart=true");
    }
  }

  /** SASL user name, falling back to the nick. */
  public String saslUsername() {
    return sasl.username().isBlank() ? identity.nick() : sasl.username();
  }
}
