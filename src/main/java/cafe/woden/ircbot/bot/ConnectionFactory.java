package cafe.woden.ircbot.bot;

import cafe.woden.ircbot.config.BotProperties;
import cafe.woden.ircbot.irc.IrcConnection;
import java.io.IOException;

/** Opens the socket for a bot. */
@FunctionalInterface
public interface ConnectionFactory {

  ConnectionFactory SOCKET =
      server ->
          IrcConnection.open(
              server.host(),
              server.port(),
              server.tls(),
              server.trustAllCertificates(),
              server.connectTimeout());

  IrcConnection open(BotProperties.Server server) throws IOException;
}
