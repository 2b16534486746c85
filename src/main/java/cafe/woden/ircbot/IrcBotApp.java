package cafe.woden.ircbot;

import cafe.woden.ircbot.bot.ConnectionFactory;
import cafe.woden.ircbot.bot.IrcBot;
import cafe.woden.ircbot.config.BotProperties;
import cafe.woden.ircbot.irc.CloseReason;
import cafe.woden.ircbot.util.NamedThreads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@EnableConfigurationProperties(BotProperties.class)
public class IrcBotApp {
  private static final Logger log = LoggerFactory.getLogger(IrcBotApp.class);

  public static void main(String[] args) {
    SpringApplication.run(IrcBotApp.class, args);
  }

  /** Runs the bot on its own reader thread; when the connection ends, so does the process. */
  @Bean
  public ApplicationRunner run(
      BotProperties props, IrcBot bot, ApplicationShutdownCoordinator shutdown) {
    return args -> {
      if (!props.autostart()) {
        log.info("[ircbot] bot.autostart=false; not connecting");
        return;
      }
      NamedThreads.start(
          "ircbot-reader",
          false,
          () -> {
            CloseReason reason = bot.run(ConnectionFactory.SOCKET);
            log.info("[ircbot] Connection ended: {}", reason);
            shutdown.shutdown(reason.exitCode());
          });
    };
  }
}
