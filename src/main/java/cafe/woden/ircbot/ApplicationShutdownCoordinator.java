package cafe.woden.ircbot;

import cafe.woden.ircbot.bot.IrcBot;
import cafe.woden.ircbot.util.NamedThreads;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.support.AbstractApplicationContext;
import org.springframework.stereotype.Component;

/** Stops the bot, closes the Spring context and exits the JVM with the bot's exit code. */
@Component
public class ApplicationShutdownCoordinator {
  private static final Logger log = LoggerFactory.getLogger(ApplicationShutdownCoordinator.class);

  // Hard stop if a handler thread refuses to die.
  private static final long SHUTDOWN_WATCHDOG_MS = 8000L;

  private final ConfigurableApplicationContext applicationContext;
  private final IrcBot bot;
  private final AtomicBoolean shutdownStarted = new AtomicBoolean(false);

  public ApplicationShutdownCoordinator(
      ConfigurableApplicationContext applicationContext, IrcBot bot) {
    this.applicationContext = applicationContext;
    this.bot = bot;
  }

  public void shutdown(int exitCode) {
    if (!shutdownStarted.compareAndSet(false, true)) {
      return;
    }

    NamedThreads.start(
        "ircbot-shutdown-watchdog",
        true,
        () -> {
          try {
            Thread.sleep(SHUTDOWN_WATCHDOG_MS);
          } catch (InterruptedException e) {
            return;
          }
          log.error(
              "[ircbot] Shutdown watchdog fired after {}ms; forcing JVM halt.",
              SHUTDOWN_WATCHDOG_MS);
          Runtime.getRuntime().halt(exitCode == 0 ? 1 : exitCode);
        });

    int code = exitCode;
    try {
      bot.shutdown();
    } catch (RuntimeException e) {
      log.warn("[ircbot] Error while stopping the bot", e);
      code = Math.max(code, 1);
    }

    try {
      if (isApplicationContextActive()) {
        final int exit = code;
        code = SpringApplication.exit(applicationContext, () -> exit);
      }
    } catch (IllegalStateException e) {
      log.debug("[ircbot] Spring context already closed during shutdown.", e);
    }

    int stopped = NamedThreads.shutdownTrackedExecutorsNow();
    if (stopped > 0) log.debug("[ircbot] Stopped {} executor(s) still running", stopped);

    System.exit(code);
  }

  private boolean isApplicationContextActive() {
    if (applicationContext instanceof AbstractApplicationContext ac) {
      return ac.isActive();
    }
    return true;
  }
}
