package cafe.woden.ircbot.config;

import cafe.woden.ircbot.util.NamedThreads;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * App-owned executors.
 *
 * <p>Timers get their own single thread so a saturated handler pool never delays keepalives or
 * the negotiation deadline.
 */
@Configuration
public class ExecutorConfig {
  public static final String BOT_TIMER_SCHEDULER = "botTimerScheduler";
  public static final String BOT_HANDLER_EXECUTOR = "botHandlerExecutor";

  @Bean(name = BOT_TIMER_SCHEDULER, destroyMethod = "shutdown")
  public ScheduledExecutorService botTimerScheduler() {
    return NamedThreads.newSingleThreadScheduledExecutor("ircbot-timers");
  }

  @Bean(name = BOT_HANDLER_EXECUTOR, destroyMethod = "shutdown")
  public ExecutorService botHandlerExecutor(BotProperties props) {
    BotProperties.Workers w = props.workers();
    return NamedThreads.newBoundedPool(
        "ircbot-handler", w.coreThreads(), w.maxThreads(), w.queueCapacity());
  }
}
