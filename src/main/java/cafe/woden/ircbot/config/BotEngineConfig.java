package cafe.woden.ircbot.config;

import cafe.woden.ircbot.bot.BotPlugin;
import cafe.woden.ircbot.bot.InMemoryKeyValueStore;
import cafe.woden.ircbot.bot.IrcBot;
import cafe.woden.ircbot.bot.KeyValueStore;
import cafe.woden.ircbot.outbound.Sleeper;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires the bot engine. Plugins are every {@link BotPlugin} bean in the context. */
@Configuration
public class BotEngineConfig {

  @Bean
  public Scheduler botScheduler(
      @Qualifier(ExecutorConfig.BOT_TIMER_SCHEDULER) ScheduledExecutorService timers) {
    return Schedulers.from(timers);
  }

  @Bean
  @ConditionalOnMissingBean(KeyValueStore.class)
  public KeyValueStore keyValueStore() {
    return new InMemoryKeyValueStore();
  }

  @Bean(destroyMethod = "shutdown")
  public IrcBot ircBot(
      BotProperties props,
      ObjectProvider<BotPlugin> plugins,
      KeyValueStore store,
      Scheduler botScheduler,
      @Qualifier(ExecutorConfig.BOT_HANDLER_EXECUTOR) ExecutorService handlers) {
    List<BotPlugin> loaded = plugins.orderedStream().toList();
    return new IrcBot(
        props, loaded, store, botScheduler, handlers, System::currentTimeMillis, Sleeper.THREAD);
  }
}
