package cafe.woden.ircbot.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.ircbot.bot.BotPlugin;
import cafe.woden.ircbot.bot.InMemoryKeyValueStore;
import cafe.woden.ircbot.bot.IrcBot;
import cafe.woden.ircbot.bot.KeyValueStore;
import cafe.woden.ircbot.bot.PluginRegistrar;
import cafe.woden.ircbot.dispatch.HandlerDescriptor;
import cafe.woden.ircbot.dispatch.HandlerResult;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

class BotEngineConfigTest {

  private final ApplicationContextRunner runner =
      new ApplicationContextRunner()
          .withUserConfiguration(
              PropsConfig.class, ExecutorConfig.class, BotEngineConfig.class)
          .withPropertyValues("bot.autostart=false", "bot.workers.core-threads=2");

  @Test
  void wiresBotWithDefaultStoreAndBoundedPool() {
    runner.run(
        ctx -> {
          assertTrue(ctx.containsBean("ircBot"));
          assertInstanceOf(InMemoryKeyValueStore.class, ctx.getBean(KeyValueStore.class));
          ExecutorService pool =
              ctx.getBean(ExecutorConfig.BOT_HANDLER_EXECUTOR, ExecutorService.class);
          assertEquals(2, ((ThreadPoolExecutor) pool).getCorePoolSize());
          assertEquals("ircbot", ctx.getBean(IrcBot.class).nick());
        });
  }

  @Test
  void customStoreAndPluginBeansAreUsed() {
    // Registered ahead of the engine config so the default store backs off.
    new ApplicationContextRunner()
        .withUserConfiguration(
            PropsConfig.class, PluginConfig.class, ExecutorConfig.class, BotEngineConfig.class)
        .withPropertyValues("bot.autostart=false")
        .run(
            ctx -> {
              KeyValueStore store = ctx.getBean(KeyValueStore.class);
              assertInstanceOf(CustomStore.class, store);
              assertEquals(store, ctx.getBean(IrcBot.class).store());
            });
  }

  static class CustomStore extends InMemoryKeyValueStore {}

  @Configuration(proxyBeanMethods = false)
  @EnableConfigurationProperties(BotProperties.class)
  static class PropsConfig {}

  @Configuration(proxyBeanMethods = false)
  static class PluginConfig {
    @Bean
    KeyValueStore customStore() {
      return new CustomStore();
    }

    @Bean
    BotPlugin echoPlugin() {
      return new BotPlugin() {
        @Override
        public String name() {
          return "echo";
        }

        @Override
        public void setup(PluginRegistrar registrar) {
          registrar.register(
              HandlerDescriptor.command("echo")
                  .handler(
                      t -> {
                        registrar.bot().reply(t, t.args());
                        return HandlerResult.OK;
                      }));
        }
      };
    }
  }
}
