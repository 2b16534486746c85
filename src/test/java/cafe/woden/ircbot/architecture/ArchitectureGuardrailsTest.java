package cafe.woden.ircbot.architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;
import org.jmolecules.ddd.annotation.ValueObject;

@AnalyzeClasses(
    packages = "cafe.woden.ircbot",
    importOptions = {ImportOption.DoNotIncludeTests.class})
class ArchitectureGuardrailsTest {

  @ArchTest
  static final ArchRule irc_should_not_depend_on_higher_packages =
      noClasses()
          .that()
          .resideInAPackage("cafe.woden.ircbot.irc..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage(
              "cafe.woden.ircbot.cap..",
              "cafe.woden.ircbot.state..",
              "cafe.woden.ircbot.dispatch..",
              "cafe.woden.ircbot.outbound..",
              "cafe.woden.ircbot.bot..",
              "cafe.woden.ircbot.config..")
          .because("the protocol layer must stay usable without the bot engine");

  @ArchTest
  static final ArchRule engine_parts_should_not_depend_on_bot_or_config =
      noClasses()
          .that()
          .resideInAnyPackage(
              "cafe.woden.ircbot.cap..",
              "cafe.woden.ircbot.state..",
              "cafe.woden.ircbot.dispatch..",
              "cafe.woden.ircbot.outbound..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("cafe.woden.ircbot.bot..", "cafe.woden.ircbot.config..")
          .because("IrcBot assembles the engine parts, not the other way around");

  @ArchTest
  static final ArchRule engine_parts_should_not_depend_on_spring =
      noClasses()
          .that()
          .resideInAnyPackage(
              "cafe.woden.ircbot.irc..",
              "cafe.woden.ircbot.cap..",
              "cafe.woden.ircbot.state..",
              "cafe.woden.ircbot.dispatch..",
              "cafe.woden.ircbot.outbound..",
              "cafe.woden.ircbot.bot..")
          .should()
          .dependOnClassesThat()
          .resideInAPackage("org.springframework..")
          .because("only config and the application entry point are Spring-aware");

  @ArchTest
  static final ArchRule value_objects_should_be_records =
      classes()
          .that()
          .areAnnotatedWith(ValueObject.class)
          .should()
          .beAssignableTo(Record.class)
          .because("value objects are immutable and compared by value");
}
