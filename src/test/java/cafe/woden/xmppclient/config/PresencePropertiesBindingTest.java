package cafe.woden.xmppclient.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.xmppclient.model.AutoAwayConfig;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class PresencePropertiesBindingTest {

  private final ApplicationContextRunner runner =
      new ApplicationContextRunner().withUserConfiguration(PresencePropertiesTestConfig.class);

  @Test
  void defaultsAreAppliedWhenNothingIsConfigured() {
    runner.run(
        ctx -> {
          PresenceProperties props = ctx.getBean(PresenceProperties.class);

          AutoAwayConfig autoAway = props.autoAway().toConfig();
          assertTrue(autoAway.enabled());
          assertEquals(300_000, autoAway.idleThresholdMs());
          assertEquals(30_000, autoAway.checkIntervalMs());

          assertEquals(100, props.colors().saturation());
          assertEquals(35, props.colors().lightThemeLightness());
          assertEquals(65, props.colors().darkThemeLightness());
        });
  }

  @Test
  void explicitValuesBind() {
    runner
        .withPropertyValues(
            "xmpp.presence.auto-away.enabled=false",
            "xmpp.presence.auto-away.idle-threshold-ms=120000",
            "xmpp.presence.auto-away.check-interval-ms=10000",
            "xmpp.presence.colors.saturation=80",
            "xmpp.presence.colors.light-theme-lightness=40",
            "xmpp.presence.colors.dark-theme-lightness=70")
        .run(
            ctx -> {
              PresenceProperties props = ctx.getBean(PresenceProperties.class);

              assertFalse(props.autoAway().enabled());
              assertEquals(120_000, props.autoAway().idleThresholdMs());
              assertEquals(10_000, props.autoAway().checkIntervalMs());
              assertEquals(80, props.colors().saturation());
              assertEquals(40, props.colors().lightThemeLightness());
              assertEquals(70, props.colors().darkThemeLightness());
            });
  }

  @Test
  void partialAutoAwaySectionKeepsAutoAwayEnabled() {
    runner
        .withPropertyValues("xmpp.presence.auto-away.idle-threshold-ms=60000")
        .run(
            ctx -> {
              PresenceProperties props = ctx.getBean(PresenceProperties.class);
              assertTrue(props.autoAway().enabled());
              assertEquals(60_000, props.autoAway().idleThresholdMs());
            });
  }

  @Test
  void invalidValuesAreNormalized() {
    runner
        .withPropertyValues(
            "xmpp.presence.auto-away.idle-threshold-ms=-1",
            "xmpp.presence.auto-away.check-interval-ms=900000",
            "xmpp.presence.colors.saturation=250")
        .run(
            ctx -> {
              PresenceProperties props = ctx.getBean(PresenceProperties.class);
              assertEquals(300_000, props.autoAway().idleThresholdMs());
              assertEquals(300_000, props.autoAway().checkIntervalMs());
              assertEquals(100, props.colors().saturation());
            });
  }

  @Test
  void invertedLightnessFailsStartup() {
    runner
        .withPropertyValues(
            "xmpp.presence.colors.light-theme-lightness=70",
            "xmpp.presence.colors.dark-theme-lightness=30")
        .run(ctx -> assertInstanceOf(Throwable.class, ctx.getStartupFailure()));
  }

  @Configuration(proxyBeanMethods = false)
  @EnableConfigurationProperties(PresenceProperties.class)
  static class PresencePropertiesTestConfig {}
}
