package cafe.woden.xmppclient.config;

import cafe.woden.xmppclient.model.AutoAwayConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Presence subsystem configuration.
 *
 * <p>Example YAML:
 * <pre>
 * xmpp:
 *   presence:
 *     auto-away:
 *       enabled: true
 *       idle-threshold-ms: 300000
 *       check-interval-ms: 30000
 *     colors:
 *       saturation: 100
 *       light-theme-lightness: 35
 *       dark-theme-lightness: 65
 * </pre>
 */
@ConfigurationProperties(prefix = "xmpp.presence")
public record PresenceProperties(AutoAway autoAway, Colors colors) {

  public PresenceProperties {
    if (autoAway == null) {
      autoAway =
          new AutoAway(
              true,
              AutoAwayConfig.DEFAULT_IDLE_THRESHOLD_MS,
              AutoAwayConfig.DEFAULT_CHECK_INTERVAL_MS);
    }
    if (colors == null) {
      colors = Colors.defaults();
    }
  }

  public static PresenceProperties defaults() {
    return new PresenceProperties(null, null);
  }

  /**
   * Initial auto-away settings; the user can change them at runtime through the machine.
   *
   * <p>{@code enabled} defaults to true when the key is absent.
   */
  public record AutoAway(Boolean enabled, long idleThresholdMs, long checkIntervalMs) {
    public AutoAway {
      if (enabled == null) enabled = Boolean.TRUE;
      if (idleThresholdMs <= 0) idleThresholdMs = AutoAwayConfig.DEFAULT_IDLE_THRESHOLD_MS;
      if (checkIntervalMs <= 0) checkIntervalMs = AutoAwayConfig.DEFAULT_CHECK_INTERVAL_MS;
      if (checkIntervalMs > idleThresholdMs) checkIntervalMs = idleThresholdMs;
    }

    public AutoAwayConfig toConfig() {
      return new AutoAwayConfig(idleThresholdMs, checkIntervalMs, enabled);
    }
  }

  /**
   * XEP-0392 color generation (HSLuv saturation and lightness, 0-100).
   *
   * <p>The dark-theme lightness must be above the light-theme one so badges stay readable on both
   * backgrounds.
   */
  public record Colors(
      double saturation, double lightThemeLightness, double darkThemeLightness) {
    public Colors {
      if (saturation <= 0 || saturation > 100) saturation = 100;
      if (lightThemeLightness <= 0 || lightThemeLightness >= 100) lightThemeLightness = 35;
      if (darkThemeLightness <= 0 || darkThemeLightness >= 100) darkThemeLightness = 65;
      if (darkThemeLightness <= lightThemeLightness) {
        throw new IllegalArgumentException(
            "xmpp.presence.colors.dark-theme-lightness ("
                + darkThemeLightness
                + ") must be greater than light-theme-lightness ("
                + lightThemeLightness
                + ")");
      }
    }

    public static Colors defaults() {
      return new Colors(100, 35, 65);
    }
  }
}
