package cafe.woden.xmppclient.presence;

import cafe.woden.xmppclient.config.PresenceProperties;
import cafe.woden.xmppclient.model.ContactColors;
import cafe.woden.xmppclient.model.Jids;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Locale;
import org.hsluv.HsluvColorConverter;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.springframework.stereotype.Component;

/**
 * XEP-0392 consistent colors for contact badges.
 *
 * <p>The bare JID is hashed with SHA-1; the first two digest bytes (little-endian) pick a hue,
 * which is rendered through HSLuv twice: once dark enough for light backgrounds, once light
 * enough for dark backgrounds. The result depends on nothing but the JID and the configured
 * lightness, so callers compute it once when a contact is created.
 */
@Component
@ApplicationLayer
public class ContactColorAssigner {

  private final PresenceProperties.Colors colors;

  public ContactColorAssigner(PresenceProperties props) {
    this.colors = props != null ? props.colors() : PresenceProperties.Colors.defaults();
  }

  public ContactColors assign(String jid) {
    double hue = hueAngle(Jids.bare(jid));
    String light = hex(hue, colors.saturation(), colors.lightThemeLightness());
    String dark = hex(hue, colors.saturation(), colors.darkThemeLightness());
    return new ContactColors(light, dark);
  }

  /** HSLuv (hue in degrees, saturation and lightness 0-100) as lower-case {@code #rrggbb}. */
  static String hex(double hue, double saturation, double lightness) {
    HsluvColorConverter converter = new HsluvColorConverter();
    converter.hsluv_h = hue;
    converter.hsluv_s = saturation;
    converter.hsluv_l = lightness;
    converter.hsluvToRgb();
    return String.format(
        Locale.ROOT,
        "#%02x%02x%02x",
        channel(converter.rgb_r),
        channel(converter.rgb_g),
        channel(converter.rgb_b));
  }

  private static int channel(double value) {
    return (int) Math.max(0, Math.min(255, Math.round(value * 255)));
  }

  /** XEP-0392 hue angle in degrees, {@code [0, 360)}. */
  public static double hueAngle(String input) {
    byte[] digest = sha1(input == null ? "" : input);
    int value = (digest[0] & 0xff) | ((digest[1] & 0xff) << 8);
    return value / 65536.0 * 360.0;
  }

  private static byte[] sha1(String input) {
    try {
      return MessageDigest.getInstance("SHA-1").digest(input.getBytes(StandardCharsets.UTF_8));
    } catch (NoSuchAlgorithmException e) {
      // Every JRE is required to ship SHA-1.
      throw new IllegalStateException("SHA-1 not available", e);
    }
  }
}
