package cafe.woden.xmppclient.model;

import java.util.Locale;
import java.util.Objects;

/** Roster subscription state (RFC 6121). */
public enum Subscription {
  NONE,
  TO,
  FROM,
  BOTH;

  public static Subscription fromWire(String raw) {
    String s = Objects.toString(raw, "").trim().toLowerCase(Locale.ROOT);
    return switch (s) {
      case "to" -> TO;
      case "from" -> FROM;
      case "both" -> BOTH;
      default -> NONE;
    };
  }
}
