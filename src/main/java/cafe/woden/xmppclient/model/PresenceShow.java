package cafe.woden.xmppclient.model;

import java.util.Locale;
import java.util.Objects;

/**
 * The {@code <show/>} sub-state of an available XMPP presence.
 *
 * <p>{@link #ONLINE} stands for a presence without any {@code <show/>} element. Tokens we do not
 * know are kept as {@link #UNRECOGNIZED} so a malformed stanza still counts as available.
 */
public enum PresenceShow {
  CHAT("chat"),
  ONLINE(null),
  AWAY("away"),
  XA("xa"),
  DND("dnd"),
  UNRECOGNIZED(null);

  private final String wireValue;

  PresenceShow(String wireValue) {
    this.wireValue = wireValue;
  }

  /** Token to put in {@code <show/>}, or {@code null} when the element must be omitted. */
  public String wireValue() {
    return wireValue;
  }

  public static PresenceShow fromWire(String raw) {
    String s = Objects.toString(raw, "").trim();
    if (s.isEmpty()) return ONLINE;
    return switch (s.toLowerCase(Locale.ROOT)) {
      case "chat" -> CHAT;
      case "away" -> AWAY;
      case "xa" -> XA;
      case "dnd" -> DND;
      default -> UNRECOGNIZED;
    };
  }
}
