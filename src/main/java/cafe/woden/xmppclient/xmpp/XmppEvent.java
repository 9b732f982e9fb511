package cafe.woden.xmppclient.xmpp;

import cafe.woden.xmppclient.model.RosterItem;
import java.time.Instant;
import java.util.List;

/**
 * Parsed inbound events the transport hands to the presence subsystem.
 *
 * <p>Addresses are raw JIDs as received; show values are the raw {@code <show/>} token (null when
 * the element was absent).
 */
public sealed interface XmppEvent
    permits XmppEvent.Connected,
        XmppEvent.Disconnected,
        XmppEvent.FullAuthRequired,
        XmppEvent.PresenceAvailable,
        XmppEvent.PresenceUnavailable,
        XmppEvent.PresenceError,
        XmppEvent.RosterReceived,
        XmppEvent.RosterItemPushed,
        XmppEvent.RosterItemRemoved {

  record Connected(Instant at, String boundJid) implements XmppEvent {}

  record Disconnected(Instant at, String reason) implements XmppEvent {}

  /**
   * Stream resumption failed and the session had to authenticate from scratch.
   *
   * <p>Contacts that went offline during the gap were never reported, so every cached presence is
   * stale.
   */
  record FullAuthRequired(Instant at) implements XmppEvent {}

  /** Available presence from one resource. */
  record PresenceAvailable(
      Instant at,
      String from,
      String show,
      int priority,
      String status,
      Instant lastInteraction,
      String client)
      implements XmppEvent {

    public static PresenceAvailable of(String from, String show, int priority, String status) {
      return new PresenceAvailable(Instant.now(), from, show, priority, status, null, null);
    }
  }

  /** {@code type="unavailable"} from one resource. */
  record PresenceUnavailable(Instant at, String from) implements XmppEvent {}

  /** {@code type="error"} presence, typically addressed from the bare JID. */
  record PresenceError(Instant at, String from, String condition) implements XmppEvent {}

  /** Full roster (initial fetch or re-fetch after a new session). */
  record RosterReceived(Instant at, List<RosterItem> items) implements XmppEvent {
    public RosterReceived {
      items = items == null ? List.of() : List.copyOf(items);
    }
  }

  record RosterItemPushed(Instant at, RosterItem item) implements XmppEvent {}

  record RosterItemRemoved(Instant at, String jid) implements XmppEvent {}
}
