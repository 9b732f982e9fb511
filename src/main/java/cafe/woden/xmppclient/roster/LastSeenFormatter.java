package cafe.woden.xmppclient.roster;

import cafe.woden.xmppclient.model.Contact;
import cafe.woden.xmppclient.presence.PresenceRanking;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/** Short activity strings for contact tooltips ("Away · idle 15m", "Last seen 2h ago"). */
public final class LastSeenFormatter {

  private static final Duration ACTIVE_WINDOW = Duration.ofMinutes(1);

  /**
   * @param idle idle time of an online contact, null when active or offline
   * @param sinceLastSeen time since an offline contact was last seen, null otherwise
   */
  public record LastSeenInfo(String text, boolean active, Duration idle, Duration sinceLastSeen) {}

  private LastSeenFormatter() {}

  public static LastSeenInfo lastSeenInfo(Contact contact, Instant now) {
    Objects.requireNonNull(contact, "contact");
    Objects.requireNonNull(now, "now");

    if (contact.isOnline()) {
      Instant li = contact.lastInteraction();
      if (li == null) return new LastSeenInfo("Active now", true, null, null);

      Duration idle = nonNegative(Duration.between(li, now));
      if (idle.compareTo(ACTIVE_WINDOW) < 0) return new LastSeenInfo("Active now", true, null, null);
      return new LastSeenInfo(formatIdle(idle), false, idle, null);
    }

    Instant seen = contact.lastSeen();
    if (seen == null) return new LastSeenInfo("Offline", false, null, null);

    Duration since = nonNegative(Duration.between(seen, now));
    return new LastSeenInfo("Last seen " + formatAgo(since), false, null, since);
  }

  /** "Online · Active", "Away · idle 15m" or, when offline, the last-seen text alone. */
  public static String statusText(Contact contact, Instant now) {
    LastSeenInfo info = lastSeenInfo(contact, now);
    if (!contact.isOnline()) return info.text();

    String label = PresenceRanking.displayLabel(contact.presence());
    return info.active() ? label + " · Active" : label + " · " + info.text();
  }

  static String formatAgo(Duration d) {
    long minutes = d.toMinutes();
    long hours = d.toHours();
    long days = d.toDays();

    if (d.getSeconds() < 60) return "just now";
    if (minutes < 60) return minutes + "m ago";
    if (hours < 24) return hours + "h ago";
    if (days == 1) return "yesterday";
    if (days < 7) return days + "d ago";
    return (days / 7) + "w ago";
  }

  static String formatIdle(Duration d) {
    long minutes = d.toMinutes();
    long hours = d.toHours();

    if (minutes < 1) return "active";
    if (minutes < 60) return "idle " + minutes + "m";
    if (hours < 24) return "idle " + hours + "h";
    return "idle " + (hours / 24) + "d";
  }

  private static Duration nonNegative(Duration d) {
    return d.isNegative() ? Duration.ZERO : d;
  }
}
