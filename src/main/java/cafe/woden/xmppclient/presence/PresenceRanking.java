package cafe.woden.xmppclient.presence;

import cafe.woden.xmppclient.model.PresenceShow;
import cafe.woden.xmppclient.model.PresenceStatus;
import java.util.List;
import java.util.Optional;

/**
 * Availability ordering of show values.
 *
 * <p>Lower rank means more available: chat (0), online (1), away (2), xa (3), dnd (4), anything
 * else (5). Every tie-break in the presence code goes through this ordering.
 */
public final class PresenceRanking {

  public static final int UNRECOGNIZED_RANK = 5;

  private PresenceRanking() {}

  /** Rank of {@code show}; {@code null} is plain online. */
  public static int rank(PresenceShow show) {
    if (show == null) return 1;
    return switch (show) {
      case CHAT -> 0;
      case ONLINE -> 1;
      case AWAY -> 2;
      case XA -> 3;
      case DND -> 4;
      case UNRECOGNIZED -> UNRECOGNIZED_RANK;
    };
  }

  /**
   * Most available show of {@code shows}; on equal rank the earliest element wins.
   *
   * @return empty when {@code shows} is empty
   */
  public static Optional<PresenceShow> bestOf(List<PresenceShow> shows) {
    if (shows == null || shows.isEmpty()) return Optional.empty();

    PresenceShow best = shows.get(0);
    int bestRank = rank(best);
    for (int i = 1; i < shows.size(); i++) {
      PresenceShow s = shows.get(i);
      int r = rank(s);
      if (r < bestRank) {
        best = s;
        bestRank = r;
      }
    }
    return Optional.of(best == null ? PresenceShow.ONLINE : best);
  }

  /**
   * Maps an available presence's show value to the UI status.
   *
   * <p>Never returns {@link PresenceStatus#OFFLINE}: offline comes from having no resources.
   */
  public static PresenceStatus toStatus(PresenceShow show) {
    if (show == null) return PresenceStatus.ONLINE;
    return switch (show) {
      case CHAT, ONLINE, UNRECOGNIZED -> PresenceStatus.ONLINE;
      case AWAY, XA -> PresenceStatus.AWAY;
      case DND -> PresenceStatus.DND;
    };
  }

  /** Ordering used when sorting contacts: online, away, dnd, offline. */
  public static int statusOrder(PresenceStatus status) {
    if (status == null) return 3;
    return switch (status) {
      case ONLINE -> 0;
      case AWAY -> 1;
      case DND -> 2;
      case OFFLINE -> 3;
    };
  }

  public static String displayLabel(PresenceStatus status) {
    if (status == null) return "Offline";
    return switch (status) {
      case ONLINE -> "Online";
      case AWAY -> "Away";
      case DND -> "Do not disturb";
      case OFFLINE -> "Offline";
    };
  }
}
