package cafe.woden.xmppclient.roster;

import cafe.woden.xmppclient.model.Contact;
import java.util.Objects;

/**
 * One observable change of the contact store.
 *
 * <p>{@code jid}, {@code previous} and {@code current} are null for store-wide kinds ({@link
 * Kind#ROSTER_REPLACED}, {@link Kind#PRESENCE_RESET}).
 */
public record RosterChange(Kind kind, String jid, Contact previous, Contact current) {

  public enum Kind {
    ROSTER_REPLACED,
    ADDED,
    UPDATED,
    PRESENCE,
    REMOVED,
    PRESENCE_RESET
  }

  public RosterChange {
    Objects.requireNonNull(kind, "kind");
  }

  static RosterChange storeWide(Kind kind) {
    return new RosterChange(kind, null, null, null);
  }

  static RosterChange of(Kind kind, Contact previous, Contact current) {
    String jid = current != null ? current.jid() : previous != null ? previous.jid() : null;
    return new RosterChange(kind, jid, previous, current);
  }
}
