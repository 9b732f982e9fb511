package cafe.woden.xmppclient.model;

import java.util.List;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/** A roster entry as delivered by the roster collaborator. */
@ValueObject
public record RosterItem(String jid, String name, Subscription subscription, List<String> groups) {

  public RosterItem {
    jid = Jids.bare(jid);
    if (jid.isEmpty()) throw new IllegalArgumentException("jid is blank");
    name = Objects.toString(name, "").trim();
    if (name.isEmpty()) name = Jids.localPart(jid);
    subscription = Objects.requireNonNullElse(subscription, Subscription.NONE);
    groups = groups == null ? List.of() : List.copyOf(groups);
  }

  public static RosterItem of(String jid, String name) {
    return new RosterItem(jid, name, Subscription.BOTH, List.of());
  }
}
