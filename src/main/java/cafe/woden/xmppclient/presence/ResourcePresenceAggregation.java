package cafe.woden.xmppclient.presence;

import cafe.woden.xmppclient.model.PresenceShow;
import cafe.woden.xmppclient.model.PresenceStatus;
import cafe.woden.xmppclient.model.ResourcePresence;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Picks the resource that speaks for a contact.
 *
 * <p>The highest priority wins. Resources tied on the top priority are compared with {@link
 * PresenceRanking#bestOf}, so the most available show wins and, among equal shows, the resource
 * that arrived first.
 */
public final class ResourcePresenceAggregation {

  /** Result of aggregating a non-empty resource set. */
  public record Aggregate(String resource, ResourcePresence winner) {
    public Aggregate {
      Objects.requireNonNull(resource, "resource");
      Objects.requireNonNull(winner, "winner");
    }

    public PresenceStatus presence() {
      return PresenceRanking.toStatus(winner.show());
    }

    public String statusMessage() {
      return winner.statusMessage();
    }

    public Instant lastInteraction() {
      return winner.lastInteraction();
    }
  }

  private ResourcePresenceAggregation() {}

  /**
   * @param resources resource id → presence, iterated in arrival order
   * @return empty when there is no resource (the contact is offline)
   */
  public static Optional<Aggregate> select(Map<String, ResourcePresence> resources) {
    if (resources == null || resources.isEmpty()) return Optional.empty();

    int topPriority = Integer.MIN_VALUE;
    for (ResourcePresence rp : resources.values()) {
      topPriority = Math.max(topPriority, rp.priority());
    }

    List<Map.Entry<String, ResourcePresence>> tied = new ArrayList<>();
    for (Map.Entry<String, ResourcePresence> e : resources.entrySet()) {
      if (e.getValue().priority() == topPriority) tied.add(e);
    }

    if (tied.size() == 1) {
      Map.Entry<String, ResourcePresence> only = tied.get(0);
      return Optional.of(new Aggregate(only.getKey(), only.getValue()));
    }

    List<PresenceShow> shows = new ArrayList<>(tied.size());
    for (Map.Entry<String, ResourcePresence> e : tied) shows.add(e.getValue().show());
    PresenceShow best = PresenceRanking.bestOf(shows).orElseThrow();

    for (Map.Entry<String, ResourcePresence> e : tied) {
      if (e.getValue().show() == best) {
        return Optional.of(new Aggregate(e.getKey(), e.getValue()));
      }
    }
    // bestOf only returns members of its input.
    throw new IllegalStateException("no tied resource carries show " + best);
  }
}
