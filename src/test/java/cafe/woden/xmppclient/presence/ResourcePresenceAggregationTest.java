package cafe.woden.xmppclient.presence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.xmppclient.model.PresenceShow;
import cafe.woden.xmppclient.model.PresenceStatus;
import cafe.woden.xmppclient.model.ResourcePresence;
import cafe.woden.xmppclient.presence.ResourcePresenceAggregation.Aggregate;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ResourcePresenceAggregationTest {

  @Test
  void emptyResourceSetHasNoAggregate() {
    assertTrue(ResourcePresenceAggregation.select(Map.of()).isEmpty());
    assertTrue(ResourcePresenceAggregation.select(null).isEmpty());
  }

  @Test
  void highestPriorityWinsEvenIfLessAvailable() {
    LinkedHashMap<String, ResourcePresence> resources = new LinkedHashMap<>();
    resources.put("phone", ResourcePresence.of(PresenceShow.CHAT, 0, "on the go"));
    resources.put("desktop", ResourcePresence.of(PresenceShow.DND, 10, "focus"));

    Aggregate agg = ResourcePresenceAggregation.select(resources).orElseThrow();

    assertEquals("desktop", agg.resource());
    assertEquals(PresenceStatus.DND, agg.presence());
    assertEquals("focus", agg.statusMessage());
  }

  @Test
  void equalPriorityPrefersMoreAvailableShow() {
    LinkedHashMap<String, ResourcePresence> resources = new LinkedHashMap<>();
    resources.put("laptop", ResourcePresence.of(PresenceShow.XA, 5, "gone"));
    resources.put("tablet", ResourcePresence.of(PresenceShow.ONLINE, 5, "here"));

    Aggregate agg = ResourcePresenceAggregation.select(resources).orElseThrow();

    assertEquals("tablet", agg.resource());
    assertEquals(PresenceStatus.ONLINE, agg.presence());
    assertEquals("here", agg.statusMessage());
  }

  @Test
  void fullTieGoesToFirstArrival() {
    LinkedHashMap<String, ResourcePresence> first = new LinkedHashMap<>();
    first.put("a", ResourcePresence.of(PresenceShow.AWAY, 1, "first"));
    first.put("b", ResourcePresence.of(PresenceShow.AWAY, 1, "second"));

    LinkedHashMap<String, ResourcePresence> reversed = new LinkedHashMap<>();
    reversed.put("b", ResourcePresence.of(PresenceShow.AWAY, 1, "second"));
    reversed.put("a", ResourcePresence.of(PresenceShow.AWAY, 1, "first"));

    assertEquals("a", ResourcePresenceAggregation.select(first).orElseThrow().resource());
    assertEquals("b", ResourcePresenceAggregation.select(reversed).orElseThrow().resource());
  }

  @Test
  void negativePrioritiesStillAggregate() {
    LinkedHashMap<String, ResourcePresence> resources = new LinkedHashMap<>();
    resources.put("bot", ResourcePresence.of(PresenceShow.AWAY, -5, null));
    resources.put("idle", ResourcePresence.of(PresenceShow.CHAT, -10, null));

    Aggregate agg = ResourcePresenceAggregation.select(resources).orElseThrow();

    assertEquals("bot", agg.resource());
    assertEquals(PresenceStatus.AWAY, agg.presence());
  }

  @Test
  void equalPriorityTieBreaksByAvailability() {
    LinkedHashMap<String, ResourcePresence> awayAndDnd = new LinkedHashMap<>();
    awayAndDnd.put("a", ResourcePresence.of(PresenceShow.AWAY, 0, null));
    awayAndDnd.put("b", ResourcePresence.of(PresenceShow.DND, 0, null));

    LinkedHashMap<String, ResourcePresence> onlineAndChat = new LinkedHashMap<>();
    onlineAndChat.put("a", ResourcePresence.of(PresenceShow.ONLINE, 0, null));
    onlineAndChat.put("b", ResourcePresence.of(PresenceShow.CHAT, 0, null));

    assertEquals(
        PresenceStatus.AWAY,
        ResourcePresenceAggregation.select(awayAndDnd).orElseThrow().presence());
    assertEquals(
        PresenceStatus.ONLINE,
        ResourcePresenceAggregation.select(onlineAndChat).orElseThrow().presence());
  }
}
