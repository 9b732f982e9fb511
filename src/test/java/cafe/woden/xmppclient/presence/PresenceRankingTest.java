package cafe.woden.xmppclient.presence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.xmppclient.model.PresenceShow;
import cafe.woden.xmppclient.model.PresenceStatus;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class PresenceRankingTest {

  @Test
  void ranksFollowAvailabilityOrder() {
    assertEquals(0, PresenceRanking.rank(PresenceShow.CHAT));
    assertEquals(1, PresenceRanking.rank(PresenceShow.ONLINE));
    assertEquals(1, PresenceRanking.rank(null));
    assertEquals(2, PresenceRanking.rank(PresenceShow.AWAY));
    assertEquals(3, PresenceRanking.rank(PresenceShow.XA));
    assertEquals(4, PresenceRanking.rank(PresenceShow.DND));
    assertEquals(PresenceRanking.UNRECOGNIZED_RANK, PresenceRanking.rank(PresenceShow.UNRECOGNIZED));
  }

  @Test
  void unknownWireTokenRanksBelowDnd() {
    PresenceShow weird = PresenceShow.fromWire("lunch");

    assertEquals(PresenceShow.UNRECOGNIZED, weird);
    assertTrue(PresenceRanking.rank(weird) > PresenceRanking.rank(PresenceShow.DND));
  }

  @Test
  void bestOfPicksMostAvailable() {
    assertEquals(
        PresenceShow.CHAT,
        PresenceRanking.bestOf(List.of(PresenceShow.DND, PresenceShow.CHAT, PresenceShow.AWAY))
            .orElseThrow());
    assertEquals(
        PresenceShow.AWAY,
        PresenceRanking.bestOf(List.of(PresenceShow.XA, PresenceShow.DND, PresenceShow.AWAY))
            .orElseThrow());
  }

  @Test
  void bestOfTreatsNullAsOnline() {
    assertEquals(
        PresenceShow.ONLINE,
        PresenceRanking.bestOf(Arrays.asList(PresenceShow.AWAY, null)).orElseThrow());
  }

  @Test
  void bestOfIsEmptyForNoShows() {
    assertTrue(PresenceRanking.bestOf(List.of()).isEmpty());
    assertTrue(PresenceRanking.bestOf(null).isEmpty());
  }

  @Test
  void availableShowsNeverMapToOffline() {
    for (PresenceShow show : PresenceShow.values()) {
      assertTrue(
          PresenceRanking.toStatus(show) != PresenceStatus.OFFLINE,
          () -> show + " must not map to offline");
    }
    assertEquals(PresenceStatus.AWAY, PresenceRanking.toStatus(PresenceShow.XA));
    assertEquals(PresenceStatus.DND, PresenceRanking.toStatus(PresenceShow.DND));
    assertEquals(PresenceStatus.ONLINE, PresenceRanking.toStatus(PresenceShow.CHAT));
    assertEquals(PresenceStatus.ONLINE, PresenceRanking.toStatus(PresenceShow.UNRECOGNIZED));
  }

  @Test
  void displayLabels() {
    assertEquals("Online", PresenceRanking.displayLabel(PresenceStatus.ONLINE));
    assertEquals("Away", PresenceRanking.displayLabel(PresenceStatus.AWAY));
    assertEquals("Do not disturb", PresenceRanking.displayLabel(PresenceStatus.DND));
    assertEquals("Offline", PresenceRanking.displayLabel(PresenceStatus.OFFLINE));
  }
}
