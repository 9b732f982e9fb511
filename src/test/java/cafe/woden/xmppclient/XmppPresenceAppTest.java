package cafe.woden.xmppclient;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import cafe.woden.xmppclient.model.PresenceStatus;
import cafe.woden.xmppclient.model.RosterItem;
import cafe.woden.xmppclient.roster.ContactPresenceAggregator;
import cafe.woden.xmppclient.roster.RosterChange;
import cafe.woden.xmppclient.self.SelfPresenceMachine;
import cafe.woden.xmppclient.xmpp.XmppEvent;
import cafe.woden.xmppclient.xmpp.XmppEventBus;
import io.reactivex.rxjava3.subscribers.TestSubscriber;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest
class XmppPresenceAppTest {

  @Autowired XmppEventBus bus;
  @Autowired ContactPresenceAggregator roster;
  @Autowired SelfPresenceMachine self;

  @Test
  void transportEventsFlowThroughTheWiredContext() {
    TestSubscriber<RosterChange> changes = roster.changes().test();
    Instant now = Instant.now();

    bus.publish(new XmppEvent.Connected(now, "me@example.com/desk"));
    bus.publish(
        new XmppEvent.RosterReceived(now, List.of(RosterItem.of("alice@example.com", "Alice"))));
    bus.publish(XmppEvent.PresenceAvailable.of("alice@example.com/phone", "away", 0, "lunch"));

    changes.awaitCount(2).assertValueCount(2);

    assertEquals(PresenceStatus.AWAY, roster.presenceFor("alice@example.com"));
    assertTrue(self.snapshot().isConnected());
  }

  @Test
  void configuredAutoAwayDefaultsReachTheMachine() {
    assertTrue(self.autoAwayConfig().enabled());
    assertEquals(300_000, self.autoAwayConfig().idleThresholdMs());
  }
}
