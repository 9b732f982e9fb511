package cafe.woden.xmppclient.app;

import cafe.woden.xmppclient.config.ExecutorConfig;
import cafe.woden.xmppclient.model.PresenceShow;
import cafe.woden.xmppclient.model.ResourcePresence;
import cafe.woden.xmppclient.roster.ContactPresenceAggregator;
import cafe.woden.xmppclient.self.SelfPresenceMachine;
import cafe.woden.xmppclient.xmpp.XmppEvent;
import cafe.woden.xmppclient.xmpp.XmppEventBus;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Routes transport events into the roster aggregator and the self-presence machine.
 *
 * <p>All events are handled on one thread, in the order they were published, so a reset after a
 * failed stream resumption is always applied before the presences that follow it.
 */
@Component
@ApplicationLayer
public class PresenceMediator {
  private static final Logger log = LoggerFactory.getLogger(PresenceMediator.class);

  private final XmppEventBus bus;
  private final ContactPresenceAggregator roster;
  private final SelfPresenceMachine self;
  private final Scheduler scheduler;

  private final CompositeDisposable disposables = new CompositeDisposable();
  private final AtomicBoolean started = new AtomicBoolean(false);

  public PresenceMediator(
      XmppEventBus bus,
      ContactPresenceAggregator roster,
      SelfPresenceMachine self,
      @Qualifier(ExecutorConfig.PRESENCE_EVENT_SCHEDULER) Scheduler scheduler) {
    this.bus = Objects.requireNonNull(bus, "bus");
    this.roster = Objects.requireNonNull(roster, "roster");
    this.self = Objects.requireNonNull(self, "self");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  @PostConstruct
  void init() {
    start();
  }

  @PreDestroy
  void shutdown() {
    stop();
  }

  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    disposables.add(
        bus.events()
            .observeOn(scheduler)
            .subscribe(this::onEventSafely, err -> log.warn("presence event stream failed", err)));
  }

  public void stop() {
    if (!started.compareAndSet(true, false)) {
      return;
    }
    disposables.clear();
  }

  private void onEventSafely(XmppEvent event) {
    try {
      onEvent(event);
    } catch (RuntimeException e) {
      // keep the subscription alive; one bad stanza must not stop presence tracking
      log.warn("failed to apply {}", event, e);
    }
  }

  void onEvent(XmppEvent event) {
    if (event instanceof XmppEvent.PresenceAvailable e) {
      roster.updatePresence(
          e.from(),
          new ResourcePresence(
              PresenceShow.fromWire(e.show()),
              e.priority(),
              e.status(),
              e.lastInteraction(),
              e.client()));
    } else if (event instanceof XmppEvent.PresenceUnavailable e) {
      roster.removePresence(e.from());
    } else if (event instanceof XmppEvent.PresenceError e) {
      roster.setPresenceError(e.from(), e.condition());
    } else if (event instanceof XmppEvent.RosterReceived e) {
      roster.setContacts(e.items());
    } else if (event instanceof XmppEvent.RosterItemPushed e) {
      roster.addOrUpdateContact(e.item());
    } else if (event instanceof XmppEvent.RosterItemRemoved e) {
      roster.removeContact(e.jid());
    } else if (event instanceof XmppEvent.FullAuthRequired) {
      roster.resetAllPresence();
    } else if (event instanceof XmppEvent.Connected e) {
      log.info("connected as {}", e.boundJid());
      self.connect();
    } else if (event instanceof XmppEvent.Disconnected e) {
      log.info("disconnected: {}", e.reason());
      self.disconnect();
    }
  }
}
