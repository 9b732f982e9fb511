package cafe.woden.xmppclient.self;

import cafe.woden.xmppclient.config.PresenceProperties;
import cafe.woden.xmppclient.model.AutoAwayConfig;
import cafe.woden.xmppclient.model.AutoAwayConfigPatch;
import cafe.woden.xmppclient.model.AutoAwaySavedState;
import cafe.woden.xmppclient.model.PresenceShow;
import cafe.woden.xmppclient.model.PresenceStatus;
import cafe.woden.xmppclient.model.UserPresenceShow;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.BehaviorProcessor;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * The local user's presence, driven by connection, UI and idle events.
 *
 * <p>One instance lives for the whole process. The last explicit choice survives disconnects
 * and is re-applied on the next connect; auto-away is always dropped on disconnect.
 *
 * <p>Events that make no sense in the current state (setting presence while offline, idling
 * while in dnd, ...) are ignored rather than rejected.
 */
@Component
@ApplicationLayer
public class SelfPresenceMachine {
  private static final Logger log = LoggerFactory.getLogger(SelfPresenceMachine.class);

  private final Clock clock;
  private final BehaviorProcessor<SelfPresenceSnapshot> updates = BehaviorProcessor.create();

  private SelfPresenceSnapshot current;

  public SelfPresenceMachine(PresenceProperties props, Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
    AutoAwayConfig config =
        props != null ? props.autoAway().toConfig() : AutoAwayConfig.defaults();
    this.current =
        new SelfPresenceSnapshot(
            SelfPresenceState.DISCONNECTED, SelfPresenceContext.initial(config));
    updates.onNext(current);
  }

  /** Current snapshot first, then one item per effective transition. */
  public Flowable<SelfPresenceSnapshot> updates() {
    return updates.onBackpressureLatest();
  }

  /**
   * Apply {@code event}.
   *
   * @return true if state or context changed
   */
  public synchronized boolean send(SelfPresenceEvent event) {
    Objects.requireNonNull(event, "event");
    SelfPresenceSnapshot prev = current;
    SelfPresenceSnapshot next = SelfPresenceTransitions.apply(prev, event, clock.instant());
    if (next.equals(prev)) {
      log.debug("self presence: {} ignored in {}", event, prev.stateName());
      return false;
    }
    current = next;
    if (!next.state().equals(prev.state())) {
      log.debug("self presence: {} -> {} on {}", prev.stateName(), next.stateName(), event);
    }
    updates.onNext(next);
    return true;
  }

  public synchronized SelfPresenceSnapshot snapshot() {
    return current;
  }

  // Event shortcuts

  public boolean connect() {
    return send(new SelfPresenceEvent.Connect());
  }

  public boolean disconnect() {
    return send(new SelfPresenceEvent.Disconnect());
  }

  public boolean setPresence(UserPresenceShow show, String status) {
    return send(new SelfPresenceEvent.SetPresence(show, status));
  }

  public boolean setOnline(String status) {
    return setPresence(UserPresenceShow.ONLINE, status);
  }

  public boolean setAway(String status) {
    return setPresence(UserPresenceShow.AWAY, status);
  }

  public boolean setDnd(String status) {
    return setPresence(UserPresenceShow.DND, status);
  }

  public boolean idleDetected(Instant since) {
    return send(new SelfPresenceEvent.IdleDetected(since));
  }

  public boolean activityDetected() {
    return send(new SelfPresenceEvent.ActivityDetected());
  }

  public boolean sleepDetected() {
    return send(new SelfPresenceEvent.SleepDetected());
  }

  public boolean wakeDetected() {
    return send(new SelfPresenceEvent.WakeDetected());
  }

  public boolean setAutoAwayConfig(AutoAwayConfigPatch patch) {
    return send(new SelfPresenceEvent.SetAutoAwayConfig(patch));
  }

  // Projections

  public Optional<PresenceShow> wireShow() {
    return snapshot().wireShow();
  }

  public PresenceStatus status() {
    return snapshot().status();
  }

  public boolean isAutoAway() {
    return snapshot().isAutoAway();
  }

  public String stateName() {
    return snapshot().stateName();
  }

  public Optional<Instant> idleSince() {
    return snapshot().idleSince();
  }

  public AutoAwayConfig autoAwayConfig() {
    return snapshot().context().autoAwayConfig();
  }

  public String statusMessage() {
    return snapshot().context().statusMessage();
  }

  public UserPresenceShow lastUserPreference() {
    return snapshot().context().lastUserPreference();
  }

  public Optional<AutoAwaySavedState> preAutoAwayState() {
    return snapshot().preAutoAwayState();
  }
}
