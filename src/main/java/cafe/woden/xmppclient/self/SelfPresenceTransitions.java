package cafe.woden.xmppclient.self;

import cafe.woden.xmppclient.model.AutoAwaySavedState;
import cafe.woden.xmppclient.self.SelfPresenceEvent.ActivityDetected;
import cafe.woden.xmppclient.self.SelfPresenceEvent.Connect;
import cafe.woden.xmppclient.self.SelfPresenceEvent.Disconnect;
import cafe.woden.xmppclient.self.SelfPresenceEvent.IdleDetected;
import cafe.woden.xmppclient.self.SelfPresenceEvent.SetAutoAwayConfig;
import cafe.woden.xmppclient.self.SelfPresenceEvent.SetPresence;
import cafe.woden.xmppclient.self.SelfPresenceEvent.SleepDetected;
import cafe.woden.xmppclient.self.SelfPresenceEvent.WakeDetected;
import java.time.Instant;
import java.util.Objects;

/**
 * Transition function of the self-presence machine.
 *
 * <p>Events that have no transition from the current state return the input snapshot unchanged.
 */
public final class SelfPresenceTransitions {

  private SelfPresenceTransitions() {}

  public static SelfPresenceSnapshot apply(
      SelfPresenceSnapshot current, SelfPresenceEvent event, Instant now) {
    Objects.requireNonNull(current, "current");
    Objects.requireNonNull(event, "event");
    Objects.requireNonNull(now, "now");

    SelfPresenceState state = current.state();
    SelfPresenceContext ctx = current.context();

    if (event instanceof SetAutoAwayConfig e) {
      return new SelfPresenceSnapshot(
          state, ctx.withAutoAwayConfig(ctx.autoAwayConfig().merge(e.patch())));
    }

    if (event instanceof Connect) {
      if (state.isConnected()) return current;
      return new SelfPresenceSnapshot(
          SelfPresenceState.connected(ctx.lastUserPreference()), ctx.withIdleSince(null));
    }

    if (!state.isConnected()) return current;

    if (event instanceof Disconnect) {
      return new SelfPresenceSnapshot(SelfPresenceState.DISCONNECTED, ctx.withIdleSince(null));
    }
    if (event instanceof SetPresence e) {
      return new SelfPresenceSnapshot(
          SelfPresenceState.connected(e.show()), ctx.withUserChoice(e.show(), e.status()));
    }
    if (event instanceof IdleDetected e) {
      return enterAutoAway(current, e.since() != null ? e.since() : now);
    }
    if (event instanceof SleepDetected) {
      return enterAutoAway(current, now);
    }
    if (event instanceof ActivityDetected || event instanceof WakeDetected) {
      return leaveAutoAway(current);
    }
    return current;
  }

  private static SelfPresenceSnapshot enterAutoAway(SelfPresenceSnapshot current, Instant since) {
    AutoAwaySavedState saved;
    if (current.state() instanceof SelfPresenceState.Online) {
      saved = AutoAwaySavedState.ONLINE;
    } else if (current.state() instanceof SelfPresenceState.Away) {
      saved = AutoAwaySavedState.AWAY;
    } else {
      // dnd is never overridden; already auto-away keeps its original idle start
      return current;
    }
    return new SelfPresenceSnapshot(
        new SelfPresenceState.AutoAway(saved), current.context().withIdleSince(since));
  }

  private static SelfPresenceSnapshot leaveAutoAway(SelfPresenceSnapshot current) {
    if (!(current.state() instanceof SelfPresenceState.AutoAway a)) return current;
    return new SelfPresenceSnapshot(
        SelfPresenceState.connected(a.preState().toUserShow()),
        current.context().withIdleSince(null));
  }
}
