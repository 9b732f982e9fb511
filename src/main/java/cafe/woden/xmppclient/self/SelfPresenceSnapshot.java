package cafe.woden.xmppclient.self;

import cafe.woden.xmppclient.model.AutoAwaySavedState;
import cafe.woden.xmppclient.model.PresenceShow;
import cafe.woden.xmppclient.model.PresenceStatus;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/** Immutable view of the machine: current state plus context. */
public record SelfPresenceSnapshot(SelfPresenceState state, SelfPresenceContext context) {

  public SelfPresenceSnapshot {
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(context, "context");
  }

  /** Show value to put on the wire; empty while disconnected. */
  public Optional<PresenceShow> wireShow() {
    return state.isConnected() ? Optional.of(state.show()) : Optional.empty();
  }

  public PresenceStatus status() {
    return state.status();
  }

  public boolean isConnected() {
    return state.isConnected();
  }

  public boolean isAutoAway() {
    return state instanceof SelfPresenceState.AutoAway;
  }

  public Optional<AutoAwaySavedState> preAutoAwayState() {
    if (state instanceof SelfPresenceState.AutoAway a) return Optional.of(a.preState());
    return Optional.empty();
  }

  public Optional<Instant> idleSince() {
    return Optional.ofNullable(context.idleSince());
  }

  public String stateName() {
    return state.stateName();
  }
}
