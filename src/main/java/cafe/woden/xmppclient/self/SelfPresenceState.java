package cafe.woden.xmppclient.self;

import cafe.woden.xmppclient.model.AutoAwaySavedState;
import cafe.woden.xmppclient.model.PresenceShow;
import cafe.woden.xmppclient.model.PresenceStatus;
import cafe.woden.xmppclient.model.UserPresenceShow;
import java.util.Locale;
import java.util.Objects;

/**
 * State of the local user's presence.
 *
 * <p>{@link AutoAway} carries the state it replaced, which can only be online or away. There is
 * no way to express "auto-away while disconnected" or "auto-away over dnd".
 */
public sealed interface SelfPresenceState
    permits SelfPresenceState.Disconnected,
        SelfPresenceState.Online,
        SelfPresenceState.Away,
        SelfPresenceState.Dnd,
        SelfPresenceState.AutoAway {

  Disconnected DISCONNECTED = new Disconnected();
  Online ONLINE = new Online();
  Away AWAY = new Away();
  Dnd DND = new Dnd();

  record Disconnected() implements SelfPresenceState {}

  record Online() implements SelfPresenceState {}

  record Away() implements SelfPresenceState {}

  record Dnd() implements SelfPresenceState {}

  record AutoAway(AutoAwaySavedState preState) implements SelfPresenceState {
    public AutoAway {
      Objects.requireNonNull(preState, "preState");
    }
  }

  static SelfPresenceState connected(UserPresenceShow show) {
    if (show == null) return ONLINE;
    return switch (show) {
      case ONLINE -> ONLINE;
      case AWAY -> AWAY;
      case DND -> DND;
    };
  }

  default boolean isConnected() {
    return !(this instanceof Disconnected);
  }

  /** Show value to transmit; auto-away goes out as plain away. */
  default PresenceShow show() {
    if (this instanceof Away || this instanceof AutoAway) return PresenceShow.AWAY;
    if (this instanceof Dnd) return PresenceShow.DND;
    return PresenceShow.ONLINE;
  }

  default PresenceStatus status() {
    if (this instanceof Disconnected) return PresenceStatus.OFFLINE;
    if (this instanceof Away || this instanceof AutoAway) return PresenceStatus.AWAY;
    if (this instanceof Dnd) return PresenceStatus.DND;
    return PresenceStatus.ONLINE;
  }

  /** e.g. {@code disconnected}, {@code connected.dnd}, {@code connected.autoAway(online)}. */
  default String stateName() {
    if (this instanceof Disconnected) return "disconnected";
    if (this instanceof AutoAway a) {
      return "connected.autoAway(" + a.preState().name().toLowerCase(Locale.ROOT) + ")";
    }
    if (this instanceof Away) return "connected.away";
    if (this instanceof Dnd) return "connected.dnd";
    return "connected.online";
  }
}
