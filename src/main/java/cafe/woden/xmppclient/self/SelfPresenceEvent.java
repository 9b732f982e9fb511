package cafe.woden.xmppclient.self;

import cafe.woden.xmppclient.model.AutoAwayConfigPatch;
import cafe.woden.xmppclient.model.UserPresenceShow;
import java.time.Instant;
import java.util.Objects;

/** Inputs of {@link SelfPresenceMachine}. */
public sealed interface SelfPresenceEvent
    permits SelfPresenceEvent.Connect,
        SelfPresenceEvent.Disconnect,
        SelfPresenceEvent.SetPresence,
        SelfPresenceEvent.IdleDetected,
        SelfPresenceEvent.ActivityDetected,
        SelfPresenceEvent.SleepDetected,
        SelfPresenceEvent.WakeDetected,
        SelfPresenceEvent.SetAutoAwayConfig {

  record Connect() implements SelfPresenceEvent {}

  record Disconnect() implements SelfPresenceEvent {}

  /** Explicit user choice; {@code status} may be null to clear the message. */
  record SetPresence(UserPresenceShow show, String status) implements SelfPresenceEvent {
    public SetPresence {
      Objects.requireNonNull(show, "show");
    }
  }

  /** The user has been idle since {@code since}; null means "now". */
  record IdleDetected(Instant since) implements SelfPresenceEvent {}

  record ActivityDetected() implements SelfPresenceEvent {}

  record SleepDetected() implements SelfPresenceEvent {}

  record WakeDetected() implements SelfPresenceEvent {}

  record SetAutoAwayConfig(AutoAwayConfigPatch patch) implements SelfPresenceEvent {
    public SetAutoAwayConfig {
      Objects.requireNonNull(patch, "patch");
    }
  }
}
