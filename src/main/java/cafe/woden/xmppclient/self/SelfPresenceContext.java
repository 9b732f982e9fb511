package cafe.woden.xmppclient.self;

import cafe.woden.xmppclient.model.AutoAwayConfig;
import cafe.woden.xmppclient.model.UserPresenceShow;
import java.time.Instant;
import java.util.Objects;

/**
 * Data kept alongside the presence state.
 *
 * @param statusMessage the user's status text, may be null
 * @param lastUserPreference last explicit choice, re-applied on every connect
 * @param idleSince when the current auto-away period started, null outside auto-away
 * @param autoAwayConfig idle detection settings
 */
public record SelfPresenceContext(
    String statusMessage,
    UserPresenceShow lastUserPreference,
    Instant idleSince,
    AutoAwayConfig autoAwayConfig) {

  public SelfPresenceContext {
    lastUserPreference = Objects.requireNonNullElse(lastUserPreference, UserPresenceShow.ONLINE);
    autoAwayConfig = Objects.requireNonNullElse(autoAwayConfig, AutoAwayConfig.defaults());
  }

  public static SelfPresenceContext initial(AutoAwayConfig config) {
    return new SelfPresenceContext(null, UserPresenceShow.ONLINE, null, config);
  }

  SelfPresenceContext withIdleSince(Instant since) {
    return new SelfPresenceContext(statusMessage, lastUserPreference, since, autoAwayConfig);
  }

  SelfPresenceContext withUserChoice(UserPresenceShow show, String status) {
    return new SelfPresenceContext(status, show, null, autoAwayConfig);
  }

  SelfPresenceContext withAutoAwayConfig(AutoAwayConfig config) {
    return new SelfPresenceContext(statusMessage, lastUserPreference, idleSince, config);
  }
}
