package cafe.woden.xmppclient.app;

import cafe.woden.xmppclient.app.api.IdleTimePort;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.springframework.stereotype.Component;

/**
 * Default {@link IdleTimePort}: idle time is measured from the last {@link #recordActivity()}
 * call made by the UI layer.
 */
@Component
@ApplicationLayer
public class InputActivityTracker implements IdleTimePort {

  private final Clock clock;
  private final AtomicReference<Instant> lastActivity;

  public InputActivityTracker(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.lastActivity = new AtomicReference<>(clock.instant());
  }

  public void recordActivity() {
    lastActivity.set(clock.instant());
  }

  public Instant lastActivity() {
    return lastActivity.get();
  }

  @Override
  public Duration idleTime() {
    Duration idle = Duration.between(lastActivity.get(), clock.instant());
    return idle.isNegative() ? Duration.ZERO : idle;
  }
}
