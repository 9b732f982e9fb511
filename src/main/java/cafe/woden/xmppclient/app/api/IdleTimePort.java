package cafe.woden.xmppclient.app.api;

import java.time.Duration;
import org.jmolecules.architecture.layered.ApplicationLayer;

/** Source of the local user's input idle time, polled by auto-away. */
@ApplicationLayer
public interface IdleTimePort {

  /** Time since the last keyboard/mouse activity; never negative. */
  Duration idleTime();
}
