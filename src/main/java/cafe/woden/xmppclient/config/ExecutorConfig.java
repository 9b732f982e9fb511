package cafe.woden.xmppclient.config;

import cafe.woden.xmppclient.util.NamedThreads;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.schedulers.Schedulers;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Centralized app-owned executors.
 *
 * <p>Presence events go through exactly one thread so updates for a contact are applied in the
 * order the transport delivered them.
 */
@Configuration
public class ExecutorConfig {
  public static final String PRESENCE_EVENT_EXECUTOR = "presenceEventExecutor";
  public static final String PRESENCE_EVENT_SCHEDULER = "presenceEventScheduler";
  public static final String AUTO_AWAY_EXECUTOR = "autoAwayExecutor";
  public static final String AUTO_AWAY_SCHEDULER = "autoAwayScheduler";

  @Bean(name = PRESENCE_EVENT_EXECUTOR, destroyMethod = "shutdown")
  public ExecutorService presenceEventExecutor() {
    return NamedThreads.newSingleThreadExecutor("xmpp-presence-events");
  }

  @Bean(name = PRESENCE_EVENT_SCHEDULER)
  public Scheduler presenceEventScheduler(
      @Qualifier(PRESENCE_EVENT_EXECUTOR) ExecutorService executor) {
    return Schedulers.from(executor);
  }

  @Bean(name = AUTO_AWAY_EXECUTOR, destroyMethod = "shutdown")
  public ScheduledExecutorService autoAwayExecutor() {
    return NamedThreads.newSingleThreadScheduledExecutor("xmpp-auto-away");
  }

  @Bean(name = AUTO_AWAY_SCHEDULER)
  public Scheduler autoAwayScheduler(
      @Qualifier(AUTO_AWAY_EXECUTOR) ScheduledExecutorService executor) {
    return Schedulers.from(executor);
  }

  @Bean
  public Clock presenceClock() {
    return Clock.systemUTC();
  }
}
