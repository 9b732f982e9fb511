package cafe.woden.xmppclient.app;

import cafe.woden.xmppclient.app.api.IdleTimePort;
import cafe.woden.xmppclient.config.ExecutorConfig;
import cafe.woden.xmppclient.model.AutoAwayConfig;
import cafe.woden.xmppclient.self.SelfPresenceMachine;
import cafe.woden.xmppclient.self.SelfPresenceSnapshot;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Polls input idle time and drives auto-away on the self-presence machine.
 *
 * <p>The poll only runs while auto-away is enabled and is restarted whenever the interval or
 * threshold changes. OS sleep/wake notifications are forwarded as they arrive.
 */
@Component
@ApplicationLayer
public class AutoAwayCoordinator {
  private static final Logger log = LoggerFactory.getLogger(AutoAwayCoordinator.class);

  private final SelfPresenceMachine machine;
  private final IdleTimePort idleTime;
  private final Clock clock;
  private final Scheduler scheduler;

  private final CompositeDisposable disposables = new CompositeDisposable();
  private final AtomicBoolean started = new AtomicBoolean(false);

  public AutoAwayCoordinator(
      SelfPresenceMachine machine,
      IdleTimePort idleTime,
      Clock clock,
      @Qualifier(ExecutorConfig.AUTO_AWAY_SCHEDULER) Scheduler scheduler) {
    this.machine = Objects.requireNonNull(machine, "machine");
    this.idleTime = Objects.requireNonNull(idleTime, "idleTime");
    this.clock = Objects.requireNonNull(clock, "clock");
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
        machine
            .updates()
            .map(s -> s.context().autoAwayConfig())
            .distinctUntilChanged()
            .switchMap(this::ticker)
            .subscribe(tick -> check(), err -> log.warn("auto-away ticker failed", err)));
  }

  public void stop() {
    if (!started.compareAndSet(true, false)) {
      return;
    }
    disposables.clear();
  }

  private Flowable<Long> ticker(AutoAwayConfig config) {
    if (!config.enabled()) {
      log.debug("auto-away disabled");
      return Flowable.empty();
    }
    log.debug(
        "auto-away polling every {}ms, threshold {}ms",
        config.checkIntervalMs(),
        config.idleThresholdMs());
    return Flowable.interval(
        config.checkIntervalMs(), config.checkIntervalMs(), TimeUnit.MILLISECONDS, scheduler);
  }

  /** One poll: enter auto-away past the threshold, leave it once input resumes. */
  void check() {
    SelfPresenceSnapshot snapshot = machine.snapshot();
    if (!snapshot.isConnected()) return;
    AutoAwayConfig config = snapshot.context().autoAwayConfig();
    if (!config.enabled()) return;

    Duration idle = idleTime.idleTime();
    if (idle.toMillis() >= config.idleThresholdMs()) {
      if (!snapshot.isAutoAway()) {
        machine.idleDetected(clock.instant().minus(idle));
      }
    } else if (snapshot.isAutoAway()) {
      machine.activityDetected();
    }
  }

  public void systemWillSleep() {
    log.debug("system going to sleep");
    machine.sleepDetected();
  }

  public void systemDidWake() {
    log.debug("system woke up");
    machine.wakeDetected();
  }
}
