package cafe.woden.xmppclient.model;

import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Auto-away tuning.
 *
 * @param idleThresholdMs idle time after which auto-away is triggered
 * @param checkIntervalMs how often the idle time is polled, never longer than the threshold
 * @param enabled when false, idle polling is stopped by its owner
 */
@ValueObject
public record AutoAwayConfig(long idleThresholdMs, long checkIntervalMs, boolean enabled) {

  public static final long DEFAULT_IDLE_THRESHOLD_MS = 5 * 60_000L;
  public static final long DEFAULT_CHECK_INTERVAL_MS = 30_000L;

  public AutoAwayConfig {
    if (idleThresholdMs <= 0) idleThresholdMs = DEFAULT_IDLE_THRESHOLD_MS;
    if (checkIntervalMs <= 0) checkIntervalMs = DEFAULT_CHECK_INTERVAL_MS;
    if (checkIntervalMs > idleThresholdMs) checkIntervalMs = idleThresholdMs;
  }

  public static AutoAwayConfig defaults() {
    return new AutoAwayConfig(DEFAULT_IDLE_THRESHOLD_MS, DEFAULT_CHECK_INTERVAL_MS, true);
  }

  /** Apply the non-null fields of {@code patch}. */
  public AutoAwayConfig merge(AutoAwayConfigPatch patch) {
    if (patch == null) return this;
    return new AutoAwayConfig(
        patch.idleThresholdMs() != null ? patch.idleThresholdMs() : idleThresholdMs,
        patch.checkIntervalMs() != null ? patch.checkIntervalMs() : checkIntervalMs,
        patch.enabled() != null ? patch.enabled() : enabled);
  }
}
