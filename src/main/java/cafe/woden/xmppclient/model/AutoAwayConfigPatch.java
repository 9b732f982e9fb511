package cafe.woden.xmppclient.model;

/** Partial {@link AutoAwayConfig} update; null fields are left untouched. */
public record AutoAwayConfigPatch(Long idleThresholdMs, Long checkIntervalMs, Boolean enabled) {

  public static AutoAwayConfigPatch enabled(boolean enabled) {
    return new AutoAwayConfigPatch(null, null, enabled);
  }

  public static AutoAwayConfigPatch idleThresholdMs(long idleThresholdMs) {
    return new AutoAwayConfigPatch(idleThresholdMs, null, null);
  }
}
