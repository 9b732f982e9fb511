package cafe.woden.xmppclient.model;

/**
 * Simplified availability shown in the UI.
 *
 * <p>{@link #OFFLINE} is never derived from a show value. It only means that no resource of the
 * contact (or of the local session) is available.
 */
public enum PresenceStatus {
  ONLINE,
  AWAY,
  DND,
  OFFLINE
}
