package cafe.woden.xmppclient.model;

/**
 * State remembered when auto-away kicks in, restored on activity.
 *
 * <p>There is no DND member: do-not-disturb is never replaced by auto-away.
 */
public enum AutoAwaySavedState {
  ONLINE,
  AWAY;

  public UserPresenceShow toUserShow() {
    return this == ONLINE ? UserPresenceShow.ONLINE : UserPresenceShow.AWAY;
  }
}
