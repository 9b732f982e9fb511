package cafe.woden.xmppclient.model;

/** Presence values the local user can pick explicitly. */
public enum UserPresenceShow {
  ONLINE,
  AWAY,
  DND;

  public PresenceShow toShow() {
    return switch (this) {
      case ONLINE -> PresenceShow.ONLINE;
      case AWAY -> PresenceShow.AWAY;
      case DND -> PresenceShow.DND;
    };
  }

  public PresenceStatus toStatus() {
    return switch (this) {
      case ONLINE -> PresenceStatus.ONLINE;
      case AWAY -> PresenceStatus.AWAY;
      case DND -> PresenceStatus.DND;
    };
  }
}
