package cafe.woden.xmppclient.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Snapshot of a roster contact together with its derived presence.
 *
 * <p>{@code resources} is an unmodifiable map in arrival order; an empty map means the contact
 * has no connected resource and is therefore {@link PresenceStatus#OFFLINE}. When {@code
 * presenceError} is set the map is always empty.
 *
 * <p>Colors are fixed when the contact is first created and carried over by every {@code with*}
 * copy.
 */
public record Contact(
    String jid,
    String name,
    Subscription subscription,
    List<String> groups,
    PresenceStatus presence,
    String statusMessage,
    Map<String, ResourcePresence> resources,
    String presenceError,
    Instant lastSeen,
    Instant lastInteraction,
    String colorLight,
    String colorDark) {

  public Contact {
    Objects.requireNonNull(jid, "jid");
    name = Objects.toString(name, "");
    subscription = Objects.requireNonNullElse(subscription, Subscription.NONE);
    groups = groups == null ? List.of() : List.copyOf(groups);
    presence = Objects.requireNonNullElse(presence, PresenceStatus.OFFLINE);
    resources =
        (resources == null || resources.isEmpty())
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(resources));
  }

  /** A freshly created, offline contact. */
  public static Contact create(RosterItem item, ContactColors colors) {
    Objects.requireNonNull(item, "item");
    Objects.requireNonNull(colors, "colors");
    return new Contact(
        item.jid(),
        item.name(),
        item.subscription(),
        item.groups(),
        PresenceStatus.OFFLINE,
        null,
        Map.of(),
        null,
        null,
        null,
        colors.colorLight(),
        colors.colorDark());
  }

  public boolean isOnline() {
    return presence != PresenceStatus.OFFLINE;
  }

  public boolean hasResources() {
    return !resources.isEmpty();
  }

  public ContactColors colors() {
    return new ContactColors(colorLight, colorDark);
  }

  /** Roster fields replaced, presence and colors kept. */
  public Contact withRosterItem(RosterItem item) {
    return new Contact(
        jid,
        item.name(),
        item.subscription(),
        item.groups(),
        presence,
        statusMessage,
        resources,
        presenceError,
        lastSeen,
        lastInteraction,
        colorLight,
        colorDark);
  }

  public Contact withPresence(
      PresenceStatus presence,
      String statusMessage,
      Map<String, ResourcePresence> resources,
      String presenceError,
      Instant lastSeen,
      Instant lastInteraction) {
    return new Contact(
        jid,
        name,
        subscription,
        groups,
        presence,
        statusMessage,
        resources,
        presenceError,
        lastSeen,
        lastInteraction,
        colorLight,
        colorDark);
  }
}
