package cafe.woden.xmppclient.model;

import java.time.Instant;
import java.util.Objects;
import org.jmolecules.ddd.annotation.ValueObject;

/**
 * Presence of one connected resource (device/session) of a contact.
 *
 * @param show sub-state of the available presence, never null
 * @param priority XMPP presence priority, higher is preferred
 * @param statusMessage free-form {@code <status/>} text, may be null
 * @param lastInteraction XEP-0319 idle time reported by that client, may be null
 * @param client client name learned from entity capabilities, may be null
 */
@ValueObject
public record ResourcePresence(
    PresenceShow show, int priority, String statusMessage, Instant lastInteraction, String client) {

  public ResourcePresence {
    show = Objects.requireNonNullElse(show, PresenceShow.ONLINE);
    if (statusMessage != null && statusMessage.isBlank()) statusMessage = null;
    if (client != null && client.isBlank()) client = null;
  }

  public static ResourcePresence of(PresenceShow show, int priority, String statusMessage) {
    return new ResourcePresence(show, priority, statusMessage, null, null);
  }
}
