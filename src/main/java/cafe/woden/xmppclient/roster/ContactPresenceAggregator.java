package cafe.woden.xmppclient.roster;

import cafe.woden.xmppclient.model.Contact;
import cafe.woden.xmppclient.model.Jids;
import cafe.woden.xmppclient.model.PresenceShow;
import cafe.woden.xmppclient.model.PresenceStatus;
import cafe.woden.xmppclient.model.ResourcePresence;
import cafe.woden.xmppclient.model.RosterItem;
import cafe.woden.xmppclient.presence.ContactColorAssigner;
import cafe.woden.xmppclient.presence.PresenceRanking;
import cafe.woden.xmppclient.presence.ResourcePresenceAggregation;
import cafe.woden.xmppclient.presence.ResourcePresenceAggregation.Aggregate;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.processors.FlowableProcessor;
import io.reactivex.rxjava3.processors.PublishProcessor;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jmolecules.architecture.layered.ApplicationLayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory roster keyed by bare JID, with one aggregate presence per contact.
 *
 * <p>Every presence mutation rebuilds the contact's resource map and re-runs {@link
 * ResourcePresenceAggregation#select}; nothing is patched in place. Events addressed to JIDs that
 * are not in the roster are dropped.
 *
 * <p>Mutations are serialized on an internal lock, and each change is published while that lock
 * is held, so {@link #changes()} reports mutations in the order they were applied. Callers still
 * have to feed updates for one contact in transport order: an unavailable presence overtaking its
 * available presence would leave a stale resource behind.
 */
@Component
@ApplicationLayer
public class ContactPresenceAggregator {
  private static final Logger log = LoggerFactory.getLogger(ContactPresenceAggregator.class);

  private static final Comparator<Contact> PRESENCE_THEN_NAME =
      Comparator.<Contact>comparingInt(c -> PresenceRanking.statusOrder(c.presence()))
          .thenComparing(Contact::name, String.CASE_INSENSITIVE_ORDER)
          .thenComparing(Contact::jid);

  private final ContactColorAssigner colorAssigner;
  private final Clock clock;

  private final Object lock = new Object();

  // bare jid -> contact, in roster order
  private final LinkedHashMap<String, Contact> contacts = new LinkedHashMap<>();

  private final FlowableProcessor<RosterChange> changes =
      PublishProcessor.<RosterChange>create().toSerialized();

  public ContactPresenceAggregator(ContactColorAssigner colorAssigner, Clock clock) {
    this.colorAssigner = Objects.requireNonNull(colorAssigner, "colorAssigner");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public Flowable<RosterChange> changes() {
    return changes.onBackpressureBuffer();
  }


  /**
   * Replace the roster with {@code items}.
   *
   * <p>Contacts that stay in the roster keep their presence and colors; new ones start offline.
   */
  public void setContacts(List<RosterItem> items) {
    synchronized (lock) {
      LinkedHashMap<String, Contact> next = new LinkedHashMap<>();
      if (items != null) {
        for (RosterItem item : items) {
          if (item == null) continue;
          Contact existing = contacts.get(item.jid());
          next.put(item.jid(), existing != null ? existing.withRosterItem(item) : create(item));
        }
      }
      contacts.clear();
      contacts.putAll(next);
      log.debug("roster replaced: {} contact(s)", contacts.size());
      changes.onNext(RosterChange.storeWide(RosterChange.Kind.ROSTER_REPLACED));
    }
  }

  /** Add a contact, or update its roster fields while keeping presence and colors. */
  public Contact addOrUpdateContact(RosterItem item) {
    Objects.requireNonNull(item, "item");
    synchronized (lock) {
      Contact prev = contacts.get(item.jid());
      Contact next = prev != null ? prev.withRosterItem(item) : create(item);
      contacts.put(item.jid(), next);
      changes.onNext(
          RosterChange.of(
              prev == null ? RosterChange.Kind.ADDED : RosterChange.Kind.UPDATED, prev, next));
      return next;
    }
  }

  public boolean removeContact(String jid) {
    String bare = Jids.bare(jid);
    if (bare.isEmpty()) return false;
    synchronized (lock) {
      Contact prev = contacts.remove(bare);
      if (prev == null) return false;
      changes.onNext(RosterChange.of(RosterChange.Kind.REMOVED, prev, null));
      return true;
    }
  }

  /** Forget every contact (end of session). */
  public void clear() {
    synchronized (lock) {
      contacts.clear();
      changes.onNext(RosterChange.storeWide(RosterChange.Kind.ROSTER_REPLACED));
    }
  }


  public boolean updatePresence(
      String fullJid, PresenceShow show, int priority, String statusMessage) {
    return updatePresence(fullJid, ResourcePresence.of(show, priority, statusMessage));
  }

  /**
   * Store the presence of one resource and recompute the contact.
   *
   * <p>A fresh available presence clears any earlier presence error.
   *
   * @return true if the contact changed
   */
  public boolean updatePresence(String fullJid, ResourcePresence presence) {
    Objects.requireNonNull(presence, "presence");
    String bare = Jids.bare(fullJid);
    if (bare.isEmpty()) return false;
    String resource = Jids.resource(fullJid);

    synchronized (lock) {
      Contact prev = contacts.get(bare);
      if (prev == null) {
        log.debug("ignoring presence from {} (not in roster)", fullJid);
        return false;
      }
      LinkedHashMap<String, ResourcePresence> resources = new LinkedHashMap<>(prev.resources());
      resources.put(resource, presence);
      Contact next = recompute(prev, resources, null, prev.lastSeen());
      contacts.put(bare, next);
      return publishPresence(prev, next);
    }
  }

  /**
   * Drop one resource. When it was the last one the contact goes offline and {@code lastSeen} is
   * stamped; otherwise the aggregate is recomputed from the remaining resources.
   *
   * @return true if the contact changed
   */
  public boolean removePresence(String fullJid) {
    String bare = Jids.bare(fullJid);
    if (bare.isEmpty()) return false;
    String resource = Jids.resource(fullJid);

    synchronized (lock) {
      Contact prev = contacts.get(bare);
      if (prev == null || !prev.resources().containsKey(resource)) return false;

      LinkedHashMap<String, ResourcePresence> resources = new LinkedHashMap<>(prev.resources());
      resources.remove(resource);
      Instant lastSeen = resources.isEmpty() ? clock.instant() : prev.lastSeen();
      Contact next = recompute(prev, resources, prev.presenceError(), lastSeen);
      contacts.put(bare, next);
      return publishPresence(prev, next);
    }
  }

  /**
   * Record a bare-JID presence error (e.g. {@code recipient-unavailable}).
   *
   * <p>All cached resources are discarded so a later unavailable presence for one of them cannot
   * bring a different stale resource back online. Calling it again with the same condition
   * changes nothing.
   *
   * @return true if the contact changed
   */
  public boolean setPresenceError(String jid, String condition) {
    String bare = Jids.bare(jid);
    if (bare.isEmpty()) return false;
    String cond = Objects.toString(condition, "").trim();
    if (cond.isEmpty()) cond = "undefined-condition";

    synchronized (lock) {
      Contact prev = contacts.get(bare);
      if (prev == null) {
        log.debug("ignoring presence error {} from {} (not in roster)", cond, jid);
        return false;
      }
      Instant lastSeen = prev.isOnline() ? clock.instant() : prev.lastSeen();
      Contact next =
          prev.withPresence(PresenceStatus.OFFLINE, null, Map.of(), cond, lastSeen, null);
      contacts.put(bare, next);
      return publishPresence(prev, next);
    }
  }

  /**
   * Mark every contact offline and drop resources, status messages and presence errors.
   *
   * <p>Used after a failed stream resumption: contacts that went offline while we were gone never
   * told us, so only presences received from now on are trusted. Roster data is kept.
   *
   * @return number of contacts reset
   */
  public int resetAllPresence() {
    int count;
    synchronized (lock) {
      for (Map.Entry<String, Contact> e : contacts.entrySet()) {
        Contact c = e.getValue();
        e.setValue(
            c.withPresence(PresenceStatus.OFFLINE, null, Map.of(), null, c.lastSeen(), null));
      }
      count = contacts.size();
      changes.onNext(RosterChange.storeWide(RosterChange.Kind.PRESENCE_RESET));
    }
    log.info("reset presence of {} contact(s)", count);
    return count;
  }


  public Optional<Contact> get(String jid) {
    String bare = Jids.bare(jid);
    if (bare.isEmpty()) return Optional.empty();
    synchronized (lock) {
      return Optional.ofNullable(contacts.get(bare));
    }
  }

  public List<Contact> contacts() {
    synchronized (lock) {
      return List.copyOf(contacts.values());
    }
  }

  public List<String> contactJids() {
    synchronized (lock) {
      return List.copyOf(contacts.keySet());
    }
  }

  public List<Contact> onlineContacts() {
    List<Contact> out = new ArrayList<>();
    for (Contact c : contacts()) {
      if (c.isOnline()) out.add(c);
    }
    return List.copyOf(out);
  }

  public List<Contact> offlineContacts() {
    List<Contact> out = new ArrayList<>();
    for (Contact c : contacts()) {
      if (!c.isOnline()) out.add(c);
    }
    return List.copyOf(out);
  }

  /** Contacts ordered online, away, dnd, offline; then by name. */
  public List<Contact> sortedContacts() {
    List<Contact> out = new ArrayList<>(contacts());
    out.sort(PRESENCE_THEN_NAME);
    return List.copyOf(out);
  }

  public int onlineCount() {
    int n = 0;
    for (Contact c : contacts()) {
      if (c.isOnline()) n++;
    }
    return n;
  }

  public PresenceStatus presenceFor(String jid) {
    return get(jid).map(Contact::presence).orElse(PresenceStatus.OFFLINE);
  }

  public Optional<String> statusMessageFor(String jid) {
    return get(jid).map(Contact::statusMessage);
  }

  public Map<String, ResourcePresence> resourcesFor(String jid) {
    return get(jid).map(Contact::resources).orElse(Map.of());
  }

  public int resourceCountFor(String jid) {
    return resourcesFor(jid).size();
  }


  private Contact create(RosterItem item) {
    return Contact.create(item, colorAssigner.assign(item.jid()));
  }

  private static Contact recompute(
      Contact c, Map<String, ResourcePresence> resources, String presenceError, Instant lastSeen) {
    Optional<Aggregate> aggregate = ResourcePresenceAggregation.select(resources);
    if (aggregate.isEmpty()) {
      return c.withPresence(PresenceStatus.OFFLINE, null, Map.of(), presenceError, lastSeen, null);
    }
    Aggregate a = aggregate.get();
    return c.withPresence(
        a.presence(), a.statusMessage(), resources, presenceError, lastSeen, a.lastInteraction());
  }

  private boolean publishPresence(Contact prev, Contact next) {
    if (Objects.equals(prev, next)) return false;
    if (prev.presence() != next.presence()) {
      log.debug("{}: {} -> {}", next.jid(), prev.presence(), next.presence());
    }
    changes.onNext(RosterChange.of(RosterChange.Kind.PRESENCE, prev, next));
    return true;
  }
}
