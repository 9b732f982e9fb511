package cafe.woden.xmppclient.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Minimal JID splitting helpers.
 *
 * <p>Bare JIDs are trimmed and lower-cased so they can be used as map keys. Resources keep their
 * case (RFC 7622 treats them as case-sensitive).
 */
public final class Jids {

  private Jids() {}

  private static String norm(String s) {
    return Objects.toString(s, "").trim();
  }

  /** {@code user@domain/res} → {@code user@domain}; blank input yields "". */
  public static String bare(String jid) {
    String j = norm(jid);
    int slash = j.indexOf('/');
    String bare = slash >= 0 ? j.substring(0, slash) : j;
    return bare.trim().toLowerCase(Locale.ROOT);
  }

  /** Resource part of a full JID, or "" for a bare JID. */
  public static String resource(String jid) {
    String j = norm(jid);
    int slash = j.indexOf('/');
    return slash >= 0 ? j.substring(slash + 1) : "";
  }

  /** Local part ({@code user}) or the whole bare JID when there is none. */
  public static String localPart(String jid) {
    String b = bare(jid);
    int at = b.indexOf('@');
    return at > 0 ? b.substring(0, at) : b;
  }
}
