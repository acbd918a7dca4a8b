package io.b2mash.meetings.pointtracker.permission;

import java.util.UUID;

/**
 * Parsed form of a point's {@code assigned_to} column: {@code user:<id>}, {@code attendee:<id>},
 * {@code company:<name>}, or legacy free text (a name or an email).
 *
 * @param kind the tag, or {@link Kind#LEGACY} when the value carries none
 * @param value the part after the tag; the whole text for legacy values
 * @param raw the stored text, unchanged
 */
public record AssignmentReference(Kind kind, String value, String raw) {

  public enum Kind {
    USER("user:"),
    ATTENDEE("attendee:"),
    COMPANY("company:"),
    LEGACY("");

    private final String prefix;

    Kind(String prefix) {
      this.prefix = prefix;
    }

    public String prefix() {
      return prefix;
    }
  }

  /** Parses stored text. Returns {@code null} for a null or blank value (unassigned point). */
  public static AssignmentReference parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    for (Kind kind : Kind.values()) {
      if (kind != Kind.LEGACY && raw.startsWith(kind.prefix())) {
        return new AssignmentReference(kind, raw.substring(kind.prefix().length()), raw);
      }
    }
    return new AssignmentReference(Kind.LEGACY, raw, raw);
  }

  public static String forUser(UUID userId) {
    return Kind.USER.prefix() + userId;
  }

  public boolean isUser() {
    return kind == Kind.USER;
  }

  /** True only for a {@code user:} reference naming exactly {@code userId}. */
  public boolean refersToUser(UUID userId) {
    return isUser() && userId != null && value.equals(userId.toString());
  }

  /**
   * Legacy fallback: the stored text contains the email. Looser than an id match and kept only for
   * rows written before tagged references existed.
   */
  public boolean mentionsEmail(String email) {
    return email != null && !email.isBlank() && raw.contains(email);
  }
}
