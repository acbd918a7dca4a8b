package io.b2mash.meetings.pointtracker.security;

import io.b2mash.meetings.pointtracker.exception.AuthenticationRequiredException;
import java.util.Optional;

/**
 * Request-scoped user context. Bound by {@link CurrentUserFilter} for the duration of one request
 * and read by controllers, guards and the audit builder.
 */
public final class RequestScopes {

  private static final ThreadLocal<CurrentUser> CURRENT_USER = new ThreadLocal<>();

  private RequestScopes() {}

  public static void bind(CurrentUser user) {
    CURRENT_USER.set(user);
  }

  public static void clear() {
    CURRENT_USER.remove();
  }

  public static boolean isBound() {
    return CURRENT_USER.get() != null;
  }

  public static Optional<CurrentUser> currentUser() {
    return Optional.ofNullable(CURRENT_USER.get());
  }

  /** Returns the bound user. Throws {@link AuthenticationRequiredException} if none is bound. */
  public static CurrentUser requireCurrentUser() {
    CurrentUser user = CURRENT_USER.get();
    if (user == null) {
      throw new AuthenticationRequiredException();
    }
    return user;
  }
}
