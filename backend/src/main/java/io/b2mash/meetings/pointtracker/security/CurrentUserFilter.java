package io.b2mash.meetings.pointtracker.security;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.meetings.pointtracker.user.UserContextService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Resolves the JWT subject to a user and binds a {@link CurrentUser} for the request. Roles and
 * memberships are read fresh on every request; only the subject to user-id mapping is cached.
 */
@Component
public class CurrentUserFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(CurrentUserFilter.class);

  private final UserContextService userContextService;
  private final Cache<String, UUID> userIdCache =
      Caffeine.newBuilder().maximumSize(50_000).expireAfterWrite(Duration.ofHours(1)).build();

  public CurrentUserFilter(UserContextService userContextService) {
    this.userContextService = userContextService;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    var user = resolveCurrentUser();
    if (user.isEmpty()) {
      // Unknown subject: continue unbound, handlers answer 401
      filterChain.doFilter(request, response);
      return;
    }
    RequestScopes.bind(user.get());
    try {
      filterChain.doFilter(request, response);
    } finally {
      RequestScopes.clear();
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return request.getRequestURI().startsWith("/actuator/");
  }

  public void evictFromCache(String subject) {
    userIdCache.invalidate(subject);
  }

  private Optional<CurrentUser> resolveCurrentUser() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (!(authentication instanceof JwtAuthenticationToken jwtAuth)) {
      return Optional.empty();
    }
    String subject = jwtAuth.getToken().getSubject();
    if (subject == null) {
      return Optional.empty();
    }

    UUID userId;
    try {
      userId =
          userIdCache.get(subject, s -> userContextService.findUserIdBySubject(s).orElse(null));
    } catch (RuntimeException e) {
      log.warn("Failed to resolve user for subject {}: {}", subject, e.getMessage());
      return Optional.empty();
    }
    if (userId == null) {
      log.warn("No user registered for subject {}", subject);
      return Optional.empty();
    }

    Optional<CurrentUser> user;
    try {
      user = userContextService.loadCurrentUser(userId);
    } catch (RuntimeException e) {
      log.warn("Failed to load user {} for subject {}: {}", userId, subject, e.getMessage());
      return Optional.empty();
    }
    if (user.isEmpty()) {
      log.warn("User {} for subject {} is missing or inactive", userId, subject);
      userIdCache.invalidate(subject);
    }
    return user;
  }
}
