package com.worshipteam.notification.config;

import com.worshipteam.notification.model.UserRecord;
import com.worshipteam.notification.model.UserRole;
import com.worshipteam.notification.repository.UserRepository;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authorization.AuthorizationDecision;
import org.springframework.security.authorization.AuthorizationManager;
import org.springframework.security.core.Authentication;
import org.springframework.security.web.access.intercept.RequestAuthorizationContext;

/**
 * Grants access when the authenticated caller is an active user whose stored role is one of the
 * allowed roles. Roles are read from the users table on every request, never from the caller.
 */
public class RoleTierAuthorizationManager
    implements AuthorizationManager<RequestAuthorizationContext> {

  private static final Logger logger = LoggerFactory.getLogger(RoleTierAuthorizationManager.class);

  private final UserRepository userRepository;
  private final Set<UserRole> allowedRoles;

  public RoleTierAuthorizationManager(UserRepository userRepository, Set<UserRole> allowedRoles) {
    this.userRepository = userRepository;
    this.allowedRoles = EnumSet.copyOf(allowedRoles);
  }

  public static RoleTierAuthorizationManager manager(UserRepository userRepository) {
    return new RoleTierAuthorizationManager(
        userRepository, EnumSet.of(UserRole.ROOT, UserRole.MINISTER));
  }

  public static RoleTierAuthorizationManager admin(UserRepository userRepository) {
    return new RoleTierAuthorizationManager(userRepository, EnumSet.of(UserRole.ROOT));
  }

  @Override
  public AuthorizationDecision check(
      Supplier<Authentication> authentication, RequestAuthorizationContext context) {
    final Authentication auth = authentication.get();
    if (auth == null
        || auth instanceof AnonymousAuthenticationToken
        || !auth.isAuthenticated()
        || auth.getName() == null) {
      return new AuthorizationDecision(false);
    }
    final Optional<UserRecord> user = userRepository.findByUserId(auth.getName());
    final boolean granted =
        user.map(u -> u.active() && u.role() != null && allowedRoles.contains(u.role()))
            .orElse(false);
    if (!granted) {
      logger.info(
          "role tier denied userId={} path={} allowed={}",
          auth.getName(),
          context.getRequest().getRequestURI(),
          allowedRoles);
    }
    return new AuthorizationDecision(granted);
  }
}
