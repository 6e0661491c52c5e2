package com.codeheadsystems.onepass.server.resource;

import com.codeheadsystems.onepass.server.exception.NotFoundException;
import com.codeheadsystems.onepass.server.exception.PermissionDeniedException;
import com.codeheadsystems.onepass.server.exception.UnauthenticatedException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import java.security.Principal;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates the managers' exception contract into HTTP statuses.
 */
final class ResourceErrors {

  private static final Logger log = LoggerFactory.getLogger(ResourceErrors.class);

  private ResourceErrors() {
  }

  /**
   * The authenticated caller's uid, or null for anonymous requests.
   */
  static String callerUid(SecurityContext securityContext) {
    if (securityContext == null) {
      return null;
    }
    Principal principal = securityContext.getUserPrincipal();
    return principal == null ? null : principal.getName();
  }

  static <T> T call(Supplier<T> action) {
    try {
      return action.get();
    } catch (UnauthenticatedException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.UNAUTHORIZED);
    } catch (PermissionDeniedException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.FORBIDDEN);
    } catch (NotFoundException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.NOT_FOUND);
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    } catch (WebApplicationException e) {
      throw e;
    } catch (RuntimeException e) {
      log.error("Request failed", e);
      throw new WebApplicationException(e.getMessage(), Response.Status.INTERNAL_SERVER_ERROR);
    }
  }
}
