package com.codeheadsystems.onepass.server.auth;

import java.util.EnumSet;
import java.util.Set;

/**
 * Privileged operations and the roles allowed to perform them.
 */
public enum Permission {
  SCAN_ENTRY(EnumSet.of(Role.STAFF, Role.SECURITY, Role.ADMIN, Role.ORGANIZER)),
  REVOKE_PASS(EnumSet.of(Role.ADMIN));

  private final Set<Role> allowedRoles;

  Permission(Set<Role> allowedRoles) {
    this.allowedRoles = allowedRoles;
  }

  public boolean allows(Role role) {
    return role != null && allowedRoles.contains(role);
  }
}
