package com.codeheadsystems.onepass.server.auth;

/**
 * Closed set of roles a user record can carry.
 */
public enum Role {
  USER,
  STAFF,
  SECURITY,
  ADMIN,
  ORGANIZER
}
