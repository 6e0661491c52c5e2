package com.codeheadsystems.onepass.server.model;

/**
 * Display status of a pass.
 */
public enum PassStatus {
  ACTIVE,
  INACTIVE,
  REVOKED
}
