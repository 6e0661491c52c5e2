package com.codeheadsystems.onepass.server.model;

import com.codeheadsystems.onepass.server.auth.Role;

/**
 * A user record with its embedded pass.
 *
 * @param uid   unique id, also the JWT subject
 * @param email contact address, may be null
 * @param role  authorization role, {@link Role#USER} when unset
 * @param pass  the user's pass, null until issued
 */
public record UserRecord(String uid, String email, Role role, Pass pass) {

  public UserRecord {
    if (role == null) {
      role = Role.USER;
    }
  }

  public static UserRecord of(String uid, Role role) {
    return new UserRecord(uid, null, role, null);
  }

  public UserRecord withPass(Pass newPass) {
    return new UserRecord(uid, email, role, newPass);
  }
}
