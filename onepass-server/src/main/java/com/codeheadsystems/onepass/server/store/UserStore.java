package com.codeheadsystems.onepass.server.store;

import com.codeheadsystems.onepass.server.model.Pass;
import com.codeheadsystems.onepass.server.model.UserRecord;
import java.util.Optional;

/**
 * The {@code users} collection. Each user record embeds at most one pass.
 */
public interface UserStore {

  Optional<UserRecord> findUser(String uid);

  /**
   * Creates a user record if none exists for its uid, then notifies the registered
   * {@link UserCreatedListener}s.
   *
   * @param user the record to create
   * @return true if created, false if a record with that uid already existed
   */
  boolean createUser(UserRecord user);

  /**
   * Sets the pass on a user record, creating a bare record if the user is unknown. Other fields
   * of an existing record are preserved. Does not notify listeners.
   *
   * @param uid  owner of the pass
   * @param pass the pass to store
   */
  void mergePass(String uid, Pass pass);

  void addUserCreatedListener(UserCreatedListener listener);
}
