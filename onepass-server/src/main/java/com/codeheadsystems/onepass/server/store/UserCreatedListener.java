package com.codeheadsystems.onepass.server.store;

import com.codeheadsystems.onepass.server.model.UserRecord;

/**
 * Notified after a user record is created for the first time.
 */
@FunctionalInterface
public interface UserCreatedListener {

  void onUserCreated(UserRecord user);
}
