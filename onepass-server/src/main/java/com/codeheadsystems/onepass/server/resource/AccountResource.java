package com.codeheadsystems.onepass.server.resource;

import com.codeheadsystems.onepass.model.account.CreateAccountRequest;
import com.codeheadsystems.onepass.server.auth.AccessController;
import com.codeheadsystems.onepass.server.auth.Role;
import com.codeheadsystems.onepass.server.model.UserRecord;
import com.codeheadsystems.onepass.server.store.UserStore;
import jakarta.annotation.security.PermitAll;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the user record for the authenticated caller.
 * <p>
 * Creation notifies the store's user-created listeners, which issue the pass. Returns 201 when
 * the record was created and 200 when it already existed.
 */
@Path("/accounts")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AccountResource {

  private static final Logger log = LoggerFactory.getLogger(AccountResource.class);

  private final AccessController accessController;
  private final UserStore userStore;

  public AccountResource(final AccessController accessController, final UserStore userStore) {
    this.accessController = accessController;
    this.userStore = userStore;
  }

  @POST
  @PermitAll
  public Response createAccount(@Context SecurityContext securityContext,
                                CreateAccountRequest request) {
    String caller = ResourceErrors.callerUid(securityContext);
    return ResourceErrors.call(() -> {
      String uid = accessController.authenticate(caller);
      String email = request == null ? null : request.email();
      boolean created = userStore.createUser(new UserRecord(uid, email, Role.USER, null));
      log.info("Account {} for {}", created ? "created" : "already exists", uid);
      return Response.status(created ? Response.Status.CREATED : Response.Status.OK).build();
    });
  }
}
