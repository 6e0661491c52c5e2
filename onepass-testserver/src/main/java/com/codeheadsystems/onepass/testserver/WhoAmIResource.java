package com.codeheadsystems.onepass.testserver;

import com.codeheadsystems.onepass.dropwizard.auth.OnePassPrincipal;
import com.codeheadsystems.onepass.server.store.UserStore;
import io.dropwizard.auth.Auth;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JWT-protected endpoint that reports who the caller is and what the server knows about them.
 * Use it to check that a bearer token works before calling the pass or entry endpoints.
 */
@Path("/api/whoami")
@Produces(MediaType.APPLICATION_JSON)
public class WhoAmIResource {

  private final UserStore userStore;

  public WhoAmIResource(UserStore userStore) {
    this.userStore = userStore;
  }

  /**
   * Returns the uid from the token plus the stored role and pass status, if a user record exists.
   *
   * @param principal the principal injected by the Dropwizard auth filter
   * @return a map containing {@code uid}, and {@code role} and {@code passStatus} when known
   */
  @GET
  public Map<String, String> whoAmI(@Auth OnePassPrincipal principal) {
    Map<String, String> result = new LinkedHashMap<>();
    result.put("uid", principal.uid());
    userStore.findUser(principal.uid()).ifPresent(user -> {
      result.put("role", user.role().name());
      result.put("passStatus", user.pass() == null ? "NONE" : user.pass().status().name());
    });
    return result;
  }
}
