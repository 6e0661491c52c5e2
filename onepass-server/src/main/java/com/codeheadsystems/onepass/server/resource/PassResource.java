package com.codeheadsystems.onepass.server.resource;

import com.codeheadsystems.onepass.model.pass.PassResponse;
import com.codeheadsystems.onepass.model.pass.RevokePassRequest;
import com.codeheadsystems.onepass.model.pass.RevokePassResponse;
import com.codeheadsystems.onepass.server.manager.PassIssuer;
import com.codeheadsystems.onepass.server.manager.PassRevoker;
import jakarta.annotation.security.PermitAll;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.SecurityContext;

/**
 * JAX-RS resource for pass issuance and revocation.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /pass}        - return the caller's pass, issuing it if needed</li>
 *   <li>{@code POST /pass/revoke} - revoke another user's pass (administrators only)</li>
 * </ul>
 */
@Path("/pass")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class PassResource {

  private final PassIssuer passIssuer;
  private final PassRevoker passRevoker;

  public PassResource(final PassIssuer passIssuer, final PassRevoker passRevoker) {
    this.passIssuer = passIssuer;
    this.passRevoker = passRevoker;
  }

  @POST
  @PermitAll
  public PassResponse generateUserPass(@Context SecurityContext securityContext) {
    String caller = ResourceErrors.callerUid(securityContext);
    return ResourceErrors.call(() -> passIssuer.generateUserPass(caller));
  }

  @POST
  @PermitAll
  @Path("/revoke")
  public RevokePassResponse revokeUserPass(@Context SecurityContext securityContext,
                                           RevokePassRequest request) {
    if (request == null) {
      throw new WebApplicationException("Missing request body", Response.Status.BAD_REQUEST);
    }
    String caller = ResourceErrors.callerUid(securityContext);
    return ResourceErrors.call(() ->
        passRevoker.revokePass(caller, request.targetUid(), request.reason()));
  }
}
