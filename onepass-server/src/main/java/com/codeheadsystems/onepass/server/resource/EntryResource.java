package com.codeheadsystems.onepass.server.resource;

import com.codeheadsystems.onepass.model.entry.ValidateEntryRequest;
import com.codeheadsystems.onepass.model.entry.ValidateEntryResponse;
import com.codeheadsystems.onepass.server.manager.EntryValidator;
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
 * JAX-RS resource for scanning passes at event entrances.
 * <p>
 * Rejections are ordinary 200 responses with {@code status: rejected}; only caller and request
 * errors map to 4xx.
 */
@Path("/entry")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class EntryResource {

  private final EntryValidator entryValidator;

  public EntryResource(final EntryValidator entryValidator) {
    this.entryValidator = entryValidator;
  }

  @POST
  @PermitAll
  @Path("/validate")
  public ValidateEntryResponse validate(@Context SecurityContext securityContext,
                                        ValidateEntryRequest request) {
    if (request == null) {
      throw new WebApplicationException("Missing request body", Response.Status.BAD_REQUEST);
    }
    String caller = ResourceErrors.callerUid(securityContext);
    return ResourceErrors.call(() ->
        entryValidator.validate(caller, request.qrText(), request.eventId()));
  }
}
