package com.codeheadsystems.sendkey.server.resource;

import com.codeheadsystems.sendkey.model.CreateEntryRequest;
import com.codeheadsystems.sendkey.model.CreateEntryResponse;
import com.codeheadsystems.sendkey.model.EntryView;
import com.codeheadsystems.sendkey.model.RevealEntryRequest;
import com.codeheadsystems.sendkey.model.RevealEntryResponse;
import com.codeheadsystems.sendkey.server.auth.TokenManager;
import com.codeheadsystems.sendkey.server.manager.CreateEntryCommand;
import com.codeheadsystems.sendkey.server.manager.CreateEntryResult;
import com.codeheadsystems.sendkey.server.manager.DecryptEntryResult;
import com.codeheadsystems.sendkey.server.manager.EntryManager;
import com.codeheadsystems.sendkey.server.model.Views;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JAX-RS resource for secret entries.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /entries}                (bearer) create an entry as the caller</li>
 *   <li>{@code GET /entries/{id}?nonce=}     look an entry up by id and nonce</li>
 *   <li>{@code POST /entries/{id}/value}     reveal the value once</li>
 *   <li>{@code GET /users/{userId}/entries}  (bearer) list the caller's active entries</li>
 * </ul>
 */
@Path("/")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class EntryResource {

  private static final Logger log = LoggerFactory.getLogger(EntryResource.class);

  static final String NONCE_REQUIRED = "A nonce is required.";

  private final EntryManager entryManager;
  private final TokenManager tokenManager;

  public EntryResource(EntryManager entryManager, TokenManager tokenManager) {
    this.entryManager = entryManager;
    this.tokenManager = tokenManager;
  }

  @POST
  @Path("entries")
  public Response createEntry(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                              CreateEntryRequest request) {
    log.debug("createEntry()");
    UUID caller = BearerAuth.requireCaller(tokenManager, authorization);
    if (request == null) {
      throw BearerAuth.error(Response.Status.BAD_REQUEST, "Missing request body");
    }
    CreateEntryResult result = entryManager.createEntry(new CreateEntryCommand(
        request.name(), caller, request.sendToEmail(), request.value(), request.secret(),
        CreateEntryCommand.durationOfMinutes(request.durationMinutes())));
    if (!result.success()) {
      return Response.status(Response.Status.BAD_REQUEST)
          .entity(CreateEntryResponse.failed(result.errors()))
          .build();
    }
    return Response.status(Response.Status.CREATED)
        .entity(CreateEntryResponse.created(Views.entry(result.entry().get())))
        .build();
  }

  @GET
  @Path("entries/{id}")
  public EntryView findEntry(@PathParam("id") String id, @QueryParam("nonce") String nonce) {
    log.debug("findEntry(id={})", id);
    if (nonce == null || nonce.isBlank()) {
      throw BearerAuth.error(Response.Status.BAD_REQUEST, NONCE_REQUIRED);
    }
    return parseId(id)
        .flatMap(entryId -> entryManager.findEntry(entryId, nonce))
        .map(Views::entry)
        .orElseThrow(() -> BearerAuth.error(Response.Status.NOT_FOUND, "Entry not found"));
  }

  @POST
  @Path("entries/{id}/value")
  public Response revealEntry(@PathParam("id") String id, RevealEntryRequest request) {
    log.debug("revealEntry(id={})", id);
    if (request == null || request.nonce() == null || request.nonce().isBlank()) {
      return Response.status(Response.Status.BAD_REQUEST)
          .entity(RevealEntryResponse.failed(List.of(NONCE_REQUIRED), false))
          .build();
    }
    Optional<UUID> entryId = parseId(id);
    if (entryId.isEmpty()) {
      return Response.status(Response.Status.BAD_REQUEST)
          .entity(RevealEntryResponse.failed(List.of(EntryManager.INVALID_ENTRY), false))
          .build();
    }
    DecryptEntryResult result = entryManager.decryptEntry(entryId.get(), request.nonce(), request.secret());
    if (!result.success()) {
      return Response.status(Response.Status.BAD_REQUEST)
          .entity(RevealEntryResponse.failed(result.errors(), result.expired()))
          .build();
    }
    return Response.ok(RevealEntryResponse.revealed(new String(result.value(), StandardCharsets.UTF_8))).build();
  }

  @GET
  @Path("users/{userId}/entries")
  public List<EntryView> listEntries(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                     @PathParam("userId") String userId) {
    log.debug("listEntries(userId={})", userId);
    UUID caller = BearerAuth.requireCaller(tokenManager, authorization);
    if (!parseId(userId).map(caller::equals).orElse(false)) {
      throw BearerAuth.error(Response.Status.FORBIDDEN, "Entries can only be listed by their sender");
    }
    return entryManager.listBySender(caller).stream().map(Views::entry).toList();
  }

  private static Optional<UUID> parseId(String id) {
    if (id == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(UUID.fromString(id));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
