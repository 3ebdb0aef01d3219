package com.codeheadsystems.sendkey.springboot.controller;

import com.codeheadsystems.sendkey.model.CreateEntryRequest;
import com.codeheadsystems.sendkey.model.CreateEntryResponse;
import com.codeheadsystems.sendkey.model.EntryView;
import com.codeheadsystems.sendkey.model.RevealEntryRequest;
import com.codeheadsystems.sendkey.model.RevealEntryResponse;
import com.codeheadsystems.sendkey.server.manager.CreateEntryCommand;
import com.codeheadsystems.sendkey.server.manager.CreateEntryResult;
import com.codeheadsystems.sendkey.server.manager.DecryptEntryResult;
import com.codeheadsystems.sendkey.server.manager.EntryManager;
import com.codeheadsystems.sendkey.server.model.Views;
import com.codeheadsystems.sendkey.springboot.security.SendKeyPrincipal;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
public class EntryController {

  private static final Logger log = LoggerFactory.getLogger(EntryController.class);

  static final String NONCE_REQUIRED = "A nonce is required.";

  private final EntryManager entryManager;

  public EntryController(EntryManager entryManager) {
    this.entryManager = entryManager;
  }

  @PostMapping("/entries")
  public ResponseEntity<CreateEntryResponse> createEntry(@AuthenticationPrincipal SendKeyPrincipal caller,
                                                         @RequestBody(required = false) CreateEntryRequest request) {
    log.debug("createEntry()");
    if (request == null) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Missing request body");
    }
    CreateEntryResult result = entryManager.createEntry(new CreateEntryCommand(
        request.name(), caller.userId(), request.sendToEmail(), request.value(), request.secret(),
        CreateEntryCommand.durationOfMinutes(request.durationMinutes())));
    if (!result.success()) {
      return ResponseEntity.badRequest().body(CreateEntryResponse.failed(result.errors()));
    }
    return ResponseEntity.status(HttpStatus.CREATED)
        .body(CreateEntryResponse.created(Views.entry(result.entry().get())));
  }

  @GetMapping("/entries/{id}")
  public EntryView findEntry(@PathVariable("id") String id,
                             @RequestParam(name = "nonce", required = false) String nonce) {
    log.debug("findEntry(id={})", id);
    if (nonce == null || nonce.isBlank()) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, NONCE_REQUIRED);
    }
    return parseId(id)
        .flatMap(entryId -> entryManager.findEntry(entryId, nonce))
        .map(Views::entry)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Entry not found"));
  }

  @PostMapping("/entries/{id}/value")
  public ResponseEntity<RevealEntryResponse> revealEntry(@PathVariable("id") String id,
                                                         @RequestBody(required = false) RevealEntryRequest request) {
    log.debug("revealEntry(id={})", id);
    if (request == null || request.nonce() == null || request.nonce().isBlank()) {
      return ResponseEntity.badRequest().body(RevealEntryResponse.failed(List.of(NONCE_REQUIRED), false));
    }
    Optional<UUID> entryId = parseId(id);
    if (entryId.isEmpty()) {
      return ResponseEntity.badRequest()
          .body(RevealEntryResponse.failed(List.of(EntryManager.INVALID_ENTRY), false));
    }
    DecryptEntryResult result = entryManager.decryptEntry(entryId.get(), request.nonce(), request.secret());
    if (!result.success()) {
      return ResponseEntity.badRequest().body(RevealEntryResponse.failed(result.errors(), result.expired()));
    }
    return ResponseEntity.ok(RevealEntryResponse.revealed(new String(result.value(), StandardCharsets.UTF_8)));
  }

  @GetMapping("/users/{userId}/entries")
  public List<EntryView> listEntries(@AuthenticationPrincipal SendKeyPrincipal caller,
                                     @PathVariable("userId") String userId) {
    log.debug("listEntries(userId={})", userId);
    if (!parseId(userId).map(caller.userId()::equals).orElse(false)) {
      throw new ResponseStatusException(HttpStatus.FORBIDDEN, "Entries can only be listed by their sender");
    }
    return entryManager.listBySender(caller.userId()).stream().map(Views::entry).toList();
  }

  private static Optional<UUID> parseId(String id) {
    try {
      return Optional.of(UUID.fromString(id));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
