package com.codeheadsystems.sendkey.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Result of {@code POST /entries}. On failure {@code errors} lists every violated rule.
 *
 * @param success whether the entry was created
 * @param errors  validation messages, empty on success
 * @param entry   the created entry, null on failure
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateEntryResponse(
    @JsonProperty("success") boolean success,
    @JsonProperty("errors") List<String> errors,
    @JsonProperty("entry") EntryView entry) {

  public static CreateEntryResponse created(EntryView entry) {
    return new CreateEntryResponse(true, List.of(), entry);
  }

  public static CreateEntryResponse failed(List<String> errors) {
    return new CreateEntryResponse(false, errors, null);
  }
}
