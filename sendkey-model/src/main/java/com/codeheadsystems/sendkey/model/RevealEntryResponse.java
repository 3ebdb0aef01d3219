package com.codeheadsystems.sendkey.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Result of revealing an entry.
 * <p>
 * A successful reveal carries only {@code value}. A failed reveal carries the error list and
 * whether the entry has now expired; it never says how many attempts remain.
 *
 * @param success whether the value was revealed
 * @param errors  failure reasons, null on success
 * @param expired true when the failure exhausted the attempt limit
 * @param value   the revealed plaintext, null on failure
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RevealEntryResponse(
    @JsonProperty("success") boolean success,
    @JsonProperty("errors") List<String> errors,
    @JsonProperty("expired") Boolean expired,
    @JsonProperty("value") String value) {

  public static RevealEntryResponse revealed(String value) {
    return new RevealEntryResponse(true, null, null, value);
  }

  public static RevealEntryResponse failed(List<String> errors, boolean expired) {
    return new RevealEntryResponse(false, errors, expired, null);
  }
}
