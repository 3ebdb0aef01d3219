package com.codeheadsystems.sendkey.server.manager;

import java.util.List;

/**
 * Outcome of {@link EntryManager#decryptEntry}.
 *
 * @param success true if the value was revealed (and the entry claimed)
 * @param errors  failure reasons, empty on success
 * @param expired true if this failure pushed the entry over the attempt limit
 * @param value   the plaintext, null on failure
 */
public record DecryptEntryResult(boolean success, List<String> errors, boolean expired, byte[] value) {

  static DecryptEntryResult revealed(byte[] value) {
    return new DecryptEntryResult(true, List.of(), false, value);
  }

  static DecryptEntryResult failed(boolean expired, String... errors) {
    return new DecryptEntryResult(false, List.of(errors), expired, null);
  }

  @Override
  public String toString() {
    return "DecryptEntryResult[success=" + success + ", errors=" + errors + ", expired=" + expired + "]";
  }
}
