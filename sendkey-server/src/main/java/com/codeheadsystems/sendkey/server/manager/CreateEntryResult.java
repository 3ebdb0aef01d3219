package com.codeheadsystems.sendkey.server.manager;

import com.codeheadsystems.sendkey.server.model.Entry;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of {@link EntryManager#createEntry}: either the stored entry or every violated rule.
 */
public record CreateEntryResult(Optional<Entry> entry, List<String> errors) {

  static CreateEntryResult created(Entry entry) {
    return new CreateEntryResult(Optional.of(entry), List.of());
  }

  static CreateEntryResult invalid(List<String> errors) {
    return new CreateEntryResult(Optional.empty(), List.copyOf(errors));
  }

  public boolean success() {
    return entry.isPresent();
  }
}
