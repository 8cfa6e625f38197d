package com.aiadvent.codegraph.index;

import com.aiadvent.codegraph.index.domain.SourceFile;
import java.util.List;

/**
 * Outcome of comparing a fresh scan with the stored file rows.
 *
 * @param changed pairs of stored row and new content for files whose hash differs
 * @param added files with no live row, including previously deleted files that reappeared
 */
public record ChangeSet(
    List<SourceFile> unchanged,
    List<ChangedFile> changed,
    List<ChangedFile> added,
    List<SourceFile> deleted) {

  public ChangeSet {
    unchanged = List.copyOf(unchanged);
    changed = List.copyOf(changed);
    added = List.copyOf(added);
    deleted = List.copyOf(deleted);
  }

  public boolean isEmpty() {
    return changed.isEmpty() && added.isEmpty() && deleted.isEmpty();
  }

  /** Stored row (absent for brand-new paths) together with the discovered content. */
  public record ChangedFile(SourceFile stored, DiscoveredFile discovered) {}
}
