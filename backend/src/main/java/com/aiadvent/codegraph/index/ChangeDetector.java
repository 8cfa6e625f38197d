package com.aiadvent.codegraph.index;

import com.aiadvent.codegraph.index.ChangeSet.ChangedFile;
import com.aiadvent.codegraph.index.domain.SourceFile;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.springframework.stereotype.Component;

/** Classifies files by content hash; the hash is the only input to the skip decision. */
@Component
public class ChangeDetector {

  public ChangeSet detect(Collection<SourceFile> stored, Collection<DiscoveredFile> discovered) {
    Map<String, SourceFile> storedByPath = new HashMap<>();
    for (SourceFile file : stored) {
      storedByPath.put(file.getRelativePath(), file);
    }
    List<SourceFile> unchanged = new ArrayList<>();
    List<ChangedFile> changed = new ArrayList<>();
    List<ChangedFile> added = new ArrayList<>();
    for (DiscoveredFile file : discovered) {
      SourceFile existing = storedByPath.remove(file.relativePath());
      if (existing == null) {
        added.add(new ChangedFile(null, file));
      } else if (existing.isDeleted()) {
        added.add(new ChangedFile(existing, file));
      } else if (Objects.equals(existing.getContentHash(), file.contentHash())) {
        unchanged.add(existing);
      } else {
        changed.add(new ChangedFile(existing, file));
      }
    }
    List<SourceFile> deleted =
        storedByPath.values().stream()
            .filter(file -> !file.isDeleted())
            .sorted((left, right) -> left.getRelativePath().compareTo(right.getRelativePath()))
            .toList();
    return new ChangeSet(unchanged, changed, added, deleted);
  }
}
