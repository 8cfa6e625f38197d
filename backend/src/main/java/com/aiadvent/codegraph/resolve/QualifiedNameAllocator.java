package com.aiadvent.codegraph.resolve;

import com.aiadvent.codegraph.parser.model.SymbolDescriptor;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Hands out repository-unique qualified names. A name that is already taken gets the first free
 * {@code #n} suffix starting at 2; children of a renamed symbol follow their parent's new name.
 */
class QualifiedNameAllocator {

  private final Set<String> taken = new HashSet<>();

  QualifiedNameAllocator(Collection<String> reserved) {
    taken.addAll(reserved);
  }

  String[] allocate(List<SymbolDescriptor> symbols) {
    String[] allocated = new String[symbols.size()];
    for (int i = 0; i < symbols.size(); i++) {
      SymbolDescriptor descriptor = symbols.get(i);
      String candidate = descriptor.qualifiedName();
      if (descriptor.hasParent() && descriptor.parentIndex() < i) {
        String parentRaw = symbols.get(descriptor.parentIndex()).qualifiedName();
        String parentAllocated = allocated[descriptor.parentIndex()];
        if (!parentRaw.equals(parentAllocated) && candidate.startsWith(parentRaw + ".")) {
          candidate = parentAllocated + candidate.substring(parentRaw.length());
        }
      }
      allocated[i] = claim(candidate);
    }
    return allocated;
  }

  private String claim(String base) {
    if (taken.add(base)) {
      return base;
    }
    for (int n = 2; ; n++) {
      String candidate = base + "#" + n;
      if (taken.add(candidate)) {
        return candidate;
      }
    }
  }
}
