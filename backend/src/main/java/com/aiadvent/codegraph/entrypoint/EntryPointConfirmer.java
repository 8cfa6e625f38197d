package com.aiadvent.codegraph.entrypoint;

import java.util.List;

/**
 * Reviews a batch of rule matches and decides which are real entry points. Implementations may
 * call out to a model; they are always invoked through the enrichment executor, so they may block
 * and may throw.
 */
public interface EntryPointConfirmer {

  /**
   * @return one verdict per candidate that was reviewed; candidates without a verdict are treated
   *     as rejected
   */
  List<ConfirmationVerdict> confirm(List<CandidateContext> candidates);
}
