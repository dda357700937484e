package io.trail.query;

import io.trail.model.Version;

import java.util.List;

/**
 * Result of checking an entity's strict-mode version chain.
 *
 * @param chain    versions of the entity, oldest first
 * @param problems why the chain does not verify; empty when it does
 */
public record ChainVerification(List<Version> chain, List<String> problems) {
  public ChainVerification {
    chain = List.copyOf(chain);
    problems = List.copyOf(problems);
  }

  public boolean isValid() {
    return problems.isEmpty();
  }
}
