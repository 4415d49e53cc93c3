package com.ltlcheck.model;

/**
 * An atomic proposition. Identity is given by {@link #id()} alone; implementations which are
 * used as map keys should base {@code equals} and {@code hashCode} on it.
 */
public interface Proposition {
  PropositionId id();

  default String name() {
    return id().value();
  }

  /**
   * Decides whether the proposition holds in the given context.
   *
   * @throws PropositionEvaluationException if the proposition cannot be evaluated, e.g. because
   *     the context does not provide the expected kind of state
   */
  boolean evaluate(EvaluationContext context) throws PropositionEvaluationException;
}
