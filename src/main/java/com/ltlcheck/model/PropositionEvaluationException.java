package com.ltlcheck.model;

import static java.util.Objects.requireNonNull;

/**
 * Raised when a proposition cannot be evaluated. Aborts the model checking call it occurs in;
 * a formula which does not hold is never reported through this exception.
 */
public class PropositionEvaluationException extends Exception {
  private final PropositionId propositionId;

  public PropositionEvaluationException(PropositionId propositionId, String message) {
    super(message);
    this.propositionId = requireNonNull(propositionId);
  }

  public PropositionEvaluationException(PropositionId propositionId, String message, Throwable cause) {
    super(message, cause);
    this.propositionId = requireNonNull(propositionId);
  }

  public static PropositionEvaluationException stateTypeMismatch(
      PropositionId propositionId, Class<?> expected, EvaluationContext context) {
    return new PropositionEvaluationException(propositionId,
        "Proposition %s expects a state of type %s, got %s".formatted(
            propositionId, expected.getName(), context.stateDescription()));
  }

  public PropositionId propositionId() {
    return propositionId;
  }
}
