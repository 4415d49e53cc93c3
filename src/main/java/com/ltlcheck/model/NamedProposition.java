package com.ltlcheck.model;

import static java.util.Objects.requireNonNull;

/**
 * A proposition which is nothing but a label. Model checking decides its truth through
 * {@link KripkeStructure#atomicPropositionsTrue(Object)}; direct evaluation requires a
 * {@link Labelled} state.
 */
public record NamedProposition(PropositionId id) implements Proposition {
  public NamedProposition {
    requireNonNull(id);
  }

  public static NamedProposition of(String id) {
    return new NamedProposition(PropositionId.of(id));
  }

  @Override
  public boolean evaluate(EvaluationContext context) throws PropositionEvaluationException {
    Labelled state = context.currentStateAs(Labelled.class)
        .orElseThrow(() -> PropositionEvaluationException.stateTypeMismatch(id, Labelled.class, context));
    return state.labels().contains(id);
  }

  @Override
  public String toString() {
    return id.value();
  }
}
