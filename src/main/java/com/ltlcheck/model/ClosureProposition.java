package com.ltlcheck.model;

import static java.util.Objects.requireNonNull;

/**
 * A proposition evaluated by a function over states of type {@code S}.
 */
public final class ClosureProposition<S> implements Proposition {
  @FunctionalInterface
  public interface Evaluator<S> {
    boolean test(S state) throws Exception;
  }

  private final PropositionId id;
  private final String name;
  private final Class<S> stateType;
  private final Evaluator<S> evaluator;

  private ClosureProposition(PropositionId id, String name, Class<S> stateType, Evaluator<S> evaluator) {
    this.id = requireNonNull(id);
    this.name = requireNonNull(name);
    this.stateType = requireNonNull(stateType);
    this.evaluator = requireNonNull(evaluator);
  }

  public static <S> ClosureProposition<S> of(String id, Class<S> stateType, Evaluator<S> evaluator) {
    return new ClosureProposition<>(PropositionId.of(id), id, stateType, evaluator);
  }

  public static <S> ClosureProposition<S> of(String id, String name, Class<S> stateType, Evaluator<S> evaluator) {
    return new ClosureProposition<>(PropositionId.of(id), name, stateType, evaluator);
  }

  @Override
  public PropositionId id() {
    return id;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public boolean evaluate(EvaluationContext context) throws PropositionEvaluationException {
    S state = context.currentStateAs(stateType)
        .orElseThrow(() -> PropositionEvaluationException.stateTypeMismatch(id, stateType, context));
    try {
      return evaluator.test(state);
    } catch (Exception e) {
      if (e instanceof InterruptedException) {
        Thread.currentThread().interrupt();
      }
      throw new PropositionEvaluationException(id, "Evaluation of %s failed on %s".formatted(name, state), e);
    }
  }

  @Override
  public boolean equals(Object obj) {
    return this == obj || (obj instanceof ClosureProposition<?> that && id.equals(that.id));
  }

  @Override
  public int hashCode() {
    return id.hashCode();
  }

  @Override
  public String toString() {
    return id.value();
  }
}
