package com.ltlcheck.model;

import static java.util.Objects.requireNonNull;

import java.util.Optional;
import java.util.OptionalInt;

public record StateContext<S>(S state, OptionalInt traceIndex) implements EvaluationContext {
  public StateContext {
    requireNonNull(state);
    requireNonNull(traceIndex);
  }

  public static <S> StateContext<S> of(S state) {
    return new StateContext<>(state, OptionalInt.empty());
  }

  public static <S> StateContext<S> of(S state, int index) {
    return new StateContext<>(state, OptionalInt.of(index));
  }

  @Override
  public <T> Optional<T> currentStateAs(Class<T> type) {
    return type.isInstance(state) ? Optional.of(type.cast(state)) : Optional.empty();
  }

  @Override
  public String stateDescription() {
    return state.getClass().getName();
  }
}
