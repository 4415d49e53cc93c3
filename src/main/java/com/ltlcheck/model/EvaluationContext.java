package com.ltlcheck.model;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * The context a {@link Proposition} is evaluated in, typically a single state of a model.
 */
public interface EvaluationContext {
  /**
   * Returns the current state if it is an instance of {@code type}.
   */
  <T> Optional<T> currentStateAs(Class<T> type);

  /**
   * Position of the context inside a sequence of states, if it is part of one.
   */
  default OptionalInt traceIndex() {
    return OptionalInt.empty();
  }

  /**
   * Type of the wrapped state, used in error messages.
   */
  String stateDescription();
}
