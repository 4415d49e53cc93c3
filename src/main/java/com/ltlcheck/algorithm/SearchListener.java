package com.ltlcheck.algorithm;

import com.ltlcheck.model.Counterexample;

/**
 * Receives progress of a {@link NestedDfs} search. All callbacks do nothing by default.
 */
public interface SearchListener<T> {
  default void outerStateVisited(T state) {}

  default void innerSearchStarted(T seed) {}

  default void innerStateVisited(T state) {}

  default void acceptingCycleFound(Counterexample<T> lasso) {}
}
