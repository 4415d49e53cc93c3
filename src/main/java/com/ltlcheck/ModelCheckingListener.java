package com.ltlcheck;

import com.ltlcheck.algorithm.SearchListener;
import com.ltlcheck.algorithm.Tableau;
import com.ltlcheck.graph.FormulaAutomaton;
import com.ltlcheck.graph.ProductState;

/**
 * Observer of a model checking run, passed per call. All callbacks do nothing by default.
 */
public interface ModelCheckingListener<S> extends SearchListener<ProductState<S>> {
  default void onTableau(Tableau<?> tableau) {}

  default void onAutomaton(FormulaAutomaton automaton) {}

  default void onFinished(ModelCheckingStatistics statistics) {}
}
