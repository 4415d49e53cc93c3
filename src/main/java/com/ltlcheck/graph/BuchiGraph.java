package com.ltlcheck.graph;

import com.ltlcheck.model.PropositionEvaluationException;
import java.util.Set;

/**
 * A generalized Büchi automaton explored on demand, as consumed by the emptiness check. Acceptance
 * is on states: a run is accepting if it visits every acceptance set infinitely often.
 */
public interface BuchiGraph<T> {
  Set<T> initialStates() throws PropositionEvaluationException;

  Set<T> successors(T state) throws PropositionEvaluationException;

  int acceptanceSetCount();

  boolean isAccepting(T state, int acceptanceSet);
}
