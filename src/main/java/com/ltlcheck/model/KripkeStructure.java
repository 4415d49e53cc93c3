package com.ltlcheck.model;

import java.util.Set;

/**
 * A labelled transition system queried on demand. Only the part reachable from the initial
 * states is ever explored, so the state space may be generated lazily.
 *
 * <p>Liveness properties are only checked on infinite paths; a reachable state without
 * successors ends every path through it.
 */
public interface KripkeStructure<S> {
  Set<S> initialStates();

  Set<S> successors(S state);

  Set<PropositionId> atomicPropositionsTrue(S state) throws PropositionEvaluationException;
}
