package com.ltlcheck.graph;

import static java.util.Objects.requireNonNull;

import com.ltlcheck.model.KripkeStructure;
import com.ltlcheck.model.PropositionEvaluationException;
import com.ltlcheck.model.PropositionId;
import it.unimi.dsi.fastutil.ints.IntList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Synchronous product of a Kripke structure and a formula automaton, built lazily while it is
 * explored. A pair {@code (s, q)} moves to {@code (s', q')} if {@code s'} is a successor of
 * {@code s}, {@code q'} one of {@code q} and the guard of {@code q'} holds under the labels of
 * {@code s'}. Acceptance is that of the automaton component.
 *
 * <p>Labels are queried once per Kripke state. Instances are meant for a single search and are
 * not thread safe.
 */
public final class ProductAutomaton<S> implements BuchiGraph<ProductState<S>> {
  /**
   * Treatment of Kripke states without successors.
   */
  public enum DeadlockPolicy {
    /** A path ending in a terminal state is finite and never a counterexample. */
    IGNORE,
    /** A terminal state repeats forever, as if it had a self loop. */
    STUTTER
  }

  private final FormulaAutomaton automaton;
  private final KripkeStructure<S> model;
  private final DeadlockPolicy deadlockPolicy;
  private final Map<S, Set<PropositionId>> labelCache = new HashMap<>();

  public ProductAutomaton(FormulaAutomaton automaton, KripkeStructure<S> model, DeadlockPolicy deadlockPolicy) {
    this.automaton = requireNonNull(automaton);
    this.model = requireNonNull(model);
    this.deadlockPolicy = requireNonNull(deadlockPolicy);
  }

  public static <S> Set<S> kripkeSuccessors(KripkeStructure<S> model, S state, DeadlockPolicy deadlockPolicy) {
    Set<S> successors = model.successors(state);
    if (successors.isEmpty() && deadlockPolicy == DeadlockPolicy.STUTTER) {
      return Set.of(state);
    }
    return successors;
  }

  private Set<PropositionId> labels(S state) throws PropositionEvaluationException {
    Set<PropositionId> labels = labelCache.get(state);
    if (labels == null) {
      labels = Set.copyOf(model.atomicPropositionsTrue(state));
      labelCache.put(state, labels);
    }
    return labels;
  }

  private void addSuccessors(Set<ProductState<S>> states, S kripkeState, IntList automatonSuccessors)
      throws PropositionEvaluationException {
    if (automatonSuccessors.isEmpty()) {
      return;
    }
    Set<PropositionId> labels = labels(kripkeState);
    for (int i = 0; i < automatonSuccessors.size(); i++) {
      int successor = automatonSuccessors.getInt(i);
      if (automaton.guard(successor).test(labels)) {
        states.add(new ProductState<>(kripkeState, successor));
      }
    }
  }

  @Override
  public Set<ProductState<S>> initialStates() throws PropositionEvaluationException {
    IntList initialNodes = automaton.successors(FormulaAutomaton.INITIAL_STATE);
    Set<ProductState<S>> initialStates = new LinkedHashSet<>();
    for (S initialState : model.initialStates()) {
      addSuccessors(initialStates, initialState, initialNodes);
    }
    return initialStates;
  }

  @Override
  public Set<ProductState<S>> successors(ProductState<S> state) throws PropositionEvaluationException {
    IntList automatonSuccessors = automaton.successors(state.automatonState());
    Set<ProductState<S>> successors = new LinkedHashSet<>();
    for (S kripkeSuccessor : kripkeSuccessors(model, state.kripkeState(), deadlockPolicy)) {
      addSuccessors(successors, kripkeSuccessor, automatonSuccessors);
    }
    return successors;
  }

  @Override
  public int acceptanceSetCount() {
    return automaton.acceptanceSetCount();
  }

  @Override
  public boolean isAccepting(ProductState<S> state, int acceptanceSet) {
    return automaton.isAccepting(state.automatonState(), acceptanceSet);
  }

  public FormulaAutomaton automaton() {
    return automaton;
  }

  public KripkeStructure<S> model() {
    return model;
  }

  public int labelledStates() {
    return labelCache.size();
  }
}
