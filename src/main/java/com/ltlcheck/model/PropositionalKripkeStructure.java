package com.ltlcheck.model;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableSet;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Kripke structure over arbitrary state objects whose labeling is obtained by evaluating a fixed
 * list of propositions on each state. Evaluation failures surface from
 * {@link #atomicPropositionsTrue(Object)}.
 */
public final class PropositionalKripkeStructure<S> implements KripkeStructure<S> {
  private final Set<S> initialStates;
  private final Function<S, ? extends Collection<S>> successors;
  private final List<Proposition> propositions;

  public PropositionalKripkeStructure(Collection<S> initialStates, Function<S, ? extends Collection<S>> successors,
      Collection<? extends Proposition> propositions) {
    this.initialStates = ImmutableSet.copyOf(initialStates);
    this.successors = requireNonNull(successors);
    this.propositions = List.copyOf(propositions);
    checkArgument(this.propositions.stream().map(Proposition::id).distinct().count() == this.propositions.size(),
        "Duplicate proposition ids in %s", this.propositions);
  }

  @Override
  public Set<S> initialStates() {
    return initialStates;
  }

  @Override
  public Set<S> successors(S state) {
    return ImmutableSet.copyOf(successors.apply(state));
  }

  @Override
  public Set<PropositionId> atomicPropositionsTrue(S state) throws PropositionEvaluationException {
    EvaluationContext context = StateContext.of(state);
    Set<PropositionId> labels = new HashSet<>();
    for (Proposition proposition : propositions) {
      if (proposition.evaluate(context)) {
        labels.add(proposition.id());
      }
    }
    return labels;
  }

  public List<Proposition> propositions() {
    return propositions;
  }
}
