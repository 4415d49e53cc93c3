package com.ltlcheck.model;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.SetMultimap;
import java.util.Arrays;
import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

public final class ExplicitKripkeStructure<S> implements KripkeStructure<S> {
  private final Set<S> states;
  private final Set<S> initialStates;
  private final SetMultimap<S, S> transitions;
  private final SetMultimap<S, PropositionId> labels;

  private ExplicitKripkeStructure(Set<S> states, Set<S> initialStates, SetMultimap<S, S> transitions,
      SetMultimap<S, PropositionId> labels) {
    checkArgument(states.containsAll(initialStates), "Undeclared initial states %s",
        initialStates.stream().filter(s -> !states.contains(s)).collect(Collectors.toSet()));
    checkArgument(states.containsAll(transitions.keySet()) && states.containsAll(transitions.values()),
        "Transitions refer to undeclared states");
    checkArgument(states.containsAll(labels.keySet()), "Labels refer to undeclared states");

    this.states = ImmutableSet.copyOf(states);
    this.initialStates = ImmutableSet.copyOf(initialStates);
    this.transitions = ImmutableSetMultimap.copyOf(transitions);
    this.labels = ImmutableSetMultimap.copyOf(labels);
  }

  public static <S> Builder<S> builder() {
    return new Builder<>();
  }

  public Set<S> states() {
    return states;
  }

  @Override
  public Set<S> initialStates() {
    return initialStates;
  }

  @Override
  public Set<S> successors(S state) {
    return transitions.get(state);
  }

  @Override
  public Set<PropositionId> atomicPropositionsTrue(S state) {
    return labels.get(state);
  }

  @Override
  public String toString() {
    return states.stream()
        .map(s -> "%s%s %s -> %s".formatted(initialStates.contains(s) ? ">" : "", s, labels.get(s), transitions.get(s)))
        .collect(Collectors.joining(", ", "{", "}"));
  }

  public static final class Builder<S> {
    private final ImmutableSet.Builder<S> states = ImmutableSet.builder();
    private final ImmutableSet.Builder<S> initialStates = ImmutableSet.builder();
    private final ImmutableSetMultimap.Builder<S, S> transitions = ImmutableSetMultimap.builder();
    private final ImmutableSetMultimap.Builder<S, PropositionId> labels = ImmutableSetMultimap.builder();

    private Builder() {}

    public Builder<S> state(S state) {
      states.add(state);
      return this;
    }

    /**
     * Declares an initial state.
     */
    public Builder<S> initial(S state) {
      states.add(state);
      initialStates.add(state);
      return this;
    }

    public Builder<S> transition(S from, S to) {
      states.add(from, to);
      transitions.put(from, to);
      return this;
    }

    @SafeVarargs
    public final Builder<S> transitions(S from, S... to) {
      states.add(from);
      states.add(to);
      transitions.putAll(from, Arrays.asList(to));
      return this;
    }

    public Builder<S> label(S state, Collection<PropositionId> propositions) {
      states.add(state);
      labels.putAll(state, propositions);
      return this;
    }

    public Builder<S> label(S state, String... propositions) {
      return label(state, Arrays.stream(propositions).map(PropositionId::of).toList());
    }

    public ExplicitKripkeStructure<S> build() {
      return new ExplicitKripkeStructure<>(states.build(), initialStates.build(), transitions.build(), labels.build());
    }
  }
}
