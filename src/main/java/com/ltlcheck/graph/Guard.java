package com.ltlcheck.graph;

import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import com.ltlcheck.model.PropositionId;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Conjunction of literals labelling an automaton state: every {@code positive} proposition has to
 * be true and every {@code negative} one false.
 */
public record Guard(Set<PropositionId> positive, Set<PropositionId> negative) {
  public static final Guard TRUE = new Guard(Set.of(), Set.of());

  public Guard {
    positive = ImmutableSortedSet.copyOf(positive);
    negative = ImmutableSortedSet.copyOf(negative);
    assert Sets.intersection(positive, negative).isEmpty() : "Contradictory guard";
  }

  public boolean test(Set<PropositionId> labels) {
    return labels.containsAll(positive) && negative.stream().noneMatch(labels::contains);
  }

  public boolean isTrue() {
    return positive.isEmpty() && negative.isEmpty();
  }

  @Override
  public String toString() {
    if (isTrue()) {
      return "true";
    }
    return Stream.concat(positive.stream().map(PropositionId::value), negative.stream().map(id -> "!" + id.value()))
        .collect(Collectors.joining(" & "));
  }
}
