package com.ltlcheck.model;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A lasso-shaped infinite path of a model: the {@code prefix} is followed once, then the
 * {@code cycle} repeats forever. The last cycle state moves back to the first one; the first
 * cycle state is not repeated at the end.
 */
public record Counterexample<S>(List<S> prefix, List<S> cycle) {
  public Counterexample {
    checkArgument(!cycle.isEmpty(), "Counterexample cycle must not be empty");
    prefix = List.copyOf(prefix);
    cycle = List.copyOf(cycle);
  }

  public Stream<S> transientStates() {
    return prefix.stream();
  }

  public Stream<S> loopStates(boolean withClosingState) {
    return withClosingState ? Stream.concat(cycle.stream(), Stream.of(cycle.get(0))) : cycle.stream();
  }

  public Stream<S> states(boolean withClosingState) {
    return Stream.concat(transientStates(), loopStates(withClosingState));
  }

  public int size() {
    return prefix.size() + cycle.size();
  }

  public <T> Counterexample<T> map(Function<? super S, ? extends T> function) {
    return new Counterexample<>(
        prefix.stream().<T>map(function).toList(),
        cycle.stream().<T>map(function).toList());
  }

  /**
   * Renders the path as {@code s0 -> s1 -> (s2 -> s3)∞}.
   */
  public String infinitePathDescription() {
    String cycleString = cycle.stream().map(String::valueOf).collect(Collectors.joining(" -> ", "(", ")∞"));
    if (prefix.isEmpty()) {
      return cycleString;
    }
    return prefix.stream().map(String::valueOf).collect(Collectors.joining(" -> ")) + " -> " + cycleString;
  }

  @Override
  public String toString() {
    return infinitePathDescription();
  }
}
