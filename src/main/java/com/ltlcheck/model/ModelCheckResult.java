package com.ltlcheck.model;

import static java.util.Objects.requireNonNull;

import java.util.Optional;

/**
 * Verdict of a model checking run. A violated property is a regular result carrying a
 * {@link Counterexample}, not an exception.
 */
public sealed interface ModelCheckResult<S> {
  static <S> ModelCheckResult<S> satisfied() {
    return new Holds<>();
  }

  static <S> ModelCheckResult<S> violated(Counterexample<S> counterexample) {
    return new Fails<>(counterexample);
  }

  boolean holds();

  Optional<Counterexample<S>> counterexample();

  record Holds<S>() implements ModelCheckResult<S> {
    @Override
    public boolean holds() {
      return true;
    }

    @Override
    public Optional<Counterexample<S>> counterexample() {
      return Optional.empty();
    }

    @Override
    public String toString() {
      return "holds";
    }
  }

  record Fails<S>(Counterexample<S> witness) implements ModelCheckResult<S> {
    public Fails {
      requireNonNull(witness);
    }

    @Override
    public boolean holds() {
      return false;
    }

    @Override
    public Optional<Counterexample<S>> counterexample() {
      return Optional.of(witness);
    }

    @Override
    public String toString() {
      return "fails: " + witness.infinitePathDescription();
    }
  }
}
