package com.ltlcheck.graph;

import static java.util.Objects.requireNonNull;

import com.ltlcheck.output.DotFormatted;

public record ProductState<S>(S kripkeState, int automatonState) implements DotFormatted {
  public ProductState {
    requireNonNull(kripkeState);
  }

  @Override
  public String toString() {
    return "(%s x %d)".formatted(kripkeState, automatonState);
  }

  @Override
  public String dotString() {
    return "%s x %d".formatted(DotFormatted.toDotString(kripkeState), automatonState);
  }
}
