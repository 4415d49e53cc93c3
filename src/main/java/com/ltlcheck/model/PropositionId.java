package com.ltlcheck.model;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CharMatcher;

/**
 * Stable identity of an atomic proposition. Two propositions with the same id are the same
 * proposition as far as formulas and Kripke labelings are concerned.
 */
public record PropositionId(String value) implements Comparable<PropositionId> {
  private static final CharMatcher VALID_CHARACTERS = CharMatcher.inRange('a', 'z')
      .or(CharMatcher.inRange('A', 'Z'))
      .or(CharMatcher.inRange('0', '9'))
      .or(CharMatcher.anyOf("_-."))
      .precomputed();

  public PropositionId {
    checkArgument(value != null && !value.isEmpty(), "Proposition id cannot be empty");
    checkArgument(CharMatcher.whitespace().matchesNoneOf(value),
        "Proposition id %s contains whitespace", value);
    checkArgument(VALID_CHARACTERS.matchesAllOf(value),
        "Proposition id %s contains invalid characters: %s", value, VALID_CHARACTERS.removeFrom(value));
  }

  public static PropositionId of(String value) {
    return new PropositionId(value);
  }

  public static boolean isValid(String value) {
    return value != null && !value.isEmpty() && VALID_CHARACTERS.matchesAllOf(value);
  }

  @Override
  public int compareTo(PropositionId o) {
    return value.compareTo(o.value);
  }

  @Override
  public String toString() {
    return value;
  }
}
