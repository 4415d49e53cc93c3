package com.ltlcheck.algorithm;

import java.util.BitSet;
import java.util.stream.IntStream;

/**
 * A fully expanded tableau node: the formulas holding in the current step and the obligations
 * passed on to the next step, both as sets of {@link FormulaArena} ids. Identity is the pair of
 * sets.
 */
public final class TableauNode {
  private final BitSet current;
  private final BitSet next;
  private final int hashCode;

  TableauNode(BitSet current, BitSet next) {
    this.current = (BitSet) current.clone();
    this.next = (BitSet) next.clone();
    this.hashCode = 31 * this.current.hashCode() + this.next.hashCode();
  }

  public boolean contains(int formulaId) {
    return formulaId >= 0 && current.get(formulaId);
  }

  public boolean obliges(int formulaId) {
    return formulaId >= 0 && next.get(formulaId);
  }

  public IntStream current() {
    return current.stream();
  }

  public IntStream next() {
    return next.stream();
  }

  BitSet nextSet() {
    return (BitSet) next.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TableauNode that)) {
      return false;
    }
    return hashCode == that.hashCode && current.equals(that.current) && next.equals(that.next);
  }

  @Override
  public int hashCode() {
    return hashCode;
  }

  @Override
  public String toString() {
    return current + " / " + next;
  }
}
