package com.ltlcheck.model;

import static java.util.Objects.requireNonNull;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Immutable linear temporal logic formula over atomic propositions of type {@code P}.
 *
 * <p>The set of operators is closed. Consumers dispatch through {@link Visitor}, so adding an
 * operator fails to compile wherever it is not handled. Equality is structural; atomic
 * propositions are compared by their {@link PropositionId}.
 */
public sealed interface LtlFormula<P extends Proposition> {
  interface Visitor<P extends Proposition, R> {
    R visit(BooleanLiteral<P> formula);

    R visit(Atomic<P> formula);

    R visit(Not<P> formula);

    R visit(And<P> formula);

    R visit(Or<P> formula);

    R visit(Implies<P> formula);

    R visit(Next<P> formula);

    R visit(Eventually<P> formula);

    R visit(Globally<P> formula);

    R visit(Until<P> formula);

    R visit(WeakUntil<P> formula);

    R visit(Release<P> formula);
  }

  <R> R accept(Visitor<P, R> visitor);

  /**
   * Direct subformulas, left to right.
   */
  Stream<LtlFormula<P>> children();

  default boolean isAtomic() {
    return this instanceof Atomic<P> || this instanceof BooleanLiteral<P>;
  }

  /**
   * All distinct subformulas including this one, in pre-order.
   */
  default Set<LtlFormula<P>> subformulas() {
    Set<LtlFormula<P>> subformulas = new LinkedHashSet<>();
    Deque<LtlFormula<P>> stack = new ArrayDeque<>();
    stack.push(this);
    while (!stack.isEmpty()) {
      LtlFormula<P> current = stack.pop();
      if (subformulas.add(current)) {
        var children = current.children().toList();
        for (int i = children.size() - 1; i >= 0; i--) {
          stack.push(children.get(i));
        }
      }
    }
    return subformulas;
  }

  /**
   * The atomic propositions of this formula, by order of first occurrence.
   */
  default Set<P> propositions() {
    Map<PropositionId, P> propositions = new LinkedHashMap<>();
    for (LtlFormula<P> subformula : subformulas()) {
      if (subformula instanceof Atomic<P> atomic) {
        propositions.putIfAbsent(atomic.proposition().id(), atomic.proposition());
      }
    }
    return new LinkedHashSet<>(propositions.values());
  }

  static <P extends Proposition> LtlFormula<P> of(boolean value) {
    return new BooleanLiteral<>(value);
  }

  static <P extends Proposition> LtlFormula<P> atomic(P proposition) {
    return new Atomic<>(proposition);
  }

  static <P extends Proposition> LtlFormula<P> not(LtlFormula<P> operand) {
    return new Not<>(operand);
  }

  static <P extends Proposition> LtlFormula<P> and(LtlFormula<P> left, LtlFormula<P> right) {
    return new And<>(left, right);
  }

  static <P extends Proposition> LtlFormula<P> or(LtlFormula<P> left, LtlFormula<P> right) {
    return new Or<>(left, right);
  }

  static <P extends Proposition> LtlFormula<P> implies(LtlFormula<P> left, LtlFormula<P> right) {
    return new Implies<>(left, right);
  }

  static <P extends Proposition> LtlFormula<P> next(LtlFormula<P> operand) {
    return new Next<>(operand);
  }

  static <P extends Proposition> LtlFormula<P> eventually(LtlFormula<P> operand) {
    return new Eventually<>(operand);
  }

  static <P extends Proposition> LtlFormula<P> globally(LtlFormula<P> operand) {
    return new Globally<>(operand);
  }

  static <P extends Proposition> LtlFormula<P> until(LtlFormula<P> left, LtlFormula<P> right) {
    return new Until<>(left, right);
  }

  static <P extends Proposition> LtlFormula<P> weakUntil(LtlFormula<P> left, LtlFormula<P> right) {
    return new WeakUntil<>(left, right);
  }

  static <P extends Proposition> LtlFormula<P> release(LtlFormula<P> left, LtlFormula<P> right) {
    return new Release<>(left, right);
  }

  record BooleanLiteral<P extends Proposition>(boolean value) implements LtlFormula<P> {
    @Override
    public <R> R accept(Visitor<P, R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Stream<LtlFormula<P>> children() {
      return Stream.empty();
    }

    @Override
    public String toString() {
      return value ? "true" : "false";
    }
  }

  record Atomic<P extends Proposition>(P proposition) implements LtlFormula<P> {
    public Atomic {
      requireNonNull(proposition);
    }

    @Override
    public <R> R accept(Visitor<P, R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Stream<LtlFormula<P>> children() {
      return Stream.empty();
    }

    @Override
    public boolean equals(Object obj) {
      return this == obj || (obj instanceof Atomic<?> that && proposition.id().equals(that.proposition.id()));
    }

    @Override
    public int hashCode() {
      return proposition.id().hashCode();
    }

    @Override
    public String toString() {
      return proposition.id().value();
    }
  }

  record Not<P extends Proposition>(LtlFormula<P> operand) implements LtlFormula<P> {
    public Not {
      requireNonNull(operand);
    }

    @Override
    public <R> R accept(Visitor<P, R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Stream<LtlFormula<P>> children() {
      return Stream.of(operand);
    }

    @Override
    public String toString() {
      return "!" + operand;
    }
  }

  record And<P extends Proposition>(LtlFormula<P> left, LtlFormula<P> right) implements LtlFormula<P> {
    public And {
      requireNonNull(left);
      requireNonNull(right);
    }

    @Override
    public <R> R accept(Visitor<P, R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Stream<LtlFormula<P>> children() {
      return Stream.of(left, right);
    }

    @Override
    public String toString() {
      return "(%s & %s)".formatted(left, right);
    }
  }

  record Or<P extends Proposition>(LtlFormula<P> left, LtlFormula<P> right) implements LtlFormula<P> {
    public Or {
      requireNonNull(left);
      requireNonNull(right);
    }

    @Override
    public <R> R accept(Visitor<P, R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Stream<LtlFormula<P>> children() {
      return Stream.of(left, right);
    }

    @Override
    public String toString() {
      return "(%s | %s)".formatted(left, right);
    }
  }

  record Implies<P extends Proposition>(LtlFormula<P> left, LtlFormula<P> right) implements LtlFormula<P> {
    public Implies {
      requireNonNull(left);
      requireNonNull(right);
    }

    @Override
    public <R> R accept(Visitor<P, R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Stream<LtlFormula<P>> children() {
      return Stream.of(left, right);
    }

    @Override
    public String toString() {
      return "(%s -> %s)".formatted(left, right);
    }
  }

  record Next<P extends Proposition>(LtlFormula<P> operand) implements LtlFormula<P> {
    public Next {
      requireNonNull(operand);
    }

    @Override
    public <R> R accept(Visitor<P, R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Stream<LtlFormula<P>> children() {
      return Stream.of(operand);
    }

    @Override
    public String toString() {
      return "X " + operand;
    }
  }

  record Eventually<P extends Proposition>(LtlFormula<P> operand) implements LtlFormula<P> {
    public Eventually {
      requireNonNull(operand);
    }

    @Override
    public <R> R accept(Visitor<P, R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Stream<LtlFormula<P>> children() {
      return Stream.of(operand);
    }

    @Override
    public String toString() {
      return "F " + operand;
    }
  }

  record Globally<P extends Proposition>(LtlFormula<P> operand) implements LtlFormula<P> {
    public Globally {
      requireNonNull(operand);
    }

    @Override
    public <R> R accept(Visitor<P, R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Stream<LtlFormula<P>> children() {
      return Stream.of(operand);
    }

    @Override
    public String toString() {
      return "G " + operand;
    }
  }

  record Until<P extends Proposition>(LtlFormula<P> left, LtlFormula<P> right) implements LtlFormula<P> {
    public Until {
      requireNonNull(left);
      requireNonNull(right);
    }

    @Override
    public <R> R accept(Visitor<P, R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Stream<LtlFormula<P>> children() {
      return Stream.of(left, right);
    }

    @Override
    public String toString() {
      return "(%s U %s)".formatted(left, right);
    }
  }

  /**
   * {@code a W b}, equivalent to {@code (a U b) | G a}.
   */
  record WeakUntil<P extends Proposition>(LtlFormula<P> left, LtlFormula<P> right) implements LtlFormula<P> {
    public WeakUntil {
      requireNonNull(left);
      requireNonNull(right);
    }

    @Override
    public <R> R accept(Visitor<P, R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Stream<LtlFormula<P>> children() {
      return Stream.of(left, right);
    }

    @Override
    public String toString() {
      return "(%s W %s)".formatted(left, right);
    }
  }

  /**
   * {@code a R b}, equivalent to {@code !(!a U !b)}.
   */
  record Release<P extends Proposition>(LtlFormula<P> left, LtlFormula<P> right) implements LtlFormula<P> {
    public Release {
      requireNonNull(left);
      requireNonNull(right);
    }

    @Override
    public <R> R accept(Visitor<P, R> visitor) {
      return visitor.visit(this);
    }

    @Override
    public Stream<LtlFormula<P>> children() {
      return Stream.of(left, right);
    }

    @Override
    public String toString() {
      return "(%s R %s)".formatted(left, right);
    }
  }
}
