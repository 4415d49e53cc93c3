package com.ltlcheck.rewriter;

import com.ltlcheck.model.LtlFormula;
import com.ltlcheck.model.LtlFormula.And;
import com.ltlcheck.model.LtlFormula.Atomic;
import com.ltlcheck.model.LtlFormula.BooleanLiteral;
import com.ltlcheck.model.LtlFormula.Eventually;
import com.ltlcheck.model.LtlFormula.Globally;
import com.ltlcheck.model.LtlFormula.Implies;
import com.ltlcheck.model.LtlFormula.Next;
import com.ltlcheck.model.LtlFormula.Not;
import com.ltlcheck.model.LtlFormula.Or;
import com.ltlcheck.model.LtlFormula.Release;
import com.ltlcheck.model.LtlFormula.Until;
import com.ltlcheck.model.LtlFormula.WeakUntil;
import com.ltlcheck.model.Proposition;
import java.util.HashMap;
import java.util.Map;

/**
 * Syntactic simplification: constant folding, double negation, idempotence and absorption of
 * nested temporal operators. Every rule is a language equivalence. Applied until a fixpoint is
 * reached.
 */
public final class Simplifier<P extends Proposition> implements LtlFormula.Visitor<P, LtlFormula<P>> {
  private static final int MAXIMAL_ROUNDS = 64;

  private final Map<LtlFormula<P>, LtlFormula<P>> cache = new HashMap<>();

  public static <P extends Proposition> LtlFormula<P> fixpoint(LtlFormula<P> formula) {
    Simplifier<P> simplifier = new Simplifier<>();
    LtlFormula<P> current = formula;
    for (int round = 0; round < MAXIMAL_ROUNDS; round++) {
      LtlFormula<P> simplified = simplifier.apply(current);
      if (simplified.equals(current)) {
        return simplified;
      }
      current = simplified;
    }
    return current;
  }

  public LtlFormula<P> apply(LtlFormula<P> formula) {
    LtlFormula<P> cached = cache.get(formula);
    if (cached == null) {
      cached = formula.accept(this);
      cache.put(formula, cached);
    }
    return cached;
  }

  private static boolean isTrue(LtlFormula<?> formula) {
    return formula instanceof BooleanLiteral<?> literal && literal.value();
  }

  private static boolean isFalse(LtlFormula<?> formula) {
    return formula instanceof BooleanLiteral<?> literal && !literal.value();
  }

  @Override
  public LtlFormula<P> visit(BooleanLiteral<P> formula) {
    return formula;
  }

  @Override
  public LtlFormula<P> visit(Atomic<P> formula) {
    return formula;
  }

  @Override
  public LtlFormula<P> visit(Not<P> formula) {
    LtlFormula<P> operand = apply(formula.operand());
    if (operand instanceof BooleanLiteral<P> literal) {
      return LtlFormula.of(!literal.value());
    }
    if (operand instanceof Not<P> not) {
      return not.operand();
    }
    return LtlFormula.not(operand);
  }

  @Override
  public LtlFormula<P> visit(And<P> formula) {
    LtlFormula<P> left = apply(formula.left());
    LtlFormula<P> right = apply(formula.right());
    if (isFalse(left) || isFalse(right)) {
      return LtlFormula.of(false);
    }
    if (isTrue(left)) {
      return right;
    }
    if (isTrue(right) || left.equals(right)) {
      return left;
    }
    return LtlFormula.and(left, right);
  }

  @Override
  public LtlFormula<P> visit(Or<P> formula) {
    LtlFormula<P> left = apply(formula.left());
    LtlFormula<P> right = apply(formula.right());
    if (isTrue(left) || isTrue(right)) {
      return LtlFormula.of(true);
    }
    if (isFalse(left)) {
      return right;
    }
    if (isFalse(right) || left.equals(right)) {
      return left;
    }
    return LtlFormula.or(left, right);
  }

  @Override
  public LtlFormula<P> visit(Implies<P> formula) {
    LtlFormula<P> left = apply(formula.left());
    LtlFormula<P> right = apply(formula.right());
    if (isFalse(left) || isTrue(right) || left.equals(right)) {
      return LtlFormula.of(true);
    }
    if (isTrue(left)) {
      return right;
    }
    return LtlFormula.implies(left, right);
  }

  @Override
  public LtlFormula<P> visit(Next<P> formula) {
    LtlFormula<P> operand = apply(formula.operand());
    return operand instanceof BooleanLiteral<P> ? operand : LtlFormula.next(operand);
  }

  @Override
  public LtlFormula<P> visit(Eventually<P> formula) {
    LtlFormula<P> operand = apply(formula.operand());
    if (operand instanceof BooleanLiteral<P> || operand instanceof Eventually<P>) {
      return operand;
    }
    return LtlFormula.eventually(operand);
  }

  @Override
  public LtlFormula<P> visit(Globally<P> formula) {
    LtlFormula<P> operand = apply(formula.operand());
    if (operand instanceof BooleanLiteral<P> || operand instanceof Globally<P>) {
      return operand;
    }
    return LtlFormula.globally(operand);
  }

  @Override
  public LtlFormula<P> visit(Until<P> formula) {
    LtlFormula<P> left = apply(formula.left());
    LtlFormula<P> right = apply(formula.right());
    if (right instanceof BooleanLiteral<P> || isFalse(left) || left.equals(right)) {
      return right;
    }
    if (isTrue(left)) {
      return LtlFormula.eventually(right);
    }
    return LtlFormula.until(left, right);
  }

  @Override
  public LtlFormula<P> visit(WeakUntil<P> formula) {
    LtlFormula<P> left = apply(formula.left());
    LtlFormula<P> right = apply(formula.right());
    if (isTrue(left) || isTrue(right)) {
      return LtlFormula.of(true);
    }
    if (isFalse(left) || left.equals(right)) {
      return right;
    }
    if (isFalse(right)) {
      return LtlFormula.globally(left);
    }
    return LtlFormula.weakUntil(left, right);
  }

  // Literal left operands are kept: false R b and true R b are handled by the acceptance generator.
  @Override
  public LtlFormula<P> visit(Release<P> formula) {
    LtlFormula<P> left = apply(formula.left());
    LtlFormula<P> right = apply(formula.right());
    if (right instanceof BooleanLiteral<P> || left.equals(right)) {
      return right;
    }
    return LtlFormula.release(left, right);
  }
}
