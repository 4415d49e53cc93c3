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
 * Pushes negations down to atomic propositions and removes implications. The result only
 * contains literals, {@code &}, {@code |}, {@code X}, {@code F}, {@code G}, {@code U}, {@code W}
 * and {@code R}.
 *
 * <p>Results are memoized per distinct subformula, so one instance should be reused for all
 * rewrites belonging to the same formula.
 */
public final class NegationNormalForm<P extends Proposition> {
  private final Map<LtlFormula<P>, LtlFormula<P>> positiveCache = new HashMap<>();
  private final Map<LtlFormula<P>, LtlFormula<P>> negativeCache = new HashMap<>();
  private final Positive positive = new Positive();
  private final Negative negative = new Negative();

  public static <P extends Proposition> LtlFormula<P> of(LtlFormula<P> formula) {
    return new NegationNormalForm<P>().apply(formula);
  }

  public static boolean isNegationNormalForm(LtlFormula<?> formula) {
    return formula.subformulas().stream().allMatch(subformula -> !(subformula instanceof Implies<?>)
        && (!(subformula instanceof Not<?> not) || not.operand() instanceof Atomic<?>));
  }

  public LtlFormula<P> apply(LtlFormula<P> formula) {
    LtlFormula<P> cached = positiveCache.get(formula);
    if (cached == null) {
      cached = formula.accept(positive);
      positiveCache.put(formula, cached);
    }
    return cached;
  }

  /**
   * Negation normal form of {@code !formula}.
   */
  public LtlFormula<P> negate(LtlFormula<P> formula) {
    LtlFormula<P> cached = negativeCache.get(formula);
    if (cached == null) {
      cached = formula.accept(negative);
      negativeCache.put(formula, cached);
    }
    return cached;
  }

  private final class Positive implements LtlFormula.Visitor<P, LtlFormula<P>> {
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
      return negate(formula.operand());
    }

    @Override
    public LtlFormula<P> visit(And<P> formula) {
      return LtlFormula.and(apply(formula.left()), apply(formula.right()));
    }

    @Override
    public LtlFormula<P> visit(Or<P> formula) {
      return LtlFormula.or(apply(formula.left()), apply(formula.right()));
    }

    @Override
    public LtlFormula<P> visit(Implies<P> formula) {
      return LtlFormula.or(negate(formula.left()), apply(formula.right()));
    }

    @Override
    public LtlFormula<P> visit(Next<P> formula) {
      return LtlFormula.next(apply(formula.operand()));
    }

    @Override
    public LtlFormula<P> visit(Eventually<P> formula) {
      return LtlFormula.eventually(apply(formula.operand()));
    }

    @Override
    public LtlFormula<P> visit(Globally<P> formula) {
      return LtlFormula.globally(apply(formula.operand()));
    }

    @Override
    public LtlFormula<P> visit(Until<P> formula) {
      return LtlFormula.until(apply(formula.left()), apply(formula.right()));
    }

    @Override
    public LtlFormula<P> visit(WeakUntil<P> formula) {
      return LtlFormula.weakUntil(apply(formula.left()), apply(formula.right()));
    }

    @Override
    public LtlFormula<P> visit(Release<P> formula) {
      return LtlFormula.release(apply(formula.left()), apply(formula.right()));
    }
  }

  private final class Negative implements LtlFormula.Visitor<P, LtlFormula<P>> {
    @Override
    public LtlFormula<P> visit(BooleanLiteral<P> formula) {
      return LtlFormula.of(!formula.value());
    }

    @Override
    public LtlFormula<P> visit(Atomic<P> formula) {
      return LtlFormula.not(formula);
    }

    @Override
    public LtlFormula<P> visit(Not<P> formula) {
      return apply(formula.operand());
    }

    @Override
    public LtlFormula<P> visit(And<P> formula) {
      return LtlFormula.or(negate(formula.left()), negate(formula.right()));
    }

    @Override
    public LtlFormula<P> visit(Or<P> formula) {
      return LtlFormula.and(negate(formula.left()), negate(formula.right()));
    }

    @Override
    public LtlFormula<P> visit(Implies<P> formula) {
      return LtlFormula.and(apply(formula.left()), negate(formula.right()));
    }

    @Override
    public LtlFormula<P> visit(Next<P> formula) {
      return LtlFormula.next(negate(formula.operand()));
    }

    @Override
    public LtlFormula<P> visit(Eventually<P> formula) {
      return LtlFormula.globally(negate(formula.operand()));
    }

    @Override
    public LtlFormula<P> visit(Globally<P> formula) {
      return LtlFormula.eventually(negate(formula.operand()));
    }

    // !(a U b) = !a R !b
    @Override
    public LtlFormula<P> visit(Until<P> formula) {
      return LtlFormula.release(negate(formula.left()), negate(formula.right()));
    }

    // !(a W b) = !b U (!a & !b)
    @Override
    public LtlFormula<P> visit(WeakUntil<P> formula) {
      LtlFormula<P> negatedRight = negate(formula.right());
      return LtlFormula.until(negatedRight, LtlFormula.and(negate(formula.left()), negatedRight));
    }

    @Override
    public LtlFormula<P> visit(Release<P> formula) {
      return LtlFormula.until(negate(formula.left()), negate(formula.right()));
    }
  }
}
