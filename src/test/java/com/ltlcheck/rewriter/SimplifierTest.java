package com.ltlcheck.rewriter;

import static com.ltlcheck.model.LtlFormula.and;
import static com.ltlcheck.model.LtlFormula.atomic;
import static com.ltlcheck.model.LtlFormula.eventually;
import static com.ltlcheck.model.LtlFormula.globally;
import static com.ltlcheck.model.LtlFormula.implies;
import static com.ltlcheck.model.LtlFormula.next;
import static com.ltlcheck.model.LtlFormula.not;
import static com.ltlcheck.model.LtlFormula.or;
import static com.ltlcheck.model.LtlFormula.release;
import static com.ltlcheck.model.LtlFormula.until;
import static com.ltlcheck.model.LtlFormula.weakUntil;
import static org.junit.Assert.assertEquals;

import com.ltlcheck.model.LtlFormula;
import com.ltlcheck.model.NamedProposition;
import org.junit.Test;

public class SimplifierTest {
  private static final LtlFormula<NamedProposition> p = atomic(NamedProposition.of("p"));
  private static final LtlFormula<NamedProposition> q = atomic(NamedProposition.of("q"));
  private static final LtlFormula<NamedProposition> tt = LtlFormula.of(true);
  private static final LtlFormula<NamedProposition> ff = LtlFormula.of(false);

  private static LtlFormula<NamedProposition> simplify(LtlFormula<NamedProposition> formula) {
    return Simplifier.fixpoint(formula);
  }

  @Test
  public void foldsBooleanConstants() {
    assertEquals(p, simplify(and(tt, p)));
    assertEquals(ff, simplify(and(p, ff)));
    assertEquals(tt, simplify(or(p, tt)));
    assertEquals(q, simplify(or(ff, q)));
    assertEquals(ff, simplify(not(tt)));
    assertEquals(tt, simplify(implies(ff, p)));
    assertEquals(p, simplify(and(p, p)));
  }

  @Test
  public void foldsTemporalConstants() {
    assertEquals(tt, simplify(next(tt)));
    assertEquals(ff, simplify(eventually(ff)));
    assertEquals(tt, simplify(globally(tt)));
    assertEquals(tt, simplify(until(p, tt)));
    assertEquals(ff, simplify(until(p, ff)));
    assertEquals(q, simplify(until(ff, q)));
    assertEquals(eventually(q), simplify(until(tt, q)));
    assertEquals(tt, simplify(release(p, tt)));
    assertEquals(ff, simplify(release(p, ff)));
    assertEquals(tt, simplify(weakUntil(p, tt)));
    assertEquals(globally(p), simplify(weakUntil(p, ff)));
  }

  @Test
  public void keepsReleaseWithConstantLeftOperand() {
    assertEquals(release(ff, q), simplify(release(ff, q)));
    assertEquals(release(tt, q), simplify(release(tt, q)));
  }

  @Test
  public void removesIdempotentOperators() {
    assertEquals(eventually(p), simplify(eventually(eventually(p))));
    assertEquals(globally(p), simplify(globally(globally(p))));
    assertEquals(p, simplify(until(p, p)));
    assertEquals(p, simplify(not(not(p))));
  }

  @Test
  public void reachesFixpoint() {
    assertEquals(globally(eventually(q)), simplify(globally(or(ff, until(and(tt, tt), eventually(q))))));
    assertEquals(globally(p), simplify(and(globally(p), next(tt))));
  }
}
