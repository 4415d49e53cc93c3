package com.ltlcheck.algorithm;

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
import com.ltlcheck.rewriter.NegationNormalForm;
import com.ltlcheck.rewriter.Simplifier;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import it.unimi.dsi.fastutil.ints.IntSet;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Expands a formula into its tableau.
 *
 * <p>The formula is brought into negation normal form and simplified, then expanded node by node:
 * conjunctions are split, disjunctions branch, and temporal operators are unfolded into a
 * condition on the current step and an obligation for the next one
 * ({@code a U b = b | (a & X(a U b))}, {@code F a = a | X F a}, {@code G a = a & X G a},
 * {@code a R b = b & (a | X(a R b))}). Weak until is rewritten to {@code (a U b) | G a}.
 * Branches containing {@code false} or a complementary pair of literals are dropped. Every until
 * and eventually formula met on the way is a liveness obligation.
 *
 * <p>Nodes are deduplicated structurally and the expansion of an obligation set is computed only
 * once, so the number of nodes depends on the formula alone.
 */
public final class TableauBuilder<P extends Proposition> {
  private static final Logger log = Logger.getLogger(TableauBuilder.class.getName());

  private final FormulaArena<P> arena = new FormulaArena<>();
  private final NegationNormalForm<P> normalForm = new NegationNormalForm<>();
  private final Map<WeakUntil<P>, LtlFormula<P>> weakUntilExpansions = new HashMap<>();
  private final IntSet obligations = new IntLinkedOpenHashSet();

  private final List<TableauNode> nodes = new ArrayList<>();
  private final Map<TableauNode, Integer> nodeIndices = new HashMap<>();
  private final Map<BitSet, IntList> expansions = new HashMap<>();

  private TableauBuilder() {}

  /**
   * Builds the tableau of {@code formula}. To check a property, pass its negation.
   */
  public static <P extends Proposition> Tableau<P> build(LtlFormula<P> formula) {
    return new TableauBuilder<P>().tableau(formula);
  }

  private Tableau<P> tableau(LtlFormula<P> formula) {
    LtlFormula<P> root = Simplifier.fixpoint(normalForm.apply(formula));
    log.log(Level.FINE, () -> "Expanding %s (rewritten from %s)".formatted(root, formula));

    BitSet seed = new BitSet();
    seed.set(arena.intern(root));
    IntList initialNodes = expand(seed);

    List<IntList> successors = new ArrayList<>();
    for (int node = 0; node < nodes.size(); node++) {
      successors.add(expand(nodes.get(node).nextSet()));
    }

    List<LtlFormula<P>> obligationFormulas = obligations.intStream().mapToObj(arena::formula).toList();
    Tableau<P> tableau = new Tableau<>(root, arena, nodes, initialNodes, successors, obligationFormulas);
    log.log(Level.FINE, tableau::toString);
    return tableau;
  }

  private IntList expand(BitSet formulas) {
    IntList cached = expansions.get(formulas);
    if (cached != null) {
      return cached;
    }

    Set<TableauNode> expanded = new LinkedHashSet<>();
    Deque<Branch> pending = new ArrayDeque<>();
    pending.push(new Branch((BitSet) formulas.clone(), new BitSet(), new BitSet()));
    Expander expander = new Expander(pending);
    while (!pending.isEmpty()) {
      Branch branch = pending.pop();
      boolean consistent = true;
      while (consistent && !branch.todo.isEmpty()) {
        int id = branch.todo.nextSetBit(0);
        branch.todo.clear(id);
        if (!branch.current.get(id)) {
          consistent = expander.expand(branch, id);
        }
      }
      if (consistent) {
        expanded.add(new TableauNode(branch.current, branch.next));
      }
    }

    IntList indices = new IntArrayList(expanded.size());
    for (TableauNode node : expanded) {
      Integer index = nodeIndices.get(node);
      if (index == null) {
        index = nodes.size();
        nodes.add(node);
        nodeIndices.put(node, index);
      }
      indices.add(index.intValue());
    }
    IntList result = IntLists.unmodifiable(indices);
    expansions.put((BitSet) formulas.clone(), result);
    return result;
  }

  private LtlFormula<P> expandWeakUntil(WeakUntil<P> formula) {
    return weakUntilExpansions.computeIfAbsent(formula, weakUntil -> LtlFormula.or(
        LtlFormula.until(weakUntil.left(), weakUntil.right()), LtlFormula.globally(weakUntil.left())));
  }

  private static final class Branch {
    final BitSet todo;
    final BitSet current;
    final BitSet next;

    Branch(BitSet todo, BitSet current, BitSet next) {
      this.todo = todo;
      this.current = current;
      this.next = next;
    }

    Branch copy() {
      return new Branch((BitSet) todo.clone(), (BitSet) current.clone(), (BitSet) next.clone());
    }
  }

  /**
   * Expands a single formula of a branch. Returns {@code false} if the branch became
   * inconsistent; alternatives are pushed as new branches.
   */
  private final class Expander implements LtlFormula.Visitor<P, Boolean> {
    private final Deque<Branch> pending;
    private Branch branch;
    private int id;

    Expander(Deque<Branch> pending) {
      this.pending = pending;
    }

    boolean expand(Branch branch, int id) {
      this.branch = branch;
      this.id = id;
      boolean consistent = arena.formula(id).accept(this);
      if (consistent) {
        branch.current.set(id);
      }
      return consistent;
    }

    private void now(LtlFormula<P> formula) {
      branch.todo.set(arena.intern(formula));
    }

    private Branch alternative() {
      Branch alternative = branch.copy();
      alternative.current.set(id);
      pending.push(alternative);
      return alternative;
    }

    private boolean consistentWith(LtlFormula<P> complement) {
      int complementId = arena.lookup(complement);
      return complementId == -1 || !branch.current.get(complementId);
    }

    @Override
    public Boolean visit(BooleanLiteral<P> formula) {
      return formula.value();
    }

    @Override
    public Boolean visit(Atomic<P> formula) {
      return consistentWith(LtlFormula.not(formula));
    }

    @Override
    public Boolean visit(Not<P> formula) {
      if (formula.operand() instanceof Atomic<P>) {
        return consistentWith(formula.operand());
      }
      now(normalForm.negate(formula.operand()));
      return true;
    }

    @Override
    public Boolean visit(And<P> formula) {
      now(formula.left());
      now(formula.right());
      return true;
    }

    @Override
    public Boolean visit(Or<P> formula) {
      alternative().todo.set(arena.intern(formula.right()));
      now(formula.left());
      return true;
    }

    @Override
    public Boolean visit(Implies<P> formula) {
      now(normalForm.apply(formula));
      return true;
    }

    @Override
    public Boolean visit(Next<P> formula) {
      branch.next.set(arena.intern(formula.operand()));
      return true;
    }

    @Override
    public Boolean visit(Eventually<P> formula) {
      obligations.add(id);
      alternative().next.set(id);
      now(formula.operand());
      return true;
    }

    @Override
    public Boolean visit(Globally<P> formula) {
      now(formula.operand());
      branch.next.set(id);
      return true;
    }

    @Override
    public Boolean visit(Until<P> formula) {
      obligations.add(id);
      Branch postponed = alternative();
      postponed.todo.set(arena.intern(formula.left()));
      postponed.next.set(id);
      now(formula.right());
      return true;
    }

    @Override
    public Boolean visit(WeakUntil<P> formula) {
      now(expandWeakUntil(formula));
      return true;
    }

    @Override
    public Boolean visit(Release<P> formula) {
      Branch postponed = alternative();
      postponed.todo.set(arena.intern(formula.right()));
      postponed.next.set(id);
      now(formula.left());
      now(formula.right());
      return true;
    }
  }
}
