package com.ltlcheck.algorithm;

import com.ltlcheck.model.LtlFormula;
import com.ltlcheck.model.LtlFormula.BooleanLiteral;
import com.ltlcheck.model.LtlFormula.Eventually;
import com.ltlcheck.model.LtlFormula.Release;
import com.ltlcheck.model.LtlFormula.Until;
import com.ltlcheck.model.Proposition;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.function.Predicate;

/**
 * Derives the generalized Büchi acceptance sets of a tableau, one per liveness obligation.
 *
 * <p>For {@code a U b} and {@code F b} a node is accepting if it does not carry the obligation or
 * already satisfies {@code b}; visiting the set infinitely often forbids postponing {@code b}
 * forever. Release is the dual of until and needs no fairness, except for {@code false R b} which
 * is treated like {@code G b}. Without any obligation a single set containing every node is
 * produced.
 */
public final class AcceptanceConditionGenerator {
  private AcceptanceConditionGenerator() {}

  public static <P extends Proposition> List<BitSet> acceptanceSets(Tableau<P> tableau) {
    return acceptanceSets(tableau.nodes(), tableau.obligations(), tableau.arena());
  }

  public static <P extends Proposition> List<BitSet> acceptanceSets(List<TableauNode> nodes,
      List<LtlFormula<P>> obligations, FormulaArena<P> arena) {
    if (obligations.isEmpty()) {
      return List.of(allNodes(nodes));
    }
    List<BitSet> sets = new ArrayList<>(obligations.size());
    for (LtlFormula<P> obligation : obligations) {
      sets.add(acceptanceSet(nodes, obligation, arena));
    }
    return sets;
  }

  private static <P extends Proposition> BitSet acceptanceSet(List<TableauNode> nodes, LtlFormula<P> obligation,
      FormulaArena<P> arena) {
    if (obligation instanceof Until<P> until) {
      return discharged(nodes, obligation, until.right(), arena);
    }
    if (obligation instanceof Eventually<P> eventually) {
      return discharged(nodes, obligation, eventually.operand(), arena);
    }
    if (obligation instanceof Release<P> release) {
      if (release.left() instanceof BooleanLiteral<P> literal && !literal.value()) {
        return discharged(nodes, obligation, release.right(), arena);
      }
      return allNodes(nodes);
    }
    throw new IllegalArgumentException("Not a liveness obligation: " + obligation);
  }

  private static <P extends Proposition> BitSet discharged(List<TableauNode> nodes, LtlFormula<P> obligation,
      LtlFormula<P> goal, FormulaArena<P> arena) {
    int obligationId = arena.lookup(obligation);
    int goalId = arena.lookup(goal);
    return select(nodes, node -> !node.contains(obligationId) || node.contains(goalId));
  }

  private static BitSet allNodes(List<TableauNode> nodes) {
    return select(nodes, node -> true);
  }

  private static BitSet select(List<TableauNode> nodes, Predicate<TableauNode> predicate) {
    BitSet set = new BitSet(nodes.size());
    for (int i = 0; i < nodes.size(); i++) {
      if (predicate.test(nodes.get(i))) {
        set.set(i);
      }
    }
    return set;
  }
}
