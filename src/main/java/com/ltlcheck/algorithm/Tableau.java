package com.ltlcheck.algorithm;

import com.ltlcheck.model.LtlFormula;
import com.ltlcheck.model.Proposition;
import it.unimi.dsi.fastutil.ints.IntList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of expanding a formula: the reachable, consistent tableau nodes, the nodes satisfying the
 * formula in the first step, the successor relation between nodes and the liveness obligations in
 * order of discovery.
 */
public final class Tableau<P extends Proposition> {
  private final LtlFormula<P> formula;
  private final FormulaArena<P> arena;
  private final List<TableauNode> nodes;
  private final IntList initialNodes;
  private final List<IntList> successors;
  private final List<LtlFormula<P>> obligations;

  Tableau(LtlFormula<P> formula, FormulaArena<P> arena, List<TableauNode> nodes, IntList initialNodes,
      List<IntList> successors, List<LtlFormula<P>> obligations) {
    assert nodes.size() == successors.size();
    this.formula = formula;
    this.arena = arena;
    this.nodes = List.copyOf(nodes);
    this.initialNodes = initialNodes;
    this.successors = List.copyOf(successors);
    this.obligations = List.copyOf(obligations);
  }

  /**
   * The expanded formula after rewriting.
   */
  public LtlFormula<P> formula() {
    return formula;
  }

  public FormulaArena<P> arena() {
    return arena;
  }

  public List<TableauNode> nodes() {
    return nodes;
  }

  public int size() {
    return nodes.size();
  }

  public IntList initialNodes() {
    return initialNodes;
  }

  public IntList successors(int node) {
    return successors.get(node);
  }

  public List<LtlFormula<P>> obligations() {
    return obligations;
  }

  public boolean contains(int node, LtlFormula<P> formula) {
    return nodes.get(node).contains(arena.lookup(formula));
  }

  public List<LtlFormula<P>> formulas(int node) {
    return nodes.get(node).current().mapToObj(arena::formula).toList();
  }

  @Override
  public String toString() {
    return "Tableau for %s with %d nodes, obligations %s".formatted(formula, nodes.size(),
        obligations.stream().map(Object::toString).collect(Collectors.joining(", ", "[", "]")));
  }
}
