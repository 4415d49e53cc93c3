package com.ltlcheck.graph;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;

import com.ltlcheck.algorithm.AcceptanceConditionGenerator;
import com.ltlcheck.algorithm.Tableau;
import com.ltlcheck.algorithm.TableauBuilder;
import com.ltlcheck.model.LtlFormula;
import com.ltlcheck.model.LtlFormula.Atomic;
import com.ltlcheck.model.LtlFormula.Not;
import com.ltlcheck.model.Proposition;
import com.ltlcheck.model.PropositionId;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Explicit generalized Büchi automaton of a formula, labelled on states. State {@code 0} is a
 * synthetic initial state without label; tableau node {@code i} is state {@code i + 1}. A
 * transition into a state may only be taken by a letter satisfying the {@link Guard} of that
 * state.
 */
public final class FormulaAutomaton {
  public static final int INITIAL_STATE = 0;

  private final LtlFormula<?> formula;
  private final List<IntList> successors;
  private final List<Guard> guards;
  private final List<String> labels;
  private final List<BitSet> acceptanceSets;

  private FormulaAutomaton(LtlFormula<?> formula, List<IntList> successors, List<Guard> guards, List<String> labels,
      List<BitSet> acceptanceSets) {
    this.formula = formula;
    this.successors = List.copyOf(successors);
    this.guards = List.copyOf(guards);
    this.labels = List.copyOf(labels);
    this.acceptanceSets = acceptanceSets.stream().map(set -> (BitSet) set.clone()).toList();
  }

  /**
   * Automaton accepting exactly the words satisfying {@code formula}.
   */
  public static <P extends Proposition> FormulaAutomaton of(LtlFormula<P> formula) {
    Tableau<P> tableau = TableauBuilder.build(formula);
    return of(tableau, AcceptanceConditionGenerator.acceptanceSets(tableau));
  }

  public static <P extends Proposition> FormulaAutomaton of(Tableau<P> tableau, List<BitSet> nodeAcceptanceSets) {
    int nodeCount = tableau.size();
    List<IntList> successors = new ArrayList<>(nodeCount + 1);
    List<Guard> guards = new ArrayList<>(nodeCount + 1);
    List<String> labels = new ArrayList<>(nodeCount + 1);

    successors.add(shift(tableau.initialNodes()));
    guards.add(Guard.TRUE);
    labels.add("init");
    for (int node = 0; node < nodeCount; node++) {
      List<LtlFormula<P>> formulas = tableau.formulas(node);
      successors.add(shift(tableau.successors(node)));
      guards.add(guard(formulas));
      labels.add(formulas.stream().map(Object::toString).collect(Collectors.joining(", ", "{", "}")));
    }

    List<BitSet> acceptanceSets = new ArrayList<>(nodeAcceptanceSets.size());
    for (BitSet nodeSet : nodeAcceptanceSets) {
      checkArgument(nodeSet.length() <= nodeCount, "Acceptance set refers to unknown nodes");
      BitSet stateSet = new BitSet(nodeCount + 1);
      nodeSet.stream().forEach(node -> stateSet.set(node + 1));
      acceptanceSets.add(stateSet);
    }
    return new FormulaAutomaton(tableau.formula(), successors, guards, labels, acceptanceSets);
  }

  private static IntList shift(IntList nodes) {
    IntList states = new IntArrayList(nodes.size());
    for (int i = 0; i < nodes.size(); i++) {
      states.add(nodes.getInt(i) + 1);
    }
    return IntLists.unmodifiable(states);
  }

  private static <P extends Proposition> Guard guard(List<LtlFormula<P>> formulas) {
    Set<PropositionId> positive = new HashSet<>();
    Set<PropositionId> negative = new HashSet<>();
    for (LtlFormula<P> formula : formulas) {
      if (formula instanceof Atomic<P> atomic) {
        positive.add(atomic.proposition().id());
      } else if (formula instanceof Not<P> not && not.operand() instanceof Atomic<P> atomic) {
        negative.add(atomic.proposition().id());
      }
    }
    return new Guard(positive, negative);
  }

  public LtlFormula<?> formula() {
    return formula;
  }

  public int size() {
    return successors.size();
  }

  public IntList successors(int state) {
    checkElementIndex(state, size());
    return successors.get(state);
  }

  public Guard guard(int state) {
    return guards.get(state);
  }

  /**
   * The formulas holding in a state, for display.
   */
  public String label(int state) {
    return labels.get(state);
  }

  public int acceptanceSetCount() {
    return acceptanceSets.size();
  }

  public boolean isAccepting(int state, int acceptanceSet) {
    return acceptanceSets.get(acceptanceSet).get(state);
  }

  @Override
  public String toString() {
    return "Automaton for %s: %d states, %d acceptance sets".formatted(formula, size(), acceptanceSetCount());
  }
}
