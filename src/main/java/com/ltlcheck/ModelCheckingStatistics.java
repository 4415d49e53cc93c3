package com.ltlcheck;

import java.time.Duration;

/**
 * Size and timing figures of a single model checking run.
 *
 * @param tableauNodes nodes of the tableau of the negated formula
 * @param acceptanceSets generalized Büchi acceptance sets of the automaton
 * @param outerStates pairs of product state and acceptance counter visited by the outer search
 * @param innerStates pairs visited by the inner searches
 * @param transitions product transitions explored by both searches
 * @param elapsed wall clock time of the whole run
 */
public record ModelCheckingStatistics(int tableauNodes, int acceptanceSets, int outerStates, int innerStates,
                                      long transitions, Duration elapsed) {
  @Override
  public String toString() {
    return "tableau: %d nodes, %d acceptance sets; search: %d outer, %d inner states, %d transitions; took %s"
        .formatted(tableauNodes, acceptanceSets, outerStates, innerStates, transitions, elapsed);
  }
}
