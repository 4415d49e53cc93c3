package com.ltlcheck.algorithm;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.google.common.collect.ImmutableSetMultimap;
import com.google.common.collect.SetMultimap;
import com.ltlcheck.algorithm.NestedDfs.InnerSearch;
import com.ltlcheck.graph.BuchiGraph;
import com.ltlcheck.model.Counterexample;
import com.ltlcheck.model.PropositionEvaluationException;
import com.ltlcheck.model.PropositionId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

@RunWith(Parameterized.class)
public class NestedDfsTest {
  private final InnerSearch innerSearch;

  public NestedDfsTest(InnerSearch innerSearch) {
    this.innerSearch = innerSearch;
  }

  @Parameters(name = "{0}")
  public static Collection<Object[]> data() {
    return Arrays.stream(InnerSearch.values()).map(value -> new Object[] {value}).toList();
  }

  private static final class Graph implements BuchiGraph<Integer> {
    private final Set<Integer> initialStates;
    private final SetMultimap<Integer, Integer> edges;
    private final List<Set<Integer>> acceptanceSets;

    Graph(Set<Integer> initialStates, SetMultimap<Integer, Integer> edges, List<Set<Integer>> acceptanceSets) {
      this.initialStates = initialStates;
      this.edges = edges;
      this.acceptanceSets = acceptanceSets;
    }

    @Override
    public Set<Integer> initialStates() {
      return initialStates;
    }

    @Override
    public Set<Integer> successors(Integer state) {
      return edges.get(state);
    }

    @Override
    public int acceptanceSetCount() {
      return acceptanceSets.size();
    }

    @Override
    public boolean isAccepting(Integer state, int acceptanceSet) {
      return acceptanceSets.get(acceptanceSet).contains(state);
    }
  }

  private static SetMultimap<Integer, Integer> edges(int... pairs) {
    ImmutableSetMultimap.Builder<Integer, Integer> builder = ImmutableSetMultimap.builder();
    for (int i = 0; i < pairs.length; i += 2) {
      builder.put(pairs[i], pairs[i + 1]);
    }
    return builder.build();
  }

  private NestedDfs.Result<Integer> search(Graph graph) throws PropositionEvaluationException {
    return NestedDfs.search(graph, innerSearch, new SearchListener<>() {});
  }

  @Test
  public void selfLoopIsCycle() throws PropositionEvaluationException {
    var result = search(new Graph(Set.of(0), edges(0, 0), List.of(Set.of(0))));
    assertEquals(new Counterexample<>(List.of(), List.of(0)), result.lasso().orElseThrow());
  }

  @Test
  public void acceptingStateOffCycle() throws PropositionEvaluationException {
    assertTrue(search(new Graph(Set.of(0), edges(0, 1, 1, 2, 2, 2), List.of(Set.of(1)))).isEmpty());
    assertTrue(search(new Graph(Set.of(0), edges(0, 1, 1, 2, 2, 3, 3, 2), List.of(Set.of(1)))).isEmpty());
  }

  @Test
  public void finitePathsAreNotLassos() throws PropositionEvaluationException {
    var result = search(new Graph(Set.of(0), edges(0, 1, 1, 2), List.of(Set.of(0, 1, 2))));
    assertTrue(result.isEmpty());
    assertEquals(3, result.outerStates());
  }

  @Test
  public void cycleVisitsEveryAcceptanceSet() throws PropositionEvaluationException {
    var result = search(new Graph(Set.of(0), edges(0, 1, 1, 2, 2, 1), List.of(Set.of(1), Set.of(2))));
    assertEquals(new Counterexample<>(List.of(0, 1), List.of(2, 1)), result.lasso().orElseThrow());
  }

  @Test
  public void separateCyclesDoNotCombine() throws PropositionEvaluationException {
    var graph = new Graph(Set.of(0), edges(0, 1, 1, 1, 0, 2, 2, 2), List.of(Set.of(1), Set.of(2)));
    assertTrue(search(graph).isEmpty());
  }

  @Test
  public void stateInAllSetsWithSelfLoop() throws PropositionEvaluationException {
    var graph = new Graph(Set.of(0), edges(0, 1, 1, 1), List.of(Set.of(1), Set.of(1), Set.of(0, 1)));
    assertEquals(new Counterexample<>(List.of(0), List.of(1)), search(graph).lasso().orElseThrow());
  }

  @Test
  public void cycleThroughSharedStates() throws PropositionEvaluationException {
    // 3 is reached by the inner search of 4 first, but only the cycle through 5 returns to 5
    var graph = new Graph(Set.of(0),
        edges(0, 1, 1, 4, 4, 3, 3, 3, 1, 5, 5, 3, 5, 6, 6, 5),
        List.of(Set.of(4, 5)));
    var lasso = search(graph).lasso().orElseThrow();
    assertEquals(List.of(0, 1), lasso.prefix());
    assertEquals(5, lasso.cycle().get(0).intValue());
    assertTrue(lasso.cycle().contains(6));
  }

  @Test
  public void reportsProgress() throws PropositionEvaluationException {
    List<String> events = new ArrayList<>();
    var graph = new Graph(Set.of(0), edges(0, 1, 1, 0), List.of(Set.of(1)));
    var result = NestedDfs.search(graph, innerSearch, new SearchListener<>() {
      @Override
      public void outerStateVisited(Integer state) {
        events.add("outer " + state);
      }

      @Override
      public void innerSearchStarted(Integer seed) {
        events.add("seed " + seed);
      }

      @Override
      public void innerStateVisited(Integer state) {
        events.add("inner " + state);
      }

      @Override
      public void acceptingCycleFound(Counterexample<Integer> lasso) {
        events.add("found " + lasso);
      }
    });
    assertEquals(List.of("outer 0", "outer 1", "seed 1", "inner 0", "found 0 -> (1 -> 0)∞"), events);
    assertEquals(2, result.outerStates());
    assertEquals(1, result.innerStates());
    assertEquals(4, result.transitions());
  }

  @Test
  public void noInitialStates() throws PropositionEvaluationException {
    assertTrue(search(new Graph(Set.of(), edges(0, 0), List.of(Set.of(0)))).isEmpty());
  }

  @Test
  public void propagatesEvaluationFailure() {
    BuchiGraph<Integer> graph = new BuchiGraph<>() {
      @Override
      public Set<Integer> initialStates() {
        return Set.of(0);
      }

      @Override
      public Set<Integer> successors(Integer state) throws PropositionEvaluationException {
        throw new PropositionEvaluationException(PropositionId.of("p"), "broken");
      }

      @Override
      public int acceptanceSetCount() {
        return 1;
      }

      @Override
      public boolean isAccepting(Integer state, int acceptanceSet) {
        return false;
      }
    };
    var exception = assertThrows(PropositionEvaluationException.class,
        () -> NestedDfs.search(graph, innerSearch, new SearchListener<>() {}));
    assertEquals(PropositionId.of("p"), exception.propositionId());
    assertFalse(exception.getMessage().isEmpty());
  }
}
