package com.ltlcheck.graph;

import static com.ltlcheck.model.LtlFormula.atomic;
import static com.ltlcheck.model.LtlFormula.eventually;
import static com.ltlcheck.model.LtlFormula.globally;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import com.ltlcheck.graph.ProductAutomaton.DeadlockPolicy;
import com.ltlcheck.model.ClosureProposition;
import com.ltlcheck.model.ExplicitKripkeStructure;
import com.ltlcheck.model.KripkeStructure;
import com.ltlcheck.model.LtlFormula;
import com.ltlcheck.model.NamedProposition;
import com.ltlcheck.model.PropositionEvaluationException;
import com.ltlcheck.model.PropositionId;
import com.ltlcheck.model.PropositionalKripkeStructure;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.Test;

public class ProductAutomatonTest {
  private static final LtlFormula<NamedProposition> p = atomic(NamedProposition.of("p"));

  // s0 <-> s1 -> s2, p holds in s0 only
  private static final ExplicitKripkeStructure<String> model = ExplicitKripkeStructure.<String>builder()
      .initial("s0")
      .transition("s0", "s1")
      .transitions("s1", "s0", "s2")
      .state("s2")
      .label("s0", "p")
      .build();

  private static final class CountingStructure implements KripkeStructure<String> {
    private final Map<String, Integer> queries = new HashMap<>();

    @Override
    public Set<String> initialStates() {
      return model.initialStates();
    }

    @Override
    public Set<String> successors(String state) {
      return model.successors(state);
    }

    @Override
    public Set<PropositionId> atomicPropositionsTrue(String state) {
      queries.merge(state, 1, Integer::sum);
      return model.atomicPropositionsTrue(state);
    }
  }

  @Test
  public void initialStatesRespectGuards() throws PropositionEvaluationException {
    var product = new ProductAutomaton<>(FormulaAutomaton.of(eventually(p)), model, DeadlockPolicy.IGNORE);
    assertEquals(Set.of(new ProductState<>("s0", 1), new ProductState<>("s0", 2)), product.initialStates());

    var safety = new ProductAutomaton<>(FormulaAutomaton.of(globally(p)), model, DeadlockPolicy.IGNORE);
    ProductState<String> initial = new ProductState<>("s0", 1);
    assertEquals(Set.of(initial), safety.initialStates());
    assertTrue(safety.successors(initial).isEmpty());
  }

  @Test
  public void successorsPairBothComponents() throws PropositionEvaluationException {
    var product = new ProductAutomaton<>(FormulaAutomaton.of(eventually(p)), model, DeadlockPolicy.IGNORE);
    assertEquals(Set.of(new ProductState<>("s1", 2)), product.successors(new ProductState<>("s0", 2)));
    assertEquals(Set.of(new ProductState<>("s0", 1), new ProductState<>("s0", 2), new ProductState<>("s2", 2)),
        product.successors(new ProductState<>("s1", 2)));
    assertTrue(product.successors(new ProductState<>("s2", 2)).isEmpty());
  }

  @Test
  public void stutteringTerminalStates() throws PropositionEvaluationException {
    var product = new ProductAutomaton<>(FormulaAutomaton.of(eventually(p)), model, DeadlockPolicy.STUTTER);
    assertEquals(Set.of(new ProductState<>("s2", 2)), product.successors(new ProductState<>("s2", 2)));
    assertEquals(Set.of("s2"), ProductAutomaton.kripkeSuccessors(model, "s2", DeadlockPolicy.STUTTER));
    assertTrue(ProductAutomaton.kripkeSuccessors(model, "s2", DeadlockPolicy.IGNORE).isEmpty());
  }

  @Test
  public void acceptanceOfAutomatonComponent() {
    var product = new ProductAutomaton<>(FormulaAutomaton.of(eventually(p)), model, DeadlockPolicy.IGNORE);
    assertEquals(1, product.acceptanceSetCount());
    assertTrue(product.isAccepting(new ProductState<>("s0", 1), 0));
    assertTrue(product.isAccepting(new ProductState<>("s1", 3), 0));
    assertFalse(product.isAccepting(new ProductState<>("s0", 2), 0));
  }

  @Test
  public void labelsAreQueriedOnce() throws PropositionEvaluationException {
    CountingStructure structure = new CountingStructure();
    var product = new ProductAutomaton<>(FormulaAutomaton.of(eventually(p)), structure, DeadlockPolicy.IGNORE);
    for (int i = 0; i < 3; i++) {
      product.initialStates();
      product.successors(new ProductState<>("s1", 2));
    }
    assertEquals(Map.of("s0", 1, "s2", 1), structure.queries);
    assertEquals(2, product.labelledStates());
  }

  @Test
  public void propagatesEvaluationFailure() {
    var structure = new PropositionalKripkeStructure<>(List.of(0), i -> List.of(i),
        List.of(ClosureProposition.of("p", Integer.class, i -> {
          throw new IllegalStateException("unavailable");
        })));
    var product = new ProductAutomaton<>(FormulaAutomaton.of(eventually(p)), structure, DeadlockPolicy.IGNORE);
    var exception = assertThrows(PropositionEvaluationException.class, product::initialStates);
    assertEquals(PropositionId.of("p"), exception.propositionId());
    assertTrue(exception.getCause() instanceof IllegalStateException);
  }
}
