package com.ltlcheck;

import static java.util.Objects.requireNonNull;

import com.google.common.base.Stopwatch;
import com.ltlcheck.algorithm.AcceptanceConditionGenerator;
import com.ltlcheck.algorithm.NestedDfs;
import com.ltlcheck.algorithm.NestedDfs.InnerSearch;
import com.ltlcheck.algorithm.Tableau;
import com.ltlcheck.algorithm.TableauBuilder;
import com.ltlcheck.graph.FormulaAutomaton;
import com.ltlcheck.graph.ProductAutomaton;
import com.ltlcheck.graph.ProductAutomaton.DeadlockPolicy;
import com.ltlcheck.graph.ProductState;
import com.ltlcheck.model.Counterexample;
import com.ltlcheck.model.KripkeStructure;
import com.ltlcheck.model.LtlFormula;
import com.ltlcheck.model.ModelCheckResult;
import com.ltlcheck.model.Proposition;
import com.ltlcheck.model.PropositionEvaluationException;
import java.util.BitSet;
import java.util.Iterator;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Decides whether all infinite paths of a Kripke structure satisfy an LTL formula.
 *
 * <p>The negation of the formula is translated into a generalized Büchi automaton, which is
 * explored in product with the model by a nested depth-first search. An accepting lasso of the
 * product is a path violating the formula and is reported as counterexample; if there is none
 * the formula holds.
 *
 * <p>Instances hold no state besides their options and may be shared between threads, provided
 * the queried Kripke structures are safe to use concurrently.
 */
public final class ModelChecker {
  private static final Logger log = Logger.getLogger(ModelChecker.class.getName());

  public record Options(InnerSearch innerSearch, DeadlockPolicy deadlockPolicy) {
    public Options {
      requireNonNull(innerSearch);
      requireNonNull(deadlockPolicy);
    }

    public static Options defaults() {
      return new Options(InnerSearch.SHARED, DeadlockPolicy.IGNORE);
    }

    public Options withInnerSearch(InnerSearch innerSearch) {
      return new Options(innerSearch, deadlockPolicy);
    }

    public Options withDeadlockPolicy(DeadlockPolicy deadlockPolicy) {
      return new Options(innerSearch, deadlockPolicy);
    }
  }

  private final Options options;

  public ModelChecker() {
    this(Options.defaults());
  }

  public ModelChecker(Options options) {
    this.options = requireNonNull(options);
  }

  public Options options() {
    return options;
  }

  public <P extends Proposition, S> ModelCheckResult<S> check(LtlFormula<P> formula, KripkeStructure<S> model)
      throws PropositionEvaluationException {
    return check(formula, model, new ModelCheckingListener<>() {});
  }

  /**
   * Checks {@code formula} against {@code model}, reporting progress to {@code listener}.
   *
   * @throws PropositionEvaluationException if the model fails to evaluate a proposition. A
   *     violated formula is reported as {@link ModelCheckResult.Fails}, never as exception.
   */
  public <P extends Proposition, S> ModelCheckResult<S> check(LtlFormula<P> formula, KripkeStructure<S> model,
      ModelCheckingListener<S> listener) throws PropositionEvaluationException {
    requireNonNull(formula);
    requireNonNull(model);
    requireNonNull(listener);
    Stopwatch overall = Stopwatch.createStarted();

    Tableau<P> tableau = TableauBuilder.build(LtlFormula.not(formula));
    listener.onTableau(tableau);
    List<BitSet> acceptanceSets = AcceptanceConditionGenerator.acceptanceSets(tableau);
    FormulaAutomaton automaton = FormulaAutomaton.of(tableau, acceptanceSets);
    listener.onAutomaton(automaton);
    log.log(Level.FINE, () -> "Built %s in %s".formatted(automaton, overall));

    ProductAutomaton<S> product = new ProductAutomaton<>(automaton, model, options.deadlockPolicy());
    NestedDfs.Result<ProductState<S>> search = NestedDfs.search(product, options.innerSearch(), listener);

    ModelCheckResult<S> result;
    if (search.lasso().isPresent()) {
      Counterexample<S> counterexample = search.lasso().get().map(ProductState::kripkeState);
      assert validate(counterexample, model, options.deadlockPolicy()) : counterexample;
      result = ModelCheckResult.violated(counterexample);
    } else {
      result = ModelCheckResult.satisfied();
    }

    ModelCheckingStatistics statistics = new ModelCheckingStatistics(tableau.size(), acceptanceSets.size(),
        search.outerStates(), search.innerStates(), search.transitions(), overall.elapsed());
    log.log(Level.FINE, () -> "Checked %s: %s (%s)".formatted(formula, result, statistics));
    listener.onFinished(statistics);
    return result;
  }

  private static <S> boolean validate(Counterexample<S> counterexample, KripkeStructure<S> model,
      DeadlockPolicy deadlockPolicy) {
    Iterator<S> iterator = counterexample.states(true).iterator();
    S current = iterator.next();
    if (!model.initialStates().contains(current)) {
      return false;
    }
    while (iterator.hasNext()) {
      S next = iterator.next();
      if (!ProductAutomaton.kripkeSuccessors(model, current, deadlockPolicy).contains(next)) {
        return false;
      }
      current = next;
    }
    return true;
  }
}
