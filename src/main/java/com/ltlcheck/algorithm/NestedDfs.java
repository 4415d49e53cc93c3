package com.ltlcheck.algorithm;

import static java.util.Objects.requireNonNull;

import com.ltlcheck.graph.BuchiGraph;
import com.ltlcheck.model.Counterexample;
import com.ltlcheck.model.PropositionEvaluationException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Nested depth-first search for an accepting lasso in a generalized Büchi graph.
 *
 * <p>Acceptance sets are handled by a round-robin counter: the search runs over pairs of a state
 * and the index of the next set to visit. The counter skips every consecutive set the state
 * belongs to; once all sets have been seen the pair is accepting and the counter starts over. A
 * state belonging to every set therefore is accepting with counter {@code 0}, and a self loop on
 * it is a cycle of length one.
 *
 * <p>The outer search visits all reachable pairs and starts an inner search from each accepting
 * pair once all its successors are done. The inner search looks for a path back to this seed;
 * each successor is compared to the seed before anything else. Both searches are iterative.
 */
public final class NestedDfs<T> {
  private static final Logger log = Logger.getLogger(NestedDfs.class.getName());

  /**
   * Bookkeeping of the inner searches.
   */
  public enum InnerSearch {
    /** One visited set for all inner searches, valid since seeds are taken in post-order. */
    SHARED,
    /** A fresh visited set for each seed. */
    PER_SEED
  }

  public record Result<T>(Optional<Counterexample<T>> lasso, int outerStates, int innerStates, long transitions) {
    public boolean isEmpty() {
      return lasso.isEmpty();
    }
  }

  private record Node<T>(T state, int counter) {}

  private static final class Frame<T> {
    final Node<T> node;
    final Iterator<Node<T>> successors;

    Frame(Node<T> node, Iterator<Node<T>> successors) {
      this.node = node;
      this.successors = successors;
    }
  }

  private final BuchiGraph<T> graph;
  private final InnerSearch innerSearch;
  private final SearchListener<T> listener;
  private final int acceptanceSets;

  private final Set<Node<T>> visited = new HashSet<>();
  private final Set<Node<T>> flagged = new HashSet<>();
  private int innerStates = 0;
  private long transitions = 0;

  private NestedDfs(BuchiGraph<T> graph, InnerSearch innerSearch, SearchListener<T> listener) {
    this.graph = requireNonNull(graph);
    this.innerSearch = requireNonNull(innerSearch);
    this.listener = requireNonNull(listener);
    this.acceptanceSets = graph.acceptanceSetCount();
  }

  public static <T> Result<T> search(BuchiGraph<T> graph) throws PropositionEvaluationException {
    return search(graph, InnerSearch.SHARED, new SearchListener<>() {});
  }

  public static <T> Result<T> search(BuchiGraph<T> graph, InnerSearch innerSearch, SearchListener<T> listener)
      throws PropositionEvaluationException {
    return new NestedDfs<>(graph, innerSearch, listener).run();
  }

  private int advance(T state, int counter) {
    int next = counter;
    while (next < acceptanceSets && graph.isAccepting(state, next)) {
      next++;
    }
    return next;
  }

  private boolean isAccepting(Node<T> node) {
    return advance(node.state, node.counter) == acceptanceSets;
  }

  private Iterator<Node<T>> successors(Node<T> node) throws PropositionEvaluationException {
    int advanced = advance(node.state, node.counter);
    int counter = advanced == acceptanceSets ? 0 : advanced;
    Set<T> successors = graph.successors(node.state);
    transitions += successors.size();
    List<Node<T>> nodes = new ArrayList<>(successors.size());
    for (T successor : successors) {
      nodes.add(new Node<>(successor, counter));
    }
    return nodes.iterator();
  }

  private Result<T> run() throws PropositionEvaluationException {
    Deque<Frame<T>> stack = new ArrayDeque<>();
    for (T initialState : graph.initialStates()) {
      Node<T> initial = new Node<>(initialState, 0);
      if (!visited.add(initial)) {
        continue;
      }
      listener.outerStateVisited(initialState);
      stack.push(new Frame<>(initial, successors(initial)));

      while (!stack.isEmpty()) {
        Frame<T> frame = stack.peek();
        if (frame.successors.hasNext()) {
          Node<T> successor = frame.successors.next();
          if (visited.add(successor)) {
            listener.outerStateVisited(successor.state);
            stack.push(new Frame<>(successor, successors(successor)));
          }
          continue;
        }
        stack.pop();
        if (isAccepting(frame.node)) {
          @Nullable
          List<T> cycle = innerSearch(frame.node);
          if (cycle != null) {
            List<T> prefix = new ArrayList<>(stack.size());
            stack.descendingIterator().forEachRemaining(f -> prefix.add(f.node.state));
            Counterexample<T> lasso = new Counterexample<>(prefix, cycle);
            log.log(Level.FINE, () -> "Found accepting lasso %s".formatted(lasso));
            listener.acceptingCycleFound(lasso);
            return new Result<>(Optional.of(lasso), visited.size(), innerStates, transitions);
          }
        }
      }
    }
    log.log(Level.FINE, () -> "No accepting lasso among %d states".formatted(visited.size()));
    return new Result<>(Optional.empty(), visited.size(), innerStates, transitions);
  }

  /**
   * Searches a path from the seed back to itself. Returns the states of the cycle starting with
   * the seed, or {@code null} if there is none.
   */
  @Nullable
  private List<T> innerSearch(Node<T> seed) throws PropositionEvaluationException {
    listener.innerSearchStarted(seed.state);
    Set<Node<T>> flags = innerSearch == InnerSearch.SHARED ? flagged : new HashSet<>();
    Deque<Frame<T>> stack = new ArrayDeque<>();
    stack.push(new Frame<>(seed, successors(seed)));

    while (!stack.isEmpty()) {
      Frame<T> frame = stack.peek();
      if (!frame.successors.hasNext()) {
        stack.pop();
        continue;
      }
      Node<T> successor = frame.successors.next();
      if (successor.equals(seed)) {
        List<T> cycle = new ArrayList<>(stack.size());
        stack.descendingIterator().forEachRemaining(f -> cycle.add(f.node.state));
        return cycle;
      }
      if (flags.add(successor)) {
        innerStates++;
        listener.innerStateVisited(successor.state);
        stack.push(new Frame<>(successor, successors(successor)));
      }
    }
    return null;
  }
}
