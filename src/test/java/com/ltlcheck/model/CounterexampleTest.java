package com.ltlcheck.model;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.List;
import org.junit.Test;

public class CounterexampleTest {
  @Test
  public void describesLasso() {
    Counterexample<String> counterexample = new Counterexample<>(List.of("s0"), List.of("s1", "s2"));
    assertEquals("s0 -> (s1 -> s2)∞", counterexample.infinitePathDescription());
    assertEquals("(s1)∞", new Counterexample<>(List.of(), List.of("s1")).infinitePathDescription());
  }

  @Test
  public void statesWithClosingState() {
    Counterexample<String> counterexample = new Counterexample<>(List.of("s0"), List.of("s1", "s2"));
    assertEquals(List.of("s0", "s1", "s2", "s1"), counterexample.states(true).toList());
    assertEquals(List.of("s0", "s1", "s2"), counterexample.states(false).toList());
    assertEquals(3, counterexample.size());
  }

  @Test
  public void rejectsEmptyCycle() {
    assertThrows(IllegalArgumentException.class, () -> new Counterexample<>(List.of("s0"), List.of()));
  }

  @Test
  public void mapsStates() {
    Counterexample<Integer> counterexample = new Counterexample<>(List.of(1), List.of(2, 3));
    assertEquals(new Counterexample<>(List.of("1"), List.of("2", "3")), counterexample.map(String::valueOf));
  }

  @Test
  public void resultCarriesCounterexample() {
    Counterexample<String> counterexample = new Counterexample<>(List.of(), List.of("s0"));
    ModelCheckResult<String> fails = ModelCheckResult.violated(counterexample);
    assertFalse(fails.holds());
    assertEquals(counterexample, fails.counterexample().orElseThrow());

    ModelCheckResult<String> holds = ModelCheckResult.satisfied();
    assertTrue(holds.holds());
    assertTrue(holds.counterexample().isEmpty());
    assertEquals(ModelCheckResult.<String>satisfied(), holds);
  }
}
