package com.ltlcheck.output;

import static com.ltlcheck.model.LtlFormula.atomic;
import static com.ltlcheck.model.LtlFormula.eventually;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import com.ltlcheck.graph.FormulaAutomaton;
import com.ltlcheck.model.Counterexample;
import com.ltlcheck.model.ExplicitKripkeStructure;
import com.ltlcheck.model.ModelCheckResult;
import com.ltlcheck.model.NamedProposition;
import com.ltlcheck.model.PropositionEvaluationException;
import com.ltlcheck.model.PropositionId;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.Test;

public class DotWriterTest {
  private static String write(ThrowingWriter writer) throws PropositionEvaluationException {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    try (PrintStream stream = new PrintStream(bytes, true, StandardCharsets.UTF_8)) {
      writer.write(stream);
    }
    return bytes.toString(StandardCharsets.UTF_8);
  }

  private interface ThrowingWriter {
    void write(PrintStream stream) throws PropositionEvaluationException;
  }

  @Test
  public void automaton() throws PropositionEvaluationException {
    FormulaAutomaton automaton = FormulaAutomaton.of(eventually(atomic(NamedProposition.of("p"))));
    String dot = write(stream -> DotWriter.writeAutomaton(automaton, stream));

    assertTrue(dot.startsWith("digraph {\n"));
    assertTrue(dot.endsWith("}\n"));
    assertTrue(dot, dot.contains("A_0 [shape=point,label=\"0: init\"]"));
    assertTrue(dot, dot.contains("A_1 -> A_3 [label=\"true\"]"));
    assertTrue(dot, dot.contains("A_0 -> A_1 [label=\"p\"]"));
  }

  @Test
  public void counterexample() throws PropositionEvaluationException {
    ExplicitKripkeStructure<String> model = ExplicitKripkeStructure.<String>builder()
        .initial("a")
        .transition("a", "b")
        .transition("b", "b")
        .label("a", "q", "p")
        .build();
    Counterexample<String> counterexample = new Counterexample<>(List.of("a"), List.of("b"));
    String dot = write(stream -> DotWriter.writeCounterexample(counterexample, model, stream));

    assertTrue(dot, dot.contains("C_0 [shape=record,color=black,label=\"{a|[p,q]}\"]"));
    assertTrue(dot, dot.contains("C_1 [shape=record,color=red,label=\"{b|[]}\"]"));
    assertTrue(dot, dot.contains("C_0 -> C_1\n"));
    assertTrue(dot, dot.contains("C_1 -> C_1 [style=dashed]"));
  }

  @Test
  public void formatsResults() {
    assertEquals("f: holds", Formatter.format("f", ModelCheckResult.satisfied()));
    assertEquals("f: fails, counterexample a -> (b -> c)∞",
        Formatter.format("f", ModelCheckResult.violated(new Counterexample<>(List.of("a"), List.of("b", "c")))));
    assertEquals("[a,b]", Formatter.format(List.of(PropositionId.of("b"), PropositionId.of("a"))));
  }
}
