package com.ltlcheck.output;

import static com.ltlcheck.output.DotFormatted.toDotString;

import com.ltlcheck.graph.FormulaAutomaton;
import com.ltlcheck.model.Counterexample;
import com.ltlcheck.model.KripkeStructure;
import com.ltlcheck.model.PropositionEvaluationException;
import it.unimi.dsi.fastutil.ints.IntList;
import java.io.PrintStream;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

public final class DotWriter {
    private DotWriter() {}

    public static void writeAutomaton(FormulaAutomaton automaton, PrintStream writer) {
        writer.append("digraph {\n");
        writer.append("label=\"%s\"\n".formatted(toDotString(automaton.formula())));
        for (int state = 0; state < automaton.size(); state++) {
            int current = state;
            String acceptance = IntStream.range(0, automaton.acceptanceSetCount())
                    .filter(set -> automaton.isAccepting(current, set))
                    .mapToObj(Integer::toString)
                    .collect(Collectors.joining(","));
            writer.append("A_%d [shape=%s,label=\"%d: %s%s\"]\n".formatted(state,
                    state == FormulaAutomaton.INITIAL_STATE ? "point" : "box",
                    state, DotFormatted.escape(automaton.label(state)), acceptance.isEmpty() ? "" : " {" + acceptance + "}"));
        }
        for (int state = 0; state < automaton.size(); state++) {
            IntList successors = automaton.successors(state);
            for (int i = 0; i < successors.size(); i++) {
                int successor = successors.getInt(i);
                writer.append("A_%d -> A_%d [label=\"%s\"]\n".formatted(state, successor,
                        toDotString(automaton.guard(successor))));
            }
        }
        writer.append("}\n");
    }

    /**
     * Writes the states of the lasso in order. States repeated along the path are drawn once per
     * occurrence.
     */
    public static <S> void writeCounterexample(Counterexample<S> counterexample, KripkeStructure<S> model,
            PrintStream writer) throws PropositionEvaluationException {
        List<S> prefix = counterexample.prefix();

        writer.append("digraph {\n");
        writer.append("rankdir=LR\n");
        int index = 0;
        for (S state : counterexample.states(false).toList()) {
            writer.append("C_%d [shape=record,color=%s,label=\"{%s|%s}\"]\n".formatted(index,
                    index < prefix.size() ? "black" : "red",
                    DotFormatted.toRecordString(toDotString(state)),
                    DotFormatted.toRecordString(Formatter.format(model.atomicPropositionsTrue(state)))));
            if (index > 0) {
                writer.append("C_%d -> C_%d\n".formatted(index - 1, index));
            }
            index++;
        }
        writer.append("C_%d -> C_%d [style=dashed]\n".formatted(index - 1, prefix.size()));
        writer.append("}\n");
    }
}
