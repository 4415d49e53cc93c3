package com.ltlcheck;

import static picocli.CommandLine.Command;
import static picocli.CommandLine.Option;

import com.google.common.base.Stopwatch;
import com.ltlcheck.algorithm.NestedDfs.InnerSearch;
import com.ltlcheck.graph.FormulaAutomaton;
import com.ltlcheck.graph.ProductAutomaton.DeadlockPolicy;
import com.ltlcheck.model.Counterexample;
import com.ltlcheck.model.LtlFormula;
import com.ltlcheck.model.ModelCheckResult;
import com.ltlcheck.model.NamedProposition;
import com.ltlcheck.output.DotWriter;
import com.ltlcheck.output.Formatter;
import com.ltlcheck.parser.ModelParser;
import com.ltlcheck.parser.ModelParser.ModelFile;
import com.ltlcheck.parser.ModelState;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import picocli.CommandLine;

@Command(
    name = "ltlcheck",
    mixinStandardHelpOptions = true,
    version = "LTL model checker 0.1",
    description = "Checks LTL formulas against an explicit Kripke structure")
public final class Main implements Callable<Integer> {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private static PrintStream open(String output) throws IOException {
        return "-".equals(output)
            ? System.out
            : new PrintStream(new BufferedOutputStream(Files.newOutputStream(Path.of(output))), false, StandardCharsets.UTF_8);
    }

    private static String destination(String pattern, String formulaName) {
        return pattern.replace("%F", formulaName.replaceAll("[^A-Za-z0-9_.-]", "_"));
    }

    @Option(
        names = {"--model"},
        required = true,
        description = "Model file in JSON format")
    private Path model;

    @Option(
        names = {"--formula"},
        description = "Name of a formula to check (repeatable, default: all formulas of the model)")
    private List<String> formulas = List.of();

    @Option(
        names = {"-O", "--output"},
        description = "Write the verdicts")
    private String writeOutput = "-";

    @Nullable
    @Option(
        names = {"--write-dot-gba"},
        description = "Write the automaton of each negated formula (%%F is replaced by the formula name)")
    private String writeDotAutomaton;

    @Nullable
    @Option(
        names = {"--write-dot-cex"},
        description = "Write each counterexample (%%F is replaced by the formula name)")
    private String writeDotCounterexample;

    @Option(
        names = {"--deadlock"},
        description = "Treatment of states without successors. Valid: ${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE}")
    private DeadlockPolicy deadlockPolicy = DeadlockPolicy.IGNORE;

    @Option(
        names = {"--inner-search"},
        description = "Visited set of the inner search. Valid: ${COMPLETION-CANDIDATES}, default: ${DEFAULT-VALUE}")
    private InnerSearch innerSearch = InnerSearch.SHARED;

    Main() {}

    public static void main(String[] args) {
        System.exit(new CommandLine(new Main())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .execute(args));
    }

    private Map<String, LtlFormula<NamedProposition>> selectFormulas(ModelFile modelFile) {
        if (formulas.isEmpty()) {
            return modelFile.formulas();
        }
        Map<String, LtlFormula<NamedProposition>> selected = new LinkedHashMap<>();
        for (String name : formulas) {
            var formula = modelFile.formulas().get(name);
            if (formula == null) {
                throw new CommandLine.ParameterException(new CommandLine(this),
                    "Unknown formula %s, model %s defines %s".formatted(name, modelFile.name(), modelFile.formulas().keySet()));
            }
            selected.put(name, formula);
        }
        return selected;
    }

    @Override
    public Integer call() throws Exception {
        ModelFile modelFile = ModelParser.parse(model);
        log.log(Level.INFO, () -> "Loaded model %s with %d states".formatted(modelFile.name(), modelFile.model().states().size()));

        ModelChecker checker = new ModelChecker(ModelChecker.Options.defaults()
            .withDeadlockPolicy(deadlockPolicy)
            .withInnerSearch(innerSearch));
        List<String> mismatches = new ArrayList<>();
        Stopwatch overall = Stopwatch.createStarted();
        try (var stream = open(writeOutput)) {
            for (var entry : selectFormulas(modelFile).entrySet()) {
                String name = entry.getKey();
                log.log(Level.INFO, () -> "Checking %s: %s".formatted(name, entry.getValue()));

                List<FormulaAutomaton> automata = new ArrayList<>(1);
                ModelCheckResult<ModelState> result = checker.check(entry.getValue(), modelFile.model(),
                    new ModelCheckingListener<ModelState>() {
                        @Override
                        public void onAutomaton(FormulaAutomaton automaton) {
                            automata.add(automaton);
                        }

                        @Override
                        public void onFinished(ModelCheckingStatistics statistics) {
                            log.log(Level.INFO, () -> "Statistics: %s".formatted(statistics));
                        }
                    });
                stream.println(Formatter.format(name, result));

                if (writeDotAutomaton != null) {
                    try (var dotStream = open(destination(writeDotAutomaton, name))) {
                        DotWriter.writeAutomaton(automata.get(0), dotStream);
                    }
                }
                if (writeDotCounterexample != null && result.counterexample().isPresent()) {
                    Counterexample<ModelState> counterexample = result.counterexample().get();
                    try (var dotStream = open(destination(writeDotCounterexample, name))) {
                        DotWriter.writeCounterexample(counterexample, modelFile.model(), dotStream);
                    }
                }

                Boolean expected = modelFile.expected().get(name);
                if (expected != null && expected != result.holds()) {
                    mismatches.add("%s: expected %s, got %s".formatted(name, expected ? "holds" : "fails", result));
                }
            }
        }
        log.log(Level.INFO, () -> "Checking took %s overall".formatted(overall));

        if (!mismatches.isEmpty()) {
            System.err.println("Validation failed!");
            mismatches.forEach(System.err::println);
            return 1;
        }
        return 0;
    }
}
