package com.ltlcheck.output;

import com.ltlcheck.model.ModelCheckResult;
import com.ltlcheck.model.PropositionId;
import java.util.Collection;
import java.util.stream.Collectors;

public final class Formatter {
    private Formatter() {}

    public static String format(String name, ModelCheckResult<?> result) {
        return result.counterexample()
                .map(counterexample -> "%s: fails, counterexample %s".formatted(name, counterexample.infinitePathDescription()))
                .orElseGet(() -> "%s: holds".formatted(name));
    }

    public static String format(Collection<PropositionId> labels) {
        return labels.stream()
                .sorted()
                .map(PropositionId::value)
                .collect(Collectors.joining(",", "[", "]"));
    }
}
