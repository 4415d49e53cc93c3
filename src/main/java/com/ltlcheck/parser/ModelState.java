package com.ltlcheck.parser;

import static java.util.Objects.requireNonNull;

import com.ltlcheck.model.Labelled;
import com.ltlcheck.model.PropositionId;
import com.ltlcheck.output.DotFormatted;
import java.util.Set;

public record ModelState(String name, Set<PropositionId> labels) implements Labelled, DotFormatted {
    public ModelState {
        requireNonNull(name);
        labels = Set.copyOf(labels);
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public String dotString() {
        return name;
    }
}
