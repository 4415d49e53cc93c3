package com.ltlcheck.parser;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.ltlcheck.model.ExplicitKripkeStructure;
import com.ltlcheck.model.LtlFormula;
import com.ltlcheck.model.NamedProposition;
import com.ltlcheck.model.PropositionId;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads a model file: a Kripke structure with named states together with named formulas and,
 * optionally, their expected verdicts.
 *
 * <pre>{@code
 * {
 *   "name": "traffic light",
 *   "initial": ["red"],
 *   "states": {
 *     "red": {"labels": ["isRed"], "successors": ["green"]},
 *     ...
 *   },
 *   "formulas": {"eventually red": {"eventually": "isRed"}},
 *   "expected": {"eventually red": true}
 * }
 * }</pre>
 */
public final class ModelParser {
  public record ModelFile(String name, ExplicitKripkeStructure<ModelState> model,
                          Map<String, LtlFormula<NamedProposition>> formulas, Map<String, Boolean> expected) {
    public ModelState state(String name) {
      return model.states().stream()
          .filter(state -> state.name().equals(name))
          .findAny()
          .orElseThrow(() -> new IllegalArgumentException("Unknown state " + name));
    }
  }

  private ModelParser() {}

  public static ModelFile parse(Path path) throws IOException {
    try (Reader reader = Files.newBufferedReader(path)) {
      return parse(reader);
    }
  }

  public static ModelFile parse(Reader reader) {
    return parse(ParseUtil.object(JsonParser.parseReader(reader), "model file"));
  }

  public static ModelFile parse(JsonObject json) {
    String name = json.has("name") ? ParseUtil.string(json.get("name"), "name") : "model";

    JsonObject statesObject = ParseUtil.object(ParseUtil.member(json, "states", "model"), "states");
    Map<String, ModelState> states = new LinkedHashMap<>();
    for (Map.Entry<String, JsonElement> entry : statesObject.entrySet()) {
      String stateName = entry.getKey();
      JsonObject stateObject = ParseUtil.object(entry.getValue(), stateName);
      Set<PropositionId> labels = stateObject.has("labels")
          ? ParseUtil.stream(ParseUtil.array(stateObject.get("labels"), stateName))
              .map(label -> PropositionId.of(ParseUtil.string(label, stateName)))
              .collect(Collectors.toSet())
          : Set.of();
      states.put(stateName, new ModelState(stateName, labels));
    }

    ExplicitKripkeStructure.Builder<ModelState> builder = ExplicitKripkeStructure.builder();
    for (ModelState state : states.values()) {
      builder.label(state, state.labels());
      JsonObject stateObject = statesObject.getAsJsonObject(state.name());
      if (stateObject.has("successors")) {
        ParseUtil.stream(ParseUtil.array(stateObject.get("successors"), state.name()))
            .map(successor -> resolve(states, ParseUtil.string(successor, state.name())))
            .forEach(successor -> builder.transition(state, successor));
      }
    }
    ParseUtil.stream(ParseUtil.array(ParseUtil.member(json, "initial", "model"), "initial"))
        .map(initial -> resolve(states, ParseUtil.string(initial, "initial")))
        .forEach(builder::initial);
    ExplicitKripkeStructure<ModelState> model = builder.build();
    checkArgument(!model.initialStates().isEmpty(), "Model %s has no initial state", name);

    Map<String, LtlFormula<NamedProposition>> formulas = new LinkedHashMap<>();
    if (json.has("formulas")) {
      for (Map.Entry<String, JsonElement> entry : ParseUtil.object(json.get("formulas"), "formulas").entrySet()) {
        formulas.put(entry.getKey(), FormulaParser.parse(entry.getValue()));
      }
    }

    Map<String, Boolean> expected = new LinkedHashMap<>();
    if (json.has("expected")) {
      for (Map.Entry<String, JsonElement> entry : ParseUtil.object(json.get("expected"), "expected").entrySet()) {
        checkArgument(formulas.containsKey(entry.getKey()), "Expected verdict for unknown formula %s", entry.getKey());
        expected.put(entry.getKey(), ParseUtil.bool(entry.getValue(), entry.getKey()));
      }
    }
    return new ModelFile(name, model, ImmutableMap.copyOf(formulas), ImmutableMap.copyOf(expected));
  }

  private static ModelState resolve(Map<String, ModelState> states, String name) {
    ModelState state = states.get(name);
    if (state == null) {
      throw new IllegalArgumentException("Unknown state " + name);
    }
    return state;
  }
}
