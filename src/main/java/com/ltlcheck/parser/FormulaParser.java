package com.ltlcheck.parser;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.ltlcheck.model.LtlFormula;
import com.ltlcheck.model.NamedProposition;
import java.util.Map;
import java.util.function.BinaryOperator;
import java.util.function.UnaryOperator;

/**
 * Reads formulas written as JSON trees. A string is an atomic proposition, a boolean a constant
 * and an object with a single operator key holds the operand, or a two-element array of operands
 * for binary operators: {@code {"globally": {"implies": ["red", {"next": "green"}]}}}.
 */
public final class FormulaParser {
    private static final Map<String, UnaryOperator<LtlFormula<NamedProposition>>> UNARY = Map.of(
            "not", LtlFormula::not,
            "next", LtlFormula::next,
            "eventually", LtlFormula::eventually,
            "globally", LtlFormula::globally);

    private static final Map<String, BinaryOperator<LtlFormula<NamedProposition>>> BINARY = Map.of(
            "and", LtlFormula::and,
            "or", LtlFormula::or,
            "implies", LtlFormula::implies,
            "until", LtlFormula::until,
            "weakUntil", LtlFormula::weakUntil,
            "release", LtlFormula::release);

    private FormulaParser() {}

    public static LtlFormula<NamedProposition> parse(JsonElement element) {
        if (element.isJsonPrimitive()) {
            JsonPrimitive primitive = element.getAsJsonPrimitive();
            if (primitive.isBoolean()) {
                return LtlFormula.of(primitive.getAsBoolean());
            }
            if (primitive.isString()) {
                return LtlFormula.atomic(NamedProposition.of(primitive.getAsString()));
            }
            throw new IllegalArgumentException("Invalid formula " + element);
        }
        JsonObject object = ParseUtil.object(element, "formula");
        if (object.size() != 1) {
            throw new IllegalArgumentException("Expected exactly one operator in " + element);
        }
        var entry = object.entrySet().iterator().next();
        String operator = entry.getKey();
        JsonElement operands = entry.getValue();

        var unary = UNARY.get(operator);
        if (unary != null) {
            return unary.apply(parse(operands));
        }
        var binary = BINARY.get(operator);
        if (binary != null) {
            JsonArray array = ParseUtil.array(operands, operator);
            if (array.size() != 2) {
                throw new IllegalArgumentException("Operator %s expects two operands, got %s".formatted(operator, array));
            }
            return binary.apply(parse(array.get(0)), parse(array.get(1)));
        }
        throw new IllegalArgumentException("Unknown operator " + operator);
    }
}
