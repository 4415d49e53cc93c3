package com.ltlcheck.parser;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

public final class ParseUtil {
    private ParseUtil() {}

    static Stream<JsonElement> stream(JsonArray array) {
        return StreamSupport.stream(Spliterators.spliterator(array.iterator(), array.size(),
                Spliterator.IMMUTABLE | Spliterator.SIZED | Spliterator.ORDERED), false);
    }

    static JsonElement member(JsonObject object, String name, String context) {
        JsonElement element = object.get(name);
        if (element == null || element.isJsonNull()) {
            throw new IllegalArgumentException("Missing %s in %s".formatted(name, context));
        }
        return element;
    }

    static String string(JsonElement element, String context) {
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new IllegalArgumentException("Expected a string in %s, got %s".formatted(context, element));
        }
        return element.getAsString();
    }

    static boolean bool(JsonElement element, String context) {
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isBoolean()) {
            throw new IllegalArgumentException("Expected a boolean in %s, got %s".formatted(context, element));
        }
        return element.getAsBoolean();
    }

    static JsonArray array(JsonElement element, String context) {
        if (!element.isJsonArray()) {
            throw new IllegalArgumentException("Expected an array in %s, got %s".formatted(context, element));
        }
        return element.getAsJsonArray();
    }

    static JsonObject object(JsonElement element, String context) {
        if (!element.isJsonObject()) {
            throw new IllegalArgumentException("Expected an object in %s, got %s".formatted(context, element));
        }
        return element.getAsJsonObject();
    }
}
