package com.amannmalik.money.codec;

import jakarta.json.*;

import java.util.regex.Pattern;

final class JsonSupport {
    private JsonSupport() {
    }

    static String requireString(JsonObject parent, String key) {
        if (!parent.containsKey(key) || parent.isNull(key)) {
            throw new JsonDecodingException("Missing string: " + key);
        }
        var value = parent.get(key);
        if (value.getValueType() != JsonValue.ValueType.STRING) {
            throw new JsonDecodingException("Expected string at: " + key);
        }
        var string = ((JsonString) value).getString();
        if (string.isBlank()) {
            throw new JsonDecodingException("String MUST be non-blank: " + key);
        }
        return string;
    }

    static String requireMatching(JsonObject parent, String key, Pattern pattern) {
        var string = requireString(parent, key);
        if (!pattern.matcher(string).matches()) {
            throw new JsonDecodingException("String at " + key + " MUST match " + pattern.pattern());
        }
        return string;
    }

    static JsonObject requireObject(JsonValue value, String path) {
        if (value == null || value.getValueType() != JsonValue.ValueType.OBJECT) {
            throw new JsonDecodingException("Expected object at: " + path);
        }
        return value.asJsonObject();
    }

    static JsonValue read(JsonReader reader) {
        try (reader) {
            return reader.readValue();
        } catch (JsonException e) {
            throw new JsonDecodingException("Malformed JSON", e);
        }
    }
}
