package trellis.core.config;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import trellis.core.Filter;
import trellis.core.exception.ParseException;
import trellis.core.util.ObjectChecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses run requests given as JSON objects of the form:
 *
 * <pre>
 * {
 *   "suites": ["com.example.StackSpec", ...],
 *   "test_name": "A stack should pop",
 *   "tags_to_include": ["fast"],
 *   "tags_to_exclude": ["slow"],
 *   "config": { "db_url": "jdbc:h2:mem:test", "retries": 3, "verbose": true }
 * }
 * </pre>
 *
 * Only {@code suites} is required. Without {@code tags_to_exclude} only the ignore tag is excluded; the ignore tag is
 * always excluded in addition to any tags given. Config values must be strings, numbers or booleans. Numbers are
 * parsed as longs when they have no fraction, otherwise as doubles.
 */
public final class JsonRunRequestParser {
    private static final String SUITES_KEY = "suites";
    private static final String TEST_NAME_KEY = "test_name";
    private static final String TAGS_TO_INCLUDE_KEY = "tags_to_include";
    private static final String TAGS_TO_EXCLUDE_KEY = "tags_to_exclude";
    private static final String CONFIG_KEY = "config";

    /**
     * Parses the given request.
     *
     * @param request The request as a JSON string.
     * @return the parsed request.
     * @throws ParseException If the request is not valid JSON or is not structured as expected.
     */
    public RunRequest parseRunRequest(String request) throws ParseException {
        ObjectChecker.assertNonNull(request, "request");

        JsonElement parsedRequest;
        try {
            parsedRequest = JsonParser.parseString(request);
        } catch (JsonParseException e) {
            throw new ParseException(createParseFailureMessage("malformed JSON: " + e.getMessage()), e);
        }
        if (!parsedRequest.isJsonObject()) {
            throw new ParseException(createParseFailureMessage("request is not a JSON object"));
        }
        JsonObject jsonRequest = parsedRequest.getAsJsonObject();

        try {
            List<String> suites = parseAsStringList(jsonRequest, SUITES_KEY);
            if (suites.isEmpty()) {
                throw new ParseException("expected at least one suite in " + SUITES_KEY);
            }

            String testName = jsonRequest.has(TEST_NAME_KEY) ? parseAsString(jsonRequest, TEST_NAME_KEY) : null;

            Set<String> tagsToInclude = null;
            if (jsonRequest.has(TAGS_TO_INCLUDE_KEY)) {
                tagsToInclude = new LinkedHashSet<>(parseAsStringList(jsonRequest, TAGS_TO_INCLUDE_KEY));
                if (tagsToInclude.isEmpty()) {
                    throw new ParseException("expected " + TAGS_TO_INCLUDE_KEY + " to be non-empty when given");
                }
            }

            Set<String> tagsToExclude = new LinkedHashSet<>();
            tagsToExclude.add(Filter.IGNORE_TAG);
            if (jsonRequest.has(TAGS_TO_EXCLUDE_KEY)) {
                tagsToExclude.addAll(parseAsStringList(jsonRequest, TAGS_TO_EXCLUDE_KEY));
            }

            Set<String> testNamesToInclude = (testName == null) ? null : Collections.singleton(testName);
            Map<String, Object> configMap = jsonRequest.has(CONFIG_KEY) ? parseConfig(parseAsJsonObject(jsonRequest, CONFIG_KEY)) : Collections.emptyMap();

            return RunRequest.of(suites, testName, Filter.of(tagsToInclude, tagsToExclude, testNamesToInclude), configMap);
        } catch (ParseException e) {
            throw new ParseException(createParseFailureMessage(e.getMessage()), e);
        }
    }

    private static Map<String, Object> parseConfig(JsonObject config) throws ParseException {
        Map<String, Object> configMap = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : config.entrySet()) {
            JsonElement value = entry.getValue();
            if (!value.isJsonPrimitive()) {
                throw new ParseException("expected config value of " + entry.getKey() + " to be a String, a Number or a Boolean");
            }

            JsonPrimitive primitive = value.getAsJsonPrimitive();
            if (primitive.isBoolean()) {
                configMap.put(entry.getKey(), primitive.getAsBoolean());
            } else if (primitive.isNumber()) {
                configMap.put(entry.getKey(), parseNumber(primitive));
            } else {
                configMap.put(entry.getKey(), primitive.getAsString());
            }
        }
        return configMap;
    }

    private static Number parseNumber(JsonPrimitive primitive) {
        String text = primitive.getAsString();
        if (text.contains(".") || text.contains("e") || text.contains("E")) {
            return primitive.getAsDouble();
        }
        return primitive.getAsLong();
    }

    private static String createParseFailureMessage(String cause) {
        return "Failed to parse run request: " + cause;
    }

    private static String parseAsString(JsonObject json, String attribute) throws ParseException {
        JsonElement element = getElementFromAttribute(json, attribute);
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new ParseException("expected " + attribute + " to be a String");
        }
        return element.getAsString();
    }

    private static List<String> parseAsStringList(JsonObject json, String attribute) throws ParseException {
        JsonElement element = getElementFromAttribute(json, attribute);
        if (!element.isJsonArray()) {
            throw new ParseException("expected " + attribute + " to be a JSON Array");
        }

        JsonArray array = element.getAsJsonArray();
        List<String> values = new ArrayList<>();
        for (JsonElement value : array) {
            if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
                throw new ParseException("expected every element of " + attribute + " to be a String");
            }
            values.add(value.getAsString());
        }
        return values;
    }

    private static JsonObject parseAsJsonObject(JsonObject json, String attribute) throws ParseException {
        JsonElement element = getElementFromAttribute(json, attribute);
        if (!element.isJsonObject()) {
            throw new ParseException("expected " + attribute + " to be a JSON Object");
        }
        return element.getAsJsonObject();
    }

    private static JsonElement getElementFromAttribute(JsonObject json, String attribute) throws ParseException {
        if (!json.has(attribute)) {
            throw new ParseException("missing " + attribute);
        }
        return json.get(attribute);
    }
}
