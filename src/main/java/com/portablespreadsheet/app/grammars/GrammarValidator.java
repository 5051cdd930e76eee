package com.portablespreadsheet.app.grammars;

import com.fasterxml.jackson.databind.JsonNode;
import com.portablespreadsheet.app.exceptions.GrammarException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Checks that a grammar has exactly the shape of the reference grammar:
 * the same keys at every level, values of the same JSON type, and order
 * arrays that are a permutation of the reference ones.
 */
public class GrammarValidator {

    private final JsonNode referenceShape;

    public GrammarValidator(JsonNode referenceShape) {
        this.referenceShape = referenceShape;
    }

    public boolean isValid(JsonNode candidate) {
        try {
            check(candidate);
            return true;
        } catch (GrammarException e) {
            return false;
        }
    }

    /**
     * @throws GrammarException naming the first offending path
     */
    public void check(JsonNode candidate) {
        if (candidate == null || !candidate.isObject()) {
            throw new GrammarException("Grammar must be a JSON object");
        }
        check(referenceShape, candidate, "");
    }

    private void check(JsonNode reference, JsonNode candidate, String path) {
        if (reference.isObject()) {
            if (!candidate.isObject()) {
                throw new GrammarException("Expected an object at " + describe(path));
            }
            Iterator<Map.Entry<String, JsonNode>> fields = reference.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String childPath = path + "/" + field.getKey();
                JsonNode child = candidate.get(field.getKey());
                if (child == null) {
                    throw new GrammarException("Missing key " + childPath);
                }
                check(field.getValue(), child, childPath);
            }
            Iterator<String> names = candidate.fieldNames();
            while (names.hasNext()) {
                String name = names.next();
                if (!reference.has(name)) {
                    throw new GrammarException("Unknown key " + path + "/" + name);
                }
            }
        } else if (reference.isArray()) {
            if (!candidate.isArray() || !isPermutation(reference, candidate)) {
                throw new GrammarException("Expected a permutation of " + reference + " at " + describe(path));
            }
        } else if (reference.isIntegralNumber()) {
            if (!candidate.isIntegralNumber()) {
                throw new GrammarException("Expected an integer at " + describe(path));
            }
        } else if (reference.getNodeType() != candidate.getNodeType()) {
            throw new GrammarException("Expected " + reference.getNodeType().name().toLowerCase()
                    + " at " + describe(path));
        }
    }

    private static boolean isPermutation(JsonNode reference, JsonNode candidate) {
        if (reference.size() != candidate.size()) {
            return false;
        }
        List<String> remaining = new ArrayList<>();
        reference.forEach(item -> remaining.add(item.asText()));
        for (JsonNode item : candidate) {
            if (!item.isTextual() || !remaining.remove(item.asText())) {
                return false;
            }
        }
        return true;
    }

    private static String describe(String path) {
        return path.isEmpty() ? "the root" : path;
    }
}
