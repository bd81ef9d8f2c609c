package com.specforge.core.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.specforge.core.error.ErrorCode;
import com.specforge.core.model.DeterministicTest;
import com.specforge.core.model.ParseIssue;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes fenced {@code json} blocks into deterministic tests.
 *
 * <p>Each block is decoded on its own. A block that is not valid JSON, or does not hold
 * an object (or an array of objects), is dropped and reported as a {@link ParseIssue};
 * the remaining blocks are still decoded.
 */
public final class DeterministicTestExtractor {

    private static final Pattern JSON_BLOCK = Pattern.compile(
        "```json[ \\t]*\\n(.*?)\\n[ \\t]*```", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);

    private static final Pattern DT_TOKEN = Pattern.compile("\\bDT[-_]?(\\d+)\\b", Pattern.CASE_INSENSITIVE);

    private final ObjectMapper objectMapper;

    public DeterministicTestExtractor(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Decoded tests plus faults for dropped blocks.
     *
     * @param tests decoded tests in document order
     * @param issues one issue per dropped block
     */
    public record Extraction(List<DeterministicTest> tests, List<ParseIssue> issues) {
    }

    /**
     * Extracts deterministic tests from section text.
     *
     * <p>Test ids come from the object's {@code id} field, else the nearest {@code DT-<n>}
     * token between the previous block and this one, else {@code DT-<position>}.
     *
     * @param text deterministic-tests section text (may be empty)
     * @return extraction result
     */
    public Extraction extract(String text) {
        List<DeterministicTest> tests = new ArrayList<>();
        List<ParseIssue> issues = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return new Extraction(tests, issues);
        }

        Matcher block = JSON_BLOCK.matcher(text);
        int previousEnd = 0;
        int blockIndex = 0;
        while (block.find()) {
            blockIndex++;
            String location = "deterministic_tests block " + blockIndex;
            String labelId = nearestLabel(text.substring(previousEnd, block.start()));
            previousEnd = block.end();

            JsonNode node;
            try {
                node = objectMapper.readTree(block.group(1));
            } catch (JsonProcessingException e) {
                issues.add(new ParseIssue(ErrorCode.PARSE_BLOCK,
                    "Invalid JSON in deterministic test block: " + e.getOriginalMessage(), location));
                continue;
            }

            if (node != null && node.isObject()) {
                tests.add(toTest(node, labelId, tests.size() + 1));
            } else if (node != null && node.isArray() && allObjects(node)) {
                for (JsonNode element : node) {
                    tests.add(toTest(element, null, tests.size() + 1));
                }
            } else {
                issues.add(new ParseIssue(ErrorCode.PARSE_BLOCK,
                    "Deterministic test block must hold a JSON object", location));
            }
        }
        return new Extraction(tests, issues);
    }

    private static DeterministicTest toTest(JsonNode node, String labelId, int position) {
        String id = node.hasNonNull("id") ? node.get("id").asText() : labelId;
        if (id == null || id.isBlank()) {
            id = "DT-" + position;
        }
        JsonNode expected = node.has("expected") ? node.get("expected") : node.get("output");
        return new DeterministicTest(id, node.get("input"), expected);
    }

    private static boolean allObjects(JsonNode array) {
        if (array.isEmpty()) {
            return false;
        }
        for (JsonNode element : array) {
            if (!element.isObject()) {
                return false;
            }
        }
        return true;
    }

    private static String nearestLabel(String preceding) {
        Matcher token = DT_TOKEN.matcher(preceding);
        String last = null;
        while (token.find()) {
            last = "DT-" + token.group(1);
        }
        return last;
    }
}
