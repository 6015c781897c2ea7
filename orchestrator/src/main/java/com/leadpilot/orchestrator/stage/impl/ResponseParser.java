package com.leadpilot.orchestrator.stage.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.leadpilot.orchestrator.stage.StageFailure;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the JSON object a stage prompt asks Claude to produce.
 *
 * Claude is told to wrap its answer in {@code <result>...</result>}, but in
 * practice it sometimes uses a ```json fence or plain text around a bare
 * object. Candidates are tried in that order:
 *   1. content of the first result tag
 *   2. content of the first fenced block
 *   3. the whole response
 *   4. the span from the first '{' to the last '}'
 */
public class ResponseParser {

    private static final Pattern RESULT_TAG = Pattern.compile(
            "<result>(.*?)</result>",
            Pattern.DOTALL
    );

    // ```json ... ``` or ``` ... ```
    private static final Pattern JSON_FENCE = Pattern.compile(
            "```(?:json)?\\s*\\n(.*?)\\n\\s*```",
            Pattern.DOTALL
    );

    private ResponseParser() {}

    public static Optional<String> extractResult(String response) {
        Matcher m = RESULT_TAG.matcher(response);
        return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
    }

    public static Optional<String> extractJsonFence(String response) {
        Matcher m = JSON_FENCE.matcher(response);
        return m.find() ? Optional.of(m.group(1).strip()) : Optional.empty();
    }

    /** The outermost brace span, or empty if the text has no '{' ... '}' pair. */
    public static Optional<String> extractBraces(String response) {
        int start = response.indexOf('{');
        int end   = response.lastIndexOf('}');
        return start >= 0 && end > start ? Optional.of(response.substring(start, end + 1)) : Optional.empty();
    }

    /**
     * Parse the response into a JSON object.
     *
     * @throws StageFailure of kind PARSE_ERROR if no candidate is a JSON object
     */
    public static ObjectNode parseObject(String response, ObjectMapper json) {
        if (response == null || response.isBlank()) {
            throw new StageFailure(StageFailure.Kind.PARSE_ERROR, "Empty response");
        }
        List<String> candidates = new ArrayList<>();
        extractResult(response).ifPresent(candidates::add);
        extractJsonFence(response).ifPresent(candidates::add);
        candidates.add(response.strip());
        extractBraces(response).ifPresent(candidates::add);

        for (String c : candidates) {
            try {
                JsonNode node = json.readTree(c);
                if (node != null && node.isObject()) {
                    return (ObjectNode) node;
                }
            } catch (JsonProcessingException e) {
                // try the next candidate
            }
        }
        String preview = response.length() > 200 ? response.substring(0, 200) + "..." : response;
        throw new StageFailure(StageFailure.Kind.PARSE_ERROR, "No JSON object in response: " + preview);
    }
}
