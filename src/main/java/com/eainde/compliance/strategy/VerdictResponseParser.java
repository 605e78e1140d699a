package com.eainde.compliance.strategy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns a raw completion payload into {@link LlmFeatureVerdict} records.
 *
 * <h3>Passes:</h3>
 * <ol>
 *   <li>Strict parse of the payload with code fences stripped</li>
 *   <li>Sanitize: drop control characters, normalize smart quotes, then fix
 *       {@code True/False} outside string literals, invalid escapes inside them
 *       and trailing commas; strict parse again</li>
 *   <li>Permissive parse of the outermost balanced {@code {...}} block</li>
 * </ol>
 * If all passes fail, or no results array is present, a {@link ResponseParseException} is thrown.
 */
public class VerdictResponseParser {

    private static final Logger log = LoggerFactory.getLogger(VerdictResponseParser.class);

    private static final String[] RESULT_KEYS = {"feature_results", "results", "verdicts"};

    private static final Pattern LEADING_FENCE = Pattern.compile("^```(?:json)?\\s*");
    private static final Pattern TRAILING_FENCE = Pattern.compile("\\s*```\\s*$");
    private static final String VALID_ESCAPES = "\"\\/bfnrtu";
    private static final Pattern TRAILING_COMMA = Pattern.compile(",(\\s*[}\\]])");

    private final ObjectMapper objectMapper;

    public VerdictResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param rawResponse payload returned by the completion service
     * @return per-feature records in response order, possibly empty
     * @throws ResponseParseException if the payload is blank or has no parseable results array
     */
    public List<LlmFeatureVerdict> parse(String rawResponse) throws ResponseParseException {
        if (rawResponse == null || rawResponse.isBlank()) {
            throw new ResponseParseException("Empty completion payload");
        }

        String unfenced = stripFences(rawResponse);
        JsonNode root;
        try {
            root = objectMapper.readTree(unfenced);
        } catch (JsonProcessingException strictFailure) {
            log.debug("Strict parse failed ({}), sanitizing", strictFailure.getOriginalMessage());
            root = parseSanitized(sanitize(unfenced));
        }

        JsonNode results = findResultsArray(root);
        if (results == null) {
            throw new ResponseParseException("Payload has no feature_results array");
        }

        List<LlmFeatureVerdict> parsed = new ArrayList<>(results.size());
        for (JsonNode node : results) {
            if (!node.isObject()) {
                throw new ResponseParseException("feature_results entry is not an object: " + node.getNodeType());
            }
            try {
                parsed.add(objectMapper.treeToValue(node, LlmFeatureVerdict.class));
            } catch (JsonProcessingException e) {
                throw new ResponseParseException("Malformed feature_results entry", e);
            }
        }
        return parsed;
    }

    // =========================================================================
    //  Sanitizing
    // =========================================================================

    private JsonNode parseSanitized(String sanitized) throws ResponseParseException {
        try {
            return objectMapper.readTree(sanitized);
        } catch (JsonProcessingException sanitizedFailure) {
            log.warn("Parse of sanitized payload failed ({}), trying balanced-brace extraction",
                    sanitizedFailure.getOriginalMessage());
            String extracted = extractOutermostObject(sanitized);
            try {
                return objectMapper.readTree(extracted);
            } catch (JsonProcessingException permissiveFailure) {
                throw new ResponseParseException("Payload is not valid JSON after extraction", permissiveFailure);
            }
        }
    }

    private static String stripFences(String text) {
        String cleaned = text.strip();
        cleaned = LEADING_FENCE.matcher(cleaned).replaceFirst("");
        cleaned = TRAILING_FENCE.matcher(cleaned).replaceFirst("");
        return cleaned.strip();
    }

    String sanitize(String text) {
        String cleaned = stripFences(text);

        StringBuilder sb = new StringBuilder(cleaned.length());
        for (int i = 0; i < cleaned.length(); i++) {
            char c = cleaned.charAt(i);
            switch (c) {
                case '“', '”' -> sb.append('"');
                case '‘', '’' -> sb.append('\'');
                default -> {
                    if (!Character.isISOControl(c) || c == '\n' || c == '\r' || c == '\t') {
                        sb.append(c);
                    }
                }
            }
        }
        cleaned = sb.toString();

        cleaned = repairLiterals(cleaned);
        cleaned = TRAILING_COMMA.matcher(cleaned).replaceAll("$1");
        return cleaned.strip();
    }

    /**
     * Rewrites {@code True}/{@code False} tokens outside string literals and doubles
     * backslashes inside them that do not start a valid escape. Escape pairs are consumed
     * whole, so an escaped backslash stays as it is.
     */
    static String repairLiterals(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        boolean inString = false;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') {
                    if (i + 1 < text.length() && VALID_ESCAPES.indexOf(text.charAt(i + 1)) >= 0) {
                        sb.append(c).append(text.charAt(i + 1));
                        i += 2;
                    } else {
                        sb.append("\\\\");
                        i++;
                    }
                    continue;
                }
                if (c == '"') {
                    inString = false;
                }
                sb.append(c);
                i++;
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (isToken(text, i, "True")) {
                sb.append("true");
                i += 4;
                continue;
            } else if (isToken(text, i, "False")) {
                sb.append("false");
                i += 5;
                continue;
            }
            sb.append(c);
            i++;
        }
        return sb.toString();
    }

    private static boolean isToken(String text, int at, String word) {
        if (!text.startsWith(word, at)) return false;
        boolean startsWord = at == 0 || !Character.isLetterOrDigit(text.charAt(at - 1));
        int end = at + word.length();
        boolean endsWord = end == text.length() || !Character.isLetterOrDigit(text.charAt(end));
        return startsWord && endsWord;
    }

    /**
     * Returns the first balanced {@code {...}} block, ignoring braces inside string literals.
     */
    String extractOutermostObject(String text) throws ResponseParseException {
        int start = text.indexOf('{');
        if (start < 0) {
            throw new ResponseParseException("No JSON object start found");
        }

        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return text.substring(start, i + 1);
                }
            }
        }
        throw new ResponseParseException("No matching closing brace found");
    }

    private JsonNode findResultsArray(JsonNode root) {
        if (root == null) return null;
        if (root.isArray()) return root;
        for (String key : RESULT_KEYS) {
            if (root.has(key) && root.get(key).isArray()) {
                return root.get(key);
            }
        }
        return null;
    }
}
