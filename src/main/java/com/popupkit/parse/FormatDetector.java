package com.popupkit.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.popupkit.AppLogger;
import com.popupkit.dsl.ClassicDialectParser;
import com.popupkit.dsl.DialectParser;
import com.popupkit.dsl.NaturalDialectParser;
import com.popupkit.dsl.StructuredDialectParser;
import com.popupkit.json.ErgonomicNormalizer;
import com.popupkit.json.PopupJsonCodec;
import com.popupkit.models.PopupDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides how a raw popup payload is read: strict canonical JSON, relaxed JSON through the
 * normalizer, or one of the textual dialects in fixed order.
 */
public class FormatDetector {

    public static final String FORMAT_STRICT_JSON = "json";
    public static final String FORMAT_ERGONOMIC_JSON = "ergonomic-json";

    private final PopupJsonCodec codec;
    private final ErgonomicNormalizer normalizer;
    private final List<DialectParser> dialects;

    public FormatDetector(ObjectMapper objectMapper) {
        this.codec = new PopupJsonCodec(objectMapper);
        this.normalizer = new ErgonomicNormalizer(codec.getObjectMapper());
        this.dialects = List.of(new ClassicDialectParser(), new NaturalDialectParser(), new StructuredDialectParser());
    }

    public PopupDefinition parse(String raw) {
        return detect(raw).getDefinition();
    }

    /**
     * Like {@link #parse(String)}, but never throws.
     */
    public PopupParseResult tryParse(String raw) {
        try {
            return detect(raw);
        } catch (PopupParseException e) {
            return PopupParseResult.error(e);
        }
    }

    /**
     * Parse and validate, reporting which format was used.
     */
    public PopupParseResult detect(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new PopupParseException(ErrorKind.MALFORMED_INPUT, "Empty popup definition");
        }
        String input = unwrapCodeFence(raw);
        AppLogger logger = AppLogger.get();

        PopupParseException jsonError = null;
        String trimmed = input.trim();
        if (trimmed.startsWith("{")) {
            JsonNode root = null;
            try {
                root = codec.readTree(trimmed);
            } catch (PopupParseException e) {
                jsonError = e;
            }
            if (root != null && root.isObject()) {
                if (!root.has("title")) {
                    throw new PopupParseException(ErrorKind.MISSING_REQUIRED_FIELD, "Missing required field 'title'");
                }
                if (!root.has("elements")) {
                    throw new PopupParseException(ErrorKind.MISSING_REQUIRED_FIELD, "Missing required field 'elements'");
                }
                if (normalizer.isStrict(root)) {
                    if (logger != null) {
                        logger.debug("Popup payload read as strict JSON");
                    }
                    return PopupParseResult.ok(PopupValidator.validate(codec.readDefinition(root)), FORMAT_STRICT_JSON);
                }
                if (logger != null) {
                    logger.info("Popup payload uses relaxed JSON shapes; normalizing");
                }
                return PopupParseResult.ok(PopupValidator.validate(codec.readDefinition(normalizer.normalize(root))),
                    FORMAT_ERGONOMIC_JSON);
            }
        }

        if (isJsonArray(trimmed)) {
            throw new PopupParseException(ErrorKind.MALFORMED_INPUT, "Popup JSON must be an object, not an array");
        }

        List<DialectParser> envelopes = new ArrayList<>();
        for (DialectParser dialect : dialects) {
            if (dialect.matchesEnvelope(input)) {
                envelopes.add(dialect);
            }
        }
        if (envelopes.size() > 1 && logger != null) {
            logger.warn("Input matches " + envelopes.size() + " dialect envelopes; using " + envelopes.get(0).getName()
                + " (" + ErrorKind.AMBIGUOUS_FORMAT.getCode() + ")");
        }

        PopupParseException best = jsonError;
        for (DialectParser dialect : dialects) {
            boolean envelope = envelopes.contains(dialect);
            if (!envelopes.isEmpty() && !envelope) {
                continue;
            }
            PopupDefinition definition;
            try {
                definition = dialect.parse(input);
            } catch (PopupParseException e) {
                if (envelope) {
                    throw e;
                }
                best = richer(best, e);
                continue;
            }
            if (logger != null) {
                logger.debug("Popup payload read as " + dialect.getName() + " dialect");
            }
            // Validation failures belong to the dialect that parsed; no other dialect is tried.
            return PopupParseResult.ok(PopupValidator.validate(definition), dialect.getName());
        }
        throw best != null ? best : new PopupParseException(ErrorKind.MALFORMED_INPUT, "Unrecognized popup format");
    }

    /**
     * Whole input is one JSON array. Bracketed button rows such as {@code [Save | Cancel]} are not.
     */
    boolean isJsonArray(String trimmed) {
        if (!trimmed.startsWith("[") || !trimmed.endsWith("]")) {
            return false;
        }
        try {
            JsonNode node = codec.getObjectMapper().reader()
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .readTree(trimmed);
            return node != null && node.isArray();
        } catch (JsonProcessingException e) {
            return false;
        }
    }

    /**
     * The error from the parser that got furthest into the input.
     */
    static PopupParseException richer(PopupParseException current, PopupParseException candidate) {
        if (current == null) {
            return candidate;
        }
        return candidate.getOffset() > current.getOffset() ? candidate : current;
    }

    /**
     * Strip a surrounding Markdown code fence, keeping line numbers stable.
     */
    static String unwrapCodeFence(String raw) {
        String trimmed = raw.trim();
        if (!trimmed.startsWith("```") || !trimmed.endsWith("```") || trimmed.length() < 6) {
            return raw;
        }
        String[] lines = raw.split("\n", -1);
        int first = -1;
        int last = -1;
        for (int i = 0; i < lines.length; i++) {
            if (!lines[i].trim().isEmpty()) {
                if (first < 0) {
                    first = i;
                }
                last = i;
            }
        }
        if (first == last || !lines[first].trim().startsWith("```") || !"```".equals(lines[last].trim())) {
            return raw;
        }
        lines[first] = "";
        lines[last] = "";
        return String.join("\n", lines);
    }
}
