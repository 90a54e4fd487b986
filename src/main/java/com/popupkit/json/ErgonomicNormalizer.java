package com.popupkit.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.popupkit.models.ElementKind;
import com.popupkit.parse.ErrorKind;
import com.popupkit.parse.PopupParseException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites relaxed JSON into the strict canonical shape read by {@link PopupJsonCodec}.
 * The rewrite is purely structural: it never introduces a widget kind and leaves
 * already-strict elements as they are. The input tree is not modified.
 */
public class ErgonomicNormalizer {

    private static final Set<String> RESERVED_KEYS = Set.of(
        "id", "when", "reveals", "option_children", "options", "default", "min", "max",
        "placeholder", "rows", "elements", "description"
    );

    private final ObjectMapper objectMapper;

    public ErgonomicNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
    }

    /**
     * True when normalizing the root would change nothing.
     */
    public boolean isStrict(JsonNode root) {
        return root != null && root.isObject()
            && root.path("title").isTextual()
            && root.path("elements").isArray()
            && normalize(root).equals(root);
    }

    public ObjectNode normalize(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new PopupParseException(ErrorKind.MALFORMED_INPUT, "Popup definition must be a JSON object");
        }
        ObjectNode copy = ((ObjectNode) root).deepCopy();
        JsonNode elements = copy.get("elements");
        if (elements != null) {
            copy.set("elements", normalizeList(elements));
        }
        return copy;
    }

    private JsonNode normalizeList(JsonNode node) {
        if (node.isObject() || node.isTextual()) {
            ArrayNode wrapped = objectMapper.createArrayNode();
            wrapped.add(normalizeElement(node));
            return wrapped;
        }
        if (!node.isArray()) {
            return node;
        }
        ArrayNode result = objectMapper.createArrayNode();
        for (JsonNode child : node) {
            result.add(normalizeElement(child));
        }
        return result;
    }

    JsonNode normalizeElement(JsonNode node) {
        if (node.isTextual()) {
            return textElement(node.asText());
        }
        if (!node.isObject()) {
            return node;
        }
        ObjectNode element = (ObjectNode) node;
        ElementKind kind = PopupJsonCodec.detectKind(element);
        if (kind == null) {
            return element;
        }

        if (kind.hasOptions()) {
            normalizeOptions(element);
        }
        if (kind.isValueBearing() && !element.hasNonNull("id")) {
            JsonNode label = element.get(PopupJsonCodec.kindKey(element, kind));
            element.put("id", IdGenerator.slug(label != null && label.isTextual() ? label.asText() : null));
        }

        JsonNode reveals = element.get("reveals");
        if (reveals != null && !reveals.isNull()) {
            element.set("reveals", normalizeList(reveals));
        }
        if (kind == ElementKind.GROUP) {
            JsonNode members = element.get("elements");
            if (members != null && !members.isNull()) {
                element.set("elements", normalizeList(members));
            }
        }
        if (kind.hasOptions()) {
            normalizeOptionChildren(element, kind);
        }
        return element;
    }

    /**
     * Comma-separated option strings become lists; option objects using "because" are given
     * the canonical "description" key.
     */
    private void normalizeOptions(ObjectNode element) {
        JsonNode options = element.get("options");
        if (options == null) {
            return;
        }
        if (options.isTextual()) {
            ArrayNode list = objectMapper.createArrayNode();
            for (String part : options.asText().split(",")) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    list.add(trimmed);
                }
            }
            element.set("options", list);
            return;
        }
        if (!options.isArray()) {
            return;
        }
        for (JsonNode option : options) {
            if (option.isObject() && option.has("because") && !option.has("description")) {
                ObjectNode entry = (ObjectNode) option;
                entry.set("description", entry.get("because"));
                entry.remove("because");
            }
        }
    }

    private void normalizeOptionChildren(ObjectNode element, ElementKind kind) {
        Set<String> optionLabels = optionLabels(element.get("options"));
        ObjectNode children = element.has("option_children") && element.get("option_children").isObject()
            ? (ObjectNode) element.get("option_children")
            : null;

        // Option-as-key shorthand: {"choice": "Mode", "options": ["A", "B"], "A": [...]}
        String kindKey = PopupJsonCodec.kindKey(element, kind);
        List<String> moved = new ArrayList<>();
        Iterator<String> names = element.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!name.equals(kindKey) && !RESERVED_KEYS.contains(name) && optionLabels.contains(name)) {
                moved.add(name);
            }
        }
        if (!moved.isEmpty() && children == null) {
            children = objectMapper.createObjectNode();
        }
        for (String name : moved) {
            if (!children.has(name)) {
                children.set(name, element.get(name));
            }
            element.remove(name);
        }
        if (children == null) {
            return;
        }

        Iterator<Map.Entry<String, JsonNode>> fields = children.fields();
        List<String> keys = new ArrayList<>();
        while (fields.hasNext()) {
            keys.add(fields.next().getKey());
        }
        for (String key : keys) {
            children.set(key, normalizeList(children.get(key)));
        }
        element.set("option_children", children);
    }

    private Set<String> optionLabels(JsonNode options) {
        Set<String> labels = new HashSet<>();
        if (options == null || !options.isArray()) {
            return labels;
        }
        for (JsonNode option : options) {
            if (option.isTextual()) {
                labels.add(option.asText());
            } else if (option.isObject() && option.path("value").isTextual()) {
                labels.add(option.get("value").asText());
            }
        }
        return labels;
    }

    private ObjectNode textElement(String content) {
        ObjectNode text = objectMapper.createObjectNode();
        text.put(ElementKind.TEXT.getTag(), content);
        return text;
    }
}
