package com.popupkit.json;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.popupkit.models.ButtonsElement;
import com.popupkit.models.CheckboxElement;
import com.popupkit.models.ChoiceElement;
import com.popupkit.models.ConditionalElement;
import com.popupkit.models.Element;
import com.popupkit.models.ElementKind;
import com.popupkit.models.ElementValue;
import com.popupkit.models.GroupElement;
import com.popupkit.models.MultiSelectElement;
import com.popupkit.models.OptionElement;
import com.popupkit.models.OptionValue;
import com.popupkit.models.PopupDefinition;
import com.popupkit.models.PopupState;
import com.popupkit.models.SliderElement;
import com.popupkit.models.TextElement;
import com.popupkit.models.TextInputElement;
import com.popupkit.parse.ErrorKind;
import com.popupkit.parse.PopupParseException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads and writes the strict canonical JSON form of popups and their state.
 * An element object carries its kind as a key whose value is the label:
 * {@code {"slider": "Volume", "id": "volume", "min": 0, "max": 100}}.
 */
public class PopupJsonCodec {

    /**
     * Detection order for kind keys. Text is tried last because "text" is also a plausible
     * option label inside option-as-key children.
     */
    private static final ElementKind[] DETECTION_ORDER = {
        ElementKind.SLIDER, ElementKind.CHECKBOX, ElementKind.TEXTBOX, ElementKind.CHOICE,
        ElementKind.SELECT, ElementKind.MULTISELECT, ElementKind.GROUP, ElementKind.CONDITIONAL,
        ElementKind.BUTTONS, ElementKind.TEXT
    };

    private static final double DEFAULT_SLIDER_MIN = 0;
    private static final double DEFAULT_SLIDER_MAX = 100;

    private final ObjectMapper objectMapper;

    public PopupJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    /**
     * Parse raw JSON text into a tree, mapping syntax errors to positioned failures.
     */
    public JsonNode readTree(String raw) {
        try {
            JsonNode node = objectMapper.readTree(raw);
            if (node == null || node.isMissingNode()) {
                throw new PopupParseException(ErrorKind.MALFORMED_INPUT, "Empty JSON document");
            }
            return node;
        } catch (JsonProcessingException e) {
            JsonLocation location = e.getLocation();
            int line = location != null ? Math.max(1, location.getLineNr()) : 1;
            int column = location != null ? Math.max(1, location.getColumnNr()) : 1;
            int offset = location != null ? (int) Math.max(0, location.getCharOffset()) : 0;
            throw new PopupParseException(ErrorKind.MALFORMED_INPUT, e.getOriginalMessage(), line, column, offset,
                lineAt(raw, line));
        }
    }

    /**
     * Resolve the kind key of an element object, or null when none is present.
     */
    public static ElementKind detectKind(JsonNode node) {
        if (node == null || !node.isObject()) {
            return null;
        }
        for (ElementKind kind : DETECTION_ORDER) {
            if (node.has(kind.getTag())) {
                return kind;
            }
            for (String alias : kind.getAliases()) {
                if (node.has(alias)) {
                    return kind;
                }
            }
        }
        return null;
    }

    static String kindKey(JsonNode node, ElementKind kind) {
        if (node.has(kind.getTag())) {
            return kind.getTag();
        }
        for (String alias : kind.getAliases()) {
            if (node.has(alias)) {
                return alias;
            }
        }
        return null;
    }

    // ---- reading ----

    public PopupDefinition readDefinition(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new PopupParseException(ErrorKind.MALFORMED_INPUT, "Popup definition must be a JSON object");
        }
        JsonNode titleNode = root.get("title");
        JsonNode elementsNode = root.get("elements");
        if (titleNode == null) {
            throw new PopupParseException(ErrorKind.MISSING_REQUIRED_FIELD, "Missing required field 'title'");
        }
        if (elementsNode == null) {
            throw new PopupParseException(ErrorKind.MISSING_REQUIRED_FIELD, "Missing required field 'elements'");
        }
        if (!titleNode.isTextual() && !titleNode.isNull()) {
            throw new PopupParseException(ErrorKind.MALFORMED_INPUT, "Field 'title' must be a string");
        }
        String title = titleNode.isNull() ? null : titleNode.asText();
        return new PopupDefinition(title, readElementList(elementsNode, "elements"));
    }

    List<Element> readElementList(JsonNode node, String path) {
        if (node == null || node.isNull()) {
            return new ArrayList<>();
        }
        if (!node.isArray()) {
            throw malformed(path, "expected an array of elements");
        }
        List<Element> elements = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            elements.add(readElement(node.get(i), path + "[" + i + "]"));
        }
        return elements;
    }

    public Element readElement(JsonNode node, String path) {
        if (node == null || !node.isObject()) {
            throw malformed(path, "element must be an object");
        }
        ElementKind kind = detectKind(node);
        if (kind == null) {
            throw new PopupParseException(ErrorKind.UNKNOWN_WIDGET_KIND,
                path + ": no recognized element kind among keys " + fieldNames(node));
        }
        JsonNode labelNode = node.get(kindKey(node, kind));
        Element element;
        switch (kind) {
            case TEXT:
                element = new TextElement(requireText(labelNode, path, kind));
                break;
            case SLIDER: {
                double min = readNumber(node.get("min"), DEFAULT_SLIDER_MIN, path + ".min");
                double max = readNumber(node.get("max"), DEFAULT_SLIDER_MAX, path + ".max");
                JsonNode def = node.get("default");
                Double defaultValue = def == null || def.isNull() ? null : readNumber(def, 0, path + ".default");
                element = new SliderElement(requireText(labelNode, path, kind), min, max, defaultValue);
                break;
            }
            case CHECKBOX: {
                JsonNode def = node.get("default");
                if (def != null && !def.isNull() && !def.isBoolean()) {
                    throw malformed(path + ".default", "expected a boolean");
                }
                element = new CheckboxElement(requireText(labelNode, path, kind), def != null && def.asBoolean(false));
                break;
            }
            case TEXTBOX: {
                JsonNode placeholder = node.get("placeholder");
                JsonNode rows = node.get("rows");
                if (rows != null && !rows.isNull() && !rows.canConvertToInt()) {
                    throw malformed(path + ".rows", "expected an integer");
                }
                element = new TextInputElement(requireText(labelNode, path, kind),
                    placeholder != null && placeholder.isTextual() ? placeholder.asText() : null,
                    rows != null && !rows.isNull() ? rows.asInt() : null);
                break;
            }
            case CHOICE:
            case SELECT: {
                List<OptionValue> options = readOptions(node.get("options"), path);
                ChoiceElement choice = new ChoiceElement(kind, requireText(labelNode, path, kind), options,
                    readDefaultIndex(node.get("default"), options, path));
                element = readOptionChildren(choice, node.get("option_children"), path);
                break;
            }
            case MULTISELECT: {
                List<OptionValue> options = readOptions(node.get("options"), path);
                element = readOptionChildren(new MultiSelectElement(requireText(labelNode, path, kind), options),
                    node.get("option_children"), path);
                break;
            }
            case GROUP:
                element = new GroupElement(requireText(labelNode, path, kind),
                    readElementList(node.get("elements"), path + ".elements"));
                break;
            case CONDITIONAL:
                element = new ConditionalElement(requireText(labelNode, path, kind), new ArrayList<>());
                break;
            case BUTTONS:
                element = new ButtonsElement(readButtons(labelNode, path));
                break;
            default:
                throw new PopupParseException(ErrorKind.UNKNOWN_WIDGET_KIND, path + ": unsupported kind " + kind);
        }

        JsonNode id = node.get("id");
        if (id != null && !id.isNull()) {
            if (!id.isTextual() || id.asText().isEmpty()) {
                throw malformed(path + ".id", "expected a non-empty string");
            }
            element.setId(id.asText());
        } else if (kind.isValueBearing()) {
            throw new PopupParseException(ErrorKind.MISSING_REQUIRED_FIELD,
                path + ": " + kind.getTag() + " '" + element.getLabel() + "' has no 'id'");
        }
        JsonNode when = node.get("when");
        if (when != null && !when.isNull()) {
            if (!when.isTextual()) {
                throw malformed(path + ".when", "expected a string");
            }
            element.setWhen(when.asText());
        }
        element.setReveals(readElementList(node.get("reveals"), path + ".reveals"));
        return element;
    }

    private List<OptionValue> readOptions(JsonNode node, String path) {
        if (node == null || node.isNull()) {
            throw new PopupParseException(ErrorKind.MISSING_REQUIRED_FIELD, path + ": missing 'options'");
        }
        if (!node.isArray()) {
            throw malformed(path + ".options", "expected an array");
        }
        List<OptionValue> options = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            JsonNode option = node.get(i);
            if (option.isTextual()) {
                options.add(new OptionValue(option.asText()));
            } else if (option.isObject() && option.path("value").isTextual()) {
                JsonNode description = option.get("description");
                options.add(new OptionValue(option.get("value").asText(),
                    description != null && description.isTextual() ? description.asText() : null));
            } else {
                throw malformed(path + ".options[" + i + "]", "expected a string or {\"value\": ...}");
            }
        }
        return options;
    }

    private Integer readDefaultIndex(JsonNode node, List<OptionValue> options, String path) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.canConvertToInt()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            for (int i = 0; i < options.size(); i++) {
                if (options.get(i).getLabel().equals(node.asText())) {
                    return i;
                }
            }
        }
        throw malformed(path + ".default", "expected an option index or option label");
    }

    private <T extends OptionElement> T readOptionChildren(T element, JsonNode node, String path) {
        if (node == null || node.isNull()) {
            return element;
        }
        if (!node.isObject()) {
            throw malformed(path + ".option_children", "expected an object keyed by option label");
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            if (element.indexOfOption(entry.getKey()) < 0) {
                throw malformed(path + ".option_children", "'" + entry.getKey() + "' is not one of the options");
            }
            element.putOptionChildren(entry.getKey(),
                readElementList(entry.getValue(), path + ".option_children." + entry.getKey()));
        }
        return element;
    }

    private List<String> readButtons(JsonNode node, String path) {
        if (node == null || !node.isArray()) {
            throw malformed(path + ".buttons", "expected an array of labels");
        }
        List<String> buttons = new ArrayList<>();
        for (JsonNode button : node) {
            if (!button.isTextual()) {
                throw malformed(path + ".buttons", "button labels must be strings");
            }
            buttons.add(button.asText());
        }
        return buttons;
    }

    private static String requireText(JsonNode node, String path, ElementKind kind) {
        if (node == null || !node.isTextual()) {
            throw malformed(path, "'" + kind.getTag() + "' must be a string");
        }
        return node.asText();
    }

    private static double readNumber(JsonNode node, double fallback, String path) {
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isNumber()) {
            throw malformed(path, "expected a number");
        }
        return node.asDouble();
    }

    private static PopupParseException malformed(String path, String reason) {
        return new PopupParseException(ErrorKind.MALFORMED_INPUT, path + ": " + reason);
    }

    private static List<String> fieldNames(JsonNode node) {
        List<String> names = new ArrayList<>();
        node.fieldNames().forEachRemaining(names::add);
        return names;
    }

    private static String lineAt(String raw, int line) {
        if (raw == null) {
            return null;
        }
        String[] lines = raw.split("\n", -1);
        return line >= 1 && line <= lines.length ? lines[line - 1] : null;
    }

    // ---- writing ----

    public ObjectNode writeDefinition(PopupDefinition definition) {
        ObjectNode root = objectMapper.createObjectNode();
        if (definition.getTitle() != null) {
            root.put("title", definition.getTitle());
        } else {
            root.putNull("title");
        }
        root.set("elements", writeElementList(definition.getElements()));
        return root;
    }

    private ArrayNode writeElementList(List<Element> elements) {
        ArrayNode array = objectMapper.createArrayNode();
        for (Element element : elements) {
            array.add(writeElement(element));
        }
        return array;
    }

    public ObjectNode writeElement(Element element) {
        ObjectNode node = objectMapper.createObjectNode();
        ElementKind kind = element.getKind();
        if (kind == ElementKind.BUTTONS) {
            ArrayNode buttons = node.putArray(kind.getTag());
            for (String button : ((ButtonsElement) element).getButtons()) {
                buttons.add(button);
            }
        } else {
            node.put(kind.getTag(), element.getLabel());
        }
        if (element.getId() != null) {
            node.put("id", element.getId());
        }
        if (element.getWhen() != null && !(kind == ElementKind.CONDITIONAL && element.getWhen().equals(element.getLabel()))) {
            node.put("when", element.getWhen());
        }

        switch (kind) {
            case SLIDER: {
                SliderElement slider = (SliderElement) element;
                node.put("min", slider.getMin());
                node.put("max", slider.getMax());
                if (slider.getDefaultValue() != null) {
                    node.put("default", slider.getDefaultValue());
                }
                break;
            }
            case CHECKBOX:
                node.put("default", ((CheckboxElement) element).getDefaultValue());
                break;
            case TEXTBOX: {
                TextInputElement input = (TextInputElement) element;
                if (input.getPlaceholder() != null) {
                    node.put("placeholder", input.getPlaceholder());
                }
                if (input.getRows() != null) {
                    node.put("rows", input.getRows());
                }
                break;
            }
            case CHOICE:
            case SELECT:
            case MULTISELECT:
                writeOptions(node, (OptionElement) element);
                if (element instanceof ChoiceElement && ((ChoiceElement) element).getDefaultIndex() != null) {
                    node.put("default", ((ChoiceElement) element).getDefaultIndex());
                }
                break;
            case GROUP:
                node.set("elements", writeElementList(((GroupElement) element).getElements()));
                break;
            default:
                break;
        }

        if (!element.getReveals().isEmpty()) {
            node.set("reveals", writeElementList(element.getReveals()));
        }
        return node;
    }

    private void writeOptions(ObjectNode node, OptionElement element) {
        ArrayNode options = node.putArray("options");
        for (OptionValue option : element.getOptions()) {
            if (option.hasDescription()) {
                ObjectNode entry = options.addObject();
                entry.put("value", option.getLabel());
                entry.put("description", option.getDescription());
            } else {
                options.add(option.getLabel());
            }
        }
        if (!element.getOptionChildren().isEmpty()) {
            ObjectNode children = node.putObject("option_children");
            for (Map.Entry<String, List<Element>> entry : element.getOptionChildren().entrySet()) {
                children.set(entry.getKey(), writeElementList(entry.getValue()));
            }
        }
    }

    // ---- state ----

    public ObjectNode writeState(PopupState state) {
        ObjectNode node = objectMapper.createObjectNode();
        ObjectNode values = node.putObject("values");
        for (Map.Entry<String, ElementValue> entry : state.getValues().entrySet()) {
            values.set(entry.getKey(), writeValue(entry.getValue()));
        }
        if (state.getButtonClicked() != null) {
            node.put("button_clicked", state.getButtonClicked());
        } else {
            node.putNull("button_clicked");
        }
        return node;
    }

    public JsonNode writeValue(ElementValue value) {
        switch (value.getType()) {
            case NUMBER:
                return objectMapper.getNodeFactory().numberNode(value.asNumber());
            case BOOLEAN:
                return objectMapper.getNodeFactory().booleanNode(value.asBoolean());
            case TEXT:
                return objectMapper.getNodeFactory().textNode(value.asText());
            case CHOICE:
                return value.asChoice() != null
                    ? objectMapper.getNodeFactory().numberNode(value.asChoice())
                    : objectMapper.getNodeFactory().nullNode();
            case MULTI_CHOICE: {
                ArrayNode array = objectMapper.createArrayNode();
                for (Boolean selected : value.asMultiChoice()) {
                    array.add(selected);
                }
                return array;
            }
            default:
                throw new IllegalStateException("Unhandled value type " + value.getType());
        }
    }

    /**
     * Read a state object. JSON shapes map onto value variants: numbers become numeric values
     * except where {@code choiceIds} marks a single-choice element, whose values are indices.
     */
    public PopupState readState(JsonNode node, Set<String> choiceIds) {
        if (node == null || !node.isObject()) {
            throw new PopupParseException(ErrorKind.MALFORMED_INPUT, "State must be a JSON object");
        }
        Map<String, ElementValue> values = new LinkedHashMap<>();
        JsonNode valuesNode = node.path("values");
        Iterator<Map.Entry<String, JsonNode>> fields = valuesNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            values.put(entry.getKey(), readValue(entry.getValue(), choiceIds.contains(entry.getKey()), entry.getKey()));
        }
        JsonNode button = node.get("button_clicked");
        return new PopupState(values, button != null && button.isTextual() ? button.asText() : null);
    }

    private ElementValue readValue(JsonNode node, boolean choice, String id) {
        if (choice) {
            if (node.isNull()) {
                return ElementValue.choice(null);
            }
            if (node.canConvertToInt()) {
                return ElementValue.choice(node.asInt());
            }
        } else if (node.isNumber()) {
            return ElementValue.number(node.asDouble());
        }
        if (node.isBoolean()) {
            return ElementValue.bool(node.asBoolean());
        }
        if (node.isTextual()) {
            return ElementValue.text(node.asText());
        }
        if (node.isArray()) {
            List<Boolean> selections = new ArrayList<>();
            for (JsonNode flag : node) {
                selections.add(flag.asBoolean(false));
            }
            return ElementValue.multiChoice(selections);
        }
        if (node.isNull()) {
            return ElementValue.choice(null);
        }
        throw new PopupParseException(ErrorKind.MALFORMED_INPUT, "values." + id + ": unsupported value shape");
    }
}
