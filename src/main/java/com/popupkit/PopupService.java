package com.popupkit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.popupkit.condition.VisibilityResolver;
import com.popupkit.dsl.DslSerializer;
import com.popupkit.json.PopupJsonCodec;
import com.popupkit.models.Element;
import com.popupkit.models.ElementKind;
import com.popupkit.models.PopupDefinition;
import com.popupkit.models.PopupResult;
import com.popupkit.models.PopupState;
import com.popupkit.parse.ErrorKind;
import com.popupkit.parse.FormatDetector;
import com.popupkit.parse.PopupParseException;
import com.popupkit.parse.PopupParseResult;
import com.popupkit.parse.PopupValidator;
import com.popupkit.state.ElementLocator;
import com.popupkit.state.ResultCollapser;
import com.popupkit.state.StateDeriver;
import com.popupkit.transform.OtherOptionTransform;

import java.util.HashSet;
import java.util.Set;

/**
 * Entry point for the popup pipeline: raw text in, canonical tree, initial state and
 * collapsed result out.
 */
public class PopupService {

    private final FormatDetector detector;
    private final PopupJsonCodec codec;
    private final boolean injectOther;

    public PopupService(ObjectMapper objectMapper, boolean injectOther) {
        this.detector = new FormatDetector(objectMapper);
        this.codec = new PopupJsonCodec(objectMapper);
        this.injectOther = injectOther;
    }

    public PopupService(ObjectMapper objectMapper) {
        this(objectMapper, false);
    }

    public PopupJsonCodec getCodec() {
        return codec;
    }

    public boolean isInjectOther() {
        return injectOther;
    }

    public PopupDefinition parse(String raw) {
        return prepare(raw, injectOther).getDefinition();
    }

    /**
     * Parse, validate and optionally add the free-text "Other" option to every choice.
     */
    public PopupParseResult prepare(String raw, boolean withOther) {
        PopupParseResult result = detector.detect(raw);
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("Parsed popup '" + result.getDefinition().getTitle() + "' as " + result.getDialect()
                + " (" + result.getDefinition().getElements().size() + " top-level elements)");
        }
        if (!withOther) {
            return result;
        }
        return PopupParseResult.ok(PopupValidator.validate(OtherOptionTransform.apply(result.getDefinition())),
            result.getDialect());
    }

    /**
     * Like {@link #prepare(String, boolean)}, but reports failures in the result instead of throwing.
     */
    public PopupParseResult tryPrepare(String raw, boolean withOther) {
        try {
            return prepare(raw, withOther);
        } catch (PopupParseException e) {
            AppLogger logger = AppLogger.get();
            if (logger != null) {
                logger.warn("Popup parse failed [" + e.getKind().getCode() + "]: " + e.getReason());
            }
            return PopupParseResult.error(e);
        }
    }

    public PopupState deriveState(PopupDefinition definition) {
        return StateDeriver.derive(definition);
    }

    public PopupResult collapse(PopupState state, PopupDefinition definition) {
        return ResultCollapser.collapse(state, definition);
    }

    /**
     * Collapse only the values of elements currently visible under the state.
     */
    public PopupResult collapseVisible(PopupState state, PopupDefinition definition) {
        return ResultCollapser.collapse(state, definition, VisibilityResolver.visibleIds(definition, state));
    }

    public String toDsl(PopupDefinition definition) {
        return DslSerializer.serialize(definition);
    }

    public Element find(PopupDefinition definition, String id) {
        Element element = ElementLocator.findById(definition, id);
        if (element == null) {
            throw new PopupParseException(ErrorKind.ELEMENT_NOT_FOUND, "No element with id '" + id + "'");
        }
        return element;
    }

    public PopupState readState(JsonNode node, PopupDefinition definition) {
        return codec.readState(node, choiceIds(definition));
    }

    /**
     * Ids whose numeric values are option indices rather than numbers.
     */
    static Set<String> choiceIds(PopupDefinition definition) {
        Set<String> ids = new HashSet<>();
        ElementLocator.forEach(definition.getElements(), element -> {
            if (element.getId() != null
                && (element.getKind() == ElementKind.CHOICE || element.getKind() == ElementKind.SELECT)) {
                ids.add(element.getId());
            }
        });
        return ids;
    }
}
