package com.popupkit.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.popupkit.models.ChoiceElement;
import com.popupkit.models.ConditionalElement;
import com.popupkit.models.ElementKind;
import com.popupkit.models.ElementValue;
import com.popupkit.models.PopupDefinition;
import com.popupkit.models.PopupState;
import com.popupkit.models.SliderElement;
import com.popupkit.parse.ErrorKind;
import com.popupkit.parse.PopupParseException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class PopupJsonCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final PopupJsonCodec codec = new PopupJsonCodec(mapper);

    private PopupDefinition read(String json) {
        return codec.readDefinition(codec.readTree(json));
    }

    @Test
    void readsEveryKind() {
        PopupDefinition def = read("{\"title\":\"All\",\"elements\":["
            + "{\"text\":\"Hi\"},"
            + "{\"slider\":\"Vol\",\"id\":\"vol\",\"min\":1,\"max\":10},"
            + "{\"checkbox\":\"On\",\"id\":\"on\",\"default\":true},"
            + "{\"textbox\":\"Name\",\"id\":\"name\",\"placeholder\":\"you\",\"rows\":3},"
            + "{\"select\":\"Size\",\"id\":\"size\",\"options\":[\"S\",\"M\"],\"default\":\"M\"},"
            + "{\"multiselect\":\"Tags\",\"id\":\"tags\",\"options\":[\"a\",{\"value\":\"b\",\"description\":\"bee\"}]},"
            + "{\"group\":\"G\",\"elements\":[{\"text\":\"inside\"}]},"
            + "{\"conditional\":\"on\",\"reveals\":[{\"text\":\"shown\"}]},"
            + "{\"buttons\":[\"OK\",\"Cancel\"]}]}");

        assertEquals("All", def.getTitle());
        assertEquals(9, def.getElements().size());
        SliderElement slider = (SliderElement) def.getElements().get(1);
        assertEquals(1.0, slider.getMin());
        assertNull(slider.getDefaultValue());
        ChoiceElement size = (ChoiceElement) def.getElements().get(4);
        assertEquals(ElementKind.SELECT, size.getKind());
        assertEquals(1, size.getDefaultIndex());
        ConditionalElement conditional = (ConditionalElement) def.getElements().get(7);
        assertEquals("on", conditional.getWhen());
        assertEquals(1, conditional.getReveals().size());
    }

    @Test
    void acceptsAliases() {
        PopupDefinition def = read("{\"title\":\"A\",\"elements\":[{\"check\":\"X\",\"id\":\"x\"},{\"input\":\"Y\",\"id\":\"y\"}]}");
        assertEquals(ElementKind.CHECKBOX, def.getElements().get(0).getKind());
        assertEquals(ElementKind.TEXTBOX, def.getElements().get(1).getKind());
    }

    @Test
    void sliderRangeDefaultsToZeroToHundred() {
        SliderElement slider = (SliderElement) read("{\"title\":\"A\",\"elements\":[{\"slider\":\"S\",\"id\":\"s\"}]}")
            .getElements().get(0);
        assertEquals(0.0, slider.getMin());
        assertEquals(100.0, slider.getMax());
    }

    @Test
    void missingIdOnValueElement() {
        PopupParseException e = assertThrows(PopupParseException.class,
            () -> read("{\"title\":\"A\",\"elements\":[{\"slider\":\"S\"}]}"));
        assertEquals(ErrorKind.MISSING_REQUIRED_FIELD, e.getKind());
    }

    @Test
    void unknownKind() {
        PopupParseException e = assertThrows(PopupParseException.class,
            () -> read("{\"title\":\"A\",\"elements\":[{\"dial\":\"S\",\"id\":\"s\"}]}"));
        assertEquals(ErrorKind.UNKNOWN_WIDGET_KIND, e.getKind());
        assertTrue(e.getReason().startsWith("elements[0]"));
    }

    @Test
    void optionChildrenMustNameOptions() {
        PopupParseException e = assertThrows(PopupParseException.class,
            () -> read("{\"title\":\"A\",\"elements\":[{\"choice\":\"C\",\"id\":\"c\",\"options\":[\"x\"],"
                + "\"option_children\":{\"y\":[]}}]}"));
        assertEquals(ErrorKind.MALFORMED_INPUT, e.getKind());
    }

    @Test
    void syntaxErrorsCarryPosition() {
        PopupParseException e = assertThrows(PopupParseException.class,
            () -> codec.readTree("{\n  \"title\": \"A\",\n  \"elements\": [,]\n}"));
        assertEquals(ErrorKind.MALFORMED_INPUT, e.getKind());
        assertTrue(e.hasPosition());
        assertEquals(3, e.getLine());
    }

    @Test
    void writeThenReadGivesSameTree() {
        PopupDefinition def = read("{\"title\":\"T\",\"elements\":[{\"choice\":\"Mode\",\"id\":\"mode\","
            + "\"options\":[\"A\",{\"value\":\"B\",\"description\":\"second\"}],"
            + "\"option_children\":{\"B\":[{\"checkbox\":\"Deep\",\"id\":\"deep\",\"when\":\"mode\"}]}}]}");
        JsonNode written = codec.writeDefinition(def);
        assertEquals(def, codec.readDefinition(written));
        assertTrue(written.get("elements").get(0).get("options").get(1).isObject());
    }

    @Test
    void statesUseIndicesForChoices() {
        PopupState state = new PopupState();
        state.setValue("mode", ElementValue.choice(null));
        state.setValue("level", ElementValue.number(3));
        state.setValue("tags", ElementValue.multiChoice(List.of(true, false)));
        JsonNode json = codec.writeState(state);
        assertTrue(json.get("values").get("mode").isNull());
        assertTrue(json.get("button_clicked").isNull());

        PopupState back = codec.readState(json, Set.of("mode"));
        assertEquals(ElementValue.choice(null), back.getValue("mode"));
        assertEquals(ElementValue.number(3), back.getValue("level"));
        assertEquals(List.of(true, false), back.getValue("tags").asMultiChoice());
        assertNull(back.getButtonClicked());
    }

    @Test
    void readStateTreatsChoiceNumbersAsIndices() throws Exception {
        JsonNode json = mapper.readTree("{\"values\":{\"mode\":1,\"level\":1},\"button_clicked\":\"OK\"}");
        PopupState state = codec.readState(json, Set.of("mode"));
        assertEquals(ElementValue.choice(1), state.getValue("mode"));
        assertEquals(ElementValue.number(1), state.getValue("level"));
        assertEquals("OK", state.getButtonClicked());
    }
}
