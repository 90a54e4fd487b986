package com.popupkit.state;

import com.popupkit.models.ButtonsElement;
import com.popupkit.models.CheckboxElement;
import com.popupkit.models.ChoiceElement;
import com.popupkit.models.Element;
import com.popupkit.models.ElementValue;
import com.popupkit.models.GroupElement;
import com.popupkit.models.MultiSelectElement;
import com.popupkit.models.OptionValue;
import com.popupkit.models.PopupDefinition;
import com.popupkit.models.PopupState;
import com.popupkit.models.SliderElement;
import com.popupkit.models.TextElement;
import com.popupkit.models.TextInputElement;
import com.popupkit.parse.ErrorKind;
import com.popupkit.parse.PopupParseException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StateDeriverTest {

    private static <T extends Element> T withId(T element, String id) {
        element.setId(id);
        return element;
    }

    private static List<OptionValue> options(String... labels) {
        List<OptionValue> list = new ArrayList<>();
        for (String label : labels) {
            list.add(new OptionValue(label));
        }
        return list;
    }

    @Test
    void sliderWithoutDefaultStartsAtMidpoint() {
        PopupDefinition def = new PopupDefinition("t", List.of(withId(new SliderElement("Level", 1, 10, null), "level")));
        PopupState state = StateDeriver.derive(def);
        assertEquals(5.5, state.getValue("level").asNumber());
    }

    @Test
    void defaultsPerKind() {
        PopupDefinition def = new PopupDefinition("t", List.of(
            new TextElement("Intro"),
            withId(new SliderElement("Volume", 0, 100, 75.0), "volume"),
            withId(new CheckboxElement("Notify", true), "notify"),
            withId(new TextInputElement("Name", null, null), "name"),
            withId(new ChoiceElement("Theme", options("Light", "Dark"), null), "theme"),
            withId(new ChoiceElement("Size", options("S", "M", "L"), 1), "size"),
            withId(new MultiSelectElement("Tags", options("a", "b", "c")), "tags"),
            new ButtonsElement(List.of("OK"))
        ));
        PopupState state = StateDeriver.derive(def);

        assertEquals(6, state.getValues().size());
        assertEquals(75.0, state.getValue("volume").asNumber());
        assertTrue(state.getValue("notify").asBoolean());
        assertEquals("", state.getValue("name").asText());
        assertNull(state.getValue("theme").asChoice());
        assertEquals(1, state.getValue("size").asChoice());
        assertEquals(List.of(false, false, false), state.getValue("tags").asMultiChoice());
        assertTrue(state.isCancelled());
    }

    @Test
    void outOfRangeChoiceDefaultIsUnset() {
        PopupDefinition def = new PopupDefinition("t",
            List.of(withId(new ChoiceElement("Mode", options("A", "B"), 5), "mode")));
        assertEquals(ElementValue.choice(null), StateDeriver.derive(def).getValue("mode"));
    }

    @Test
    void walksEveryBranchAndReveal() {
        ChoiceElement mode = withId(new ChoiceElement("Mode", options("Simple", "Advanced"), 0), "mode");
        mode.putOptionChildren("Advanced", List.of(withId(new SliderElement("Depth", 0, 10, null), "depth")));
        CheckboxElement extra = withId(new CheckboxElement("Extra", false), "extra");
        extra.setReveals(List.of(withId(new TextInputElement("Why", null, null), "why")));
        GroupElement group = new GroupElement("Box", List.of(mode, extra));

        PopupState state = StateDeriver.derive(new PopupDefinition("t", List.of(group)));

        assertEquals(List.of("mode", "depth", "extra", "why"), List.copyOf(state.getValues().keySet()));
        assertEquals(5.0, state.getValue("depth").asNumber());
    }

    @Test
    void duplicateIdAcrossBranchesIsRejected() {
        ChoiceElement mode = withId(new ChoiceElement("Mode", options("A", "B"), null), "mode");
        mode.putOptionChildren("A", List.of(withId(new CheckboxElement("X", false), "x")));
        mode.putOptionChildren("B", List.of(withId(new CheckboxElement("X", true), "x")));

        PopupParseException e = assertThrows(PopupParseException.class,
            () -> StateDeriver.derive(new PopupDefinition("t", List.of(mode))));
        assertEquals(ErrorKind.DUPLICATE_IDENTIFIER, e.getKind());
    }
}
