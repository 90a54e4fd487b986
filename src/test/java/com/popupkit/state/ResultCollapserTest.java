package com.popupkit.state;

import com.popupkit.models.CheckboxElement;
import com.popupkit.models.ChoiceElement;
import com.popupkit.models.Element;
import com.popupkit.models.ElementValue;
import com.popupkit.models.MultiSelectElement;
import com.popupkit.models.OptionValue;
import com.popupkit.models.PopupDefinition;
import com.popupkit.models.PopupResult;
import com.popupkit.models.PopupState;
import com.popupkit.models.SliderElement;
import com.popupkit.models.TextInputElement;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ResultCollapserTest {

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

    private static PopupDefinition nestedSlider() {
        ChoiceElement mode = withId(new ChoiceElement("Mode", options("Basic", "Custom"), null), "mode");
        mode.putOptionChildren("Custom", List.of(withId(new SliderElement("Amount", 0, 100, null), "x")));
        return new PopupDefinition("t", List.of(mode));
    }

    @Test
    void findsSliderNestedInOptionBranch() {
        PopupDefinition def = nestedSlider();
        PopupState state = StateDeriver.derive(def);
        state.setValue("x", ElementValue.number(75));
        state.setButtonClicked("OK");

        PopupResult result = ResultCollapser.collapse(state, def);

        assertFalse(result.isCancelled());
        assertEquals("75/100", result.getValues().get("x"));
        assertFalse(result.getValues().containsKey("mode"));
    }

    @Test
    void missingButtonMeansCancelled() {
        PopupDefinition def = nestedSlider();
        PopupState state = StateDeriver.derive(def);
        state.setValue("x", ElementValue.number(10));

        assertTrue(ResultCollapser.collapse(state, def).isCancelled());
    }

    @Test
    void staleKeysAreSkipped() {
        PopupDefinition def = nestedSlider();
        PopupState state = StateDeriver.derive(def);
        state.setValue("ghost", ElementValue.text("boo"));
        state.setButtonClicked("OK");

        PopupResult result = ResultCollapser.collapse(state, def);

        assertEquals("OK", result.getButton());
        assertFalse(result.getValues().containsKey("ghost"));
        assertEquals("50/100", result.getValues().get("x"));
    }

    @Test
    void formatsEachKind() {
        PopupDefinition def = new PopupDefinition("t", List.of(
            withId(new CheckboxElement("Notify", false), "notify"),
            withId(new TextInputElement("Name", null, null), "name"),
            withId(new ChoiceElement("Theme", options("Light", "Dark"), null), "theme"),
            withId(new MultiSelectElement("Tags", options("red", "green", "blue")), "tags")
        ));
        PopupState state = StateDeriver.derive(def);
        state.setValue("notify", ElementValue.bool(true));
        state.setValue("name", ElementValue.text("Ada"));
        state.setValue("theme", ElementValue.choice(1));
        state.setValue("tags", ElementValue.multiChoice(List.of(true, false, true)));
        state.setButtonClicked("Save");

        PopupResult result = ResultCollapser.collapse(state, def);

        assertEquals(Boolean.TRUE, result.getValues().get("notify"));
        assertEquals("Ada", result.getValues().get("name"));
        assertEquals("Dark", result.getValues().get("theme"));
        assertEquals(List.of("red", "blue"), result.getValues().get("tags"));
    }

    @Test
    void mismatchedValueTypeIsOmitted() {
        PopupDefinition def = new PopupDefinition("t", List.of(withId(new CheckboxElement("Notify", false), "notify")));
        PopupState state = new PopupState();
        state.setValue("notify", ElementValue.text("yes"));
        state.setButtonClicked("OK");

        assertTrue(ResultCollapser.collapse(state, def).getValues().isEmpty());
    }

    @Test
    void restrictsToGivenIds() {
        PopupDefinition def = nestedSlider();
        PopupState state = StateDeriver.derive(def);
        state.setValue("mode", ElementValue.choice(0));
        state.setButtonClicked("OK");

        PopupResult result = ResultCollapser.collapse(state, def, Set.of("mode"));

        assertEquals("Basic", result.getValues().get("mode"));
        assertFalse(result.getValues().containsKey("x"));
    }
}
