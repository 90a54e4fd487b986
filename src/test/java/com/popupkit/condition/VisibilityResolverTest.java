package com.popupkit.condition;

import com.popupkit.models.CheckboxElement;
import com.popupkit.models.ChoiceElement;
import com.popupkit.models.ConditionalElement;
import com.popupkit.models.Element;
import com.popupkit.models.ElementValue;
import com.popupkit.models.GroupElement;
import com.popupkit.models.OptionValue;
import com.popupkit.models.PopupDefinition;
import com.popupkit.models.PopupState;
import com.popupkit.models.SliderElement;
import com.popupkit.models.TextInputElement;
import com.popupkit.state.StateDeriver;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class VisibilityResolverTest {

    private static <T extends Element> T withId(T element, String id) {
        element.setId(id);
        return element;
    }

    private PopupDefinition definition() {
        ChoiceElement mode = withId(new ChoiceElement("Mode",
            List.of(new OptionValue("Basic"), new OptionValue("Custom")), 0), "mode");
        mode.putOptionChildren("Custom", List.of(withId(new SliderElement("Depth", 0, 10, null), "depth")));

        CheckboxElement extra = withId(new CheckboxElement("Extra", false), "extra");
        extra.setReveals(List.of(withId(new TextInputElement("Why", null, null), "why")));

        TextInputElement guarded = withId(new TextInputElement("Loud note", null, null), "loud_note");
        guarded.setWhen("depth > 5");

        ConditionalElement block = new ConditionalElement("extra", List.of(
            withId(new CheckboxElement("Confirm", false), "confirm")));

        return new PopupDefinition("t", List.of(new GroupElement("Box", List.of(mode, extra)), guarded, block));
    }

    @Test
    void initialVisibility() {
        PopupDefinition def = definition();
        Set<String> ids = VisibilityResolver.visibleIds(def, StateDeriver.derive(def));
        assertEquals(Set.of("mode", "extra"), ids);
    }

    @Test
    void selectionAndChecksOpenBranches() {
        PopupDefinition def = definition();
        PopupState state = StateDeriver.derive(def);
        state.setValue("mode", ElementValue.choice(1));
        state.setValue("depth", ElementValue.number(8));
        state.setValue("extra", ElementValue.bool(true));

        Set<String> ids = VisibilityResolver.visibleIds(def, state);

        assertEquals(List.of("mode", "depth", "extra", "why", "loud_note", "confirm"), List.copyOf(ids));
    }
}
