package com.popupkit.transform;

import com.popupkit.models.CheckboxElement;
import com.popupkit.models.ChoiceElement;
import com.popupkit.models.Element;
import com.popupkit.models.ElementKind;
import com.popupkit.models.GroupElement;
import com.popupkit.models.MultiSelectElement;
import com.popupkit.models.OptionElement;
import com.popupkit.models.OptionValue;
import com.popupkit.models.PopupDefinition;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OtherOptionTransformTest {

    private static List<OptionValue> options(String... labels) {
        List<OptionValue> list = new ArrayList<>();
        for (String label : labels) {
            list.add(new OptionValue(label));
        }
        return list;
    }

    private static ChoiceElement choice(String id, String... labels) {
        ChoiceElement choice = new ChoiceElement(id, options(labels), null);
        choice.setId(id);
        return choice;
    }

    @Test
    void appendsOtherWithTextField() {
        PopupDefinition def = new PopupDefinition("t", List.of(choice("color", "Red", "Blue")));
        OptionElement out = (OptionElement) OtherOptionTransform.apply(def).getElements().get(0);

        assertEquals(List.of("Red", "Blue", OtherOptionTransform.OTHER_LABEL), out.getOptionLabels());
        List<Element> branch = out.getOptionChildren().get(OtherOptionTransform.OTHER_LABEL);
        assertEquals(1, branch.size());
        assertEquals(ElementKind.TEXTBOX, branch.get(0).getKind());
        assertEquals("color_other_text", branch.get(0).getId());
    }

    @Test
    void leavesInputUntouched() {
        PopupDefinition def = new PopupDefinition("t", List.of(choice("color", "Red")));
        OtherOptionTransform.apply(def);
        assertEquals(1, ((OptionElement) def.getElements().get(0)).getOptions().size());
    }

    @Test
    void isIdempotent() {
        MultiSelectElement tags = new MultiSelectElement("Tags", options("a", "b"));
        tags.setId("tags");
        PopupDefinition def = new PopupDefinition("t", List.of(choice("color", "Red"), tags));

        PopupDefinition once = OtherOptionTransform.apply(def);
        assertEquals(once, OtherOptionTransform.apply(once));
    }

    @Test
    void recognizesExistingOther() {
        ChoiceElement described = new ChoiceElement("x",
            List.of(new OptionValue("A"), new OptionValue("Other", "write your own")), null);
        described.setId("x");
        PopupDefinition def = new PopupDefinition("t", List.of(
            choice("a", "One", "OTHER"),
            choice("b", "One", "other (specify)"),
            described));

        PopupDefinition out = OtherOptionTransform.apply(def);

        assertEquals(2, ((OptionElement) out.getElements().get(0)).getOptions().size());
        assertEquals(2, ((OptionElement) out.getElements().get(1)).getOptions().size());
        assertEquals(2, ((OptionElement) out.getElements().get(2)).getOptions().size());
    }

    @Test
    void reachesNestedElements() {
        ChoiceElement inner = choice("inner", "x");
        ChoiceElement branchChoice = choice("deep", "y");
        ChoiceElement outer = choice("outer", "A", "B");
        outer.putOptionChildren("A", List.of(branchChoice));
        CheckboxElement box = new CheckboxElement("Box", false);
        box.setId("box");
        box.setReveals(List.of(inner));
        box.setWhen("outer");
        PopupDefinition def = new PopupDefinition("t", List.of(new GroupElement("G", List.of(outer, box))));

        PopupDefinition out = OtherOptionTransform.apply(def);
        GroupElement group = (GroupElement) out.getElements().get(0);
        ChoiceElement outerOut = (ChoiceElement) group.getElements().get(0);
        ChoiceElement deepOut = (ChoiceElement) outerOut.getOptionChildren().get("A").get(0);
        ChoiceElement innerOut = (ChoiceElement) group.getElements().get(1).getReveals().get(0);

        assertEquals(3, outerOut.getOptions().size());
        assertEquals(2, deepOut.getOptions().size());
        assertEquals(2, innerOut.getOptions().size());
        assertEquals("outer", group.getElements().get(1).getWhen());
    }

    @Test
    void isOtherMatching() {
        assertTrue(OtherOptionTransform.isOther("other"));
        assertTrue(OtherOptionTransform.isOther(" Other (please specify) "));
        assertTrue(OtherOptionTransform.isOther("Other (explain)"));
        assertFalse(OtherOptionTransform.isOther("Others"));
        assertFalse(OtherOptionTransform.isOther("Another"));
    }
}
