package com.popupkit.state;

import com.popupkit.models.CheckboxElement;
import com.popupkit.models.ChoiceElement;
import com.popupkit.models.Element;
import com.popupkit.models.GroupElement;
import com.popupkit.models.OptionValue;
import com.popupkit.models.PopupDefinition;
import com.popupkit.models.TextElement;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ElementLocatorTest {

    @Test
    void findsAtAnyDepth() {
        CheckboxElement deep = new CheckboxElement("Deep", false);
        deep.setId("deep");
        ChoiceElement choice = new ChoiceElement("C", List.of(new OptionValue("A")), null);
        choice.setId("c");
        GroupElement inner = new GroupElement("Inner", List.of(deep));
        choice.putOptionChildren("A", List.of(inner));
        PopupDefinition def = new PopupDefinition("t", List.of(new TextElement("hi"), choice));

        assertSame(deep, ElementLocator.findById(def, "deep"));
        assertSame(choice, ElementLocator.findById(def, "c"));
        assertNull(ElementLocator.findById(def, "missing"));
        assertNull(ElementLocator.findById(def, null));
    }

    @Test
    void visitsInPreOrder() {
        CheckboxElement a = new CheckboxElement("A", false);
        CheckboxElement revealed = new CheckboxElement("R", false);
        a.setReveals(List.of(revealed));
        GroupElement group = new GroupElement("G", List.of(a));
        TextElement tail = new TextElement("tail");

        List<String> seen = new ArrayList<>();
        ElementLocator.forEach(List.<Element>of(group, tail), e -> seen.add(e.getLabel()));

        assertEquals(List.of("G", "A", "R", "tail"), seen);
    }
}
