package com.popupkit.dsl;

import com.popupkit.models.CheckboxElement;
import com.popupkit.models.ChoiceElement;
import com.popupkit.models.Element;
import com.popupkit.models.ElementKind;
import com.popupkit.models.SliderElement;
import com.popupkit.models.TextInputElement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WidgetInferenceTest {

    @Test
    void booleanWordsAndSymbols() {
        assertTrue(((CheckboxElement) WidgetInference.infer("Notify", "Yes")).getDefaultValue());
        assertTrue(((CheckboxElement) WidgetInference.infer("Notify", "✓")).getDefaultValue());
        assertTrue(((CheckboxElement) WidgetInference.infer("Notify", "[x]")).getDefaultValue());
        assertFalse(((CheckboxElement) WidgetInference.infer("Notify", "off")).getDefaultValue());
        assertFalse(((CheckboxElement) WidgetInference.infer("Notify", "[ ]")).getDefaultValue());
    }

    @Test
    void rangesBecomeSliders() {
        SliderElement a = (SliderElement) WidgetInference.infer("Level", "1-10");
        assertEquals(1.0, a.getMin());
        assertEquals(10.0, a.getMax());
        assertNull(a.getDefaultValue());

        SliderElement b = (SliderElement) WidgetInference.infer("Temp", "-5..5 = 0.5");
        assertEquals(-5.0, b.getMin());
        assertEquals(0.5, b.getDefaultValue());

        assertEquals(ElementKind.SLIDER, WidgetInference.infer("Count", "0 to 20").getKind());
    }

    @Test
    void hintMakesTextInput() {
        TextInputElement input = (TextInputElement) WidgetInference.infer("Full Name", "@first and last");
        assertEquals("full_name", input.getId());
        assertEquals("first and last", input.getPlaceholder());
        assertNull(((TextInputElement) WidgetInference.infer("Notes", "@")).getPlaceholder());
    }

    @Test
    void listsAndPipes() {
        Element multi = WidgetInference.infer("Tags", "[work, home, \"side project\"]");
        assertEquals(ElementKind.MULTISELECT, multi.getKind());

        ChoiceElement choice = (ChoiceElement) WidgetInference.infer("Theme", "Light | Dark | Auto");
        assertEquals(List.of("Light", "Dark", "Auto"), choice.getOptionLabels());

        ChoiceElement single = (ChoiceElement) WidgetInference.infer("Only", "Just this |");
        assertEquals(List.of("Just this"), single.getOptionLabels());
    }

    @Test
    void plainValuesStayText() {
        assertNull(WidgetInference.infer("Note", "remember to save"));
        assertNull(WidgetInference.infer("Empty", "  "));
        assertNull(WidgetInference.infer("List", "[ , ]"));
    }
}
