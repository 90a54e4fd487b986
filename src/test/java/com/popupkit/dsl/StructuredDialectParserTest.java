package com.popupkit.dsl;

import com.popupkit.models.ButtonsElement;
import com.popupkit.models.CheckboxElement;
import com.popupkit.models.ChoiceElement;
import com.popupkit.models.ConditionalElement;
import com.popupkit.models.Element;
import com.popupkit.models.ElementKind;
import com.popupkit.models.GroupElement;
import com.popupkit.models.PopupDefinition;
import com.popupkit.models.SliderElement;
import com.popupkit.models.TextElement;
import com.popupkit.models.TextInputElement;
import com.popupkit.parse.ErrorKind;
import com.popupkit.parse.PopupParseException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StructuredDialectParserTest {

    private final StructuredDialectParser parser = new StructuredDialectParser();

    @Test
    void settingsExample() {
        PopupDefinition def = parser.parse("Settings:\n  Volume: 0-100 = 75\n  Theme: Light | Dark\n  [Save | Cancel]");

        assertEquals("Settings", def.getTitle());
        List<Element> elements = def.getElements();
        assertEquals(3, elements.size());

        SliderElement volume = (SliderElement) elements.get(0);
        assertEquals("volume", volume.getId());
        assertEquals(75.0, volume.getDefaultValue());
        assertEquals(100.0, volume.getMax());

        ChoiceElement theme = (ChoiceElement) elements.get(1);
        assertEquals(List.of("Light", "Dark"), theme.getOptionLabels());
        assertNull(theme.getDefaultIndex());

        ButtonsElement buttons = (ButtonsElement) elements.get(2);
        assertEquals(List.of("Save", "Cancel", ButtonsElement.FORCE_YIELD), buttons.getButtons());
    }

    @Test
    void addsDefaultButtonsWhenNoneGiven() {
        PopupDefinition def = parser.parse("Quick question\nReady: yes");
        assertEquals("Quick question", def.getTitle());
        Element last = def.getElements().get(def.getElements().size() - 1);
        assertEquals(List.of("OK", ButtonsElement.FORCE_YIELD), ((ButtonsElement) last).getButtons());
        assertTrue(((CheckboxElement) def.getElements().get(0)).getDefaultValue());
    }

    @Test
    void noTitleWhenFirstLineIsAField() {
        PopupDefinition def = parser.parse("Volume: 0-10\nName: @your name");
        assertNull(def.getTitle());
        assertEquals(ElementKind.SLIDER, def.getElements().get(0).getKind());
        TextInputElement name = (TextInputElement) def.getElements().get(1);
        assertEquals("your name", name.getPlaceholder());
    }

    @Test
    void headingTitle() {
        PopupDefinition def = parser.parse("## Deploy: production\nGo now: yes");
        assertEquals("Deploy: production", def.getTitle());
    }

    @Test
    void whenBlockBecomesConditional() {
        PopupDefinition def = parser.parse("Prefs:\n  Advanced: no\n  when Advanced:\n    Depth: 1-10\n");

        assertEquals(3, def.getElements().size());
        ConditionalElement conditional = (ConditionalElement) def.getElements().get(1);
        assertEquals("Advanced", conditional.getCondition());
        assertEquals(1, conditional.getReveals().size());
        assertEquals("depth", conditional.getReveals().get(0).getId());
    }

    @Test
    void braceConditionalOnSeveralLines() {
        PopupDefinition def = parser.parse(
            "Prefs\nMode: Fast | Careful\n[if Mode = Careful] {\n  Depth: 1-10\n  Note: @why\n}\n[Go]");

        ConditionalElement conditional = (ConditionalElement) def.getElements().get(1);
        assertEquals("Mode = Careful", conditional.getCondition());
        assertEquals(2, conditional.getReveals().size());
        assertEquals(List.of("Go", ButtonsElement.FORCE_YIELD), ((ButtonsElement) def.getElements().get(2)).getButtons());
    }

    @Test
    void braceConditionalOnOneLineAndNested() {
        PopupDefinition def = parser.parse(
            "Prefs\nA: yes\n[if A] { B: no\n  [if B] { C: 1-3 }\n}\n");

        ConditionalElement outer = (ConditionalElement) def.getElements().get(1);
        assertEquals(2, outer.getReveals().size());
        ConditionalElement inner = (ConditionalElement) outer.getReveals().get(1);
        assertEquals("B", inner.getCondition());
        assertEquals(ElementKind.SLIDER, inner.getReveals().get(0).getKind());
    }

    @Test
    void braceOnFollowingLine() {
        PopupDefinition def = parser.parse("Prefs\nA: yes\n[if not A]\n{\n  \"Turn A on for more\"\n}");
        ConditionalElement conditional = (ConditionalElement) def.getElements().get(1);
        assertEquals("not A", conditional.getCondition());
        assertEquals("Turn A on for more", conditional.getReveals().get(0).getLabel());
    }

    @Test
    void unclosedBraceReportsItsLine() {
        PopupParseException e = assertThrows(PopupParseException.class,
            () -> parser.parse("Prefs\n[if x] {\n  A: yes\n"));
        assertEquals(ErrorKind.MALFORMED_INPUT, e.getKind());
        assertEquals(2, e.getLine());
        assertEquals(8, e.getColumn());
    }

    @Test
    void strayClosingBrace() {
        PopupParseException e = assertThrows(PopupParseException.class, () -> parser.parse("Prefs\nA: yes\n}"));
        assertEquals(3, e.getLine());
    }

    @Test
    void contentAfterClosingBrace() {
        assertThrows(PopupParseException.class, () -> parser.parse("Prefs\n[if A] { B: no } trailing"));
    }

    @Test
    void nestedLinesRevealOrFillOptionBranches() {
        PopupDefinition def = parser.parse(
            "Prefs\nExtra: no\n  Why: @tell us\nMode: Fast | Careful\n  Careful:\n    Depth: 1-10\n");

        CheckboxElement extra = (CheckboxElement) def.getElements().get(0);
        assertEquals(1, extra.getReveals().size());
        assertEquals("why", extra.getReveals().get(0).getId());

        ChoiceElement mode = (ChoiceElement) def.getElements().get(1);
        assertTrue(mode.getReveals().isEmpty());
        assertEquals("depth", mode.getOptionChildren().get("Careful").get(0).getId());
    }

    @Test
    void groupsAndText() {
        PopupDefinition def = parser.parse(
            "Setup\n> Pick carefully\n--- Audio ---\n  Volume: 0-100\nDisplay:\n  Bright: on\nJust some words\n\"Quoted: text\"");

        assertEquals("> Pick carefully", def.getElements().get(0).getLabel());
        GroupElement audio = (GroupElement) def.getElements().get(1);
        assertEquals("Audio", audio.getLabel());
        assertEquals(1, audio.getElements().size());
        GroupElement display = (GroupElement) def.getElements().get(2);
        assertEquals("Display", display.getLabel());
        assertEquals("Just some words", ((TextElement) def.getElements().get(3)).getContent());
        assertEquals("Quoted: text", ((TextElement) def.getElements().get(4)).getContent());
    }

    @Test
    void commentsAndBlankLinesAreSkipped() {
        PopupDefinition def = parser.parse("\n// setup\nPrefs\n\n  // nothing here\nA: yes\n");
        assertEquals("Prefs", def.getTitle());
        assertEquals(2, def.getElements().size());
    }

    @Test
    void emptyInput() {
        PopupParseException e = assertThrows(PopupParseException.class, () -> parser.parse("  \n\n"));
        assertEquals(ErrorKind.MALFORMED_INPUT, e.getKind());
    }

    @Test
    void neverClaimsAnEnvelope() {
        assertFalse(parser.matchesEnvelope("Settings:\n  A: yes"));
    }
}
