package com.popupkit.dsl;

import com.popupkit.models.ButtonsElement;
import com.popupkit.models.ElementKind;
import com.popupkit.models.PopupDefinition;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NaturalDialectParserTest {

    private final NaturalDialectParser parser = new NaturalDialectParser();

    @Test
    void inlineButtons() {
        PopupDefinition def = parser.parse("confirm Delete the file with Yes or No");
        assertEquals("Delete the file?", def.getTitle());
        assertEquals(1, def.getElements().size());
        assertEquals(List.of("Yes", "No", ButtonsElement.FORCE_YIELD),
            ((ButtonsElement) def.getElements().get(0)).getButtons());
    }

    @Test
    void questionMayContainWith() {
        PopupDefinition def = parser.parse("confirm Proceed with caution? with Yes or No");
        assertEquals("Proceed with caution?", def.getTitle());
        assertEquals(List.of("Yes", "No", ButtonsElement.FORCE_YIELD),
            ((ButtonsElement) def.getElements().get(0)).getButtons());

        def = parser.parse("confirm Share with Alice or Bob?");
        assertEquals("Share with Alice or Bob?", def.getTitle());
        assertEquals(List.of("OK", ButtonsElement.FORCE_YIELD),
            ((ButtonsElement) def.getElements().get(0)).getButtons());
    }

    @Test
    void singleWordAfterWithStaysInQuestion() {
        PopupDefinition def = parser.parse("Confirm proceed with caution");
        assertEquals("proceed with caution?", def.getTitle());
        assertEquals(List.of("OK", ButtonsElement.FORCE_YIELD),
            ((ButtonsElement) def.getElements().get(0)).getButtons());
    }

    @Test
    void bodyLinesFollowTheQuestion() {
        PopupDefinition def = parser.parse("confirm Ship it?\n  Reason: @why now\n  Notify team: yes\n[Ship | Wait]");
        assertEquals("Ship it?", def.getTitle());
        assertEquals(3, def.getElements().size());
        assertEquals(ElementKind.TEXTBOX, def.getElements().get(0).getKind());
        assertEquals("notify_team", def.getElements().get(1).getId());
        assertEquals(List.of("Ship", "Wait", ButtonsElement.FORCE_YIELD),
            ((ButtonsElement) def.getElements().get(2)).getButtons());
    }

    @Test
    void inlineButtonsGoAfterBody() {
        PopupDefinition def = parser.parse("confirm Retry upload with Retry or Skip\nAttempts left: 3 to 5");
        assertEquals(2, def.getElements().size());
        assertEquals(ElementKind.SLIDER, def.getElements().get(0).getKind());
        assertEquals(ElementKind.BUTTONS, def.getElements().get(1).getKind());
    }

    @Test
    void envelopeIsTheConfirmKeyword() {
        assertTrue(parser.matchesEnvelope("\n  confirm Go?"));
        assertFalse(parser.matchesEnvelope("Confirmation:\n  A: yes"));
        assertFalse(parser.matchesEnvelope("Settings"));
    }
}
