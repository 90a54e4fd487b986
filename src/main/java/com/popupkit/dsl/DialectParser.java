package com.popupkit.dsl;

import com.popupkit.models.PopupDefinition;
import com.popupkit.parse.PopupParseException;

/**
 * One textual popup dialect.
 */
public interface DialectParser {

    String getName();

    /**
     * True when the input opens with this dialect's outer envelope. Once the envelope matched,
     * a parse failure is final and no other dialect is tried.
     */
    boolean matchesEnvelope(String input);

    PopupDefinition parse(String input) throws PopupParseException;
}
