package com.popupkit.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.popupkit.parse.ErrorKind;
import com.popupkit.parse.PopupParseException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ErgonomicNormalizerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ErgonomicNormalizer normalizer = new ErgonomicNormalizer(mapper);

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    @Test
    void strictInputIsLeftAlone() throws Exception {
        JsonNode strict = json("{\"title\":\"T\",\"elements\":[{\"checkbox\":\"On\",\"id\":\"on\",\"default\":true}]}");
        assertTrue(normalizer.isStrict(strict));
        assertEquals(strict, normalizer.normalize(strict));
    }

    @Test
    void fillsIdsAndSplitsOptions() throws Exception {
        JsonNode relaxed = json("{\"title\":\"T\",\"elements\":[{\"choice\":\"Color Scheme\",\"options\":\"Red, Green ,Blue\"}]}");
        assertFalse(normalizer.isStrict(relaxed));

        ObjectNode out = normalizer.normalize(relaxed);
        JsonNode choice = out.get("elements").get(0);
        assertEquals("color_scheme", choice.get("id").asText());
        assertEquals(3, choice.get("options").size());
        assertEquals("Green", choice.get("options").get(1).asText());
    }

    @Test
    void wrapsSingleElementsAndStrings() throws Exception {
        ObjectNode out = normalizer.normalize(json("{\"title\":\"T\",\"elements\":\"Hello\"}"));
        assertTrue(out.get("elements").isArray());
        assertEquals("Hello", out.get("elements").get(0).get("text").asText());

        out = normalizer.normalize(json("{\"title\":\"T\",\"elements\":{\"slider\":\"Level\"}}"));
        assertEquals("level", out.get("elements").get(0).get("id").asText());
    }

    @Test
    void movesOptionKeysIntoChildren() throws Exception {
        ObjectNode out = normalizer.normalize(json(
            "{\"title\":\"T\",\"elements\":[{\"choice\":\"Mode\",\"options\":[\"Fast\",\"Careful\"],"
                + "\"Careful\":[{\"slider\":\"Depth\"}]}]}"));
        JsonNode choice = out.get("elements").get(0);
        assertFalse(choice.has("Careful"));
        JsonNode branch = choice.get("option_children").get("Careful");
        assertEquals("depth", branch.get(0).get("id").asText());
    }

    @Test
    void renamesBecauseToDescription() throws Exception {
        ObjectNode out = normalizer.normalize(json(
            "{\"title\":\"T\",\"elements\":[{\"choice\":\"Plan\",\"id\":\"plan\","
                + "\"options\":[{\"value\":\"A\",\"because\":\"cheap\"},\"B\"]}]}"));
        JsonNode option = out.get("elements").get(0).get("options").get(0);
        assertEquals("cheap", option.get("description").asText());
        assertFalse(option.has("because"));
    }

    @Test
    void normalizesRevealsAndGroupMembers() throws Exception {
        ObjectNode out = normalizer.normalize(json(
            "{\"title\":\"T\",\"elements\":[{\"group\":\"G\",\"elements\":[{\"checkbox\":\"Extra\","
                + "\"reveals\":\"More text\"}]}]}"));
        JsonNode member = out.get("elements").get(0).get("elements").get(0);
        assertEquals("extra", member.get("id").asText());
        assertEquals("More text", member.get("reveals").get(0).get("text").asText());
    }

    @Test
    void doesNotModifyInput() throws Exception {
        JsonNode relaxed = json("{\"title\":\"T\",\"elements\":[{\"slider\":\"Level\"}]}");
        normalizer.normalize(relaxed);
        assertFalse(relaxed.get("elements").get(0).has("id"));
    }

    @Test
    void rejectsNonObjectRoot() throws Exception {
        PopupParseException e = assertThrows(PopupParseException.class, () -> normalizer.normalize(json("[1,2]")));
        assertEquals(ErrorKind.MALFORMED_INPUT, e.getKind());
    }
}
