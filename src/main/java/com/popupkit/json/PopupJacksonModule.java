package com.popupkit.json;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.popupkit.models.PopupDefinition;

import java.io.IOException;

/**
 * Lets an {@code ObjectMapper} bind {@link PopupDefinition} fields directly, using the
 * canonical JSON form. Relaxed shapes are normalized on the way in.
 */
public class PopupJacksonModule extends SimpleModule {

    public PopupJacksonModule() {
        super("PopupJacksonModule");
        PopupJsonCodec codec = new PopupJsonCodec(null);
        ErgonomicNormalizer normalizer = new ErgonomicNormalizer(codec.getObjectMapper());

        addSerializer(PopupDefinition.class, new JsonSerializer<PopupDefinition>() {
            @Override
            public void serialize(PopupDefinition value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
                gen.writeTree(codec.writeDefinition(value));
            }
        });
        addDeserializer(PopupDefinition.class, new JsonDeserializer<PopupDefinition>() {
            @Override
            public PopupDefinition deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
                JsonNode node = p.readValueAsTree();
                return codec.readDefinition(normalizer.normalize(node));
            }
        });
    }
}
