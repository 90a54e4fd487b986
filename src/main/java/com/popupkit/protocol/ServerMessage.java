package com.popupkit.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.popupkit.models.PopupDefinition;

/**
 * Messages from the relay to the rendering client. Serialized with a snake_case
 * {@code type} discriminator. Bind with an ObjectMapper that has
 * {@link com.popupkit.json.PopupJacksonModule} registered.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ServerMessage.ShowPopup.class, name = "show_popup"),
    @JsonSubTypes.Type(value = ServerMessage.ClosePopup.class, name = "close_popup"),
    @JsonSubTypes.Type(value = ServerMessage.Ping.class, name = "ping")
})
public abstract class ServerMessage {

    public static ShowPopup showPopup(String id, PopupDefinition definition, long timeoutMs) {
        return new ShowPopup(id, definition, timeoutMs);
    }

    public static ClosePopup closePopup(String id) {
        return new ClosePopup(id);
    }

    public static Ping ping() {
        return new Ping();
    }

    public static class ShowPopup extends ServerMessage {
        private final String id;
        private final PopupDefinition definition;
        private final long timeoutMs;

        @JsonCreator
        public ShowPopup(@JsonProperty("id") String id,
                         @JsonProperty("definition") PopupDefinition definition,
                         @JsonProperty("timeout_ms") long timeoutMs) {
            this.id = id;
            this.definition = definition;
            this.timeoutMs = timeoutMs;
        }

        @JsonProperty("id")
        public String getId() { return id; }

        @JsonProperty("definition")
        public PopupDefinition getDefinition() { return definition; }

        @JsonProperty("timeout_ms")
        public long getTimeoutMs() { return timeoutMs; }
    }

    public static class ClosePopup extends ServerMessage {
        private final String id;

        @JsonCreator
        public ClosePopup(@JsonProperty("id") String id) {
            this.id = id;
        }

        @JsonProperty("id")
        public String getId() { return id; }
    }

    /**
     * Keepalive.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Ping extends ServerMessage {
    }
}
