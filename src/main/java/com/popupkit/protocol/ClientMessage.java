package com.popupkit.protocol;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.popupkit.models.PopupResult;

/**
 * Messages from the rendering client back to the relay.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ClientMessage.Ready.class, name = "ready"),
    @JsonSubTypes.Type(value = ClientMessage.Result.class, name = "result"),
    @JsonSubTypes.Type(value = ClientMessage.Pong.class, name = "pong")
})
public abstract class ClientMessage {

    public static Ready ready(String deviceName) {
        return new Ready(deviceName);
    }

    public static Result result(String id, PopupResult result) {
        return new Result(id, result);
    }

    public static Pong pong() {
        return new Pong();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Ready extends ClientMessage {
        private final String deviceName;

        @JsonCreator
        public Ready(@JsonProperty("device_name") String deviceName) {
            this.deviceName = deviceName;
        }

        @JsonProperty("device_name")
        public String getDeviceName() { return deviceName; }
    }

    public static class Result extends ClientMessage {
        private final String id;
        private final PopupResult result;

        @JsonCreator
        public Result(@JsonProperty("id") String id, @JsonProperty("result") PopupResult result) {
            this.id = id;
            this.result = result;
        }

        @JsonProperty("id")
        public String getId() { return id; }

        @JsonProperty("result")
        public PopupResult getResult() { return result; }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Pong extends ClientMessage {
    }
}
