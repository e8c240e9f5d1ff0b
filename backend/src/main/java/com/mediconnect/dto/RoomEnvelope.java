package com.mediconnect.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.mediconnect.exception.ErrorCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Frame exchanged with consultation clients over STOMP, in both directions.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RoomEnvelope {

    private Type type;
    private String roomId;
    private String fromUserId;
    private String toUserId;
    private JsonNode payload;
    private Long sequence;
    private Instant timestamp;
    private ErrorCode errorCode;

    public enum Type {
        JOIN("join", true),
        LEAVE("leave", true),
        SIGNALING_OFFER("signaling-offer", true),
        SIGNALING_ANSWER("signaling-answer", true),
        SIGNALING_ICE("signaling-ice", true),
        MEDIA_STATE("media-state", true),
        CHAT_MESSAGE("chat-message", true),
        CONNECTION_QUALITY("connection-quality", true),
        ROOM_CLOSED("room-closed", false),
        ERROR("error", false),
        ROOM_JOINED("room-joined", false),
        PARTICIPANT_JOINED("participant-joined", false),
        PARTICIPANT_LEFT("participant-left", false),
        PARTICIPANT_DISCONNECTED("participant-disconnected", false);

        private final String wireName;
        private final boolean clientOriginated;

        Type(String wireName, boolean clientOriginated) {
            this.wireName = wireName;
            this.clientOriginated = clientOriginated;
        }

        @JsonValue
        public String getWireName() {
            return wireName;
        }

        public boolean isClientOriginated() {
            return clientOriginated;
        }

        public boolean isSignaling() {
            return this == SIGNALING_OFFER || this == SIGNALING_ANSWER || this == SIGNALING_ICE;
        }

        /**
         * Unknown names map to null so the handler can answer with a malformed-message error
         * instead of the converter rejecting the frame.
         */
        @JsonCreator
        public static Type fromWireName(String value) {
            if (value == null) {
                return null;
            }
            for (Type type : values()) {
                if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                    return type;
                }
            }
            return null;
        }
    }

    public static RoomEnvelope notice(Type type, String roomId, JsonNode payload, Instant at) {
        return RoomEnvelope.builder()
            .type(type)
            .roomId(roomId)
            .payload(payload)
            .timestamp(at)
            .build();
    }

    public static RoomEnvelope error(String roomId, ErrorCode code, String message, Instant at) {
        return RoomEnvelope.builder()
            .type(Type.ERROR)
            .roomId(roomId)
            .errorCode(code)
            .payload(JsonNodeFactory.instance.objectNode().put("message", message))
            .timestamp(at)
            .build();
    }
}
