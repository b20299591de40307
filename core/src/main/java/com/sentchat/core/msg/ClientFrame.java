package com.sentchat.core.msg;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

/**
 * Client-to-server frame, a tagged variant keyed by the {@code type} property.
 * <p>
 * Wire examples:
 * <pre>
 * {"type":"subscribe","room_id":"r1"}
 * {"type":"message","room_id":"r1","content":"hello"}
 * {"type":"typing","room_id":"r1","data":{"is_typing":true}}
 * {"type":"read","room_id":"r1","data":{"message_ids":["m1","m2"]}}
 * {"type":"create_thread","data":{"title":"weekend plans"}}
 * </pre>
 * </p>
 * <p>
 * A frame with a missing or unknown {@code type} fails to decode.
 * </p>
 */
@Getter
@Setter
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ClientFrame.Subscribe.class, name = "subscribe"),
    @JsonSubTypes.Type(value = ClientFrame.Unsubscribe.class, name = "unsubscribe"),
    @JsonSubTypes.Type(value = ClientFrame.CreateThread.class, name = "create_thread"),
    @JsonSubTypes.Type(value = ClientFrame.Chat.class, name = "message"),
    @JsonSubTypes.Type(value = ClientFrame.Typing.class, name = "typing"),
    @JsonSubTypes.Type(value = ClientFrame.Read.class, name = "read")
})
public abstract class ClientFrame {

    private String roomId;

    public abstract FrameKind kind();

    public static class Subscribe extends ClientFrame {
        @Override
        public FrameKind kind() {
            return FrameKind.SUBSCRIBE;
        }
    }

    public static class Unsubscribe extends ClientFrame {
        @Override
        public FrameKind kind() {
            return FrameKind.UNSUBSCRIBE;
        }
    }

    @Getter
    @Setter
    public static class CreateThread extends ClientFrame {
        private CreateThreadData data;

        @Override
        public FrameKind kind() {
            return FrameKind.CREATE_THREAD;
        }

        public String title() {
            return data == null ? null : data.getTitle();
        }
    }

    @Getter
    @Setter
    public static class Chat extends ClientFrame {
        private String content;

        @Override
        public FrameKind kind() {
            return FrameKind.MESSAGE;
        }
    }

    @Getter
    @Setter
    public static class Typing extends ClientFrame {
        private TypingData data;

        @Override
        public FrameKind kind() {
            return FrameKind.TYPING;
        }
    }

    @Getter
    @Setter
    public static class Read extends ClientFrame {
        private ReadData data;

        @Override
        public FrameKind kind() {
            return FrameKind.READ;
        }
    }

    @Getter
    @Setter
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CreateThreadData {
        private String title;
    }

    @Getter
    @Setter
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class TypingData {
        private Boolean isTyping;
    }

    @Getter
    @Setter
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ReadData {
        private List<String> messageIds;
    }
}
