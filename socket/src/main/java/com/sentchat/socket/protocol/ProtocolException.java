package com.sentchat.socket.protocol;

import com.sentchat.core.msg.FrameKind;
import lombok.Getter;

/**
 * A client request that could not be carried out. Always answered with an {@code error}
 * envelope; the connection stays open.
 */
@Getter
public class ProtocolException extends RuntimeException {

    public enum Category {
        /**
         * Not valid JSON, or a missing/unknown {@code type}.
         */
        DECODE,
        /**
         * Missing field, blank content, or not a member of the room.
         */
        PRECONDITION,
        /**
         * The store (or another collaborator) failed.
         */
        COLLABORATOR;

        public String wireName() {
            return name().toLowerCase();
        }
    }

    private final Category category;
    /**
     * Kind of the failed frame, null when the frame could not be decoded.
     */
    private final FrameKind request;
    private final String roomId;

    public ProtocolException(Category category, FrameKind request, String roomId, String message, Throwable cause) {
        super(message, cause);
        this.category = category;
        this.request = request;
        this.roomId = roomId;
    }

    public static ProtocolException decode(String message, Throwable cause) {
        return new ProtocolException(Category.DECODE, null, null, message, cause);
    }

    public static ProtocolException precondition(FrameKind request, String roomId, String message) {
        return new ProtocolException(Category.PRECONDITION, request, roomId, message, null);
    }

    public static ProtocolException collaborator(FrameKind request, String roomId, String message, Throwable cause) {
        return new ProtocolException(Category.COLLABORATOR, request, roomId, message, cause);
    }
}
