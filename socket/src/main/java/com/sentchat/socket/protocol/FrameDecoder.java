package com.sentchat.socket.protocol;

import com.sentchat.core.msg.ClientFrame;
import com.sentchat.core.util.JsonUtils;

import java.io.UncheckedIOException;

/**
 * Turns raw text frames into typed {@link ClientFrame} variants.
 */
public class FrameDecoder {

    /**
     * @throws ProtocolException with category DECODE for blank input, invalid JSON, or a
     *                           missing/unknown type
     */
    public ClientFrame decode(String raw) {
        if (raw == null || raw.isBlank()) {
            throw ProtocolException.decode("Empty message", null);
        }
        ClientFrame frame;
        try {
            frame = JsonUtils.readValue(raw, ClientFrame.class);
        } catch (UncheckedIOException e) {
            throw ProtocolException.decode("Invalid message format", e);
        }
        if (frame == null) {
            throw ProtocolException.decode("Invalid message format", null);
        }
        return frame;
    }
}
