package com.sentchat.core.util;

import java.nio.charset.StandardCharsets;

public final class BytesUtils {
    private BytesUtils() {
    }

    /**
     * Size of a text frame payload once UTF-8 encoded.
     */
    public static long getBytesLength(String str) {
        return str == null ? 0 : str.getBytes(StandardCharsets.UTF_8).length;
    }

}
