package com.sentchat.core.auth;

import lombok.Builder;
import lombok.Value;

/**
 * Verified identity of a connected user.
 */
@Value
@Builder(toBuilder = true)
public class Identity {
    String userId;
    String displayName;
    String avatar;
}
