package com.sentchat.socket.relay;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Kafka record value of the room relay topic.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RelayRecord {
    /**
     * Node that broadcast the event locally; it skips its own records.
     */
    String originNode;
    String roomId;
    /**
     * Serialized envelope, forwarded to members unchanged.
     */
    String payload;
}
