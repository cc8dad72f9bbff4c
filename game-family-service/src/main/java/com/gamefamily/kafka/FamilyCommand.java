package com.gamefamily.kafka;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Inbound command envelope. {@code characterId} is the member the command acts on (the senior for
 * {@code ADD_JUNIOR}, the junior for activity commands); {@code body} depends on {@code type}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FamilyCommand(
    String transactionId,
    long characterId,
    int worldId,
    String type,
    JsonNode body
) {

    public long longField(String name) {
        return body == null ? 0L : body.path(name).asLong(0L);
    }

    public int intField(String name) {
        return body == null ? 0 : body.path(name).asInt(0);
    }

    public String textField(String name, String fallback) {
        if (body == null || !body.hasNonNull(name)) {
            return fallback;
        }
        return body.get(name).asText();
    }
}
