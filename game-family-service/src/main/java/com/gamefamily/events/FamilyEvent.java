package com.gamefamily.events;

import java.time.Instant;
import java.util.List;

/**
 * Envelope published for every family event. {@code characterId} is the member the event is about,
 * or 0 for events that are not about one member (the daily reset).
 */
public record FamilyEvent<B>(
    String transactionId,
    long characterId,
    FamilyEventType type,
    B body
) {

    public record LinkCreated(long seniorId, long juniorId, Instant timestamp) {}

    public record LinkBroken(long seniorId, long juniorId, String reason, Instant timestamp) {}

    public record TreeDissolved(long seniorId, List<Long> affectedIds, String reason, Instant timestamp) {}

    public record RepGained(long repGained, int dailyRep, String source, Instant timestamp) {}

    public record RepRedeemed(long repRedeemed, String reason, Instant timestamp) {}

    public record RepReset(int affectedCount, Instant timestamp) {}

    public record RepError(String errorCode, String errorMessage, long amount, Instant timestamp) {}

    public record LinkError(long seniorId, long juniorId, String errorCode, String errorMessage, Instant timestamp) {}
}
