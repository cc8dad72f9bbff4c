package com.gamefamily.events;

import java.time.Instant;
import java.util.List;

/**
 * Outbound notifications about family state. Implementations must not throw: notification is
 * fire-and-forget from the caller's point of view.
 */
public interface FamilyEventSink {

    void linkCreated(long seniorId, long juniorId);

    void linkBroken(long characterId, long seniorId, long juniorId, String reason);

    void treeDissolved(long seniorId, List<Long> affectedIds, String reason);

    void repGained(long characterId, long amount, int dailyRep, String source);

    void repRedeemed(long characterId, long amount, String reason);

    void repReset(int affectedCount, Instant resetTime);

    void repError(long characterId, String errorCode, String errorMessage, long amount);

    void linkError(long seniorId, long juniorId, String errorCode, String errorMessage);
}
